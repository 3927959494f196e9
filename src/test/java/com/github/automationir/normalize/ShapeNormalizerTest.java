package com.github.automationir.normalize;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.AutomationException;
import com.github.automationir.Fixtures;
import com.github.automationir.catalog.CatalogLoader;
import com.github.automationir.catalog.DeviceCatalog;
import com.github.automationir.model.IrJson;

/**
 * Tests to check coercion of loosely shaped documents into canonical IR shape.
 */
public class ShapeNormalizerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testLooseDocument() throws AutomationException {
    // 1. prep normalizer over the default catalog
    final DeviceCatalog catalog = CatalogLoader.defaultDeviceCatalog();
    final ShapeNormalizer normalizer = new ShapeNormalizer(catalog);
    final JsonNode raw = Fixtures.load(Fixtures.LOOSE_LLM_OUTPUT);
    final String rawText = IrJson.canonicalString(raw);

    // 2. normalize and check devices and states
    final JsonNode normalized = normalizer.normalize(raw);
    final JsonNode devices = normalized.get(IrJson.DEVICES);
    assertEquals(2, devices.size());
    assertEquals("motion_hall", devices.get(0).get(IrJson.ID).asText());
    assertEquals("motionSensor", devices.get(0).get(IrJson.KIND).asText());
    assertEquals("light_hall", devices.get(1).get(IrJson.ID).asText());
    assertEquals("switch", devices.get(1).get(IrJson.KIND).asText());
    final JsonNode machine = normalized.get(IrJson.STATE_MACHINE);
    assertEquals("Idle", machine.get(IrJson.INITIAL).asText());
    assertEquals("Idle", machine.get(IrJson.STATES).get(0).get(IrJson.ID).asText());
    assertEquals("Lit", machine.get(IrJson.STATES).get(1).get(IrJson.ID).asText());
    assertFalse(machine.get(IrJson.STATES).get(1).has(IrJson.LABEL));

    // 3. first transition: endpoint aliases, singular trigger and action
    final JsonNode first = machine.get(IrJson.TRANSITIONS).get(0);
    assertEquals("Idle", first.get(IrJson.FROM).asText());
    assertEquals("Lit", first.get(IrJson.TO).asText());
    final JsonNode trigger = first.get(IrJson.TRIGGERS).get(0);
    assertEquals("becomes", trigger.get(IrJson.TYPE).asText());
    assertEquals("motion_hall", trigger.get(IrJson.REF).get(IrJson.DEVICE).asText());
    assertEquals("motion", trigger.get(IrJson.REF).get(IrJson.PATH).asText());
    assertEquals("Detected", trigger.get(IrJson.VALUE).get(IrJson.STRING).asText());
    final JsonNode action = first.get(IrJson.ACTIONS).get(0);
    assertEquals("command", action.get(IrJson.TYPE).asText());
    assertEquals("light_hall", action.get(IrJson.DEVICE).asText());
    assertFalse(action.has("deviceId"));

    // 4. second transition: timer becomes after, no-op command dropped, null guard dropped
    final JsonNode second = machine.get(IrJson.TRANSITIONS).get(1);
    assertEquals("Idle", second.get(IrJson.TO).asText());
    assertEquals("after", second.get(IrJson.TRIGGERS).get(0).get(IrJson.TYPE).asText());
    assertEquals(120, second.get(IrJson.TRIGGERS).get(0).get(IrJson.SECONDS).asInt());
    assertFalse(second.has(IrJson.GUARD));
    final JsonNode actions = second.get(IrJson.ACTIONS);
    assertEquals(2, actions.size());
    assertEquals("light_hall", actions.get(0).get(IrJson.DEVICE).asText());
    assertEquals("notify", actions.get(1).get(IrJson.TYPE).asText());
    assertEquals("Hall is dark again", actions.get(1).get(IrJson.MESSAGE).asText());

    // 5. the input is untouched
    assertEquals(rawText, IrJson.canonicalString(raw));
  }

  @Test
  public void testNormalizeIsIdempotent() throws AutomationException {
    final ShapeNormalizer normalizer = new ShapeNormalizer(CatalogLoader.defaultDeviceCatalog());
    for (String fixture : new String[] {Fixtures.LOOSE_LLM_OUTPUT, Fixtures.HALL_LIGHT,
        Fixtures.DELAYED_OFF}) {
      final JsonNode once = normalizer.normalize(Fixtures.load(fixture));
      final JsonNode twice = normalizer.normalize(once);
      assertEquals(fixture, IrJson.canonicalString(once), IrJson.canonicalString(twice));
    }
  }

  @Test
  public void testCanonicalDocumentUnchanged() throws AutomationException {
    final ShapeNormalizer normalizer = new ShapeNormalizer(CatalogLoader.defaultDeviceCatalog());
    final JsonNode canonical = Fixtures.load(Fixtures.HALL_LIGHT);
    assertEquals(IrJson.canonicalString(canonical),
        IrJson.canonicalString(normalizer.normalize(canonical)));
  }

  @Test
  public void testNonObjectsPassThrough() throws AutomationException {
    final ShapeNormalizer normalizer = new ShapeNormalizer(CatalogLoader.defaultDeviceCatalog());
    final JsonNode array = IrJson.parse("[1, 2]");
    assertSame(array, normalizer.normalize(array));
    final JsonNode text = IrJson.parse("\"hello\"");
    assertSame(text, normalizer.normalize(text));
  }

  @Test
  public void testFailingRuleIsSkipped() throws AutomationException {
    // 1. a rule that always blows up ahead of the built-in ones
    final List<ShapeRule> rules = new ArrayList<>();
    rules.add(new ShapeRule() {
      @Override
      public String name() {
        return "exploding";
      }

      @Override
      public boolean appliesTo(ObjectNode document) {
        return true;
      }

      @Override
      public ObjectNode apply(ObjectNode document) {
        throw new IllegalStateException("boom");
      }
    });
    final DeviceCatalog catalog = CatalogLoader.defaultDeviceCatalog();
    rules.addAll(ShapeNormalizer.defaultRules(catalog));

    // 2. the remaining rules still run
    final JsonNode normalized =
        new ShapeNormalizer(rules).normalize(Fixtures.load(Fixtures.LOOSE_LLM_OUTPUT));
    final JsonNode expected =
        new ShapeNormalizer(catalog).normalize(Fixtures.load(Fixtures.LOOSE_LLM_OUTPUT));
    assertEquals(IrJson.canonicalString(expected), IrJson.canonicalString(normalized));
    assertTrue(normalized.get(IrJson.STATE_MACHINE).has(IrJson.INITIAL));
  }

  @Test
  public void testLooseAlarmDocument() throws AutomationException {
    // 1. a document without devices and with secondary shapes
    final ShapeNormalizer normalizer = new ShapeNormalizer(CatalogLoader.defaultDeviceCatalog());
    final JsonNode normalized = normalizer.normalize(Fixtures.load(Fixtures.LOOSE_ALARM));

    // 2. devices inferred from triggers and actions, sorted, kinds from the catalog
    final JsonNode devices = normalized.get(IrJson.DEVICES);
    assertEquals(3, devices.size());
    assertEquals("alarm_home", devices.get(0).get(IrJson.ID).asText());
    assertEquals("alarm", devices.get(0).get(IrJson.KIND).asText());
    assertEquals("door_front", devices.get(1).get(IrJson.ID).asText());
    assertEquals("contactSensor", devices.get(1).get(IrJson.KIND).asText());
    assertEquals("lamp_living", devices.get(2).get(IrJson.ID).asText());
    assertEquals("dimmer", devices.get(2).get(IrJson.KIND).asText());

    // 3. a missing from falls back to the initial state
    final JsonNode machine = normalized.get(IrJson.STATE_MACHINE);
    final JsonNode first = machine.get(IrJson.TRANSITIONS).get(0);
    assertEquals("Armed", first.get(IrJson.FROM).asText());

    // 4. alarm command aliases
    final JsonNode actions = first.get(IrJson.ACTIONS);
    assertEquals(6, actions.size());
    assertEquals("command", actions.get(0).get(IrJson.TYPE).asText());
    assertEquals("siren", actions.get(0).get(IrJson.COMMAND).asText());
    assertEquals("off", actions.get(1).get(IrJson.COMMAND).asText());

    // 5. parameters collapse into args, preferring mode
    assertEquals(1, actions.get(2).get(IrJson.ARGS).size());
    assertEquals("night", actions.get(2).get(IrJson.ARGS).get(0).get(IrJson.STRING).asText());
    assertFalse(actions.get(2).has("parameters"));
    assertEquals(40, actions.get(3).get(IrJson.ARGS).get(0).get(IrJson.NUMBER).intValue());

    // 6. delay in hours, notify msg alias
    assertEquals("delay", actions.get(4).get(IrJson.TYPE).asText());
    assertEquals(3600, actions.get(4).get(IrJson.SECONDS).intValue());
    assertFalse(actions.get(4).has("duration"));
    assertEquals("notify", actions.get(5).get(IrJson.TYPE).asText());
    assertEquals("Door opened", actions.get(5).get(IrJson.MESSAGE).asText());

    // 7. schedule key becomes a cron trigger
    final JsonNode schedule = machine.get(IrJson.TRANSITIONS).get(1).get(IrJson.TRIGGERS).get(0);
    assertEquals("schedule", schedule.get(IrJson.TYPE).asText());
    assertEquals("0 7 * * *", schedule.get(IrJson.CRON).asText());

    // 8. value synonyms fold opened into open
    final JsonNode folded = new LiteralSynonyms().normalize(normalized);
    assertEquals("open", folded.get(IrJson.STATE_MACHINE).get(IrJson.TRANSITIONS).get(0)
        .get(IrJson.TRIGGERS).get(0).get(IrJson.VALUE).get(IrJson.STRING).asText());
  }
}

package com.github.automationir.normalize;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.AutomationException;
import com.github.automationir.model.IrJson;

/**
 * Tests to check synonym folding of literal values and command aliases.
 */
public class LiteralSynonymsTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final String DOCUMENT = "{\"version\":\"0.1\",\"devices\":[],"
      + "\"stateMachine\":{\"initial\":\"A\",\"states\":[{\"id\":\"A\",\"invariants\":["
      + "{\"op\":\"eq\",\"args\":[{\"ref\":{\"device\":\"presence_phone\",\"path\":\"presence\"}},"
      + "{\"lit\":{\"string\":\" Home \"}}]}]}],"
      + "\"transitions\":[{\"from\":\"A\",\"to\":\"A\",\"triggers\":["
      + "{\"type\":\"becomes\",\"ref\":{\"device\":\"motion_hall\",\"path\":\"motion\"},"
      + "\"value\":{\"string\":\"DETECTED\"}},"
      + "{\"type\":\"becomes\",\"ref\":{\"device\":\"thermostat_main\",\"path\":\"thermostatMode\"},"
      + "\"value\":{\"string\":\" Heat \"}}],"
      + "\"guard\":{\"op\":\"not\",\"args\":[{\"op\":\"eq\",\"args\":["
      + "{\"ref\":{\"device\":\"door_front\",\"path\":\"contact\"}},{\"lit\":{\"string\":\"opened\"}}]}]},"
      + "\"actions\":[{\"type\":\"command\",\"device\":\"light_hall\",\"command\":\"Turn_On\"},"
      + "{\"type\":\"command\",\"device\":\"lamp_living\",\"command\":\"setLevel\","
      + "\"args\":[{\"number\":40}]}]}]}}";

  @Test
  public void testSynonymsAndAliases() throws AutomationException {
    // 1. fold the document
    final JsonNode raw = IrJson.parse(DOCUMENT);
    final JsonNode folded = new LiteralSynonyms().normalize(raw);
    final JsonNode machine = folded.get(IrJson.STATE_MACHINE);
    final JsonNode transition = machine.get(IrJson.TRANSITIONS).get(0);

    // 2. becomes values: synonym replaced ignoring case, unknown values trimmed with case kept
    assertEquals("active",
        transition.get(IrJson.TRIGGERS).get(0).get(IrJson.VALUE).get(IrJson.STRING).asText());
    assertEquals("Heat",
        transition.get(IrJson.TRIGGERS).get(1).get(IrJson.VALUE).get(IrJson.STRING).asText());

    // 3. guard and invariant literals
    assertEquals("open", transition.get(IrJson.GUARD).get(IrJson.ARGS).get(0).get(IrJson.ARGS)
        .get(1).get(IrJson.LIT).get(IrJson.STRING).asText());
    assertEquals("present", machine.get(IrJson.STATES).get(0).get(IrJson.INVARIANTS).get(0)
        .get(IrJson.ARGS).get(1).get(IrJson.LIT).get(IrJson.STRING).asText());

    // 4. command aliases, other commands untouched
    assertEquals("on", transition.get(IrJson.ACTIONS).get(0).get(IrJson.COMMAND).asText());
    assertEquals("setLevel", transition.get(IrJson.ACTIONS).get(1).get(IrJson.COMMAND).asText());

    // 5. the input is untouched
    assertEquals("DETECTED", raw.get(IrJson.STATE_MACHINE).get(IrJson.TRANSITIONS).get(0)
        .get(IrJson.TRIGGERS).get(0).get(IrJson.VALUE).get(IrJson.STRING).asText());
  }

  @Test
  public void testCanonicalValue() {
    assertEquals("not present", LiteralSynonyms.canonicalValue("Away"));
    assertEquals("inactive", LiteralSynonyms.canonicalValue("no motion"));
    assertEquals("on", LiteralSynonyms.canonicalValue("TRUE"));
    assertEquals("Night", LiteralSynonyms.canonicalValue(" Night"));
  }

  @Test
  public void testWithoutStateMachine() throws AutomationException {
    final JsonNode document = IrJson.parse("{\"version\":\"0.1\"}");
    assertEquals(document, new LiteralSynonyms().normalize(document));
    final JsonNode array = IrJson.parse("[]");
    assertSame(array, new LiteralSynonyms().normalize(array));
  }
}

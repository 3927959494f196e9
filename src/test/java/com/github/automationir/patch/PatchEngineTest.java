package com.github.automationir.patch;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.AutomationException;
import com.github.automationir.AutomationException.Code;
import com.github.automationir.Fixtures;
import com.github.automationir.model.IrJson;
import com.github.automationir.patch.Edit.EditBuilder;

/**
 * Tests to check edit application against IR trees.
 */
public class PatchEngineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final PatchEngine engine = new PatchEngine();

  @Test
  public void testStateEdits() throws AutomationException {
    // 1. relabel, add and re-point initial
    final JsonNode parent = Fixtures.load(Fixtures.HALL_LIGHT);
    final String parentText = IrJson.canonicalString(parent);
    final JsonNode patched = engine.apply(parent, patch(
        EditBuilder.newBuilder(EditOp.SET_STATE_LABEL).stateId("Idle").label("Waiting").build(),
        EditBuilder.newBuilder(EditOp.ADD_STATE).stateId("Away").label("").build(),
        EditBuilder.newBuilder(EditOp.SET_INITIAL).stateId("Night").build()));

    // 2. check states
    final JsonNode machine = patched.get(IrJson.STATE_MACHINE);
    final JsonNode states = machine.get(IrJson.STATES);
    assertEquals(4, states.size());
    assertEquals("Waiting", states.get(0).get(IrJson.LABEL).asText());
    assertEquals("Away", states.get(2).get(IrJson.ID).asText());
    assertFalse(states.get(2).has(IrJson.LABEL));
    assertEquals("Night", states.get(3).get(IrJson.ID).asText());
    assertEquals("Night", machine.get(IrJson.INITIAL).asText());

    // 3. the parent is untouched
    assertEquals(parentText, IrJson.canonicalString(parent));
  }

  @Test
  public void testRemoveStateCascades() throws AutomationException {
    final JsonNode patched = engine.apply(Fixtures.load(Fixtures.HALL_LIGHT),
        patch(EditBuilder.newBuilder(EditOp.REMOVE_STATE).stateId("LightOn").build()));
    final JsonNode machine = patched.get(IrJson.STATE_MACHINE);
    assertEquals(1, machine.get(IrJson.STATES).size());
    assertEquals(0, machine.get(IrJson.TRANSITIONS).size());
    assertEquals("Idle", machine.get(IrJson.INITIAL).asText());
  }

  @Test
  public void testRemovingInitialKeepsPointer() throws AutomationException {
    final JsonNode patched = engine.apply(Fixtures.load(Fixtures.HALL_LIGHT),
        patch(EditBuilder.newBuilder(EditOp.REMOVE_STATE).stateId("Idle").build()));
    assertEquals("Idle", patched.get(IrJson.STATE_MACHINE).get(IrJson.INITIAL).asText());
  }

  @Test
  public void testAddTransitionCreatesStates() throws AutomationException {
    // 1. add a parallel transition and one to a new state
    final ArrayNode triggers = IrJson.nodes().arrayNode();
    triggers.addObject().put(IrJson.TYPE, "after").put(IrJson.SECONDS, 600);
    final JsonNode patched = engine.apply(Fixtures.load(Fixtures.HALL_LIGHT), patch(
        EditBuilder.newBuilder(EditOp.ADD_TRANSITION).from("LightOn").to("Idle")
            .triggers(triggers).build(),
        EditBuilder.newBuilder(EditOp.ADD_TRANSITION).from("LightOn").to("Alarm").build()));

    // 2. stub states and copied fields
    final JsonNode machine = patched.get(IrJson.STATE_MACHINE);
    assertEquals(3, machine.get(IrJson.STATES).size());
    assertEquals("Alarm", machine.get(IrJson.STATES).get(2).get(IrJson.ID).asText());
    final JsonNode transitions = machine.get(IrJson.TRANSITIONS);
    assertEquals(4, transitions.size());
    assertEquals(600, transitions.get(2).get(IrJson.TRIGGERS).get(0).get(IrJson.SECONDS).asInt());
    assertFalse(transitions.get(3).has(IrJson.TRIGGERS));
  }

  @Test
  public void testParallelTransitionsNeedIndex() throws Exception {
    // 1. two transitions sharing LightOn->Idle
    final JsonNode parent = engine.apply(Fixtures.load(Fixtures.HALL_LIGHT), patch(
        EditBuilder.newBuilder(EditOp.ADD_TRANSITION).from("LightOn").to("Idle").build()));

    // 2. an update without index is ambiguous
    final ArrayNode actions = IrJson.nodes().arrayNode();
    actions.addObject().put(IrJson.TYPE, "notify").put(IrJson.MESSAGE, "second");
    try {
      engine.apply(parent, patch(EditBuilder.newBuilder(EditOp.UPDATE_TRANSITION).from("LightOn")
          .to("Idle").actions(actions).build()));
      fail("expected an ambiguity failure");
    } catch (AutomationException expected) {
      assertEquals(Code.AMBIGUOUS_TRANSITION, expected.getCode());
      assertTrue(expected.getMessage().contains("(0..1)"));
    }

    // 3. index 1 picks the second match only
    final JsonNode updated = engine.apply(parent, patch(EditBuilder
        .newBuilder(EditOp.UPDATE_TRANSITION).from("LightOn").to("Idle").index(1)
        .actions(actions).build()));
    final JsonNode transitions = updated.get(IrJson.STATE_MACHINE).get(IrJson.TRANSITIONS);
    assertEquals("off", transitions.get(1).get(IrJson.ACTIONS).get(0).get(IrJson.COMMAND)
        .asText());
    assertEquals("second", transitions.get(2).get(IrJson.ACTIONS).get(0).get(IrJson.MESSAGE)
        .asText());

    // 4. index 2 is out of range
    try {
      engine.apply(parent, patch(EditBuilder.newBuilder(EditOp.REMOVE_TRANSITION).from("LightOn")
          .to("Idle").index(2).build()));
      fail("expected an index failure");
    } catch (AutomationException expected) {
      assertEquals(Code.TRANSITION_INDEX_OUT_OF_RANGE, expected.getCode());
    }
  }

  @Test
  public void testOversizedIndexIsOutOfRange() throws AutomationException {
    // 1. two LightOn->Idle matches
    final JsonNode parent = engine.apply(Fixtures.load(Fixtures.HALL_LIGHT), patch(
        EditBuilder.newBuilder(EditOp.ADD_TRANSITION).from("LightOn").to("Idle").build()));

    // 2. 2^32 + 1 would wrap to 1 as an int
    assertRejected(parent, Code.TRANSITION_INDEX_OUT_OF_RANGE, EditBuilder
        .newBuilder(EditOp.UPDATE_TRANSITION).from("LightOn").to("Idle").index(4294967297L)
        .build());
    assertRejected(parent, Code.TRANSITION_INDEX_OUT_OF_RANGE, EditBuilder
        .newBuilder(EditOp.REMOVE_TRANSITION).from("LightOn").to("Idle").index(4294967297L)
        .build());

    // 3. beyond the long range in either direction
    for (String index : new String[] {"99999999999999999999999", "-99999999999999999999999"}) {
      final Edit edit = Edit.fromJson((ObjectNode) IrJson.parse(
          "{\"op\":\"remove_transition\",\"from\":\"LightOn\",\"to\":\"Idle\",\"index\":"
              + index + "}"));
      assertRejected(parent, Code.TRANSITION_INDEX_OUT_OF_RANGE, edit);
    }
  }

  @Test
  public void testUpdateRetargets() throws AutomationException {
    final JsonNode patched = engine.apply(Fixtures.load(Fixtures.HALL_LIGHT), patch(
        EditBuilder.newBuilder(EditOp.UPDATE_TRANSITION).from("Idle").to("LightOn")
            .newTo("Dimmed").guard(IrJson.nodes().nullNode()).build()));
    final JsonNode machine = patched.get(IrJson.STATE_MACHINE);
    final JsonNode first = machine.get(IrJson.TRANSITIONS).get(0);
    assertEquals("Idle", first.get(IrJson.FROM).asText());
    assertEquals("Dimmed", first.get(IrJson.TO).asText());
    assertTrue(first.get(IrJson.GUARD).isNull());
    assertEquals("t1", first.get(IrJson.ID).asText());
    assertEquals("Dimmed", machine.get(IrJson.STATES).get(2).get(IrJson.ID).asText());
  }

  @Test
  public void testRemoveTransition() throws AutomationException {
    // 1. a matching pair goes
    final JsonNode removed = engine.apply(Fixtures.load(Fixtures.HALL_LIGHT),
        patch(EditBuilder.newBuilder(EditOp.REMOVE_TRANSITION).from("Idle").to("LightOn").build()));
    final JsonNode transitions = removed.get(IrJson.STATE_MACHINE).get(IrJson.TRANSITIONS);
    assertEquals(1, transitions.size());
    assertEquals("t2", transitions.get(0).get(IrJson.ID).asText());

    // 2. no match at all leaves the document as it was
    final JsonNode parent = Fixtures.load(Fixtures.HALL_LIGHT);
    final JsonNode unchanged = engine.apply(parent,
        patch(EditBuilder.newBuilder(EditOp.REMOVE_TRANSITION).from("Idle").to("Idle").build()));
    assertEquals(parent, unchanged);
  }

  @Test
  public void testUpdateWithoutMatch() throws AutomationException {
    try {
      engine.apply(Fixtures.load(Fixtures.HALL_LIGHT), patch(
          EditBuilder.newBuilder(EditOp.UPDATE_TRANSITION).from("Idle").to("Idle").build()));
      fail("expected a missing transition failure");
    } catch (AutomationException expected) {
      assertEquals(Code.TRANSITION_NOT_FOUND, expected.getCode());
    }
  }

  @Test
  public void testInvalidEdits() throws AutomationException {
    final JsonNode parent = Fixtures.load(Fixtures.HALL_LIGHT);
    // 1. label must be a string
    final ObjectNode numericLabel = IrJson.nodes().objectNode().put(Edit.OP, "set_state_label")
        .put(Edit.STATE_ID, "Idle").put(Edit.LABEL, 7);
    assertRejected(parent, Code.INVALID_EDIT, Edit.fromJson(numericLabel));
    // 2. endpoints are required
    assertRejected(parent, Code.INVALID_EDIT,
        EditBuilder.newBuilder(EditOp.ADD_TRANSITION).from("Idle").build());
    assertRejected(parent, Code.INVALID_EDIT,
        EditBuilder.newBuilder(EditOp.ADD_STATE).build());
    // 3. unknown op, even after valid edits
    final ObjectNode rename = IrJson.nodes().objectNode().put(Edit.OP, "rename_state")
        .put(Edit.STATE_ID, "Idle");
    assertRejected(parent, Code.UNSUPPORTED_EDIT_OP,
        EditBuilder.newBuilder(EditOp.ADD_STATE).stateId("X").build(), Edit.fromJson(rename));
  }

  @Test
  public void testDocumentWithoutMachine() throws AutomationException {
    assertRejected(IrJson.parse("{\"version\":\"0.1\"}"), Code.INVALID_DOCUMENT,
        EditBuilder.newBuilder(EditOp.ADD_STATE).stateId("A").build());
  }

  @Test
  public void testPatchDocumentParsing() throws AutomationException {
    // 1. non-object edits are skipped and the summary kept
    final PatchDocument document = PatchDocument.fromJson(IrJson.parse(
        "{\"summary\":\"rename\",\"edits\":[1,{\"op\":\"set_initial\",\"state_id\":\"LightOn\"}]}"));
    assertEquals("rename", document.getSummary());
    assertEquals(1, document.getEdits().size());
    assertEquals(EditOp.SET_INITIAL, document.getEdits().get(0).getOp());

    // 2. malformed patches
    for (String bad : new String[] {"[]", "{\"edits\":{}}"}) {
      try {
        PatchDocument.fromJson(IrJson.parse(bad));
        fail("expected an invalid patch: " + bad);
      } catch (AutomationException expected) {
        assertEquals(Code.INVALID_PATCH, expected.getCode());
      }
    }
    assertTrue(PatchDocument.fromJson(IrJson.parse("{}")).getEdits().isEmpty());
  }

  private void assertRejected(final JsonNode parent, final Code code, final Edit... edits) {
    final String before = IrJson.canonicalString(parent);
    try {
      engine.apply(parent, patch(edits));
      fail("expected " + code);
    } catch (AutomationException expected) {
      assertEquals(code, expected.getCode());
    }
    assertEquals(before, IrJson.canonicalString(parent));
  }

  private static PatchDocument patch(final Edit... edits) {
    return new PatchDocument(null, edits.length == 0 ? Collections.<Edit>emptyList()
        : Arrays.asList(edits));
  }
}

package com.github.automationir.patch;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.AutomationException;
import com.github.automationir.AutomationException.Code;
import com.github.automationir.model.IrJson;

/**
 * Applies a {@link PatchDocument} to an IR tree. The parent is never touched: edits run in order
 * against a private deep copy, and the first invalid edit aborts the whole patch with an
 * {@link AutomationException}.
 *
 * Transitions are addressed by their {@code (from, to)} pair. An optional {@code index} selects
 * the n-th (0-based) transition among those sharing the pair, not a position in the global
 * transition list.
 */
public final class PatchEngine {
  private static final Logger logger = LogManager.getLogger(PatchEngine.class.getSimpleName());

  public JsonNode apply(final JsonNode parent, final PatchDocument patch)
      throws AutomationException {
    if (parent == null || !parent.isObject()) {
      throw new AutomationException(Code.INVALID_DOCUMENT);
    }
    final ObjectNode document = ((ObjectNode) parent).deepCopy();
    final JsonNode machineNode = document.get(IrJson.STATE_MACHINE);
    if (machineNode == null || !machineNode.isObject()) {
      throw new AutomationException(Code.INVALID_DOCUMENT, "IR is missing its stateMachine object");
    }
    final ObjectNode machine = (ObjectNode) machineNode;
    int step = 0;
    for (Edit edit : patch.getEdits()) {
      step++;
      final EditOp op = edit.getOp();
      if (op == null) {
        throw new AutomationException(Code.UNSUPPORTED_EDIT_OP,
            "Unsupported patch op: " + edit.getOpName());
      }
      logger.debug("edit {}: {}", step, op.getWireName());
      switch (op) {
        case SET_STATE_LABEL:
          setStateLabel(machine, edit);
          break;
        case SET_INITIAL:
          setInitial(machine, edit);
          break;
        case ADD_STATE:
          addState(machine, edit);
          break;
        case REMOVE_STATE:
          removeState(machine, edit);
          break;
        case ADD_TRANSITION:
          addTransition(machine, edit);
          break;
        case REMOVE_TRANSITION:
          removeTransition(machine, edit);
          break;
        case UPDATE_TRANSITION:
          updateTransition(machine, edit);
          break;
        default:
          throw new AutomationException(Code.UNSUPPORTED_EDIT_OP,
              "Unsupported patch op: " + op.getWireName());
      }
    }
    return document;
  }

  private static void setStateLabel(final ObjectNode machine, final Edit edit)
      throws AutomationException {
    final String stateId = edit.getStateId();
    final String label = edit.getLabel();
    if (stateId.isEmpty() || label == null) {
      throw new AutomationException(Code.INVALID_EDIT,
          "set_state_label requires state_id (string) and label (string)");
    }
    ensureState(machine, stateId).put(IrJson.LABEL, label);
  }

  private static void setInitial(final ObjectNode machine, final Edit edit)
      throws AutomationException {
    final String stateId = requireStateId(edit);
    ensureState(machine, stateId);
    machine.put(IrJson.INITIAL, stateId);
  }

  private static void addState(final ObjectNode machine, final Edit edit)
      throws AutomationException {
    final ObjectNode state = ensureState(machine, requireStateId(edit));
    final String label = edit.getLabel();
    if (label != null && !label.isEmpty()) {
      state.put(IrJson.LABEL, label);
    }
  }

  /**
   * Drops the state and every transition touching it. The initial pointer is left alone.
   */
  private static void removeState(final ObjectNode machine, final Edit edit)
      throws AutomationException {
    final String stateId = requireStateId(edit);
    final JsonNode states = machine.get(IrJson.STATES);
    if (states != null && states.isArray()) {
      final ArrayNode kept = IrJson.nodes().arrayNode();
      for (JsonNode state : states) {
        if (!(state.isObject() && stateId.equals(IrJson.text(state, IrJson.ID)))) {
          kept.add(state);
        }
      }
      machine.set(IrJson.STATES, kept);
    }
    final JsonNode transitions = machine.get(IrJson.TRANSITIONS);
    if (transitions != null && transitions.isArray()) {
      final ArrayNode kept = IrJson.nodes().arrayNode();
      for (JsonNode transition : transitions) {
        if (!(transition.isObject() && touches(transition, stateId))) {
          kept.add(transition);
        }
      }
      machine.set(IrJson.TRANSITIONS, kept);
    }
  }

  private static boolean touches(final JsonNode transition, final String stateId) {
    return stateId.equals(IrJson.text(transition, IrJson.FROM))
        || stateId.equals(IrJson.text(transition, IrJson.TO));
  }

  private static void addTransition(final ObjectNode machine, final Edit edit)
      throws AutomationException {
    final String from = edit.getFrom();
    final String to = edit.getTo();
    if (from.isEmpty() || to.isEmpty()) {
      throw new AutomationException(Code.INVALID_EDIT, "add_transition requires from and to");
    }
    ensureState(machine, from);
    ensureState(machine, to);
    final ObjectNode transition = IrJson.nodes().objectNode();
    transition.put(IrJson.FROM, from);
    transition.put(IrJson.TO, to);
    copyReplacements(edit, transition);
    transitions(machine).add(transition);
  }

  /**
   * Without an index the first same-pair match goes; no match at all is a no-op.
   */
  private static void removeTransition(final ObjectNode machine, final Edit edit)
      throws AutomationException {
    final String from = edit.getFrom();
    final String to = edit.getTo();
    if (from.isEmpty() || to.isEmpty()) {
      throw new AutomationException(Code.INVALID_EDIT, "remove_transition requires from and to");
    }
    final JsonNode transitions = machine.get(IrJson.TRANSITIONS);
    if (transitions == null || !transitions.isArray()) {
      return;
    }
    final List<Integer> positions = matchPositions((ArrayNode) transitions, from, to);
    if (positions.isEmpty()) {
      logger.debug("remove_transition {}->{} matched nothing", from, to);
      return;
    }
    final Long index = edit.getIndex();
    if (index == null) {
      ((ArrayNode) transitions).remove(positions.get(0).intValue());
      return;
    }
    checkIndex(index.longValue(), positions.size(), from, to);
    ((ArrayNode) transitions).remove(positions.get((int) index.longValue()).intValue());
  }

  private static void updateTransition(final ObjectNode machine, final Edit edit)
      throws AutomationException {
    final String from = edit.getFrom();
    final String to = edit.getTo();
    if (from.isEmpty() || to.isEmpty()) {
      throw new AutomationException(Code.INVALID_EDIT,
          "update_transition requires from and to (and optional index)");
    }
    final JsonNode transitionsNode = machine.get(IrJson.TRANSITIONS);
    if (transitionsNode == null || !transitionsNode.isArray()) {
      throw new AutomationException(Code.INVALID_DOCUMENT,
          "IR is missing its stateMachine.transitions[] list");
    }
    final ArrayNode transitions = (ArrayNode) transitionsNode;
    final List<Integer> positions = matchPositions(transitions, from, to);
    if (positions.isEmpty()) {
      throw new AutomationException(Code.TRANSITION_NOT_FOUND,
          "No transition found from '" + from + "' to '" + to + "'");
    }
    final Long index = edit.getIndex();
    final int chosen;
    if (index == null) {
      if (positions.size() > 1) {
        throw new AutomationException(Code.AMBIGUOUS_TRANSITION,
            "Multiple transitions found from '" + from + "' to '" + to
                + "'. Specify an explicit transition index (0.." + (positions.size() - 1)
                + ") among matches.");
      }
      chosen = positions.get(0).intValue();
    } else {
      checkIndex(index.longValue(), positions.size(), from, to);
      chosen = positions.get((int) index.longValue()).intValue();
    }

    final ObjectNode transition = (ObjectNode) transitions.get(chosen);
    final String newFrom = edit.getNewFrom();
    if (newFrom != null) {
      ensureState(machine, newFrom);
      transition.put(IrJson.FROM, newFrom);
    }
    final String newTo = edit.getNewTo();
    if (newTo != null) {
      ensureState(machine, newTo);
      transition.put(IrJson.TO, newTo);
    }
    copyReplacements(edit, transition);
  }

  private static void copyReplacements(final Edit edit, final ObjectNode transition) {
    for (String field : new String[] {IrJson.TRIGGERS, IrJson.GUARD, IrJson.ACTIONS}) {
      if (edit.has(field)) {
        transition.set(field, edit.copyOf(field));
      }
    }
  }

  private static List<Integer> matchPositions(final ArrayNode transitions, final String from,
      final String to) {
    final List<Integer> positions = new ArrayList<>();
    for (int i = 0; i < transitions.size(); i++) {
      final JsonNode transition = transitions.get(i);
      if (transition.isObject() && from.equals(IrJson.text(transition, IrJson.FROM))
          && to.equals(IrJson.text(transition, IrJson.TO))) {
        positions.add(Integer.valueOf(i));
      }
    }
    return positions;
  }

  private static void checkIndex(final long index, final int matches, final String from,
      final String to) throws AutomationException {
    if (index < 0 || index >= matches) {
      throw new AutomationException(Code.TRANSITION_INDEX_OUT_OF_RANGE,
          "Transition index out of range for " + from + "->" + to + ": " + index);
    }
  }

  private static String requireStateId(final Edit edit) throws AutomationException {
    final String stateId = edit.getStateId();
    if (stateId.isEmpty()) {
      throw new AutomationException(Code.INVALID_EDIT,
          edit.getOpName() + " requires state_id");
    }
    return stateId;
  }

  /**
   * The state with the id, appended as a bare {@code {id}} stub when absent.
   */
  private static ObjectNode ensureState(final ObjectNode machine, final String stateId)
      throws AutomationException {
    JsonNode states = machine.get(IrJson.STATES);
    if (states == null || states.isNull()) {
      states = machine.putArray(IrJson.STATES);
    } else if (!states.isArray()) {
      throw new AutomationException(Code.INVALID_DOCUMENT,
          "stateMachine.states is not a list");
    }
    for (ObjectNode state : IrJson.objects(states)) {
      if (stateId.equals(IrJson.text(state, IrJson.ID))) {
        return state;
      }
    }
    return ((ArrayNode) states).addObject().put(IrJson.ID, stateId);
  }

  private static ArrayNode transitions(final ObjectNode machine) throws AutomationException {
    final JsonNode transitions = machine.get(IrJson.TRANSITIONS);
    if (transitions == null || transitions.isNull()) {
      return machine.putArray(IrJson.TRANSITIONS);
    }
    if (!transitions.isArray()) {
      throw new AutomationException(Code.INVALID_DOCUMENT,
          "stateMachine.transitions is not a list");
    }
    return (ArrayNode) transitions;
  }
}

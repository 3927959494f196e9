package com.github.automationir.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * Rules for the state list and the initial pointer.
 */
final class StateRules {

  /**
   * Bare state names become {@code {id}} objects.
   */
  static final class StateIdentifiers extends ElementRule {
    StateIdentifiers() {
      super("state-identifiers", Scope.STATES);
    }

    @Override
    protected JsonNode rewrite(JsonNode element, ObjectNode document) {
      if (!element.isTextual()) {
        return element;
      }
      return IrJson.nodes().objectNode().put(IrJson.ID, element.textValue());
    }
  }

  /**
   * {@code name} stands in for a missing {@code id}; a name or label repeating the id is dropped.
   */
  static final class StateObjects extends ElementRule {
    StateObjects() {
      super("state-objects", Scope.STATES);
    }

    @Override
    protected JsonNode rewrite(JsonNode element, ObjectNode document) {
      if (!element.isObject()) {
        return element;
      }
      final ObjectNode state = (ObjectNode) element;
      if (!state.has(IrJson.ID) && state.has("name")) {
        state.set(IrJson.ID, state.remove("name"));
      }
      final JsonNode id = state.get(IrJson.ID);
      if (id == null) {
        return state;
      }
      if (id.equals(state.get("name"))) {
        state.remove("name");
      }
      if (id.isTextual() && id.equals(state.get(IrJson.LABEL))) {
        state.remove(IrJson.LABEL);
      }
      return state;
    }
  }

  /**
   * A missing initial pointer defaults to the first declared state, else to {@code Idle}.
   */
  static final class InitialDefault implements ShapeRule {

    @Override
    public String name() {
      return "initial-default";
    }

    @Override
    public boolean appliesTo(final ObjectNode document) {
      final ObjectNode machine = ShapeSupport.stateMachine(document);
      return machine != null && !ShapeSupport.isNonEmptyText(machine.get(IrJson.INITIAL));
    }

    @Override
    public ObjectNode apply(final ObjectNode document) {
      final ObjectNode copy = document.deepCopy();
      final ObjectNode machine = ShapeSupport.stateMachine(copy);
      machine.put(IrJson.INITIAL, firstStateId(machine, ShapeSupport.FALLBACK_STATE));
      return copy;
    }
  }

  /**
   * Id of the first declared state when it has a string id, else the fallback.
   */
  static String firstStateId(final ObjectNode machine, final String fallback) {
    final JsonNode states = machine.get(IrJson.STATES);
    if (states != null && states.isArray() && states.size() > 0) {
      final JsonNode first = states.get(0);
      if (first.isObject() && ShapeSupport.isNonEmptyText(first.get(IrJson.ID))) {
        return first.get(IrJson.ID).textValue();
      }
    }
    return fallback;
  }

  private StateRules() {}
}

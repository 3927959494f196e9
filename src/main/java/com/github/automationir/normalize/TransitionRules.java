package com.github.automationir.normalize;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * Rules for the keys of a transition object.
 */
final class TransitionRules {

  /**
   * {@code target}/{@code next} stand in for {@code to}, {@code source}/{@code state} for
   * {@code from}.
   */
  static final class EndpointAliases extends ElementRule {
    EndpointAliases() {
      super("endpoint-aliases", Scope.TRANSITIONS);
    }

    @Override
    protected JsonNode rewrite(JsonNode element, ObjectNode document) {
      if (!element.isObject()) {
        return element;
      }
      final ObjectNode transition = (ObjectNode) element;
      rename(transition, IrJson.TO, "target", "next");
      rename(transition, IrJson.FROM, "source", "state");
      return transition;
    }

    private static void rename(final ObjectNode transition, final String canonical,
        final String... aliases) {
      for (String alias : aliases) {
        if (!transition.has(canonical) && transition.has(alias)) {
          transition.set(canonical, transition.remove(alias));
        }
      }
    }
  }

  /**
   * A singular {@code trigger}/{@code action} object, or an object in place of the list, becomes a
   * one-element list under the plural key.
   */
  static final class SingularLists extends ElementRule {
    SingularLists() {
      super("singular-lists", Scope.TRANSITIONS);
    }

    @Override
    protected JsonNode rewrite(JsonNode element, ObjectNode document) {
      if (!element.isObject()) {
        return element;
      }
      final ObjectNode transition = (ObjectNode) element;
      wrap(transition, IrJson.TRIGGERS, "trigger");
      wrap(transition, IrJson.ACTIONS, "action");
      return transition;
    }

    private static void wrap(final ObjectNode transition, final String plural,
        final String singular) {
      if (!transition.has(plural) && transition.path(singular).isObject()) {
        transition.putArray(plural).add(transition.remove(singular));
      }
      final JsonNode list = transition.get(plural);
      if (list != null && list.isObject()) {
        transition.putArray(plural).add(list);
      }
    }
  }

  /**
   * A missing {@code from} falls back to the initial state and a missing {@code to} to some other
   * declared state. The result may still be invalid; the validator reports it.
   */
  static final class EndpointFallback extends ElementRule {
    EndpointFallback() {
      super("endpoint-fallback", Scope.TRANSITIONS);
    }

    @Override
    protected JsonNode rewrite(JsonNode element, ObjectNode document) {
      if (!element.isObject()) {
        return element;
      }
      final ObjectNode transition = (ObjectNode) element;
      final ObjectNode machine = ShapeSupport.stateMachine(document);
      final List<String> stateIds = stateIds(machine);
      if (!ShapeSupport.isNonEmptyText(transition.get(IrJson.FROM))) {
        final JsonNode initial = machine.get(IrJson.INITIAL);
        transition.put(IrJson.FROM, initial != null && initial.isTextual() ? initial.textValue()
            : stateIds.isEmpty() ? ShapeSupport.FALLBACK_STATE : stateIds.get(0));
      }
      if (!ShapeSupport.isNonEmptyText(transition.get(IrJson.TO))) {
        final String from = transition.get(IrJson.FROM).textValue();
        String to = from;
        for (String stateId : stateIds) {
          if (!stateId.equals(from)) {
            to = stateId;
            break;
          }
        }
        transition.put(IrJson.TO, to);
      }
      return transition;
    }

    private static List<String> stateIds(final ObjectNode machine) {
      final List<String> ids = new ArrayList<>();
      for (ObjectNode state : IrJson.objects(machine.get(IrJson.STATES))) {
        final String id = IrJson.text(state, IrJson.ID);
        if (id != null) {
          ids.add(id);
        }
      }
      return ids;
    }
  }

  /**
   * Triggers and actions that are missing or not lists become empty lists; a null guard is
   * dropped.
   */
  static final class ListDefaults extends ElementRule {
    ListDefaults() {
      super("list-defaults", Scope.TRANSITIONS);
    }

    @Override
    protected JsonNode rewrite(JsonNode element, ObjectNode document) {
      if (!element.isObject()) {
        return element;
      }
      final ObjectNode transition = (ObjectNode) element;
      if (!transition.path(IrJson.TRIGGERS).isArray()) {
        transition.putArray(IrJson.TRIGGERS);
      }
      if (!transition.path(IrJson.ACTIONS).isArray()) {
        transition.putArray(IrJson.ACTIONS);
      }
      if (transition.has(IrJson.GUARD) && transition.get(IrJson.GUARD).isNull()) {
        transition.remove(IrJson.GUARD);
      }
      return transition;
    }
  }

  private TransitionRules() {}
}

package com.github.automationir.patch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.Action;
import com.github.automationir.model.Automation;
import com.github.automationir.model.IrJson;
import com.github.automationir.model.IrWriter;

/**
 * Compares two IRs under the equivalence used for round-trips and no-op edits. States compare as
 * {@code id|label} (or {@code id} without a label). Transitions compare by their key-sorted JSON
 * once the transition id is dropped and empty command {@code args} are removed, so neither
 * affects equality.
 */
public final class IrDiffer {

  public static IrDiff diff(final Automation baseline, final Automation edited) {
    return diff(IrWriter.write(baseline), IrWriter.write(edited));
  }

  public static IrDiff diff(final JsonNode baseline, final JsonNode edited) {
    final JsonNode baselineMachine = machine(baseline);
    final JsonNode editedMachine = machine(edited);

    final Set<String> baselineStates = stateKeys(baselineMachine);
    final Set<String> editedStates = stateKeys(editedMachine);
    final Map<String, JsonNode> baselineTransitions = transitionKeys(baselineMachine);
    final Map<String, JsonNode> editedTransitions = transitionKeys(editedMachine);

    final List<String> statesAdded = new ArrayList<>(editedStates);
    statesAdded.removeAll(baselineStates);
    final List<String> statesRemoved = new ArrayList<>(baselineStates);
    statesRemoved.removeAll(editedStates);

    final List<JsonNode> transitionsAdded = new ArrayList<>();
    for (Map.Entry<String, JsonNode> entry : editedTransitions.entrySet()) {
      if (!baselineTransitions.containsKey(entry.getKey())) {
        transitionsAdded.add(entry.getValue());
      }
    }
    final List<JsonNode> transitionsRemoved = new ArrayList<>();
    for (Map.Entry<String, JsonNode> entry : baselineTransitions.entrySet()) {
      if (!editedTransitions.containsKey(entry.getKey())) {
        transitionsRemoved.add(entry.getValue());
      }
    }
    return new IrDiff(IrJson.text(baselineMachine, IrJson.INITIAL),
        IrJson.text(editedMachine, IrJson.INITIAL), statesAdded, statesRemoved, transitionsAdded,
        transitionsRemoved);
  }

  /**
   * Canonical key of a state: {@code id|label} when it has a non-empty label, else {@code id}.
   */
  public static String stateKey(final JsonNode state) {
    final String id = state.path(IrJson.ID).asText();
    final String label = IrJson.text(state, IrJson.LABEL);
    return label != null && !label.isEmpty() ? id + "|" + label : id;
  }

  /**
   * Copy of a transition with its id and empty command argument lists removed, keys sorted.
   */
  public static JsonNode canonicalTransition(final ObjectNode transition) {
    final ObjectNode copy = transition.deepCopy();
    copy.remove(IrJson.ID);
    final JsonNode actions = copy.get(IrJson.ACTIONS);
    if (actions != null && actions.isArray()) {
      final ArrayNode kept = IrJson.nodes().arrayNode();
      for (ObjectNode action : IrJson.objects(actions)) {
        final JsonNode args = action.get(IrJson.ARGS);
        if (Action.COMMAND.equals(IrJson.text(action, IrJson.TYPE)) && args != null
            && isEmptyArgs(args)) {
          action.remove(IrJson.ARGS);
        }
        kept.add(action);
      }
      copy.set(IrJson.ACTIONS, kept);
    }
    return IrJson.sortKeys(copy);
  }

  private static boolean isEmptyArgs(final JsonNode args) {
    return args.isNull() || args.isContainerNode() && args.size() == 0
        || args.isTextual() && args.asText().isEmpty();
  }

  private static JsonNode machine(final JsonNode document) {
    final JsonNode machine = document == null ? null : document.get(IrJson.STATE_MACHINE);
    return machine != null && machine.isObject() ? machine : IrJson.nodes().objectNode();
  }

  private static Set<String> stateKeys(final JsonNode machine) {
    final Set<String> keys = new TreeSet<>();
    for (ObjectNode state : IrJson.objects(machine.get(IrJson.STATES))) {
      keys.add(stateKey(state));
    }
    return keys;
  }

  private static Map<String, JsonNode> transitionKeys(final JsonNode machine) {
    final Map<String, JsonNode> keys = new TreeMap<>();
    for (ObjectNode transition : IrJson.objects(machine.get(IrJson.TRANSITIONS))) {
      final JsonNode canonical = canonicalTransition(transition);
      keys.put(canonical.toString(), canonical);
    }
    return keys;
  }

  private IrDiffer() {}
}

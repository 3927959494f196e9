package com.github.automationir.validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.node.TextNode;
import com.github.automationir.catalog.CapabilityCatalog;
import com.github.automationir.catalog.CapabilityCatalog.AttributeSpec;
import com.github.automationir.catalog.CapabilityCatalog.KindSpec;
import com.github.automationir.catalog.DeviceCatalog;
import com.github.automationir.model.Action;
import com.github.automationir.model.Automation;
import com.github.automationir.model.DeviceRef;
import com.github.automationir.model.Expression;
import com.github.automationir.model.Literal;
import com.github.automationir.model.Operator;
import com.github.automationir.model.State;
import com.github.automationir.model.StateMachineDefinition;
import com.github.automationir.model.Transition;
import com.github.automationir.model.Trigger;

/**
 * Catalog-aware checks over a structurally conformant automation. All problems are accumulated;
 * nothing here stops at the first finding.
 */
public final class SemanticValidator {
  private static final List<Set<String>> EXCLUSIVE_COMMANDS = Arrays.<Set<String>>asList(
      new LinkedHashSet<>(Arrays.asList("on", "off")),
      new LinkedHashSet<>(Arrays.asList("lock", "unlock")));

  private final DeviceCatalog deviceCatalog;
  private final CapabilityCatalog capabilityCatalog;

  public SemanticValidator(final DeviceCatalog deviceCatalog,
      final CapabilityCatalog capabilityCatalog) {
    this.deviceCatalog = deviceCatalog;
    this.capabilityCatalog = capabilityCatalog;
  }

  public ValidationReport validate(final Automation automation) {
    final Pass pass = new Pass();
    final StateMachineDefinition machine = automation.getStateMachine();
    final Set<String> stateIds = machine.stateIds();

    if (!stateIds.contains(machine.getInitial())) {
      pass.error(DiagnosticCode.UNKNOWN_STATE, "$.stateMachine.initial",
          "Initial state '" + machine.getInitial() + "' not found in states.",
          new ArrayList<>(new TreeSet<>(stateIds)));
    }

    final List<State> states = machine.getStates();
    for (int i = 0; i < states.size(); i++) {
      final List<Expression> invariants = states.get(i).getInvariants();
      for (int k = 0; k < invariants.size(); k++) {
        pass.walk(invariants.get(k), "$.stateMachine.states[" + i + "].invariants[" + k + "]");
      }
    }

    final List<Transition> transitions = machine.getTransitions();
    for (int i = 0; i < transitions.size(); i++) {
      final Transition transition = transitions.get(i);
      final String base = "$.stateMachine.transitions[" + i + "]";
      if (!stateIds.contains(transition.getFromState())) {
        pass.error(DiagnosticCode.UNKNOWN_STATE, base + ".from",
            "Unknown state '" + transition.getFromState() + "'", null);
      }
      if (!stateIds.contains(transition.getToState())) {
        pass.error(DiagnosticCode.UNKNOWN_STATE, base + ".to",
            "Unknown state '" + transition.getToState() + "'", null);
      }

      final List<Trigger> triggers = transition.getTriggers();
      for (int j = 0; j < triggers.size(); j++) {
        final Trigger trigger = triggers.get(j);
        final String path = base + ".triggers[" + j + "]";
        if (trigger instanceof Trigger.Becomes) {
          final Trigger.Becomes becomes = (Trigger.Becomes) trigger;
          if (pass.checkRef(becomes.getRef(), path) != null) {
            pass.checkValue(becomes.getRef(), becomes.getValue(), path, path + ".value.string");
          }
        } else if (trigger instanceof Trigger.Changes) {
          pass.checkRef(((Trigger.Changes) trigger).getRef(), path);
        }
      }

      if (transition.getGuard() != null) {
        pass.walk(transition.getGuard(), base + ".guard");
      }

      final Map<String, Set<String>> commandsByDevice = new LinkedHashMap<>();
      final List<Action> actions = transition.getActions();
      for (int j = 0; j < actions.size(); j++) {
        if (!(actions.get(j) instanceof Action.Command)) {
          continue;
        }
        final Action.Command command = (Action.Command) actions.get(j);
        pass.checkCommand(command, base + ".actions[" + j + "]");
        Set<String> seen = commandsByDevice.get(command.getDevice());
        if (seen == null) {
          seen = new HashSet<>();
          commandsByDevice.put(command.getDevice(), seen);
        }
        seen.add(command.getCommand());
      }
      for (Map.Entry<String, Set<String>> entry : commandsByDevice.entrySet()) {
        for (Set<String> pair : EXCLUSIVE_COMMANDS) {
          if (entry.getValue().containsAll(pair)) {
            pass.error(DiagnosticCode.CONFLICTING_COMMANDS, base + ".actions",
                "Conflicting actions for device '" + entry.getKey() + "' ("
                    + String.join("/", pair) + ") in same transition.",
                null);
          }
        }
      }
    }

    reachability(machine, stateIds, pass);
    return new ValidationReport(pass.diagnostics, pass.patches);
  }

  private static void reachability(final StateMachineDefinition machine,
      final Set<String> stateIds, final Pass pass) {
    final String initial = machine.getInitial();
    if (!stateIds.contains(initial)) {
      return;
    }
    final Map<String, List<String>> adjacency = new LinkedHashMap<>();
    for (String stateId : stateIds) {
      adjacency.put(stateId, new ArrayList<String>());
    }
    for (Transition transition : machine.getTransitions()) {
      final List<String> next = adjacency.get(transition.getFromState());
      if (next != null) {
        next.add(transition.getToState());
      }
    }
    final Set<String> visited = new HashSet<>();
    final Deque<String> stack = new ArrayDeque<>();
    stack.push(initial);
    while (!stack.isEmpty()) {
      final String current = stack.pop();
      if (!visited.add(current)) {
        continue;
      }
      final List<String> next = adjacency.get(current);
      if (next != null) {
        for (String target : next) {
          if (!visited.contains(target)) {
            stack.push(target);
          }
        }
      }
    }
    for (String stateId : new TreeSet<>(stateIds)) {
      if (!visited.contains(stateId)) {
        pass.diagnostics.add(new Diagnostic(DiagnosticCode.UNREACHABLE_STATE,
            "$.stateMachine.states",
            "Unreachable state '" + stateId + "' from initial state '" + initial + "'."));
      }
    }
  }

  /**
   * Accumulator for one validation run.
   */
  private final class Pass {
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<NormalizationPatch> patches = new ArrayList<>();

    void error(final DiagnosticCode code, final String path, final String message,
        final List<String> suggestions) {
      diagnostics.add(new Diagnostic(code, path, message, suggestions));
    }

    /**
     * Kind spec of the device, or null after reporting why there is none.
     */
    KindSpec checkDevice(final String deviceId, final String path) {
      if (!deviceCatalog.contains(deviceId)) {
        final List<String> known = deviceCatalog.sortedIds();
        error(DiagnosticCode.UNKNOWN_DEVICE, path,
            "Unknown device '" + deviceId + "'. Must be one of: " + known, known);
        return null;
      }
      final String kind = deviceCatalog.kindOf(deviceId);
      final KindSpec spec = capabilityCatalog.kind(kind);
      if (spec == null) {
        error(DiagnosticCode.UNKNOWN_KIND, path,
            "No capability spec found for kind '" + kind + "'", null);
      }
      return spec;
    }

    /**
     * Attribute spec of the reference, or null after reporting why there is none.
     */
    AttributeSpec checkRef(final DeviceRef ref, final String path) {
      final KindSpec spec = checkDevice(ref.getDevice(), path);
      if (spec == null) {
        return null;
      }
      final AttributeSpec attribute = spec.attribute(ref.getPath());
      if (attribute == null) {
        final List<String> allowed = spec.sortedAttributeNames();
        error(DiagnosticCode.UNKNOWN_ATTRIBUTE, path, "Unknown attribute '" + ref.getPath()
            + "' for kind '" + spec.getName() + "'. Allowed: " + allowed, allowed);
      }
      return attribute;
    }

    /**
     * Enum membership of a literal compared against a reference whose validity was already
     * reported on.
     */
    void checkValue(final DeviceRef ref, final Literal value, final String path,
        final String valuePath) {
      if (!deviceCatalog.contains(ref.getDevice())) {
        return;
      }
      final KindSpec spec = capabilityCatalog.kind(deviceCatalog.kindOf(ref.getDevice()));
      final AttributeSpec attribute = spec == null ? null : spec.attribute(ref.getPath());
      final List<String> allowed =
          attribute == null ? null : capabilityCatalog.enumValues(attribute);
      if (allowed == null) {
        return;
      }
      final String qualified = spec.getName() + "." + ref.getPath();
      if (!value.isString()) {
        error(DiagnosticCode.ENUM_TYPE_MISMATCH, path,
            "Expected string literal for enum '" + qualified + "'. Allowed: " + allowed, allowed);
        return;
      }
      if (allowed.contains(value.getString())) {
        return;
      }
      error(DiagnosticCode.ENUM_VALUE_NOT_ALLOWED, path, "Invalid value '" + value.getString()
          + "' for " + qualified + ". Allowed: " + allowed, allowed);
      for (String candidate : allowed) {
        if (candidate.equalsIgnoreCase(value.getString())) {
          patches.add(new NormalizationPatch("replace", valuePath, TextNode.valueOf(candidate),
              "Value differs from allowed '" + candidate + "' only by letter case"));
          break;
        }
      }
    }

    void checkCommand(final Action.Command command, final String path) {
      final KindSpec spec = checkDevice(command.getDevice(), path);
      if (spec == null || spec.hasCommand(command.getCommand())) {
        return;
      }
      final List<String> allowed = spec.sortedCommandNames();
      error(DiagnosticCode.UNKNOWN_COMMAND, path, "Unknown command '" + command.getCommand()
          + "' for kind '" + spec.getName() + "'. Allowed: " + allowed, allowed);
    }

    void walk(final Expression expression, final String path) {
      if (expression instanceof Expression.Ref) {
        checkRef(((Expression.Ref) expression).getRef(), path);
        return;
      }
      if (!(expression instanceof Expression.Op)) {
        return;
      }
      final Expression.Op op = (Expression.Op) expression;
      final Operator operator = op.getOperator();
      final int arity = op.getArgs().size();
      if (operator == Operator.NOT && arity != 1) {
        error(DiagnosticCode.EXPRESSION_ARITY, path, "'not' must have 1 argument", null);
      } else if (operator.isComparison() && arity != 2) {
        error(DiagnosticCode.EXPRESSION_ARITY, path,
            "'" + operator.getWireName() + "' must have 2 arguments", null);
      } else if (operator.isConnective() && arity < 2) {
        error(DiagnosticCode.EXPRESSION_ARITY, path,
            "'" + operator.getWireName() + "' must have 2+ arguments", null);
      }
      for (int k = 0; k < arity; k++) {
        walk(op.getArgs().get(k), path + ".args[" + k + "]");
      }
      if (!operator.isComparison() || arity != 2) {
        return;
      }
      final Expression left = op.getArgs().get(0);
      final Expression right = op.getArgs().get(1);
      if (left instanceof Expression.Ref && right instanceof Expression.Lit) {
        checkValue(((Expression.Ref) left).getRef(), ((Expression.Lit) right).getLiteral(), path,
            path + ".args[1].lit.string");
      } else if (right instanceof Expression.Ref && left instanceof Expression.Lit) {
        checkValue(((Expression.Ref) right).getRef(), ((Expression.Lit) left).getLiteral(), path,
            path + ".args[0].lit.string");
      }
    }
  }
}

package com.github.automationir.model;

import static com.github.automationir.model.IrJson.*;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads a structurally conformant IR tree into the typed model. Callers are expected to have run
 * the structural validator first; a non-conformant tree is a programming error here and surfaces as
 * an {@link IllegalArgumentException}.
 */
public final class IrReader {

  public static Automation readAutomation(final JsonNode root) {
    final List<Device> devices = new ArrayList<>();
    for (JsonNode device : require(root, DEVICES)) {
      devices.add(new Device(requireText(device, ID), requireText(device, KIND)));
    }
    return new Automation(requireText(root, VERSION), devices,
        readStateMachine(require(root, STATE_MACHINE)));
  }

  public static StateMachineDefinition readStateMachine(final JsonNode node) {
    final List<State> states = new ArrayList<>();
    for (JsonNode state : require(node, STATES)) {
      states.add(readState(state));
    }
    final List<Transition> transitions = new ArrayList<>();
    for (JsonNode transition : require(node, TRANSITIONS)) {
      transitions.add(readTransition(transition));
    }
    return new StateMachineDefinition(requireText(node, INITIAL), states, transitions);
  }

  public static State readState(final JsonNode node) {
    final List<Expression> invariants = new ArrayList<>();
    final JsonNode invariantsNode = node.get(INVARIANTS);
    if (invariantsNode != null && invariantsNode.isArray()) {
      for (JsonNode invariant : invariantsNode) {
        invariants.add(readExpression(invariant));
      }
    }
    return new State(requireText(node, ID), text(node, LABEL), invariants);
  }

  public static Transition readTransition(final JsonNode node) {
    final Transition.TransitionBuilder builder = Transition.TransitionBuilder.newBuilder()
        .id(text(node, ID)).from(requireText(node, FROM)).to(requireText(node, TO));
    for (JsonNode trigger : require(node, TRIGGERS)) {
      builder.trigger(readTrigger(trigger));
    }
    final JsonNode guard = node.get(GUARD);
    if (guard != null && !guard.isNull()) {
      builder.guard(readExpression(guard));
    }
    for (JsonNode action : require(node, ACTIONS)) {
      builder.action(readAction(action));
    }
    return builder.build();
  }

  public static Trigger readTrigger(final JsonNode node) {
    final String type = requireText(node, TYPE);
    switch (type) {
      case Trigger.BECOMES:
        return new Trigger.Becomes(readRef(require(node, REF)), readLiteral(require(node, VALUE)));
      case Trigger.CHANGES:
        return new Trigger.Changes(readRef(require(node, REF)));
      case Trigger.SCHEDULE:
        return new Trigger.Schedule(requireText(node, CRON));
      case Trigger.AFTER:
        return new Trigger.After(require(node, SECONDS).intValue());
      default:
        throw new IllegalArgumentException("Unknown trigger type '" + type + "'");
    }
  }

  public static Action readAction(final JsonNode node) {
    final String type = requireText(node, TYPE);
    switch (type) {
      case Action.COMMAND:
        final List<Literal> args = new ArrayList<>();
        final JsonNode argsNode = node.get(ARGS);
        if (argsNode != null && argsNode.isArray()) {
          for (JsonNode arg : argsNode) {
            args.add(readLiteral(arg));
          }
        }
        return new Action.Command(requireText(node, DEVICE), requireText(node, COMMAND), args);
      case Action.DELAY:
        return new Action.Delay(require(node, SECONDS).intValue());
      case Action.NOTIFY:
        return new Action.Notify(requireText(node, MESSAGE));
      default:
        throw new IllegalArgumentException("Unknown action type '" + type + "'");
    }
  }

  public static Expression readExpression(final JsonNode node) {
    if (node.has(REF)) {
      return new Expression.Ref(readRef(node.get(REF)));
    }
    if (node.has(LIT)) {
      return new Expression.Lit(readLiteral(node.get(LIT)));
    }
    final String opName = requireText(node, OP);
    final Operator operator = Operator.fromWireName(opName);
    if (operator == null) {
      throw new IllegalArgumentException("Unknown operator '" + opName + "'");
    }
    final List<Expression> args = new ArrayList<>();
    for (JsonNode arg : require(node, ARGS)) {
      args.add(readExpression(arg));
    }
    return new Expression.Op(operator, args);
  }

  public static DeviceRef readRef(final JsonNode node) {
    return new DeviceRef(requireText(node, DEVICE), requireText(node, PATH));
  }

  public static Literal readLiteral(final JsonNode node) {
    if (node.has(STRING)) {
      return Literal.ofString(node.get(STRING).asText());
    }
    if (node.has(NUMBER)) {
      final JsonNode number = node.get(NUMBER);
      if (number.isIntegralNumber() && number.canConvertToLong()) {
        return Literal.ofInteger(number.longValue());
      }
      return Literal.ofDecimal(number.doubleValue());
    }
    if (node.has(BOOL)) {
      return Literal.ofBool(node.get(BOOL).booleanValue());
    }
    throw new IllegalArgumentException("Not a literal: " + node);
  }

  private static JsonNode require(final JsonNode node, final String field) {
    final JsonNode value = node == null ? null : node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing required field '" + field + "' in " + node);
    }
    return value;
  }

  private static String requireText(final JsonNode node, final String field) {
    final JsonNode value = require(node, field);
    if (!value.isTextual()) {
      throw new IllegalArgumentException("Field '" + field + "' must be a string in " + node);
    }
    return value.textValue();
  }

  private IrReader() {}
}

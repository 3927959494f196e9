package com.github.automationir.model;

import static com.github.automationir.model.IrJson.*;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes the typed model back into a canonical IR tree. Optional members are omitted when empty:
 * state label and invariants, transition id and guard, command args.
 */
public final class IrWriter {

  public static ObjectNode write(final Automation automation) {
    final ObjectNode root = nodes().objectNode();
    root.put(VERSION, automation.getVersion());
    final ArrayNode devices = root.putArray(DEVICES);
    for (Device device : automation.getDevices()) {
      devices.addObject().put(ID, device.getId()).put(KIND, device.getKind());
    }
    root.set(STATE_MACHINE, writeStateMachine(automation.getStateMachine()));
    return root;
  }

  public static ObjectNode writeStateMachine(final StateMachineDefinition stateMachine) {
    final ObjectNode node = nodes().objectNode();
    node.put(INITIAL, stateMachine.getInitial());
    final ArrayNode states = node.putArray(STATES);
    for (State state : stateMachine.getStates()) {
      states.add(writeState(state));
    }
    final ArrayNode transitions = node.putArray(TRANSITIONS);
    for (Transition transition : stateMachine.getTransitions()) {
      transitions.add(writeTransition(transition));
    }
    return node;
  }

  public static ObjectNode writeState(final State state) {
    final ObjectNode node = nodes().objectNode();
    node.put(ID, state.getId());
    if (state.hasLabel()) {
      node.put(LABEL, state.getLabel());
    }
    if (!state.getInvariants().isEmpty()) {
      final ArrayNode invariants = node.putArray(INVARIANTS);
      for (Expression invariant : state.getInvariants()) {
        invariants.add(writeExpression(invariant));
      }
    }
    return node;
  }

  public static ObjectNode writeTransition(final Transition transition) {
    final ObjectNode node = nodes().objectNode();
    if (transition.getId() != null) {
      node.put(ID, transition.getId());
    }
    node.put(FROM, transition.getFromState());
    node.put(TO, transition.getToState());
    final ArrayNode triggers = node.putArray(TRIGGERS);
    for (Trigger trigger : transition.getTriggers()) {
      triggers.add(writeTrigger(trigger));
    }
    if (transition.getGuard() != null) {
      node.set(GUARD, writeExpression(transition.getGuard()));
    }
    final ArrayNode actions = node.putArray(ACTIONS);
    for (Action action : transition.getActions()) {
      actions.add(writeAction(action));
    }
    return node;
  }

  public static ObjectNode writeTrigger(final Trigger trigger) {
    return trigger.accept(new Trigger.Visitor<ObjectNode>() {
      @Override
      public ObjectNode visitBecomes(Trigger.Becomes becomes) {
        final ObjectNode node = typed(Trigger.BECOMES);
        node.set(REF, writeRef(becomes.getRef()));
        node.set(VALUE, writeLiteral(becomes.getValue()));
        return node;
      }

      @Override
      public ObjectNode visitChanges(Trigger.Changes changes) {
        final ObjectNode node = typed(Trigger.CHANGES);
        node.set(REF, writeRef(changes.getRef()));
        return node;
      }

      @Override
      public ObjectNode visitSchedule(Trigger.Schedule schedule) {
        return typed(Trigger.SCHEDULE).put(CRON, schedule.getCron());
      }

      @Override
      public ObjectNode visitAfter(Trigger.After after) {
        return typed(Trigger.AFTER).put(SECONDS, after.getSeconds());
      }
    });
  }

  public static ObjectNode writeAction(final Action action) {
    return action.accept(new Action.Visitor<ObjectNode>() {
      @Override
      public ObjectNode visitCommand(Action.Command command) {
        final ObjectNode node = typed(Action.COMMAND).put(DEVICE, command.getDevice())
            .put(COMMAND, command.getCommand());
        if (!command.getArgs().isEmpty()) {
          final ArrayNode args = node.putArray(ARGS);
          for (Literal arg : command.getArgs()) {
            args.add(writeLiteral(arg));
          }
        }
        return node;
      }

      @Override
      public ObjectNode visitDelay(Action.Delay delay) {
        return typed(Action.DELAY).put(SECONDS, delay.getSeconds());
      }

      @Override
      public ObjectNode visitNotify(Action.Notify notify) {
        return typed(Action.NOTIFY).put(MESSAGE, notify.getMessage());
      }
    });
  }

  public static ObjectNode writeExpression(final Expression expression) {
    return expression.accept(new Expression.Visitor<ObjectNode>() {
      @Override
      public ObjectNode visitRef(Expression.Ref ref) {
        final ObjectNode node = nodes().objectNode();
        node.set(REF, writeRef(ref.getRef()));
        return node;
      }

      @Override
      public ObjectNode visitLit(Expression.Lit lit) {
        final ObjectNode node = nodes().objectNode();
        node.set(LIT, writeLiteral(lit.getLiteral()));
        return node;
      }

      @Override
      public ObjectNode visitOp(Expression.Op op) {
        final ObjectNode node = nodes().objectNode();
        node.put(OP, op.getOperator().getWireName());
        final ArrayNode args = node.putArray(ARGS);
        for (Expression arg : op.getArgs()) {
          args.add(writeExpression(arg));
        }
        return node;
      }
    });
  }

  public static ObjectNode writeRef(final DeviceRef ref) {
    return nodes().objectNode().put(DEVICE, ref.getDevice()).put(PATH, ref.getPath());
  }

  public static ObjectNode writeLiteral(final Literal literal) {
    final ObjectNode node = nodes().objectNode();
    switch (literal.getKind()) {
      case STRING:
        node.put(STRING, literal.getString());
        break;
      case NUMBER:
        if (literal.isIntegral()) {
          final long value = literal.getNumber().longValue();
          if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            node.put(NUMBER, (int) value);
          } else {
            node.put(NUMBER, value);
          }
        } else {
          node.put(NUMBER, literal.getNumber().doubleValue());
        }
        break;
      case BOOL:
        node.put(BOOL, literal.getBool());
        break;
      default:
        throw new IllegalStateException("Unhandled literal kind " + literal.getKind());
    }
    return node;
  }

  private static ObjectNode typed(final String type) {
    return nodes().objectNode().put(TYPE, type);
  }

  private IrWriter() {}
}

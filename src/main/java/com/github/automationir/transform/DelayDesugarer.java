package com.github.automationir.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automationir.model.Action;
import com.github.automationir.model.Automation;
import com.github.automationir.model.State;
import com.github.automationir.model.StateMachineDefinition;
import com.github.automationir.model.Transition;
import com.github.automationir.model.Transition.TransitionBuilder;
import com.github.automationir.model.Trigger;

/**
 * Rewrites inline delays into explicit timer states. A transition whose actions hold a delay that
 * is followed by more actions is split at that delay:
 *
 * <pre>
 * A --(triggers, guard / before)--> Wait_{n}s_{k} --(after n / rest)--> B
 * </pre>
 *
 * The tail leg is scanned again so chained delays each get their own wait state. A delay in last
 * position is left alone. Wait states are appended to the state list.
 */
public final class DelayDesugarer {
  private static final Logger logger = LogManager.getLogger(DelayDesugarer.class.getSimpleName());

  public Automation desugar(final Automation automation) {
    final StateMachineDefinition machine = automation.getStateMachine();
    final Set<String> knownIds = machine.stateIds();
    final List<State> states = new ArrayList<>(machine.getStates());
    final List<Transition> transitions = new ArrayList<>();
    int counter = 0;

    for (Transition transition : machine.getTransitions()) {
      Transition current = transition;
      int delayIndex = splittableDelay(current.getActions());
      while (delayIndex >= 0) {
        final List<Action> actions = current.getActions();
        final int seconds = ((Action.Delay) actions.get(delayIndex)).getSeconds();
        counter++;
        final String waitState = freshStateId(seconds, counter, knownIds);
        knownIds.add(waitState);
        states.add(new State(waitState));

        final TransitionBuilder head = current.toBuilder().to(waitState)
            .actions(actions.subList(0, delayIndex));
        final TransitionBuilder tail = TransitionBuilder.newBuilder().from(waitState)
            .to(current.getToState()).trigger(new Trigger.After(seconds))
            .actions(actions.subList(delayIndex + 1, actions.size()));
        if (current.getId() != null) {
          head.id(current.getId() + "_a" + counter);
          tail.id(current.getId() + "_b" + counter);
        }
        transitions.add(head.build());
        logger.debug("split {} -> {} at a {}s delay via {}", current.getFromState(),
            current.getToState(), seconds, waitState);

        current = tail.build();
        delayIndex = splittableDelay(current.getActions());
      }
      transitions.add(current);
    }

    if (counter == 0) {
      return automation;
    }
    return automation.withStateMachine(
        new StateMachineDefinition(machine.getInitial(), states, transitions));
  }

  /**
   * Index of the first delay when it is followed by at least one more action, else -1.
   */
  static int splittableDelay(final List<Action> actions) {
    for (int i = 0; i < actions.size(); i++) {
      if (actions.get(i) instanceof Action.Delay) {
        return i < actions.size() - 1 ? i : -1;
      }
    }
    return -1;
  }

  static String freshStateId(final int seconds, final int counter, final Set<String> knownIds) {
    final String base = "Wait_" + seconds + "s_" + counter;
    String candidate = base;
    int suffix = 1;
    while (knownIds.contains(candidate)) {
      candidate = base + "_" + suffix++;
    }
    return candidate;
  }

  /**
   * Whether any transition still carries a delay before its last action.
   */
  public static boolean hasSplittableDelay(final Automation automation) {
    for (Transition transition : automation.getStateMachine().getTransitions()) {
      if (splittableDelay(transition.getActions()) >= 0) {
        return true;
      }
    }
    return false;
  }
}

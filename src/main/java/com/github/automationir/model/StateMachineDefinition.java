package com.github.automationir.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The states, transitions and initial pointer of an automation. Instances are immutable; every
 * pipeline stage that rewrites the graph builds a new definition.
 */
public final class StateMachineDefinition {
  private final String initial;
  private final List<State> states;
  private final List<Transition> transitions;

  public StateMachineDefinition(final String initial, final List<State> states,
      final List<Transition> transitions) {
    this.initial = Objects.requireNonNull(initial, "initial");
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
  }

  public String getInitial() {
    return initial;
  }

  public List<State> getStates() {
    return states;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  /**
   * Declared state ids in declaration order.
   */
  public Set<String> stateIds() {
    final Set<String> ids = new LinkedHashSet<>();
    for (State state : states) {
      ids.add(state.getId());
    }
    return ids;
  }

  /**
   * State with the given id or null.
   */
  public State findState(final String stateId) {
    for (State state : states) {
      if (state.getId().equals(stateId)) {
        return state;
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StateMachineDefinition)) {
      return false;
    }
    StateMachineDefinition other = (StateMachineDefinition) o;
    return initial.equals(other.initial) && states.equals(other.states)
        && transitions.equals(other.transitions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(initial, states, transitions);
  }

  @Override
  public String toString() {
    return "StateMachineDefinition [initial=" + initial + ", states=" + states + ", transitions="
        + transitions + "]";
  }
}

package com.github.automationir.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A directed edge of the machine, fromState->toState, fired by any of its triggers when its guard
 * holds, executing its actions in order.
 *
 * There is no unique identity across transitions. The same from->to pair may repeat; such parallel
 * transitions are told apart by their position among same-pair matches. The optional id is carried
 * along but never used for matching.
 */
public final class Transition {
  private final String id;
  private final String fromState;
  private final String toState;
  private final List<Trigger> triggers;
  private final Expression guard;
  private final List<Action> actions;

  private Transition(final TransitionBuilder builder) {
    if (builder.fromState == null || builder.toState == null) {
      throw new IllegalArgumentException("Transition endpoints cannot be null");
    }
    this.id = builder.id;
    this.fromState = builder.fromState;
    this.toState = builder.toState;
    this.triggers = Collections.unmodifiableList(new ArrayList<>(builder.triggers));
    this.guard = builder.guard;
    this.actions = Collections.unmodifiableList(new ArrayList<>(builder.actions));
  }

  /**
   * Id or null when the transition has none.
   */
  public String getId() {
    return id;
  }

  public String getFromState() {
    return fromState;
  }

  public String getToState() {
    return toState;
  }

  public List<Trigger> getTriggers() {
    return triggers;
  }

  /**
   * Guard or null when the transition is unguarded.
   */
  public Expression getGuard() {
    return guard;
  }

  public List<Action> getActions() {
    return actions;
  }

  public TransitionBuilder toBuilder() {
    return TransitionBuilder.newBuilder().id(id).from(fromState).to(toState).triggers(triggers)
        .guard(guard).actions(actions);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Transition)) {
      return false;
    }
    Transition other = (Transition) o;
    return Objects.equals(id, other.id) && fromState.equals(other.fromState)
        && toState.equals(other.toState) && triggers.equals(other.triggers)
        && Objects.equals(guard, other.guard) && actions.equals(other.actions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, fromState, toState, triggers, guard, actions);
  }

  @Override
  public String toString() {
    return "Transition [id=" + id + ", fromState=" + fromState + ", toState=" + toState
        + ", triggers=" + triggers + ", guard=" + guard + ", actions=" + actions + "]";
  }

  public final static class TransitionBuilder {
    private String id;
    private String fromState;
    private String toState;
    private final List<Trigger> triggers = new ArrayList<>();
    private Expression guard;
    private final List<Action> actions = new ArrayList<>();

    public static TransitionBuilder newBuilder() {
      return new TransitionBuilder();
    }

    public TransitionBuilder id(final String id) {
      this.id = id;
      return this;
    }

    public TransitionBuilder from(final String fromState) {
      this.fromState = fromState;
      return this;
    }

    public TransitionBuilder to(final String toState) {
      this.toState = toState;
      return this;
    }

    public TransitionBuilder trigger(final Trigger trigger) {
      this.triggers.add(trigger);
      return this;
    }

    public TransitionBuilder triggers(final List<Trigger> triggers) {
      this.triggers.clear();
      this.triggers.addAll(triggers);
      return this;
    }

    public TransitionBuilder guard(final Expression guard) {
      this.guard = guard;
      return this;
    }

    public TransitionBuilder action(final Action action) {
      this.actions.add(action);
      return this;
    }

    public TransitionBuilder actions(final List<Action> actions) {
      this.actions.clear();
      this.actions.addAll(actions);
      return this;
    }

    public Transition build() {
      return new Transition(this);
    }

    private TransitionBuilder() {}
  }
}

package com.github.automationir.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object represents immutable metadata about a state. Identity is the id; the label is a
 * display override used only for rendering.
 */
public final class State {
  private final String id;
  // label and invariants are optional
  private final String label;
  private final List<Expression> invariants;

  public State(final String id, final String label, final List<Expression> invariants) {
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("State id cannot be null or empty");
    }
    this.id = id;
    this.label = label;
    this.invariants = invariants == null ? Collections.<Expression>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(invariants));
  }

  public State(final String id) {
    this(id, null, null);
  }

  public String getId() {
    return id;
  }

  /**
   * Label or null when the state has none.
   */
  public String getLabel() {
    return label;
  }

  public boolean hasLabel() {
    return label != null && !label.isEmpty();
  }

  /**
   * Text shown for the state in a diagram: its label when present, else its id.
   */
  public String getDisplayName() {
    return hasLabel() ? label : id;
  }

  public List<Expression> getInvariants() {
    return invariants;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id.hashCode();
    result = prime * result + ((label == null) ? 0 : label.hashCode());
    result = prime * result + invariants.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    if (!id.equals(other.id)) {
      return false;
    }
    if (label == null) {
      if (other.label != null) {
        return false;
      }
    } else if (!label.equals(other.label)) {
      return false;
    }
    return invariants.equals(other.invariants);
  }

  @Override
  public String toString() {
    return "State [id=" + id + ", label=" + label + ", invariants=" + invariants + "]";
  }
}

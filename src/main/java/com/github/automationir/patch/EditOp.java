package com.github.automationir.patch;

/**
 * Edit operations a patch may carry, keyed by their wire name.
 */
public enum EditOp {
  SET_STATE_LABEL("set_state_label"),
  SET_INITIAL("set_initial"),
  ADD_STATE("add_state"),
  REMOVE_STATE("remove_state"),
  ADD_TRANSITION("add_transition"),
  REMOVE_TRANSITION("remove_transition"),
  UPDATE_TRANSITION("update_transition");

  private final String wireName;

  private EditOp(final String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  /**
   * The operation with this wire name, or null.
   */
  public static EditOp fromWireName(final String wireName) {
    for (EditOp op : values()) {
      if (op.wireName.equals(wireName)) {
        return op;
      }
    }
    return null;
  }
}

package com.github.automationir.validate;

/**
 * Severity of a diagnostic. Only errors make a report fail.
 */
public enum Severity {
  ERROR("error"),
  WARNING("warning");

  private final String wireName;

  private Severity(final String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }
}

package com.github.automationir.validate;

/**
 * Stable diagnostic codes. The wire value is what reports carry; two constants may share a wire
 * value when the original notation used one code for two situations.
 */
public enum DiagnosticCode {
  SCHEMA_VIOLATION("E100", DiagnosticCategory.STRUCTURAL, Severity.ERROR),
  UNKNOWN_DEVICE("E110", DiagnosticCategory.REFERENCE, Severity.ERROR),
  UNKNOWN_STATE("E111", DiagnosticCategory.REFERENCE, Severity.ERROR),
  UNKNOWN_ATTRIBUTE("E200", DiagnosticCategory.CAPABILITY, Severity.ERROR),
  UNKNOWN_KIND("E205", DiagnosticCategory.CAPABILITY, Severity.ERROR),
  UNKNOWN_COMMAND("E300", DiagnosticCategory.CAPABILITY, Severity.ERROR),
  ENUM_TYPE_MISMATCH("E210", DiagnosticCategory.VALUE, Severity.ERROR),
  ENUM_VALUE_NOT_ALLOWED("E220", DiagnosticCategory.VALUE, Severity.ERROR),
  EXPRESSION_ARITY("E400", DiagnosticCategory.EXPRESSION, Severity.ERROR),
  CONFLICTING_COMMANDS("E530", DiagnosticCategory.CONFLICT, Severity.ERROR),
  MISSING_INITIAL_MARKER("E400", DiagnosticCategory.PARSE, Severity.ERROR),
  TRIGGER_PARSE_FAILURE("E410", DiagnosticCategory.PARSE, Severity.ERROR),
  GUARD_PARSE_FAILURE("E420", DiagnosticCategory.PARSE, Severity.ERROR),
  INVARIANT_PARSE_FAILURE("E430", DiagnosticCategory.PARSE, Severity.ERROR),
  ACTION_PARSE_FAILURE("E440", DiagnosticCategory.PARSE, Severity.ERROR),
  MISSING_TRANSITION_LABEL("W400", DiagnosticCategory.WARNING, Severity.WARNING),
  UNKNOWN_STATE_LABEL("W401", DiagnosticCategory.WARNING, Severity.WARNING),
  SANITIZED_STATE_TOKEN("W402", DiagnosticCategory.WARNING, Severity.WARNING),
  UNKNOWN_LABEL_SEGMENT("W410", DiagnosticCategory.WARNING, Severity.WARNING),
  UNREACHABLE_STATE("W500", DiagnosticCategory.WARNING, Severity.WARNING);

  private final String value;
  private final DiagnosticCategory category;
  private final Severity severity;

  private DiagnosticCode(final String value, final DiagnosticCategory category,
      final Severity severity) {
    this.value = value;
    this.category = category;
    this.severity = severity;
  }

  public String getValue() {
    return value;
  }

  public DiagnosticCategory getCategory() {
    return category;
  }

  public Severity getSeverity() {
    return severity;
  }
}

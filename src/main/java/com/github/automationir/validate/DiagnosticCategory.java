package com.github.automationir.validate;

/**
 * Families of problems a diagnostic can report.
 */
public enum DiagnosticCategory {
  // schema-level violations
  STRUCTURAL,
  // unknown device or state
  REFERENCE,
  // unknown attribute, command or device kind
  CAPABILITY,
  // enum type or value mismatch
  VALUE,
  // operator arity
  EXPRESSION,
  // mutually exclusive commands on one transition
  CONFLICT,
  // diagram text that could not be decoded
  PARSE,
  // non-fatal smells
  WARNING;
}

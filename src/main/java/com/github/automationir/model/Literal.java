package com.github.automationir.model;

import java.math.BigDecimal;

/**
 * Tagged scalar value: exactly one of string, number or boolean. Numbers keep their integral or
 * decimal nature so that {@code 5} and {@code 5.0} stay distinct through a round-trip.
 */
public final class Literal {
  public static enum Kind {
    STRING, NUMBER, BOOL;
  }

  private final Kind kind;
  private final String stringValue;
  private final Number numberValue;
  private final boolean boolValue;

  private Literal(final Kind kind, final String stringValue, final Number numberValue,
      final boolean boolValue) {
    this.kind = kind;
    this.stringValue = stringValue;
    this.numberValue = numberValue;
    this.boolValue = boolValue;
  }

  public static Literal ofString(final String value) {
    return new Literal(Kind.STRING, value == null ? "" : value, null, false);
  }

  public static Literal ofInteger(final long value) {
    return new Literal(Kind.NUMBER, null, Long.valueOf(value), false);
  }

  public static Literal ofDecimal(final double value) {
    return new Literal(Kind.NUMBER, null, Double.valueOf(value), false);
  }

  public static Literal ofBool(final boolean value) {
    return new Literal(Kind.BOOL, null, null, value);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isString() {
    return kind == Kind.STRING;
  }

  public String getString() {
    return stringValue;
  }

  public Number getNumber() {
    return numberValue;
  }

  public boolean isIntegral() {
    return numberValue instanceof Long;
  }

  public boolean getBool() {
    return boolValue;
  }

  /**
   * Plain rendering of the value without quoting: integers without a fraction, decimals in plain
   * (non-scientific) notation with at least one fractional digit.
   */
  public String valueText() {
    switch (kind) {
      case STRING:
        return stringValue;
      case NUMBER:
        if (isIntegral()) {
          return numberValue.toString();
        }
        final BigDecimal decimal = BigDecimal.valueOf(numberValue.doubleValue());
        return (decimal.scale() > 0 ? decimal : decimal.setScale(1)).toPlainString();
      case BOOL:
        return boolValue ? "true" : "false";
      default:
        throw new IllegalStateException("Unhandled literal kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + kind.hashCode();
    result = prime * result + ((stringValue == null) ? 0 : stringValue.hashCode());
    result = prime * result + ((numberValue == null) ? 0 : numberValue.hashCode());
    result = prime * result + (boolValue ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Literal other = (Literal) obj;
    if (kind != other.kind || boolValue != other.boolValue) {
      return false;
    }
    if (stringValue == null ? other.stringValue != null : !stringValue.equals(other.stringValue)) {
      return false;
    }
    return numberValue == null ? other.numberValue == null : numberValue.equals(other.numberValue);
  }

  @Override
  public String toString() {
    return "Literal [" + kind + "=" + valueText() + "]";
  }
}

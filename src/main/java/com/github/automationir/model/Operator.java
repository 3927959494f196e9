package com.github.automationir.model;

/**
 * Operators of an expression node along with their wire names and, for comparisons, the infix
 * symbol used in diagram text.
 */
public enum Operator {
  NOT("not", null),
  AND("and", "and"),
  OR("or", "or"),
  EQ("eq", "=="),
  NEQ("neq", "!="),
  LT("lt", "<"),
  LTE("lte", "<="),
  GT("gt", ">"),
  GTE("gte", ">=");

  private final String wireName;
  private final String infix;

  private Operator(final String wireName, final String infix) {
    this.wireName = wireName;
    this.infix = infix;
  }

  public String getWireName() {
    return wireName;
  }

  public String getInfix() {
    return infix;
  }

  public boolean isComparison() {
    return this != NOT && this != AND && this != OR;
  }

  public boolean isConnective() {
    return this == AND || this == OR;
  }

  public static Operator fromWireName(final String wireName) {
    for (Operator operator : values()) {
      if (operator.wireName.equals(wireName)) {
        return operator;
      }
    }
    return null;
  }

  public static Operator fromInfix(final String infix) {
    for (Operator operator : values()) {
      if (operator.isComparison() && operator.infix.equals(infix)) {
        return operator;
      }
    }
    return null;
  }
}

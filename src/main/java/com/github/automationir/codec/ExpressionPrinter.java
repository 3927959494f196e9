package com.github.automationir.codec;

import java.util.ArrayList;
import java.util.List;

import com.github.automationir.model.Expression;
import com.github.automationir.model.Operator;

/**
 * Renders an expression in the infix form the {@link ExpressionParser} reads back: references as
 * {@code device.path}, {@code not (x)}, and every binary or n-ary operator fully parenthesized.
 */
public final class ExpressionPrinter implements Expression.Visitor<String> {
  private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

  public static String print(final Expression expression) {
    return expression.accept(INSTANCE);
  }

  @Override
  public String visitRef(Expression.Ref ref) {
    return ref.getRef().getDevice() + "." + ref.getRef().getPath();
  }

  @Override
  public String visitLit(Expression.Lit lit) {
    return LiteralText.format(lit.getLiteral());
  }

  @Override
  public String visitOp(Expression.Op op) {
    final List<Expression> args = op.getArgs();
    if (op.getOperator() == Operator.NOT) {
      if (args.size() != 1) {
        throw new IllegalArgumentException("not takes exactly one argument, got " + args.size());
      }
      return "not (" + args.get(0).accept(this) + ")";
    }
    if (args.size() < 2 || op.getOperator().isComparison() && args.size() != 2) {
      throw new IllegalArgumentException(
          op.getOperator().getWireName() + " cannot take " + args.size() + " arguments");
    }
    final List<String> printed = new ArrayList<>(args.size());
    for (Expression arg : args) {
      printed.add(arg.accept(this));
    }
    return "(" + String.join(" " + op.getOperator().getInfix() + " ", printed) + ")";
  }

  private ExpressionPrinter() {}
}

package com.github.automationir.codec;

import java.util.ArrayList;
import java.util.List;

import com.github.automationir.model.Expression;
import com.github.automationir.model.Literal;
import com.github.automationir.model.Operator;

/**
 * Recursive-descent parser for guard and invariant expressions. Precedence from lowest to
 * highest: {@code or}, {@code and}, a single comparison, {@code not}, then primaries
 * (parenthesized expression, {@code device.path} reference, literal). The whole input must be
 * consumed.
 */
public final class ExpressionParser {
  private final ExpressionTokenizer tokenizer;
  private Token current;

  private ExpressionParser(final String input) {
    this.tokenizer = new ExpressionTokenizer(input);
    this.current = tokenizer.next();
  }

  public static Expression parse(final String input) throws DiagramParseException {
    final ExpressionParser parser = new ExpressionParser(input.trim());
    final Expression expression = parser.parseOr();
    if (parser.current.getType() != Token.Type.EOF) {
      throw new DiagramParseException("unexpected " + parser.current);
    }
    return expression;
  }

  private void advance() {
    current = tokenizer.next();
  }

  private Expression parseOr() throws DiagramParseException {
    final List<Expression> args = new ArrayList<>();
    args.add(parseAnd());
    while (current.is(Token.Type.KEYWORD, "or")) {
      advance();
      args.add(parseAnd());
    }
    return args.size() == 1 ? args.get(0) : Expression.op(Operator.OR, args);
  }

  private Expression parseAnd() throws DiagramParseException {
    final List<Expression> args = new ArrayList<>();
    args.add(parseComparison());
    while (current.is(Token.Type.KEYWORD, "and")) {
      advance();
      args.add(parseComparison());
    }
    return args.size() == 1 ? args.get(0) : Expression.op(Operator.AND, args);
  }

  private Expression parseComparison() throws DiagramParseException {
    final Expression left = parseUnary();
    if (current.getType() != Token.Type.OP) {
      return left;
    }
    final Operator operator = Operator.fromInfix(current.getText());
    if (operator == null) {
      throw new DiagramParseException("unknown operator " + current);
    }
    advance();
    return Expression.op(operator, left, parseUnary());
  }

  private Expression parseUnary() throws DiagramParseException {
    if (current.is(Token.Type.KEYWORD, "not")) {
      advance();
      return Expression.op(Operator.NOT, parseUnary());
    }
    return parsePrimary();
  }

  private Expression parsePrimary() throws DiagramParseException {
    final Token token = current;
    switch (token.getType()) {
      case LPAREN: {
        advance();
        final Expression inner = parseOr();
        if (current.getType() != Token.Type.RPAREN) {
          throw new DiagramParseException("expected ')' but found " + current);
        }
        advance();
        return inner;
      }
      case REF: {
        final int dot = token.getText().indexOf('.');
        if (dot < 0) {
          throw new DiagramParseException(
              "reference " + token + " needs a device and an attribute path");
        }
        advance();
        return Expression.ref(token.getText().substring(0, dot),
            token.getText().substring(dot + 1));
      }
      case LIT: {
        final Literal literal = LiteralText.parse(token.getText());
        if (literal == null) {
          throw new DiagramParseException("bad literal " + token);
        }
        advance();
        return Expression.lit(literal);
      }
      default:
        throw new DiagramParseException("unexpected " + token);
    }
  }
}

package com.github.automationir.codec;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hand-rolled scanner over an expression string. Quoted string tokens keep their quotes and
 * escapes; an unterminated string or an unexpected character yields a {@code BAD} token.
 */
final class ExpressionTokenizer {
  private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
  private static final Pattern WORD =
      Pattern.compile(DiagramSyntax.IDENTIFIER + "(?:\\." + DiagramSyntax.IDENTIFIER + ")*");

  private final String input;
  private int position;

  ExpressionTokenizer(final String input) {
    this.input = input;
  }

  Token next() {
    while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
      position++;
    }
    if (position >= input.length()) {
      return Token.EOF;
    }
    final char c = input.charAt(position);
    if (c == '(') {
      position++;
      return new Token(Token.Type.LPAREN, "(");
    }
    if (c == ')') {
      position++;
      return new Token(Token.Type.RPAREN, ")");
    }
    for (String operator : new String[] {"==", "!=", "<=", ">="}) {
      if (input.startsWith(operator, position)) {
        position += 2;
        return new Token(Token.Type.OP, operator);
      }
    }
    if (c == '<' || c == '>') {
      position++;
      return new Token(Token.Type.OP, String.valueOf(c));
    }
    if (c == '"') {
      return quoted();
    }

    final Matcher number = NUMBER.matcher(input).region(position, input.length());
    if (number.lookingAt()) {
      position = number.end();
      return new Token(Token.Type.LIT, number.group());
    }
    final Matcher word = WORD.matcher(input).region(position, input.length());
    if (word.lookingAt()) {
      position = word.end();
      final String text = word.group();
      final String lowered = text.toLowerCase(Locale.ROOT);
      switch (lowered) {
        case "and":
        case "or":
        case "not":
          return new Token(Token.Type.KEYWORD, lowered);
        case "true":
        case "false":
          return new Token(Token.Type.LIT, lowered);
        default:
          return new Token(Token.Type.REF, text);
      }
    }
    position++;
    return new Token(Token.Type.BAD, String.valueOf(c));
  }

  private Token quoted() {
    final int start = position;
    boolean escaped = false;
    for (int i = start + 1; i < input.length(); i++) {
      final char c = input.charAt(i);
      if (escaped) {
        escaped = false;
      } else if (c == '\\') {
        escaped = true;
      } else if (c == '"') {
        position = i + 1;
        return new Token(Token.Type.LIT, input.substring(start, position));
      }
    }
    position = input.length();
    return new Token(Token.Type.BAD, input.substring(start));
  }
}

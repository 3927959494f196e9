package com.github.automationir.codec;

import java.util.Locale;
import java.util.regex.Pattern;

import com.github.automationir.model.Literal;

/**
 * Text form of literals: strings double-quoted with backslash escapes, numbers in plain notation,
 * booleans as {@code true}/{@code false}.
 */
public final class LiteralText {
  private static final Pattern INTEGER = Pattern.compile("-?\\d+");
  private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

  public static String format(final Literal literal) {
    if (literal.isString()) {
      return quote(literal.getString());
    }
    return literal.valueText();
  }

  public static String quote(final String text) {
    return '"' + DiagramSyntax.escape(text) + '"';
  }

  /**
   * Parses a literal token, or returns null when the token is not a literal. Boolean keywords are
   * matched regardless of case.
   */
  public static Literal parse(final String token) {
    final String text = token.trim();
    final String lowered = text.toLowerCase(Locale.ROOT);
    if ("true".equals(lowered) || "false".equals(lowered)) {
      return Literal.ofBool("true".equals(lowered));
    }
    if (INTEGER.matcher(text).matches()) {
      try {
        return Literal.ofInteger(Long.parseLong(text));
      } catch (NumberFormatException beyondLong) {
        return Literal.ofDecimal(Double.parseDouble(text));
      }
    }
    if (DECIMAL.matcher(text).matches()) {
      return Literal.ofDecimal(Double.parseDouble(text));
    }
    if (DiagramSyntax.isQuoted(text)) {
      return Literal.ofString(DiagramSyntax.unescape(text.substring(1, text.length() - 1)));
    }
    return null;
  }

  private LiteralText() {}
}

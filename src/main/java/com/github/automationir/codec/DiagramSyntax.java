package com.github.automationir.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lexical conventions of the diagram text shared by the encoder and the decoder.
 */
public final class DiagramSyntax {
  public static final String START = "@startuml";
  public static final String END = "@enduml";
  public static final String TITLE = "title";
  public static final String START_MARKER = "[*]";
  public static final String ARROW = "-->";

  public static final String TRIGGER_PREFIX = "TRIGGER:";
  public static final String GUARD_PREFIX = "GUARD:";
  public static final String ACTION_PREFIX = "ACTION:";

  /**
   * The two characters backslash and n, which separate label segments.
   */
  public static final String LABEL_BREAK = "\\n";
  public static final String TRIGGER_JOINER = " AND ";

  static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";
  static final String CHAIN = IDENTIFIER + "(?:\\." + IDENTIFIER + ")+";

  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile(IDENTIFIER);
  private static final Pattern NON_IDENTIFIER_CHARS = Pattern.compile("[^A-Za-z0-9_]");

  public static boolean isIdentifier(final String token) {
    return IDENTIFIER_PATTERN.matcher(token).matches();
  }

  /**
   * Turns an arbitrary token into an identifier: disallowed characters become underscores and a
   * leading digit gets an {@code S_} prefix. Blank input becomes {@code State}.
   */
  public static String sanitize(final String token) {
    final String replaced = NON_IDENTIFIER_CHARS.matcher(token.trim()).replaceAll("_");
    if (replaced.isEmpty()) {
      return "State";
    }
    if (Character.isDigit(replaced.charAt(0))) {
      return "S_" + replaced;
    }
    return replaced;
  }

  /**
   * Escapes backslashes, double quotes and line breaks for use inside a quoted string. The result
   * stays on one line.
   */
  public static String escape(final String text) {
    return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n")
        .replace("\r", "\\r");
  }

  /**
   * Reverses {@link #escape}. A backslash followed by any other character is kept as-is.
   */
  public static String unescape(final String text) {
    final StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '\\' && i + 1 < text.length()) {
        final char next = text.charAt(i + 1);
        if (next == '\\' || next == '"') {
          out.append(next);
          i++;
          continue;
        }
        if (next == 'n' || next == 'r') {
          out.append(next == 'n' ? '\n' : '\r');
          i++;
          continue;
        }
      }
      out.append(c);
    }
    return out.toString();
  }

  static boolean isQuoted(final String token) {
    return token.length() >= 2 && token.charAt(0) == '"' && token.charAt(token.length() - 1) == '"';
  }

  /**
   * Splits on a separator that occurs outside double-quoted strings. Backslash escapes inside
   * quotes are honoured. Pieces are trimmed and blank pieces dropped.
   */
  static List<String> splitOutsideQuotes(final String text, final String separator) {
    final List<String> pieces = new ArrayList<>();
    final StringBuilder current = new StringBuilder();
    boolean quoted = false;
    boolean escaped = false;
    int i = 0;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (escaped) {
        escaped = false;
      } else if (!quoted && text.startsWith(separator, i)) {
        addPiece(pieces, current);
        current.setLength(0);
        i += separator.length();
        continue;
      } else if (c == '\\') {
        escaped = quoted;
      } else if (c == '"') {
        quoted = !quoted;
      }
      current.append(c);
      i++;
    }
    addPiece(pieces, current);
    return pieces;
  }

  private static void addPiece(final List<String> pieces, final CharSequence piece) {
    final String trimmed = piece.toString().trim();
    if (!trimmed.isEmpty()) {
      pieces.add(trimmed);
    }
  }

  private DiagramSyntax() {}
}

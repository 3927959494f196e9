package com.github.automationir.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.automationir.model.Action;
import com.github.automationir.model.Literal;

/**
 * Reads one action: {@code delay <n>s}, {@code notify <literal or bare text>},
 * {@code <dev>.<cmd>(<literals>)} or a bare {@code <dev>.<cmd>}.
 */
public final class ActionParser {
  private static final String NOTIFY_PREFIX = "notify ";
  private static final Pattern DELAY =
      Pattern.compile("delay\\s+(\\d+)\\s*s", Pattern.CASE_INSENSITIVE);
  private static final Pattern CALL = Pattern.compile(
      "(" + DiagramSyntax.IDENTIFIER + ")\\.(" + DiagramSyntax.IDENTIFIER + ")\\((.*)\\)");
  private static final Pattern BARE_COMMAND =
      Pattern.compile("(" + DiagramSyntax.IDENTIFIER + ")\\.(" + DiagramSyntax.IDENTIFIER + ")");

  public static Action parse(final String text) throws DiagramParseException {
    final String trimmed = text.trim();
    Matcher matcher = DELAY.matcher(trimmed);
    if (matcher.matches()) {
      return new Action.Delay(TriggerParser.seconds(matcher.group(1)));
    }
    if (trimmed.toLowerCase(Locale.ROOT).startsWith(NOTIFY_PREFIX)) {
      final String rest = trimmed.substring(NOTIFY_PREFIX.length()).trim();
      final Literal literal = LiteralText.parse(rest);
      if (literal != null && literal.isString()) {
        return new Action.Notify(literal.getString());
      }
      return new Action.Notify(stripQuotes(rest));
    }
    matcher = CALL.matcher(trimmed);
    if (matcher.matches()) {
      final List<Literal> args = new ArrayList<>();
      for (String piece : DiagramSyntax.splitOutsideQuotes(matcher.group(3), ",")) {
        final Literal literal = LiteralText.parse(piece);
        if (literal == null) {
          throw new DiagramParseException("argument '" + piece + "' is not a literal");
        }
        args.add(literal);
      }
      return new Action.Command(matcher.group(1), matcher.group(2), args);
    }
    matcher = BARE_COMMAND.matcher(trimmed);
    if (matcher.matches()) {
      return new Action.Command(matcher.group(1), matcher.group(2));
    }
    throw new DiagramParseException("not a recognized action form");
  }

  private static String stripQuotes(final String text) {
    int start = 0;
    int end = text.length();
    while (start < end && text.charAt(start) == '"') {
      start++;
    }
    while (end > start && text.charAt(end - 1) == '"') {
      end--;
    }
    return text.substring(start, end);
  }

  private ActionParser() {}
}

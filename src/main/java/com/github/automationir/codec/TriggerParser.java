package com.github.automationir.codec;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.automationir.model.DeviceRef;
import com.github.automationir.model.Literal;
import com.github.automationir.model.Trigger;

/**
 * Reads one trigger: {@code schedule <cron>}, {@code after <n>s}, {@code <dev>.<path> changes} or
 * {@code <dev>.<path> becomes <literal>}.
 */
public final class TriggerParser {
  private static final String SCHEDULE_PREFIX = "schedule ";
  private static final Pattern AFTER =
      Pattern.compile("after\\s+(\\d+)\\s*s", Pattern.CASE_INSENSITIVE);
  private static final Pattern CHANGES =
      Pattern.compile("(" + DiagramSyntax.CHAIN + ")\\s+changes");
  private static final Pattern BECOMES =
      Pattern.compile("(" + DiagramSyntax.CHAIN + ")\\s+becomes\\s+(.+)");

  public static Trigger parse(final String text) throws DiagramParseException {
    final String trimmed = text.trim();
    if (trimmed.toLowerCase(Locale.ROOT).startsWith(SCHEDULE_PREFIX)) {
      final String cron = trimmed.substring(SCHEDULE_PREFIX.length()).trim();
      if (cron.isEmpty()) {
        throw new DiagramParseException("schedule needs a cron expression");
      }
      return new Trigger.Schedule(cron);
    }
    Matcher matcher = AFTER.matcher(trimmed);
    if (matcher.matches()) {
      return new Trigger.After(seconds(matcher.group(1)));
    }
    matcher = CHANGES.matcher(trimmed);
    if (matcher.matches()) {
      return new Trigger.Changes(ref(matcher.group(1)));
    }
    matcher = BECOMES.matcher(trimmed);
    if (matcher.matches()) {
      final Literal value = LiteralText.parse(matcher.group(2));
      if (value == null) {
        throw new DiagramParseException("bad literal '" + matcher.group(2).trim() + "'");
      }
      return new Trigger.Becomes(ref(matcher.group(1)), value);
    }
    throw new DiagramParseException("not a recognized trigger form");
  }

  /**
   * Splits a dotted chain at its first dot: the device, then the remaining path.
   */
  static DeviceRef ref(final String chain) {
    final int dot = chain.indexOf('.');
    return new DeviceRef(chain.substring(0, dot), chain.substring(dot + 1));
  }

  static int seconds(final String digits) throws DiagramParseException {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException tooLarge) {
      throw new DiagramParseException("duration " + digits + "s is too large");
    }
  }

  private TriggerParser() {}
}

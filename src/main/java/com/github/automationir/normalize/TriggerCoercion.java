package com.github.automationir.normalize;

import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;
import com.github.automationir.model.Trigger;

/**
 * Coerces trigger variants into the canonical {@code {type, ref:{device, path}, value|cron}} or
 * {@code {type:"after", seconds}} shape.
 *
 * <ul>
 * <li>device from {@code device|deviceId|device_id}, attribute from
 * {@code path|attribute|attr|property|prop}, either at top level or inside {@code ref}</li>
 * <li>type from {@code type|condition|event}; inferred as {@code becomes} when a value-like key is
 * present, else {@code changes}, or {@code schedule} when a schedule-like key is present</li>
 * <li>timers ({@code after|timer|delay}, or bare {@code seconds}/{@code duration}) become
 * {@code after} with the duration converted to seconds</li>
 * </ul>
 * Anything ambiguous is left alone.
 */
final class TriggerCoercion extends ElementRule {

  TriggerCoercion() {
    super("trigger-coercion", Scope.TRIGGERS);
  }

  @Override
  protected JsonNode rewrite(JsonNode element, ObjectNode document) {
    if (!element.isObject()) {
      return element;
    }
    final ObjectNode trigger = (ObjectNode) element;
    final JsonNode ref = trigger.get(IrJson.REF);
    String device = IrJson.firstText(trigger, ShapeSupport.DEVICE_KEYS);
    String attribute = IrJson.firstText(trigger, ShapeSupport.ATTRIBUTE_KEYS);
    if (ref != null && ref.isObject()) {
      if (device == null) {
        device = IrJson.firstText(ref, ShapeSupport.DEVICE_KEYS);
      }
      if (attribute == null) {
        attribute = IrJson.firstText(ref, ShapeSupport.ATTRIBUTE_KEYS);
      }
    }

    String type = IrJson.firstText(trigger, IrJson.TYPE, "condition", "event");
    final String lowered = type == null ? null : type.trim().toLowerCase(Locale.ROOT);
    if (isTimer(trigger, lowered)) {
      final Integer seconds = ShapeSupport.timerSeconds(trigger);
      if (seconds != null) {
        return after(seconds);
      }
    }

    if (type == null && trigger.has(Trigger.BECOMES)) {
      type = Trigger.BECOMES;
    }
    if (type == null && device != null && attribute != null) {
      type = ShapeSupport.hasAny(trigger, IrJson.VALUE, "equals", "state", Trigger.BECOMES, "val")
          ? Trigger.BECOMES : Trigger.CHANGES;
    }
    if (type == null && ShapeSupport.hasAny(trigger, IrJson.CRON, Trigger.SCHEDULE, "time")) {
      type = Trigger.SCHEDULE;
    }
    if (type != null) {
      type = type.trim();
    }

    if (device != null && attribute != null && type != null) {
      final ObjectNode coerced = IrJson.nodes().objectNode();
      coerced.put(IrJson.TYPE, type);
      coerced.putObject(IrJson.REF).put(IrJson.DEVICE, device).put(IrJson.PATH, attribute);
      if (Trigger.BECOMES.equals(type)) {
        coerced.set(IrJson.VALUE, value(trigger));
      } else if (Trigger.SCHEDULE.equals(type)) {
        final String cron =
            IrJson.firstText(trigger, IrJson.CRON, Trigger.SCHEDULE, "time", "at", "event");
        if (cron != null) {
          coerced.put(IrJson.CRON, cron);
        } else {
          final Integer seconds = ShapeSupport.timerSeconds(trigger);
          if (seconds != null) {
            return after(seconds);
          }
        }
      }
      return coerced;
    }

    // schedule with no device reference, its cron under another key
    if (Trigger.SCHEDULE.equals(type) && !trigger.path(IrJson.CRON).isTextual()) {
      final String cron = IrJson.firstText(trigger, Trigger.SCHEDULE, "time", "at");
      if (cron != null && !Trigger.SCHEDULE.equals(cron)) {
        final ObjectNode coerced = IrJson.nodes().objectNode();
        coerced.put(IrJson.TYPE, Trigger.SCHEDULE);
        coerced.put(IrJson.CRON, cron);
        return coerced;
      }
    }
    return trigger;
  }

  private static boolean isTimer(final ObjectNode trigger, final String lowered) {
    if (lowered == null) {
      return trigger.has(IrJson.SECONDS) || trigger.has("duration");
    }
    switch (lowered) {
      case Trigger.AFTER:
      case "timer":
      case "delay":
        return true;
      case Trigger.SCHEDULE:
        return !trigger.has(IrJson.CRON) && trigger.has(IrJson.SECONDS);
      default:
        return false;
    }
  }

  /**
   * The compared value under {@code value}, {@code becomes}, {@code equals}, {@code state} or
   * {@code val}, as a literal.
   */
  private static JsonNode value(final ObjectNode trigger) {
    JsonNode value = ShapeSupport.present(trigger, IrJson.VALUE);
    if (value == null) {
      value = ShapeSupport.present(trigger, Trigger.BECOMES);
    }
    if (value == null) {
      value = ShapeSupport.firstFilled(trigger, "equals", "state", "val");
    }
    return IrJson.isLiteralObject(value) ? value : IrJson.toLiteral(value);
  }

  private static ObjectNode after(final int seconds) {
    final ObjectNode after = IrJson.nodes().objectNode();
    after.put(IrJson.TYPE, Trigger.AFTER);
    after.put(IrJson.SECONDS, seconds);
    return after;
  }
}

package com.github.automationir.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * Lookups shared by the shape rules. Nothing here throws on odd input.
 */
final class ShapeSupport {
  static final String FALLBACK_STATE = "Idle";

  static final String[] DEVICE_KEYS = {"device", "deviceId", "device_id"};
  static final String[] ATTRIBUTE_KEYS = {"path", "attribute", "attr", "property", "prop"};

  /**
   * The stateMachine member when it is an object, else null.
   */
  static ObjectNode stateMachine(final JsonNode document) {
    final JsonNode machine = document.get(IrJson.STATE_MACHINE);
    return machine != null && machine.isObject() ? (ObjectNode) machine : null;
  }

  static boolean isNonEmptyText(final JsonNode node) {
    return node != null && node.isTextual() && !node.textValue().isEmpty();
  }

  /**
   * A present, non-null member, else null.
   */
  static JsonNode present(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value;
  }

  /**
   * First member that is set to something non-empty: a non-empty string or container, a non-zero
   * number or {@code true}.
   */
  static JsonNode firstFilled(final JsonNode node, final String... fields) {
    for (String field : fields) {
      final JsonNode value = node.get(field);
      if (isFilled(value)) {
        return value;
      }
    }
    return null;
  }

  static boolean isFilled(final JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return false;
    }
    if (value.isTextual()) {
      return !value.textValue().isEmpty();
    }
    if (value.isContainerNode()) {
      return value.size() > 0;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isNumber()) {
      return value.doubleValue() != 0d;
    }
    return true;
  }

  static boolean hasAny(final JsonNode node, final String... fields) {
    for (String field : fields) {
      if (node.has(field)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Device id referenced by one of the device keys, either as a string or as an object carrying a
   * string {@code id}.
   */
  static String deviceId(final JsonNode node) {
    for (String key : DEVICE_KEYS) {
      final JsonNode value = node.get(key);
      if (isNonEmptyText(value)) {
        return value.textValue();
      }
      if (value != null && value.isObject() && isNonEmptyText(value.get(IrJson.ID))) {
        return value.get(IrJson.ID).textValue();
      }
    }
    return null;
  }

  /**
   * Elements of an array, or the object itself when a single object stands in for the list.
   */
  static List<JsonNode> listLike(final JsonNode node) {
    final List<JsonNode> out = new ArrayList<>();
    if (node == null) {
      return out;
    }
    if (node.isArray()) {
      for (JsonNode element : node) {
        out.add(element);
      }
    } else if (node.isObject()) {
      out.add(node);
    }
    return out;
  }

  /**
   * Whole seconds of a numeric value, truncated, else null.
   */
  static Integer wholeSeconds(final JsonNode value) {
    return value != null && value.isNumber() ? Integer.valueOf(value.intValue()) : null;
  }

  /**
   * Converts a duration in seconds, minutes or hours to seconds. An absent or unrecognized unit
   * counts as seconds. Null when the duration is not a number.
   */
  static Integer unitSeconds(final JsonNode duration, final JsonNode unit) {
    if (duration == null || !duration.isNumber()) {
      return null;
    }
    final double amount = duration.doubleValue();
    if (unit == null || !unit.isTextual()) {
      return Integer.valueOf((int) amount);
    }
    switch (unit.textValue().trim().toLowerCase(Locale.ROOT)) {
      case "m":
      case "min":
      case "mins":
      case "minute":
      case "minutes":
        return Integer.valueOf((int) (amount * 60));
      case "h":
      case "hr":
      case "hrs":
      case "hour":
      case "hours":
        return Integer.valueOf((int) (amount * 3600));
      default:
        return Integer.valueOf((int) amount);
    }
  }

  /**
   * Seconds of a timer-shaped object: its {@code seconds}, else its {@code duration} and
   * {@code unit}.
   */
  static Integer timerSeconds(final JsonNode node) {
    final Integer seconds = wholeSeconds(node.get("seconds"));
    if (seconds != null) {
      return seconds;
    }
    return node.has("duration") ? unitSeconds(node.get("duration"), node.get("unit")) : null;
  }

  private ShapeSupport() {}
}

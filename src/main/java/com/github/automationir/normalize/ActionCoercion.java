package com.github.automationir.normalize;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.catalog.DeviceCatalog;
import com.github.automationir.model.Action;
import com.github.automationir.model.IrJson;

/**
 * Coerces action variants into the canonical command, delay and notify shapes. Placeholder
 * commands that do nothing are dropped, as are list entries that are not objects.
 */
final class ActionCoercion extends ElementRule {
  private static final Set<String> NO_OP_COMMANDS = Collections.unmodifiableSet(new HashSet<>(
      Arrays.asList("none", "noop", "no-op", "do_nothing", "do nothing", "nothing")));
  private static final Set<String> ALARM_ON_ALIASES = Collections.unmodifiableSet(new HashSet<>(
      Arrays.asList("on", "turn_on", "turnon")));
  private static final String ALARM_KIND = "alarm";

  private final DeviceCatalog catalog;

  ActionCoercion(final DeviceCatalog catalog) {
    super("action-coercion", Scope.ACTIONS);
    this.catalog = catalog;
  }

  @Override
  protected JsonNode rewrite(JsonNode element, ObjectNode document) {
    if (!element.isObject()) {
      return null;
    }
    final ObjectNode action = (ObjectNode) element;
    if (!action.has(IrJson.TYPE)) {
      if (isDeviceLike(action.get(IrJson.DEVICE)) && action.path(IrJson.COMMAND).isTextual()) {
        action.put(IrJson.TYPE, Action.COMMAND);
      } else if (Action.DELAY.equals(IrJson.text(action, "action"))) {
        action.put(IrJson.TYPE, Action.DELAY);
      }
    }

    final String type = IrJson.text(action, IrJson.TYPE);
    if (Action.DELAY.equals(type)) {
      coerceDelay(action);
    } else if (Action.COMMAND.equals(type)) {
      return coerceCommand(action);
    } else if (Action.NOTIFY.equals(type)) {
      coerceNotify(action);
    }
    return action;
  }

  private static boolean isDeviceLike(final JsonNode device) {
    return device != null && (device.isTextual()
        || device.isObject() && device.path(IrJson.ID).isTextual());
  }

  private static void coerceDelay(final ObjectNode action) {
    final JsonNode seconds = action.get(IrJson.SECONDS);
    if (seconds == null) {
      final Integer converted = action.has("duration")
          ? ShapeSupport.unitSeconds(action.get("duration"), action.get("unit")) : null;
      if (converted != null) {
        action.remove("duration");
        action.remove("unit");
        action.put(IrJson.SECONDS, converted.intValue());
      }
    } else if (seconds.isNumber() && !seconds.isIntegralNumber()) {
      action.put(IrJson.SECONDS, seconds.intValue());
    }
    action.remove("action");
  }

  /**
   * Returns null when the command is a placeholder.
   */
  private ObjectNode coerceCommand(final ObjectNode action) {
    if (!action.has(IrJson.DEVICE)) {
      for (String key : new String[] {"deviceId", "device_id"}) {
        if (ShapeSupport.isFilled(action.get(key))) {
          action.set(IrJson.DEVICE, action.remove(key));
          break;
        }
      }
    }
    final JsonNode device = action.get(IrJson.DEVICE);
    if (device != null && device.isObject() && device.has(IrJson.ID)) {
      action.set(IrJson.DEVICE, device.get(IrJson.ID));
    }

    final JsonNode parameters = action.get("parameters");
    if (!action.has(IrJson.ARGS) && parameters != null && parameters.isObject()) {
      if (parameters.has("mode")) {
        action.putArray(IrJson.ARGS).addObject().put(IrJson.STRING,
            parameters.get("mode").asText());
      } else if (parameters.size() == 1) {
        final Iterator<JsonNode> values = parameters.elements();
        action.putArray(IrJson.ARGS).add(IrJson.toLiteral(values.next()));
      }
      action.remove("parameters");
    }

    final JsonNode args = action.get(IrJson.ARGS);
    if (args != null && args.isArray()) {
      final ArrayNode literals = IrJson.nodes().arrayNode();
      for (JsonNode arg : args) {
        literals.add(IrJson.isLiteralObject(arg) ? arg : IrJson.toLiteral(arg));
      }
      action.set(IrJson.ARGS, literals);
    }

    final String deviceId = IrJson.text(action, IrJson.DEVICE);
    final String command = IrJson.text(action, IrJson.COMMAND);
    if (deviceId != null && command != null) {
      final String normalized = command.trim().toLowerCase(Locale.ROOT);
      if (NO_OP_COMMANDS.contains(normalized)) {
        return null;
      }
      if (ALARM_KIND.equals(catalog.kindOf(deviceId))) {
        if (ALARM_ON_ALIASES.contains(normalized)) {
          action.put(IrJson.COMMAND, "siren");
        } else if ("deactivate".equals(normalized) || "disable".equals(normalized)) {
          action.put(IrJson.COMMAND, "off");
        }
      }
    }
    return action;
  }

  private static void coerceNotify(final ObjectNode action) {
    if (action.has(IrJson.MESSAGE)) {
      return;
    }
    if (action.has("text")) {
      action.set(IrJson.MESSAGE, action.remove("text"));
    } else if (action.has("msg")) {
      action.set(IrJson.MESSAGE, action.remove("msg"));
    } else {
      action.put(IrJson.MESSAGE, "");
    }
  }
}

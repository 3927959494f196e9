package com.github.automationir.normalize;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.Action;
import com.github.automationir.model.IrJson;
import com.github.automationir.model.Trigger;

/**
 * Maps natural-language value synonyms to canonical enum tokens ("detected" to "active", "home" to
 * "present") in becomes values and in guard and invariant literals, and folds common command
 * aliases onto {@code on}/{@code off}. String literals are trimmed; the lookup ignores case but a
 * value with no synonym keeps its case.
 */
public final class LiteralSynonyms {
  private static final Map<String, String> VALUE_SYNONYMS;
  private static final Map<String, String> COMMAND_ALIASES;

  static {
    final Map<String, String> values = new HashMap<>();
    // motion
    values.put("detected", "active");
    values.put("motion", "active");
    values.put("movement", "active");
    values.put("no motion", "inactive");
    values.put("no_motion", "inactive");
    // contact
    values.put("opened", "open");
    values.put("shut", "closed");
    // presence
    values.put("home", "present");
    values.put("away", "not present");
    values.put("not_home", "not present");
    // switch
    values.put("true", "on");
    values.put("false", "off");
    VALUE_SYNONYMS = Collections.unmodifiableMap(values);

    final Map<String, String> commands = new HashMap<>();
    commands.put("turn_on", "on");
    commands.put("turnon", "on");
    commands.put("on", "on");
    commands.put("turn_off", "off");
    commands.put("turnoff", "off");
    commands.put("off", "off");
    COMMAND_ALIASES = Collections.unmodifiableMap(commands);
  }

  /**
   * A normalized copy of the document; the input is left untouched.
   */
  public JsonNode normalize(final JsonNode document) {
    if (document == null || !document.isObject()) {
      return document;
    }
    final ObjectNode copy = ((ObjectNode) document).deepCopy();
    final ObjectNode machine = ShapeSupport.stateMachine(copy);
    if (machine == null) {
      return copy;
    }
    for (ObjectNode transition : IrJson.objects(machine.get(IrJson.TRANSITIONS))) {
      for (ObjectNode trigger : IrJson.objects(transition.get(IrJson.TRIGGERS))) {
        final JsonNode value = trigger.get(IrJson.VALUE);
        if (Trigger.BECOMES.equals(IrJson.text(trigger, IrJson.TYPE)) && value != null
            && value.isObject()) {
          trigger.set(IrJson.VALUE, literal((ObjectNode) value));
        }
      }
      walkExpression(transition.get(IrJson.GUARD));
      for (ObjectNode action : IrJson.objects(transition.get(IrJson.ACTIONS))) {
        final String command = IrJson.text(action, IrJson.COMMAND);
        if (Action.COMMAND.equals(IrJson.text(action, IrJson.TYPE)) && command != null) {
          final String alias = COMMAND_ALIASES.get(command.trim().toLowerCase(Locale.ROOT));
          if (alias != null) {
            action.put(IrJson.COMMAND, alias);
          }
        }
      }
    }
    for (ObjectNode state : IrJson.objects(machine.get(IrJson.STATES))) {
      final JsonNode invariants = state.get(IrJson.INVARIANTS);
      if (invariants != null && invariants.isArray()) {
        for (JsonNode invariant : invariants) {
          walkExpression(invariant);
        }
      }
    }
    return copy;
  }

  /**
   * Canonical token for a string value: trimmed, with synonyms replaced.
   */
  public static String canonicalValue(final String value) {
    final String trimmed = value.trim();
    final String synonym = VALUE_SYNONYMS.get(trimmed.toLowerCase(Locale.ROOT));
    return synonym != null ? synonym : trimmed;
  }

  private static void walkExpression(final JsonNode expression) {
    if (expression == null || !expression.isObject()) {
      return;
    }
    final ObjectNode node = (ObjectNode) expression;
    final JsonNode lit = node.get(IrJson.LIT);
    if (lit != null && lit.isObject()) {
      node.set(IrJson.LIT, literal((ObjectNode) lit));
    }
    final JsonNode args = node.get(IrJson.ARGS);
    if (node.has(IrJson.OP) && args != null && args.isArray()) {
      for (JsonNode arg : args) {
        walkExpression(arg);
      }
    }
  }

  private static ObjectNode literal(final ObjectNode literal) {
    final JsonNode value = literal.get(IrJson.STRING);
    if (value == null || !value.isValueNode() || value.isNull()) {
      return literal;
    }
    return IrJson.nodes().objectNode().put(IrJson.STRING, canonicalValue(value.asText()));
  }
}

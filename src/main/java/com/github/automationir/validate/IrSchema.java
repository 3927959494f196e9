package com.github.automationir.validate;

import static com.github.automationir.model.IrJson.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.model.Action;
import com.github.automationir.model.Automation;
import com.github.automationir.model.Operator;
import com.github.automationir.model.Trigger;

/**
 * Declarative shape of the canonical IR: the version, required fields, value types, identifier
 * state and device ids, the trigger and action type enumerations, non-negative integer durations,
 * literal and expression shapes. Additional properties are tolerated. Every violation is reported
 * as an {@code E100} error whose path points from the document root, e.g.
 * {@code $.stateMachine.transitions[0].triggers[1]}.
 */
public final class IrSchema {
  private final Shape root;

  private IrSchema(final Shape root) {
    this.root = root;
  }

  /**
   * The schema of IR version 0.1.
   */
  public static IrSchema canonical() {
    final Shape ref = object().required(DEVICE, identifier()).required(PATH, string());
    final Shape literal = new LiteralShape();
    final Shape expression = new ExpressionShape(ref, literal);
    final Shape seconds = new IntegerShape(0);

    final Map<String, ObjectShape> triggers = new LinkedHashMap<>();
    triggers.put(Trigger.BECOMES, object().required(REF, ref).required(VALUE, literal));
    triggers.put(Trigger.CHANGES, object().required(REF, ref));
    triggers.put(Trigger.SCHEDULE, object().required(CRON, string()));
    triggers.put(Trigger.AFTER, object().required(SECONDS, seconds));

    final Map<String, ObjectShape> actions = new LinkedHashMap<>();
    actions.put(Action.COMMAND, object().required(DEVICE, identifier()).required(COMMAND, string())
        .optional(ARGS, array(literal)));
    actions.put(Action.DELAY, object().required(SECONDS, seconds));
    actions.put(Action.NOTIFY, object().required(MESSAGE, string()));

    final Shape state = object().required(ID, identifier()).optional(LABEL, string())
        .optional(INVARIANTS, array(expression));
    final Shape transition = object().optional(ID, string()).required(FROM, identifier())
        .required(TO, identifier()).required(TRIGGERS, array(new TaggedShape(triggers)))
        .optional(GUARD, expression).required(ACTIONS, array(new TaggedShape(actions)));
    final Shape stateMachine = object().required(INITIAL, identifier())
        .required(STATES, array(state)).required(TRANSITIONS, array(transition));
    final Shape device = object().required(ID, identifier()).required(KIND, string());

    return new IrSchema(object().required(VERSION, new ConstantShape(Automation.CURRENT_VERSION))
        .required(DEVICES, array(device)).required(STATE_MACHINE, stateMachine));
  }

  /**
   * All violations of the document, in document order. Empty when the document conforms.
   */
  public List<Diagnostic> check(final JsonNode document) {
    final List<Diagnostic> violations = new ArrayList<>();
    root.check(document, "$", violations);
    return violations;
  }

  private static ObjectShape object() {
    return new ObjectShape();
  }

  private static Shape string() {
    return new StringShape();
  }

  /**
   * State and device ids appear bare in the diagram text, so they must be identifiers.
   */
  private static Shape identifier() {
    return new IdentifierShape();
  }

  private static Shape array(final Shape items) {
    return new ArrayShape(items);
  }

  private static void violation(final List<Diagnostic> out, final String path,
      final String message) {
    out.add(new Diagnostic(DiagnosticCode.SCHEMA_VIOLATION, path, message));
  }

  private static String quoted(final Iterable<String> values) {
    final StringBuilder builder = new StringBuilder("[");
    final Iterator<String> iterator = values.iterator();
    while (iterator.hasNext()) {
      builder.append('\'').append(iterator.next()).append('\'');
      if (iterator.hasNext()) {
        builder.append(", ");
      }
    }
    return builder.append(']').toString();
  }

  private static boolean typeMismatch(final JsonNode value, final boolean matches,
      final String type, final String path, final List<Diagnostic> out) {
    if (!matches) {
      violation(out, path, value + " is not of type '" + type + "'");
      return true;
    }
    return false;
  }

  private static abstract class Shape {
    abstract void check(JsonNode value, String path, List<Diagnostic> out);
  }

  private static final class StringShape extends Shape {
    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      typeMismatch(value, value.isTextual(), "string", path, out);
    }
  }

  private static final class IdentifierShape extends Shape {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      if (typeMismatch(value, value.isTextual(), "string", path, out)) {
        return;
      }
      if (!IDENTIFIER.matcher(value.textValue()).matches()) {
        violation(out, path, value + " does not match '^" + IDENTIFIER.pattern() + "$'");
      }
    }
  }

  private static final class ConstantShape extends Shape {
    private final String expected;

    private ConstantShape(final String expected) {
      this.expected = expected;
    }

    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      if (!value.isTextual() || !expected.equals(value.textValue())) {
        violation(out, path, "'" + expected + "' was expected");
      }
    }
  }

  private static final class IntegerShape extends Shape {
    private final int minimum;

    private IntegerShape(final int minimum) {
      this.minimum = minimum;
    }

    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      if (typeMismatch(value, value.isIntegralNumber() && value.canConvertToInt(), "integer", path,
          out)) {
        return;
      }
      if (value.intValue() < minimum) {
        violation(out, path, value + " is less than the minimum of " + minimum);
      }
    }
  }

  private static final class ArrayShape extends Shape {
    private final Shape items;

    private ArrayShape(final Shape items) {
      this.items = items;
    }

    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      if (typeMismatch(value, value.isArray(), "array", path, out)) {
        return;
      }
      for (int i = 0; i < value.size(); i++) {
        items.check(value.get(i), path + "[" + i + "]", out);
      }
    }
  }

  private static final class ObjectShape extends Shape {
    private final Map<String, Shape> properties = new LinkedHashMap<>();
    private final Set<String> required = new LinkedHashSet<>();

    ObjectShape required(final String name, final Shape node) {
      properties.put(name, node);
      required.add(name);
      return this;
    }

    ObjectShape optional(final String name, final Shape node) {
      properties.put(name, node);
      return this;
    }

    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      if (typeMismatch(value, value.isObject(), "object", path, out)) {
        return;
      }
      checkMembers(value, path, out);
    }

    void checkMembers(final JsonNode value, final String path, final List<Diagnostic> out) {
      for (String name : required) {
        if (!value.has(name)) {
          violation(out, path, "'" + name + "' is a required property");
        }
      }
      for (Map.Entry<String, Shape> property : properties.entrySet()) {
        final JsonNode member = value.get(property.getKey());
        if (member != null) {
          property.getValue().check(member, path + "." + property.getKey(), out);
        }
      }
    }
  }

  /**
   * Object discriminated by its {@code type} member.
   */
  private static final class TaggedShape extends Shape {
    private final Map<String, ObjectShape> variants;

    private TaggedShape(final Map<String, ObjectShape> variants) {
      this.variants = variants;
    }

    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      if (typeMismatch(value, value.isObject(), "object", path, out)) {
        return;
      }
      final JsonNode type = value.get(TYPE);
      if (type == null) {
        violation(out, path, "'" + TYPE + "' is a required property");
        return;
      }
      if (!type.isTextual() || !variants.containsKey(type.textValue())) {
        violation(out, path + "." + TYPE,
            type + " is not one of " + quoted(variants.keySet()));
        return;
      }
      variants.get(type.textValue()).checkMembers(value, path, out);
    }
  }

  /**
   * Exactly one of {@code string}, {@code number} or {@code bool}, with a value of that type.
   */
  private static final class LiteralShape extends Shape {
    private static final List<String> KEYS = Collections.unmodifiableList(
        Arrays.asList(STRING, NUMBER, BOOL));

    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      if (typeMismatch(value, value.isObject(), "object", path, out)) {
        return;
      }
      final List<String> present = new ArrayList<>();
      for (String key : KEYS) {
        if (value.has(key)) {
          present.add(key);
        }
      }
      if (present.size() != 1) {
        violation(out, path, value + " is not valid under exactly one of " + quoted(KEYS));
        return;
      }
      final String key = present.get(0);
      final JsonNode member = value.get(key);
      final String memberPath = path + "." + key;
      if (STRING.equals(key)) {
        typeMismatch(member, member.isTextual(), "string", memberPath, out);
      } else if (NUMBER.equals(key)) {
        typeMismatch(member, member.isNumber(), "number", memberPath, out);
      } else {
        typeMismatch(member, member.isBoolean(), "boolean", memberPath, out);
      }
    }
  }

  /**
   * A reference, a literal or an operator node whose arguments are expressions. Arity is a
   * semantic concern and not checked here.
   */
  private static final class ExpressionShape extends Shape {
    private final Shape ref;
    private final Shape literal;

    private ExpressionShape(final Shape ref, final Shape literal) {
      this.ref = ref;
      this.literal = literal;
    }

    @Override
    void check(JsonNode value, String path, List<Diagnostic> out) {
      if (typeMismatch(value, value.isObject(), "object", path, out)) {
        return;
      }
      if (value.has(REF)) {
        ref.check(value.get(REF), path + "." + REF, out);
        return;
      }
      if (value.has(LIT)) {
        literal.check(value.get(LIT), path + "." + LIT, out);
        return;
      }
      if (!value.has(OP)) {
        violation(out, path, value + " is not a valid expression: expected one of "
            + quoted(Arrays.asList(REF, LIT, OP)));
        return;
      }
      final JsonNode op = value.get(OP);
      if (!op.isTextual() || Operator.fromWireName(op.textValue()) == null) {
        final List<String> names = new ArrayList<>();
        for (Operator operator : Operator.values()) {
          names.add(operator.getWireName());
        }
        violation(out, path + "." + OP, op + " is not one of " + quoted(names));
      }
      final JsonNode args = value.get(ARGS);
      if (args == null) {
        violation(out, path, "'" + ARGS + "' is a required property");
        return;
      }
      if (typeMismatch(args, args.isArray(), "array", path + "." + ARGS, out)) {
        return;
      }
      for (int i = 0; i < args.size(); i++) {
        check(args.get(i), path + "." + ARGS + "[" + i + "]", out);
      }
    }
  }
}

package com.github.automationir.model;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.AutomationException;
import com.github.automationir.AutomationException.Code;

/**
 * Wire keys of the canonical IR and the shared Jackson plumbing around them. The mapper is
 * configured once and only used for reading and writing, which is thread-safe.
 */
public final class IrJson {
  public static final String VERSION = "version";
  public static final String DEVICES = "devices";
  public static final String ID = "id";
  public static final String KIND = "kind";
  public static final String STATE_MACHINE = "stateMachine";
  public static final String INITIAL = "initial";
  public static final String STATES = "states";
  public static final String LABEL = "label";
  public static final String INVARIANTS = "invariants";
  public static final String TRANSITIONS = "transitions";
  public static final String FROM = "from";
  public static final String TO = "to";
  public static final String TRIGGERS = "triggers";
  public static final String GUARD = "guard";
  public static final String ACTIONS = "actions";
  public static final String TYPE = "type";
  public static final String REF = "ref";
  public static final String DEVICE = "device";
  public static final String PATH = "path";
  public static final String VALUE = "value";
  public static final String CRON = "cron";
  public static final String SECONDS = "seconds";
  public static final String COMMAND = "command";
  public static final String ARGS = "args";
  public static final String MESSAGE = "message";
  public static final String LIT = "lit";
  public static final String OP = "op";
  public static final String STRING = "string";
  public static final String NUMBER = "number";
  public static final String BOOL = "bool";

  private static final ObjectMapper mapper =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public static ObjectMapper mapper() {
    return mapper;
  }

  public static JsonNodeFactory nodes() {
    return JsonNodeFactory.instance;
  }

  public static JsonNode parse(final String json) throws AutomationException {
    try {
      return mapper.readTree(json);
    } catch (IOException exception) {
      throw new AutomationException(Code.SERIALIZATION_FAILURE, "Malformed JSON document",
          exception);
    }
  }

  public static String print(final JsonNode node) throws AutomationException {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException exception) {
      throw new AutomationException(Code.SERIALIZATION_FAILURE, exception);
    }
  }

  /**
   * Compact serialization with object keys sorted at every level. Two trees that differ only in key
   * order produce the same text.
   */
  public static String canonicalString(final JsonNode node) {
    return sortKeys(node).toString();
  }

  public static JsonNode sortKeys(final JsonNode node) {
    if (node.isObject()) {
      final Map<String, JsonNode> sorted = new TreeMap<>();
      final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        sorted.put(field.getKey(), sortKeys(field.getValue()));
      }
      final ObjectNode out = nodes().objectNode();
      for (Map.Entry<String, JsonNode> entry : sorted.entrySet()) {
        out.set(entry.getKey(), entry.getValue());
      }
      return out;
    }
    if (node.isArray()) {
      final ArrayNode out = nodes().arrayNode();
      for (JsonNode element : node) {
        out.add(sortKeys(element));
      }
      return out;
    }
    return node;
  }

  /**
   * Object children of an array; non-object elements are skipped. Empty for anything but an array.
   */
  public static List<ObjectNode> objects(final JsonNode array) {
    final List<ObjectNode> out = new ArrayList<>();
    if (array != null && array.isArray()) {
      for (JsonNode element : array) {
        if (element.isObject()) {
          out.add((ObjectNode) element);
        }
      }
    }
    return out;
  }

  /**
   * Text of a string-valued field or null when the field is absent or not a string.
   */
  public static String text(final JsonNode node, final String field) {
    if (node == null) {
      return null;
    }
    final JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.textValue() : null;
  }

  /**
   * Text of the first of the given fields holding a non-empty string, else null.
   */
  public static String firstText(final JsonNode node, final String... fields) {
    for (String field : fields) {
      final String value = text(node, field);
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return null;
  }

  /**
   * Whether the node is a literal object, i.e. carries one of the string/number/bool keys.
   */
  public static boolean isLiteralObject(final JsonNode node) {
    return node != null && node.isObject()
        && (node.has(STRING) || node.has(NUMBER) || node.has(BOOL));
  }

  /**
   * Wraps a bare JSON scalar into a literal object. Null becomes the empty string and anything that
   * is not a boolean or a number is rendered as text.
   */
  public static ObjectNode toLiteral(final JsonNode value) {
    final ObjectNode literal = nodes().objectNode();
    if (value == null || value.isNull() || value.isMissingNode()) {
      literal.put(STRING, "");
    } else if (value.isBoolean()) {
      literal.put(BOOL, value.booleanValue());
    } else if (value.isIntegralNumber()) {
      literal.set(NUMBER, value);
    } else if (value.isNumber()) {
      literal.put(NUMBER, value.doubleValue());
    } else if (value.isTextual()) {
      literal.put(STRING, value.textValue());
    } else {
      literal.put(STRING, value.toString());
    }
    return literal;
  }

  private IrJson() {}
}

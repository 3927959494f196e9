package com.github.automationir.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Read-only catalog mapping a device kind to the attributes it exposes and the commands it
 * accepts, plus the value sets backing enum-typed attributes.
 *
 * Shape: {@code {kinds:{<kind>:{attributes:{<name>:{type, valuesFrom?}}, commands:{<name>:{}}}},
 * valueSets:{<name>:[string...]}}}.
 */
public final class CapabilityCatalog {
  public static final String ENUM_TYPE = "enum";

  private final Map<String, KindSpec> kinds;
  private final Map<String, List<String>> valueSets;

  private CapabilityCatalog(final Map<String, KindSpec> kinds,
      final Map<String, List<String>> valueSets) {
    this.kinds = Collections.unmodifiableMap(kinds);
    this.valueSets = Collections.unmodifiableMap(valueSets);
  }

  public static CapabilityCatalog fromJson(final JsonNode root) {
    final Map<String, KindSpec> kinds = new LinkedHashMap<>();
    final JsonNode kindsNode = root == null ? null : root.get("kinds");
    if (kindsNode != null && kindsNode.isObject()) {
      final Iterator<Map.Entry<String, JsonNode>> it = kindsNode.fields();
      while (it.hasNext()) {
        final Map.Entry<String, JsonNode> entry = it.next();
        if (entry.getValue().isObject()) {
          kinds.put(entry.getKey(), KindSpec.fromJson(entry.getKey(), entry.getValue()));
        }
      }
    }
    final Map<String, List<String>> valueSets = new LinkedHashMap<>();
    final JsonNode setsNode = root == null ? null : root.get("valueSets");
    if (setsNode != null && setsNode.isObject()) {
      final Iterator<Map.Entry<String, JsonNode>> it = setsNode.fields();
      while (it.hasNext()) {
        final Map.Entry<String, JsonNode> entry = it.next();
        final List<String> values = new ArrayList<>();
        boolean allStrings = entry.getValue().isArray();
        for (JsonNode value : entry.getValue()) {
          if (!value.isTextual()) {
            allStrings = false;
            break;
          }
          values.add(value.textValue());
        }
        // a set carrying anything but strings cannot constrain an enum
        if (allStrings) {
          valueSets.put(entry.getKey(), Collections.unmodifiableList(values));
        }
      }
    }
    return new CapabilityCatalog(kinds, valueSets);
  }

  /**
   * Spec of the kind or null when the catalog has no entry for it.
   */
  public KindSpec kind(final String kind) {
    return kind == null ? null : kinds.get(kind);
  }

  /**
   * Declared values of an enum-typed attribute, or null when the attribute is not an enum or its
   * value set is unknown.
   */
  public List<String> enumValues(final AttributeSpec attribute) {
    if (attribute == null || !ENUM_TYPE.equals(attribute.getType())
        || attribute.getValuesFrom() == null) {
      return null;
    }
    return valueSets.get(attribute.getValuesFrom());
  }

  public Set<String> kindNames() {
    return kinds.keySet();
  }

  @Override
  public String toString() {
    return "CapabilityCatalog [kinds=" + kinds.keySet() + ", valueSets=" + valueSets.keySet() + "]";
  }

  public static final class KindSpec {
    private final String name;
    private final Map<String, AttributeSpec> attributes;
    private final Set<String> commands;

    private KindSpec(final String name, final Map<String, AttributeSpec> attributes,
        final Set<String> commands) {
      this.name = name;
      this.attributes = Collections.unmodifiableMap(attributes);
      this.commands = Collections.unmodifiableSet(commands);
    }

    static KindSpec fromJson(final String name, final JsonNode node) {
      final Map<String, AttributeSpec> attributes = new LinkedHashMap<>();
      final JsonNode attrs = node.get("attributes");
      if (attrs != null && attrs.isObject()) {
        final Iterator<Map.Entry<String, JsonNode>> it = attrs.fields();
        while (it.hasNext()) {
          final Map.Entry<String, JsonNode> entry = it.next();
          final JsonNode spec = entry.getValue();
          if (spec.isObject()) {
            final JsonNode type = spec.get("type");
            final JsonNode valuesFrom = spec.get("valuesFrom");
            attributes.put(entry.getKey(),
                new AttributeSpec(entry.getKey(), type != null ? type.asText() : null,
                    valuesFrom != null && valuesFrom.isTextual() ? valuesFrom.textValue() : null));
          }
        }
      }
      final Set<String> commands = new TreeSet<>();
      final JsonNode cmds = node.get("commands");
      if (cmds != null && cmds.isObject()) {
        cmds.fieldNames().forEachRemaining(commands::add);
      }
      return new KindSpec(name, attributes, commands);
    }

    public String getName() {
      return name;
    }

    /**
     * Spec of the attribute or null when the kind does not declare it.
     */
    public AttributeSpec attribute(final String attribute) {
      return attributes.get(attribute);
    }

    public List<String> sortedAttributeNames() {
      return new ArrayList<>(new TreeSet<>(attributes.keySet()));
    }

    public boolean hasCommand(final String command) {
      return commands.contains(command);
    }

    public List<String> sortedCommandNames() {
      return new ArrayList<>(commands);
    }

    @Override
    public String toString() {
      return "KindSpec [name=" + name + ", attributes=" + attributes.keySet() + ", commands="
          + commands + "]";
    }
  }

  public static final class AttributeSpec {
    private final String name;
    private final String type;
    private final String valuesFrom;

    AttributeSpec(final String name, final String type, final String valuesFrom) {
      this.name = name;
      this.type = type;
      this.valuesFrom = valuesFrom;
    }

    public String getName() {
      return name;
    }

    public String getType() {
      return type;
    }

    public String getValuesFrom() {
      return valuesFrom;
    }

    @Override
    public String toString() {
      return "AttributeSpec [name=" + name + ", type=" + type + ", valuesFrom=" + valuesFrom + "]";
    }
  }
}

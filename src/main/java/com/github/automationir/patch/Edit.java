package com.github.automationir.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * One edit of a patch. The edit keeps its JSON form since trigger, guard and action replacements
 * are raw IR fragments that re-enter the normalization pipeline after the patch is applied.
 */
public final class Edit {
  public static final String OP = "op";
  public static final String STATE_ID = "state_id";
  public static final String LABEL = "label";
  public static final String FROM = "from";
  public static final String TO = "to";
  public static final String INDEX = "index";
  public static final String NEW_FROM = "new_from";
  public static final String NEW_TO = "new_to";

  private final ObjectNode fields;

  private Edit(final ObjectNode fields) {
    this.fields = fields;
  }

  public static Edit fromJson(final ObjectNode node) {
    return new Edit(node.deepCopy());
  }

  /**
   * The raw op name, possibly one no {@link EditOp} knows.
   */
  public String getOpName() {
    final JsonNode op = fields.get(OP);
    return op == null || op.isNull() ? null : op.asText();
  }

  public EditOp getOp() {
    final String name = getOpName();
    return name == null ? null : EditOp.fromWireName(name);
  }

  public String getStateId() {
    return scalarText(STATE_ID);
  }

  /**
   * The label when it is a JSON string, else null.
   */
  public String getLabel() {
    final JsonNode label = fields.get(LABEL);
    return label != null && label.isTextual() ? label.asText() : null;
  }

  public String getFrom() {
    return scalarText(FROM);
  }

  public String getTo() {
    return scalarText(TO);
  }

  /**
   * The 0-based match index when given as an integer, else null. Integers beyond the long range
   * are clamped to it so they stay out of range instead of wrapping.
   */
  public Long getIndex() {
    final JsonNode index = fields.get(INDEX);
    if (index == null || !index.isIntegralNumber()) {
      return null;
    }
    if (!index.canConvertToLong()) {
      return Long.valueOf(index.bigIntegerValue().signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE);
    }
    return Long.valueOf(index.longValue());
  }

  public String getNewFrom() {
    final JsonNode value = fields.get(NEW_FROM);
    return value != null && value.isTextual() && !value.asText().isEmpty() ? value.asText() : null;
  }

  public String getNewTo() {
    final JsonNode value = fields.get(NEW_TO);
    return value != null && value.isTextual() && !value.asText().isEmpty() ? value.asText() : null;
  }

  /**
   * True when the edit names the field at all, even with a null value.
   */
  public boolean has(final String field) {
    return fields.has(field);
  }

  /**
   * A copy of the field's value, or null when absent.
   */
  public JsonNode copyOf(final String field) {
    final JsonNode value = fields.get(field);
    return value == null ? null : value.deepCopy();
  }

  public ObjectNode toJson() {
    return fields.deepCopy();
  }

  /**
   * Text of a scalar field, empty when absent or null.
   */
  private String scalarText(final String field) {
    final JsonNode value = fields.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return "";
    }
    return value.asText();
  }

  @Override
  public String toString() {
    return "Edit " + fields;
  }

  /**
   * Builds edits programmatically.
   */
  public final static class EditBuilder {
    private final ObjectNode fields = IrJson.nodes().objectNode();

    public static EditBuilder newBuilder(final EditOp op) {
      return new EditBuilder(op);
    }

    public EditBuilder stateId(final String stateId) {
      fields.put(STATE_ID, stateId);
      return this;
    }

    public EditBuilder label(final String label) {
      fields.put(LABEL, label);
      return this;
    }

    public EditBuilder from(final String from) {
      fields.put(FROM, from);
      return this;
    }

    public EditBuilder to(final String to) {
      fields.put(TO, to);
      return this;
    }

    public EditBuilder index(final long index) {
      fields.put(INDEX, index);
      return this;
    }

    public EditBuilder newFrom(final String newFrom) {
      fields.put(NEW_FROM, newFrom);
      return this;
    }

    public EditBuilder newTo(final String newTo) {
      fields.put(NEW_TO, newTo);
      return this;
    }

    public EditBuilder triggers(final JsonNode triggers) {
      fields.set(IrJson.TRIGGERS, triggers);
      return this;
    }

    public EditBuilder guard(final JsonNode guard) {
      fields.set(IrJson.GUARD, guard);
      return this;
    }

    public EditBuilder actions(final JsonNode actions) {
      fields.set(IrJson.ACTIONS, actions);
      return this;
    }

    public Edit build() {
      return new Edit(fields.deepCopy());
    }

    private EditBuilder(final EditOp op) {
      fields.put(OP, op.getWireName());
    }
  }
}

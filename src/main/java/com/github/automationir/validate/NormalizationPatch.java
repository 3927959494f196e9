package com.github.automationir.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * Informational record of a normalization the validator would suggest. Emitting one never changes
 * the IR.
 */
public final class NormalizationPatch {
  private final String op;
  private final String path;
  private final JsonNode value;
  private final String reason;

  public NormalizationPatch(final String op, final String path, final JsonNode value,
      final String reason) {
    this.op = op;
    this.path = path;
    this.value = value;
    this.reason = reason;
  }

  public String getOp() {
    return op;
  }

  public String getPath() {
    return path;
  }

  public JsonNode getValue() {
    return value;
  }

  public String getReason() {
    return reason;
  }

  public ObjectNode toJson() {
    final ObjectNode node = IrJson.nodes().objectNode();
    node.put("op", op);
    node.put("path", path);
    node.set("value", value);
    node.put("reason", reason);
    return node;
  }

  @Override
  public String toString() {
    return "NormalizationPatch [op=" + op + ", path=" + path + ", value=" + value + ", reason="
        + reason + "]";
  }
}

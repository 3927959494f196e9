package com.github.automationir.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.AutomationException;
import com.github.automationir.AutomationException.Code;
import com.github.automationir.model.IrJson;

/**
 * An ordered list of edits with an optional free-text summary, {@code {summary, edits[]}}.
 */
public final class PatchDocument {
  public static final String SUMMARY = "summary";
  public static final String EDITS = "edits";

  private final String summary;
  private final List<Edit> edits;

  public PatchDocument(final String summary, final List<Edit> edits) {
    this.summary = summary;
    this.edits = Collections.unmodifiableList(new ArrayList<>(edits));
  }

  /**
   * Reads a patch document. Entries of {@code edits} that are not objects are skipped; a missing
   * {@code edits} field reads as an empty patch.
   */
  public static PatchDocument fromJson(final JsonNode node) throws AutomationException {
    if (node == null || !node.isObject()) {
      throw new AutomationException(Code.INVALID_PATCH, "Patch document must be a JSON object");
    }
    final JsonNode editsNode = node.get(EDITS);
    if (editsNode != null && !editsNode.isArray()) {
      throw new AutomationException(Code.INVALID_PATCH, "Patch must contain an edits[] list");
    }
    final List<Edit> edits = new ArrayList<>();
    for (ObjectNode edit : IrJson.objects(editsNode)) {
      edits.add(Edit.fromJson(edit));
    }
    return new PatchDocument(IrJson.text(node, SUMMARY), edits);
  }

  /**
   * Free-text summary, or null.
   */
  public String getSummary() {
    return summary;
  }

  public List<Edit> getEdits() {
    return edits;
  }

  public ObjectNode toJson() {
    final ObjectNode node = IrJson.nodes().objectNode();
    if (summary != null) {
      node.put(SUMMARY, summary);
    }
    final ArrayNode array = node.putArray(EDITS);
    for (Edit edit : edits) {
      array.add(edit.toJson());
    }
    return node;
  }

  @Override
  public String toString() {
    return "PatchDocument [summary=" + summary + ", edits=" + edits.size() + "]";
  }
}

package com.github.automationir.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * Structural difference between two IRs: the initial pointers, the canonical state keys added and
 * removed, and the canonical transitions added and removed, all sorted.
 */
public final class IrDiff {
  private final String baselineInitial;
  private final String editedInitial;
  private final List<String> statesAdded;
  private final List<String> statesRemoved;
  private final List<JsonNode> transitionsAdded;
  private final List<JsonNode> transitionsRemoved;

  IrDiff(final String baselineInitial, final String editedInitial, final List<String> statesAdded,
      final List<String> statesRemoved, final List<JsonNode> transitionsAdded,
      final List<JsonNode> transitionsRemoved) {
    this.baselineInitial = baselineInitial;
    this.editedInitial = editedInitial;
    this.statesAdded = Collections.unmodifiableList(new ArrayList<>(statesAdded));
    this.statesRemoved = Collections.unmodifiableList(new ArrayList<>(statesRemoved));
    this.transitionsAdded = Collections.unmodifiableList(new ArrayList<>(transitionsAdded));
    this.transitionsRemoved = Collections.unmodifiableList(new ArrayList<>(transitionsRemoved));
  }

  public String getBaselineInitial() {
    return baselineInitial;
  }

  public String getEditedInitial() {
    return editedInitial;
  }

  public boolean initialChanged() {
    return !Objects.equals(baselineInitial, editedInitial);
  }

  public List<String> getStatesAdded() {
    return statesAdded;
  }

  public List<String> getStatesRemoved() {
    return statesRemoved;
  }

  public List<JsonNode> getTransitionsAdded() {
    return transitionsAdded;
  }

  public List<JsonNode> getTransitionsRemoved() {
    return transitionsRemoved;
  }

  /**
   * True when the two IRs are equivalent: same initial, same states, same transitions.
   */
  public boolean isEmpty() {
    return !initialChanged() && statesAdded.isEmpty() && statesRemoved.isEmpty()
        && transitionsAdded.isEmpty() && transitionsRemoved.isEmpty();
  }

  /**
   * Human-readable change summary, one line per kind of change; empty when nothing changed.
   */
  public List<String> summaryLines() {
    final List<String> lines = new ArrayList<>();
    if (initialChanged()) {
      lines.add("- initial: " + baselineInitial + " -> " + editedInitial);
    }
    if (!statesAdded.isEmpty()) {
      lines.add("- states added (" + statesAdded.size() + "): " + statesAdded);
    }
    if (!statesRemoved.isEmpty()) {
      lines.add("- states removed (" + statesRemoved.size() + "): " + statesRemoved);
    }
    if (!transitionsAdded.isEmpty()) {
      lines.add("- transitions added (" + transitionsAdded.size() + ")");
    }
    if (!transitionsRemoved.isEmpty()) {
      lines.add("- transitions removed (" + transitionsRemoved.size() + ")");
    }
    return lines;
  }

  public ObjectNode toJson() {
    final ObjectNode node = IrJson.nodes().objectNode();
    final ObjectNode initial = node.putObject(IrJson.INITIAL);
    initial.put("baseline", baselineInitial);
    initial.put("edited", editedInitial);
    final ArrayNode added = node.putArray("states_added");
    for (String state : statesAdded) {
      added.add(state);
    }
    final ArrayNode removed = node.putArray("states_removed");
    for (String state : statesRemoved) {
      removed.add(state);
    }
    node.putArray("transitions_added").addAll(transitionsAdded);
    node.putArray("transitions_removed").addAll(transitionsRemoved);
    return node;
  }

  @Override
  public String toString() {
    return "IrDiff [initial=" + baselineInitial + "->" + editedInitial + ", statesAdded="
        + statesAdded + ", statesRemoved=" + statesRemoved + ", transitionsAdded="
        + transitionsAdded.size() + ", transitionsRemoved=" + transitionsRemoved.size() + "]";
  }
}

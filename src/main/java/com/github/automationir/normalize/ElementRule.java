package com.github.automationir.normalize;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * A rule that rewrites the elements of one kind of list independently. The rule applies when any
 * element would change, so {@link #rewrite} has to be idempotent for the rule to settle.
 */
public abstract class ElementRule implements ShapeRule {

  /**
   * The lists an element rule can target.
   */
  public static enum Scope {
    DEVICES, STATES, TRANSITIONS, TRIGGERS, ACTIONS;
  }

  private final String name;
  private final Scope scope;

  protected ElementRule(final String name, final Scope scope) {
    this.name = name;
    this.scope = scope;
  }

  /**
   * Rewrites one element. The element is a private copy and may be modified and returned. Returns
   * an element equal to the input when nothing applies, or null to drop the element.
   */
  protected abstract JsonNode rewrite(JsonNode element, ObjectNode document);

  @Override
  public String name() {
    return name;
  }

  public Scope getScope() {
    return scope;
  }

  @Override
  public boolean appliesTo(final ObjectNode document) {
    for (Slot slot : slots(document)) {
      for (JsonNode element : slot.array()) {
        final JsonNode rewritten = rewrite(element.deepCopy(), document);
        if (rewritten == null || !rewritten.equals(element)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public ObjectNode apply(final ObjectNode document) {
    final ObjectNode copy = document.deepCopy();
    for (Slot slot : slots(copy)) {
      final ArrayNode rewritten = IrJson.nodes().arrayNode();
      for (JsonNode element : slot.array()) {
        final JsonNode replacement = rewrite(element.deepCopy(), copy);
        if (replacement != null) {
          rewritten.add(replacement);
        }
      }
      slot.parent.set(slot.field, rewritten);
    }
    return copy;
  }

  private List<Slot> slots(final ObjectNode document) {
    final List<Slot> slots = new ArrayList<>();
    if (scope == Scope.DEVICES) {
      addSlot(slots, document, IrJson.DEVICES);
      return slots;
    }
    final ObjectNode machine = ShapeSupport.stateMachine(document);
    if (machine == null) {
      return slots;
    }
    switch (scope) {
      case STATES:
        addSlot(slots, machine, IrJson.STATES);
        break;
      case TRANSITIONS:
        addSlot(slots, machine, IrJson.TRANSITIONS);
        break;
      case TRIGGERS:
      case ACTIONS:
        final String field = scope == Scope.TRIGGERS ? IrJson.TRIGGERS : IrJson.ACTIONS;
        for (ObjectNode transition : IrJson.objects(machine.get(IrJson.TRANSITIONS))) {
          addSlot(slots, transition, field);
        }
        break;
      default:
        break;
    }
    return slots;
  }

  private static void addSlot(final List<Slot> slots, final ObjectNode parent,
      final String field) {
    final JsonNode array = parent.get(field);
    if (array != null && array.isArray()) {
      slots.add(new Slot(parent, field));
    }
  }

  private static final class Slot {
    private final ObjectNode parent;
    private final String field;

    private Slot(final ObjectNode parent, final String field) {
      this.parent = parent;
      this.field = field;
    }

    private JsonNode array() {
      return parent.get(field);
    }
  }

  @Override
  public String toString() {
    return "ElementRule [name=" + name + ", scope=" + scope + "]";
  }
}

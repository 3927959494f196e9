package com.github.automationir.normalize;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One structural rewrite of a loosely shaped IR document. A rule never mutates the document it is
 * given and, once applied, no longer applies to its own output.
 */
public interface ShapeRule {

  String name();

  boolean appliesTo(ObjectNode document);

  /**
   * A rewritten copy of the document.
   */
  ObjectNode apply(ObjectNode document);
}

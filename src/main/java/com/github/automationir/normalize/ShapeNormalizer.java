package com.github.automationir.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.catalog.DeviceCatalog;

/**
 * Best-effort coercion of a loosely shaped document into canonical IR shape. An ordered table of
 * {@link ShapeRule}s is applied until no rule matches. Normalization never fails: a shape no rule
 * understands is left as-is for the validator to report.
 */
public final class ShapeNormalizer {
  private static final Logger logger = LogManager.getLogger(ShapeNormalizer.class.getSimpleName());

  private final List<ShapeRule> rules;

  public ShapeNormalizer(final DeviceCatalog deviceCatalog) {
    this(defaultRules(deviceCatalog));
  }

  public ShapeNormalizer(final List<ShapeRule> rules) {
    this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
  }

  /**
   * The built-in rules in application order.
   */
  public static List<ShapeRule> defaultRules(final DeviceCatalog deviceCatalog) {
    final List<ShapeRule> rules = new ArrayList<>();
    // 1. devices
    rules.add(new DeviceRules.DeviceIdentifiers(deviceCatalog));
    rules.add(new DeviceRules.DeviceObjects(deviceCatalog));
    rules.add(new DeviceRules.DeviceInference(deviceCatalog));
    // 2. states and initial pointer
    rules.add(new StateRules.StateIdentifiers());
    rules.add(new StateRules.StateObjects());
    rules.add(new StateRules.InitialDefault());
    // 3. transition keys
    rules.add(new TransitionRules.EndpointAliases());
    rules.add(new TransitionRules.SingularLists());
    rules.add(new TransitionRules.EndpointFallback());
    rules.add(new TransitionRules.ListDefaults());
    // 4. trigger and action variants
    rules.add(new TriggerCoercion());
    rules.add(new ActionCoercion(deviceCatalog));
    return rules;
  }

  public List<ShapeRule> getRules() {
    return rules;
  }

  /**
   * A normalized copy of the document. Anything that is not a JSON object is returned unchanged.
   */
  public JsonNode normalize(final JsonNode raw) {
    if (raw == null || !raw.isObject()) {
      return raw;
    }
    ObjectNode document = ((ObjectNode) raw).deepCopy();
    final Set<String> failed = new HashSet<>();
    final int maxPasses = rules.size() + 1;
    for (int pass = 1; pass <= maxPasses; pass++) {
      boolean applied = false;
      for (ShapeRule rule : rules) {
        if (failed.contains(rule.name())) {
          continue;
        }
        try {
          if (rule.appliesTo(document)) {
            document = rule.apply(document);
            applied = true;
            logger.debug("pass {}: applied {}", pass, rule.name());
          }
        } catch (RuntimeException problem) {
          failed.add(rule.name());
          logger.warn("Rule {} failed and is skipped for this document", rule.name(), problem);
        }
      }
      if (!applied) {
        return document;
      }
    }
    logger.error("Shape rules did not settle after {} passes, returning the last rewrite",
        maxPasses);
    return document;
  }
}

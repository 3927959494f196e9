package com.github.automationir.validate;

import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.catalog.CapabilityCatalog;
import com.github.automationir.catalog.DeviceCatalog;
import com.github.automationir.model.Automation;
import com.github.automationir.model.IrReader;

/**
 * Two-phase validation of an IR tree. Structural conformance is checked first; semantic checks only
 * run on a conformant tree since they rely on its shape.
 */
public final class AutomationValidator {
  private static final Logger logger =
      LogManager.getLogger(AutomationValidator.class.getSimpleName());

  private final IrSchema schema;
  private final SemanticValidator semanticValidator;

  public AutomationValidator(final IrSchema schema, final DeviceCatalog deviceCatalog,
      final CapabilityCatalog capabilityCatalog) {
    this.schema = schema;
    this.semanticValidator = new SemanticValidator(deviceCatalog, capabilityCatalog);
  }

  public ValidationReport validate(final JsonNode ir) {
    final List<Diagnostic> structural = checkStructure(ir);
    if (!structural.isEmpty()) {
      return new ValidationReport(structural, Collections.<NormalizationPatch>emptyList());
    }
    return checkSemantics(IrReader.readAutomation(ir));
  }

  /**
   * Phase one only. An empty list means the tree can be read into the typed model.
   */
  public List<Diagnostic> checkStructure(final JsonNode ir) {
    final List<Diagnostic> violations = schema.check(ir);
    if (!violations.isEmpty()) {
      logger.debug("{} structural violation(s), first at {}", violations.size(),
          violations.get(0).getPath());
    }
    return violations;
  }

  /**
   * Phase two only, over an automation read from a conformant tree.
   */
  public ValidationReport checkSemantics(final Automation automation) {
    final ValidationReport report = semanticValidator.validate(automation);
    logger.debug("semantic validation: {}", report);
    return report;
  }
}

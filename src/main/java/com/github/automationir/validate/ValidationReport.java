package com.github.automationir.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * Outcome of validating one IR: every diagnostic found, never truncated, plus any informational
 * normalization patches. The report is ok iff no diagnostic is an error.
 */
public final class ValidationReport {
  private final List<Diagnostic> diagnostics;
  private final List<NormalizationPatch> patches;

  public ValidationReport(final List<Diagnostic> diagnostics,
      final List<NormalizationPatch> patches) {
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    this.patches = Collections.unmodifiableList(new ArrayList<>(patches));
  }

  /**
   * A report whose diagnostics are the given ones followed by this report's.
   */
  public ValidationReport prepend(final List<Diagnostic> earlier) {
    final List<Diagnostic> all = new ArrayList<>(earlier);
    all.addAll(diagnostics);
    return new ValidationReport(all, patches);
  }

  public boolean isOk() {
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        return false;
      }
    }
    return true;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public List<NormalizationPatch> getPatches() {
    return patches;
  }

  public List<Diagnostic> errors() {
    final List<Diagnostic> errors = new ArrayList<>();
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        errors.add(diagnostic);
      }
    }
    return errors;
  }

  public List<Diagnostic> warnings() {
    final List<Diagnostic> warnings = new ArrayList<>();
    for (Diagnostic diagnostic : diagnostics) {
      if (!diagnostic.isError()) {
        warnings.add(diagnostic);
      }
    }
    return warnings;
  }

  /**
   * Diagnostics carrying the given wire code.
   */
  public List<Diagnostic> withCode(final String codeValue) {
    final List<Diagnostic> matches = new ArrayList<>();
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.getCodeValue().equals(codeValue)) {
        matches.add(diagnostic);
      }
    }
    return matches;
  }

  public ObjectNode toJson() {
    final ObjectNode node = IrJson.nodes().objectNode();
    node.put("ok", isOk());
    final ArrayNode diagnosticsNode = node.putArray("diagnostics");
    for (Diagnostic diagnostic : diagnostics) {
      diagnosticsNode.add(diagnostic.toJson());
    }
    final ArrayNode patchesNode = node.putArray("patches");
    for (NormalizationPatch patch : patches) {
      patchesNode.add(patch.toJson());
    }
    return node;
  }

  @Override
  public String toString() {
    return "ValidationReport [ok=" + isOk() + ", errors=" + errors().size() + ", warnings="
        + warnings().size() + ", patches=" + patches.size() + "]";
  }
}

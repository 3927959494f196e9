package com.github.automationir;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.model.Automation;
import com.github.automationir.validate.ValidationReport;

/**
 * This object encapsulates the outcome of running a document through the compiler pipeline.
 * 
 * The canonical IR is always present. The typed {@link #getAutomation() automation} is absent when
 * the document failed structural validation, and the {@link #getDiagram() diagram} is present only
 * when the report is ok.
 */
public final class CompilationResult {
  private final JsonNode ir;
  private final Automation automation;
  private final ValidationReport report;
  private final String diagram;

  public CompilationResult(final JsonNode ir, final Automation automation,
      final ValidationReport report, final String diagram) {
    this.ir = ir;
    this.automation = automation;
    this.report = report;
    this.diagram = diagram;
  }

  public JsonNode getIr() {
    return ir;
  }

  public Automation getAutomation() {
    return automation;
  }

  public ValidationReport getReport() {
    return report;
  }

  public String getDiagram() {
    return diagram;
  }

  public boolean isOk() {
    return report.isOk();
  }

  @Override
  public String toString() {
    return "CompilationResult [ok=" + isOk() + ", diagnostics=" + report.getDiagnostics().size()
        + ", patches=" + report.getPatches().size() + ", diagram=" + (diagram != null) + "]";
  }
}

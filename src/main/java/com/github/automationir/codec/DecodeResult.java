package com.github.automationir.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.Automation;
import com.github.automationir.model.IrWriter;
import com.github.automationir.validate.Diagnostic;

/**
 * Outcome of decoding diagram text: the best-effort automation plus every diagnostic collected
 * along the way, in line order.
 */
public final class DecodeResult {
  private final Automation automation;
  private final List<Diagnostic> diagnostics;

  public DecodeResult(final Automation automation, final List<Diagnostic> diagnostics) {
    this.automation = automation;
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public Automation getAutomation() {
    return automation;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public boolean hasErrors() {
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        return true;
      }
    }
    return false;
  }

  /**
   * The decoded automation as an IR tree.
   */
  public ObjectNode toJson() {
    return IrWriter.write(automation);
  }

  @Override
  public String toString() {
    return "DecodeResult [automation=" + automation + ", diagnostics=" + diagnostics + "]";
  }
}

package com.github.automationir;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.codec.DecodeResult;
import com.github.automationir.model.Automation;
import com.github.automationir.patch.IrDiff;
import com.github.automationir.patch.PatchDocument;

/**
 * Compiler core for smart-home automations expressed as state machines. Raw documents are coerced
 * into canonical IR shape, inline delays are desugared into timer states, the result is validated
 * against the device and capability catalogs, and a clean automation is rendered as editable
 * state-diagram text.
 * 
 * Notes for users:<br>
 * 1. every operation works on its own copy of the input; nothing the caller passes in is
 * mutated.<br>
 * 
 * 2. a compiler holds no per-document state, so a single instance may be shared by threads
 * compiling independent documents.<br>
 * 
 * 3. validation problems come back as diagnostics in the result; only patch application and
 * configuration problems are raised as {@link AutomationException}.<br>
 */
public interface AutomationCompiler {

  ///// Pipeline /////
  /**
   * Normalize, desugar and validate a raw document, and render it when the report is ok.
   */
  CompilationResult compile(final JsonNode rawDocument);

  /**
   * Decode diagram text into a best-effort automation with its parse diagnostics.
   */
  DecodeResult decode(final String diagramText);

  /**
   * Decode diagram text and compile the result. Decode diagnostics precede the validator's.
   */
  CompilationResult roundTrip(final String diagramText);

  /**
   * Render an automation as diagram text with the configured title.
   */
  String render(final Automation automation);


  ///// Editing /////
  /**
   * Apply a patch to a parent IR and return the raw patched document. The parent is untouched.
   */
  JsonNode applyPatch(final JsonNode parentIr, final PatchDocument patch)
      throws AutomationException;

  /**
   * Apply a patch and compile the patched document.
   */
  CompilationResult edit(final JsonNode parentIr, final PatchDocument patch)
      throws AutomationException;

  /**
   * Structural difference between two IRs.
   */
  IrDiff diff(final JsonNode baseline, final JsonNode edited);


  ///// Compiler instance /////
  /**
   * Reports the id of this compiler instance.
   */
  String getId();

  /**
   * Returns the config that this compiler is wired with.
   */
  CompilerConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build compilers.
   */
  public final static class AutomationCompilerBuilder {
    private CompilerConfiguration config;

    public static AutomationCompilerBuilder newBuilder() {
      return new AutomationCompilerBuilder();
    }

    public AutomationCompilerBuilder config(final CompilerConfiguration config) {
      this.config = config;
      return this;
    }

    public AutomationCompiler build() throws AutomationException {
      return new AutomationCompilerImpl(config);
    }

    private AutomationCompilerBuilder() {}
  }

}

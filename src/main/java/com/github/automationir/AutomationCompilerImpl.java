package com.github.automationir;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.AutomationException.Code;
import com.github.automationir.codec.DecodeResult;
import com.github.automationir.codec.DiagramDecoder;
import com.github.automationir.codec.DiagramEncoder;
import com.github.automationir.model.Automation;
import com.github.automationir.model.IrReader;
import com.github.automationir.model.IrWriter;
import com.github.automationir.normalize.LiteralSynonyms;
import com.github.automationir.normalize.ShapeNormalizer;
import com.github.automationir.patch.IrDiff;
import com.github.automationir.patch.IrDiffer;
import com.github.automationir.patch.PatchDocument;
import com.github.automationir.patch.PatchEngine;
import com.github.automationir.transform.DelayDesugarer;
import com.github.automationir.validate.AutomationValidator;
import com.github.automationir.validate.Diagnostic;
import com.github.automationir.validate.IrSchema;
import com.github.automationir.validate.NormalizationPatch;
import com.github.automationir.validate.ValidationReport;

/**
 * Default compiler wiring the pipeline stages together.
 * 
 * Notes for users:<br>
 * 1. the stages run in a fixed order: shape normalization, literal synonyms, structural
 * validation, typed read, delay desugaring, semantic validation, rendering.<br>
 * 
 * 2. semantic checks are skipped entirely when the document is not structurally conformant; the
 * result then carries only the structural diagnostics and no typed automation.<br>
 * 
 * 3. all collaborators are immutable, so this compiler is thread-safe.<br>
 */
public final class AutomationCompilerImpl implements AutomationCompiler {
  private static final Logger logger =
      LogManager.getLogger(AutomationCompilerImpl.class.getSimpleName());

  private final String compilerId = UUID.randomUUID().toString();

  private final CompilerConfiguration config;
  private final ShapeNormalizer normalizer;
  private final LiteralSynonyms synonyms = new LiteralSynonyms();
  private final AutomationValidator validator;
  private final DelayDesugarer desugarer = new DelayDesugarer();
  private final DiagramEncoder encoder;
  private final DiagramDecoder decoder = new DiagramDecoder();
  private final PatchEngine patchEngine = new PatchEngine();

  AutomationCompilerImpl(final CompilerConfiguration config) throws AutomationException {
    if (config == null) {
      throw new AutomationException(Code.INVALID_CONFIGURATION,
          "CompilerConfiguration cannot be null");
    }
    this.config = config;
    this.normalizer = new ShapeNormalizer(config.getDeviceCatalog());
    this.validator = new AutomationValidator(IrSchema.canonical(), config.getDeviceCatalog(),
        config.getCapabilityCatalog());
    this.encoder = new DiagramEncoder(config.getDiagramTitle());
    logInfo(compilerId, "Fired up compiler with " + config);
  }

  @Override
  public CompilationResult compile(final JsonNode rawDocument) {
    JsonNode document = normalizer.normalize(rawDocument);
    if (config.getNormalizeLiterals()) {
      document = synonyms.normalize(document);
    }
    logDebug(compilerId, "Normalized document");

    final List<Diagnostic> structural = validator.checkStructure(document);
    if (!structural.isEmpty()) {
      logInfo(compilerId,
          "Document failed structural validation with " + structural.size() + " diagnostics");
      return new CompilationResult(document, null,
          new ValidationReport(structural, Collections.<NormalizationPatch>emptyList()), null);
    }

    Automation automation = IrReader.readAutomation(document);
    if (config.getDesugarDelays()) {
      automation = desugarer.desugar(automation);
    }
    final ValidationReport report = validator.checkSemantics(automation);
    final String diagram = report.isOk() ? encoder.encode(automation) : null;
    logInfo(compilerId, "Compiled automation, ok=" + report.isOk() + ", errors="
        + report.errors().size() + ", warnings=" + report.warnings().size());
    return new CompilationResult(IrWriter.write(automation), automation, report, diagram);
  }

  @Override
  public DecodeResult decode(final String diagramText) {
    final DecodeResult decoded = decoder.decode(diagramText);
    if (decoded.hasErrors()) {
      logWarning(compilerId,
          "Diagram decoded with errors: " + decoded.getDiagnostics().size() + " diagnostics");
    }
    return decoded;
  }

  @Override
  public CompilationResult roundTrip(final String diagramText) {
    final DecodeResult decoded = decode(diagramText);
    final CompilationResult compiled = compile(decoded.toJson());
    final ValidationReport report = compiled.getReport().prepend(decoded.getDiagnostics());
    final String diagram = report.isOk() ? compiled.getDiagram() : null;
    return new CompilationResult(compiled.getIr(), compiled.getAutomation(), report, diagram);
  }

  @Override
  public String render(final Automation automation) {
    return encoder.encode(automation);
  }

  @Override
  public JsonNode applyPatch(final JsonNode parentIr, final PatchDocument patch)
      throws AutomationException {
    try {
      final JsonNode patched = patchEngine.apply(parentIr, patch);
      logInfo(compilerId, "Applied " + patch.getEdits().size() + " edits"
          + (patch.getSummary() == null ? "" : ": " + patch.getSummary()));
      return patched;
    } catch (AutomationException problem) {
      logWarning(compilerId, "Rejected patch: " + problem.getMessage());
      throw problem;
    }
  }

  @Override
  public CompilationResult edit(final JsonNode parentIr, final PatchDocument patch)
      throws AutomationException {
    final CompilationResult result = compile(applyPatch(parentIr, patch));
    if (logger.isInfoEnabled()) {
      final List<String> changes = diff(parentIr, result.getIr()).summaryLines();
      logInfo(compilerId, changes.isEmpty() ? "Edit made no structural changes"
          : "Edit changes: " + String.join("; ", changes));
    }
    return result;
  }

  @Override
  public IrDiff diff(final JsonNode baseline, final JsonNode edited) {
    return IrDiffer.diff(baseline, edited);
  }

  @Override
  public String getId() {
    return compilerId;
  }

  @Override
  public CompilerConfiguration getConfiguration() {
    return config;
  }

  private static void logWarning(final String compilerId, final String message) {
    logger.warn(new StringBuilder().append("[c:").append(compilerId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String compilerId, final String message) {
    logger.info(new StringBuilder().append("[c:").append(compilerId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String compilerId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[c:").append(compilerId).append("] ")
          .append(message).toString());
    }
  }
}

package com.github.automationir;

import com.github.automationir.catalog.CapabilityCatalog;
import com.github.automationir.catalog.DeviceCatalog;
import com.github.automationir.codec.DiagramEncoder;

/**
 * This class encapsulates all the configuration parameters for the compiler. Use the
 * {@code CompilerConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. both catalogs are required; they are read-only once loaded and may be shared by any number of
 * compilers.<br>
 * 2. the diagram title defaults to {@value DiagramEncoder#DEFAULT_TITLE}.<br>
 * 3. literal-synonym normalization and delay desugaring are on unless switched off.<br>
 */
public final class CompilerConfiguration {
  private final DeviceCatalog deviceCatalog;
  private final CapabilityCatalog capabilityCatalog;
  private final String diagramTitle;
  private final boolean normalizeLiterals;
  private final boolean desugarDelays;

  public DeviceCatalog getDeviceCatalog() {
    return deviceCatalog;
  }

  public CapabilityCatalog getCapabilityCatalog() {
    return capabilityCatalog;
  }

  public String getDiagramTitle() {
    return diagramTitle;
  }

  public boolean getNormalizeLiterals() {
    return normalizeLiterals;
  }

  public boolean getDesugarDelays() {
    return desugarDelays;
  }

  public final static class CompilerConfigurationBuilder {
    private DeviceCatalog deviceCatalog;
    private CapabilityCatalog capabilityCatalog;
    private String diagramTitle = DiagramEncoder.DEFAULT_TITLE;
    private boolean normalizeLiterals = true;
    private boolean desugarDelays = true;

    public static CompilerConfigurationBuilder newBuilder() {
      return new CompilerConfigurationBuilder();
    }

    public CompilerConfigurationBuilder deviceCatalog(final DeviceCatalog deviceCatalog) {
      this.deviceCatalog = deviceCatalog;
      return this;
    }

    public CompilerConfigurationBuilder capabilityCatalog(
        final CapabilityCatalog capabilityCatalog) {
      this.capabilityCatalog = capabilityCatalog;
      return this;
    }

    public CompilerConfigurationBuilder diagramTitle(final String diagramTitle) {
      this.diagramTitle = diagramTitle;
      return this;
    }

    public CompilerConfigurationBuilder normalizeLiterals(final boolean normalizeLiterals) {
      this.normalizeLiterals = normalizeLiterals;
      return this;
    }

    public CompilerConfigurationBuilder desugarDelays(final boolean desugarDelays) {
      this.desugarDelays = desugarDelays;
      return this;
    }

    public CompilerConfiguration build() throws AutomationException {
      final CompilerConfiguration config = new CompilerConfiguration(deviceCatalog,
          capabilityCatalog, diagramTitle, normalizeLiterals, desugarDelays);
      config.validate();
      return config;
    }

    private CompilerConfigurationBuilder() {}
  }

  private void validate() throws AutomationException {
    StringBuilder messages = new StringBuilder();
    if (deviceCatalog == null) {
      messages.append("DeviceCatalog cannot be null. ");
    }
    if (capabilityCatalog == null) {
      messages.append("CapabilityCatalog cannot be null. ");
    }
    if (diagramTitle == null || diagramTitle.trim().isEmpty()) {
      messages.append("Diagram title cannot be blank. ");
    }
    if (messages.length() > 0) {
      throw new AutomationException(AutomationException.Code.INVALID_CONFIGURATION,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "CompilerConfiguration [deviceCatalog=" + deviceCatalog + ", capabilityCatalog="
        + capabilityCatalog + ", diagramTitle=" + diagramTitle + ", normalizeLiterals="
        + normalizeLiterals + ", desugarDelays=" + desugarDelays + "]";
  }

  private CompilerConfiguration(final DeviceCatalog deviceCatalog,
      final CapabilityCatalog capabilityCatalog, final String diagramTitle,
      final boolean normalizeLiterals, final boolean desugarDelays) {
    this.deviceCatalog = deviceCatalog;
    this.capabilityCatalog = capabilityCatalog;
    this.diagramTitle = diagramTitle;
    this.normalizeLiterals = normalizeLiterals;
    this.desugarDelays = desugarDelays;
  }

}

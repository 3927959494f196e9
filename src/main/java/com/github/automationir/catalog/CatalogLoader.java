package com.github.automationir.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.AutomationException;
import com.github.automationir.AutomationException.Code;
import com.github.automationir.model.IrJson;

/**
 * Loads device and capability catalogs, either the defaults bundled on the classpath or files
 * supplied by the installation.
 */
public final class CatalogLoader {
  private static final Logger logger = LogManager.getLogger(CatalogLoader.class.getSimpleName());

  public static final String DEFAULT_DEVICE_CATALOG = "catalog/device_catalog.json";
  public static final String DEFAULT_CAPABILITY_CATALOG = "catalog/capability_catalog.json";

  public static DeviceCatalog defaultDeviceCatalog() throws AutomationException {
    return DeviceCatalog.fromJson(readResource(DEFAULT_DEVICE_CATALOG));
  }

  public static CapabilityCatalog defaultCapabilityCatalog() throws AutomationException {
    return CapabilityCatalog.fromJson(readResource(DEFAULT_CAPABILITY_CATALOG));
  }

  public static DeviceCatalog deviceCatalog(final Path file) throws AutomationException {
    return DeviceCatalog.fromJson(readFile(file));
  }

  public static CapabilityCatalog capabilityCatalog(final Path file) throws AutomationException {
    return CapabilityCatalog.fromJson(readFile(file));
  }

  static JsonNode readResource(final String resource) throws AutomationException {
    final InputStream stream = CatalogLoader.class.getClassLoader().getResourceAsStream(resource);
    if (stream == null) {
      throw new AutomationException(Code.CATALOG_LOAD_FAILURE,
          "Catalog resource not found on classpath: " + resource);
    }
    try (InputStream in = stream) {
      final JsonNode root = IrJson.mapper().readTree(in);
      logger.debug("Loaded catalog resource " + resource);
      return requireObject(root, resource);
    } catch (IOException exception) {
      throw new AutomationException(Code.CATALOG_LOAD_FAILURE,
          "Failed to read catalog resource " + resource, exception);
    }
  }

  static JsonNode readFile(final Path file) throws AutomationException {
    try (InputStream in = Files.newInputStream(file)) {
      final JsonNode root = IrJson.mapper().readTree(in);
      logger.info("Loaded catalog file " + file);
      return requireObject(root, file.toString());
    } catch (IOException exception) {
      throw new AutomationException(Code.CATALOG_LOAD_FAILURE,
          "Failed to read catalog file " + file, exception);
    }
  }

  private static JsonNode requireObject(final JsonNode root, final String source)
      throws AutomationException {
    if (root == null || !root.isObject()) {
      throw new AutomationException(Code.CATALOG_LOAD_FAILURE,
          "Catalog " + source + " must hold a JSON object");
    }
    return root;
  }

  private CatalogLoader() {}
}

package com.github.automationir.catalog;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.automationir.AutomationException;
import com.github.automationir.AutomationException.Code;
import com.github.automationir.catalog.CapabilityCatalog.KindSpec;

/**
 * Tests to check loading the device and capability catalogs.
 */
public class CatalogLoaderTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testDefaultCatalogs() throws AutomationException {
    // 1. devices, globals included
    final DeviceCatalog devices = CatalogLoader.defaultDeviceCatalog();
    assertEquals("switch", devices.kindOf("light_hall"));
    assertEquals("motionSensor", devices.kindOf("motion_hall"));
    assertEquals("location", devices.kindOf("location"));
    assertNull(devices.kindOf("lite_hall"));
    assertTrue(devices.sortedIds().indexOf("alarm_home") < devices.sortedIds()
        .indexOf("light_hall"));

    // 2. capabilities and value sets
    final CapabilityCatalog capabilities = CatalogLoader.defaultCapabilityCatalog();
    final KindSpec motionSensor = capabilities.kind("motionSensor");
    assertNotNull(motionSensor);
    assertEquals(Arrays.asList("active", "inactive"),
        capabilities.enumValues(motionSensor.attribute("motion")));
    final KindSpec dimmer = capabilities.kind("dimmer");
    assertNull(capabilities.enumValues(dimmer.attribute("level")));
    assertTrue(dimmer.hasCommand("setLevel"));
    assertFalse(dimmer.hasCommand("lock"));
    assertEquals(Arrays.asList("off", "on", "setLevel"), dimmer.sortedCommandNames());
    assertNull(capabilities.kind("toaster"));
  }

  @Test
  public void testCatalogsFromFiles() throws Exception {
    // 1. write a small pair of catalogs
    final File deviceFile = folder.newFile("devices.json");
    Files.write(deviceFile.toPath(),
        "{\"devices\":[{\"id\":\"fan_attic\",\"kind\":\"fan\"},{\"id\":\"broken\"}]}"
            .getBytes(StandardCharsets.UTF_8));
    final File capabilityFile = folder.newFile("capabilities.json");
    Files.write(capabilityFile.toPath(),
        ("{\"kinds\":{\"fan\":{\"attributes\":{\"speed\":{\"type\":\"enum\",\"valuesFrom\":\"s\"}},"
            + "\"commands\":{\"spin\":{}}}},\"valueSets\":{\"s\":[\"low\",\"high\"],\"bad\":[1]}}")
                .getBytes(StandardCharsets.UTF_8));

    // 2. entries without a kind are skipped, non-string value sets are ignored
    final DeviceCatalog devices = CatalogLoader.deviceCatalog(deviceFile.toPath());
    assertEquals(Arrays.asList("fan_attic"), devices.sortedIds());
    final CapabilityCatalog capabilities = CatalogLoader.capabilityCatalog(capabilityFile.toPath());
    final KindSpec fan = capabilities.kind("fan");
    assertEquals(Arrays.asList("low", "high"), capabilities.enumValues(fan.attribute("speed")));
    assertTrue(fan.hasCommand("spin"));
  }

  @Test
  public void testUnreadableCatalogs() throws Exception {
    // 1. missing file
    try {
      CatalogLoader.deviceCatalog(new File(folder.getRoot(), "absent.json").toPath());
      fail("expected a load failure");
    } catch (AutomationException expected) {
      assertEquals(Code.CATALOG_LOAD_FAILURE, expected.getCode());
    }

    // 2. a JSON array is not a catalog
    final File arrayFile = folder.newFile("array.json");
    Files.write(arrayFile.toPath(), "[1,2]".getBytes(StandardCharsets.UTF_8));
    try {
      CatalogLoader.capabilityCatalog(arrayFile.toPath());
      fail("expected a load failure");
    } catch (AutomationException expected) {
      assertEquals(Code.CATALOG_LOAD_FAILURE, expected.getCode());
    }
  }
}

package com.github.automationir.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.model.IrJson;

/**
 * Read-only catalog of the devices an installation has, {@code {devices:[{id,kind}],
 * globals:[{id,kind}]}}. Globals are pseudo-devices such as the hub's mode and are looked up exactly
 * like devices.
 */
public final class DeviceCatalog {
  private final Map<String, String> kindsById;

  private DeviceCatalog(final Map<String, String> kindsById) {
    this.kindsById = Collections.unmodifiableMap(new LinkedHashMap<>(kindsById));
  }

  public static DeviceCatalog fromJson(final JsonNode root) {
    final Map<String, String> kindsById = new LinkedHashMap<>();
    collect(root == null ? null : root.get("devices"), kindsById);
    collect(root == null ? null : root.get("globals"), kindsById);
    return new DeviceCatalog(kindsById);
  }

  public static DeviceCatalog of(final Map<String, String> kindsById) {
    return new DeviceCatalog(kindsById);
  }

  private static void collect(final JsonNode entries, final Map<String, String> kindsById) {
    for (JsonNode entry : IrJson.objects(entries)) {
      final JsonNode id = entry.get("id");
      final JsonNode kind = entry.get("kind");
      if (id != null && kind != null && !id.isNull() && !kind.isNull()) {
        kindsById.put(id.asText(), kind.asText());
      }
    }
  }

  public boolean contains(final String deviceId) {
    return kindsById.containsKey(deviceId);
  }

  /**
   * Kind of the device or null when the catalog does not know it.
   */
  public String kindOf(final String deviceId) {
    return kindsById.get(deviceId);
  }

  /**
   * All known device ids, sorted.
   */
  public List<String> sortedIds() {
    final List<String> ids = new ArrayList<>(kindsById.keySet());
    Collections.sort(ids);
    return ids;
  }

  public Map<String, String> asMap() {
    return kindsById;
  }

  @Override
  public String toString() {
    return "DeviceCatalog " + kindsById;
  }
}

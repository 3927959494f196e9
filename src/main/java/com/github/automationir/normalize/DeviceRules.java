package com.github.automationir.normalize;

import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.catalog.DeviceCatalog;
import com.github.automationir.model.Device;
import com.github.automationir.model.IrJson;

/**
 * Rules for the top-level device list.
 */
final class DeviceRules {

  /**
   * Bare device identifiers become {@code {id, kind}} objects.
   */
  static final class DeviceIdentifiers extends ElementRule {
    private final DeviceCatalog catalog;

    DeviceIdentifiers(final DeviceCatalog catalog) {
      super("device-identifiers", Scope.DEVICES);
      this.catalog = catalog;
    }

    @Override
    protected JsonNode rewrite(JsonNode element, ObjectNode document) {
      if (!element.isTextual()) {
        return element;
      }
      final String id = element.textValue();
      return IrJson.nodes().objectNode().put(IrJson.ID, id).put(IrJson.KIND, kindOf(catalog, id));
    }
  }

  /**
   * {@code name} stands in for a missing {@code id}; a missing or unknown kind is taken from the
   * catalog.
   */
  static final class DeviceObjects extends ElementRule {
    private final DeviceCatalog catalog;

    DeviceObjects(final DeviceCatalog catalog) {
      super("device-objects", Scope.DEVICES);
      this.catalog = catalog;
    }

    @Override
    protected JsonNode rewrite(JsonNode element, ObjectNode document) {
      if (!element.isObject()) {
        return element;
      }
      final ObjectNode device = (ObjectNode) element;
      if (!device.has(IrJson.ID) && device.has("name")) {
        device.set(IrJson.ID, device.remove("name"));
      }
      final String id = IrJson.text(device, IrJson.ID);
      if (id == null) {
        return device;
      }
      final JsonNode kind = device.get(IrJson.KIND);
      if (kind == null) {
        device.put(IrJson.KIND, kindOf(catalog, id));
      } else if (Device.UNKNOWN_KIND.equals(kind.asText()) && catalog.contains(id)) {
        device.put(IrJson.KIND, catalog.kindOf(id));
      }
      return device;
    }
  }

  /**
   * A missing or empty device list is inferred from the devices that triggers and actions refer
   * to, sorted by id.
   */
  static final class DeviceInference implements ShapeRule {
    private final DeviceCatalog catalog;

    DeviceInference(final DeviceCatalog catalog) {
      this.catalog = catalog;
    }

    @Override
    public String name() {
      return "device-inference";
    }

    @Override
    public boolean appliesTo(final ObjectNode document) {
      return lacksDevices(document) && !inferred(document).isEmpty();
    }

    @Override
    public ObjectNode apply(final ObjectNode document) {
      final ObjectNode copy = document.deepCopy();
      final ArrayNode devices = copy.putArray(IrJson.DEVICES);
      for (Map.Entry<String, String> entry : inferred(document).entrySet()) {
        devices.addObject().put(IrJson.ID, entry.getKey()).put(IrJson.KIND, entry.getValue());
      }
      return copy;
    }

    private static boolean lacksDevices(final ObjectNode document) {
      final JsonNode devices = document.get(IrJson.DEVICES);
      return devices == null || !devices.isArray() || devices.size() == 0;
    }

    private Map<String, String> inferred(final ObjectNode document) {
      final Map<String, String> found = new TreeMap<>();
      final ObjectNode machine = ShapeSupport.stateMachine(document);
      if (machine == null) {
        return found;
      }
      for (ObjectNode transition : IrJson.objects(machine.get(IrJson.TRANSITIONS))) {
        collect(transition, IrJson.TRIGGERS, "trigger", found);
        collect(transition, IrJson.ACTIONS, "action", found);
      }
      return found;
    }

    private void collect(final ObjectNode transition, final String plural, final String singular,
        final Map<String, String> found) {
      JsonNode list = transition.get(plural);
      if (list == null || !(list.isArray() || list.isObject())) {
        list = transition.get(singular);
      }
      for (JsonNode element : ShapeSupport.listLike(list)) {
        if (!element.isObject()) {
          continue;
        }
        String id = ShapeSupport.deviceId(element);
        if (id == null && element.has(IrJson.REF)) {
          id = ShapeSupport.deviceId(element.get(IrJson.REF));
        }
        if (id != null && !found.containsKey(id)) {
          found.put(id, kindOf(catalog, id));
        }
      }
    }
  }

  private static String kindOf(final DeviceCatalog catalog, final String id) {
    final String kind = catalog.kindOf(id);
    return kind != null ? kind : Device.UNKNOWN_KIND;
  }

  private DeviceRules() {}
}

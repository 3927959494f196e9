package com.github.automationir.model;

import java.util.Objects;

/**
 * Reference to a device attribute, {@code <device>.<path>}.
 */
public final class DeviceRef {
  private final String device;
  private final String path;

  public DeviceRef(final String device, final String path) {
    this.device = Objects.requireNonNull(device, "device");
    this.path = Objects.requireNonNull(path, "path");
  }

  public String getDevice() {
    return device;
  }

  public String getPath() {
    return path;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DeviceRef)) {
      return false;
    }
    DeviceRef other = (DeviceRef) o;
    return device.equals(other.device) && path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(device, path);
  }

  @Override
  public String toString() {
    return device + "." + path;
  }
}

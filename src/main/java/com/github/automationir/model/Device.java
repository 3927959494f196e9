package com.github.automationir.model;

import java.util.Objects;

/**
 * A device used by an automation. The kind indexes into the capability catalog.
 */
public final class Device {
  public static final String UNKNOWN_KIND = "unknown";

  private final String id;
  private final String kind;

  public Device(final String id, final String kind) {
    this.id = Objects.requireNonNull(id, "id");
    this.kind = kind == null ? UNKNOWN_KIND : kind;
  }

  public String getId() {
    return id;
  }

  public String getKind() {
    return kind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Device)) {
      return false;
    }
    Device other = (Device) o;
    return id.equals(other.id) && kind.equals(other.kind);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, kind);
  }

  @Override
  public String toString() {
    return "Device [id=" + id + ", kind=" + kind + "]";
  }
}

package com.github.automationir.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical intermediate representation of one automation: the devices it touches and the state
 * machine describing it.
 */
public final class Automation {
  public static final String CURRENT_VERSION = "0.1";

  private final String version;
  private final List<Device> devices;
  private final StateMachineDefinition stateMachine;

  public Automation(final String version, final List<Device> devices,
      final StateMachineDefinition stateMachine) {
    this.version = version == null ? CURRENT_VERSION : version;
    this.devices = Collections.unmodifiableList(new ArrayList<>(devices));
    this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
  }

  public String getVersion() {
    return version;
  }

  public List<Device> getDevices() {
    return devices;
  }

  public StateMachineDefinition getStateMachine() {
    return stateMachine;
  }

  public Automation withStateMachine(final StateMachineDefinition stateMachine) {
    return new Automation(version, devices, stateMachine);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Automation)) {
      return false;
    }
    Automation other = (Automation) o;
    return version.equals(other.version) && devices.equals(other.devices)
        && stateMachine.equals(other.stateMachine);
  }

  @Override
  public int hashCode() {
    return Objects.hash(version, devices, stateMachine);
  }

  @Override
  public String toString() {
    return "Automation [version=" + version + ", devices=" + devices + ", stateMachine="
        + stateMachine + "]";
  }
}

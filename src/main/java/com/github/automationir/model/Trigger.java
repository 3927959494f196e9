package com.github.automationir.model;

import java.util.Objects;

/**
 * Condition that fires a transition: an attribute becoming a value, an attribute changing, a cron
 * schedule or a timer elapsing.
 */
public abstract class Trigger {
  public static final String BECOMES = "becomes";
  public static final String CHANGES = "changes";
  public static final String SCHEDULE = "schedule";
  public static final String AFTER = "after";

  private Trigger() {}

  /**
   * Wire value of the {@code type} discriminator.
   */
  public abstract String getType();

  public abstract <R> R accept(Visitor<R> visitor);

  public interface Visitor<R> {
    R visitBecomes(Becomes becomes);

    R visitChanges(Changes changes);

    R visitSchedule(Schedule schedule);

    R visitAfter(After after);
  }

  public static final class Becomes extends Trigger {
    private final DeviceRef ref;
    private final Literal value;

    public Becomes(final DeviceRef ref, final Literal value) {
      this.ref = Objects.requireNonNull(ref, "ref");
      this.value = Objects.requireNonNull(value, "value");
    }

    public DeviceRef getRef() {
      return ref;
    }

    public Literal getValue() {
      return value;
    }

    @Override
    public String getType() {
      return BECOMES;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBecomes(this);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Becomes)) {
        return false;
      }
      Becomes other = (Becomes) o;
      return ref.equals(other.ref) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(BECOMES, ref, value);
    }

    @Override
    public String toString() {
      return "Becomes [" + ref + "=" + value + "]";
    }
  }

  public static final class Changes extends Trigger {
    private final DeviceRef ref;

    public Changes(final DeviceRef ref) {
      this.ref = Objects.requireNonNull(ref, "ref");
    }

    public DeviceRef getRef() {
      return ref;
    }

    @Override
    public String getType() {
      return CHANGES;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitChanges(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Changes && ref.equals(((Changes) o).ref);
    }

    @Override
    public int hashCode() {
      return Objects.hash(CHANGES, ref);
    }

    @Override
    public String toString() {
      return "Changes [" + ref + "]";
    }
  }

  public static final class Schedule extends Trigger {
    private final String cron;

    public Schedule(final String cron) {
      this.cron = Objects.requireNonNull(cron, "cron");
    }

    public String getCron() {
      return cron;
    }

    @Override
    public String getType() {
      return SCHEDULE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSchedule(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Schedule && cron.equals(((Schedule) o).cron);
    }

    @Override
    public int hashCode() {
      return Objects.hash(SCHEDULE, cron);
    }

    @Override
    public String toString() {
      return "Schedule [" + cron + "]";
    }
  }

  public static final class After extends Trigger {
    private final int seconds;

    public After(final int seconds) {
      if (seconds < 0) {
        throw new IllegalArgumentException("after seconds must be >= 0, got " + seconds);
      }
      this.seconds = seconds;
    }

    public int getSeconds() {
      return seconds;
    }

    @Override
    public String getType() {
      return AFTER;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAfter(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof After && seconds == ((After) o).seconds;
    }

    @Override
    public int hashCode() {
      return Objects.hash(AFTER, seconds);
    }

    @Override
    public String toString() {
      return "After [" + seconds + "s]";
    }
  }
}

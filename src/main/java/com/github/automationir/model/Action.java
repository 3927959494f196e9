package com.github.automationir.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Effect executed when a transition fires: a device command, an inline delay or a notification.
 */
public abstract class Action {
  public static final String COMMAND = "command";
  public static final String DELAY = "delay";
  public static final String NOTIFY = "notify";

  private Action() {}

  /**
   * Wire value of the {@code type} discriminator.
   */
  public abstract String getType();

  public abstract <R> R accept(Visitor<R> visitor);

  public interface Visitor<R> {
    R visitCommand(Command command);

    R visitDelay(Delay delay);

    R visitNotify(Notify notify);
  }

  public static final class Command extends Action {
    private final String device;
    private final String command;
    private final List<Literal> args;

    public Command(final String device, final String command, final List<Literal> args) {
      this.device = Objects.requireNonNull(device, "device");
      this.command = Objects.requireNonNull(command, "command");
      this.args = args == null ? Collections.<Literal>emptyList()
          : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Command(final String device, final String command) {
      this(device, command, null);
    }

    public String getDevice() {
      return device;
    }

    public String getCommand() {
      return command;
    }

    public List<Literal> getArgs() {
      return args;
    }

    @Override
    public String getType() {
      return COMMAND;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCommand(this);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Command)) {
        return false;
      }
      Command other = (Command) o;
      return device.equals(other.device) && command.equals(other.command)
          && args.equals(other.args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(COMMAND, device, command, args);
    }

    @Override
    public String toString() {
      return "Command [" + device + "." + command + args + "]";
    }
  }

  public static final class Delay extends Action {
    private final int seconds;

    public Delay(final int seconds) {
      if (seconds < 0) {
        throw new IllegalArgumentException("delay seconds must be >= 0, got " + seconds);
      }
      this.seconds = seconds;
    }

    public int getSeconds() {
      return seconds;
    }

    @Override
    public String getType() {
      return DELAY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDelay(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Delay && seconds == ((Delay) o).seconds;
    }

    @Override
    public int hashCode() {
      return Objects.hash(DELAY, seconds);
    }

    @Override
    public String toString() {
      return "Delay [" + seconds + "s]";
    }
  }

  public static final class Notify extends Action {
    private final String message;

    public Notify(final String message) {
      this.message = message == null ? "" : message;
    }

    public String getMessage() {
      return message;
    }

    @Override
    public String getType() {
      return NOTIFY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNotify(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Notify && message.equals(((Notify) o).message);
    }

    @Override
    public int hashCode() {
      return Objects.hash(NOTIFY, message);
    }

    @Override
    public String toString() {
      return "Notify [" + message + "]";
    }
  }
}

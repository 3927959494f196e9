package com.github.automationir.codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automationir.model.Action;
import com.github.automationir.model.Automation;
import com.github.automationir.model.Expression;
import com.github.automationir.model.Literal;
import com.github.automationir.model.State;
import com.github.automationir.model.StateMachineDefinition;
import com.github.automationir.model.Transition;
import com.github.automationir.model.Trigger;

/**
 * Renders an automation as state-diagram text. The output is deterministic for a given input and
 * is exactly what {@link DiagramDecoder} accepts:
 *
 * <pre>
 * state "&lt;label&gt;" as &lt;id&gt;
 * [*] --> &lt;initial&gt;
 * note right of &lt;id&gt; / - &lt;invariant&gt; / end note
 * &lt;from&gt; --> &lt;to&gt; : TRIGGER: t1 AND t2\nGUARD: g\nACTION: a1\nACTION: a2
 * </pre>
 *
 * The encoder expects a validated automation; an operator with the wrong number of arguments is
 * an {@link IllegalArgumentException}.
 */
public final class DiagramEncoder {
  private static final Logger logger = LogManager.getLogger(DiagramEncoder.class.getSimpleName());

  public static final String DEFAULT_TITLE = "Automation";

  private static final List<String> EDITING_GUIDE = Collections.unmodifiableList(Arrays.asList(
      "' === Human-editable guide ===",
      "' This diagram can be edited and decoded back into the automation IR.",
      "'",
      "' Supported label lines (one per line, joined with \\n in the label):",
      "'   TRIGGER: <dev>.<attr> becomes \"value\" AND <dev>.<attr> changes AND after 30s AND schedule <cron>",
      "'   GUARD:   (<dev>.<attr> == \"value\") and not (<dev>.<attr> != \"value\")",
      "'   ACTION:  <dev>.<command>(\"arg\", 1) | delay 30s | notify \"message\"",
      "'",
      "' Rename the display label in a state declaration rather than its alias:",
      "'   state \"Hallway Light On\" as LightOn",
      "' Keep the alias (LightOn) stable so transitions remain parseable.",
      "' ============================="));

  private final String title;

  public DiagramEncoder() {
    this(DEFAULT_TITLE);
  }

  public DiagramEncoder(final String title) {
    this.title = title == null || title.trim().isEmpty() ? DEFAULT_TITLE : title;
  }

  public String getTitle() {
    return title;
  }

  public String encode(final Automation automation) {
    final StateMachineDefinition machine = automation.getStateMachine();
    final List<String> lines = new ArrayList<>();
    lines.add(DiagramSyntax.START);
    lines.add(DiagramSyntax.TITLE + " " + title);
    lines.add("");
    lines.addAll(EDITING_GUIDE);
    lines.add("");

    for (State state : machine.getStates()) {
      lines.add("state " + LiteralText.quote(state.getDisplayName()) + " as " + state.getId());
    }
    lines.add("");
    lines.add(DiagramSyntax.START_MARKER + " " + DiagramSyntax.ARROW + " " + machine.getInitial());
    lines.add("");

    for (State state : machine.getStates()) {
      if (state.getInvariants().isEmpty()) {
        continue;
      }
      lines.add("note right of " + state.getId());
      for (Expression invariant : state.getInvariants()) {
        lines.add("- " + ExpressionPrinter.print(invariant));
      }
      lines.add("end note");
      lines.add("");
    }

    for (Transition transition : machine.getTransitions()) {
      final String arrow =
          transition.getFromState() + " " + DiagramSyntax.ARROW + " " + transition.getToState();
      final String label = label(transition);
      lines.add(label.isEmpty() ? arrow : arrow + " : " + label);
    }
    lines.add(DiagramSyntax.END);
    lines.add("");
    logger.debug("Encoded {} states and {} transitions", machine.getStates().size(),
        machine.getTransitions().size());
    return String.join("\n", lines);
  }

  /**
   * Transition label segments joined by the two-character {@code \n} sequence; empty when the
   * transition has no triggers, guard or actions.
   */
  static String label(final Transition transition) {
    final List<String> segments = new ArrayList<>();
    if (!transition.getTriggers().isEmpty()) {
      final List<String> triggers = new ArrayList<>();
      for (Trigger trigger : transition.getTriggers()) {
        triggers.add(formatTrigger(trigger));
      }
      segments.add(DiagramSyntax.TRIGGER_PREFIX + " "
          + String.join(DiagramSyntax.TRIGGER_JOINER, triggers));
    }
    if (transition.getGuard() != null) {
      segments.add(DiagramSyntax.GUARD_PREFIX + " " + ExpressionPrinter.print(transition.getGuard()));
    }
    for (Action action : transition.getActions()) {
      segments.add(DiagramSyntax.ACTION_PREFIX + " " + formatAction(action));
    }
    return String.join(DiagramSyntax.LABEL_BREAK, segments);
  }

  public static String formatTrigger(final Trigger trigger) {
    return trigger.accept(new Trigger.Visitor<String>() {
      @Override
      public String visitBecomes(Trigger.Becomes becomes) {
        return becomes.getRef() + " becomes " + LiteralText.format(becomes.getValue());
      }

      @Override
      public String visitChanges(Trigger.Changes changes) {
        return changes.getRef() + " changes";
      }

      @Override
      public String visitSchedule(Trigger.Schedule schedule) {
        return "schedule " + schedule.getCron();
      }

      @Override
      public String visitAfter(Trigger.After after) {
        return "after " + after.getSeconds() + "s";
      }
    });
  }

  public static String formatAction(final Action action) {
    return action.accept(new Action.Visitor<String>() {
      @Override
      public String visitCommand(Action.Command command) {
        final List<String> args = new ArrayList<>();
        for (Literal arg : command.getArgs()) {
          args.add(LiteralText.format(arg));
        }
        return command.getDevice() + "." + command.getCommand() + "(" + String.join(", ", args)
            + ")";
      }

      @Override
      public String visitDelay(Action.Delay delay) {
        return "delay " + delay.getSeconds() + "s";
      }

      @Override
      public String visitNotify(Action.Notify notify) {
        return "notify " + LiteralText.quote(notify.getMessage());
      }
    });
  }
}

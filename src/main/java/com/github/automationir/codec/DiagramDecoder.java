package com.github.automationir.codec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automationir.model.Action;
import com.github.automationir.model.Automation;
import com.github.automationir.model.Device;
import com.github.automationir.model.Expression;
import com.github.automationir.model.State;
import com.github.automationir.model.StateMachineDefinition;
import com.github.automationir.model.Transition;
import com.github.automationir.model.Trigger;
import com.github.automationir.validate.Diagnostic;
import com.github.automationir.validate.DiagnosticCode;

/**
 * Line-oriented, tolerant reader of diagram text. It accepts everything {@link DiagramEncoder}
 * writes plus common hand edits, and never aborts: every construct that fails to parse becomes a
 * diagnostic located at {@code puml:L<n>} and decoding continues with the next one.
 *
 * Devices of the decoded automation are every device referenced by a trigger, command, guard or
 * invariant, sorted by id, with kind {@code unknown}; resolving their kinds is left to the shape
 * normalizer.
 */
public final class DiagramDecoder {
  private static final Logger logger = LogManager.getLogger(DiagramDecoder.class.getSimpleName());

  static final String FALLBACK_INITIAL = "Idle";

  private static final Pattern LINE_BREAK = Pattern.compile("\\R");
  private static final Pattern TITLE = Pattern.compile("title(?:\\s.*)?", Pattern.CASE_INSENSITIVE);
  private static final Pattern STATE_DECLARATION =
      Pattern.compile("state\\s+\"(.+?)\"\\s+as\\s+(" + DiagramSyntax.IDENTIFIER + ")");
  private static final Pattern NOTE_START = Pattern.compile(
      "note\\s+right\\s+of\\s+(" + DiagramSyntax.IDENTIFIER + ")", Pattern.CASE_INSENSITIVE);
  private static final Pattern INITIAL_MARKER =
      Pattern.compile("\\[\\*\\]\\s*-->\\s*(\"(?:[^\"\\\\]|\\\\.)*\"|[^\\s:]+)(?:\\s*:.*)?");
  private static final Pattern TRANSITION =
      Pattern.compile("(.+?)\\s*-->\\s*(.+?)(?:\\s*:\\s*(.+))?");

  public DecodeResult decode(final String text) {
    final Session session = new Session();
    final String[] lines = LINE_BREAK.split(text, -1);
    for (int i = 0; i < lines.length; i++) {
      session.line(i + 1, lines[i].trim());
    }
    final DecodeResult result = session.finish();
    logger.debug("Decoded {} lines into {} states and {} transitions with {} diagnostics",
        lines.length, result.getAutomation().getStateMachine().getStates().size(),
        result.getAutomation().getStateMachine().getTransitions().size(),
        result.getDiagnostics().size());
    return result;
  }

  /**
   * Mutable state of one decode call.
   */
  private static final class Session {
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, String> labelsById = new HashMap<>();
    private final Map<String, String> idsByLabel = new HashMap<>();
    private final Map<String, List<Expression>> invariants = new LinkedHashMap<>();
    private final Set<String> statesSeen = new LinkedHashSet<>();
    private final List<Transition> transitions = new ArrayList<>();
    private String initial;
    private boolean inNote;
    private String noteState;
    private int lineNumber;

    private void line(final int number, final String line) {
      lineNumber = number;
      if (line.isEmpty() || line.startsWith("'") || line.startsWith("//")) {
        return;
      }
      if (inNote) {
        noteLine(line);
        return;
      }
      if (line.startsWith("@")
          || TITLE.matcher(line).matches() && !line.contains(DiagramSyntax.ARROW)) {
        return;
      }

      Matcher matcher = STATE_DECLARATION.matcher(line);
      if (matcher.matches()) {
        final String label = DiagramSyntax.unescape(matcher.group(1));
        final String id = matcher.group(2);
        labelsById.put(id, label);
        idsByLabel.put(label, id);
        statesSeen.add(id);
        return;
      }
      matcher = NOTE_START.matcher(line);
      if (matcher.matches()) {
        inNote = true;
        noteState = matcher.group(1);
        statesSeen.add(noteState);
        return;
      }
      matcher = INITIAL_MARKER.matcher(line);
      if (matcher.matches()) {
        initial = resolveState(matcher.group(1));
        statesSeen.add(initial);
        return;
      }
      matcher = TRANSITION.matcher(line);
      if (matcher.matches()) {
        transition(matcher.group(1).trim(), matcher.group(2).trim(), matcher.group(3));
      }
      // anything else is ignored
    }

    private void noteLine(final String line) {
      if ("end note".equals(line.toLowerCase(Locale.ROOT))) {
        inNote = false;
        noteState = null;
        return;
      }
      if (!line.startsWith("-")) {
        return;
      }
      int start = 0;
      while (start < line.length() && line.charAt(start) == '-') {
        start++;
      }
      final String text = line.substring(start).trim();
      try {
        List<Expression> list = invariants.get(noteState);
        if (list == null) {
          list = new ArrayList<>();
          invariants.put(noteState, list);
        }
        list.add(ExpressionParser.parse(text));
      } catch (DiagramParseException problem) {
        report(DiagnosticCode.INVARIANT_PARSE_FAILURE,
            "Could not parse invariant expression: " + text + " (" + problem.getMessage() + ")");
      }
    }

    private void transition(final String fromToken, final String toToken, final String label) {
      if (DiagramSyntax.START_MARKER.equals(fromToken)
          || DiagramSyntax.START_MARKER.equals(toToken)) {
        return;
      }
      final String from = resolveState(fromToken);
      final String to = resolveState(toToken);
      statesSeen.add(from);
      statesSeen.add(to);

      final Transition.TransitionBuilder builder =
          Transition.TransitionBuilder.newBuilder().from(from).to(to);
      if (label == null || label.trim().isEmpty()) {
        report(DiagnosticCode.MISSING_TRANSITION_LABEL, "Transition '" + from + " --> " + to
            + "' has no label; triggers and actions will be empty.");
        transitions.add(builder.build());
        return;
      }
      for (String segment : DiagramSyntax.splitOutsideQuotes(label,
          DiagramSyntax.LABEL_BREAK)) {
        if (segment.startsWith(DiagramSyntax.TRIGGER_PREFIX)) {
          final String triggers = segment.substring(DiagramSyntax.TRIGGER_PREFIX.length());
          for (String chunk : DiagramSyntax.splitOutsideQuotes(triggers,
              DiagramSyntax.TRIGGER_JOINER)) {
            try {
              builder.trigger(TriggerParser.parse(chunk));
            } catch (DiagramParseException problem) {
              report(DiagnosticCode.TRIGGER_PARSE_FAILURE,
                  "Could not parse trigger: " + chunk + " (" + problem.getMessage() + ")");
            }
          }
        } else if (segment.startsWith(DiagramSyntax.GUARD_PREFIX)) {
          final String guard = segment.substring(DiagramSyntax.GUARD_PREFIX.length()).trim();
          try {
            builder.guard(ExpressionParser.parse(guard));
          } catch (DiagramParseException problem) {
            report(DiagnosticCode.GUARD_PARSE_FAILURE,
                "Could not parse guard expression: " + guard + " (" + problem.getMessage() + ")");
          }
        } else if (segment.startsWith(DiagramSyntax.ACTION_PREFIX)) {
          final String action = segment.substring(DiagramSyntax.ACTION_PREFIX.length()).trim();
          try {
            builder.action(ActionParser.parse(action));
          } catch (DiagramParseException problem) {
            report(DiagnosticCode.ACTION_PARSE_FAILURE,
                "Could not parse action: " + action + " (" + problem.getMessage() + ")");
          }
        } else {
          report(DiagnosticCode.UNKNOWN_LABEL_SEGMENT, "Ignoring unknown label line: " + segment);
        }
      }
      transitions.add(builder.build());
    }

    /**
     * Maps an endpoint token to a state id: a quoted or bare declared label resolves to its
     * alias, an identifier is taken as-is and anything else is sanitized with a warning.
     */
    private String resolveState(final String token) {
      if (DiagramSyntax.isQuoted(token)) {
        final String label = DiagramSyntax.unescape(token.substring(1, token.length() - 1));
        final String id = idsByLabel.get(label);
        if (id != null) {
          return id;
        }
        report(DiagnosticCode.UNKNOWN_STATE_LABEL,
            "Unknown quoted state label '" + label + "'. Sanitizing to identifier.");
        return DiagramSyntax.sanitize(label);
      }
      if (DiagramSyntax.isIdentifier(token)) {
        return token;
      }
      final String id = idsByLabel.get(token);
      if (id != null) {
        return id;
      }
      report(DiagnosticCode.SANITIZED_STATE_TOKEN,
          "Non-identifier state token '" + token + "'. Sanitizing to identifier.");
      return DiagramSyntax.sanitize(token);
    }

    private DecodeResult finish() {
      if (initial == null) {
        diagnostics.add(new Diagnostic(DiagnosticCode.MISSING_INITIAL_MARKER, "puml:L1",
            "Missing initial state line: [*] --> <State>"));
        initial = statesSeen.isEmpty() ? FALLBACK_INITIAL : new TreeSet<>(statesSeen).first();
        statesSeen.add(initial);
      }

      final List<State> states = new ArrayList<>();
      for (String id : statesSeen) {
        final String label = labelsById.get(id);
        states.add(new State(id, label == null || label.equals(id) ? null : label,
            invariants.get(id)));
      }

      final Set<String> deviceIds = new TreeSet<>();
      final DeviceCollector collector = new DeviceCollector(deviceIds);
      for (Transition transition : transitions) {
        for (Trigger trigger : transition.getTriggers()) {
          trigger.accept(collector.triggers);
        }
        if (transition.getGuard() != null) {
          transition.getGuard().accept(collector.expressions);
        }
        for (Action action : transition.getActions()) {
          action.accept(collector.actions);
        }
      }
      for (List<Expression> list : invariants.values()) {
        for (Expression invariant : list) {
          invariant.accept(collector.expressions);
        }
      }
      final List<Device> devices = new ArrayList<>();
      for (String id : deviceIds) {
        devices.add(new Device(id, Device.UNKNOWN_KIND));
      }

      final Automation automation = new Automation(Automation.CURRENT_VERSION, devices,
          new StateMachineDefinition(initial, states, transitions));
      return new DecodeResult(automation, diagnostics);
    }

    private void report(final DiagnosticCode code, final String message) {
      diagnostics.add(new Diagnostic(code, "puml:L" + lineNumber, message));
    }
  }

  /**
   * Records every device id referenced by the visited triggers, actions and expressions.
   */
  private static final class DeviceCollector {
    private final Trigger.Visitor<Void> triggers;
    private final Action.Visitor<Void> actions;
    private final Expression.Visitor<Void> expressions;

    private DeviceCollector(final Set<String> ids) {
      triggers = new Trigger.Visitor<Void>() {
        @Override
        public Void visitBecomes(Trigger.Becomes becomes) {
          ids.add(becomes.getRef().getDevice());
          return null;
        }

        @Override
        public Void visitChanges(Trigger.Changes changes) {
          ids.add(changes.getRef().getDevice());
          return null;
        }

        @Override
        public Void visitSchedule(Trigger.Schedule schedule) {
          return null;
        }

        @Override
        public Void visitAfter(Trigger.After after) {
          return null;
        }
      };
      actions = new Action.Visitor<Void>() {
        @Override
        public Void visitCommand(Action.Command command) {
          ids.add(command.getDevice());
          return null;
        }

        @Override
        public Void visitDelay(Action.Delay delay) {
          return null;
        }

        @Override
        public Void visitNotify(Action.Notify notify) {
          return null;
        }
      };
      expressions = new Expression.Visitor<Void>() {
        @Override
        public Void visitRef(Expression.Ref ref) {
          ids.add(ref.getRef().getDevice());
          return null;
        }

        @Override
        public Void visitLit(Expression.Lit lit) {
          return null;
        }

        @Override
        public Void visitOp(Expression.Op op) {
          for (Expression arg : op.getArgs()) {
            arg.accept(this);
          }
          return null;
        }
      };
    }
  }
}

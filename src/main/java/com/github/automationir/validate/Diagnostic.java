package com.github.automationir.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.model.IrJson;

/**
 * A structured error or warning: stable code, a locator into the IR ({@code $.stateMachine...}) or
 * into diagram text ({@code puml:L<n>}), a message and optional correction suggestions.
 */
public final class Diagnostic {
  private final DiagnosticCode code;
  private final String path;
  private final String message;
  private final List<String> suggestions;

  public Diagnostic(final DiagnosticCode code, final String path, final String message,
      final List<String> suggestions) {
    this.code = code;
    this.path = path;
    this.message = message;
    this.suggestions = suggestions == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(suggestions));
  }

  public Diagnostic(final DiagnosticCode code, final String path, final String message) {
    this(code, path, message, null);
  }

  public Severity getSeverity() {
    return code.getSeverity();
  }

  public boolean isError() {
    return code.getSeverity() == Severity.ERROR;
  }

  public DiagnosticCode getCode() {
    return code;
  }

  /**
   * Wire code, e.g. {@code E110}.
   */
  public String getCodeValue() {
    return code.getValue();
  }

  public String getPath() {
    return path;
  }

  public String getMessage() {
    return message;
  }

  public List<String> getSuggestions() {
    return suggestions;
  }

  public ObjectNode toJson() {
    final ObjectNode node = IrJson.nodes().objectNode();
    node.put("severity", getSeverity().getWireName());
    node.put("code", code.getValue());
    node.put("path", path);
    node.put("message", message);
    if (!suggestions.isEmpty()) {
      final ArrayNode array = node.putArray("suggestions");
      for (String suggestion : suggestions) {
        array.add(suggestion);
      }
    }
    return node;
  }

  @Override
  public String toString() {
    return path + ": " + code.getValue() + " " + message;
  }
}

package com.github.automationir.codec;

/**
 * Raised by the line-level parsers when a trigger, action or expression does not match its
 * grammar. The decoder turns it into a diagnostic and carries on with the next construct.
 */
public final class DiagramParseException extends Exception {
  private static final long serialVersionUID = 1L;

  public DiagramParseException(final String message) {
    super(message);
  }
}

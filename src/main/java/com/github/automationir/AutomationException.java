package com.github.automationir;

/**
 * Unified single exception that's thrown by the compiler core. The idea is to use the code enum to
 * encapsulate the various fatal conditions; validation problems are never raised this way, they are
 * reported as diagnostics.
 *
 * Patch application is the main source of these: the first invalid edit aborts the whole patch.
 */
public final class AutomationException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomationException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomationException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public AutomationException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public AutomationException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_CONFIGURATION("Compiler configuration is invalid"),
    // 2.
    CATALOG_LOAD_FAILURE("Failed to load device or capability catalog"),
    // 3.
    INVALID_DOCUMENT("IR document is missing its stateMachine object or is not a JSON object"),
    // 4.
    INVALID_PATCH("Patch document must be an object carrying an edits[] list"),
    // 5.
    INVALID_EDIT("Edit is missing a required field"),
    // 6.
    UNSUPPORTED_EDIT_OP("Edit op is not supported"),
    // 7.
    TRANSITION_NOT_FOUND("No transition matches the requested from->to pair"),
    // 8.
    AMBIGUOUS_TRANSITION("Multiple transitions match the requested from->to pair, specify index"),
    // 9.
    TRANSITION_INDEX_OUT_OF_RANGE("Transition index is out of range among same-pair matches"),
    // 10.
    SERIALIZATION_FAILURE("Failed to read or write JSON");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}

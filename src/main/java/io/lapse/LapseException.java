package io.lapse;

import java.util.Optional;

/** Exception thrown for fatal errors while loading, updating, saving or publishing codes. */
public final class LapseException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input value, if any. */
  private final String input;

  /** An optional hint for fixing the error. */
  private final String hint;

  private LapseException(
      ErrorKind kind, String message, String input, String hint, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
    this.hint = hint;
  }

  /**
   * Creates a new input error.
   *
   * @param message the error message
   * @param input the offending input value
   * @param hint an optional hint for fixing the error
   * @return a new LapseException for an input error
   */
  public static LapseException input(String message, String input, String hint) {
    return new LapseException(ErrorKind.INPUT, message, input, hint, null);
  }

  /**
   * Creates a new document error.
   *
   * @param message the error message
   * @param hint an optional hint for fixing the error
   * @param cause the underlying failure, may be null
   * @return a new LapseException for a document error
   */
  public static LapseException document(String message, String hint, Throwable cause) {
    return new LapseException(ErrorKind.DOCUMENT, message, null, hint, cause);
  }

  /**
   * Creates a new storage error.
   *
   * @param message the error message
   * @param cause the underlying failure
   * @return a new LapseException for a storage error
   */
  public static LapseException storage(String message, Throwable cause) {
    return new LapseException(ErrorKind.STORAGE, message, null, null, cause);
  }

  /**
   * Creates a new publish error.
   *
   * @param message the error message
   * @param hint an optional hint for fixing the error
   * @param cause the underlying failure, may be null
   * @return a new LapseException for a publish error
   */
  public static LapseException publish(String message, String hint, Throwable cause) {
    return new LapseException(ErrorKind.PUBLISH, message, null, hint, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending input value, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns a hint for fixing the error, if available.
   *
   * @return the hint, or empty if not available
   */
  public Optional<String> hint() {
    return Optional.ofNullable(hint);
  }

  /**
   * Formats the error for a terminal, with the hint on the following lines.
   *
   * <pre>
   * error: invalid ISO timestamp for --expires
   *   input: 2025-13-01
   *   hint: use e.g. 2025-10-01T00:00:00Z
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage());
    if (input != null) {
      sb.append("\n  input: ").append(input);
    }
    if (hint != null && !hint.isEmpty()) {
      for (String line : hint.split("\n")) {
        sb.append("\n  hint: ").append(line);
      }
    }
    return sb.toString();
  }
}

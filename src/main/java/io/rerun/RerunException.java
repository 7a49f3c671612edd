package io.rerun;

import java.util.Optional;

/** Exception thrown for errors in expression parsing, evaluation, cron handling or replay. */
public final class RerunException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where the error occurred. */
  private final Span span;

  /** The original input string. */
  private final String input;

  /** An optional suggestion for fixing the error. */
  private final String suggestion;

  private RerunException(
      ErrorKind kind,
      String message,
      Span span,
      String input,
      String suggestion,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.suggestion = suggestion;
  }

  /**
   * Creates a new grammar error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @param suggestion an optional suggestion for fixing the error
   * @return a new RerunException for a grammar error
   */
  public static RerunException grammar(
      String message, Span span, String input, String suggestion) {
    return new RerunException(ErrorKind.GRAMMAR, message, span, input, suggestion, null);
  }

  /**
   * Creates a new unit error.
   *
   * @param message the error message
   * @param span the location of the unit in the input, may be null
   * @param input the original input string, may be null
   * @return a new RerunException for a unit error
   */
  public static RerunException unit(String message, Span span, String input) {
    return new RerunException(ErrorKind.UNIT, message, span, input, null, null);
  }

  /**
   * Creates a new calendar error.
   *
   * @param message the error message
   * @param cause the underlying arithmetic failure
   * @return a new RerunException for a calendar error
   */
  public static RerunException calendar(String message, Throwable cause) {
    return new RerunException(ErrorKind.CALENDAR, message, null, null, null, cause);
  }

  /**
   * Creates a new cron error.
   *
   * @param message the error message
   * @param cause the underlying parser failure, may be null
   * @return a new RerunException for a cron error
   */
  public static RerunException cron(String message, Throwable cause) {
    return new RerunException(ErrorKind.CRON, message, null, null, null, cause);
  }

  /**
   * Creates a new control-job error.
   *
   * @param message the error message
   * @return a new RerunException for a control-job error
   */
  public static RerunException control(String message) {
    return new RerunException(ErrorKind.CONTROL, message, null, null, null, null);
  }

  /**
   * Creates a new backend error.
   *
   * @param message the error message
   * @param cause the underlying failure, may be null
   * @return a new RerunException for a backend error
   */
  public static RerunException backend(String message, Throwable cause) {
    return new RerunException(ErrorKind.BACKEND, message, null, null, null, cause);
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
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the suggestion, or empty if not available
   */
  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * Formats a rich error message with underline and optional suggestion.
   *
   * <p>For errors with span and input, produces output like:
   *
   * <pre>
   * error: unknown offset unit 'q'
   *   -15q@d
   *      ^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");

      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));

      if (suggestion != null && !suggestion.isEmpty()) {
        sb.append(" try: \"").append(suggestion).append("\"");
      }

      return sb.toString();
    }

    return "error: " + getMessage();
  }
}

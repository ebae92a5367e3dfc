package io.recur;

import java.util.Optional;

/** Exception thrown when a date, schedule or repetition end cannot be parsed. */
public final class DateException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The span of the input where the error occurred. */
  private final Span span;

  /** The text that was being parsed. */
  private final String input;

  private DateException(ErrorKind kind, String message, Span span, String input) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates a new schedule error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the schedule text
   * @return a new DateException for a schedule error
   */
  public static DateException schedule(String message, Span span, String input) {
    return new DateException(ErrorKind.SCHEDULE, message, span, input);
  }

  /**
   * Creates a new repetition end error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the end text
   * @return a new DateException for an end error
   */
  public static DateException end(String message, Span span, String input) {
    return new DateException(ErrorKind.END, message, span, input);
  }

  /**
   * Creates a new date error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the date text
   * @return a new DateException for a date error
   */
  public static DateException date(String message, Span span, String input) {
    return new DateException(ErrorKind.DATE, message, span, input);
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
   * Returns the text that was being parsed, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message with an underline below the offending text.
   *
   * <pre>
   * error: day of month out of range
   *   every month on the 12, 42
   *                          ^^
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
      return sb.toString();
    }

    return "error: " + getMessage();
  }
}

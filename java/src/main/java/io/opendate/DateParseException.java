package io.opendate;

import java.util.Optional;

/** Exception thrown when a string cannot be interpreted as a date, a time, or both. */
public final class DateParseException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where the error occurred. */
  private final Span span;

  /** The original input string. */
  private final String input;

  private DateParseException(ErrorKind kind, String message, Span span, String input) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates an error for input in which no date or time component was found.
   *
   * @param input the original input string
   * @return a new DateParseException
   */
  public static DateParseException noComponents(String input) {
    return new DateParseException(
        ErrorKind.NO_COMPONENTS_FOUND, "no date or time components found", null, input);
  }

  /**
   * Creates an error for an out-of-range, duplicated or unplaceable numeric field.
   *
   * @param message the error message
   * @param span the location of the offending value, or null if it has no single location
   * @param input the original input string
   * @return a new DateParseException
   */
  public static DateParseException invalidNumeric(String message, Span span, String input) {
    return new DateParseException(ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, message, span, input);
  }

  /**
   * Creates an error for a token no rule could attribute.
   *
   * @param token the token text
   * @param span the location of the token
   * @param input the original input string
   * @return a new DateParseException
   */
  public static DateParseException unrecognized(String token, Span span, String input) {
    return new DateParseException(
        ErrorKind.UNRECOGNIZED_TOKEN, "unrecognized token '" + token + "'", span, input);
  }

  /**
   * Creates an error for input outside the strict ISO 8601 grammar.
   *
   * @param message the error message
   * @param span the location where matching stopped
   * @param input the original input string
   * @return a new DateParseException
   */
  public static DateParseException malformedIso(String message, Span span, String input) {
    return new DateParseException(ErrorKind.MALFORMED_ISO_GRAMMAR, message, span, input);
  }

  /**
   * Creates an error for an ISO week date whose week or weekday is out of range.
   *
   * @param message the error message
   * @param span the location of the week date
   * @param input the original input string
   * @return a new DateParseException
   */
  public static DateParseException invalidWeekDate(String message, Span span, String input) {
    return new DateParseException(ErrorKind.INVALID_WEEK_DATE, message, span, input);
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
   * Formats the message with the input and an underline below the offending span.
   *
   * <pre>
   * error: unrecognized token 'foo'
   *   2024-01-15 foo
   *              ^^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (span == null || input == null || input.isEmpty()) {
      return "error: " + getMessage();
    }
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage()).append("\n");
    sb.append("  ").append(input).append("\n");
    sb.append(" ".repeat(Math.min(span.start(), input.length()) + 2));
    sb.append("^".repeat(span.length()));
    return sb.toString();
  }
}

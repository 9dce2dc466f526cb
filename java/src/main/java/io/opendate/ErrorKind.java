package io.opendate;

/** The category of a parse failure. */
public enum ErrorKind {
  /** Neither a date field nor a time field could be recovered. */
  NO_COMPONENTS_FOUND("no_components_found"),
  /** A numeric field is out of range, assigned twice, or cannot be placed. */
  AMBIGUOUS_OR_INVALID_NUMERIC("ambiguous_or_invalid_numeric"),
  /** Input left over that no rule could attribute (non-fuzzy mode only). */
  UNRECOGNIZED_TOKEN("unrecognized_token"),
  /** Strict ISO 8601 input that matches no production, or has trailing input. */
  MALFORMED_ISO_GRAMMAR("malformed_iso_grammar"),
  /** ISO week number or day-of-week out of range. */
  INVALID_WEEK_DATE("invalid_week_date");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}

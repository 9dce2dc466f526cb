package io.opendate;

/**
 * A range of character positions in the parsed input.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns a span covering the single character at {@code pos}.
   *
   * @param pos the character position
   * @return a one-character span
   */
  public static Span at(int pos) {
    return new Span(pos, pos + 1);
  }

  /**
   * Returns the smallest span covering both this span and {@code other}.
   *
   * @param other the span to join
   * @return the joined span
   */
  public Span to(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }

  /**
   * Returns the underline width for this span, at least one character.
   *
   * @return the number of characters to underline
   */
  public int length() {
    return Math.max(1, end - start);
  }
}

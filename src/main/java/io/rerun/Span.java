package io.rerun;

/**
 * A range of character positions in a relative-time expression.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span, never less than one so a caret can always be drawn.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns the smallest span covering both this span and {@code other}.
   *
   * @param other the other span
   * @return the covering span
   */
  public Span to(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }
}

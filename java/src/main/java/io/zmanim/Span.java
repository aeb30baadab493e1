package io.zmanim;

/**
 * A range of character offsets in formula source text.
 *
 * @param start the start offset (inclusive)
 * @param end the end offset (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns a zero-width span at the given offset.
   *
   * @param offset the offset
   * @return the span
   */
  public static Span at(int offset) {
    return new Span(offset, offset);
  }

  /**
   * Returns the length of this span, never less than one so that carets stay visible.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns the smallest span covering this span and {@code other}.
   *
   * @param other the other span
   * @return the covering span
   */
  public Span to(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }

  /**
   * Returns the 1-based line and column of the start offset within {@code input}.
   *
   * @param input the source text this span points into
   * @return a two-element array {line, column}
   */
  public int[] lineColumn(String input) {
    int line = 1;
    int column = 1;
    int limit = Math.min(start, input.length());
    for (int i = 0; i < limit; i++) {
      if (input.charAt(i) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
    }
    return new int[] {line, column};
  }
}

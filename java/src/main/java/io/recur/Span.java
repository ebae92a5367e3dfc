package io.recur;

/**
 * Represents a range of character positions in the input.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns a span covering the whole of the given text.
   *
   * @param text the text
   * @return a span from 0 to the length of the text
   */
  public static Span of(String text) {
    return new Span(0, text == null ? 0 : text.length());
  }

  /**
   * Returns this span moved right by the given number of characters.
   *
   * @param offset the number of characters to shift by
   * @return the shifted span
   */
  public Span shift(int offset) {
    return new Span(start + offset, end + offset);
  }

  /**
   * Returns the length of this span.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }
}

package io.hclfmt;

/**
 * Represents a range of character offsets in a source file.
 *
 * @param start the start offset (inclusive)
 * @param end the end offset (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span, never less than one so an error marker stays visible.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Resolves the start of this span to a 1-based line and column in the given input.
   *
   * @param input the text this span points into
   * @return the position of the first character of the span
   */
  public Position startIn(String input) {
    int line = 1;
    int lineStart = 0;
    int limit = Math.min(start, input.length());
    for (int i = 0; i < limit; i++) {
      if (input.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    return new Position(line, limit - lineStart + 1, lineStart);
  }

  /**
   * A resolved source position.
   *
   * @param line the 1-based line number
   * @param column the 1-based column number
   * @param lineOffset the offset of the first character of the line
   */
  public record Position(int line, int column, int lineOffset) {}
}

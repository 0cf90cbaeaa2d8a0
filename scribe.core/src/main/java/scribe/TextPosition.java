package scribe;

import java.util.Objects;

/**
 * Logical position: zero based line and grapheme column inside that line.
 */
public final class TextPosition implements Comparable<TextPosition> {

  public static final TextPosition ZERO = new TextPosition(0, 0);

  /**
   * Stands for the end of the document whatever its current length.
   */
  public static final TextPosition MAX = new TextPosition(Long.MAX_VALUE, Long.MAX_VALUE);

  public final long line;
  public final long column;

  public TextPosition(long line, long column) {
    if (line < 0 || column < 0) {
      throw TextException.invalidBoundary("position", "(" + line + ", " + column + ")");
    }
    this.line = line;
    this.column = column;
  }

  public static TextPosition of(long line, long column) {
    return new TextPosition(line, column);
  }

  @Override
  public int compareTo(TextPosition o) {
    int c = Long.compare(line, o.line);
    return c != 0 ? c : Long.compare(column, o.column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TextPosition that = (TextPosition)o;
    return line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, column);
  }

  @Override
  public String toString() {
    return "(" + line + ", " + column + ")";
  }
}

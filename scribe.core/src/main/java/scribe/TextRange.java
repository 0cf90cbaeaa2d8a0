package scribe;

import java.util.Objects;

public final class TextRange {

  /**
   * The whole document.
   */
  public static final TextRange MAX = new TextRange(TextPosition.ZERO, TextPosition.MAX);

  public final TextPosition start;
  public final TextPosition end;

  public TextRange(TextPosition start, TextPosition end) {
    if (start.compareTo(end) > 0) {
      throw TextException.invalidRange(start, end);
    }
    this.start = start;
    this.end = end;
  }

  public static TextRange of(long startLine, long startColumn, long endLine, long endColumn) {
    return new TextRange(new TextPosition(startLine, startColumn), new TextPosition(endLine, endColumn));
  }

  public boolean isEmpty() {
    return start.equals(end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TextRange range = (TextRange)o;
    return start.equals(range.start) && end.equals(range.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}

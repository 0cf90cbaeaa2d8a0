package scribe.glyph;

import java.util.Objects;

/**
 * Row and screen column. Depending on the producer the row counts rows of one line or rows of a viewport.
 */
public final class ScreenPosition {
  public final long row;
  public final long column;

  public ScreenPosition(long row, long column) {
    this.row = row;
    this.column = column;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ScreenPosition that = (ScreenPosition)o;
    return row == that.row && column == that.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(row, column);
  }

  @Override
  public String toString() {
    return "(" + row + ":" + column + ")";
  }
}

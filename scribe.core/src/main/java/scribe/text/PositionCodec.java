package scribe.text;

import scribe.TextException;

/**
 * Conversions between byte offsets, grapheme columns and unwrapped screen columns within one line.
 * The {@code line} argument is the sequence of graphemes of the line content, without the line break.
 */
public final class PositionCodec {

  private PositionCodec() {
  }

  /**
   * Number of graphemes in front of the byte offset.
   */
  public static long column(Graphemes line, long byteOffset) {
    long column = 0;
    GraphemeCursor cursor = line.iterator();
    while (cursor.offset() < byteOffset) {
      if (!cursor.hasNext()) {
        throw TextException.invalidBoundary("byte offset", byteOffset);
      }
      cursor.next();
      column++;
    }
    if (cursor.offset() != byteOffset) {
      throw TextException.invalidBoundary("byte offset", byteOffset);
    }
    return column;
  }

  /**
   * Byte offset of the grapheme at the column; the column right after the last grapheme maps to the line end.
   */
  public static long byteOffset(Graphemes line, long column) {
    GraphemeCursor cursor = line.iterator();
    for (long i = 0; i < column; i++) {
      if (!cursor.hasNext()) {
        throw TextException.invalidBoundary("column", column);
      }
      cursor.next();
    }
    return cursor.offset();
  }

  /**
   * Screen column at which the grapheme at the given column starts.
   */
  public static long screenColumn(Graphemes line, long column, int tabWidth) {
    long x = 0;
    GraphemeCursor cursor = line.iterator();
    for (long i = 0; i < column; i++) {
      if (!cursor.hasNext()) {
        throw TextException.invalidBoundary("column", column);
      }
      x += DisplayWidth.of(cursor.next(), x, tabWidth);
    }
    return x;
  }

  /**
   * Column of the grapheme covering the screen cell; cells past the line end map to the line width.
   */
  public static long columnAtScreen(Graphemes line, long screenColumn, int tabWidth) {
    long x = 0;
    long column = 0;
    GraphemeCursor cursor = line.iterator();
    while (cursor.hasNext()) {
      int width = DisplayWidth.of(cursor.next(), x, tabWidth);
      if (screenColumn < x + width) {
        return column;
      }
      x += width;
      column++;
    }
    return column;
  }

  /**
   * Unwrapped display width of the line.
   */
  public static long screenWidth(Graphemes line, int tabWidth) {
    long x = 0;
    for (Grapheme g : line) {
      x += DisplayWidth.of(g, x, tabWidth);
    }
    return x;
  }
}

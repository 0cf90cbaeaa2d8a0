package scribe.glyph;

import scribe.ByteRange;

import java.util.Objects;

/**
 * What to paint for one grapheme. {@link #text} is the display form and may differ from the source text,
 * e.g. for tabs and control characters. Soft break markers cover no bytes.
 */
public final class Glyph {
  public final String text;
  public final int screenWidth;
  public final ByteRange bytes;
  /** grapheme column in the line */
  public final long column;
  /** row within the line */
  public final long row;
  /** first screen column within the row */
  public final long screenColumn;
  public final boolean lineBreak;
  public final boolean softBreak;

  public Glyph(String text,
               int screenWidth,
               ByteRange bytes,
               long column,
               long row,
               long screenColumn,
               boolean lineBreak,
               boolean softBreak) {
    this.text = text;
    this.screenWidth = screenWidth;
    this.bytes = bytes;
    this.column = column;
    this.row = row;
    this.screenColumn = screenColumn;
    this.lineBreak = lineBreak;
    this.softBreak = softBreak;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Glyph glyph = (Glyph)o;
    return screenWidth == glyph.screenWidth &&
           column == glyph.column &&
           row == glyph.row &&
           screenColumn == glyph.screenColumn &&
           lineBreak == glyph.lineBreak &&
           softBreak == glyph.softBreak &&
           text.equals(glyph.text) &&
           bytes.equals(glyph.bytes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, screenWidth, bytes, column, row, screenColumn, lineBreak, softBreak);
  }

  @Override
  public String toString() {
    return "Glyph{\"" + text + "\" " + bytes + " w=" + screenWidth + " at " + row + ":" + screenColumn + '}';
  }
}

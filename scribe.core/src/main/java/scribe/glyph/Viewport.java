package scribe.glyph;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Visible rectangle: the first visible row given as line and row within that line, the horizontal scroll
 * offset and the size in screen cells.
 */
public final class Viewport {
  public final long line;
  public final long row;
  public final long scrollX;
  public final int width;
  public final int height;

  public Viewport(long line, long row, long scrollX, int width, int height) {
    if (line < 0 || row < 0 || scrollX < 0 || width < 1 || height < 1) {
      throw new IllegalArgumentException("viewport " + line + ":" + row + "+" + scrollX + " " + width + "x" + height);
    }
    this.line = line;
    this.row = row;
    this.scrollX = scrollX;
    this.width = width;
    this.height = height;
  }

  public static Viewport of(int width, int height) {
    return new Viewport(0, 0, 0, width, height);
  }

  public Viewport scrollTo(long line, long row) {
    return new Viewport(line, row, scrollX, width, height);
  }

  public Viewport scrollX(long scrollX) {
    return new Viewport(line, row, scrollX, width, height);
  }

  /**
   * Glyphs of one screen row that intersect the viewport horizontally.
   */
  public static final class Row {
    public final long line;
    public final long row;
    public final List<Glyph> glyphs;

    public Row(long line, long row, List<Glyph> glyphs) {
      this.line = line;
      this.row = row;
      this.glyphs = Collections.unmodifiableList(glyphs);
    }

    public String text() {
      StringBuilder sb = new StringBuilder();
      for (Glyph g : glyphs) {
        sb.append(g.text);
      }
      return sb.toString();
    }

    @Override
    public String toString() {
      return line + ":" + row + " \"" + text() + "\"";
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Viewport viewport = (Viewport)o;
    return line == viewport.line &&
           row == viewport.row &&
           scrollX == viewport.scrollX &&
           width == viewport.width &&
           height == viewport.height;
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, row, scrollX, width, height);
  }

  @Override
  public String toString() {
    return "Viewport{" + line + ":" + row + "+" + scrollX + " " + width + "x" + height + '}';
  }
}

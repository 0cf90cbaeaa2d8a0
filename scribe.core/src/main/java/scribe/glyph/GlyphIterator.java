package scribe.glyph;

import org.jetbrains.annotations.Nullable;
import scribe.ByteRange;
import scribe.TextException;
import scribe.text.Grapheme;
import scribe.text.GraphemeCursor;
import scribe.text.TextView;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Glyphs of one line row by row: the graphemes of every segment, a soft break marker after every row but the last
 * when {@code wrapCtrl} is on, then the line break if the line has one.
 * <p>
 * Skipping only shapes the graphemes between the start of the target row and the target, no glyphs are built.
 */
public final class GlyphIterator implements Iterator<Glyph> {

  private final GlyphShaper shaper;
  private final TextView store;
  private final List<WrapSegment> segments;
  private final ByteRange lineBytes;
  private final ByteRange content;

  private int segment = 0;
  @Nullable private GraphemeCursor cursor;
  private long column;
  private long x;
  private boolean markerDone;
  private boolean lineBreakDone;
  @Nullable private Glyph next;
  private long visited = 0;

  GlyphIterator(GlyphShaper shaper, TextView store, long line, List<WrapSegment> segments) {
    this.shaper = shaper;
    this.store = store;
    this.segments = segments;
    this.lineBytes = store.lineBytes(line);
    this.content = store.lineContentBytes(line);
  }

  /**
   * Row of the next glyph within the line.
   */
  public long row() {
    return Math.min(segment, segments.size() - 1);
  }

  /**
   * Screen column of the next glyph within its row.
   */
  public long screenColumn() {
    return x;
  }

  /**
   * Grapheme column of the next glyph.
   */
  public long column() {
    return column;
  }

  /**
   * Graphemes taken from the text so far, shaped or skipped.
   */
  public long visited() {
    return visited;
  }

  @Override
  public boolean hasNext() {
    if (next == null) {
      next = advance();
    }
    return next != null;
  }

  @Override
  public Glyph next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    Glyph g = next;
    next = null;
    return g;
  }

  private void enter(int idx) {
    segment = idx;
    WrapSegment s = segments.get(idx);
    cursor = store.graphemes(s.bytes).iterator();
    column = s.startColumn;
    x = 0;
    markerDone = false;
  }

  @Nullable
  private Glyph advance() {
    while (segment < segments.size()) {
      if (cursor == null) {
        enter(segment);
      }
      boolean last = segment + 1 == segments.size();
      if (cursor.hasNext()) {
        Grapheme g = cursor.next();
        visited++;
        Glyph glyph = shaper.shape(g, column, segment, x, !last && !cursor.hasNext());
        x += glyph.screenWidth;
        column++;
        return glyph;
      }
      if (!last && !markerDone && shaper.settings.wrapCtrl) {
        markerDone = true;
        return shaper.softBreak(segments.get(segment).bytes.end, column, segment, x);
      }
      if (last) {
        break;
      }
      segment++;
      cursor = null;
    }
    if (!lineBreakDone) {
      lineBreakDone = true;
      if (content.end < lineBytes.end) {
        Grapheme lineBreak = new Grapheme(store.text(new ByteRange(content.end, lineBytes.end)),
                                          new ByteRange(content.end, lineBytes.end));
        Glyph glyph = shaper.shape(lineBreak, column, segments.size() - 1, x, false);
        x += glyph.screenWidth;
        return glyph;
      }
    }
    return null;
  }

  /**
   * Continues with the glyph starting at the byte offset.
   *
   * @throws TextException if the offset is outside of the line or not a grapheme boundary
   */
  public void skipTo(long byteOffset) {
    if (byteOffset < lineBytes.start || byteOffset > lineBytes.end) {
      throw TextException.invalidBoundary("byte offset", byteOffset);
    }
    next = null;
    if (byteOffset > content.end) {
      if (byteOffset != lineBytes.end) {
        throw TextException.invalidBoundary("byte offset", byteOffset);
      }
      skipLine();
      return;
    }
    int idx = segments.size() - 1;
    while (idx > 0 && segments.get(idx).bytes.start > byteOffset) {
      idx--;
    }
    enter(idx);
    lineBreakDone = false;
    boolean last = idx + 1 == segments.size();
    while (cursor.offset() < byteOffset && cursor.hasNext()) {
      Grapheme g = cursor.next();
      visited++;
      x += shaper.width(g, x, !last && !cursor.hasNext());
      column++;
    }
    if (cursor.offset() != byteOffset) {
      throw TextException.invalidBoundary("byte offset", byteOffset);
    }
  }

  /**
   * Continues inside segment {@code idx} at a grapheme whose column and screen column are already known.
   */
  void resume(int idx, long byteOffset, long column, long x) {
    next = null;
    segment = idx;
    cursor = store.graphemes(new ByteRange(byteOffset, segments.get(idx).bytes.end)).iterator();
    this.column = column;
    this.x = x;
    markerDone = false;
    lineBreakDone = false;
  }

  /**
   * Drops the rest of the line.
   */
  public void skipLine() {
    next = null;
    WrapSegment s = segments.get(segments.size() - 1);
    segment = segments.size();
    cursor = null;
    lineBreakDone = true;
    x = s.width;
  }
}

package scribe.glyph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import scribe.Edit;
import scribe.TextException;
import scribe.TextPosition;
import scribe.impl.util.LongArrayList;
import scribe.text.Grapheme;
import scribe.text.GraphemeCursor;
import scribe.text.TextView;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Per line screen width and wrap segments, computed on first request.
 * <p>
 * Entries remember the layout they were computed for; after {@link #configure} entries of another layout are
 * recomputed when asked for. Edits invalidate the lines they touch, all following lines too when the number
 * of lines changed.
 */
public final class LineMetricsCache {

  private static final Logger LOG = LogManager.getLogger(LineMetricsCache.class);

  private static final class Layout {
    final GlyphShaper shaper;
    final WrapMode mode;
    final int width;

    Layout(GlyphShaper shaper, WrapMode mode, int width) {
      this.shaper = shaper;
      this.mode = mode;
      this.width = width;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Layout layout = (Layout)o;
      return width == layout.width && mode == layout.mode && shaper.equals(layout.shaper);
    }

    @Override
    public int hashCode() {
      return Objects.hash(shaper, mode, width);
    }
  }

  /** graphemes between two checkpoints of a row */
  static final int CHECKPOINT_STRIDE = 256;

  /*
   * every CHECKPOINT_STRIDE graphemes of a long row: the row, the byte offset, grapheme column and screen column
   * of the grapheme starting there; sorted by row, then screen column
   */
  private static final class Checkpoints {
    final LongArrayList rows = new LongArrayList();
    final LongArrayList offsets = new LongArrayList();
    final LongArrayList columns = new LongArrayList();
    final LongArrayList xs = new LongArrayList();

    static Checkpoints of(GlyphShaper shaper, TextView store, List<WrapSegment> segments) {
      Checkpoints result = new Checkpoints();
      for (int idx = 0; idx < segments.size(); idx++) {
        WrapSegment s = segments.get(idx);
        // a row with fewer bytes than the stride has fewer graphemes too
        if (s.bytes.length() <= CHECKPOINT_STRIDE) {
          continue;
        }
        boolean last = idx + 1 == segments.size();
        GraphemeCursor cursor = store.graphemes(s.bytes).iterator();
        long column = s.startColumn;
        long x = 0;
        for (long n = 0; cursor.hasNext(); n++) {
          if (n > 0 && n % CHECKPOINT_STRIDE == 0) {
            result.rows.add(idx);
            result.offsets.add(cursor.offset());
            result.columns.add(column);
            result.xs.add(x);
          }
          Grapheme g = cursor.next();
          x += shaper.width(g, x, !last && !cursor.hasNext());
          column++;
        }
      }
      return result.rows.isEmpty() ? null : result;
    }

    /**
     * Last checkpoint of the row left of screen column {@code x}, -1 if there is none.
     */
    int floor(long row, long x) {
      int lo = 0;
      int hi = rows.size() - 1;
      int found = -1;
      while (lo <= hi) {
        int mid = (lo + hi) >>> 1;
        long r = rows.get(mid);
        if (r < row || (r == row && xs.get(mid) < x)) {
          found = mid;
          lo = mid + 1;
        }
        else {
          hi = mid - 1;
        }
      }
      return found >= 0 && rows.get(found) == row ? found : -1;
    }
  }

  private static final class Entry {
    final Layout layout;
    final long width;
    final List<WrapSegment> segments;
    @Nullable final Checkpoints checkpoints;

    Entry(Layout layout, long width, List<WrapSegment> segments, @Nullable Checkpoints checkpoints) {
      this.layout = layout;
      this.width = width;
      this.segments = segments;
      this.checkpoints = checkpoints;
    }
  }

  private final TreeMap<Long, Entry> entries = new TreeMap<>();
  private Layout layout;
  private long computations = 0;

  public LineMetricsCache(GlyphShaper shaper, WrapMode mode, int width) {
    this.layout = new Layout(shaper, mode, width);
  }

  public void configure(GlyphShaper shaper, WrapMode mode, int width) {
    Layout l = new Layout(shaper, mode, width);
    if (!l.equals(layout)) {
      LOG.debug("layout changed to {} at width {}", mode, width);
      layout = l;
    }
  }

  public GlyphShaper shaper() {
    return layout.shaper;
  }

  public WrapMode mode() {
    return layout.mode;
  }

  public int width() {
    return layout.width;
  }

  private Entry entry(TextView store, long line) {
    Entry e = entries.get(line);
    if (e != null && e.layout.equals(layout)) {
      return e;
    }
    if (line < 0 || line >= store.lenLines()) {
      throw TextException.invalidBoundary("line", line);
    }
    computations++;
    List<WrapSegment> segments = layout.shaper.wrap(store, line, layout.mode, layout.width);
    e = new Entry(layout,
                  layout.shaper.lineWidth(store, line),
                  Collections.unmodifiableList(segments),
                  Checkpoints.of(layout.shaper, store, segments));
    entries.put(line, e);
    return e;
  }

  /**
   * Unwrapped screen width of the line content.
   */
  public long lineWidth(TextView store, long line) {
    return entry(store, line).width;
  }

  public List<WrapSegment> wrapSegments(TextView store, long line) {
    return entry(store, line).segments;
  }

  public long rows(TextView store, long line) {
    return entry(store, line).segments.size();
  }

  /**
   * Drops lines {@code [from, to)}.
   */
  public void invalidate(long from, long to) {
    if (from >= to) {
      return;
    }
    entries.subMap(from, true, to, false).clear();
    LOG.trace("lines [{}, {}) invalidated", from, to);
  }

  public void edit(Edit edit) {
    if (Edit.isIdentity(edit)) {
      return;
    }
    if (edit.changesLineStructure()) {
      invalidate(edit.line, Long.MAX_VALUE);
    }
    else {
      invalidate(edit.line, edit.line + 1);
    }
  }

  public void clear() {
    entries.clear();
  }

  /**
   * Number of lines computed since creation.
   */
  public long computations() {
    return computations;
  }

  public int size() {
    return entries.size();
  }

  /**
   * Row within the line and screen column of a position.
   */
  public ScreenPosition toScreen(TextView store, TextPosition position) {
    long offset = store.positionToByte(position);
    long line = store.lineOf(offset);
    GlyphIterator it = glyphs(store, line);
    it.skipTo(offset);
    return new ScreenPosition(it.row(), it.screenColumn());
  }

  /**
   * Position shown at the screen column of a row of the line. Columns past the end of the row map to its last
   * grapheme, or to the line end on the last row.
   */
  public TextPosition fromScreen(TextView store, long line, long row, long x) {
    List<WrapSegment> segments = wrapSegments(store, line);
    if (row < 0 || row >= segments.size()) {
      throw TextException.invalidBoundary("row", row);
    }
    WrapSegment segment = segments.get((int)row);
    boolean last = row + 1 == segments.size();
    GlyphIterator it = glyphs(store, line);
    it.skipTo(segment.bytes.start);
    long column = segment.startColumn;
    while (it.hasNext()) {
      Glyph g = it.next();
      if (g.row != row || g.lineBreak || g.softBreak) {
        break;
      }
      if (x < g.screenColumn + g.screenWidth) {
        return new TextPosition(line, g.column);
      }
      column = g.column + 1;
    }
    if (!last && column > segment.startColumn) {
      column--;
    }
    return new TextPosition(line, column);
  }

  public GlyphIterator glyphs(TextView store, long line) {
    return new GlyphIterator(layout.shaper, store, line, wrapSegments(store, line));
  }

  /**
   * Glyphs of the line starting at a grapheme of the row that begins left of screen column {@code x}, or at the
   * row start.
   * Long rows resume from the nearest checkpoint, so the glyphs far left of {@code x} are never shaped.
   */
  public GlyphIterator glyphs(TextView store, long line, long row, long x) {
    Entry e = entry(store, line);
    if (row < 0 || row >= e.segments.size()) {
      throw TextException.invalidBoundary("row", row);
    }
    GlyphIterator it = new GlyphIterator(layout.shaper, store, line, e.segments);
    int i = e.checkpoints == null ? -1 : e.checkpoints.floor(row, x);
    if (i < 0) {
      it.skipTo(e.segments.get((int)row).bytes.start);
    }
    else {
      it.resume((int)row, e.checkpoints.offsets.get(i), e.checkpoints.columns.get(i), e.checkpoints.xs.get(i));
    }
    return it;
  }

  /**
   * Byte offset shown at the screen position, see {@link #fromScreen}.
   */
  public long byteAt(TextView store, long line, long row, long x) {
    return store.positionToByte(fromScreen(store, line, row, x));
  }
}

package scribe.glyph;

import scribe.ByteRange;
import scribe.Settings;
import scribe.text.DisplayWidth;
import scribe.text.Grapheme;
import scribe.text.GraphemeCursor;
import scribe.text.TextView;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns graphemes into glyphs and lines into wrap segments.
 * <p>
 * Display forms: a tab spans up to the next tab stop, control characters show as U+FFFD or, with
 * {@link Settings#showCtrl}, as their Control Pictures symbol. Soft hyphens and zero width spaces are invisible
 * unless a row breaks right after them, then they show as {@code "-"} and {@code " "}. With {@link Settings#showCtrl}
 * or {@link Settings#wrapCtrl} the last column of a row is kept for the line break or soft break marker.
 */
public final class GlyphShaper {

  public static final String SOFT_BREAK_MARKER = "↵";
  static final String LINE_BREAK_SYMBOL = "␊";
  static final String TAB_SYMBOL = "␉";
  static final String SOFT_HYPHEN_SYMBOL = "⸚";
  static final String ZERO_WIDTH_SPACE_SYMBOL = "¨";
  static final String REPLACEMENT = "�";

  public final Settings settings;

  public GlyphShaper(Settings settings) {
    this.settings = settings;
  }

  /**
   * Columns of a row taken by markers.
   */
  public int reserved() {
    return settings.showCtrl || settings.wrapCtrl ? 1 : 0;
  }

  private static boolean isBreakMarker(Grapheme g) {
    return g.is(DisplayWidth.SOFT_HYPHEN) || g.is(DisplayWidth.ZERO_WIDTH_SPACE);
  }

  static boolean isBreakOpportunity(Grapheme g) {
    return g.is(' ') || g.is('-') || isBreakMarker(g);
  }

  /**
   * Screen width of the grapheme at screen column {@code x} of its row. {@code atBreak} is set for the last grapheme
   * of a row that continues on the next one.
   */
  public int width(Grapheme g, long x, boolean atBreak) {
    if (g.isLineBreak()) {
      return settings.showCtrl ? 1 : 0;
    }
    if (g.is('\t')) {
      return DisplayWidth.tab(x, settings.tabWidth);
    }
    if (isBreakMarker(g)) {
      return atBreak || settings.showCtrl ? 1 : 0;
    }
    return DisplayWidth.of(g.text);
  }

  private String display(Grapheme g, boolean atBreak) {
    if (g.isLineBreak()) {
      return settings.showCtrl ? LINE_BREAK_SYMBOL : "";
    }
    if (g.is('\t')) {
      return settings.showCtrl ? TAB_SYMBOL : " ";
    }
    if (g.is(DisplayWidth.SOFT_HYPHEN)) {
      return atBreak ? "-" : settings.showCtrl ? SOFT_HYPHEN_SYMBOL : "";
    }
    if (g.is(DisplayWidth.ZERO_WIDTH_SPACE)) {
      return atBreak ? " " : settings.showCtrl ? ZERO_WIDTH_SPACE_SYMBOL : "";
    }
    int cp = g.codePoint();
    if (DisplayWidth.isControl(cp)) {
      if (!settings.showCtrl) {
        return REPLACEMENT;
      }
      if (cp < 0x20) {
        return new String(Character.toChars(0x2400 + cp));
      }
      return cp == 0x7F ? "␡" : REPLACEMENT;
    }
    return g.text;
  }

  public Glyph shape(Grapheme g, long column, long row, long x, boolean atBreak) {
    return new Glyph(display(g, atBreak), width(g, x, atBreak), g.bytes, column, row, x, g.isLineBreak(), false);
  }

  Glyph softBreak(long offset, long column, long row, long x) {
    return new Glyph(SOFT_BREAK_MARKER, 1, ByteRange.empty(offset), column, row, x, false, true);
  }

  /**
   * Unwrapped screen width of the line content.
   */
  public long lineWidth(TextView store, long line) {
    long x = 0;
    for (Grapheme g : store.graphemes(store.lineContentBytes(line))) {
      x += width(g, x, false);
    }
    return x;
  }

  /**
   * Splits the line content, line break excluded, into rows no wider than {@code viewportWidth} minus
   * {@link #reserved()}. Segments are contiguous and together cover the whole content; an empty line
   * gets one empty segment. A grapheme wider than a row gets a row of its own.
   */
  public List<WrapSegment> wrap(TextView store, long line, WrapMode mode, int viewportWidth) {
    ByteRange content = store.lineContentBytes(line);
    List<WrapSegment> segments = new ArrayList<>();
    long available = Math.max(1, (long)viewportWidth - reserved());
    boolean wrapping = mode != WrapMode.NONE;

    GraphemeCursor cursor = store.graphemes(content).iterator();
    ArrayDeque<Grapheme> replay = new ArrayDeque<>();
    ArrayList<Grapheme> row = new ArrayList<>();
    long column = 0;
    long x = 0;
    int breakAfter = -1;
    while (!replay.isEmpty() || cursor.hasNext()) {
      Grapheme g = replay.isEmpty() ? cursor.next() : replay.pollFirst();
      int w = width(g, x, false);
      // a marker must have room for its break form
      int fit = isBreakMarker(g) ? Math.max(w, 1) : w;
      if (wrapping && x + fit > available && !row.isEmpty()) {
        int cut = mode == WrapMode.WORD && breakAfter >= 0 ? breakAfter + 1 : row.size();
        segments.add(segment(row.subList(0, cut), column, true));
        column += cut;
        replay.addFirst(g);
        for (int i = row.size() - 1; i >= cut; i--) {
          replay.addFirst(row.get(i));
        }
        row.clear();
        x = 0;
        breakAfter = -1;
        continue;
      }
      row.add(g);
      x += w;
      if (isBreakOpportunity(g)) {
        breakAfter = row.size() - 1;
      }
    }
    if (row.isEmpty()) {
      segments.add(new WrapSegment(ByteRange.empty(content.end), column, 0));
    }
    else {
      segments.add(segment(row, column, false));
    }
    return segments;
  }

  private WrapSegment segment(List<Grapheme> row, long column, boolean broken) {
    long x = 0;
    for (int i = 0; i < row.size(); i++) {
      x += width(row.get(i), x, broken && i == row.size() - 1);
    }
    ByteRange bytes = new ByteRange(row.get(0).bytes.start, row.get(row.size() - 1).bytes.end);
    return new WrapSegment(bytes, column, x);
  }

  /**
   * Lazy glyphs of the line, its line break included, for the given wrapping.
   */
  public Iterable<Glyph> glyphs(TextView store, long line, WrapMode mode, int viewportWidth) {
    return glyphs(store, line, wrap(store, line, mode, viewportWidth));
  }

  /**
   * Lazy glyphs of the line laid out along precomputed segments.
   */
  public Iterable<Glyph> glyphs(TextView store, long line, List<WrapSegment> segments) {
    return () -> new GlyphIterator(this, store, line, segments);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    GlyphShaper shaper = (GlyphShaper)o;
    return settings.tabWidth == shaper.settings.tabWidth &&
           settings.showCtrl == shaper.settings.showCtrl &&
           settings.wrapCtrl == shaper.settings.wrapCtrl;
  }

  @Override
  public int hashCode() {
    return Objects.hash(settings.tabWidth, settings.showCtrl, settings.wrapCtrl);
  }
}

package scribe.glyph;

import org.junit.jupiter.api.Test;
import scribe.ByteRange;
import scribe.Settings;
import scribe.TextException;
import scribe.text.TextStore;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GlyphShaperTest {

  private static final GlyphShaper PLAIN = new GlyphShaper(Settings.DEFAULT);

  private static List<Glyph> glyphs(GlyphShaper shaper, String text, WrapMode mode, int width) {
    List<Glyph> result = new ArrayList<>();
    for (Glyph g : shaper.glyphs(TextStore.create(text), 0, mode, width)) {
      result.add(g);
    }
    return result;
  }

  private static List<String> texts(List<Glyph> glyphs) {
    List<String> result = new ArrayList<>();
    for (Glyph g : glyphs) {
      result.add(g.text);
    }
    return result;
  }

  private static List<String> rows(TextStore store, List<WrapSegment> segments) {
    List<String> result = new ArrayList<>();
    for (WrapSegment s : segments) {
      result.add(store.text(s.bytes));
    }
    return result;
  }

  private static void assertCovers(TextStore store, long line, List<WrapSegment> segments, long available) {
    ByteRange content = store.lineContentBytes(line);
    long at = content.start;
    for (WrapSegment s : segments) {
      assertEquals(at, s.bytes.start);
      assertTrue(s.width <= available || store.graphemes(s.bytes).count() == 1, s.toString());
      at = s.bytes.end;
    }
    assertEquals(content.end, at);
  }

  @Test
  public void softHyphenBreaksWords() {
    TextStore store = TextStore.create("a-soft\u00ADhyphen-test");
    List<WrapSegment> segments = PLAIN.wrap(store, 0, WrapMode.WORD, 8);
    assertEquals(List.of(new WrapSegment(new ByteRange(0, 8), 0, 7),
                         new WrapSegment(new ByteRange(8, 15), 7, 7),
                         new WrapSegment(new ByteRange(15, 19), 14, 4)),
                 segments);
    assertEquals(List.of("a-soft\u00AD", "hyphen-", "test"), rows(store, segments));

    List<Glyph> glyphs = new ArrayList<>();
    PLAIN.glyphs(store, 0, segments).forEach(glyphs::add);
    Glyph hyphen = glyphs.get(6);
    assertEquals("-", hyphen.text);
    assertEquals(1, hyphen.screenWidth);
    assertEquals(0, hyphen.row);
    assertEquals(6, hyphen.screenColumn);
  }

  @Test
  public void invisibleSoftHyphenInsideRow() {
    List<Glyph> glyphs = glyphs(PLAIN, "ab\u00ADcd", WrapMode.NONE, 80);
    assertEquals(List.of("a", "b", "", "c", "d"), texts(glyphs));
    assertEquals(0, glyphs.get(2).screenWidth);
    assertEquals(2, glyphs.get(3).screenColumn);
  }

  @Test
  public void wordWrapAtSpaces() {
    TextStore store = TextStore.create("hello world foo");
    List<WrapSegment> segments = PLAIN.wrap(store, 0, WrapMode.WORD, 8);
    assertEquals(List.of("hello ", "world ", "foo"), rows(store, segments));
    assertCovers(store, 0, segments, 8);
  }

  @Test
  public void wordWrapFallsBackToHardBreaks() {
    TextStore store = TextStore.create("abcdefghij");
    assertEquals(List.of("abcd", "efgh", "ij"), rows(store, PLAIN.wrap(store, 0, WrapMode.WORD, 4)));
    assertEquals(List.of("abcd", "efgh", "ij"), rows(store, PLAIN.wrap(store, 0, WrapMode.HARD, 4)));
    assertEquals(List.of("abcdefghij"), rows(store, PLAIN.wrap(store, 0, WrapMode.NONE, 4)));
  }

  @Test
  public void wideCharactersAreNotSplit() {
    TextStore store = TextStore.create("日本語");
    List<WrapSegment> segments = PLAIN.wrap(store, 0, WrapMode.HARD, 5);
    assertEquals(List.of("日本", "語"), rows(store, segments));
    assertEquals(4, segments.get(0).width);
    assertCovers(store, 0, segments, 5);

    TextStore narrow = TextStore.create("日a");
    assertEquals(List.of("日", "a"), rows(narrow, PLAIN.wrap(narrow, 0, WrapMode.HARD, 1)));
  }

  @Test
  public void tabsExpandToTabStops() {
    List<Glyph> glyphs = glyphs(PLAIN, "a\tb", WrapMode.NONE, 80);
    assertEquals(List.of(1, 7, 1), List.of(glyphs.get(0).screenWidth, glyphs.get(1).screenWidth, glyphs.get(2).screenWidth));
    assertEquals(" ", glyphs.get(1).text);
    assertEquals(8, glyphs.get(2).screenColumn);

    GlyphShaper visible = new GlyphShaper(Settings.DEFAULT.withShowCtrl(true).withTabWidth(4));
    List<Glyph> shown = glyphs(visible, "a\tb", WrapMode.NONE, 80);
    assertEquals("␉", shown.get(1).text);
    assertEquals(3, shown.get(1).screenWidth);
  }

  @Test
  public void controlCharacters() {
    List<Glyph> hidden = glyphs(PLAIN, "a\u0007\u007F", WrapMode.NONE, 80);
    assertEquals(List.of("a", "\uFFFD", "\uFFFD"), texts(hidden));

    GlyphShaper visible = new GlyphShaper(Settings.DEFAULT.withShowCtrl(true));
    List<Glyph> shown = glyphs(visible, "a\u0007\u007F", WrapMode.NONE, 80);
    assertEquals(List.of("a", "␇", "␡"), texts(shown));
    assertEquals(1, shown.get(1).screenWidth);
  }

  @Test
  public void lineBreakGlyph() {
    TextStore store = TextStore.create("ab\ncd");
    List<Glyph> glyphs = new ArrayList<>();
    PLAIN.glyphs(store, 0, WrapMode.NONE, 80).forEach(glyphs::add);
    assertEquals(3, glyphs.size());
    Glyph lineBreak = glyphs.get(2);
    assertTrue(lineBreak.lineBreak);
    assertEquals(0, lineBreak.screenWidth);
    assertEquals(new ByteRange(2, 3), lineBreak.bytes);

    GlyphShaper visible = new GlyphShaper(Settings.DEFAULT.withShowCtrl(true));
    List<Glyph> shown = new ArrayList<>();
    visible.glyphs(store, 0, WrapMode.NONE, 80).forEach(shown::add);
    assertEquals("␊", shown.get(2).text);
    assertEquals(1, shown.get(2).screenWidth);

    List<Glyph> last = new ArrayList<>();
    PLAIN.glyphs(store, 1, WrapMode.NONE, 80).forEach(last::add);
    assertEquals(List.of("c", "d"), texts(last));
  }

  @Test
  public void softBreakMarkers() {
    GlyphShaper shaper = new GlyphShaper(Settings.DEFAULT.withWrapCtrl(true));
    List<Glyph> glyphs = glyphs(shaper, "abcdef", WrapMode.HARD, 4);
    assertEquals(List.of("a", "b", "c", GlyphShaper.SOFT_BREAK_MARKER, "d", "e", "f"), texts(glyphs));
    Glyph marker = glyphs.get(3);
    assertTrue(marker.softBreak);
    assertEquals(0, marker.row);
    assertEquals(3, marker.screenColumn);
    assertEquals(ByteRange.empty(3), marker.bytes);
    assertEquals(1, glyphs.get(4).row);
    assertEquals(0, glyphs.get(4).screenColumn);
  }

  @Test
  public void emptyLineHasOneRow() {
    TextStore store = TextStore.create("a\n\nb");
    List<WrapSegment> segments = PLAIN.wrap(store, 1, WrapMode.WORD, 10);
    assertEquals(List.of(new WrapSegment(ByteRange.empty(2), 0, 0)), segments);
  }

  @Test
  public void rowsNeverExceedAvailableWidth() {
    TextStore store = TextStore.create("The quick\tbrown fox 日本語 jumps-over the\u200Blazy dog 👍🏽 again");
    for (int width = 1; width < 30; width++) {
      for (WrapMode mode : List.of(WrapMode.HARD, WrapMode.WORD)) {
        assertCovers(store, 0, PLAIN.wrap(store, 0, mode, width), width);
      }
    }
  }

  @Test
  public void iteratorSkips() {
    TextStore store = TextStore.create("hello world foo");
    List<WrapSegment> segments = PLAIN.wrap(store, 0, WrapMode.WORD, 8);
    GlyphIterator it = new GlyphIterator(PLAIN, store, 0, segments);
    it.skipTo(8);
    assertEquals(1, it.row());
    assertEquals(2, it.screenColumn());
    assertEquals(8, it.column());
    assertEquals("r", it.next().text);

    it.skipTo(2);
    assertEquals(0, it.row());
    assertEquals("l", it.next().text);

    it.skipTo(15);
    assertFalse(it.hasNext());
    assertEquals(2, it.row());
    assertEquals(3, it.screenColumn());

    assertThrows(TextException.class, () -> it.skipTo(16));
  }

  @Test
  public void iteratorSkipsAroundLineBreak() {
    TextStore store = TextStore.create("ab\r\ncd");
    List<WrapSegment> segments = PLAIN.wrap(store, 0, WrapMode.NONE, 80);
    GlyphIterator it = new GlyphIterator(PLAIN, store, 0, segments);
    assertThrows(TextException.class, () -> it.skipTo(3));
    it.skipTo(2);
    Glyph lineBreak = it.next();
    assertTrue(lineBreak.lineBreak);
    assertEquals(new ByteRange(2, 4), lineBreak.bytes);
    assertFalse(it.hasNext());

    it.skipTo(0);
    assertEquals("a", it.next().text);
    it.skipLine();
    assertFalse(it.hasNext());
  }

  @Test
  public void glyphsRestart() {
    TextStore store = TextStore.create("tab\there");
    Iterable<Glyph> glyphs = PLAIN.glyphs(store, 0, WrapMode.HARD, 6);
    List<Glyph> first = new ArrayList<>();
    glyphs.forEach(first::add);
    List<Glyph> second = new ArrayList<>();
    glyphs.forEach(second::add);
    assertEquals(first, second);
    assertEquals(8, first.size());
  }
}

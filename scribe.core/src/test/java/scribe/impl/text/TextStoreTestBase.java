package scribe.impl.text;

import org.junit.jupiter.api.Test;
import scribe.ByteRange;
import scribe.Edit;
import scribe.TextException;
import scribe.TextPosition;
import scribe.TextRange;
import scribe.text.Grapheme;
import scribe.text.GraphemeCursor;
import scribe.text.TextStore;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour both store backends share.
 */
public abstract class TextStoreTestBase {

  protected abstract TextStore create(String text);

  private static List<String> texts(Iterable<Grapheme> graphemes) {
    List<String> result = new ArrayList<>();
    for (Grapheme g : graphemes) {
      result.add(g.text);
    }
    return result;
  }

  private static void assertRoundTrip(TextStore store) {
    for (long o = 0; o <= store.lenBytes(); o++) {
      if (store.isBoundary(o)) {
        TextPosition p = store.byteToPosition(o);
        assertEquals(o, store.positionToByte(p), "offset " + o + " via " + p);
      }
    }
  }

  @Test
  public void lengths() {
    TextStore store = create("héllo\nwörld");
    assertEquals(13, store.lenBytes());
    assertEquals(2, store.lenLines());
    assertEquals(new ByteRange(0, 7), store.lineBytes(0));
    assertEquals(new ByteRange(0, 6), store.lineContentBytes(0));
    assertEquals(new ByteRange(7, 13), store.lineBytes(1));
    assertEquals(5, store.lineWidth(0));
    assertEquals("wörld", store.text(store.lineBytes(1)));
  }

  @Test
  public void emptyDocument() {
    TextStore store = create("");
    assertEquals(0, store.lenBytes());
    assertEquals(1, store.lenLines());
    assertEquals(TextPosition.ZERO, store.byteToPosition(0));
    assertEquals(0, store.positionToByte(TextPosition.ZERO));
    assertEquals(0, store.graphemes(new ByteRange(0, 0)).count());
  }

  @Test
  public void insertAtEndOfFirstLine() {
    TextStore store = create("héllo\nwörld");
    Edit edit = store.insert(6, "!");
    assertEquals(1, edit.insertedBytes);
    assertEquals(0, edit.line);
    assertEquals("héllo!\nwörld", store.text());
    assertEquals(2, store.lenLines());
    assertEquals(6, store.lineWidth(0));
    assertEquals(TextPosition.of(0, 6), store.byteToPosition(7));
    assertEquals(TextPosition.of(1, 0), store.byteToPosition(8));
    assertRoundTrip(store);
  }

  @Test
  public void combiningMarksFormOneGrapheme() {
    TextStore store = create("cafe\u0301!");
    assertEquals(List.of("c", "a", "f", "e\u0301", "!"), texts(store.graphemes(new ByteRange(0, store.lenBytes()))));
    assertTrue(store.isBoundary(3));
    assertFalse(store.isBoundary(4));
    assertFalse(store.isBoundary(5));
    assertTrue(store.isBoundary(6));
    assertEquals(TextPosition.of(0, 4), store.byteToPosition(6));
    TextException e = assertThrows(TextException.class, () -> store.insert(4, "x"));
    assertEquals(TextException.Kind.INVALID_BOUNDARY, e.getKind());
    assertEquals("cafe\u0301!", store.text());
  }

  @Test
  public void emojiSequences() {
    String family = "\uD83D\uDC68\u200D\uD83D\uDC69\u200D\uD83D\uDC67";
    TextStore store = create("a👍🏽b" + family);
    List<Grapheme> graphemes = store.graphemes(new ByteRange(0, store.lenBytes())).toList();
    assertEquals(4, graphemes.size());
    assertEquals(new ByteRange(1, 9), graphemes.get(1).bytes);
    assertEquals(new ByteRange(10, 28), graphemes.get(3).bytes);
    assertFalse(store.isBoundary(5));
    assertEquals(TextPosition.of(0, 4), store.byteToPosition(28));
    assertRoundTrip(store);
  }

  @Test
  public void crlfIsOneLineBreak() {
    TextStore store = create("ab\r\ncd");
    assertEquals(2, store.lenLines());
    assertEquals(new ByteRange(0, 4), store.lineBytes(0));
    assertEquals(new ByteRange(0, 2), store.lineContentBytes(0));
    assertFalse(store.isBoundary(3));
    assertThrows(TextException.class, () -> store.byteToPosition(3));
    assertThrows(TextException.class, () -> store.delete(new ByteRange(3, 4)));
    assertEquals(TextPosition.of(0, 2), store.byteToPosition(2));
    assertEquals(TextPosition.of(1, 0), store.byteToPosition(4));
    assertEquals(2, store.positionToByte(TextPosition.of(0, 2)));
    assertThrows(TextException.class, () -> store.positionToByte(TextPosition.of(0, 3)));
    assertEquals(List.of("a", "b", "\r\n", "c", "d"), texts(store.graphemes(new ByteRange(0, 6))));
    assertRoundTrip(store);

    Edit edit = store.delete(new ByteRange(2, 4));
    assertEquals("\r\n", edit.deleted);
    assertEquals(1, edit.deletedLines);
    assertEquals("abcd", store.text());
    assertEquals(1, store.lenLines());
  }

  @Test
  public void loneCarriageReturnIsNoLineBreak() {
    TextStore store = create("a\rb");
    assertEquals(1, store.lenLines());
    assertEquals(3, store.lineWidth(0));
  }

  @Test
  public void endOfDocument() {
    TextStore store = create("ab\ncd");
    assertEquals(TextPosition.of(1, 2), store.byteToPosition(5));
    assertEquals(5, store.positionToByte(TextPosition.MAX));
    assertEquals(new ByteRange(0, 5), store.rangeToBytes(TextRange.MAX));
    assertThrows(TextException.class, () -> store.byteToPosition(6));
    assertThrows(TextException.class, () -> store.positionToByte(TextPosition.of(2, 0)));
    assertThrows(TextException.class, () -> store.positionToByte(TextPosition.of(1, 3)));
    assertFalse(store.isBoundary(-1));
    assertFalse(store.isBoundary(6));
  }

  @Test
  public void endOfDocumentAfterLineBreak() {
    TextStore store = create("ab\n");
    assertEquals(2, store.lenLines());
    assertEquals(new ByteRange(3, 3), store.lineBytes(1));
    assertEquals(TextPosition.of(1, 0), store.byteToPosition(3));
    assertEquals(3, store.positionToByte(TextPosition.of(1, 0)));
  }

  @Test
  public void emptyDeleteIsIdentity() {
    TextStore store = create("hello");
    Edit edit = store.delete(ByteRange.empty(2));
    assertTrue(Edit.isIdentity(edit));
    assertEquals("hello", store.text());
  }

  @Test
  public void deleteReturnsRemovedText() {
    TextStore store = create("one\ntwo\nthree");
    Edit edit = store.delete(new ByteRange(2, 9));
    assertEquals("e\ntwo\nt", edit.deleted);
    assertEquals(7, edit.deletedBytes);
    assertEquals(2, edit.deletedLines);
    assertEquals("onhree", store.text());
    assertEquals(1, store.lenLines());
  }

  @Test
  public void invalidRange() {
    TextException e = assertThrows(TextException.class, () -> new ByteRange(5, 2));
    assertEquals(TextException.Kind.INVALID_RANGE, e.getKind());
    assertThrows(TextException.class, () -> TextRange.of(1, 0, 0, 4));
  }

  @Test
  public void negativeOffsetIsNoBoundary() {
    TextException e = assertThrows(TextException.class, () -> new ByteRange(-1, 2));
    assertEquals(TextException.Kind.INVALID_BOUNDARY, e.getKind());
  }

  @Test
  public void insertOutsideOfDocument() {
    TextStore store = create("abc");
    assertThrows(TextException.class, () -> store.insert(4, "x"));
    assertThrows(TextException.class, () -> store.insert(-1, "x"));
    assertEquals("abc", store.text());
  }

  @Test
  public void rangesConvert() {
    TextStore store = create("héllo\nwörld");
    TextRange range = TextRange.of(0, 1, 1, 2);
    ByteRange bytes = store.rangeToBytes(range);
    assertEquals(new ByteRange(1, 10), bytes);
    assertEquals(range, store.bytesToRange(bytes));
  }

  @Test
  public void cursorSkips() {
    TextStore store = create("ab\ncd\r\nef");
    GraphemeCursor cursor = store.graphemes(new ByteRange(0, store.lenBytes())).iterator();
    cursor.skipLine();
    assertEquals(3, cursor.offset());
    assertEquals("c", cursor.next().text);
    cursor.skipLine();
    assertEquals("e", cursor.next().text);
    cursor.skipTo(1);
    assertEquals("b", cursor.next().text);
    assertThrows(TextException.class, () -> cursor.skipTo(6));
    cursor.skipTo(store.lenBytes());
    assertFalse(cursor.hasNext());
  }

  @Test
  public void graphemesRestart() {
    TextStore store = create("xyz");
    Iterable<Grapheme> graphemes = store.graphemes(new ByteRange(1, 3));
    assertEquals(texts(graphemes), texts(graphemes));
    assertEquals(List.of("y", "z"), texts(graphemes));
  }

  @Test
  public void setTextReplacesEverything() {
    TextStore store = create("old\ntext");
    Edit edit = store.setText("new");
    assertEquals("old\ntext", edit.deleted);
    assertEquals("new", edit.inserted);
    assertEquals(1, store.lenLines());
    assertEquals("new", store.text());
  }

  @Test
  public void roundTripOnMixedText() {
    TextStore store = create("tab\there\r\nnaïve café\n\n日本語 text\n👍🏽 end\u00AD\n");
    assertRoundTrip(store);
    for (long line = 0; line < store.lenLines(); line++) {
      long width = store.lineWidth(line);
      for (long column = 0; column <= width; column++) {
        TextPosition p = TextPosition.of(line, column);
        assertEquals(p, store.byteToPosition(store.positionToByte(p)));
      }
    }
  }

  @Test
  public void lineOfLineBreak() {
    TextStore store = create("ab\ncd");
    assertEquals(0, store.lineOf(2));
    assertEquals(1, store.lineOf(3));
    assertEquals(1, store.lineOf(5));
  }
}

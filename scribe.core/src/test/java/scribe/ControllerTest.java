package scribe;

import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import scribe.carets.Caret;
import scribe.glyph.WrapMode;
import scribe.styles.StyleSpan;
import scribe.undo.ReplayEntry;
import scribe.undo.UndoOp;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ControllerTest {

  private static final class TestClipboard implements Clipboard {
    @Nullable String content;

    @Nullable
    @Override
    public String getString() {
      return content;
    }

    @Override
    public void setString(String text) {
      content = text;
    }
  }

  private static Editor editor(String text, long cursor) {
    Editor editor = new Editor(text);
    editor.setCaret(Caret.at(cursor));
    return editor;
  }

  @Test
  public void outcomes() {
    Editor editor = editor("hello", 0);
    assertEquals(Outcome.CONTINUE, Controller.setCursor(editor, 0, false));
    assertEquals(Outcome.CHANGED, Controller.setCursor(editor, TextPosition.of(0, 2), false));
    assertEquals(Outcome.TEXT_CHANGED, Controller.insertText(editor, "XY"));
    assertEquals(Outcome.CONTINUE, Controller.insertText(editor, ""));
    assertEquals(Outcome.CONTINUE, Controller.deleteSelection(editor));
    assertEquals(Outcome.TEXT_CHANGED, Controller.undo(editor));
    assertEquals("hello", editor.text());
    assertEquals(Outcome.CONTINUE, Controller.undo(editor));
    assertEquals(Outcome.TEXT_CHANGED, Controller.redo(editor));
    assertEquals(Outcome.CONTINUE, Controller.redo(editor));
  }

  @Test
  public void insertReplacesSelection() {
    Editor editor = new Editor("hello world");
    assertEquals(Outcome.CHANGED, Controller.setSelection(editor, TextRange.of(0, 6, 0, 11)));
    assertEquals(Outcome.TEXT_CHANGED, Controller.insertText(editor, "there"));
    assertEquals("hello there", editor.text());
    assertEquals(Caret.at(11), editor.caret());
    Controller.undo(editor);
    assertEquals("hello world", editor.text());
    assertEquals(new ByteRange(6, 11), editor.caret().selection());
  }

  @Test
  public void undoSequenceGroupsCommands() {
    Editor editor = editor("", 0);
    assertEquals(Outcome.CONTINUE, Controller.beginUndoSequence(editor));
    Controller.insertChar(editor, 'a');
    Controller.insertChar(editor, 0x1F600);
    Controller.insertNewline(editor);
    assertEquals(Outcome.CONTINUE, Controller.endUndoSequence(editor));
    assertEquals(Outcome.CONTINUE, Controller.endUndoSequence(editor));
    assertEquals("a😀\n", editor.text());
    assertEquals(1, editor.undoBuffer().remainingUndo());
    assertEquals(Outcome.TEXT_CHANGED, Controller.undo(editor));
    assertEquals("", editor.text());
  }

  @Test
  public void newlineFollowsSettings() {
    Editor editor = new Editor("ab", Settings.DEFAULT.withNewline("\r\n"));
    editor.setCaret(Caret.at(1));
    Controller.insertNewline(editor);
    assertEquals("a\r\nb", editor.text());
    assertEquals(TextPosition.of(1, 0), editor.cursorPosition());
  }

  @Test
  public void deleteAroundCursor() {
    Editor editor = editor("a\u00E9b\r\nc", 3);
    assertEquals(Outcome.TEXT_CHANGED, Controller.deletePrev(editor));
    assertEquals("ab\r\nc", editor.text());
    assertEquals(1, editor.caret().offset);

    Controller.setCursor(editor, 2, false);
    assertEquals(Outcome.TEXT_CHANGED, Controller.deleteNext(editor));
    assertEquals("abc", editor.text());

    Controller.moveDocumentEnd(editor, false);
    assertEquals(Outcome.CONTINUE, Controller.deleteNext(editor));
    Controller.moveDocumentStart(editor, false);
    assertEquals(Outcome.CONTINUE, Controller.deletePrev(editor));
  }

  @Test
  public void horizontalMovement() {
    Editor editor = editor("a\u00E9\r\nb", 0);
    Controller.moveRight(editor, false);
    assertEquals(1, editor.caret().offset);
    Controller.moveRight(editor, false);
    assertEquals(3, editor.caret().offset);
    Controller.moveRight(editor, false);
    assertEquals(5, editor.caret().offset);
    assertEquals(TextPosition.of(1, 0), editor.cursorPosition());
    Controller.moveLeft(editor, false);
    assertEquals(3, editor.caret().offset);
    Controller.moveLeft(editor, true);
    assertEquals(new ByteRange(1, 3), editor.caret().selection());
    assertEquals(3, editor.caret().anchor());
    Controller.moveRight(editor, false);
    assertEquals(Caret.at(3), editor.caret());
    Controller.moveDocumentEnd(editor, false);
    assertEquals(Outcome.CONTINUE, Controller.moveRight(editor, false));
  }

  @Test
  public void lineStartAndEnd() {
    Editor editor = editor("one\r\ntwo", 6);
    Controller.moveLineEnd(editor, false);
    assertEquals(8, editor.caret().offset);
    Controller.moveLineStart(editor, true);
    assertEquals(new ByteRange(5, 8), editor.caret().selection());
    Controller.setCursor(editor, 1, false);
    Controller.moveLineEnd(editor, false);
    assertEquals(3, editor.caret().offset);
  }

  @Test
  public void wordMovement() {
    Editor editor = editor("foo bar.baz", 0);
    long[] forward = {4, 7, 8, 11, 11};
    for (long expected : forward) {
      Controller.moveWordNext(editor, false);
      assertEquals(expected, editor.caret().offset);
    }
    long[] backward = {8, 7, 4, 0, 0};
    for (long expected : backward) {
      Controller.moveWordPrev(editor, false);
      assertEquals(expected, editor.caret().offset);
    }
  }

  @Test
  public void wordMovementAcrossLines() {
    Editor editor = editor("ab  \ncd", 2);
    Controller.moveWordNext(editor, false);
    assertEquals(5, editor.caret().offset);
    Controller.moveWordPrev(editor, false);
    assertEquals(0, editor.caret().offset);
  }

  @Test
  public void verticalMovementKeepsColumn() {
    Editor editor = new Editor("abcdef\nab\nabcdef");
    Controller.setCursor(editor, TextPosition.of(0, 5), false);
    Controller.moveDown(editor, false);
    assertEquals(TextPosition.of(1, 2), editor.cursorPosition());
    Controller.moveDown(editor, false);
    assertEquals(TextPosition.of(2, 5), editor.cursorPosition());
    Controller.moveDown(editor, false);
    assertEquals(TextPosition.of(2, 6), editor.cursorPosition());
    Controller.moveUp(editor, true);
    assertEquals(TextPosition.of(1, 2), editor.cursorPosition());
    assertTrue(editor.caret().hasSelection());
    Controller.moveUp(editor, false);
    Controller.moveUp(editor, false);
    assertEquals(TextPosition.of(0, 0), editor.cursorPosition());
  }

  @Test
  public void verticalMovementOverWrappedRows() {
    Editor editor = new Editor("hello world foo");
    editor.setLayout(WrapMode.WORD, 8);
    Controller.setCursor(editor, 1, false);
    Controller.moveDown(editor, false);
    assertEquals(7, editor.caret().offset);
    Controller.moveDown(editor, false);
    assertEquals(13, editor.caret().offset);
  }

  @Test
  public void tabs() {
    Editor editor = editor("ab", 2);
    Controller.insertTab(editor);
    assertEquals("ab\t", editor.text());

    Editor expanding = new Editor("ab", Settings.DEFAULT.withExpandTabs(true).withTabWidth(4));
    expanding.setCaret(Caret.at(2));
    Controller.insertTab(expanding);
    assertEquals("ab  ", expanding.text());
    Controller.insertTab(expanding);
    assertEquals("ab      ", expanding.text());
    assertEquals(8, expanding.caret().offset);
  }

  @Test
  public void clipboard() {
    TestClipboard clipboard = new TestClipboard();
    Editor editor = new Editor("copy me", 7, Settings.DEFAULT, clipboard);
    assertEquals(Outcome.CONTINUE, Controller.copy(editor));
    assertEquals(Outcome.CONTINUE, Controller.paste(editor));

    Controller.setSelection(editor, TextRange.of(0, 0, 0, 5));
    assertEquals(Outcome.CHANGED, Controller.copy(editor));
    assertEquals("copy ", clipboard.content);
    assertEquals(Outcome.TEXT_CHANGED, Controller.cut(editor));
    assertEquals("me", editor.text());

    Controller.moveDocumentEnd(editor, false);
    assertEquals(Outcome.TEXT_CHANGED, Controller.paste(editor));
    assertEquals("mecopy ", editor.text());

    Editor detached = new Editor("text");
    Controller.selectAll(detached);
    assertEquals(Outcome.CONTINUE, Controller.copy(detached));
    assertEquals(Outcome.CONTINUE, Controller.cut(detached));
    assertEquals("text", detached.text());
  }

  @Test
  public void textAndStyleCommands() {
    Editor editor = new Editor("abc");
    assertEquals(Outcome.CONTINUE, Controller.setText(editor, "abc"));
    assertEquals(Outcome.TEXT_CHANGED, Controller.setText(editor, "xyz"));
    assertEquals(Outcome.CHANGED, Controller.addStyle(editor, TextRange.of(0, 0, 0, 2), 3));
    assertEquals(Outcome.CONTINUE, Controller.addStyle(editor, new ByteRange(0, 2), 3));
    assertEquals(Outcome.CHANGED, Controller.removeStyle(editor, new ByteRange(0, 2), 3));
    assertEquals(Outcome.CHANGED, Controller.setStyles(editor, List.of(StyleSpan.of(1, 2, 4))));
    assertEquals(List.of(StyleSpan.of(1, 2, 4)), editor.styles().styles());
    assertEquals(Outcome.TEXT_CHANGED, Controller.clear(editor));
    assertEquals("", editor.text());
    assertEquals(Outcome.CONTINUE, Controller.clear(editor));
  }

  @Test
  public void invalidPositionsFail() {
    Editor editor = new Editor("ab\ncd");
    assertThrows(TextException.class, () -> Controller.setCursor(editor, TextPosition.of(5, 0), false));
    assertThrows(TextException.class, () -> Controller.setCursor(editor, 9, false));
    assertThrows(TextException.class, () -> Controller.setSelection(editor, TextRange.of(0, 1, 0, 7)));
    assertEquals(Caret.ZERO, editor.caret());
  }

  @Test
  public void newlineCopiesIndent() {
    Editor editor = editor("  \tfoo", 6);
    assertEquals(Outcome.TEXT_CHANGED, Controller.insertNewline(editor));
    assertEquals("  \tfoo\n  \t", editor.text());
    assertEquals(10, editor.caret().offset);
    Controller.undo(editor);
    assertEquals("  \tfoo", editor.text());
    assertEquals(0, editor.undoBuffer().remainingUndo());

    Editor plain = new Editor("  \tfoo", Settings.DEFAULT.withAutoIndent(false));
    plain.setCaret(Caret.at(6));
    Controller.insertNewline(plain);
    assertEquals("  \tfoo\n", plain.text());
  }

  @Test
  public void tabIndentsSelectedLines() {
    Editor editor = new Editor("ab\ncd\nef", Settings.DEFAULT.withTabWidth(2));
    editor.setCaret(Caret.select(1, 4));
    assertEquals(Outcome.TEXT_CHANGED, Controller.insertTab(editor));
    assertEquals("  ab\n  cd\nef", editor.text());
    assertTrue(editor.caret().hasSelection());
    Controller.undo(editor);
    assertEquals("ab\ncd\nef", editor.text());

    Editor off = new Editor("ab\ncd", Settings.DEFAULT.withAutoIndent(false));
    Controller.selectAll(off);
    assertEquals(Outcome.CONTINUE, Controller.insertTab(off));
    assertEquals("ab\ncd", off.text());
  }

  @Test
  public void backtabDedentsSelectedLines() {
    Editor editor = new Editor("  ab\n\t cd\n   ef", Settings.DEFAULT.withTabWidth(2));
    assertEquals(Outcome.CONTINUE, Controller.insertBacktab(editor));
    Controller.selectAll(editor);
    assertEquals(Outcome.TEXT_CHANGED, Controller.insertBacktab(editor));
    assertEquals("ab\ncd\n ef", editor.text());
    assertEquals(Outcome.TEXT_CHANGED, Controller.undo(editor));
    assertEquals("  ab\n\t cd\n   ef", editor.text());
  }

  @Test
  public void duplicate() {
    Editor editor = editor("ab\ncd", 1);
    assertEquals(Outcome.TEXT_CHANGED, Controller.duplicateText(editor));
    assertEquals("ab\nab\ncd", editor.text());
    assertEquals(4, editor.caret().offset);

    Controller.setCursor(editor, 7, false);
    Controller.duplicateText(editor);
    assertEquals("ab\nab\ncd\ncd", editor.text());

    Editor selected = new Editor("hello");
    selected.setCaret(Caret.select(1, 3));
    Controller.duplicateText(selected);
    assertEquals("helello", selected.text());
    assertEquals(new ByteRange(1, 3), selected.caret().selection());

    assertEquals(Outcome.CONTINUE, Controller.duplicateText(new Editor("")));
  }

  @Test
  public void deleteLines() {
    Editor editor = editor("one\ntwo\nthree", 5);
    assertEquals(Outcome.TEXT_CHANGED, Controller.deleteLine(editor));
    assertEquals("one\nthree", editor.text());
    assertEquals(4, editor.caret().offset);
    assertEquals(Outcome.TEXT_CHANGED, Controller.deleteLine(editor));
    assertEquals("one\n", editor.text());
    assertEquals(Outcome.CONTINUE, Controller.deleteLine(editor));
  }

  @Test
  public void deleteWords() {
    Editor editor = editor("foo  bar baz", 3);
    Controller.deleteNextWord(editor);
    assertEquals("foobar baz", editor.text());
    Controller.deleteNextWord(editor);
    assertEquals("foo baz", editor.text());
    Controller.deleteNextWord(editor);
    assertEquals("foobaz", editor.text());
    Controller.deleteNextWord(editor);
    assertEquals("foo", editor.text());
    assertEquals(Outcome.CONTINUE, Controller.deleteNextWord(editor));

    Editor back = editor("  foo bar", 9);
    Controller.deletePrevWord(back);
    assertEquals("  foo ", back.text());
    Controller.deletePrevWord(back);
    assertEquals("  foo", back.text());
    Controller.deletePrevWord(back);
    assertEquals("  ", back.text());
    Controller.deletePrevWord(back);
    assertEquals("", back.text());
    assertEquals(Outcome.CONTINUE, Controller.deletePrevWord(back));

    Editor joined = editor("ab\ncd", 3);
    assertEquals(Outcome.TEXT_CHANGED, Controller.deletePrevWord(joined));
    assertEquals("abcd", joined.text());

    Editor selected = new Editor("abc def");
    selected.setCaret(Caret.select(1, 5));
    Controller.deletePrevWord(selected);
    assertEquals("aef", selected.text());
  }

  @Test
  public void wordEndMovement() {
    Editor editor = editor("foo  bar\nbaz", 0);
    long[] forward = {3, 8, 12, 12};
    for (long expected : forward) {
      Controller.moveWordEndNext(editor, false);
      assertEquals(expected, editor.caret().offset);
    }
    long[] backward = {8, 3, 0};
    for (long expected : backward) {
      Controller.moveWordEndPrev(editor, false);
      assertEquals(expected, editor.caret().offset);
    }
    Controller.moveWordEndNext(editor, true);
    assertEquals(new ByteRange(0, 3), editor.caret().selection());
  }

  @Test
  public void removeStyleFullyUndoesInOneStep() {
    Editor editor = new Editor("hello world", Settings.DEFAULT.withUndoStyles(true));
    editor.addStyle(new ByteRange(0, 5), 1);
    editor.addStyle(new ByteRange(2, 8), 2);
    editor.addStyle(new ByteRange(6, 11), 1);
    List<StyleSpan> all = editor.styles().styles();

    assertEquals(Outcome.CHANGED, Controller.removeStyleFully(editor, 1));
    assertEquals(List.of(StyleSpan.of(2, 8, 2)), editor.styles().styles());
    assertEquals(Outcome.CONTINUE, Controller.removeStyleFully(editor, 1));
    assertEquals(Outcome.CHANGED, Controller.undo(editor));
    assertEquals(all, editor.styles().styles());
  }

  @Test
  public void replayLogKeepsAnotherEditorInStep() {
    Editor source = editor("hello", 5);
    Editor mirror = new Editor("hello");
    assertEquals(List.of(), source.undoBuffer().recentReplayLog());
    source.undoBuffer().enableReplayLog(true);

    Controller.insertText(source, " world");
    Controller.addStyle(source, new ByteRange(0, 5), 1);
    Controller.setCursor(source, 0, false);
    Controller.deleteNextWord(source);
    Controller.undo(source);
    Controller.undo(source);
    Controller.redo(source);

    List<ReplayEntry> log = source.undoBuffer().recentReplayLog();
    assertEquals(6, log.size());
    assertTrue(log.get(1).ops.get(0) instanceof UndoOp.AddStyle);
    assertEquals(ReplayEntry.UNDO, log.get(3));
    assertEquals(ReplayEntry.REDO, log.get(5));
    assertEquals(List.of(), source.undoBuffer().recentReplayLog());

    assertEquals(Outcome.TEXT_CHANGED, Controller.replayLog(mirror, log));
    assertEquals(source.text(), mirror.text());
    assertEquals(source.styles().styles(), mirror.styles().styles());
    assertEquals(source.undoBuffer().remainingUndo(), mirror.undoBuffer().remainingUndo());
    assertEquals(source.undoBuffer().remainingRedo(), mirror.undoBuffer().remainingRedo());
    assertEquals(Outcome.CONTINUE, Controller.replayLog(mirror, List.of()));

    Controller.undo(mirror);
    assertEquals("hello", mirror.text());
  }
}

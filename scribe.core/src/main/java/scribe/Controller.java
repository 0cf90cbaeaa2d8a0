package scribe;

import org.jetbrains.annotations.NotNull;
import scribe.carets.Caret;
import scribe.glyph.LineMetricsCache;
import scribe.glyph.ScreenPosition;
import scribe.styles.StyleSpan;
import scribe.text.DisplayWidth;
import scribe.text.Grapheme;
import scribe.text.GraphemeCursor;
import scribe.text.PositionCodec;
import scribe.text.TextView;
import scribe.undo.ReplayEntry;

import java.util.List;
import java.util.Optional;

/**
 * Commands of a text widget. Each one reports how much it changed, invalid positions fail with
 * {@link TextException} before anything is modified.
 */
public final class Controller {

  private Controller() {
  }

  private static Outcome moved(Editor editor, Caret caret) {
    Caret old = editor.caret();
    editor.setCaret(caret);
    return Outcome.of(!old.equals(caret));
  }

  private static Outcome textChanged(Editor editor, long version) {
    return editor.version() != version ? Outcome.TEXT_CHANGED : Outcome.CONTINUE;
  }

  /**
   * Replaces the selection, if any, and inserts at the cursor. Undone in one step.
   */
  public static Outcome insertText(Editor editor, @NotNull String text) {
    Caret caret = editor.caret();
    if (text.isEmpty() && !caret.hasSelection()) {
      return Outcome.CONTINUE;
    }
    long version = editor.version();
    editor.beginUndoGroup();
    try {
      if (caret.hasSelection()) {
        editor.delete(caret.selection());
      }
      editor.insert(editor.caret().offset, text);
    }
    finally {
      editor.endUndoGroup();
    }
    return textChanged(editor, version);
  }

  public static Outcome insertChar(Editor editor, int codePoint) {
    return insertText(editor, new String(Character.toChars(codePoint)));
  }

  /**
   * A tab character, or spaces up to the next tab stop when tabs are expanded. With a selection the selected
   * lines are indented instead, if auto-indent is on.
   */
  public static Outcome insertTab(Editor editor) {
    Settings settings = editor.settings();
    Caret caret = editor.caret();
    if (caret.hasSelection()) {
      return settings.autoIndent ? indent(editor, settings.tabWidth) : Outcome.CONTINUE;
    }
    if (!settings.expandTabs) {
      return insertText(editor, "\t");
    }
    TextView store = editor.store();
    long start = caret.offset;
    long lineStart = store.lineBytes(store.lineOf(start)).start;
    long x = PositionCodec.screenWidth(store.graphemes(new ByteRange(lineStart, start)), settings.tabWidth);
    StringBuilder spaces = new StringBuilder();
    for (int i = DisplayWidth.tab(x, settings.tabWidth); i > 0; i--) {
      spaces.append(' ');
    }
    return insertText(editor, spaces.toString());
  }

  /**
   * Prefixes every line touched by the selection with tab width spaces. Undone in one step.
   */
  private static Outcome indent(Editor editor, int tabWidth) {
    TextView store = editor.store();
    ByteRange selection = editor.caret().selection();
    long first = store.lineOf(selection.start);
    long last = store.lineOf(selection.end);
    String spaces = " ".repeat(tabWidth);
    editor.beginUndoGroup();
    try {
      for (long line = first; line <= last; line++) {
        editor.insert(store.lineBytes(line).start, spaces);
      }
    }
    finally {
      editor.endUndoGroup();
    }
    return Outcome.TEXT_CHANGED;
  }

  /**
   * Removes up to tab width leading spaces or tabs from every line touched by the selection. Does nothing
   * without a selection.
   */
  public static Outcome insertBacktab(Editor editor) {
    Caret caret = editor.caret();
    if (!caret.hasSelection()) {
      return Outcome.CONTINUE;
    }
    TextView store = editor.store();
    long first = store.lineOf(caret.selectionStart);
    long last = store.lineOf(caret.selectionEnd);
    int tabWidth = editor.settings().tabWidth;
    long version = editor.version();
    editor.beginUndoGroup();
    try {
      for (long line = first; line <= last; line++) {
        ByteRange content = store.lineContentBytes(line);
        long end = content.start;
        GraphemeCursor cursor = store.graphemes(content).iterator();
        for (int n = 0; n < tabWidth && cursor.hasNext(); n++) {
          Grapheme g = cursor.next();
          if (!isBlank(g)) {
            break;
          }
          end = g.bytes.end;
        }
        editor.delete(new ByteRange(content.start, end));
      }
    }
    finally {
      editor.endUndoGroup();
    }
    return textChanged(editor, version);
  }

  private static boolean isBlank(Grapheme g) {
    return g.is(' ') || g.is('\t');
  }

  /**
   * Replaces the selection, if any, with a line break. With auto-indent the new line starts with the spaces and
   * tabs that start the line above. Undone in one step.
   */
  public static Outcome insertNewline(Editor editor) {
    Settings settings = editor.settings();
    if (!settings.autoIndent) {
      return insertText(editor, settings.newline);
    }
    long version = editor.version();
    editor.beginUndoGroup();
    try {
      insertText(editor, settings.newline);
      TextView store = editor.store();
      long line = store.lineOf(editor.caret().offset);
      StringBuilder blanks = new StringBuilder();
      for (Grapheme g : store.graphemes(store.lineContentBytes(line - 1))) {
        if (!isBlank(g)) {
          break;
        }
        blanks.append(g.text);
      }
      if (blanks.length() > 0) {
        editor.insert(editor.caret().offset, blanks.toString());
      }
    }
    finally {
      editor.endUndoGroup();
    }
    return textChanged(editor, version);
  }

  /**
   * Inserts a copy of the selection after it. Without a selection the cursor line is copied, break included,
   * and the cursor moves along to the lower copy.
   */
  public static Outcome duplicateText(Editor editor) {
    Caret caret = editor.caret();
    TextView store = editor.store();
    if (caret.hasSelection()) {
      ByteRange selection = caret.selection();
      editor.insert(selection.end, store.text(selection));
      return Outcome.TEXT_CHANGED;
    }
    long line = store.lineOf(caret.offset);
    ByteRange bytes = store.lineBytes(line);
    ByteRange content = store.lineContentBytes(line);
    if (bytes.isEmpty()) {
      return Outcome.CONTINUE;
    }
    if (content.end == bytes.end) {
      // the last line has no break to copy
      editor.insert(content.end, editor.settings().newline + store.text(content));
    }
    else {
      editor.insert(bytes.start, store.text(bytes));
    }
    return Outcome.TEXT_CHANGED;
  }

  /**
   * Deletes the cursor line with its break; on the last line only its content.
   */
  public static Outcome deleteLine(Editor editor) {
    TextView store = editor.store();
    long line = store.lineOf(editor.caret().offset);
    ByteRange range = line + 1 < store.lenLines() ? store.lineBytes(line) : store.lineContentBytes(line);
    if (range.isEmpty()) {
      return Outcome.CONTINUE;
    }
    editor.delete(range);
    return Outcome.TEXT_CHANGED;
  }

  public static Outcome deleteSelection(Editor editor) {
    Caret caret = editor.caret();
    if (!caret.hasSelection()) {
      return Outcome.CONTINUE;
    }
    editor.delete(caret.selection());
    return Outcome.TEXT_CHANGED;
  }

  /**
   * Backspace: the selection, or the grapheme in front of the cursor.
   */
  public static Outcome deletePrev(Editor editor) {
    Caret caret = editor.caret();
    if (caret.hasSelection()) {
      return deleteSelection(editor);
    }
    long prev = prevBoundary(editor.store(), caret.offset);
    if (prev == caret.offset) {
      return Outcome.CONTINUE;
    }
    editor.delete(new ByteRange(prev, caret.offset));
    return Outcome.TEXT_CHANGED;
  }

  public static Outcome deleteNext(Editor editor) {
    Caret caret = editor.caret();
    if (caret.hasSelection()) {
      return deleteSelection(editor);
    }
    long next = nextBoundary(editor.store(), caret.offset);
    if (next == caret.offset) {
      return Outcome.CONTINUE;
    }
    editor.delete(new ByteRange(caret.offset, next));
    return Outcome.TEXT_CHANGED;
  }

  /**
   * Deletes the selection, or the whitespace after the cursor, or else the word after the cursor.
   */
  public static Outcome deleteNextWord(Editor editor) {
    Caret caret = editor.caret();
    if (caret.hasSelection()) {
      return deleteSelection(editor);
    }
    TextView store = editor.store();
    long offset = caret.offset;
    long end = skipWhitespace(store, offset);
    if (end == offset) {
      end = nextWordEnd(store, offset);
    }
    if (end == offset) {
      return Outcome.CONTINUE;
    }
    editor.delete(new ByteRange(offset, end));
    return Outcome.TEXT_CHANGED;
  }

  /**
   * Deletes the selection, or back to the line start if only whitespace is in between, or the whitespace in
   * front of the cursor, or else the word in front of the cursor.
   */
  public static Outcome deletePrevWord(Editor editor) {
    Caret caret = editor.caret();
    if (caret.hasSelection()) {
      return deleteSelection(editor);
    }
    TextView store = editor.store();
    long offset = caret.offset;
    long lineStart = store.lineBytes(store.lineOf(offset)).start;
    long start;
    if (offset > lineStart && onlyWhitespace(store, new ByteRange(lineStart, offset))) {
      start = lineStart;
    }
    else {
      start = backOver(store, offset, true);
      if (start == offset) {
        start = backOver(store, offset, false);
      }
    }
    if (start == offset) {
      return Outcome.CONTINUE;
    }
    editor.delete(new ByteRange(start, offset));
    return Outcome.TEXT_CHANGED;
  }

  public static Outcome setCursor(Editor editor, TextPosition position, boolean extend) {
    return setCursor(editor, editor.store().positionToByte(position), extend);
  }

  /**
   * Moves the cursor; with {@code extend} the anchor stays and the selection follows the cursor.
   */
  public static Outcome setCursor(Editor editor, long byteOffset, boolean extend) {
    Caret caret = editor.caret();
    return moved(editor, extend ? Caret.select(caret.anchor(), byteOffset) : Caret.at(byteOffset));
  }

  public static Outcome setSelection(Editor editor, TextRange range) {
    ByteRange bytes = editor.store().rangeToBytes(range);
    return moved(editor, Caret.select(bytes.start, bytes.end));
  }

  public static Outcome selectAll(Editor editor) {
    return moved(editor, Caret.select(0, editor.store().lenBytes()));
  }

  public static Outcome moveLeft(Editor editor, boolean extend) {
    Caret caret = editor.caret();
    if (caret.hasSelection() && !extend) {
      return moved(editor, Caret.at(caret.selectionStart));
    }
    return setCursor(editor, prevBoundary(editor.store(), caret.offset), extend);
  }

  public static Outcome moveRight(Editor editor, boolean extend) {
    Caret caret = editor.caret();
    if (caret.hasSelection() && !extend) {
      return moved(editor, Caret.at(caret.selectionEnd));
    }
    return setCursor(editor, nextBoundary(editor.store(), caret.offset), extend);
  }

  public static Outcome moveLineStart(Editor editor, boolean extend) {
    TextView store = editor.store();
    return setCursor(editor, store.lineBytes(store.lineOf(editor.caret().offset)).start, extend);
  }

  public static Outcome moveLineEnd(Editor editor, boolean extend) {
    TextView store = editor.store();
    return setCursor(editor, store.lineContentBytes(store.lineOf(editor.caret().offset)).end, extend);
  }

  public static Outcome moveDocumentStart(Editor editor, boolean extend) {
    return setCursor(editor, 0, extend);
  }

  public static Outcome moveDocumentEnd(Editor editor, boolean extend) {
    return setCursor(editor, editor.store().lenBytes(), extend);
  }

  public static Outcome moveWordNext(Editor editor, boolean extend) {
    return setCursor(editor, nextWordStart(editor.store(), editor.caret().offset), extend);
  }

  public static Outcome moveWordPrev(Editor editor, boolean extend) {
    return setCursor(editor, prevWordStart(editor.store(), editor.caret().offset), extend);
  }

  /**
   * To the end of the next whitespace delimited word.
   */
  public static Outcome moveWordEndNext(Editor editor, boolean extend) {
    return setCursor(editor, nextWordEnd(editor.store(), editor.caret().offset), extend);
  }

  /**
   * To the end of the previous whitespace delimited word.
   */
  public static Outcome moveWordEndPrev(Editor editor, boolean extend) {
    TextView store = editor.store();
    long offset = editor.caret().offset;
    long end = backOver(store, offset, true);
    if (end == offset) {
      end = backOver(store, backOver(store, offset, false), true);
    }
    return setCursor(editor, end, extend);
  }

  public static Outcome moveUp(Editor editor, boolean extend) {
    return moveVertically(editor, -1, extend);
  }

  public static Outcome moveDown(Editor editor, boolean extend) {
    return moveVertically(editor, 1, extend);
  }

  /*
   * moves by screen rows, wrapped rows included, keeping the screen column of the first vertical move
   */
  private static Outcome moveVertically(Editor editor, int direction, boolean extend) {
    TextView store = editor.store();
    LineMetricsCache cache = editor.cache();
    Caret caret = editor.caret();
    TextPosition position = store.byteToPosition(caret.offset);
    ScreenPosition screen = cache.toScreen(store, position);
    long vCol = caret.vCol >= 0 ? caret.vCol : screen.column;
    long line = position.line;
    long row = screen.row + direction;
    long target;
    if (row < 0) {
      if (line == 0) {
        target = 0;
      }
      else {
        line--;
        target = cache.byteAt(store, line, cache.rows(store, line) - 1, vCol);
      }
    }
    else if (row >= cache.rows(store, line)) {
      if (line + 1 >= store.lenLines()) {
        target = store.lenBytes();
      }
      else {
        target = cache.byteAt(store, line + 1, 0, vCol);
      }
    }
    else {
      target = cache.byteAt(store, line, row, vCol);
    }
    Caret next = extend ? Caret.select(caret.anchor(), target) : Caret.at(target);
    return moved(editor, next.withVCol(vCol));
  }

  public static Outcome beginUndoSequence(Editor editor) {
    editor.beginUndoGroup();
    return Outcome.CONTINUE;
  }

  public static Outcome endUndoSequence(Editor editor) {
    if (!editor.undoBuffer().isGrouping()) {
      return Outcome.CONTINUE;
    }
    editor.endUndoGroup();
    return Outcome.CONTINUE;
  }

  public static Outcome undo(Editor editor) {
    long version = editor.version();
    Optional<Caret> restored = editor.undo();
    if (!restored.isPresent()) {
      return Outcome.CONTINUE;
    }
    return textChanged(editor, version).or(Outcome.CHANGED);
  }

  public static Outcome redo(Editor editor) {
    long version = editor.version();
    Optional<Caret> restored = editor.redo();
    if (!restored.isPresent()) {
      return Outcome.CONTINUE;
    }
    return textChanged(editor, version).or(Outcome.CHANGED);
  }

  public static Outcome copy(Editor editor) {
    Caret caret = editor.caret();
    Clipboard clipboard = editor.clipboard();
    if (clipboard == null || !caret.hasSelection()) {
      return Outcome.CONTINUE;
    }
    clipboard.setString(editor.store().text(caret.selection()));
    return Outcome.CHANGED;
  }

  public static Outcome cut(Editor editor) {
    if (copy(editor) == Outcome.CONTINUE) {
      return Outcome.CONTINUE;
    }
    return deleteSelection(editor);
  }

  public static Outcome paste(Editor editor) {
    Clipboard clipboard = editor.clipboard();
    String text = clipboard == null ? null : clipboard.getString();
    if (text == null || text.isEmpty()) {
      return Outcome.CONTINUE;
    }
    return insertText(editor, text);
  }

  public static Outcome setText(Editor editor, @NotNull String text) {
    if (editor.store().text().equals(text)) {
      return Outcome.CONTINUE;
    }
    editor.setText(text);
    return Outcome.TEXT_CHANGED;
  }

  public static Outcome clear(Editor editor) {
    return setText(editor, "");
  }

  public static Outcome addStyle(Editor editor, TextRange range, int style) {
    return Outcome.of(editor.addStyle(range, style));
  }

  public static Outcome addStyle(Editor editor, ByteRange range, int style) {
    return Outcome.of(editor.addStyle(range, style));
  }

  public static Outcome removeStyle(Editor editor, ByteRange range, int style) {
    return Outcome.of(editor.removeStyle(range, style));
  }

  public static Outcome removeStyleFully(Editor editor, int style) {
    return Outcome.of(editor.removeStyleFully(style));
  }

  public static Outcome setStyles(Editor editor, List<StyleSpan> spans) {
    editor.replaceStyles(spans);
    return Outcome.CHANGED;
  }

  /**
   * Applies the replay log of another editor, see {@link Editor#replayLog}.
   */
  public static Outcome replayLog(Editor editor, List<ReplayEntry> entries) {
    long version = editor.version();
    if (!editor.replayLog(entries)) {
      return Outcome.CONTINUE;
    }
    return textChanged(editor, version).or(Outcome.CHANGED);
  }

  /**
   * Start of the grapheme in front of the offset; the line break counts as one grapheme.
   */
  static long prevBoundary(TextView store, long offset) {
    if (offset == 0) {
      return 0;
    }
    long line = store.lineOf(offset);
    ByteRange lineBytes = store.lineBytes(line);
    if (offset == lineBytes.start) {
      return store.lineContentBytes(line - 1).end;
    }
    long prev = lineBytes.start;
    GraphemeCursor cursor = store.graphemes(new ByteRange(lineBytes.start, offset)).iterator();
    while (cursor.hasNext()) {
      prev = cursor.next().bytes.start;
    }
    return prev;
  }

  static long nextBoundary(TextView store, long offset) {
    if (offset >= store.lenBytes()) {
      return store.lenBytes();
    }
    GraphemeCursor cursor = store.graphemes(new ByteRange(offset, store.lenBytes())).iterator();
    return cursor.next().bytes.end;
  }

  private enum CharClass {
    SPACE, WORD, PUNCTUATION
  }

  private static CharClass classOf(Grapheme g) {
    if (g.isWhitespace()) {
      return CharClass.SPACE;
    }
    int cp = g.codePoint();
    return Character.isLetterOrDigit(cp) || cp == '_' ? CharClass.WORD : CharClass.PUNCTUATION;
  }

  /**
   * Start of the next word: skips the rest of the current word, then whitespace.
   */
  static long nextWordStart(TextView store, long offset) {
    GraphemeCursor cursor = store.graphemes(new ByteRange(offset, store.lenBytes())).iterator();
    if (!cursor.hasNext()) {
      return offset;
    }
    Grapheme g = cursor.next();
    CharClass start = classOf(g);
    while (start != CharClass.SPACE && classOf(g) == start) {
      if (!cursor.hasNext()) {
        return store.lenBytes();
      }
      g = cursor.next();
    }
    while (classOf(g) == CharClass.SPACE) {
      if (!cursor.hasNext()) {
        return store.lenBytes();
      }
      g = cursor.next();
    }
    return g.bytes.start;
  }

  /**
   * Start of the word in front of the offset, never further back than the start of the previous line.
   */
  static long prevWordStart(TextView store, long offset) {
    if (offset == 0) {
      return 0;
    }
    long line = store.lineOf(offset);
    long lineStart = store.lineBytes(line).start;
    if (offset == lineStart) {
      line--;
      lineStart = store.lineBytes(line).start;
      offset = store.lineContentBytes(line).end;
    }
    offset = Math.min(offset, store.lineContentBytes(line).end);
    List<Grapheme> graphemes = store.graphemes(new ByteRange(lineStart, offset)).toList();
    int i = graphemes.size() - 1;
    while (i >= 0 && classOf(graphemes.get(i)) == CharClass.SPACE) {
      i--;
    }
    if (i < 0) {
      return lineStart;
    }
    CharClass cls = classOf(graphemes.get(i));
    while (i > 0 && classOf(graphemes.get(i - 1)) == cls) {
      i--;
    }
    return graphemes.get(i).bytes.start;
  }

  private static boolean onlyWhitespace(TextView store, ByteRange range) {
    for (Grapheme g : store.graphemes(range)) {
      if (!g.isWhitespace()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Start of the first grapheme at or after the offset that is not whitespace, or the document end.
   */
  static long skipWhitespace(TextView store, long offset) {
    GraphemeCursor cursor = store.graphemes(new ByteRange(offset, store.lenBytes())).iterator();
    while (cursor.hasNext()) {
      Grapheme g = cursor.next();
      if (!g.isWhitespace()) {
        return g.bytes.start;
      }
    }
    return store.lenBytes();
  }

  /**
   * Skips whitespace, then goes on up to the next whitespace.
   */
  static long nextWordEnd(TextView store, long offset) {
    long start = skipWhitespace(store, offset);
    GraphemeCursor cursor = store.graphemes(new ByteRange(start, store.lenBytes())).iterator();
    long end = start;
    while (cursor.hasNext()) {
      Grapheme g = cursor.next();
      if (g.isWhitespace()) {
        break;
      }
      end = g.bytes.end;
    }
    return end;
  }

  /**
   * Start of the run of whitespace, or of non-whitespace, right in front of the offset. Runs of whitespace go on
   * over line breaks.
   */
  static long backOver(TextView store, long offset, boolean whitespace) {
    long line = store.lineOf(offset);
    while (true) {
      long lineStart = store.lineBytes(line).start;
      List<Grapheme> graphemes = store.graphemes(new ByteRange(lineStart, offset)).toList();
      for (int i = graphemes.size() - 1; i >= 0; i--) {
        if (graphemes.get(i).isWhitespace() != whitespace) {
          return graphemes.get(i).bytes.end;
        }
      }
      if (line == 0) {
        return 0;
      }
      line--;
      offset = lineStart;
    }
  }
}

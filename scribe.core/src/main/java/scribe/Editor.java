package scribe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import scribe.carets.Caret;
import scribe.glyph.Glyph;
import scribe.glyph.GlyphIterator;
import scribe.glyph.GlyphShaper;
import scribe.glyph.LineMetricsCache;
import scribe.glyph.ScreenPosition;
import scribe.glyph.Viewport;
import scribe.glyph.WrapMode;
import scribe.glyph.WrapSegment;
import scribe.impl.util.Utf8;
import scribe.styles.StyleChange;
import scribe.styles.StyleIndex;
import scribe.styles.StyleSpan;
import scribe.text.TextStore;
import scribe.text.TextView;
import scribe.undo.ReplayEntry;
import scribe.undo.UndoBuffer;
import scribe.undo.UndoGroup;
import scribe.undo.UndoLog;
import scribe.undo.UndoOp;
import scribe.undo.UndoTarget;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * State of one text widget: the document, its styles, undo history, layout cache and the caret.
 * <p>
 * Every mutation goes to the store first; the {@link Edit} it returns is then handed to the styles, the cache
 * and the caret. Public mutators are recorded for undo, the {@link UndoTarget} methods are not.
 */
public final class Editor implements UndoTarget {

  private static final Logger LOG = LogManager.getLogger(Editor.class);

  private final TextStore store;
  private final StyleIndex styles = new StyleIndex();
  private final UndoLog undo;
  private final LineMetricsCache cache;
  @Nullable private final Clipboard clipboard;
  private Settings settings;
  private Caret caret = Caret.ZERO;
  private long version = 0;

  public Editor(@NotNull String text, long expectedBytes, Settings settings, @Nullable Clipboard clipboard) {
    this.store = TextStore.create(text, expectedBytes, settings);
    this.settings = settings;
    this.clipboard = clipboard;
    this.undo = new UndoLog(settings.undoLimit);
    this.cache = new LineMetricsCache(new GlyphShaper(settings), WrapMode.NONE, Integer.MAX_VALUE);
    LOG.debug("{} chosen for {} expected bytes", store.getClass().getSimpleName(), expectedBytes);
  }

  public Editor(@NotNull String text, Settings settings) {
    this(text, Utf8.length(text), settings, null);
  }

  public Editor(@NotNull String text) {
    this(text, Settings.DEFAULT);
  }

  /**
   * The document, for queries. Edits go through the editor so styles, caret, cache and undo follow them.
   */
  public TextView store() {
    return store;
  }

  public StyleIndex styles() {
    return styles;
  }

  public UndoBuffer undoBuffer() {
    return undo;
  }

  public LineMetricsCache cache() {
    return cache;
  }

  public Settings settings() {
    return settings;
  }

  @Nullable
  public Clipboard clipboard() {
    return clipboard;
  }

  public Caret caret() {
    return caret;
  }

  public String text() {
    return store.text();
  }

  public void setSettings(Settings settings) {
    this.settings = settings;
    undo.setLimit(settings.undoLimit);
    cache.configure(new GlyphShaper(settings), cache.mode(), cache.width());
  }

  public void setLayout(WrapMode mode, int viewportWidth) {
    cache.configure(cache.shaper(), mode, viewportWidth);
  }

  /**
   * @throws TextException if an end of the caret is not a grapheme boundary
   */
  public void setCaret(Caret caret) {
    if (!store.isBoundary(caret.selectionStart)) {
      throw TextException.invalidBoundary("byte offset", caret.selectionStart);
    }
    if (!store.isBoundary(caret.selectionEnd)) {
      throw TextException.invalidBoundary("byte offset", caret.selectionEnd);
    }
    this.caret = caret;
  }

  public TextPosition cursorPosition() {
    return store.byteToPosition(caret.offset);
  }

  public TextRange selectionRange() {
    return store.bytesToRange(caret.selection());
  }

  /**
   * Incremented by every content change, undo and redo included.
   */
  public long version() {
    return version;
  }

  private void applied(Edit edit) {
    version++;
    cache.edit(edit);
    caret = caret.edit(edit);
  }

  public Edit insert(long offset, @NotNull String text) {
    Caret before = caret;
    Edit edit = store.insert(offset, text);
    if (Edit.isIdentity(edit)) {
      return edit;
    }
    styles.edit(edit);
    applied(edit);
    undo.record(new UndoOp.InsertText(offset, text, before, caret));
    return edit;
  }

  /**
   * Deleting an empty range returns the identity edit and leaves the undo history alone.
   */
  public Edit delete(ByteRange range) {
    Caret before = caret;
    Edit edit = store.delete(range);
    if (Edit.isIdentity(edit)) {
      return edit;
    }
    List<StyleChange> changes = styles.edit(edit);
    applied(edit);
    undo.record(new UndoOp.RemoveText(edit.offset, edit.deleted, changes, before, caret));
    return edit;
  }

  /**
   * Replaces the content; undone in one step.
   */
  public Edit setText(@NotNull String text) {
    Caret before = caret;
    String old = store.text();
    Edit edit = store.setText(text);
    List<StyleChange> changes = styles.edit(edit);
    applied(edit);
    if (!old.isEmpty() || !text.isEmpty()) {
      undo.beginGroup();
      if (!old.isEmpty()) {
        undo.record(new UndoOp.RemoveText(0, old, changes, before, Caret.ZERO));
      }
      if (!text.isEmpty()) {
        undo.record(new UndoOp.InsertText(0, text, old.isEmpty() ? before : Caret.ZERO, caret));
      }
      undo.endGroup();
    }
    return edit;
  }

  public void beginUndoGroup() {
    undo.beginGroup();
  }

  public void endUndoGroup() {
    undo.endGroup();
  }

  /**
   * Reverts the most recent group and puts the caret back where it was before the group.
   *
   * @return the restored caret, empty if there was nothing to undo
   */
  public Optional<Caret> undo() {
    Optional<UndoGroup> group = undo.undo(this);
    if (!group.isPresent()) {
      return Optional.empty();
    }
    caret = group.get().before();
    return Optional.of(caret);
  }

  public Optional<Caret> redo() {
    Optional<UndoGroup> group = undo.redo(this);
    if (!group.isPresent()) {
      return Optional.empty();
    }
    caret = group.get().after();
    return Optional.of(caret);
  }

  /**
   * Applies entries taken from the replay log of an editor that started with the same text and styles. Replayed
   * ops become undoable here but are not logged again. The caret only follows the edits.
   *
   * @return false if nothing was applied
   */
  public boolean replayLog(List<ReplayEntry> entries) {
    boolean changed = false;
    for (ReplayEntry entry : entries) {
      switch (entry.kind) {
        case OPS:
          undo.beginGroup();
          try {
            for (UndoOp op : entry.ops) {
              op.replay(this);
              if (op.changesText() || settings.undoStyles) {
                undo.recordReplayed(op);
              }
            }
          }
          finally {
            undo.endGroup();
          }
          changed = true;
          break;
        case UNDO:
          changed |= undo.undoReplayed(this).isPresent();
          break;
        case REDO:
          changed |= undo.redoReplayed(this).isPresent();
          break;
      }
    }
    LOG.debug("{} replay entries applied", entries.size());
    return changed;
  }

  @Override
  public Edit insertText(long offset, String text) {
    Edit edit = store.restoreInsert(offset, text);
    if (!Edit.isIdentity(edit)) {
      styles.edit(edit);
      applied(edit);
    }
    return edit;
  }

  @Override
  public List<StyleChange> removeText(ByteRange range) {
    Edit edit = store.restoreDelete(range);
    List<StyleChange> changes = styles.edit(edit);
    applied(edit);
    return changes;
  }

  @Override
  public void restoreStyles(List<StyleChange> changes, Edit reinsert) {
    styles.restore(changes, reinsert);
  }

  @Override
  public void addStyle(StyleSpan span) {
    styles.add(span);
  }

  @Override
  public void removeStyle(StyleSpan span) {
    styles.remove(span);
  }

  @Override
  public void setStyles(List<StyleSpan> spans) {
    styles.setStyles(spans);
  }

  public boolean addStyle(ByteRange range, int style) {
    if (!styles.add(range, style)) {
      return false;
    }
    recordStyle(new UndoOp.AddStyle(new StyleSpan(range, style), caret));
    return true;
  }

  public boolean addStyle(TextRange range, int style) {
    return addStyle(store.rangeToBytes(range), style);
  }

  public boolean removeStyle(ByteRange range, int style) {
    if (!styles.remove(range, style)) {
      return false;
    }
    recordStyle(new UndoOp.RemoveStyle(new StyleSpan(range, style), caret));
    return true;
  }

  /**
   * Drops every span of the style, undone in one step when styles are undoable.
   *
   * @return false if there was no such span
   */
  public boolean removeStyleFully(int style) {
    List<StyleSpan> removed = styles.removeStyleFully(style);
    if (removed.isEmpty()) {
      return false;
    }
    undo.beginGroup();
    try {
      for (StyleSpan span : removed) {
        recordStyle(new UndoOp.RemoveStyle(span, caret));
      }
    }
    finally {
      undo.endGroup();
    }
    return true;
  }

  private void recordStyle(UndoOp op) {
    if (settings.undoStyles) {
      undo.record(op);
    }
    else {
      undo.recordReplayOnly(op);
    }
  }

  public void replaceStyles(List<StyleSpan> spans) {
    List<StyleSpan> old = settings.undoStyles || undo.isReplayLogEnabled() ? styles.styles() : null;
    styles.setStyles(spans);
    if (old != null) {
      recordStyle(new UndoOp.SetStyles(old, styles.styles(), caret));
    }
  }

  /**
   * Rows of glyphs visible in the viewport, top to bottom. Rows past the end of the document are left out.
   */
  public List<Viewport.Row> glyphs(Viewport viewport) {
    List<Viewport.Row> rows = new ArrayList<>();
    long right = viewport.scrollX + viewport.width;
    long row = viewport.row;
    for (long line = viewport.line; line < store.lenLines() && rows.size() < viewport.height; line++) {
      List<WrapSegment> segments = cache.wrapSegments(store, line);
      for (long r = row; r < segments.size() && rows.size() < viewport.height; r++) {
        GlyphIterator it = cache.glyphs(store, line, r, viewport.scrollX);
        List<Glyph> glyphs = new ArrayList<>();
        while (it.hasNext()) {
          Glyph g = it.next();
          if (g.row != r || g.screenColumn >= right) {
            break;
          }
          if (g.screenColumn + g.screenWidth > viewport.scrollX || (g.screenWidth == 0 && g.screenColumn >= viewport.scrollX)) {
            glyphs.add(g);
          }
        }
        rows.add(new Viewport.Row(line, r, glyphs));
      }
      row = 0;
    }
    return rows;
  }

  /**
   * Byte offset shown at the viewport cell. Cells right of a row end map to the row end, cells below the
   * document to its end.
   */
  public long screenToByte(Viewport viewport, long x, long y) {
    long line = viewport.line;
    long row = viewport.row;
    if (line >= store.lenLines()) {
      return store.lenBytes();
    }
    for (long i = 0; i < y; i++) {
      row++;
      if (row >= cache.rows(store, line)) {
        if (line + 1 >= store.lenLines()) {
          return store.lenBytes();
        }
        line++;
        row = 0;
      }
    }
    row = Math.min(row, cache.rows(store, line) - 1);
    return cache.byteAt(store, line, row, x + viewport.scrollX);
  }

  /**
   * Viewport cell showing the byte offset, empty when it is scrolled out of view.
   */
  public Optional<ScreenPosition> byteToScreen(Viewport viewport, long byteOffset) {
    long line = store.lineOf(byteOffset);
    ScreenPosition inLine = cache.toScreen(store, store.byteToPosition(byteOffset));
    if (line < viewport.line || (line == viewport.line && inLine.row < viewport.row)) {
      return Optional.empty();
    }
    long y = 0;
    long row = viewport.row;
    for (long l = viewport.line; l < line; l++) {
      y += cache.rows(store, l) - row;
      row = 0;
      if (y >= viewport.height) {
        return Optional.empty();
      }
    }
    y += inLine.row - row;
    long x = inLine.column - viewport.scrollX;
    if (y >= viewport.height || x < 0 || x >= viewport.width) {
      return Optional.empty();
    }
    return Optional.of(new ScreenPosition(y, x));
  }

  @Override
  public String toString() {
    return "Editor{" + store + ", " + caret + ", " + undo + '}';
  }
}

package scribe.carets;

import scribe.ByteRange;
import scribe.Edit;

import java.util.Objects;

/**
 * Cursor and selection, in byte offsets. The selection is {@code [selectionStart, selectionEnd)} and the
 * cursor sits at one of its ends; the other end is the anchor. {@code vCol} is the screen column vertical
 * movement tries to keep, or -1 when it has to be taken from the cursor.
 */
public final class Caret {

  public static final Caret ZERO = new Caret(0, 0, 0, -1);

  public final long offset;
  public final long selectionStart;
  public final long selectionEnd;
  public final long vCol;

  public Caret(long offset, long selectionStart, long selectionEnd, long vCol) {
    assert selectionStart <= selectionEnd : "selection " + selectionStart + " > " + selectionEnd;
    assert offset == selectionStart || offset == selectionEnd : "offset " + offset + " outside of selection ends";
    this.offset = offset;
    this.selectionStart = selectionStart;
    this.selectionEnd = selectionEnd;
    this.vCol = vCol;
  }

  public static Caret at(long offset) {
    return new Caret(offset, offset, offset, -1);
  }

  /**
   * Selection from the anchor to the cursor, in either direction.
   */
  public static Caret select(long anchor, long cursor) {
    return new Caret(cursor, Math.min(anchor, cursor), Math.max(anchor, cursor), -1);
  }

  public boolean hasSelection() {
    return selectionStart != selectionEnd;
  }

  public long anchor() {
    return offset == selectionStart ? selectionEnd : selectionStart;
  }

  public ByteRange selection() {
    return new ByteRange(selectionStart, selectionEnd);
  }

  public Caret withVCol(long vCol) {
    return new Caret(offset, selectionStart, selectionEnd, vCol);
  }

  public Caret dropSelection() {
    return new Caret(offset, offset, offset, vCol);
  }

  /**
   * Caret after the edit. An empty caret at the edit offset moves past inserted text, a selection does not grow
   * when text is inserted at its end.
   */
  public Caret edit(Edit edit) {
    if (Edit.isIdentity(edit)) {
      return this;
    }
    if (!hasSelection()) {
      long offsetPrime = Edit.shiftOffset(offset, edit, true);
      return new Caret(offsetPrime, offsetPrime, offsetPrime, -1);
    }
    long selectionStartPrime = Edit.shiftOffset(selectionStart, edit, true);
    long selectionEndPrime = Math.max(selectionStartPrime, Edit.shiftOffset(selectionEnd, edit, false));
    long offsetPrime = offset == selectionEnd ? selectionEndPrime : selectionStartPrime;
    return new Caret(offsetPrime, selectionStartPrime, selectionEndPrime, -1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Caret caret = (Caret)o;
    return offset == caret.offset &&
           selectionStart == caret.selectionStart &&
           selectionEnd == caret.selectionEnd;
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, selectionStart, selectionEnd);
  }

  @Override
  public String toString() {
    return "Caret{" +
           "offset=" + offset +
           ", selectionStart=" + selectionStart +
           ", selectionEnd=" + selectionEnd +
           ", vCol=" + vCol +
           '}';
  }
}

package scribe.undo;

import scribe.ByteRange;
import scribe.carets.Caret;
import scribe.impl.util.Utf8;
import scribe.styles.StyleChange;
import scribe.styles.StyleSpan;

import java.util.Collections;
import java.util.List;

/**
 * One recorded primitive mutation together with the caret before and after it.
 */
public abstract class UndoOp {
  public final Caret before;
  public final Caret after;

  UndoOp(Caret before, Caret after) {
    this.before = before;
    this.after = after;
  }

  public abstract void revert(UndoTarget target);

  public abstract void replay(UndoTarget target);

  /**
   * Text ops always go to the history, style ops only when styles are undoable.
   */
  public boolean changesText() {
    return false;
  }

  public static final class InsertText extends UndoOp {
    public final long offset;
    public final String text;

    public InsertText(long offset, String text, Caret before, Caret after) {
      super(before, after);
      this.offset = offset;
      this.text = text;
    }

    @Override
    public void revert(UndoTarget target) {
      target.removeText(new ByteRange(offset, offset + Utf8.length(text)));
    }

    @Override
    public void replay(UndoTarget target) {
      target.insertText(offset, text);
    }

    @Override
    public boolean changesText() {
      return true;
    }

    @Override
    public String toString() {
      return "InsertText{" + offset + ", \"" + text + "\"}";
    }
  }

  public static final class RemoveText extends UndoOp {
    public final long offset;
    public final String text;
    public final List<StyleChange> styles;

    public RemoveText(long offset, String text, List<StyleChange> styles, Caret before, Caret after) {
      super(before, after);
      this.offset = offset;
      this.text = text;
      this.styles = Collections.unmodifiableList(styles);
    }

    @Override
    public void revert(UndoTarget target) {
      target.restoreStyles(styles, target.insertText(offset, text));
    }

    @Override
    public void replay(UndoTarget target) {
      target.removeText(new ByteRange(offset, offset + Utf8.length(text)));
    }

    @Override
    public boolean changesText() {
      return true;
    }

    @Override
    public String toString() {
      return "RemoveText{" + offset + ", \"" + text + "\", " + styles + "}";
    }
  }

  public static final class AddStyle extends UndoOp {
    public final StyleSpan span;

    public AddStyle(StyleSpan span, Caret caret) {
      super(caret, caret);
      this.span = span;
    }

    @Override
    public void revert(UndoTarget target) {
      target.removeStyle(span);
    }

    @Override
    public void replay(UndoTarget target) {
      target.addStyle(span);
    }

    @Override
    public String toString() {
      return "AddStyle{" + span + "}";
    }
  }

  public static final class RemoveStyle extends UndoOp {
    public final StyleSpan span;

    public RemoveStyle(StyleSpan span, Caret caret) {
      super(caret, caret);
      this.span = span;
    }

    @Override
    public void revert(UndoTarget target) {
      target.addStyle(span);
    }

    @Override
    public void replay(UndoTarget target) {
      target.removeStyle(span);
    }

    @Override
    public String toString() {
      return "RemoveStyle{" + span + "}";
    }
  }

  public static final class SetStyles extends UndoOp {
    public final List<StyleSpan> oldSpans;
    public final List<StyleSpan> newSpans;

    public SetStyles(List<StyleSpan> oldSpans, List<StyleSpan> newSpans, Caret caret) {
      super(caret, caret);
      this.oldSpans = Collections.unmodifiableList(oldSpans);
      this.newSpans = Collections.unmodifiableList(newSpans);
    }

    @Override
    public void revert(UndoTarget target) {
      target.setStyles(oldSpans);
    }

    @Override
    public void replay(UndoTarget target) {
      target.setStyles(newSpans);
    }

    @Override
    public String toString() {
      return "SetStyles{" + oldSpans.size() + " -> " + newSpans.size() + "}";
    }
  }
}

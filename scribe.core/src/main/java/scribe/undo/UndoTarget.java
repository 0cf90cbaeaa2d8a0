package scribe.undo;

import scribe.ByteRange;
import scribe.Edit;
import scribe.styles.StyleChange;
import scribe.styles.StyleSpan;

import java.util.List;

/**
 * The document side of undo: primitive mutations applied without being recorded again.
 */
public interface UndoTarget {

  Edit insertText(long offset, String text);

  List<StyleChange> removeText(ByteRange range);

  void restoreStyles(List<StyleChange> changes, Edit reinsert);

  void addStyle(StyleSpan span);

  void removeStyle(StyleSpan span);

  void setStyles(List<StyleSpan> spans);
}

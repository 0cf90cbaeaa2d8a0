package scribe.text;

import org.jetbrains.annotations.NotNull;
import scribe.ByteRange;
import scribe.Edit;
import scribe.Settings;
import scribe.impl.text.RopeTextStore;
import scribe.impl.text.StringTextStore;

/**
 * A mutable document. Rejected edits throw a {@link scribe.TextException} and change nothing.
 */
public interface TextStore extends TextView {

  /**
   * Picks the backend once from the expected document size.
   */
  static TextStore create(@NotNull String text, long expectedBytes, Settings settings) {
    if (expectedBytes < settings.flatStoreLimit) {
      return new StringTextStore(text);
    }
    return new RopeTextStore(text);
  }

  static TextStore create(@NotNull String text) {
    return create(text, text.length(), Settings.DEFAULT);
  }

  Edit insert(long byteOffset, @NotNull String text);

  /**
   * Deleting an empty range changes nothing and returns an identity edit.
   */
  Edit delete(ByteRange range);

  /**
   * Replaces the whole content.
   */
  Edit setText(@NotNull String text);

  /**
   * Puts back text taken out by an earlier edit. The offset only has to lie between two code points: text that
   * merged with its neighbours into one grapheme, like a combining mark or the halves of a CRLF, is still
   * reinsertable where it came from.
   */
  Edit restoreInsert(long byteOffset, @NotNull String text);

  /**
   * Takes out text put in by an earlier edit; both ends only have to lie between two code points.
   */
  Edit restoreDelete(ByteRange range);
}

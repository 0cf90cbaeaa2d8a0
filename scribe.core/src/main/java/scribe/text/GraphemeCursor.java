package scribe.text;

import java.util.Iterator;

/**
 * Forward cursor over the graphemes of a byte range.
 */
public interface GraphemeCursor extends Iterator<Grapheme> {

  /**
   * Byte offset of the next grapheme.
   */
  long offset();

  /**
   * Moves to the given byte offset without producing the graphemes in between.
   *
   * @throws scribe.TextException if the offset is outside of the range or not a grapheme boundary
   */
  void skipTo(long byteOffset);

  /**
   * Moves past the next line break, or to the end of the range if there is none.
   */
  void skipLine();
}

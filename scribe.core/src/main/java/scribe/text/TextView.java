package scribe.text;

import scribe.ByteRange;
import scribe.TextPosition;
import scribe.TextRange;

/**
 * Read access to a document. Offsets are UTF-8 byte offsets; every offset handed in must lie on a grapheme boundary
 * within {@code [0, lenBytes()]}, otherwise a {@link scribe.TextException} is thrown.
 * Lines are separated by {@code "\n"} or {@code "\r\n"}.
 */
public interface TextView {

  long lenBytes();

  long lenLines();

  /**
   * Bytes of the line including its line break.
   */
  ByteRange lineBytes(long line);

  /**
   * Bytes of the line without its line break.
   */
  ByteRange lineContentBytes(long line);

  /**
   * Graphemes in the line, line break excluded.
   */
  long lineWidth(long line);

  Graphemes graphemes(ByteRange range);

  boolean isBoundary(long byteOffset);

  TextPosition byteToPosition(long byteOffset);

  long positionToByte(TextPosition position);

  default TextRange bytesToRange(ByteRange range) {
    return new TextRange(byteToPosition(range.start), byteToPosition(range.end));
  }

  default ByteRange rangeToBytes(TextRange range) {
    return new ByteRange(positionToByte(range.start), positionToByte(range.end));
  }

  String text(ByteRange range);

  String text();

  /**
   * Line the byte offset belongs to; a line break belongs to the line it ends.
   */
  long lineOf(long byteOffset);
}

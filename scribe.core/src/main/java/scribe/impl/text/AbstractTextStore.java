package scribe.impl.text;

import com.ibm.icu.text.BreakIterator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import scribe.ByteRange;
import scribe.Edit;
import scribe.TextException;
import scribe.TextPosition;
import scribe.impl.util.Utf8;
import scribe.text.GraphemeCursor;
import scribe.text.Graphemes;
import scribe.text.PositionCodec;
import scribe.text.TextStore;

/**
 * Everything a store can derive from byte/char/line lookups: boundary checks, grapheme iteration and position
 * conversions. Backends only have to locate offsets and splice text.
 */
public abstract class AbstractTextStore implements TextStore {

  private static final Logger LOG = LogManager.getLogger(AbstractTextStore.class);

  static final class Location {
    final long bytes;
    final long chars;
    final long line;

    Location(long bytes, long chars, long line) {
      this.bytes = bytes;
      this.chars = chars;
      this.line = line;
    }

    @Override
    public String toString() {
      return "Location{bytes=" + bytes + ", chars=" + chars + ", line=" + line + '}';
    }
  }

  /**
   * Start of a line, {@code 0 <= line < lenLines()}.
   */
  abstract Location lineStart(long line);

  /**
   * Null when the offset is outside of the document or inside a code point.
   */
  @Nullable
  abstract Location locate(long byteOffset);

  abstract long lenChars();

  abstract CharSequence chars(long fromChar, long toChar);

  abstract void splice(Location at, String text);

  abstract String cut(Location from, Location to);

  abstract void replaceAll(String text);

  final Location location(long byteOffset) {
    Location loc = locate(byteOffset);
    if (loc == null) {
      throw TextException.invalidBoundary("byte offset", byteOffset);
    }
    return loc;
  }

  private void checkLine(long line) {
    if (line < 0 || line >= lenLines()) {
      throw TextException.invalidBoundary("line", line);
    }
  }

  private long lineEndChars(long line) {
    return line + 1 < lenLines() ? lineStart(line + 1).chars : lenChars();
  }

  @Override
  public ByteRange lineBytes(long line) {
    checkLine(line);
    long start = lineStart(line).bytes;
    long end = line + 1 < lenLines() ? lineStart(line + 1).bytes : lenBytes();
    return new ByteRange(start, end);
  }

  @Override
  public ByteRange lineContentBytes(long line) {
    ByteRange bytes = lineBytes(line);
    if (line + 1 == lenLines()) {
      return bytes;
    }
    long endChars = lineStart(line + 1).chars;
    int breakLength = 1;
    if (endChars >= 2 && chars(endChars - 2, endChars - 1).charAt(0) == '\r') {
      breakLength = 2;
    }
    return new ByteRange(bytes.start, Math.max(bytes.start, bytes.end - breakLength));
  }

  @Override
  public long lineWidth(long line) {
    return graphemes(lineContentBytes(line)).count();
  }

  @Override
  public long lineOf(long byteOffset) {
    return location(byteOffset).line;
  }

  @Override
  public boolean isBoundary(long byteOffset) {
    if (byteOffset < 0 || byteOffset > lenBytes()) {
      return false;
    }
    if (byteOffset == 0 || byteOffset == lenBytes()) {
      return true;
    }
    Location loc = locate(byteOffset);
    if (loc == null) {
      return false;
    }
    Location start = lineStart(loc.line);
    if (start.chars == loc.chars) {
      return true;
    }
    BreakIterator breaker = BreakIterator.getCharacterInstance();
    breaker.setText(chars(start.chars, lineEndChars(loc.line)));
    return breaker.isBoundary((int)(loc.chars - start.chars));
  }

  private void checkBoundary(long byteOffset) {
    if (!isBoundary(byteOffset)) {
      throw TextException.invalidBoundary("byte offset", byteOffset);
    }
  }

  @Override
  public Graphemes graphemes(ByteRange range) {
    checkBoundary(range.start);
    checkBoundary(range.end);
    Location start = location(range.start);
    Location end = location(range.end);
    return new Graphemes() {
      @Override
      public ByteRange range() {
        return range;
      }

      @Override
      public GraphemeCursor iterator() {
        return new GraphemeCursorImpl(AbstractTextStore.this, range, start.chars, chars(start.chars, end.chars));
      }
    };
  }

  @Override
  public Edit insert(long byteOffset, @NotNull String text) {
    checkBoundary(byteOffset);
    return restoreInsert(byteOffset, text);
  }

  @Override
  public Edit delete(ByteRange range) {
    checkBoundary(range.start);
    checkBoundary(range.end);
    return restoreDelete(range);
  }

  @Override
  public Edit restoreInsert(long byteOffset, @NotNull String text) {
    Location at = location(byteOffset);
    if (text.isEmpty()) {
      return Edit.identity(byteOffset, at.line);
    }
    splice(at, text);
    return Edit.insert(byteOffset, text, Utf8.length(text), at.line);
  }

  @Override
  public Edit restoreDelete(ByteRange range) {
    Location from = location(range.start);
    Location to = location(range.end);
    if (range.isEmpty()) {
      return Edit.identity(range.start, from.line);
    }
    String removed = cut(from, to);
    return Edit.delete(range.start, removed, range.length(), from.line);
  }

  @Override
  public Edit setText(@NotNull String text) {
    String removed = text();
    long removedBytes = lenBytes();
    replaceAll(text);
    LOG.debug("text replaced: {} bytes removed, {} bytes inserted", removedBytes, lenBytes());
    return new Edit(0, removed, removedBytes, text, lenBytes(), 0);
  }

  @Override
  public TextPosition byteToPosition(long byteOffset) {
    checkBoundary(byteOffset);
    long line = location(byteOffset).line;
    long lineStart = lineStart(line).bytes;
    return new TextPosition(line, PositionCodec.column(graphemes(new ByteRange(lineStart, byteOffset)), byteOffset));
  }

  @Override
  public long positionToByte(TextPosition position) {
    if (position.equals(TextPosition.MAX)) {
      return lenBytes();
    }
    checkLine(position.line);
    return PositionCodec.byteOffset(graphemes(lineContentBytes(position.line)), position.column);
  }

  @Override
  public String text(ByteRange range) {
    Location from = location(range.start);
    Location to = location(range.end);
    return chars(from.chars, to.chars).toString();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{bytes=" + lenBytes() + ", lines=" + lenLines() + '}';
  }
}

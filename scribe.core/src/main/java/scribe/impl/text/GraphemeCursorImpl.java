package scribe.impl.text;

import com.ibm.icu.text.BreakIterator;
import scribe.ByteRange;
import scribe.TextException;
import scribe.impl.util.Utf8;
import scribe.text.Grapheme;
import scribe.text.GraphemeCursor;

import java.util.NoSuchElementException;

final class GraphemeCursorImpl implements GraphemeCursor {

  private final AbstractTextStore store;
  private final ByteRange range;
  private final long windowStartChars;
  private final CharSequence window;
  private final BreakIterator breaker;

  private int pos = 0;
  private long byteOffset;

  GraphemeCursorImpl(AbstractTextStore store, ByteRange range, long windowStartChars, CharSequence window) {
    this.store = store;
    this.range = range;
    this.windowStartChars = windowStartChars;
    this.window = window;
    this.breaker = BreakIterator.getCharacterInstance();
    this.breaker.setText(window);
    this.byteOffset = range.start;
  }

  @Override
  public long offset() {
    return byteOffset;
  }

  @Override
  public boolean hasNext() {
    return pos < window.length();
  }

  @Override
  public Grapheme next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    int end = breaker.following(pos);
    if (end == BreakIterator.DONE) {
      end = window.length();
    }
    StringBuilder sb = new StringBuilder(end - pos);
    for (int i = pos; i < end; i++) {
      sb.append(window.charAt(i));
    }
    String text = sb.toString();
    long bytes = Utf8.length(text);
    Grapheme g = new Grapheme(text, new ByteRange(byteOffset, byteOffset + bytes));
    pos = end;
    byteOffset += bytes;
    return g;
  }

  @Override
  public void skipTo(long offset) {
    if (offset < range.start || offset > range.end) {
      throw TextException.invalidBoundary("byte offset", offset);
    }
    if (offset == byteOffset) {
      return;
    }
    int rel = (int)(store.location(offset).chars - windowStartChars);
    if (rel != window.length() && !breaker.isBoundary(rel)) {
      throw TextException.invalidBoundary("byte offset", offset);
    }
    pos = rel;
    byteOffset = offset;
  }

  @Override
  public void skipLine() {
    if (byteOffset == range.end) {
      return;
    }
    long line = store.lineOf(byteOffset);
    long next = line + 1 < store.lenLines() ? store.lineStart(line + 1).bytes : store.lenBytes();
    skipTo(Math.min(next, range.end));
  }
}

package scribe.impl.text;

import org.jetbrains.annotations.Nullable;
import scribe.Edit;
import scribe.impl.util.Utf8;

/**
 * Contiguous buffer for short texts such as single line inputs. Lookups scan from the start.
 */
public final class StringTextStore extends AbstractTextStore {

  private final StringBuilder buffer;
  private long lenBytes;
  private long lenLines;

  public StringTextStore(String text) {
    this.buffer = new StringBuilder(text);
    this.lenBytes = Utf8.length(text);
    this.lenLines = Edit.lineBreaks(text) + 1;
  }

  @Override
  public long lenBytes() {
    return lenBytes;
  }

  @Override
  public long lenLines() {
    return lenLines;
  }

  @Override
  long lenChars() {
    return buffer.length();
  }

  @Override
  Location lineStart(long line) {
    long bytes = 0;
    long newlines = 0;
    int i = 0;
    while (newlines < line) {
      int cp = buffer.codePointAt(i);
      if (cp == '\n') {
        newlines++;
      }
      bytes += Utf8.length(cp);
      i += Character.charCount(cp);
    }
    return new Location(bytes, i, line);
  }

  @Nullable
  @Override
  Location locate(long byteOffset) {
    if (byteOffset < 0 || byteOffset > lenBytes) {
      return null;
    }
    long bytes = 0;
    long newlines = 0;
    int i = 0;
    while (bytes < byteOffset) {
      int cp = buffer.codePointAt(i);
      if (cp == '\n') {
        newlines++;
      }
      bytes += Utf8.length(cp);
      i += Character.charCount(cp);
    }
    return bytes == byteOffset ? new Location(bytes, i, newlines) : null;
  }

  @Override
  CharSequence chars(long fromChar, long toChar) {
    return buffer.substring((int)fromChar, (int)toChar);
  }

  @Override
  void splice(Location at, String text) {
    buffer.insert((int)at.chars, text);
    lenBytes += Utf8.length(text);
    lenLines += Edit.lineBreaks(text);
  }

  @Override
  String cut(Location from, Location to) {
    String removed = buffer.substring((int)from.chars, (int)to.chars);
    buffer.delete((int)from.chars, (int)to.chars);
    lenBytes -= to.bytes - from.bytes;
    lenLines -= to.line - from.line;
    return removed;
  }

  @Override
  void replaceAll(String text) {
    buffer.setLength(0);
    buffer.append(text);
    lenBytes = Utf8.length(text);
    lenLines = Edit.lineBreaks(text) + 1;
  }

  @Override
  public String text() {
    return buffer.toString();
  }
}

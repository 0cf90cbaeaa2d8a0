package scribe.text;

import scribe.ByteRange;

import java.util.Objects;

/**
 * One extended grapheme cluster and the bytes it occupies in the document.
 */
public final class Grapheme {
  public final String text;
  public final ByteRange bytes;

  public Grapheme(String text, ByteRange bytes) {
    this.text = text;
    this.bytes = bytes;
  }

  public boolean isLineBreak() {
    return text.equals("\n") || text.equals("\r\n");
  }

  public boolean isWhitespace() {
    return isLineBreak() || Character.isWhitespace(codePoint());
  }

  public int codePoint() {
    return text.isEmpty() ? 0 : text.codePointAt(0);
  }

  public boolean is(int codePoint) {
    return text.length() == Character.charCount(codePoint) && text.codePointAt(0) == codePoint;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Grapheme grapheme = (Grapheme)o;
    return text.equals(grapheme.text) && bytes.equals(grapheme.bytes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, bytes);
  }

  @Override
  public String toString() {
    return "Grapheme{\"" + text + "\" " + bytes + '}';
  }
}

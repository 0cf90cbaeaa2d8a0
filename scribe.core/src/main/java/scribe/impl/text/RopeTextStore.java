package scribe.impl.text;

import org.jetbrains.annotations.Nullable;

/**
 * Store for large documents, backed by a persistent {@link Rope} whose nodes count bytes, chars and line breaks.
 * Every lookup and splice is logarithmic in the document size.
 */
public final class RopeTextStore extends AbstractTextStore {

  private Rope.Tree<TextMetrics, String> rope;

  public RopeTextStore(String text) {
    this.rope = TextImpl.makeText(text);
  }

  /**
   * Current content as an immutable tree, unaffected by later edits.
   */
  public Rope.Tree<TextMetrics, String> snapshot() {
    return rope;
  }

  @Override
  public long lenBytes() {
    return TextImpl.bytesCount(rope);
  }

  @Override
  public long lenLines() {
    return TextImpl.linesCount(rope);
  }

  @Override
  long lenChars() {
    return TextImpl.charsCount(rope);
  }

  @Override
  Location lineStart(long line) {
    Rope.Zipper<TextMetrics, String> z = TextImpl.scanToLineStart(TextImpl.zipper(rope), line);
    return new Location(TextImpl.byteOffset(z), TextImpl.charOffset(z), line);
  }

  @Nullable
  @Override
  Location locate(long byteOffset) {
    if (byteOffset < 0 || byteOffset > lenBytes()) {
      return null;
    }
    Rope.Zipper<TextMetrics, String> z = TextImpl.scanToByteOffset(TextImpl.zipper(rope), byteOffset);
    if (TextImpl.byteOffset(z) != byteOffset) {
      return null;
    }
    return new Location(byteOffset, TextImpl.charOffset(z), TextImpl.line(z));
  }

  @Override
  CharSequence chars(long fromChar, long toChar) {
    return new RopeCharSequence(rope, (int)fromChar, (int)toChar);
  }

  @Override
  void splice(Location at, String text) {
    Rope.Zipper<TextMetrics, String> z = TextImpl.scanToByteOffset(TextImpl.zipper(rope), at.bytes);
    rope = TextImpl.root(TextImpl.insert(z, text));
  }

  @Override
  String cut(Location from, Location to) {
    Rope.Zipper<TextMetrics, String> z = TextImpl.scanToByteOffset(TextImpl.zipper(rope), from.bytes);
    StringBuilder removed = new StringBuilder();
    TextImpl.text(z, to.chars - from.chars, removed);
    rope = TextImpl.root(TextImpl.delete(z, to.chars - from.chars));
    return removed.toString();
  }

  @Override
  void replaceAll(String text) {
    rope = TextImpl.makeText(text);
  }

  @Override
  public String text() {
    return new RopeCharSequence(rope).toString();
  }
}

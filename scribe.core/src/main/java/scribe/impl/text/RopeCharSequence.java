package scribe.impl.text;

/**
 * Char window over a rope. Sequential access stays in the current chunk;
 * only a jump outside of it rescans the tree.
 */
public final class RopeCharSequence implements CharSequence {

  private final Rope.Tree<TextMetrics, String> root;
  private Rope.Zipper<TextMetrics, String> zipper;
  private String chunk;
  private int chunkStart;
  private final int fromChar, toChar;

  public RopeCharSequence(Rope.Tree<TextMetrics, String> root, int from, int to) {
    if (from < 0 || to > root.metrics.charsCount || from > to) {
      throw new IllegalArgumentException("from " + from + ", to " + to + ", total " + root.metrics.charsCount);
    }
    this.root = root;
    this.fromChar = from;
    this.toChar = to;
    if (from < to) {
      seek(Rope.toTransient(TextImpl.zipper(root)), from);
    }
  }

  public RopeCharSequence(Rope.Tree<TextMetrics, String> root) {
    this(root, 0, (int)root.metrics.charsCount);
  }

  private void seek(Rope.Zipper<TextMetrics, String> from, int absoluteCharOffset) {
    Rope.Zipper<TextMetrics, String> offsetLoc = Rope.scan(from, TextImpl.byCharOffsetExclusive(absoluteCharOffset));
    assert offsetLoc != null;
    zipper = offsetLoc;
    chunk = Rope.data(offsetLoc);
    chunkStart = (int)TextImpl.nodeCharOffset(offsetLoc);
  }

  @Override
  public int length() {
    return toChar - fromChar;
  }

  @Override
  public char charAt(int index) {
    if (index >= toChar - fromChar || index < 0) {
      throw new IndexOutOfBoundsException("index:" + index + ", from:" + fromChar + ", to:" + toChar);
    }
    int absoluteCharOffset = fromChar + index;
    if (absoluteCharOffset < chunkStart) {
      seek(Rope.toTransient(TextImpl.zipper(root)), absoluteCharOffset);
    }
    else if (absoluteCharOffset >= chunkStart + chunk.length()) {
      seek(zipper, absoluteCharOffset);
    }
    return chunk.charAt(absoluteCharOffset - chunkStart);
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    int length = toChar - fromChar;
    if (start > length || end > length) {
      throw new IndexOutOfBoundsException("start " + start + ", end " + end + ", length " + length);
    }
    if (start > end) {
      throw new IllegalArgumentException("start " + start + " > end " + end);
    }
    return new RopeCharSequence(root, fromChar + start, fromChar + end);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(length());
    if (length() > 0) {
      TextImpl.text(TextImpl.scanToCharOffset(TextImpl.zipper(root), fromChar), length(), sb);
    }
    return sb.toString();
  }
}

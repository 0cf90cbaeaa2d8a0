package scribe.impl.text;

import scribe.impl.text.Rope.ZipperOps;
import scribe.impl.util.Utf8;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Text specific operations over a {@link Rope} of string chunks.
 * Chunks never split a surrogate pair, so byte and char offsets stay on code point boundaries inside every leaf.
 */
@SuppressWarnings("WeakerAccess")
public final class TextImpl {

  private TextImpl() {
  }

  public enum OffsetKind {
    Bytes,
    Characters,
    Lines
  }

  public static TextMetrics metricsTo(String str, OffsetKind kind, long offset) {
    long bytesCount = 0;
    int charsCount = 0;
    long newlinesCount = 0;

    while (charsCount < str.length() &&
           (kind == OffsetKind.Bytes && bytesCount < offset ||
            kind == OffsetKind.Characters && charsCount < offset ||
            kind == OffsetKind.Lines && newlinesCount < offset)) {
      int codepoint = str.codePointAt(charsCount);
      if (codepoint == '\n') {
        newlinesCount += 1;
      }
      bytesCount += Utf8.length(codepoint);
      charsCount += Character.charCount(codepoint);
    }
    return new TextMetrics(bytesCount, charsCount, newlinesCount);
  }

  public static final TextOps TEXT_OPS = new TextOps(32, 512);

  public static final class TextOps implements ZipperOps<TextMetrics, String> {

    private static final TextMetrics EMPTY_TEXT_METRICS = new TextMetrics();

    public final int splitThresh;
    public final int leafSplitThresh;
    final int leafMergeThresh;

    public TextOps(int branching, int leafWidth) {
      this.splitThresh = branching;
      this.leafMergeThresh = leafWidth / 2;
      this.leafSplitThresh = leafWidth;
    }

    @Override
    public TextMetrics calculateMetrics(String data) {
      return metricsTo(data, OffsetKind.Characters, data.length());
    }

    @Override
    public TextMetrics emptyMetrics() {
      return EMPTY_TEXT_METRICS;
    }

    @Override
    public TextMetrics rf(TextMetrics o1, TextMetrics o2) {
      return o1.add(o2);
    }

    @Override
    public TextMetrics rf(List<TextMetrics> metrics) {
      TextMetrics acc = new TextMetrics();
      for (TextMetrics metric : metrics) {
        acc.merge(metric);
      }
      return acc;
    }

    @Override
    public boolean isLeafOverflown(String leafData) {
      return leafSplitThresh < leafData.length();
    }

    @Override
    public boolean isLeafUnderflown(String leafData) {
      return leafData.length() < leafMergeThresh;
    }

    @Override
    public String mergeLeaves(String leafData1, String leafData2) {
      return leafData1.concat(leafData2);
    }

    private static void splitString(String s, ArrayList<String> result, int from, int to, int thresh) {
      int length = to - from;
      if (length <= thresh) {
        result.add(s.substring(from, to));
        return;
      }
      int half = from + length / 2;
      if (Character.isHighSurrogate(s.charAt(half - 1))) {
        half += 1;
      }
      splitString(s, result, from, half, thresh);
      splitString(s, result, half, to, thresh);
    }

    @Override
    public List<String> splitLeaf(String leafData) {
      assert leafSplitThresh < leafData.length();
      ArrayList<String> result = new ArrayList<>();
      splitString(leafData, result, 0, leafData.length(), leafSplitThresh);
      return result;
    }

    @Override
    public int splitThreshold() {
      return splitThresh;
    }
  }

  /*
   * may stop in a leaf that ends exactly at the offset rather than the one starting there
   *
   * (a, b, c) (d, e, f) -> scan to 3 -> (a, b, c <|>) (d, e, f)
   */
  public static BiFunction<TextMetrics, TextMetrics, Boolean> byteOffsetPredicate(long offset) {
    return (acc, next) -> offset <= acc.bytesCount + next.bytesCount;
  }

  public static BiFunction<TextMetrics, TextMetrics, Boolean> charOffsetPredicate(long offset) {
    return (acc, next) -> offset <= acc.charsCount + next.charsCount;
  }

  public static BiFunction<TextMetrics, TextMetrics, Boolean> byCharOffsetExclusive(long offset) {
    return (acc, next) -> acc.charsCount <= offset && offset < acc.charsCount + next.charsCount;
  }

  public static BiFunction<TextMetrics, TextMetrics, Boolean> linePredicate(long offset) {
    return (acc, next) -> offset <= acc.newlinesCount + next.newlinesCount;
  }

  public static long byteOffset(Rope.Zipper<TextMetrics, String> zipper) {
    return Rope.currentAcc(zipper).bytesCount;
  }

  public static long charOffset(Rope.Zipper<TextMetrics, String> zipper) {
    return Rope.currentAcc(zipper).charsCount;
  }

  public static long nodeCharOffset(Rope.Zipper<TextMetrics, String> zipper) {
    TextMetrics acc = zipper.acc;
    return acc == null ? 0 : acc.charsCount;
  }

  public static long line(Rope.Zipper<TextMetrics, String> zipper) {
    return Rope.currentAcc(zipper).newlinesCount;
  }

  public static Rope.Tree<TextMetrics, String> makeText(String s, ZipperOps<TextMetrics, String> ops) {
    Rope.Node<TextMetrics> root = Rope.growTree(new Rope.Node<>(Rope.singletonList(s),
                                                                Rope.singletonList(ops.calculateMetrics(s))), ops);
    return new Rope.Tree<>(root, ops.rf(root.metrics), ops);
  }

  public static Rope.Tree<TextMetrics, String> makeText(String s) {
    return makeText(s, TEXT_OPS);
  }

  public static Rope.Zipper<TextMetrics, String> zipper(Rope.Tree<TextMetrics, String> tree) {
    return Rope.Zipper.zipper(tree);
  }

  public static Rope.Tree<TextMetrics, String> root(Rope.Zipper<TextMetrics, String> loc) {
    return Rope.root(loc);
  }

  private static BiFunction<TextMetrics, TextMetrics, Boolean> predicate(OffsetKind kind, long offset) {
    switch (kind) {
      case Bytes:
        return byteOffsetPredicate(offset);
      case Characters:
        return charOffsetPredicate(offset);
      case Lines:
        return linePredicate(offset);
    }
    throw new IllegalArgumentException(kind.toString());
  }

  private static long getOffset(TextMetrics metrics, OffsetKind kind) {
    switch (kind) {
      case Bytes:
        return metrics.bytesCount;
      case Characters:
        return metrics.charsCount;
      case Lines:
        return metrics.newlinesCount;
    }
    throw new IllegalArgumentException(kind.toString());
  }

  private static Rope.Zipper<TextMetrics, String> scan(Rope.Zipper<TextMetrics, String> zipper, long offset, OffsetKind kind) {
    long currentOffset = getOffset(Rope.currentAcc(zipper), kind);
    if (offset < currentOffset) {
      throw new IllegalArgumentException("Backwards scan: current is " + currentOffset + ", scanning to " + offset);
    }

    /* a leaf may contain stretches where the metric does not grow,
     * restarting the reduction from the leaf start could land to the left of the current position
     */
    if (offset == currentOffset) {
      return zipper;
    }

    boolean isTransient = zipper.isTransient;
    Rope.Zipper<TextMetrics, String> offsetLoc = Rope.scan(Rope.toTransient(zipper), predicate(kind, offset));
    if (offsetLoc == null) {
      throw new IndexOutOfBoundsException("Kind: " + kind + ", looking for offset " + offset);
    }
    if (Rope.isRoot(offsetLoc)) {
      return offsetLoc;
    }
    TextMetrics nodeAcc = Rope.nodeAcc(offsetLoc);
    String s = Rope.data(offsetLoc);
    offsetLoc.oacc = nodeAcc.add(metricsTo(s, kind, offset - getOffset(nodeAcc, kind)));
    return isTransient ? offsetLoc : Rope.toPersistent(offsetLoc);
  }

  public static Rope.Zipper<TextMetrics, String> scanToByteOffset(Rope.Zipper<TextMetrics, String> zipper, long offset) {
    return scan(zipper, offset, OffsetKind.Bytes);
  }

  public static Rope.Zipper<TextMetrics, String> scanToCharOffset(Rope.Zipper<TextMetrics, String> zipper, long offset) {
    return scan(zipper, offset, OffsetKind.Characters);
  }

  public static Rope.Zipper<TextMetrics, String> scanToLineStart(Rope.Zipper<TextMetrics, String> zipper, long line) {
    return scan(zipper, line, OffsetKind.Lines);
  }

  public static Rope.Zipper<TextMetrics, String> insert(Rope.Zipper<TextMetrics, String> loc, String s) {
    if (s.isEmpty()) {
      return loc;
    }

    Rope.Zipper<TextMetrics, String> branch = null;
    Rope.Zipper<TextMetrics, String> leaf = loc;
    while (leaf != null && Rope.isBranch(leaf)) {
      branch = leaf;
      leaf = Rope.downLeft(leaf);
    }

    if (leaf == null) {
      // only an empty tree has no leaf to insert into
      TextMetrics metrics = branch.ops.calculateMetrics(s);
      return Rope.replace(branch,
                          new Rope.Node<>(Rope.singletonList(s), Rope.singletonList(metrics)),
                          metrics);
    }
    int relCharOffset = (int)(charOffset(leaf) - nodeCharOffset(leaf));
    String data = Rope.data(leaf);
    String newData = data.substring(0, relCharOffset)
      .concat(s)
      .concat(data.substring(relCharOffset));
    return Rope.replace(leaf, newData, leaf.ops.calculateMetrics(newData));
  }

  public static Rope.Zipper<TextMetrics, String> delete(Rope.Zipper<TextMetrics, String> loc, long charCount) {
    long l = charCount;
    while (l > 0) {
      while (Rope.isBranch(loc)) {
        loc = Rope.downLeft(loc);
        assert loc != null;
      }

      String s = Rope.data(loc);
      int relOffset = (int)(charOffset(loc) - nodeCharOffset(loc));
      int chunkLength = s.length();
      int end = (int)Math.min(chunkLength, relOffset + l);
      l -= end - relOffset;
      if (relOffset == 0 && end == chunkLength) {
        loc = Rope.remove(loc);
      }
      else {
        String news = s.substring(0, relOffset).concat(s.substring(end));
        Rope.Zipper<TextMetrics, String> newLeaf = Rope.replace(loc, news, loc.ops.calculateMetrics(news));
        if (end == chunkLength && l > 0) {
          loc = Rope.next(newLeaf);
        }
        else {
          loc = newLeaf;
        }
      }
    }
    return loc;
  }

  /*
   * appends charCount chars starting at the zipper position
   */
  public static void text(Rope.Zipper<TextMetrics, String> loc, long charCount, StringBuilder sb) {
    long length = charCount;
    while (length > 0) {
      if (Rope.isBranch(loc)) {
        loc = Rope.downLeft(loc);
        continue;
      }
      String chunk = Rope.data(loc);
      int start = (int)(charOffset(loc) - nodeCharOffset(loc));
      int end = (int)Math.min(chunk.length(), start + length);
      sb.append(chunk, start, end);
      length -= end - start;
      if (length > 0) {
        loc = Rope.nextLeaf(loc);
      }
    }
  }

  public static long bytesCount(Rope.Tree<TextMetrics, String> text) {
    return text.metrics.bytesCount;
  }

  public static long charsCount(Rope.Tree<TextMetrics, String> text) {
    return text.metrics.charsCount;
  }

  public static long linesCount(Rope.Tree<TextMetrics, String> text) {
    return text.metrics.newlinesCount + 1;
  }
}

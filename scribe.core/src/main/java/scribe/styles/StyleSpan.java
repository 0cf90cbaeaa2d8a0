package scribe.styles;

import scribe.ByteRange;

import java.util.Comparator;
import java.util.Objects;

/**
 * A caller supplied style tag over a byte range.
 */
public final class StyleSpan {

  public static final Comparator<StyleSpan> BY_START =
    Comparator.<StyleSpan>comparingLong(s -> s.range.start).thenComparingLong(s -> s.range.end).thenComparingInt(s -> s.style);

  public final ByteRange range;
  public final int style;

  public StyleSpan(ByteRange range, int style) {
    this.range = range;
    this.style = style;
  }

  public static StyleSpan of(long start, long end, int style) {
    return new StyleSpan(new ByteRange(start, end), style);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    StyleSpan span = (StyleSpan)o;
    return style == span.style && range.equals(span.range);
  }

  @Override
  public int hashCode() {
    return Objects.hash(range, style);
  }

  @Override
  public String toString() {
    return range + "#" + style;
  }
}

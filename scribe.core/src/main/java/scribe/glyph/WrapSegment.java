package scribe.glyph;

import scribe.ByteRange;

import java.util.Objects;

/**
 * Bytes of a line shown on one screen row, the grapheme column the row starts at and its screen width.
 */
public final class WrapSegment {
  public final ByteRange bytes;
  public final long startColumn;
  public final long width;

  public WrapSegment(ByteRange bytes, long startColumn, long width) {
    this.bytes = bytes;
    this.startColumn = startColumn;
    this.width = width;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    WrapSegment segment = (WrapSegment)o;
    return startColumn == segment.startColumn && width == segment.width && bytes.equals(segment.bytes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(bytes, startColumn, width);
  }

  @Override
  public String toString() {
    return "WrapSegment{" + bytes + ", column=" + startColumn + ", width=" + width + '}';
  }
}

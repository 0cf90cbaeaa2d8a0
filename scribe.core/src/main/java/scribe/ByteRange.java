package scribe;

import java.util.Objects;

/**
 * Half-open range {@code [start, end)} of UTF-8 byte offsets.
 */
public final class ByteRange {
  public final long start;
  public final long end;

  public ByteRange(long start, long end) {
    if (start < 0) {
      throw TextException.invalidBoundary("byte offset", start);
    }
    if (end < start) {
      throw TextException.invalidRange(start, end);
    }
    this.start = start;
    this.end = end;
  }

  public static ByteRange of(long start, long end) {
    return new ByteRange(start, end);
  }

  public static ByteRange empty(long offset) {
    return new ByteRange(offset, offset);
  }

  public long length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ByteRange range = (ByteRange)o;
    return start == range.start && end == range.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}

package scribe.intervals;

import scribe.Edit;
import scribe.impl.intervals.Impl;

/**
 * Persistent collection of half-open intervals that follow text edits.
 * Every modification returns a new collection sharing untouched subtrees with the old one.
 */
public interface Intervals<T> {

  static <T> Intervals<T> empty() {
    return Impl.empty(32);
  }

  interface Batch<T> {
    /**
     * Intervals of one batch must come sorted by {@code from}; ids must be unique and non negative.
     */
    void add(long id, long from, long to, T data);

    Intervals<T> commit();
  }

  Batch<T> batch();

  Intervals<T> removeByIds(Iterable<Long> ids);

  /**
   * Intervals overlapping {@code [start, end)}. An empty query range finds the intervals containing {@code start}.
   */
  IntervalsIterator<T> query(long start, long end);

  /**
   * Insertion of {@code length} at {@code offset}: every boundary at or after the offset moves right,
   * so an interval starting before the offset and ending at or after it grows.
   */
  Intervals<T> expand(long offset, long length);

  /**
   * Deletion of {@code [offset, offset + length)}: covered intervals disappear, overlapping ones shrink.
   */
  Intervals<T> collapse(long offset, long length);

  default Intervals<T> edit(Edit edit) {
    Intervals<T> res = this;
    if (edit.deletedBytes > 0) {
      res = res.collapse(edit.offset, edit.deletedBytes);
    }
    if (edit.insertedBytes > 0) {
      res = res.expand(edit.offset, edit.insertedBytes);
    }
    return res;
  }
}

package scribe.styles;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import scribe.ByteRange;
import scribe.Edit;
import scribe.intervals.Interval;
import scribe.intervals.Intervals;
import scribe.intervals.IntervalsIterator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Style spans of one document, kept in an interval tree that follows every {@link Edit}.
 * <p>
 * Insertion at {@code p} moves every boundary at or after {@code p}; a deletion removes the deleted bytes from
 * every span it overlaps and drops the spans it covers.
 */
public final class StyleIndex {

  private static final Logger LOG = LogManager.getLogger(StyleIndex.class);

  private Intervals<Integer> intervals = Intervals.empty();
  private long nextId = 0;
  private int size = 0;

  public Intervals<Integer> snapshot() {
    return intervals;
  }

  public int size() {
    return size;
  }

  /**
   * @return false if the range is empty or an identical span is already there
   */
  public boolean add(ByteRange range, int style) {
    if (range.isEmpty() || find(range, style) != null) {
      return false;
    }
    Intervals.Batch<Integer> batch = intervals.batch();
    batch.add(nextId++, range.start, range.end, style);
    intervals = batch.commit();
    size++;
    return true;
  }

  public boolean add(StyleSpan span) {
    return add(span.range, span.style);
  }

  /**
   * Removes the span with exactly this range and style.
   */
  public boolean remove(ByteRange range, int style) {
    Interval<Integer> found = find(range, style);
    if (found == null) {
      return false;
    }
    intervals = intervals.removeByIds(Collections.singletonList(found.id));
    size--;
    return true;
  }

  public boolean remove(StyleSpan span) {
    return remove(span.range, span.style);
  }

  @Nullable
  private Interval<Integer> find(ByteRange range, int style) {
    if (range.isEmpty()) {
      return null;
    }
    IntervalsIterator<Integer> it = intervals.query(range.start, range.end);
    while (it.next()) {
      if (it.from() > range.start) {
        return null;
      }
      if (it.from() == range.start && it.to() == range.end && it.data() == style) {
        return it.interval();
      }
    }
    return null;
  }

  /**
   * Replaces all spans. Empty and duplicate spans are skipped.
   */
  public void setStyles(List<StyleSpan> spans) {
    List<StyleSpan> sorted = new ArrayList<>(spans);
    sorted.sort(StyleSpan.BY_START);
    Intervals<Integer> fresh = Intervals.empty();
    Intervals.Batch<Integer> batch = fresh.batch();
    StyleSpan prev = null;
    int count = 0;
    for (StyleSpan span : sorted) {
      if (span.range.isEmpty() || span.equals(prev)) {
        continue;
      }
      batch.add(nextId++, span.range.start, span.range.end, span.style);
      prev = span;
      count++;
    }
    intervals = batch.commit();
    size = count;
    LOG.debug("styles replaced: {} spans", count);
  }

  public void clear() {
    intervals = Intervals.empty();
    size = 0;
  }

  /**
   * Spans overlapping the range, ordered by start. An empty range overlaps nothing.
   */
  public List<StyleSpan> stylesIn(ByteRange range) {
    if (range.isEmpty()) {
      return Collections.emptyList();
    }
    return collect(intervals.query(range.start, range.end));
  }

  /**
   * Styles of the spans containing the byte, ordered by span start.
   */
  public List<Integer> stylesAt(long byteOffset) {
    List<Integer> result = new ArrayList<>();
    IntervalsIterator<Integer> it = intervals.query(byteOffset, byteOffset);
    while (it.next()) {
      result.add(it.data());
    }
    return result;
  }

  public boolean styleMatch(long byteOffset, int style) {
    IntervalsIterator<Integer> it = intervals.query(byteOffset, byteOffset);
    while (it.next()) {
      if (it.data() == style) {
        return true;
      }
    }
    return false;
  }

  /**
   * Range of the first span of the style containing the byte.
   */
  public Optional<ByteRange> stylesAtMatch(long byteOffset, int style) {
    IntervalsIterator<Integer> it = intervals.query(byteOffset, byteOffset);
    while (it.next()) {
      if (it.data() == style) {
        return Optional.of(new ByteRange(it.from(), it.to()));
      }
    }
    return Optional.empty();
  }

  /**
   * Drops every span of the style.
   *
   * @return the dropped spans, ordered by start
   */
  public List<StyleSpan> removeStyleFully(int style) {
    List<StyleSpan> removed = new ArrayList<>();
    List<Long> ids = new ArrayList<>();
    IntervalsIterator<Integer> it = intervals.query(0, Long.MAX_VALUE);
    while (it.next()) {
      if (it.data() == style) {
        removed.add(StyleSpan.of(it.from(), it.to(), style));
        ids.add(it.id());
      }
    }
    if (!ids.isEmpty()) {
      intervals = intervals.removeByIds(ids);
      size -= ids.size();
    }
    return removed;
  }

  public List<StyleSpan> styles() {
    return collect(intervals.query(0, Long.MAX_VALUE));
  }

  private static List<StyleSpan> collect(IntervalsIterator<Integer> it) {
    List<StyleSpan> result = new ArrayList<>();
    while (it.next()) {
      result.add(StyleSpan.of(it.from(), it.to(), it.data()));
    }
    return result;
  }

  /**
   * Moves the spans along with the edit.
   *
   * @return for a deletion, every span touching the deleted range (its ends included) with its new shape,
   * enough to put them back with {@link #restore} after the text is reinserted
   */
  public List<StyleChange> edit(Edit edit) {
    List<StyleChange> changes = Collections.emptyList();
    if (edit.deletedBytes > 0) {
      long a = edit.offset;
      long b = edit.offset + edit.deletedBytes;
      changes = new ArrayList<>();
      IntervalsIterator<Integer> it = intervals.query(Math.max(0, a - 1), b + 1);
      while (it.next()) {
        if (it.from() <= b && it.to() >= a) {
          StyleSpan before = StyleSpan.of(it.from(), it.to(), it.data());
          StyleSpan after = collapsed(before, a, edit.deletedBytes);
          if (after == null) {
            size--;
          }
          changes.add(new StyleChange(before, after));
        }
      }
    }
    intervals = intervals.edit(edit);
    return changes;
  }

  /**
   * Undoes what a deletion did to the spans once its text has been inserted back by {@code reinsert}.
   */
  public void restore(List<StyleChange> changes, Edit reinsert) {
    for (StyleChange change : changes) {
      if (change.after != null) {
        remove(expanded(change.after, reinsert.offset, reinsert.insertedBytes));
      }
      add(change.before);
    }
  }

  @Nullable
  static StyleSpan collapsed(StyleSpan span, long offset, long length) {
    long start = span.range.start;
    long end = span.range.end;
    if (end <= offset) {
      return span;
    }
    if (offset + length <= start) {
      return StyleSpan.of(start - length, end - length, span.style);
    }
    long newStart = Math.min(start, offset);
    long newEnd = Math.max(offset, end - length);
    return newEnd <= newStart ? null : StyleSpan.of(newStart, newEnd, span.style);
  }

  static StyleSpan expanded(StyleSpan span, long offset, long length) {
    long start = span.range.start;
    long end = span.range.end;
    if (offset <= start) {
      return StyleSpan.of(start + length, end + length, span.style);
    }
    if (offset <= end) {
      return StyleSpan.of(start, end + length, span.style);
    }
    return span;
  }

  @Override
  public String toString() {
    return "StyleIndex" + styles();
  }
}

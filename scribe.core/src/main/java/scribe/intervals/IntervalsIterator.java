package scribe.intervals;

import java.util.ArrayList;
import java.util.List;

/**
 * Cursor over query results in ascending order of start offset. Call {@link #next()} before reading.
 */
public interface IntervalsIterator<T> {

  long from();

  long to();

  long id();

  T data();

  boolean next();

  default Interval<T> interval() {
    return new Interval<>(id(), from(), to(), data());
  }

  default List<Interval<T>> toList() {
    ArrayList<Interval<T>> list = new ArrayList<>();
    while (next()) {
      list.add(interval());
    }
    return list;
  }
}

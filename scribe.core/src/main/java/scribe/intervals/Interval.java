package scribe.intervals;

import java.util.Objects;

/**
 * Half-open interval {@code [from, to)} with attached data.
 */
public final class Interval<T> {
  public final long id;
  public final long from;
  public final long to;
  public final T data;

  public Interval(long id, long from, long to, T data) {
    assert from <= to : ("Interval to < from: " + to + " < " + from);
    this.id = id;
    this.from = from;
    this.to = to;
    this.data = data;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Interval<?> interval = (Interval<?>)o;
    return id == interval.id &&
           from == interval.from &&
           to == interval.to &&
           Objects.equals(data, interval.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, from, to, data);
  }

  @Override
  public String toString() {
    return "id=" + id + " [" + from + ", " + to + ") " + data;
  }
}

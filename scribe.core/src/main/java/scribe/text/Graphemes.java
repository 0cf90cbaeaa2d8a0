package scribe.text;

import scribe.ByteRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Lazy, finite graphemes of a byte range. Every {@link #iterator()} call starts over from the range start.
 */
public interface Graphemes extends Iterable<Grapheme> {

  ByteRange range();

  @Override
  GraphemeCursor iterator();

  default long count() {
    long count = 0;
    GraphemeCursor cursor = iterator();
    while (cursor.hasNext()) {
      cursor.next();
      count++;
    }
    return count;
  }

  default List<Grapheme> toList() {
    List<Grapheme> list = new ArrayList<>();
    for (Grapheme g : this) {
      list.add(g);
    }
    return list;
  }
}

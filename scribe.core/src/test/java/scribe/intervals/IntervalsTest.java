package scribe.intervals;

import org.junit.jupiter.api.Test;
import scribe.Edit;
import scribe.impl.intervals.Impl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class IntervalsTest {

  private static Intervals<String> of(long... bounds) {
    Intervals.Batch<String> batch = Intervals.<String>empty().batch();
    for (int i = 0; i < bounds.length; i += 2) {
      batch.add(i / 2, bounds[i], bounds[i + 1], "i" + i / 2);
    }
    return batch.commit();
  }

  private static Interval<String> only(Intervals<String> intervals) {
    List<Interval<String>> all = intervals.query(0, Long.MAX_VALUE / 2).toList();
    assertEquals(1, all.size(), all.toString());
    return all.get(0);
  }

  @Test
  public void insertionMovesOrGrows() {
    Intervals<String> tree = of(5, 10);
    assertEquals(new Interval<>(0, 8, 13, "i0"), only(tree.expand(2, 3)));
    assertEquals(new Interval<>(0, 8, 13, "i0"), only(tree.expand(5, 3)));
    assertEquals(new Interval<>(0, 5, 13, "i0"), only(tree.expand(7, 3)));
    assertEquals(new Interval<>(0, 5, 13, "i0"), only(tree.expand(10, 3)));
    assertEquals(new Interval<>(0, 5, 10, "i0"), only(tree.expand(11, 3)));
  }

  @Test
  public void deletionShrinksOrRemoves() {
    Intervals<String> tree = of(5, 10);
    assertEquals(new Interval<>(0, 5, 7, "i0"), only(tree.collapse(7, 5)));
    assertEquals(new Interval<>(0, 2, 6, "i0"), only(tree.collapse(2, 4)));
    assertEquals(new Interval<>(0, 2, 7, "i0"), only(tree.collapse(0, 3)));
    assertEquals(new Interval<>(0, 5, 10, "i0"), only(tree.collapse(12, 3)));
    assertTrue(tree.collapse(0, 20).query(0, 100).toList().isEmpty());
    assertTrue(tree.collapse(5, 5).query(0, 100).toList().isEmpty());
  }

  @Test
  public void editCollapsesThenExpands() {
    Intervals<String> tree = of(5, 10);
    Edit replace = new Edit(6, "ab", 2, "wxyz", 4, 0);
    assertEquals(new Interval<>(0, 5, 12, "i0"), only(tree.edit(replace)));
  }

  @Test
  public void pointQueryFindsContainingIntervals() {
    Intervals<String> tree = of(0, 5, 3, 8, 5, 6, 9, 12);
    assertEquals(List.of(0L, 1L), ids(tree.query(4, 4)));
    assertEquals(List.of(1L, 2L), ids(tree.query(5, 5)));
    assertEquals(List.of(), ids(tree.query(8, 8)));
    assertEquals(List.of(1L, 2L, 3L), ids(tree.query(5, 10)));
    assertEquals(List.of(), ids(tree.query(12, 20)));
  }

  @Test
  public void unsortedBatchIsRejected() {
    Intervals.Batch<String> batch = Intervals.<String>empty().batch();
    batch.add(0, 10, 12, "a");
    assertThrows(IllegalArgumentException.class, () -> batch.add(1, 5, 6, "b"));
    assertThrows(IllegalArgumentException.class, () -> Intervals.<String>empty().batch().add(0, 5, 4, "c"));
  }

  @Test
  public void editsDoNotChangeOlderVersions() {
    Intervals<String> tree = of(0, 4, 2, 9, 20, 30);
    Intervals<String> collapsed = tree.collapse(1, 10);
    Intervals<String> removed = tree.removeByIds(List.of(1L));
    assertEquals(3, tree.query(0, 100).toList().size());
    assertEquals(List.of(new Interval<>(0, 0, 4, "i0"), new Interval<>(1, 2, 9, "i1"), new Interval<>(2, 20, 30, "i2")),
                 all(tree));
    assertEquals(List.of(new Interval<>(0, 0, 1, "i0"), new Interval<>(2, 10, 20, "i2")), all(collapsed));
    assertEquals(List.of(0L, 2L), ids(removed.query(0, 100)));
  }

  private static List<Interval<String>> all(Intervals<String> tree) {
    List<Interval<String>> all = tree.query(0, Long.MAX_VALUE / 2).toList();
    all.sort(Comparator.comparingLong(it -> it.id));
    return all;
  }

  private static List<Long> ids(IntervalsIterator<String> it) {
    List<Long> ids = new ArrayList<>();
    while (it.next()) {
      ids.add(it.id());
    }
    ids.sort(Comparator.naturalOrder());
    return ids;
  }

  private static final class Model {
    final List<Interval<String>> intervals = new ArrayList<>();

    void expand(long offset, long len) {
      for (int i = 0; i < intervals.size(); i++) {
        Interval<String> it = intervals.get(i);
        if (offset <= it.from) {
          intervals.set(i, new Interval<>(it.id, it.from + len, it.to + len, it.data));
        }
        else if (offset <= it.to) {
          intervals.set(i, new Interval<>(it.id, it.from, it.to + len, it.data));
        }
      }
    }

    void collapse(long offset, long len) {
      List<Interval<String>> result = new ArrayList<>();
      for (Interval<String> it : intervals) {
        if (it.to <= offset) {
          result.add(it);
        }
        else if (offset + len <= it.from) {
          result.add(new Interval<>(it.id, it.from - len, it.to - len, it.data));
        }
        else {
          long from = Math.min(it.from, offset);
          long to = Math.max(offset, it.to - len);
          if (from < to) {
            result.add(new Interval<>(it.id, from, to, it.data));
          }
        }
      }
      intervals.clear();
      intervals.addAll(result);
    }

    List<Long> query(long from, long to) {
      List<Long> ids = new ArrayList<>();
      for (Interval<String> it : intervals) {
        boolean hit = from == to
                      ? it.from <= from && from < it.to
                      : it.from < to && from < it.to;
        if (hit) {
          ids.add(it.id);
        }
      }
      ids.sort(Comparator.naturalOrder());
      return ids;
    }
  }

  @Test
  public void randomEditsMatchModel() {
    Random random = new Random(7);
    Model model = new Model();
    Intervals<String> tree = Impl.empty(4);
    long nextId = 0;
    long length = 1000;
    for (int step = 0; step < 400; step++) {
      int op = random.nextInt(5);
      if (op == 0 || model.intervals.size() < 10) {
        int count = 1 + random.nextInt(20);
        List<Long> starts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
          starts.add((long)random.nextInt((int)length));
        }
        starts.sort(Comparator.naturalOrder());
        Intervals.Batch<String> batch = tree.batch();
        for (long start : starts) {
          long end = start + 1 + random.nextInt(50);
          long id = nextId++;
          batch.add(id, start, end, "s" + id);
          model.intervals.add(new Interval<>(id, start, end, "s" + id));
        }
        tree = batch.commit();
      }
      else if (op == 1) {
        long offset = random.nextInt((int)length + 1);
        long len = 1 + random.nextInt(40);
        tree = tree.expand(offset, len);
        model.expand(offset, len);
        length += len;
      }
      else if (op == 2 && length > 100) {
        long offset = random.nextInt((int)length);
        long len = Math.min(length - offset, 1 + random.nextInt(40));
        tree = tree.collapse(offset, len);
        model.collapse(offset, len);
        length -= len;
      }
      else if (op == 3) {
        Set<Long> victims = new HashSet<>();
        for (int i = 0; i < 5; i++) {
          victims.add(model.intervals.get(random.nextInt(model.intervals.size())).id);
        }
        tree = tree.removeByIds(victims);
        model.intervals.removeIf(it -> victims.contains(it.id));
      }
      else {
        long from = random.nextInt((int)length);
        long to = random.nextBoolean() ? from : from + random.nextInt(100);
        assertEquals(model.query(from, to), ids(tree.query(from, to)), "query [" + from + ", " + to + ")");
      }
      List<Interval<String>> expected = new ArrayList<>(model.intervals);
      expected.sort(Comparator.comparingLong(it -> it.id));
      assertEquals(expected, all(tree));
    }
  }
}

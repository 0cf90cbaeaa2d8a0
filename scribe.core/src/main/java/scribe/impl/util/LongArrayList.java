package scribe.impl.util;

import java.util.Arrays;

/**
 * Growable array of primitive longs. Interval tree nodes keep ids, starts and ends in these.
 */
public final class LongArrayList {
  private long[] buffer;
  private int size;

  public LongArrayList() {
    this(8);
  }

  public LongArrayList(int capacity) {
    buffer = new long[Math.max(1, capacity)];
    size = 0;
  }

  public LongArrayList(long[] array) {
    buffer = array;
    size = array.length;
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public long get(int idx) {
    if (idx >= size) {
      throw new IndexOutOfBoundsException("idx: " + idx + ", size: " + size);
    }
    return buffer[idx];
  }

  public void set(int idx, long v) {
    assert idx < size;
    buffer[idx] = v;
  }

  private void grow() {
    buffer = Arrays.copyOf(buffer, Math.max(4, buffer.length * 2));
  }

  public void add(long v) {
    if (buffer.length == size) {
      grow();
    }
    buffer[size] = v;
    size += 1;
  }

  public void add(int idx, long v) {
    assert idx <= size;
    if (buffer.length == size) {
      grow();
    }
    System.arraycopy(buffer, idx, buffer, idx + 1, size - idx);
    buffer[idx] = v;
    size += 1;
  }

  public void remove(int idx) {
    if (idx >= size) {
      throw new IndexOutOfBoundsException("idx: " + idx + ", size: " + size);
    }
    System.arraycopy(buffer, idx + 1, buffer, idx, size - idx - 1);
    size -= 1;
  }

  public LongArrayList copy() {
    LongArrayList r = new LongArrayList(0);
    r.buffer = Arrays.copyOf(buffer, Math.max(1, size));
    r.size = size;
    return r;
  }

  public LongArrayList subList(int from, int to) {
    LongArrayList r = new LongArrayList(to - from);
    System.arraycopy(buffer, from, r.buffer, 0, to - from);
    r.size = to - from;
    return r;
  }

  public int indexOf(long key) {
    for (int i = 0; i < size; i++) {
      if (buffer[i] == key) {
        return i;
      }
    }
    return -1;
  }

  public long max() {
    long m = Long.MIN_VALUE;
    for (int i = 0; i < size; ++i) {
      m = Math.max(m, buffer[i]);
    }
    return m;
  }

  @Override
  public String toString() {
    return Arrays.toString(Arrays.copyOfRange(buffer, 0, size));
  }
}

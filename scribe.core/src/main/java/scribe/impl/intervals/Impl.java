package scribe.impl.intervals;

import io.lacuna.bifurcan.IntMap;
import scribe.impl.util.LongArrayList;
import scribe.intervals.Interval;
import scribe.intervals.Intervals;
import scribe.intervals.IntervalsIterator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.NoSuchElementException;

/**
 * B-tree of intervals sorted by start. Nodes keep the starts and ends of their children relative to their own
 * start, so shifting a subtree only touches the path leading to it. Every entry of a branch spans
 * {@code [min start, max end]} of the child node.
 * <p>
 * Ids of user intervals are non negative; inner nodes get negative ids so that {@code parentsMap} can resolve
 * the path from any interval to the root.
 */
@SuppressWarnings("WeakerAccess")
public final class Impl {

  private static final long ROOT_ID = -1;
  private static final long FIRST_ID = -2;

  private Impl() {
  }

  public static final class IntervalsImpl<T> implements Intervals<T> {
    public final Node root;
    public final int maxChildren;
    public final IntMap<Long> parentsMap;
    public final long nextInnerId;

    public IntervalsImpl(int maxChildren, Node root, IntMap<Long> parentsMap, long nextId) {
      this.maxChildren = maxChildren;
      this.root = root;
      this.parentsMap = parentsMap;
      this.nextInnerId = nextId;
    }

    @Override
    public Batch<T> batch() {
      return Impl.batch(this);
    }

    @Override
    public Intervals<T> removeByIds(Iterable<Long> ids) {
      return Impl.remove(this, ids);
    }

    @Override
    public IntervalsIterator<T> query(long start, long end) {
      return Impl.query(this, start, end);
    }

    @Override
    public Intervals<T> expand(long offset, long length) {
      return Impl.expand(this, offset, length);
    }

    @Override
    public Intervals<T> collapse(long offset, long length) {
      return Impl.collapse(this, offset, length);
    }
  }

  public static <T> IntervalsImpl<T> empty(int maxChildren) {
    return new IntervalsImpl<>(maxChildren, Node.empty(maxChildren / 2), new IntMap<>(), FIRST_ID);
  }

  public static final class Node {
    public final LongArrayList ids;
    public final LongArrayList starts;
    public final LongArrayList ends;
    public final ArrayList<Object> children;

    public Node(LongArrayList ids, LongArrayList starts, LongArrayList ends, ArrayList<Object> children) {
      this.ids = ids;
      this.starts = starts;
      this.ends = ends;
      this.children = children;
    }

    public static Node empty(int capacity) {
      return new Node(new LongArrayList(capacity),
                      new LongArrayList(capacity),
                      new LongArrayList(capacity),
                      new ArrayList<>(capacity));
    }

    public void add(long id, long start, long end, Object child) {
      ids.add(id);
      starts.add(start);
      ends.add(end);
      children.add(child);
    }

    public void removeAt(int idx) {
      ids.remove(idx);
      starts.remove(idx);
      ends.remove(idx);
      children.remove(idx);
    }

    public Node copy() {
      return new Node(ids.copy(), starts.copy(), ends.copy(), new ArrayList<>(children));
    }
  }

  public static final class EditingContext {
    public long nextId;
    public final int maxChildren;
    public IntMap<Long> parentsMap;

    public EditingContext(long nextId, int maxChildren, IntMap<Long> parentsMap) {
      this.nextId = nextId;
      this.maxChildren = maxChildren;
      this.parentsMap = parentsMap;
    }
  }

  public static final class Zipper {
    boolean changed = false;
    boolean hasRightCousin;
    long delta = 0;
    Zipper parent = null;
    long rightCousinStart;
    LongArrayList starts;
    LongArrayList ends;
    LongArrayList ids;
    ArrayList<Object> children;
    EditingContext editingContext;
    int idx = 0;

    private static final LongArrayList ROOT_ENDS = new LongArrayList(new long[]{Long.MAX_VALUE});
    private static final LongArrayList ROOT_STARTS = new LongArrayList(new long[]{0});
    private static final LongArrayList ROOT_IDS = new LongArrayList(new long[]{ROOT_ID});

    static Zipper create(Node root, EditingContext editingContext) {
      Zipper zipper = new Zipper();
      zipper.rightCousinStart = Long.MAX_VALUE;
      zipper.hasRightCousin = false;
      zipper.starts = ROOT_STARTS;
      zipper.ends = ROOT_ENDS;
      zipper.ids = ROOT_IDS;
      zipper.editingContext = editingContext;
      ArrayList<Object> children = new ArrayList<>(1);
      children.add(root);
      zipper.children = children;
      zipper.idx = 0;
      return zipper;
    }

    static long from(Zipper z) {
      return z.delta + z.starts.get(z.idx);
    }

    static long to(Zipper z) {
      return z.delta + z.ends.get(z.idx);
    }

    static boolean isRoot(Zipper z) {
      return z.parent == null;
    }

    static boolean isBranch(Zipper z) {
      return !z.children.isEmpty() && z.children.get(0) instanceof Node;
    }

    static Node node(Zipper z) {
      return (Node)z.children.get(z.idx);
    }

    private static void ensureMutable(Zipper z) {
      if (!z.changed) {
        z.ids = z.ids.copy();
        z.starts = z.starts.copy();
        z.ends = z.ends.copy();
        z.children = new ArrayList<>(z.children);
        z.changed = true;
      }
    }

    static Zipper downLeft(Zipper z) {
      Node child = node(z);
      if (child.children.isEmpty()) {
        return null;
      }
      Zipper r = new Zipper();
      r.parent = z;
      r.starts = child.starts;
      r.ends = child.ends;
      r.ids = child.ids;
      r.delta = z.delta + z.starts.get(z.idx);
      r.hasRightCousin = z.hasRightCousin || z.idx < z.children.size() - 1;
      r.rightCousinStart = r.hasRightCousin
                           ? (z.idx + 1 < z.starts.size()
                              ? z.starts.get(z.idx + 1)
                              : z.rightCousinStart) - z.starts.get(z.idx)
                           : Long.MAX_VALUE;
      assert r.rightCousinStart >= 0 : "rightCousinStart:" + r.rightCousinStart;
      r.children = child.children;
      r.editingContext = z.editingContext;
      r.idx = 0;
      return r;
    }

    static Zipper replace(Zipper p, Node n, long delta) {
      ensureMutable(p);
      p.children.set(p.idx, n);
      long newStart = p.starts.get(p.idx) + delta;
      p.starts.set(p.idx, newStart);
      p.ends.set(p.idx, newStart + n.ends.max());
      return p;
    }

    static Zipper right(Zipper z) {
      if (z.idx + 1 < z.children.size()) {
        z.idx += 1;
        return z;
      }
      return null;
    }

    static Zipper skipRight(Zipper z) {
      Zipper right = right(z);
      if (right != null) {
        return right;
      }
      return z.hasRightCousin ? skipRight(up(z)) : null;
    }

    static Zipper up(Zipper z) {
      if (z.changed) {
        Zipper p = z.parent;
        Node n = new Node(z.ids, z.starts, z.ends, z.children);
        long delta = p.parent == null ? 0 : normalize(n);
        n = balanceChildren(z.editingContext, n);
        replace(p, n, delta);
        return p;
      }
      return z.parent;
    }

    static Node root(Zipper z) {
      while (!isRoot(z)) {
        z = up(z);
      }
      return shrinkTree(z.editingContext, growTree(z.editingContext, node(z)));
    }

    /*
     * after every interval starting at or before the offset, keeps insertion order for equal starts
     */
    private static int findInsertionPoint(LongArrayList ss, long o) {
      int i = 0;
      while (i < ss.size() && ss.get(i) <= o) {
        ++i;
      }
      return i;
    }

    static <T> Zipper insert(Zipper z, long id, long from, long to, T data) {
      while (true) {
        if (from - z.delta <= z.rightCousinStart) {
          int insertIdx = findInsertionPoint(z.starts, from - z.delta);
          if (isBranch(z)) {
            z.idx = Math.max(0, insertIdx - 1);
            Zipper down = downLeft(z);
            if (down == null) {
              assert isRoot(z);
              Node newRoot = Node.empty(z.editingContext.maxChildren);
              newRoot.add(id, from, to, data);
              z.editingContext.parentsMap = z.editingContext.parentsMap.put(id, (Long)ROOT_ID);
              return replace(z, newRoot, 0);
            }
            z = down;
          }
          else {
            if (z.editingContext.parentsMap.get(id, null) != null) {
              throw new IllegalArgumentException("id is not unique: " + id);
            }
            ensureMutable(z);
            z.starts.add(insertIdx, from - z.delta);
            z.ends.add(insertIdx, to - z.delta);
            z.ids.add(insertIdx, id);
            z.children.add(insertIdx, data);
            Long parentId = z.parent.ids.get(z.parent.idx);
            z.editingContext.parentsMap = z.editingContext.parentsMap.put(id, parentId);
            z.idx = insertIdx <= z.idx ? z.idx + 1 : z.idx;
            return z;
          }
        }
        else {
          z = up(z);
        }
      }
    }
  }

  private static void splitNode(ArrayList<Node> result, Node source, int from, int to, int thresh) {
    int length = to - from;
    if (length <= thresh) {
      result.add(new Node(source.ids.subList(from, to),
                          source.starts.subList(from, to),
                          source.ends.subList(from, to),
                          new ArrayList<>(source.children.subList(from, to))));
    }
    else {
      int half = length / 2;
      splitNode(result, source, from, from + half, thresh);
      splitNode(result, source, from + half, to, thresh);
    }
  }

  static ArrayList<Node> splitNode(Node node, int splitThreshold) {
    ArrayList<Node> result = new ArrayList<>();
    splitNode(result, node, 0, node.children.size(), splitThreshold);
    return result;
  }

  private static boolean childrenNeedSplitting(Node node, int splitThreshold) {
    for (Object child : node.children) {
      if (!(child instanceof Node)) {
        return false;
      }
      if (((Node)child).children.size() > splitThreshold) {
        return true;
      }
    }
    return false;
  }

  private static IntMap<Long> adopt(IntMap<Long> parentsMap, long parentId, LongArrayList childrenIds) {
    Long id = parentId;
    for (int k = 0; k < childrenIds.size(); ++k) {
      parentsMap = parentsMap.put(childrenIds.get(k), id);
    }
    return parentsMap;
  }

  static Node splitChildren(EditingContext ctx, Node node) {
    int splitThreshold = ctx.maxChildren;
    if (!childrenNeedSplitting(node, splitThreshold)) {
      return node;
    }
    Node result = Node.empty(splitThreshold / 2);
    IntMap<Long> m = ctx.parentsMap;
    long nextId = ctx.nextId;
    for (int i = 0; i < node.children.size(); i++) {
      Node child = (Node)node.children.get(i);
      long childDelta = node.starts.get(i);
      long childId = node.ids.get(i);
      Long parentId = m.get(childId, null);
      if (child.children.size() > splitThreshold) {
        ArrayList<Node> partition = splitNode(child, splitThreshold);
        for (int j = 0; j < partition.size(); j++) {
          Node p = partition.get(j);
          long delta = normalize(p);
          result.starts.add(delta + childDelta);
          result.ends.add(p.ends.max() + childDelta + delta);
          result.children.add(p);
          if (j == 0) {
            result.ids.add(childId);
          }
          else {
            long newId = nextId--;
            m = adopt(m, newId, p.ids);
            m = m.put(newId, parentId);
            result.ids.add(newId);
          }
        }
      }
      else {
        result.add(childId, node.starts.get(i), node.ends.get(i), child);
      }
    }
    ctx.nextId = nextId;
    ctx.parentsMap = m;
    return result;
  }

  private static boolean childrenNeedMerging(Node node, int threshold) {
    for (Object child : node.children) {
      if (!(child instanceof Node)) {
        return false;
      }
      if (((Node)child).children.size() < threshold) {
        return true;
      }
    }
    return false;
  }

  static Node mergeNodes(long leftDelta, Node left, long rightDelta, Node right) {
    long delta = rightDelta - leftDelta;
    Node n = Node.empty(left.children.size() + right.children.size());
    for (int i = 0; i < left.children.size(); i++) {
      n.add(left.ids.get(i), left.starts.get(i), left.ends.get(i), left.children.get(i));
    }
    for (int i = 0; i < right.children.size(); i++) {
      n.add(right.ids.get(i), right.starts.get(i) + delta, right.ends.get(i) + delta, right.children.get(i));
    }
    return n;
  }

  static Node mergeChildren(EditingContext ctx, Node node) {
    int splitThreshold = ctx.maxChildren;
    int mergeThreshold = splitThreshold / 2;
    if (!childrenNeedMerging(node, mergeThreshold)) {
      return node;
    }
    Node result = Node.empty(mergeThreshold);
    Node left = (Node)node.children.get(0);
    long leftDelta = node.starts.get(0);
    long leftId = node.ids.get(0);
    long leftEnd = node.ends.get(0);
    for (int i = 1; i < node.children.size(); i++) {
      Node right = (Node)node.children.get(i);
      long rightDelta = node.starts.get(i);
      long rightId = node.ids.get(i);
      long rightEnd = node.ends.get(i);
      if (left.children.size() < mergeThreshold || right.children.size() < mergeThreshold) {
        Node merged = mergeChildren(ctx, mergeNodes(leftDelta, left, rightDelta, right));
        if (merged.children.size() > splitThreshold) {
          ArrayList<Node> split = splitNode(merged, splitThreshold);
          assert split.size() == 2;

          ctx.parentsMap = adopt(ctx.parentsMap, leftId, split.get(0).ids);
          result.add(leftId, leftDelta, leftDelta + split.get(0).ends.max(), split.get(0));

          ctx.parentsMap = adopt(ctx.parentsMap, rightId, split.get(1).ids);
          left = split.get(1);
          leftDelta += normalize(split.get(1));
          leftEnd = leftDelta + split.get(1).ends.max();
          leftId = rightId;
        }
        else {
          ctx.parentsMap = ctx.parentsMap.remove(rightId);
          ctx.parentsMap = adopt(ctx.parentsMap, leftId, right.ids);
          left = merged;
          leftEnd = leftDelta + merged.ends.max();
        }
      }
      else {
        result.add(leftId, leftDelta, leftEnd, left);
        left = right;
        leftDelta = rightDelta;
        leftId = rightId;
        leftEnd = rightEnd;
      }
    }
    result.add(leftId, leftDelta, leftEnd, left);
    return result;
  }

  static Node balanceChildren(EditingContext ctx, Node node) {
    return mergeChildren(ctx, splitChildren(ctx, node));
  }

  static Node growTree(EditingContext ctx, Node node) {
    Node balanced = balanceChildren(ctx, node);
    if (balanced.children.size() <= ctx.maxChildren) {
      return balanced;
    }
    ArrayList<Object> newChildren = new ArrayList<>();
    newChildren.add(balanced);
    long newLevelId = ctx.nextId--;
    ctx.parentsMap = adopt(ctx.parentsMap, newLevelId, balanced.ids);
    ctx.parentsMap = ctx.parentsMap.put(newLevelId, (Long)ROOT_ID);
    Node newRoot = new Node(new LongArrayList(new long[]{newLevelId}),
                            new LongArrayList(new long[]{0}),
                            new LongArrayList(new long[]{balanced.ends.max()}),
                            newChildren);
    return growTree(ctx, newRoot);
  }

  static Node shrinkTree(EditingContext ctx, Node root) {
    if (root.children.size() == 1 && root.children.get(0) instanceof Node) {
      long delta = root.starts.get(0);
      ctx.parentsMap = ctx.parentsMap.remove(root.ids.get(0));
      Node child = ((Node)root.children.get(0)).copy();
      for (int i = 0; i < child.starts.size(); i++) {
        child.starts.set(i, child.starts.get(i) + delta);
        child.ends.set(i, child.ends.get(i) + delta);
      }
      ctx.parentsMap = adopt(ctx.parentsMap, ROOT_ID, child.ids);
      return shrinkTree(ctx, child);
    }
    return root;
  }

  private static long normalize(Node node) {
    if (node.starts.isEmpty()) {
      return 0;
    }
    long delta = node.starts.get(0);
    if (delta != 0) {
      for (int i = 0; i < node.starts.size(); i++) {
        node.starts.set(i, node.starts.get(i) - delta);
        node.ends.set(i, node.ends.get(i) - delta);
      }
    }
    return delta;
  }

  public static final class Batch<T> implements Intervals.Batch<T> {
    private long lastSeenFrom = Long.MIN_VALUE;
    private Zipper zipper;
    private final EditingContext editingContext;

    Batch(Zipper zipper, EditingContext editingContext) {
      this.zipper = zipper;
      this.editingContext = editingContext;
    }

    @Override
    public void add(long id, long from, long to, T data) {
      if (from < lastSeenFrom) {
        throw new IllegalArgumentException("batch is not sorted");
      }
      if (to < from) {
        throw new IllegalArgumentException("interval end " + to + " < start " + from);
      }
      if (id < 0) {
        throw new IllegalArgumentException("id: " + id);
      }
      lastSeenFrom = from;
      zipper = Zipper.insert(zipper, id, from, to, data);
    }

    @Override
    public IntervalsImpl<T> commit() {
      return new IntervalsImpl<>(editingContext.maxChildren,
                                 Zipper.root(zipper),
                                 editingContext.parentsMap.forked(),
                                 editingContext.nextId);
    }
  }

  public static <T> Batch<T> batch(IntervalsImpl<T> tree) {
    EditingContext ctx = new EditingContext(tree.nextInnerId, tree.maxChildren, tree.parentsMap.linear());
    return new Batch<>(Zipper.create(tree.root, ctx), ctx);
  }

  static final class ForwardIterator<T> implements IntervalsIterator<T> {
    private Zipper z;
    private final long queryFrom;
    private final long queryTo;

    ForwardIterator(Zipper z, long queryFrom, long queryTo) {
      this.z = z;
      this.queryFrom = queryFrom;
      this.queryTo = queryTo;
    }

    @Override
    public long from() {
      return Zipper.from(z);
    }

    @Override
    public long to() {
      return Zipper.to(z);
    }

    @Override
    public long id() {
      return z.ids.get(z.idx);
    }

    @Override
    @SuppressWarnings("unchecked")
    public T data() {
      return (T)z.children.get(z.idx);
    }

    @Override
    public boolean next() {
      if (z == null) {
        return false;
      }
      Zipper next = Zipper.isRoot(z) ? z : Zipper.skipRight(z);
      z = next == null ? null : nextIntersection(next, queryFrom, queryTo);
      return z != null;
    }
  }

  /*
   * subtrees are pruned with closed bounds, leaves are matched exactly:
   * [s, e) overlaps [from, to), or contains `from` when the query is empty
   */
  private static boolean mayIntersect(long from, long to, long s, long e) {
    return s <= to && from <= e;
  }

  private static boolean intersects(long from, long to, long s, long e) {
    return from == to
           ? s <= from && from < e
           : s < to && from < e;
  }

  static Zipper nextIntersection(Zipper zipper, long from, long to) {
    boolean branch = Zipper.isBranch(zipper);
    for (int i = zipper.idx; i < zipper.starts.size(); ++i) {
      long s = zipper.starts.get(i) + zipper.delta;
      long e = zipper.ends.get(i) + zipper.delta;
      if (s > to) {
        return null;
      }
      if (branch ? mayIntersect(from, to, s, e) : intersects(from, to, s, e)) {
        zipper.idx = i;
        if (branch) {
          Zipper down = Zipper.downLeft(zipper);
          return down == null ? null : nextIntersection(down, from, to);
        }
        return zipper;
      }
    }
    Zipper up = Zipper.up(zipper);
    if (up == null) {
      return null;
    }
    Zipper skip = Zipper.skipRight(up);
    return skip == null ? null : nextIntersection(skip, from, to);
  }

  public static <T> IntervalsIterator<T> query(IntervalsImpl<T> tree, long from, long to) {
    if (to < from) {
      throw new IllegalArgumentException("query [" + from + ", " + to + ")");
    }
    return new ForwardIterator<>(Zipper.create(tree.root, null), from, to);
  }

  static Node expand(Node node, long offset, long len) {
    Node result = Node.empty(node.children.size());
    for (int i = 0; i < node.children.size(); i++) {
      long id = node.ids.get(i);
      long start = node.starts.get(i);
      long end = node.ends.get(i);
      Object child = node.children.get(i);
      if (offset <= start) {
        //......(interval)....
        //....o...............
        result.add(id, start + len, end + len, child);
      }
      else if (offset <= end) {
        //....(interval)....
        //........o.........
        Object c = child instanceof Node
                   ? expand((Node)child, offset - start, len)
                   : child;
        result.add(id, start, end + len, c);
      }
      else {
        //....(interval)....
        //...............o....
        result.add(id, start, end, child);
      }
    }
    return result;
  }

  public static <T> IntervalsImpl<T> expand(IntervalsImpl<T> tree, long offset, long len) {
    if (len == 0) {
      return tree;
    }
    return new IntervalsImpl<>(tree.maxChildren, expand(tree.root, offset, len), tree.parentsMap, tree.nextInnerId);
  }

  private static IntMap<Long> extinct(IntMap<Long> parentsMap, long id, Object child) {
    parentsMap = parentsMap.remove(id);
    if (child instanceof Node) {
      Node node = (Node)child;
      for (int i = 0; i < node.ids.size(); ++i) {
        parentsMap = extinct(parentsMap, node.ids.get(i), node.children.get(i));
      }
    }
    return parentsMap;
  }

  static Node collapse(EditingContext ctx, Node node, long offset, long len) {
    Node result = Node.empty(node.children.size());
    for (int i = 0; i < node.children.size(); i++) {
      long start = node.starts.get(i);
      long end = node.ends.get(i);
      Object child = node.children.get(i);
      long id = node.ids.get(i);
      if (end <= offset) {
        // (interval)..............
        // ..........[deletion]
        result.add(id, start, end, child);
      }
      else if (offset + len <= start) {
        //.............(interval)....
        //....[deletion].............
        result.add(id, start - len, end - len, child);
      }
      else if (offset <= start && end <= offset + len) {
        //........(interval)........
        //....[....deletion....]....
        ctx.parentsMap = extinct(ctx.parentsMap, id, child);
      }
      else if (child instanceof Node) {
        Node c = collapse(ctx, (Node)child, offset - start, len);
        if (c.children.isEmpty()) {
          ctx.parentsMap = ctx.parentsMap.remove(id);
        }
        else {
          long delta = normalize(c);
          long newStart = start + delta;
          result.add(id, newStart, newStart + c.ends.max(), c);
        }
      }
      else {
        //....(....interval....)....
        //......[deletion]..........
        long newStart = Math.min(start, offset);
        long newEnd = Math.max(offset, end - len);
        if (newEnd <= newStart) {
          ctx.parentsMap = extinct(ctx.parentsMap, id, child);
        }
        else {
          result.add(id, newStart, newEnd, child);
        }
      }
    }
    return balanceChildren(ctx, result);
  }

  public static <T> IntervalsImpl<T> collapse(IntervalsImpl<T> tree, long offset, long len) {
    if (len == 0) {
      return tree;
    }
    EditingContext ctx = new EditingContext(tree.nextInnerId, tree.maxChildren, tree.parentsMap.linear());
    Node root = shrinkTree(ctx, growTree(ctx, collapse(ctx, tree.root, offset, len)));
    return new IntervalsImpl<>(tree.maxChildren, root, ctx.parentsMap.forked(), ctx.nextId);
  }

  private static Node remove(EditingContext ctx, Node node, long nodeId, HashMap<Long, HashSet<Long>> subtree) {
    HashSet<Long> victims = subtree.get(nodeId);
    if (victims == null) {
      return node;
    }
    Node copy = node.copy();
    for (Long vid : victims) {
      int vidx = copy.ids.indexOf(vid);
      Object victim = copy.children.get(vidx);
      if (victim instanceof Node) {
        Node newNode = remove(ctx, (Node)victim, vid, subtree);
        if (newNode.children.isEmpty()) {
          copy.removeAt(vidx);
          ctx.parentsMap = ctx.parentsMap.remove(vid);
        }
        else {
          long delta = normalize(newNode);
          long start = copy.starts.get(vidx) + delta;
          copy.children.set(vidx, newNode);
          copy.starts.set(vidx, start);
          copy.ends.set(vidx, newNode.ends.max() + start);
        }
      }
      else {
        copy.removeAt(vidx);
        ctx.parentsMap = ctx.parentsMap.remove(vid);
      }
    }
    return balanceChildren(ctx, copy);
  }

  public static <T> IntervalsImpl<T> remove(IntervalsImpl<T> tree, Iterable<Long> ids) {
    HashMap<Long, HashSet<Long>> deletionSubtree = deletionSubtree(tree.parentsMap, ids);
    if (deletionSubtree.isEmpty()) {
      return tree;
    }
    EditingContext ctx = new EditingContext(tree.nextInnerId, tree.maxChildren, tree.parentsMap.linear());
    Node root = shrinkTree(ctx, remove(ctx, tree.root, ROOT_ID, deletionSubtree));
    return new IntervalsImpl<>(tree.maxChildren, root, ctx.parentsMap.forked(), ctx.nextId);
  }

  private static HashMap<Long, HashSet<Long>> deletionSubtree(IntMap<Long> parents, Iterable<Long> toBeDeleted) {
    HashMap<Long, HashSet<Long>> subtree = new HashMap<>();
    for (Long id : toBeDeleted) {
      if (id < 0) {
        throw new IllegalArgumentException("id: " + id);
      }
      long cid = id;
      if (parents.get(cid, null) == null) {
        continue;
      }
      while (cid != ROOT_ID) {
        Long pid = parents.get(cid, null);
        if (pid == null) {
          throw new NoSuchElementException("id: " + cid);
        }
        subtree.computeIfAbsent(pid, k -> new HashSet<>()).add(cid);
        cid = pid;
      }
    }
    return subtree;
  }
}

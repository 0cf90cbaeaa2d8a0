package scribe.impl.text;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;

/**
 * Persistent B-tree over leaf data with monoid metrics cached per child.
 * Navigation happens through {@link Zipper}s; edits made through a zipper produce a new tree on {@link #root(Zipper)}
 * sharing every untouched node with the old one.
 */
@SuppressWarnings("unchecked")
public final class Rope {

  private Rope() {
  }

  public static final class Tree<Metrics, Data> {
    public final Node<Metrics> root;
    public final Metrics metrics;
    public final ZipperOps<Metrics, Data> ops;

    public Tree(Node<Metrics> root, Metrics metrics, ZipperOps<Metrics, Data> ops) {
      this.root = root;
      this.metrics = metrics;
      this.ops = ops;
    }
  }

  public static final class Node<Metrics> {
    public final ArrayList<Object> children;
    public final ArrayList<Metrics> metrics;

    public Node(ArrayList<Object> children, ArrayList<Metrics> childrenMetrics) {
      this.children = children;
      this.metrics = childrenMetrics;
    }
  }

  public interface ZipperOps<Metrics, Data> {

    Metrics calculateMetrics(Data data);

    Metrics emptyMetrics();

    int splitThreshold();

    Metrics rf(Metrics m1, Metrics m2);

    default Metrics rf(List<Metrics> metrics) {
      Metrics r = emptyMetrics();
      for (Metrics m : metrics) {
        r = rf(r, m);
      }
      return r;
    }

    boolean isLeafOverflown(Data leafData);

    boolean isLeafUnderflown(Data leafData);

    Data mergeLeaves(Data leafData1, Data leafData2);

    List<Data> splitLeaf(Data leaf);
  }

  public static final class Zipper<Metrics, Data> {
    ZipperOps<Metrics, Data> ops;
    Zipper<Metrics, Data> parent;
    ArrayList<Object> siblings;
    ArrayList<Metrics> metrics;
    int idx = 0;

    // metrics of everything to the left of the current node
    Metrics acc;
    // metrics up to a position inside the current leaf, set by offset scans
    Metrics oacc;

    boolean isChanged = false;
    boolean isTransient = false;

    Zipper() {
    }

    Zipper<Metrics, Data> copy() {
      Zipper<Metrics, Data> that = new Zipper<>();
      that.ops = ops;
      that.parent = parent;
      that.siblings = siblings;
      that.metrics = metrics;
      that.idx = idx;
      that.acc = acc;
      that.oacc = oacc;
      that.isChanged = isChanged;
      that.isTransient = isTransient;
      return that;
    }

    public static <Metrics, Data> Zipper<Metrics, Data> zipper(Tree<Metrics, Data> tree) {
      Zipper<Metrics, Data> z = new Zipper<>();
      z.parent = null;
      z.ops = tree.ops;
      z.idx = 0;
      z.siblings = singletonList(tree.root);
      z.metrics = singletonList(tree.metrics);
      z.acc = tree.ops.emptyMetrics();
      z.oacc = null;
      return z;
    }
  }

  public static <T> ArrayList<T> singletonList(T object) {
    ArrayList<T> l = new ArrayList<>(1);
    l.add(object);
    return l;
  }

  public static <Metrics, Data> Node<Metrics> node(Zipper<Metrics, Data> loc) {
    return (Node<Metrics>)loc.siblings.get(loc.idx);
  }

  public static <Metrics, Data> Data data(Zipper<Metrics, Data> loc) {
    return (Data)loc.siblings.get(loc.idx);
  }

  public static <Metrics, Data> Metrics currentAcc(Zipper<Metrics, Data> loc) {
    if (loc.oacc != null) {
      return loc.oacc;
    }
    if (loc.acc != null) {
      return loc.acc;
    }
    return loc.ops.emptyMetrics();
  }

  public static <Metrics, Data> Metrics nodeAcc(Zipper<Metrics, Data> loc) {
    return loc.acc == null ? loc.ops.emptyMetrics() : loc.acc;
  }

  public static boolean isBranch(Zipper<?, ?> loc) {
    return loc.siblings.get(loc.idx) instanceof Node;
  }

  public static boolean isLeaf(Zipper<?, ?> loc) {
    return !isBranch(loc);
  }

  public static boolean isRoot(Zipper<?, ?> loc) {
    return loc.parent == null;
  }

  public static boolean isEmptyRoot(Zipper<?, ?> loc) {
    return isRoot(loc) && ((Node<?>)loc.siblings.get(loc.idx)).children.isEmpty();
  }

  public static <Metrics, Data> Metrics metrics(Zipper<Metrics, Data> zipper) {
    return zipper.metrics.get(zipper.idx);
  }

  public static boolean isRightmost(Zipper<?, ?> location) {
    return location.idx == location.siblings.size() - 1 && (location.parent == null || isRightmost(location.parent));
  }

  private static ArrayList<Object> getChildren(Object node) {
    return ((Node<?>)node).children;
  }

  static <Metrics, Data> boolean splitNeeded(ArrayList<Object> children, ZipperOps<Metrics, Data> ops) {
    if (children.get(0) instanceof Node) {
      for (Object child : children) {
        if (getChildren(child).size() > ops.splitThreshold()) {
          return true;
        }
      }
    }
    else {
      for (Object child : children) {
        if (ops.isLeafOverflown((Data)child)) {
          return true;
        }
      }
    }
    return false;
  }

  private static <Metrics> void splitNode(ArrayList<Node<Metrics>> result, Node<Metrics> source, int from, int to, int thresh) {
    int length = to - from;
    if (length <= thresh) {
      result.add(new Node<>(new ArrayList<>(source.children.subList(from, to)),
                            new ArrayList<>(source.metrics.subList(from, to))));
    }
    else {
      int half = length / 2;
      splitNode(result, source, from, from + half, thresh);
      splitNode(result, source, from + half, to, thresh);
    }
  }

  /*
   * every child of the result is at most splitThreshold wide, the node itself may overflow
   */
  static <Metrics, Data> Node<Metrics> splitChildren(Node<Metrics> node, ZipperOps<Metrics, Data> ops) {
    ArrayList<Object> children = node.children;
    if (!splitNeeded(children, ops)) {
      return node;
    }
    ArrayList<Object> newChildren = new ArrayList<>(children.size());
    ArrayList<Metrics> newMetrics = new ArrayList<>(children.size());
    if (children.get(0) instanceof Node) {
      for (int i = 0; i < children.size(); i++) {
        Node<Metrics> child = (Node<Metrics>)children.get(i);
        if (child.children.size() > ops.splitThreshold()) {
          ArrayList<Node<Metrics>> partition = new ArrayList<>();
          splitNode(partition, child, 0, child.children.size(), ops.splitThreshold());
          for (Node<Metrics> part : partition) {
            newChildren.add(part);
            newMetrics.add(ops.rf(part.metrics));
          }
        }
        else {
          newChildren.add(child);
          newMetrics.add(node.metrics.get(i));
        }
      }
    }
    else {
      for (int i = 0; i < children.size(); i++) {
        Data child = (Data)children.get(i);
        if (ops.isLeafOverflown(child)) {
          for (Data part : ops.splitLeaf(child)) {
            newChildren.add(part);
            newMetrics.add(ops.calculateMetrics(part));
          }
        }
        else {
          newChildren.add(child);
          newMetrics.add(node.metrics.get(i));
        }
      }
    }
    return new Node<>(newChildren, newMetrics);
  }

  static <Metrics, Data> boolean mergeNeeded(ArrayList<Object> children, ZipperOps<Metrics, Data> ops) {
    int mergeThreshold = ops.splitThreshold() / 2;
    if (children.get(0) instanceof Node) {
      for (Object child : children) {
        if (getChildren(child).size() < mergeThreshold) {
          return true;
        }
      }
    }
    else {
      for (Object child : children) {
        if (ops.isLeafUnderflown((Data)child)) {
          return true;
        }
      }
    }
    return false;
  }

  static <Metrics, Data> Node<Metrics> mergeChildren(Node<Metrics> node, ZipperOps<Metrics, Data> ops) {
    if (!mergeNeeded(node.children, ops)) {
      return node;
    }
    int splitThreshold = ops.splitThreshold();
    int mergeThreshold = splitThreshold / 2;
    ArrayList<Object> newChildren = new ArrayList<>(mergeThreshold);
    ArrayList<Metrics> newMetrics = new ArrayList<>(mergeThreshold);
    if (node.children.get(0) instanceof Node) {
      Node<Metrics> left = (Node<Metrics>)node.children.get(0);
      Metrics leftMetrics = node.metrics.get(0);
      for (int i = 1; i < node.children.size(); i++) {
        Node<Metrics> right = (Node<Metrics>)node.children.get(i);
        Metrics rightMetrics = node.metrics.get(i);
        if (left.children.size() < mergeThreshold || right.children.size() < mergeThreshold) {
          int n = left.children.size() + right.children.size();
          if (n > splitThreshold) {
            // redistribute the two nodes evenly
            int half = n / 2;
            int leftCut = Math.min(half, left.children.size());
            int rightCut = Math.max(0, half - left.children.size());

            ArrayList<Object> newLeft = new ArrayList<>(half);
            ArrayList<Metrics> newLeftMetrics = new ArrayList<>(half);
            newLeft.addAll(left.children.subList(0, leftCut));
            newLeft.addAll(right.children.subList(0, rightCut));
            newLeftMetrics.addAll(left.metrics.subList(0, leftCut));
            newLeftMetrics.addAll(right.metrics.subList(0, rightCut));

            ArrayList<Object> newRight = new ArrayList<>(n - half);
            ArrayList<Metrics> newRightMetrics = new ArrayList<>(n - half);
            newRight.addAll(left.children.subList(leftCut, left.children.size()));
            newRight.addAll(right.children.subList(rightCut, right.children.size()));
            newRightMetrics.addAll(left.metrics.subList(leftCut, left.children.size()));
            newRightMetrics.addAll(right.metrics.subList(rightCut, right.children.size()));

            Node<Metrics> mergedLeft = mergeChildren(new Node<>(newLeft, newLeftMetrics), ops);
            newChildren.add(mergedLeft);
            newMetrics.add(ops.rf(mergedLeft.metrics));

            left = new Node<>(newRight, newRightMetrics);
            leftMetrics = ops.rf(newRightMetrics);
          }
          else {
            left = mergeChildren(new Node<>(join(left.children, right.children), join(left.metrics, right.metrics)), ops);
            leftMetrics = ops.rf(left.metrics);
          }
        }
        else {
          newChildren.add(left);
          newMetrics.add(leftMetrics);
          left = right;
          leftMetrics = rightMetrics;
        }
      }
      newChildren.add(left);
      newMetrics.add(leftMetrics);
    }
    else {
      Data leftData = (Data)node.children.get(0);
      Metrics leftMetrics = node.metrics.get(0);
      for (int i = 1; i < node.children.size(); i++) {
        Data rightData = (Data)node.children.get(i);
        Metrics rightMetrics = node.metrics.get(i);
        if (ops.isLeafUnderflown(leftData) || ops.isLeafUnderflown(rightData)) {
          Data merged = ops.mergeLeaves(leftData, rightData);
          if (ops.isLeafOverflown(merged)) {
            List<Data> split = ops.splitLeaf(merged);
            for (int j = 0; j < split.size() - 1; j++) {
              newChildren.add(split.get(j));
              newMetrics.add(ops.calculateMetrics(split.get(j)));
            }
            leftData = split.get(split.size() - 1);
            leftMetrics = ops.calculateMetrics(leftData);
          }
          else {
            leftData = merged;
            leftMetrics = ops.calculateMetrics(merged);
          }
        }
        else {
          newChildren.add(leftData);
          newMetrics.add(leftMetrics);
          leftData = rightData;
          leftMetrics = rightMetrics;
        }
      }
      newChildren.add(leftData);
      newMetrics.add(leftMetrics);
    }
    return new Node<>(newChildren, newMetrics);
  }

  static <T> ArrayList<T> join(ArrayList<T> left, ArrayList<T> right) {
    ArrayList<T> tmp = new ArrayList<>(left.size() + right.size());
    tmp.addAll(left);
    tmp.addAll(right);
    return tmp;
  }

  static <Metrics, Data> Node<Metrics> balanceChildren(Node<Metrics> node, ZipperOps<Metrics, Data> ops) {
    if (node.children.isEmpty()) {
      return node;
    }
    return mergeChildren(splitChildren(node, ops), ops);
  }

  public static <Metrics, Data> Node<Metrics> growTree(Node<Metrics> node, ZipperOps<Metrics, Data> ops) {
    Node<Metrics> balanced = balanceChildren(node, ops);
    if (balanced.children.size() > ops.splitThreshold()) {
      return growTree(new Node<>(singletonList(balanced), singletonList(ops.rf(balanced.metrics))), ops);
    }
    return balanced;
  }

  static <Metrics> Node<Metrics> shrinkTree(Node<Metrics> node) {
    ArrayList<Object> children = node.children;
    if (children.size() == 1 && children.get(0) instanceof Node) {
      return shrinkTree((Node<Metrics>)children.get(0));
    }
    return node;
  }

  static boolean isChildrenMutable(Zipper<?, ?> loc) {
    return loc.isTransient && loc.isChanged;
  }

  public static <Metrics, Data> Zipper<Metrics, Data> toTransient(Zipper<Metrics, Data> zipper) {
    if (zipper.isTransient) {
      return zipper;
    }
    Zipper<Metrics, Data> copy = zipper.copy();
    copy.isTransient = true;
    return copy;
  }

  public static <Metrics, Data> Zipper<Metrics, Data> toPersistent(Zipper<Metrics, Data> zipper) {
    Zipper<Metrics, Data> z = zipper;
    while (z != null && z.isTransient) {
      z.isTransient = false;
      z = z.parent;
    }
    return zipper;
  }

  public static <Metrics, Data> Zipper<Metrics, Data> replace(Zipper<Metrics, Data> zipper, Object node, Metrics nodeMetrics) {
    boolean mutable = isChildrenMutable(zipper);
    ArrayList<Object> siblings = mutable ? zipper.siblings : new ArrayList<>(zipper.siblings);
    ArrayList<Metrics> metrics = mutable ? zipper.metrics : new ArrayList<>(zipper.metrics);
    siblings.set(zipper.idx, node);
    metrics.set(zipper.idx, nodeMetrics);

    Zipper<Metrics, Data> result = zipper.isTransient ? zipper : zipper.copy();
    result.isChanged = true;
    result.siblings = siblings;
    result.metrics = metrics;
    return result;
  }

  public static <Metrics, Data> Zipper<Metrics, Data> up(Zipper<Metrics, Data> loc) {
    if (loc.isChanged) {
      if (loc.parent == null) {
        Zipper<Metrics, Data> result = loc.isTransient ? loc : loc.copy();
        result.idx = 0;
        result.acc = null;
        result.oacc = null;
        // unchanged root stops the recursion in root()
        result.isChanged = false;
        Node<Metrics> node = shrinkTree(growTree(node(loc), loc.ops));
        result.siblings = singletonList(node);
        result.metrics = singletonList(loc.ops.rf(node.metrics));
        return result;
      }
      Node<Metrics> balanced = balanceChildren(new Node<>(loc.siblings, loc.metrics), loc.ops);
      return replace(loc.parent, balanced, loc.ops.rf(balanced.metrics));
    }
    if (loc.parent != null && loc.isTransient && !loc.parent.isTransient) {
      return toTransient(loc.parent);
    }
    return loc.parent;
  }

  /*
   * moves to the next sibling adding metrics of the current node to the accumulator,
   * null if the current node is the last child
   */
  public static <Metrics, Data> Zipper<Metrics, Data> right(Zipper<Metrics, Data> zipper) {
    if (zipper.idx < zipper.siblings.size() - 1) {
      Zipper<Metrics, Data> result = zipper.isTransient ? zipper : zipper.copy();
      result.acc = zipper.acc == null
                   ? zipper.metrics.get(zipper.idx)
                   : zipper.ops.rf(zipper.acc, zipper.metrics.get(zipper.idx));
      result.idx = zipper.idx + 1;
      result.oacc = null;
      return result;
    }
    return null;
  }

  /*
   * first child of the current node, null for leaves and empty nodes
   */
  public static <Metrics, Data> Zipper<Metrics, Data> downLeft(Zipper<Metrics, Data> zipper) {
    if (!isBranch(zipper)) {
      return null;
    }
    Node<Metrics> n = node(zipper);
    if (n.children.isEmpty()) {
      return null;
    }
    Zipper<Metrics, Data> result = new Zipper<>();
    result.ops = zipper.ops;
    result.siblings = n.children;
    result.metrics = n.metrics;
    result.acc = zipper.acc;
    result.oacc = null;
    result.idx = 0;
    result.parent = zipper;
    result.isTransient = zipper.isTransient;
    return result;
  }

  /*
   * last child of the current node, drops the accumulated position
   */
  static <Metrics, Data> Zipper<Metrics, Data> downRight(Zipper<Metrics, Data> zipper) {
    if (!isBranch(zipper)) {
      return null;
    }
    Node<Metrics> n = node(zipper);
    if (n.children.isEmpty()) {
      return null;
    }
    Zipper<Metrics, Data> result = new Zipper<>();
    result.ops = zipper.ops;
    result.siblings = n.children;
    result.metrics = n.metrics;
    result.idx = n.children.size() - 1;
    result.acc = null;
    result.oacc = null;
    result.parent = zipper;
    result.isTransient = zipper.isTransient;
    return result;
  }

  public static <Metrics, Data> Tree<Metrics, Data> root(Zipper<Metrics, Data> loc) {
    Zipper<Metrics, Data> z = loc;
    while (true) {
      Zipper<Metrics, Data> parent = up(z);
      if (parent == null) {
        return new Tree<>(node(z), metrics(z), z.ops);
      }
      z = parent;
    }
  }

  public static boolean hasNext(Zipper<?, ?> loc) {
    if (loc.parent == null && !((Node<?>)loc.siblings.get(loc.idx)).children.isEmpty()) {
      return true;
    }
    return !(isLeaf(loc) && isRightmost(loc));
  }

  public static <Metrics, Data> Zipper<Metrics, Data> next(Zipper<Metrics, Data> zipper) {
    if (isBranch(zipper)) {
      return downLeft(zipper);
    }
    return skip(zipper);
  }

  /*
   * next sibling or cousin without descending into the current node
   */
  public static <Metrics, Data> Zipper<Metrics, Data> skip(Zipper<Metrics, Data> zipper) {
    if (isRightmost(zipper)) {
      throw new NoSuchElementException();
    }
    boolean isTransient = zipper.isTransient;
    Zipper<Metrics, Data> p = toTransient(zipper);
    while (true) {
      Zipper<Metrics, Data> r = right(p);
      if (r != null) {
        return isTransient ? r : toPersistent(r);
      }
      p = up(p);
    }
  }

  public static <Metrics, Data> Zipper<Metrics, Data> nextLeaf(Zipper<Metrics, Data> zipper) {
    boolean isTransient = zipper.isTransient;
    Zipper<Metrics, Data> z = toTransient(zipper);
    do {
      z = next(z);
    }
    while (isBranch(z));
    return isTransient ? z : toPersistent(z);
  }

  /*
   * stops in a leaf, or in the root if the tree is empty; null if no node satisfies pred
   */
  public static <Metrics, Data> Zipper<Metrics, Data> scan(Zipper<Metrics, Data> zipper, BiFunction<Metrics, Metrics, Boolean> pred) {
    if (isEmptyRoot(zipper)) {
      return zipper;
    }
    if (isLeaf(zipper) && pred.apply(nodeAcc(zipper), zipper.metrics.get(zipper.idx))) {
      return zipper;
    }

    boolean isTransient = zipper.isTransient;
    Zipper<Metrics, Data> z = toTransient(zipper);
    while (true) {
      Zipper<Metrics, Data> found = null;
      Metrics acc = nodeAcc(z);
      for (int i = z.idx; i < z.siblings.size(); ++i) {
        if (pred.apply(acc, z.metrics.get(i))) {
          z.idx = i;
          z.acc = acc;
          z.oacc = null;
          found = z;
          break;
        }
        acc = z.ops.rf(acc, z.metrics.get(i));
      }

      if (found == null) {
        if (isRightmost(z)) {
          return null;
        }
        z = skip(z);
      }
      else if (isBranch(found)) {
        z = downLeft(found);
      }
      else {
        return isTransient ? found : toPersistent(found);
      }
    }
  }

  private static <Metrics, Data> Metrics accumulateTillIdx(Zipper<Metrics, Data> zipper, int idx) {
    Metrics acc = nodeAcc(zipper.parent);
    for (int i = 0; i < idx; i++) {
      acc = zipper.ops.rf(acc, zipper.metrics.get(i));
    }
    return acc;
  }

  /*
   * removes the current node keeping the accumulated position
   *
   * the result points to the right sibling of the removed node, or to the next node if it was the last child;
   * with nothing to the right it stays at the end of the nearest leaf on the left.
   * parents left without children are removed recursively
   */
  public static <Metrics, Data> Zipper<Metrics, Data> remove(Zipper<Metrics, Data> zipper) {
    while (zipper.siblings.size() == 1) {
      if (isRoot(zipper)) {
        return replace(zipper, new Node<>(new ArrayList<>(), new ArrayList<>()), zipper.ops.emptyMetrics());
      }
      zipper = up(zipper);
    }

    boolean mutable = isChildrenMutable(zipper);
    ArrayList<Object> newSiblings = mutable ? zipper.siblings : new ArrayList<>(zipper.siblings);
    ArrayList<Metrics> newMetrics = mutable ? zipper.metrics : new ArrayList<>(zipper.metrics);
    newMetrics.remove(zipper.idx);
    newSiblings.remove(zipper.idx);

    boolean isTransient = zipper.isTransient;
    Metrics initialAcc = zipper.acc;
    int initialIdx = zipper.idx;
    Zipper<Metrics, Data> result = isTransient ? zipper : zipper.copy();
    result.siblings = newSiblings;
    result.metrics = newMetrics;
    result.isChanged = true;

    if (initialIdx < newSiblings.size()) {
      result.idx = initialIdx;
      result.oacc = null;
      return result;
    }

    result.isTransient = true;
    result.idx = initialIdx - 1;
    if (isRightmost(result)) {
      result.acc = accumulateTillIdx(result, result.idx);
      while (isBranch(result)) {
        result = downRight(result);
        assert result != null;
        result.acc = accumulateTillIdx(result, result.idx);
      }
      result.oacc = initialAcc;
      return isTransient ? result : toPersistent(result);
    }
    Zipper<Metrics, Data> s = skip(result);
    return isTransient ? s : toPersistent(s);
  }
}

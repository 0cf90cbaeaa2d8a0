package scribe.undo;

import java.util.Collections;
import java.util.List;

/**
 * One step of the replay log: a group of ops as they were applied, or an undo or redo of the history.
 * Applied in order to an editor that started from the same state, the log brings it to the same text and styles.
 */
public final class ReplayEntry {

  public enum Kind {
    OPS, UNDO, REDO
  }

  public static final ReplayEntry UNDO = new ReplayEntry(Kind.UNDO, Collections.emptyList());
  public static final ReplayEntry REDO = new ReplayEntry(Kind.REDO, Collections.emptyList());

  public final Kind kind;
  /** empty unless the kind is {@link Kind#OPS} */
  public final List<UndoOp> ops;

  private ReplayEntry(Kind kind, List<UndoOp> ops) {
    this.kind = kind;
    this.ops = ops;
  }

  public static ReplayEntry ops(List<UndoOp> ops) {
    if (ops.isEmpty()) {
      throw new IllegalArgumentException("empty replay entry");
    }
    return new ReplayEntry(Kind.OPS, Collections.unmodifiableList(ops));
  }

  @Override
  public String toString() {
    return kind == Kind.OPS ? "Replay" + ops : "Replay{" + kind + "}";
  }
}

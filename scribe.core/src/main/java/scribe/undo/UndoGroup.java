package scribe.undo;

import scribe.carets.Caret;

import java.util.Collections;
import java.util.List;

/**
 * Ops undone and redone together, in recording order. Never empty.
 */
public final class UndoGroup {
  public final List<UndoOp> ops;

  public UndoGroup(List<UndoOp> ops) {
    if (ops.isEmpty()) {
      throw new IllegalArgumentException("empty undo group");
    }
    this.ops = Collections.unmodifiableList(ops);
  }

  public Caret before() {
    return ops.get(0).before;
  }

  public Caret after() {
    return ops.get(ops.size() - 1).after;
  }

  /**
   * Reverts the ops last to first. If one of them fails the ones already reverted are replayed again, so the
   * target is left as it was.
   */
  public void revert(UndoTarget target) {
    int i = ops.size() - 1;
    try {
      for (; i >= 0; i--) {
        ops.get(i).revert(target);
      }
    }
    catch (RuntimeException e) {
      try {
        for (int j = i + 1; j < ops.size(); j++) {
          ops.get(j).replay(target);
        }
      }
      catch (RuntimeException rollback) {
        e.addSuppressed(rollback);
      }
      throw e;
    }
  }

  /**
   * Replays the ops first to last, reverting the replayed ones if one of them fails.
   */
  public void replay(UndoTarget target) {
    int i = 0;
    try {
      for (; i < ops.size(); i++) {
        ops.get(i).replay(target);
      }
    }
    catch (RuntimeException e) {
      try {
        for (int j = i - 1; j >= 0; j--) {
          ops.get(j).revert(target);
        }
      }
      catch (RuntimeException rollback) {
        e.addSuppressed(rollback);
      }
      throw e;
    }
  }

  public int size() {
    return ops.size();
  }

  @Override
  public String toString() {
    return "UndoGroup" + ops;
  }
}

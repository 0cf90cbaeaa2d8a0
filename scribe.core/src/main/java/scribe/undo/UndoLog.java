package scribe.undo;

import io.lacuna.bifurcan.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Optional;

public final class UndoLog implements UndoBuffer {

  private static final Logger LOG = LogManager.getLogger(UndoLog.class);

  private List<UndoGroup> undoStack = new List<>();
  private List<UndoGroup> redoStack = new List<>();
  private final ArrayList<UndoOp> pending = new ArrayList<>();
  @Nullable private ArrayList<ReplayEntry> replayLog;
  private final ArrayList<UndoOp> pendingReplay = new ArrayList<>();
  private int depth = 0;
  private int limit;

  public UndoLog(int limit) {
    setLimit(limit);
  }

  @Override
  public void beginGroup() {
    depth++;
  }

  @Override
  public void endGroup() {
    if (depth == 0) {
      throw new IllegalStateException("no undo group to end");
    }
    depth--;
    if (depth == 0) {
      flush();
    }
  }

  @Override
  public boolean isGrouping() {
    return depth > 0;
  }

  @Override
  public void record(UndoOp op) {
    record(op, true);
  }

  @Override
  public void recordReplayed(UndoOp op) {
    record(op, false);
  }

  private void record(UndoOp op, boolean logged) {
    if (redoStack.size() > 0) {
      LOG.trace("redo history dropped: {} groups", redoStack.size());
      redoStack = new List<>();
    }
    pending.add(op);
    if (logged && replayLog != null) {
      pendingReplay.add(op);
    }
    if (depth == 0) {
      flush();
    }
  }

  @Override
  public void recordReplayOnly(UndoOp op) {
    if (replayLog == null) {
      return;
    }
    pendingReplay.add(op);
    if (depth == 0) {
      flush();
    }
  }

  private void flush() {
    if (!pendingReplay.isEmpty()) {
      if (replayLog != null) {
        replayLog.add(ReplayEntry.ops(new ArrayList<>(pendingReplay)));
      }
      pendingReplay.clear();
    }
    if (pending.isEmpty()) {
      return;
    }
    push(new UndoGroup(new ArrayList<>(pending)));
    pending.clear();
  }

  private void push(UndoGroup group) {
    undoStack = undoStack.addLast(group);
    evict();
  }

  private void evict() {
    while (undoStack.size() > limit) {
      LOG.debug("undo limit {} reached, oldest group evicted", limit);
      undoStack = undoStack.removeFirst();
    }
  }

  @Override
  public Optional<UndoGroup> undo(UndoTarget target) {
    Optional<UndoGroup> group = undoReplayed(target);
    if (group.isPresent() && replayLog != null) {
      replayLog.add(ReplayEntry.UNDO);
    }
    return group;
  }

  @Override
  public Optional<UndoGroup> undoReplayed(UndoTarget target) {
    if (depth > 0) {
      LOG.debug("undo while grouping, open group closed");
      depth = 0;
      flush();
    }
    if (undoStack.size() == 0) {
      return Optional.empty();
    }
    UndoGroup group = undoStack.last();
    LOG.debug("undo {} ops", group.size());
    group.revert(target);
    undoStack = undoStack.removeLast();
    redoStack = redoStack.addLast(group);
    LOG.trace("undo {}", group);
    return Optional.of(group);
  }

  @Override
  public Optional<UndoGroup> redo(UndoTarget target) {
    Optional<UndoGroup> group = redoReplayed(target);
    if (group.isPresent() && replayLog != null) {
      replayLog.add(ReplayEntry.REDO);
    }
    return group;
  }

  @Override
  public Optional<UndoGroup> redoReplayed(UndoTarget target) {
    if (redoStack.size() == 0) {
      return Optional.empty();
    }
    UndoGroup group = redoStack.last();
    LOG.debug("redo {} ops", group.size());
    group.replay(target);
    redoStack = redoStack.removeLast();
    undoStack = undoStack.addLast(group);
    evict();
    LOG.trace("redo {}", group);
    return Optional.of(group);
  }

  @Override
  public int remainingUndo() {
    return (int)undoStack.size();
  }

  @Override
  public int remainingRedo() {
    return (int)redoStack.size();
  }

  @Override
  public void clear() {
    undoStack = new List<>();
    redoStack = new List<>();
    pending.clear();
    depth = 0;
    // ops of an open group are applied already, a replaying editor still needs them
    if (replayLog != null && !pendingReplay.isEmpty()) {
      replayLog.add(ReplayEntry.ops(new ArrayList<>(pendingReplay)));
    }
    pendingReplay.clear();
  }

  @Override
  public int limit() {
    return limit;
  }

  @Override
  public void setLimit(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("undo limit: " + limit);
    }
    this.limit = limit;
    evict();
  }

  @Override
  public void enableReplayLog(boolean enable) {
    if (enable == (replayLog != null)) {
      return;
    }
    replayLog = enable ? new ArrayList<>() : null;
    pendingReplay.clear();
  }

  @Override
  public boolean isReplayLogEnabled() {
    return replayLog != null;
  }

  @Override
  public java.util.List<ReplayEntry> recentReplayLog() {
    if (replayLog == null) {
      return Collections.emptyList();
    }
    java.util.List<ReplayEntry> recent = new ArrayList<>(replayLog);
    replayLog.clear();
    return recent;
  }

  @Override
  public String toString() {
    return "UndoLog{undo=" + undoStack.size() + ", redo=" + redoStack.size() + ", depth=" + depth + '}';
  }
}

package scribe.undo;

import java.util.List;
import java.util.Optional;

/**
 * Undo and redo history made of groups of ops.
 * <p>
 * {@link #beginGroup()} and {@link #endGroup()} nest, the outermost pair delimits one group. An op recorded outside
 * of a group forms a group on its own. Recording clears the redo history.
 * <p>
 * With the replay log on, every group, undo and redo is also logged as a {@link ReplayEntry}, so another editor
 * started from the same state can follow the changes.
 */
public interface UndoBuffer {

  void beginGroup();

  /**
   * @throws IllegalStateException if no group is open
   */
  void endGroup();

  boolean isGrouping();

  void record(UndoOp op);

  /**
   * Logs the op for replay without making it undoable.
   */
  void recordReplayOnly(UndoOp op);

  /**
   * Adds an op received from another editor's replay log to the history, without logging it again.
   */
  void recordReplayed(UndoOp op);

  /**
   * Reverts the most recent group on the target, then moves it to the redo history. A group whose revert fails
   * stays where it is.
   */
  Optional<UndoGroup> undo(UndoTarget target);

  /**
   * Replays the most recently undone group on the target, then moves it back to the undo history.
   */
  Optional<UndoGroup> redo(UndoTarget target);

  /**
   * Undo for an {@link ReplayEntry#UNDO} received from another editor; not logged again.
   */
  Optional<UndoGroup> undoReplayed(UndoTarget target);

  Optional<UndoGroup> redoReplayed(UndoTarget target);

  int remainingUndo();

  int remainingRedo();

  void clear();

  int limit();

  /**
   * Maximal number of groups kept; older ones are dropped first.
   */
  void setLimit(int limit);

  /**
   * Switching the replay log on or off drops what it holds.
   */
  void enableReplayLog(boolean enable);

  boolean isReplayLogEnabled();

  /**
   * Takes the entries logged since the last call.
   */
  List<ReplayEntry> recentReplayLog();
}

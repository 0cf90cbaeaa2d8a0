package scribe;

/**
 * Result of a command, ordered by strength.
 */
public enum Outcome {
  /** nothing happened, the event may be handled elsewhere */
  CONTINUE,
  /** state visible on screen changed, repaint */
  CHANGED,
  /** the document content changed */
  TEXT_CHANGED;

  public Outcome or(Outcome other) {
    return compareTo(other) >= 0 ? this : other;
  }

  public static Outcome of(boolean changed) {
    return changed ? CHANGED : CONTINUE;
  }
}

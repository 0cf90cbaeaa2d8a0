package scribe;

/**
 * Rejected input: an offset or position that is not a grapheme boundary inside the document,
 * or a range whose end precedes its start. The document is never modified when this is thrown.
 */
public class TextException extends IllegalArgumentException {

  public enum Kind {
    INVALID_BOUNDARY,
    INVALID_RANGE
  }

  private final Kind kind;

  public TextException(Kind kind, String message) {
    super(kind + ": " + message);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public static TextException invalidBoundary(String what, Object value) {
    return new TextException(Kind.INVALID_BOUNDARY, what + " " + value);
  }

  public static TextException invalidRange(Object start, Object end) {
    return new TextException(Kind.INVALID_RANGE, "start " + start + " > end " + end);
  }
}

package scribe;

import java.util.Objects;

/**
 * A single mutation of a document: at {@link #offset} the {@link #deleted} text was removed and
 * {@link #inserted} put in its place. Stores hand these deltas to everything that keeps offsets into the text.
 */
public final class Edit {

  public final long offset;
  public final String deleted;
  public final String inserted;
  public final long deletedBytes;
  public final long insertedBytes;
  /** line the edit starts on */
  public final long line;
  public final long deletedLines;
  public final long insertedLines;

  public Edit(long offset, String deleted, long deletedBytes, String inserted, long insertedBytes, long line) {
    this.offset = offset;
    this.deleted = deleted;
    this.inserted = inserted;
    this.deletedBytes = deletedBytes;
    this.insertedBytes = insertedBytes;
    this.line = line;
    this.deletedLines = lineBreaks(deleted);
    this.insertedLines = lineBreaks(inserted);
  }

  public static Edit identity(long offset, long line) {
    return new Edit(offset, "", 0, "", 0, line);
  }

  public static Edit insert(long offset, String text, long bytes, long line) {
    return new Edit(offset, "", 0, text, bytes, line);
  }

  public static Edit delete(long offset, String text, long bytes, long line) {
    return new Edit(offset, text, bytes, "", 0, line);
  }

  public static long lineBreaks(String text) {
    long count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        count++;
      }
    }
    return count;
  }

  public static boolean isIdentity(Edit edit) {
    return edit.deleted.isEmpty() && edit.inserted.isEmpty();
  }

  public boolean changesLineStructure() {
    return deletedLines > 0 || insertedLines > 0;
  }

  /*
   * offsets inside the deleted text collapse to the edit offset,
   * an offset right at the edit moves past the inserted text only when shiftExact is set
   */
  public static long shiftOffset(long offset, Edit edit, boolean shiftExact) {
    if (offset < edit.offset || (offset == edit.offset && !shiftExact)) {
      return offset;
    }
    return Math.max(offset - edit.deletedBytes, edit.offset) + edit.insertedBytes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Edit edit = (Edit)o;
    return offset == edit.offset &&
           line == edit.line &&
           deleted.equals(edit.deleted) &&
           inserted.equals(edit.inserted);
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, line, deleted, inserted);
  }

  @Override
  public String toString() {
    return "[retain " + offset + "][delete \"" + deleted + "\"][insert \"" + inserted + "\"]";
  }
}

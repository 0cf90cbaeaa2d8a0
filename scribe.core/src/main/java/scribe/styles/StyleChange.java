package scribe.styles;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * What a deletion did to one span: {@link #after} is null when the span disappeared.
 */
public final class StyleChange {
  public final StyleSpan before;
  @Nullable public final StyleSpan after;

  public StyleChange(StyleSpan before, @Nullable StyleSpan after) {
    this.before = before;
    this.after = after;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    StyleChange change = (StyleChange)o;
    return before.equals(change.before) && Objects.equals(after, change.after);
  }

  @Override
  public int hashCode() {
    return Objects.hash(before, after);
  }

  @Override
  public String toString() {
    return before + " -> " + after;
  }
}

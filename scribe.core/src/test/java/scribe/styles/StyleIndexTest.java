package scribe.styles;

import org.junit.jupiter.api.Test;
import scribe.ByteRange;
import scribe.Edit;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class StyleIndexTest {

  private static final int BOLD = 1;
  private static final int ITALIC = 2;

  private static StyleIndex index(StyleSpan... spans) {
    StyleIndex index = new StyleIndex();
    for (StyleSpan span : spans) {
      assertTrue(index.add(span));
    }
    return index;
  }

  private static Edit insert(long offset, long length) {
    return Edit.insert(offset, "x".repeat((int)length), length, 0);
  }

  private static Edit delete(long from, long to) {
    return Edit.delete(from, "x".repeat((int)(to - from)), to - from, 0);
  }

  @Test
  public void insertionBeforeInsideOrAtEnd() {
    StyleIndex before = index(StyleSpan.of(5, 10, BOLD));
    before.edit(insert(2, 3));
    assertEquals(List.of(StyleSpan.of(8, 13, BOLD)), before.styles());

    StyleIndex inside = index(StyleSpan.of(5, 10, BOLD));
    inside.edit(insert(7, 3));
    assertEquals(List.of(StyleSpan.of(5, 13, BOLD)), inside.styles());

    StyleIndex atEnd = index(StyleSpan.of(5, 10, BOLD));
    atEnd.edit(insert(10, 3));
    assertEquals(List.of(StyleSpan.of(5, 13, BOLD)), atEnd.styles());

    StyleIndex after = index(StyleSpan.of(5, 10, BOLD));
    after.edit(insert(11, 3));
    assertEquals(List.of(StyleSpan.of(5, 10, BOLD)), after.styles());
  }

  @Test
  public void deletionShrinksSpans() {
    StyleIndex tail = index(StyleSpan.of(5, 10, BOLD));
    tail.edit(delete(7, 12));
    assertEquals(List.of(StyleSpan.of(5, 7, BOLD)), tail.styles());

    StyleIndex head = index(StyleSpan.of(5, 10, BOLD));
    head.edit(delete(2, 6));
    assertEquals(List.of(StyleSpan.of(2, 6, BOLD)), head.styles());

    StyleIndex shifted = index(StyleSpan.of(5, 10, BOLD));
    shifted.edit(delete(0, 3));
    assertEquals(List.of(StyleSpan.of(2, 7, BOLD)), shifted.styles());
  }

  @Test
  public void coveredSpanDisappears() {
    StyleIndex index = index(StyleSpan.of(5, 10, BOLD), StyleSpan.of(25, 30, ITALIC));
    List<StyleChange> changes = index.edit(delete(0, 20));
    assertEquals(List.of(new StyleChange(StyleSpan.of(5, 10, BOLD), null)), changes);
    assertEquals(List.of(StyleSpan.of(5, 10, ITALIC)), index.styles());
    assertEquals(1, index.size());
  }

  @Test
  public void changesIncludeTouchingSpans() {
    StyleIndex index = index(StyleSpan.of(0, 4, BOLD), StyleSpan.of(6, 9, ITALIC), StyleSpan.of(12, 15, BOLD));
    List<StyleChange> changes = index.edit(delete(4, 6));
    assertEquals(List.of(new StyleChange(StyleSpan.of(0, 4, BOLD), StyleSpan.of(0, 4, BOLD)),
                         new StyleChange(StyleSpan.of(6, 9, ITALIC), StyleSpan.of(4, 7, ITALIC))),
                 changes);
  }

  @Test
  public void restoreUndoesDeletion() {
    List<StyleSpan> original = List.of(StyleSpan.of(0, 4, BOLD),
                                       StyleSpan.of(3, 8, ITALIC),
                                       StyleSpan.of(6, 9, BOLD),
                                       StyleSpan.of(9, 12, ITALIC),
                                       StyleSpan.of(20, 22, BOLD));
    StyleIndex index = new StyleIndex();
    index.setStyles(original);
    List<StyleChange> changes = index.edit(delete(4, 9));
    Edit reinsert = insert(4, 5);
    index.edit(reinsert);
    index.restore(changes, reinsert);
    assertEquals(original, index.styles());
    assertEquals(original.size(), index.size());
  }

  @Test
  public void duplicatesAndEmptySpansAreIgnored() {
    StyleIndex index = new StyleIndex();
    assertTrue(index.add(new ByteRange(1, 3), BOLD));
    assertFalse(index.add(new ByteRange(1, 3), BOLD));
    assertTrue(index.add(new ByteRange(1, 3), ITALIC));
    assertFalse(index.add(ByteRange.empty(2), BOLD));
    assertEquals(2, index.size());

    assertFalse(index.remove(new ByteRange(1, 2), BOLD));
    assertTrue(index.remove(new ByteRange(1, 3), BOLD));
    assertEquals(List.of(StyleSpan.of(1, 3, ITALIC)), index.styles());
  }

  @Test
  public void queries() {
    StyleIndex index = index(StyleSpan.of(0, 5, BOLD), StyleSpan.of(3, 8, ITALIC), StyleSpan.of(10, 12, BOLD));
    assertEquals(List.of(BOLD, ITALIC), index.stylesAt(4));
    assertEquals(List.of(ITALIC), index.stylesAt(5));
    assertEquals(List.of(), index.stylesAt(8));
    assertTrue(index.styleMatch(11, BOLD));
    assertFalse(index.styleMatch(11, ITALIC));
    assertEquals(List.of(StyleSpan.of(3, 8, ITALIC), StyleSpan.of(10, 12, BOLD)), index.stylesIn(new ByteRange(6, 11)));
    assertEquals(List.of(), index.stylesIn(ByteRange.empty(4)));
  }

  @Test
  public void setStylesSortsAndDeduplicates() {
    StyleIndex index = index(StyleSpan.of(0, 1, BOLD));
    index.setStyles(List.of(StyleSpan.of(7, 9, BOLD),
                            StyleSpan.of(2, 4, ITALIC),
                            StyleSpan.of(7, 9, BOLD),
                            StyleSpan.of(5, 5, BOLD)));
    assertEquals(List.of(StyleSpan.of(2, 4, ITALIC), StyleSpan.of(7, 9, BOLD)), index.styles());
    assertEquals(2, index.size());
    index.clear();
    assertEquals(0, index.size());
    assertTrue(index.styles().isEmpty());
  }

  @Test
  public void matchAndRemoveFully() {
    StyleIndex index = index(StyleSpan.of(0, 5, BOLD), StyleSpan.of(3, 8, ITALIC), StyleSpan.of(10, 12, BOLD));
    assertEquals(Optional.of(new ByteRange(3, 8)), index.stylesAtMatch(4, ITALIC));
    assertEquals(Optional.of(new ByteRange(10, 12)), index.stylesAtMatch(11, BOLD));
    assertEquals(Optional.empty(), index.stylesAtMatch(8, ITALIC));

    assertEquals(List.of(StyleSpan.of(0, 5, BOLD), StyleSpan.of(10, 12, BOLD)), index.removeStyleFully(BOLD));
    assertEquals(1, index.size());
    assertEquals(List.of(StyleSpan.of(3, 8, ITALIC)), index.styles());
    assertEquals(List.of(), index.removeStyleFully(BOLD));
  }
}

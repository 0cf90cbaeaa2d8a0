package scribe.text;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UCharacterCategory;
import com.ibm.icu.lang.UProperty;

/**
 * Terminal cell widths of graphemes.
 */
public final class DisplayWidth {

  public static final int SOFT_HYPHEN = 0x00AD;
  public static final int ZERO_WIDTH_SPACE = 0x200B;
  private static final int EMOJI_PRESENTATION_SELECTOR = 0xFE0F;

  private DisplayWidth() {
  }

  public static boolean isControl(int codePoint) {
    return codePoint < 0x20 || codePoint == 0x7F || (0x80 <= codePoint && codePoint < 0xA0);
  }

  public static int tab(long screenColumn, int tabWidth) {
    return tabWidth - (int)(screenColumn % tabWidth);
  }

  /**
   * Width of a grapheme cluster on its own, tabs and line breaks excluded.
   */
  public static int of(String cluster) {
    if (cluster.isEmpty()) {
      return 0;
    }
    int first = cluster.codePointAt(0);
    if (isControl(first)) {
      return 1;
    }
    if (first == SOFT_HYPHEN || first == ZERO_WIDTH_SPACE) {
      return 0;
    }
    int type = UCharacter.getType(first);
    if (type == UCharacterCategory.NON_SPACING_MARK ||
        type == UCharacterCategory.ENCLOSING_MARK ||
        type == UCharacterCategory.FORMAT) {
      return 0;
    }
    if (0x1160 <= first && first <= 0x11FF) {
      // hangul medial vowels and final consonants join the preceding syllable
      return 0;
    }
    for (int i = 0; i < cluster.length(); ) {
      int cp = cluster.codePointAt(i);
      if (cp == EMOJI_PRESENTATION_SELECTOR || UCharacter.hasBinaryProperty(cp, UProperty.EMOJI_PRESENTATION)) {
        return 2;
      }
      i += Character.charCount(cp);
    }
    int eaw = UCharacter.getIntPropertyValue(first, UProperty.EAST_ASIAN_WIDTH);
    if (eaw == UCharacter.EastAsianWidth.WIDE || eaw == UCharacter.EastAsianWidth.FULLWIDTH) {
      return 2;
    }
    return 1;
  }

  /**
   * Width of a grapheme starting at the given screen column, with tabs expanded and line breaks taking no cells.
   */
  public static int of(Grapheme g, long screenColumn, int tabWidth) {
    if (g.isLineBreak()) {
      return 0;
    }
    if (g.is('\t')) {
      return tab(screenColumn, tabWidth);
    }
    return of(g.text);
  }
}

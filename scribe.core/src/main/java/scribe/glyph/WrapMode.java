package scribe.glyph;

public enum WrapMode {
  /** one row per line, overflow is scrolled */
  NONE,
  /** rows break at exactly the viewport width */
  HARD,
  /** rows break after the last space, dash, soft hyphen or zero width space that fits */
  WORD
}

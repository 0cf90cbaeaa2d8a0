package scribe.impl.util;

/**
 * UTF-8 lengths of UTF-16 text, without encoding it.
 */
public final class Utf8 {

  private Utf8() {
  }

  public static int length(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    else if (codePoint < 0x800) {
      return 2;
    }
    else if (codePoint < 0x10000) {
      return 3;
    }
    else {
      return 4;
    }
  }

  public static long length(CharSequence s, int from, int to) {
    long bytes = 0;
    int i = from;
    while (i < to) {
      int cp = Character.codePointAt(s, i);
      bytes += length(cp);
      i += Character.charCount(cp);
    }
    return bytes;
  }

  public static long length(CharSequence s) {
    return length(s, 0, s.length());
  }
}

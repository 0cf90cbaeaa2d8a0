package scribe;

import java.util.Objects;

/**
 * Editor configuration. Immutable, use the {@code with*} methods to derive a changed copy.
 */
public final class Settings {

  public static final Settings DEFAULT = new Settings(8, false, false, false, "\n", 99, false, 4096, true);

  public final int tabWidth;
  public final boolean expandTabs;
  public final boolean showCtrl;
  public final boolean wrapCtrl;
  public final String newline;
  public final int undoLimit;
  public final boolean undoStyles;
  /** documents expected to stay below this many bytes use the flat store */
  public final long flatStoreLimit;
  /** a new line copies the indent of the previous one, tab and back-tab indent selected lines */
  public final boolean autoIndent;

  public Settings(int tabWidth,
                  boolean expandTabs,
                  boolean showCtrl,
                  boolean wrapCtrl,
                  String newline,
                  int undoLimit,
                  boolean undoStyles,
                  long flatStoreLimit,
                  boolean autoIndent) {
    if (tabWidth < 1) {
      throw new IllegalArgumentException("tabWidth: " + tabWidth);
    }
    if (!newline.equals("\n") && !newline.equals("\r\n")) {
      throw new IllegalArgumentException("newline must be \\n or \\r\\n");
    }
    if (undoLimit < 1) {
      throw new IllegalArgumentException("undoLimit: " + undoLimit);
    }
    this.tabWidth = tabWidth;
    this.expandTabs = expandTabs;
    this.showCtrl = showCtrl;
    this.wrapCtrl = wrapCtrl;
    this.newline = newline;
    this.undoLimit = undoLimit;
    this.undoStyles = undoStyles;
    this.flatStoreLimit = flatStoreLimit;
    this.autoIndent = autoIndent;
  }

  public Settings withTabWidth(int tabWidth) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  public Settings withExpandTabs(boolean expandTabs) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  public Settings withShowCtrl(boolean showCtrl) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  public Settings withWrapCtrl(boolean wrapCtrl) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  public Settings withNewline(String newline) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  public Settings withUndoLimit(int undoLimit) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  public Settings withUndoStyles(boolean undoStyles) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  public Settings withFlatStoreLimit(long flatStoreLimit) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  public Settings withAutoIndent(boolean autoIndent) {
    return new Settings(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Settings settings = (Settings)o;
    return tabWidth == settings.tabWidth &&
           expandTabs == settings.expandTabs &&
           showCtrl == settings.showCtrl &&
           wrapCtrl == settings.wrapCtrl &&
           undoLimit == settings.undoLimit &&
           undoStyles == settings.undoStyles &&
           flatStoreLimit == settings.flatStoreLimit &&
           autoIndent == settings.autoIndent &&
           newline.equals(settings.newline);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tabWidth, expandTabs, showCtrl, wrapCtrl, newline, undoLimit, undoStyles, flatStoreLimit, autoIndent);
  }

  @Override
  public String toString() {
    return "Settings{" +
           "tabWidth=" + tabWidth +
           ", expandTabs=" + expandTabs +
           ", showCtrl=" + showCtrl +
           ", wrapCtrl=" + wrapCtrl +
           ", undoLimit=" + undoLimit +
           ", undoStyles=" + undoStyles +
           ", flatStoreLimit=" + flatStoreLimit +
           ", autoIndent=" + autoIndent +
           '}';
  }
}

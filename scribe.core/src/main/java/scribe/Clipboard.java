package scribe;

import org.jetbrains.annotations.Nullable;

/**
 * Clipboard access supplied by the hosting application.
 */
public interface Clipboard {

  @Nullable
  String getString();

  void setString(String text);
}

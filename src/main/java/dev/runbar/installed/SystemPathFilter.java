package dev.runbar.installed;

import java.util.Locale;

/**
 * Recognises programs that live in system or library locations, or inside another application
 * bundle. Those are mostly helper binaries and are only shown for confident matches.
 */
public final class SystemPathFilter {

  private static final String DATA_VOLUME_PREFIX = "/system/volumes/data";

  private final String homeLibrary;

  /**
   * Creates a filter for the given user.
   *
   * @param homeDirectory the user's home directory, whose {@code Library} folder counts as a
   *     library location
   */
  public SystemPathFilter(String homeDirectory) {
    String home = homeDirectory.endsWith("/") ? homeDirectory : homeDirectory + "/";
    this.homeLibrary = normalize((home + "Library/").toLowerCase(Locale.ROOT));
  }

  /**
   * Whether the program at the given path is a system, library or embedded program.
   *
   * @param path program location, any case
   */
  public boolean isSystemOrEmbedded(String path) {
    String normalized = normalize(path.toLowerCase(Locale.ROOT));

    if (normalized.startsWith("/system/") && !normalized.startsWith("/system/volumes/")) {
      return true;
    }
    if (normalized.startsWith("/library/") || normalized.startsWith(homeLibrary)) {
      return true;
    }

    String[] components = normalized.split("/");
    for (int i = 0; i < components.length - 1; i++) {
      if (components[i].endsWith(".app")) {
        return true;
      }
    }
    return false;
  }

  /**
   * Collapses the data-volume alias, so {@code /system/volumes/data/applications/x.app} and {@code
   * /applications/x.app} are checked the same way.
   *
   * @param lowerPath lowercased absolute path
   * @return the path without the data-volume prefix
   */
  static String normalize(String lowerPath) {
    if (!lowerPath.startsWith(DATA_VOLUME_PREFIX)) {
      return lowerPath;
    }
    String remainder = lowerPath.substring(DATA_VOLUME_PREFIX.length());
    if (remainder.isEmpty()) {
      return "/";
    }
    return remainder.startsWith("/") ? remainder : "/" + remainder;
  }
}

package dev.runbar.installed;

import java.util.List;

/** OS-level index of installed applications, queried by display-name wildcard. */
public interface ProgramIndex {

  /**
   * Finds applications whose display name matches a wildcard pattern, ignoring case and
   * diacritics.
   *
   * @param wildcardPattern pattern where {@code *} matches any run of characters
   * @param limit maximum number of records returned
   * @return matching records in index order
   */
  List<ProgramRecord> query(String wildcardPattern, int limit);
}

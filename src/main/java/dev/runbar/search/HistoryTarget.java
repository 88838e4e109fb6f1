package dev.runbar.search;

/**
 * Reference from a history entry to the concrete thing it launched. Stored with the entry and
 * re-resolved on every read, so a history row inherits the current title, subtitle and action of
 * its target.
 *
 * @param kind what sort of result the reference points to
 * @param reference path, catalog token or URL, depending on {@code kind}
 */
public record HistoryTarget(Kind kind, String reference) {

  /** Target categories a history entry can point at. */
  public enum Kind {
    INSTALLED_PROGRAM,
    CATALOG_ENTRY,
    URL,
    FILESYSTEM
  }

  /** Compact constructor validating input. */
  public HistoryTarget {
    if (kind == null) {
      throw new IllegalArgumentException("Target kind must not be null");
    }
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("Target reference must not be blank");
    }
  }
}

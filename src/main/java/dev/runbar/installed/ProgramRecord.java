package dev.runbar.installed;

import org.jspecify.annotations.Nullable;

/**
 * One application known to the OS program index.
 *
 * @param name display name
 * @param path bundle or launcher-entry location
 * @param bundleId platform bundle identifier, when the index knows it
 * @param description short description, when the index knows it
 */
public record ProgramRecord(
    String name, @Nullable String path, @Nullable String bundleId, @Nullable String description) {

  /** Compact constructor validating input. */
  public ProgramRecord {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Program name must not be blank");
    }
  }
}

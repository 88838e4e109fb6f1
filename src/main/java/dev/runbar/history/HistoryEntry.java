package dev.runbar.history;

import dev.runbar.search.HistoryTarget;
import java.time.Instant;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * One command the user ran successfully.
 *
 * @param command trimmed command text, never blank
 * @param display optional title recorded with the command
 * @param subtitle optional subtitle recorded with the command
 * @param target what the command launched, re-resolved on every read
 * @param recordedAt when the command was last run
 */
public record HistoryEntry(
    String command,
    @Nullable String display,
    @Nullable String subtitle,
    @Nullable HistoryTarget target,
    Instant recordedAt) {

  /** Compact constructor validating input. */
  public HistoryEntry {
    if (command == null || command.isBlank()) {
      throw new IllegalArgumentException("History command must not be blank");
    }
    if (recordedAt == null) {
      throw new IllegalArgumentException("recordedAt must not be null");
    }
    command = command.strip();
  }

  /** Whether this entry stores the given command, ignoring case and surrounding whitespace. */
  public boolean isCommand(String other) {
    return command.equalsIgnoreCase(other.strip());
  }

  String lowercasedCommand() {
    return command.toLowerCase(Locale.ROOT);
  }
}

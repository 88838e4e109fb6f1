package dev.runbar.search;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Immutable view of the user's input, built once per search and shared with every provider.
 *
 * @param raw the text exactly as typed
 * @param trimmed the input without leading/trailing whitespace
 * @param lowercased the trimmed input lowercased with {@link Locale#ROOT}
 */
public record SearchQuery(String raw, String trimmed, String lowercased) {

  /** Compact constructor validating that the derived variants are present. */
  public SearchQuery {
    if (raw == null || trimmed == null || lowercased == null) {
      throw new IllegalArgumentException("Query variants must not be null");
    }
  }

  /**
   * Builds a query from raw input. A {@code null} input is treated as the empty string.
   *
   * @param raw the raw text from the input field
   * @return the query with trimmed and lowercased variants
   */
  public static SearchQuery of(@Nullable String raw) {
    String input = raw == null ? "" : raw;
    String trimmed = input.strip();
    return new SearchQuery(input, trimmed, trimmed.toLowerCase(Locale.ROOT));
  }

  /** True when nothing but whitespace was typed. */
  public boolean isEmpty() {
    return trimmed.isEmpty();
  }
}

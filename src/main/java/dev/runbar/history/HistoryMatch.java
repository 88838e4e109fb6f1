package dev.runbar.history;

/**
 * A history entry that fuzzily matched a query.
 *
 * @param entry the matched entry
 * @param score fuzzy sub-score, higher is a better fit
 */
public record HistoryMatch(HistoryEntry entry, int score) {}

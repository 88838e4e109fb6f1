package dev.runbar.history;

import dev.runbar.search.HistoryTarget;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Most-recent-first list of commands the user ran successfully, capped at {@code
 * runbar.history.max-entries} and persisted through a {@link HistoryRepository} after every
 * change.
 *
 * <p>Commands are unique ignoring case: recording an existing command moves it to the front. All
 * reads and writes go through one lock, so callers on any thread see a consistent list.
 *
 * <p>Fuzzy score bands (lowercased candidate vs lowercased query):
 *
 * <ul>
 *   <li>exact: 400
 *   <li>prefix: 320
 *   <li>substring starting at offset {@code o >= 1}: {@code 220 + max(0, 60 - o)}, in [220, 279]
 *   <li>subsequence: {@code 100 + min(119, sum(max(1, 15 - gap)))}, in [101, 219]
 * </ul>
 */
@Component
public class CommandHistory {

  private static final Logger log = LoggerFactory.getLogger(CommandHistory.class);

  static final int SCORE_EXACT = 400;
  static final int SCORE_PREFIX = 320;
  static final int SCORE_SUBSTRING = 220;
  static final int SUBSTRING_PROXIMITY_WINDOW = 60;
  static final int SCORE_SUBSEQUENCE = 100;
  static final int SUBSEQUENCE_BONUS_CAP = 119;
  static final int SUBSEQUENCE_GAP_WINDOW = 15;

  private final HistoryRepository repository;
  private final Clock clock;
  private final int maxEntries;
  private final Object lock = new Object();
  private final List<HistoryEntry> entries = new ArrayList<>();

  public CommandHistory(HistoryRepository repository, HistoryProperties properties, Clock clock) {
    this.repository = repository;
    this.clock = clock;
    this.maxEntries = properties.getMaxEntries();
    entries.addAll(loadEntries());
    log.info("Loaded command history with {} entries", entries.size());
  }

  /**
   * Records a command the user launched successfully.
   *
   * @param command the command text; blank input is ignored
   */
  public void record(String command) {
    record(command, null, null, null);
  }

  /**
   * Records a command the user launched successfully, with optional presentation and target data.
   *
   * @param command the command text; blank input is ignored
   * @param display title to show for the entry
   * @param subtitle subtitle to show for the entry
   * @param target what the command launched
   */
  public void record(
      String command,
      @Nullable String display,
      @Nullable String subtitle,
      @Nullable HistoryTarget target) {
    if (command == null || command.isBlank()) {
      return;
    }
    HistoryEntry entry = new HistoryEntry(command, display, subtitle, target, clock.instant());
    synchronized (lock) {
      entries.removeIf(existing -> existing.isCommand(entry.command()));
      entries.add(0, entry);
      if (entries.size() > maxEntries) {
        entries.subList(maxEntries, entries.size()).clear();
      }
      persist();
    }
  }

  /**
   * Removes a command, ignoring case.
   *
   * @param command the command to forget
   * @return true if an entry was removed
   */
  public boolean remove(String command) {
    if (command == null || command.isBlank()) {
      return false;
    }
    synchronized (lock) {
      boolean removed = entries.removeIf(existing -> existing.isCommand(command));
      if (removed) {
        persist();
      }
      return removed;
    }
  }

  /** The {@code limit} most recent entries, most recent first. */
  public List<HistoryEntry> recentEntries(int limit) {
    synchronized (lock) {
      return List.copyOf(entries.subList(0, Math.min(Math.max(limit, 0), entries.size())));
    }
  }

  /**
   * Scores every entry against the query and returns the best ones.
   *
   * @param query the query text; surrounding whitespace is ignored
   * @param limit maximum number of matches
   * @return matches ordered by score desc, then recency
   */
  public List<HistoryMatch> fuzzyMatches(String query, int limit) {
    String needle = normalize(query);
    if (needle.isEmpty() || limit <= 0) {
      return List.of();
    }
    List<HistoryMatch> matches = new ArrayList<>();
    for (HistoryEntry entry : snapshot()) {
      OptionalInt score = fuzzyScore(entry.lowercasedCommand(), needle);
      if (score.isPresent()) {
        matches.add(new HistoryMatch(entry, score.getAsInt()));
      }
    }
    // stable sort keeps recency order within equal scores
    matches.sort(Comparator.comparingInt(HistoryMatch::score).reversed());
    return List.copyOf(matches.subList(0, Math.min(limit, matches.size())));
  }

  /**
   * The most recent command that extends the given prefix, for inline autocompletion.
   *
   * @param prefix what the user typed so far
   * @return a command starting with the prefix (ignoring case) and longer than it
   */
  public Optional<String> bestCompletion(String prefix) {
    String needle = normalize(prefix);
    if (needle.isEmpty()) {
      return Optional.empty();
    }
    return snapshot().stream()
        .filter(entry -> entry.command().length() > needle.length())
        .filter(entry -> entry.lowercasedCommand().startsWith(needle))
        .map(HistoryEntry::command)
        .findFirst();
  }

  /**
   * Commands starting with the prefix, ignoring case, in recency order.
   *
   * @param prefix what the user typed so far
   * @param limit maximum number of completions
   * @return matching commands, most recent first
   */
  public List<String> completions(String prefix, int limit) {
    String needle = normalize(prefix);
    if (needle.isEmpty()) {
      return List.of();
    }
    return snapshot().stream()
        .filter(entry -> entry.lowercasedCommand().startsWith(needle))
        .map(HistoryEntry::command)
        .limit(Math.max(limit, 0))
        .toList();
  }

  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  /**
   * Fuzzy score of a candidate for a query, both already lowercased.
   *
   * @return the score, or empty when the query is not even a subsequence of the candidate
   */
  static OptionalInt fuzzyScore(String candidate, String query) {
    if (candidate.equals(query)) {
      return OptionalInt.of(SCORE_EXACT);
    }
    if (candidate.startsWith(query)) {
      return OptionalInt.of(SCORE_PREFIX);
    }
    int offset = candidate.indexOf(query);
    if (offset > 0) {
      return OptionalInt.of(
          SCORE_SUBSTRING + Math.max(0, SUBSTRING_PROXIMITY_WINDOW - offset));
    }

    int bonus = 0;
    int searchFrom = 0;
    for (int i = 0; i < query.length(); i++) {
      int found = candidate.indexOf(query.charAt(i), searchFrom);
      if (found < 0) {
        return OptionalInt.empty();
      }
      bonus += Math.max(SUBSEQUENCE_GAP_WINDOW - (found - searchFrom), 1);
      searchFrom = found + 1;
    }
    return OptionalInt.of(SCORE_SUBSEQUENCE + Math.min(SUBSEQUENCE_BONUS_CAP, bonus));
  }

  private List<HistoryEntry> snapshot() {
    synchronized (lock) {
      return List.copyOf(entries);
    }
  }

  private List<HistoryEntry> loadEntries() {
    try {
      List<HistoryEntry> loaded = repository.load();
      return loaded.size() > maxEntries ? loaded.subList(0, maxEntries) : loaded;
    } catch (IOException | RuntimeException e) {
      log.warn("Command history is unreadable, starting with an empty history", e);
      return List.of();
    }
  }

  private void persist() {
    try {
      repository.save(List.copyOf(entries));
    } catch (IOException e) {
      log.warn("Failed to persist command history with {} entries", entries.size(), e);
    }
  }

  private static String normalize(@Nullable String text) {
    return text == null ? "" : text.strip().toLowerCase(Locale.ROOT);
  }
}

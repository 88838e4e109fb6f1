package dev.runbar.search;

import java.util.Map;
import java.util.Optional;

/**
 * Hook notified with the final score of every delivered result, keyed by identity key. Used for
 * on-screen debug annotation; not part of ranking.
 */
@FunctionalInterface
public interface ScoreObserver {

  /** Observer that ignores every notification. */
  ScoreObserver NONE = (query, scoresByIdentity) -> {};

  /**
   * Called once per reranked search with the scores that survived deduplication.
   *
   * @param query the query that was ranked
   * @param scoresByIdentity identity key to final score, in delivery order
   */
  void onScores(SearchQuery query, Map<String, Integer> scoresByIdentity);

  /** Scores of the last reranked search, for observers that keep them. */
  default Optional<RecordedScores> lastScores() {
    return Optional.empty();
  }
}

package dev.runbar.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.Nullable;

/**
 * Keeps the scores of the most recently reranked search so rows can be annotated in debug builds.
 * Registered as the conductor's {@link ScoreObserver} when {@code runbar.search.record-scores=true}
 * and read back through {@code GET /api/search/scores}.
 */
public class LastScoresRecorder implements ScoreObserver {

  private final AtomicReference<@Nullable RecordedScores> last = new AtomicReference<>();

  @Override
  public void onScores(SearchQuery query, Map<String, Integer> scoresByIdentity) {
    last.set(
        new RecordedScores(
            query.trimmed(), Collections.unmodifiableMap(new LinkedHashMap<>(scoresByIdentity))));
  }

  @Override
  public Optional<RecordedScores> lastScores() {
    return Optional.ofNullable(last.get());
  }
}

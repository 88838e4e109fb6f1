package dev.runbar.history;

import dev.runbar.catalog.CatalogProperties;
import dev.runbar.search.ProviderResult;
import dev.runbar.search.SearchProvider;
import dev.runbar.search.SearchQuery;
import dev.runbar.search.SearchResult;
import dev.runbar.search.SearchSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Offers previously run commands that fuzzily match the query.
 *
 * <p>Each of the top {@code match-limit} matches scores {@code base + (limit - rank) * 10 +
 * fuzzy}. A command equal to the query (ignoring case) is lifted to at least 1000, and one whose
 * target is a deprecated catalog package loses the catalog deprecation penalty. Duplicates are
 * collapsed keeping the best score, and candidates trailing the best one by more than {@code
 * prune-window} are dropped.
 */
@Component
public class CommandHistoryProvider implements SearchProvider {

  static final int RECENCY_STEP = 10;
  static final int EXACT_MATCH_FLOOR = 1000;

  private final CommandHistory history;
  private final HistoryTargetResolver resolver;
  private final HistoryProperties properties;
  private final CatalogProperties catalogProperties;

  public CommandHistoryProvider(
      CommandHistory history,
      HistoryTargetResolver resolver,
      HistoryProperties properties,
      CatalogProperties catalogProperties) {
    this.history = history;
    this.resolver = resolver;
    this.properties = properties;
    this.catalogProperties = catalogProperties;
  }

  @Override
  public SearchSource source() {
    return SearchSource.HISTORY;
  }

  @Override
  public List<ProviderResult> search(SearchQuery query) {
    if (query.isEmpty()) {
      return List.of();
    }
    int limit = properties.getMatchLimit();
    List<HistoryMatch> matches = history.fuzzyMatches(query.trimmed(), limit);

    List<ProviderResult> candidates = new ArrayList<>(matches.size());
    for (int rank = 0; rank < matches.size(); rank++) {
      HistoryMatch match = matches.get(rank);
      HistoryEntry entry = match.entry();
      SearchResult resolved = resolver.resolve(entry.target()).orElse(null);

      int score =
          properties.getBaseScore() + Math.max(0, (limit - rank) * RECENCY_STEP) + match.score();
      if (entry.command().toLowerCase(Locale.ROOT).equals(query.lowercased())) {
        score = Math.max(score, EXACT_MATCH_FLOOR);
      }
      if (HistoryTargetResolver.isDeprecated(resolved)) {
        score = catalogProperties.penalize(score);
      }

      SearchResult.HistoryCommand command =
          new SearchResult.HistoryCommand(
              entry.command(), entry.display(), entry.subtitle(), false, entry.target(), resolved);
      candidates.add(new ProviderResult(SearchSource.HISTORY, command, score));
    }
    candidates.sort(Comparator.comparingInt(ProviderResult::score).reversed());

    Set<String> seen = new HashSet<>();
    List<ProviderResult> results = new ArrayList<>(candidates.size());
    int cutoff = candidates.isEmpty() ? 0 : candidates.get(0).score() - properties.getPruneWindow();
    for (ProviderResult candidate : candidates) {
      if (candidate.score() < cutoff) {
        break;
      }
      if (seen.add(candidate.result().identityKey())) {
        results.add(candidate);
      }
    }
    return results;
  }
}

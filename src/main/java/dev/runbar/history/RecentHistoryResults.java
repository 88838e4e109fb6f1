package dev.runbar.history;

import dev.runbar.search.RecentResultsSource;
import dev.runbar.search.SearchResult;
import java.util.List;
import org.springframework.stereotype.Component;

/** The empty-query view: the most recent history entries, marked as recents. */
@Component
public class RecentHistoryResults implements RecentResultsSource {

  private final CommandHistory history;
  private final HistoryTargetResolver resolver;

  public RecentHistoryResults(CommandHistory history, HistoryTargetResolver resolver) {
    this.history = history;
    this.resolver = resolver;
  }

  @Override
  public List<SearchResult> recentResults(int limit) {
    return history.recentEntries(limit).stream()
        .map(
            entry ->
                (SearchResult)
                    new SearchResult.HistoryCommand(
                        entry.command(),
                        entry.display(),
                        entry.subtitle(),
                        true,
                        entry.target(),
                        resolver.resolve(entry.target()).orElse(null)))
        .toList();
  }
}

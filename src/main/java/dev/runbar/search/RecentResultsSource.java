package dev.runbar.search;

import java.util.List;

/** Supplies the rows shown when the input is empty: the most recently run commands. */
@FunctionalInterface
public interface RecentResultsSource {

  /**
   * Returns up to {@code limit} recent results, most recent first.
   *
   * @param limit maximum number of rows
   * @return recent results, already resolved against their stored targets
   */
  List<SearchResult> recentResults(int limit);
}

package dev.runbar.search;

import java.util.List;

/**
 * An independent source of scored candidates. The conductor calls every provider concurrently on
 * its own worker thread, so implementations must only read shared stores that tolerate concurrent
 * access and must not keep per-search mutable state.
 *
 * <p>Implementations should return an empty list rather than throw for ordinary failures; the
 * conductor treats an exception the same way but logs it as unexpected.
 */
public interface SearchProvider {

  /** The source tag attached to every candidate this provider returns. */
  SearchSource source();

  /**
   * Returns the candidates for a query. An empty query yields an empty list.
   *
   * @param query the query for this search
   * @return scored candidates, in no particular order
   */
  List<ProviderResult> search(SearchQuery query);
}

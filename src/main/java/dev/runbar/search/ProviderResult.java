package dev.runbar.search;

/**
 * A provider-scored candidate prior to cross-source reranking. Scores are source-local: they only
 * become comparable once {@link ResultReranker} has applied its priority tiers.
 *
 * @param source which provider produced the candidate
 * @param result the candidate result
 * @param score the provider's relevance score (higher is better, never negative)
 */
public record ProviderResult(SearchSource source, SearchResult result, int score) {

  /** Compact constructor validating input. */
  public ProviderResult {
    if (source == null || result == null) {
      throw new IllegalArgumentException("Source and result must not be null");
    }
  }

  /** Copy of this candidate with a different score. */
  public ProviderResult withScore(int newScore) {
    return new ProviderResult(source, result, newScore);
  }
}

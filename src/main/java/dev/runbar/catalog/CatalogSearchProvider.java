package dev.runbar.catalog;

import dev.runbar.search.CatalogEntry;
import dev.runbar.search.ProviderResult;
import dev.runbar.search.SearchProvider;
import dev.runbar.search.SearchQuery;
import dev.runbar.search.SearchResult;
import dev.runbar.search.SearchSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Offers catalog packages whose names, token, full token or description contain the query.
 *
 * <p>Scoring takes the best of the primary fields (display name, token, full token: exact 1000,
 * prefix 900, contains 800), the alternate names (950/850/750) and the description (500), with
 * 100 as the floor. Deprecated packages are demoted by the configured penalty but still returned.
 */
@Component
public class CatalogSearchProvider implements SearchProvider {

  private static final Logger log = LoggerFactory.getLogger(CatalogSearchProvider.class);

  static final int SCORE_EXACT = 1000;
  static final int SCORE_ALT_EXACT = 950;
  static final int SCORE_PREFIX = 900;
  static final int SCORE_ALT_PREFIX = 850;
  static final int SCORE_CONTAINS = 800;
  static final int SCORE_ALT_CONTAINS = 750;
  static final int SCORE_DESCRIPTION = 500;
  static final int SCORE_FALLBACK = 100;

  private final CatalogStore store;
  private final CatalogProperties properties;

  public CatalogSearchProvider(CatalogStore store, CatalogProperties properties) {
    this.store = store;
    this.properties = properties;
  }

  @Override
  public SearchSource source() {
    return SearchSource.CATALOG;
  }

  @Override
  public List<ProviderResult> search(SearchQuery query) {
    if (query.isEmpty()) {
      return List.of();
    }
    String needle = query.lowercased();
    List<ProviderResult> results = new ArrayList<>();
    for (CatalogEntry entry : store.entries()) {
      if (!matches(entry, needle)) {
        continue;
      }
      int score = relevanceScore(entry, needle);
      if (entry.deprecated()) {
        score = properties.penalize(score);
      }
      SearchResult.AvailablePackage pkg = new SearchResult.AvailablePackage(entry);
      results.add(new ProviderResult(SearchSource.CATALOG, pkg, score));
    }
    log.debug("Catalog matched {} of {} entries for '{}'", results.size(), store.size(), needle);
    return results;
  }

  static boolean matches(CatalogEntry entry, String needle) {
    return entry.searchableTerms().stream().anyMatch(term -> lower(term).contains(needle));
  }

  /**
   * Relevance of an entry for an already lowercased, non-empty query, before any deprecation
   * penalty.
   */
  static int relevanceScore(CatalogEntry entry, String needle) {
    int best = SCORE_FALLBACK;
    for (String field : List.of(entry.displayName(), entry.token(), entry.fullToken())) {
      best = Math.max(best, tier(lower(field), needle, SCORE_EXACT, SCORE_PREFIX, SCORE_CONTAINS));
    }
    for (String name : entry.names()) {
      best =
          Math.max(
              best,
              tier(lower(name), needle, SCORE_ALT_EXACT, SCORE_ALT_PREFIX, SCORE_ALT_CONTAINS));
    }
    if (entry.description() != null && lower(entry.description()).contains(needle)) {
      best = Math.max(best, SCORE_DESCRIPTION);
    }
    return best;
  }

  private static int tier(String field, String needle, int exact, int prefix, int contains) {
    if (field.equals(needle)) {
      return exact;
    }
    if (field.startsWith(needle)) {
      return prefix;
    }
    return field.contains(needle) ? contains : 0;
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}

package dev.runbar.installed;

import dev.runbar.catalog.CatalogStore;
import dev.runbar.search.CatalogEntry;
import dev.runbar.search.LexicalMatching;
import dev.runbar.search.ProviderResult;
import dev.runbar.search.SearchProvider;
import dev.runbar.search.SearchQuery;
import dev.runbar.search.SearchResult;
import dev.runbar.search.SearchSource;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Offers installed applications whose display name matches the query.
 *
 * <p>Scores, for lowercased name {@code n} and query {@code q}: {@code n == q} 1000, {@code n}
 * starts with {@code q} 900, a token of {@code n} equals {@code q} 950, a token starts with {@code
 * q} 880, {@code n} contains {@code q} 800, wildcard-only hit 100.
 *
 * <p>Programs in system, library or embedded locations are kept only for an exact match, or for
 * queries of at least five characters that are a prefix of the name or within one edit of it.
 * Kept programs are linked to their catalog package (by name, then program filename, then filename
 * without extension), which also supplies a missing description.
 */
@Component
public class InstalledProgramsProvider implements SearchProvider {

  private static final Logger log = LoggerFactory.getLogger(InstalledProgramsProvider.class);

  static final int SCORE_EXACT = 1000;
  static final int SCORE_TOKEN_EXACT = 950;
  static final int SCORE_PREFIX = 900;
  static final int SCORE_TOKEN_PREFIX = 880;
  static final int SCORE_CONTAINS = 800;
  static final int SCORE_WILDCARD = 100;
  static final int CONFIDENT_QUERY_LENGTH = 5;

  private final ProgramIndex index;
  private final CatalogStore catalog;
  private final InstalledProperties properties;
  private final SystemPathFilter systemPathFilter;

  public InstalledProgramsProvider(
      ProgramIndex index,
      CatalogStore catalog,
      InstalledProperties properties,
      @Value("${user.home}") String homeDirectory) {
    this.index = index;
    this.catalog = catalog;
    this.properties = properties;
    this.systemPathFilter = new SystemPathFilter(homeDirectory);
  }

  @Override
  public SearchSource source() {
    return SearchSource.INSTALLED;
  }

  @Override
  public List<ProviderResult> search(SearchQuery query) {
    if (query.isEmpty()) {
      return List.of();
    }
    String needle = query.lowercased();
    List<ProgramRecord> hits;
    try {
      hits = index.query(LexicalMatching.wildcardPattern(needle), properties.getResultLimit());
    } catch (RuntimeException e) {
      log.warn("Program index query failed for '{}'", needle, e);
      return List.of();
    }

    List<ProviderResult> results = new ArrayList<>(hits.size());
    for (ProgramRecord hit : hits) {
      String nameLower = hit.name().toLowerCase(Locale.ROOT);
      int score = relevanceScore(nameLower, needle);
      if (!shouldInclude(hit.path(), score, nameLower, needle)) {
        continue;
      }
      CatalogEntry catalogRef = matchCatalog(hit).orElse(null);
      String description = hit.description();
      if ((description == null || description.isEmpty()) && catalogRef != null) {
        String catalogDescription = catalogRef.description();
        if (catalogDescription != null && !catalogDescription.isEmpty()) {
          description = catalogDescription;
        }
      }
      SearchResult.InstalledProgram program =
          new SearchResult.InstalledProgram(
              hit.name(), hit.path(), hit.bundleId(), description, catalogRef);
      results.add(new ProviderResult(SearchSource.INSTALLED, program, score));
    }
    log.debug(
        "Installed programs: kept {} of {} index hits for '{}'",
        results.size(),
        hits.size(),
        needle);
    return results;
  }

  static int relevanceScore(String nameLower, String query) {
    if (nameLower.equals(query)) {
      return SCORE_EXACT;
    }
    if (nameLower.startsWith(query)) {
      return SCORE_PREFIX;
    }
    List<String> tokens = LexicalMatching.tokens(nameLower);
    if (tokens.contains(query)) {
      return SCORE_TOKEN_EXACT;
    }
    if (tokens.stream().anyMatch(token -> token.startsWith(query))) {
      return SCORE_TOKEN_PREFIX;
    }
    return nameLower.contains(query) ? SCORE_CONTAINS : SCORE_WILDCARD;
  }

  boolean shouldInclude(@Nullable String path, int score, String nameLower, String query) {
    if (path == null || !systemPathFilter.isSystemOrEmbedded(path)) {
      return true;
    }
    if (score >= SCORE_EXACT) {
      return true;
    }
    if (query.length() < CONFIDENT_QUERY_LENGTH) {
      return false;
    }
    return nameLower.startsWith(query) || LexicalMatching.isEditDistanceLeOne(nameLower, query);
  }

  private Optional<CatalogEntry> matchCatalog(ProgramRecord hit) {
    Optional<CatalogEntry> byName = catalog.lookupByNameOrToken(hit.name());
    if (byName.isPresent() || hit.path() == null) {
      return byName;
    }
    Path fileName = Path.of(hit.path()).getFileName();
    if (fileName == null) {
      return Optional.empty();
    }
    String filename = fileName.toString();
    int dot = filename.lastIndexOf('.');
    String basename = dot > 0 ? filename.substring(0, dot) : filename;
    return catalog
        .lookupByProvidedFilename(filename)
        .or(() -> catalog.lookupByNameOrToken(basename));
  }
}

package dev.runbar.search;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pure static utility that merges the candidates of every provider into one ordered, deduplicated
 * list.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Partition by source; remember the lowercased filename of every installed program path
 *   <li>Drop catalog packages whose provided program filenames are already installed
 *   <li>Fold a history candidate into the installed candidate with the same display name, adding
 *       the scores, so a recently run program does not appear twice
 *   <li>Concatenate installed + remaining history + catalog and sort by priority tier desc, score
 *       desc, then case-insensitive display name
 *   <li>Keep the first candidate per identity key; a later non-history candidate whose display
 *       name was already taken is dropped as well, while history rows may share a display name
 *       with their target
 * </ol>
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class ResultReranker {

  static final int TIER_EXACT_INSTALLED = 5;
  static final int TIER_EXACT_HISTORY = 4;
  static final int TIER_DEFAULT = 3;
  static final int TIER_LOW = 1;

  private ResultReranker() {}

  /**
   * Reranks the union of all provider outputs for a query.
   *
   * @param results candidates from every provider, in any order
   * @param query the query the candidates were produced for
   * @return the surviving candidates in final display order
   */
  public static List<ProviderResult> rerank(List<ProviderResult> results, SearchQuery query) {
    if (results.isEmpty()) {
      return List.of();
    }

    // Step 1: partition
    Set<String> installedFilenames = new HashSet<>();
    List<ProviderResult> installed = new ArrayList<>();
    Map<String, Integer> installedIndexByDisplay = new HashMap<>();
    List<ProviderResult> catalog = new ArrayList<>();
    List<ProviderResult> history = new ArrayList<>();

    for (ProviderResult candidate : results) {
      SearchResult result = candidate.result();
      if (result instanceof SearchResult.InstalledProgram program) {
        if (program.path() != null && !program.path().isEmpty()) {
          installedFilenames.add(lastPathComponent(program.path()).toLowerCase(Locale.ROOT));
        }
        installedIndexByDisplay.put(lower(program.displayName()), installed.size());
        installed.add(candidate);
      } else if (result instanceof SearchResult.AvailablePackage) {
        catalog.add(candidate);
      } else if (result instanceof SearchResult.HistoryCommand) {
        history.add(candidate);
      }
    }

    // Step 2: already-installed packages are not offered for installation
    List<ProviderResult> filteredCatalog =
        catalog.stream()
            .filter(
                candidate -> {
                  CatalogEntry entry = ((SearchResult.AvailablePackage) candidate.result()).entry();
                  return entry.appNames().stream()
                      .noneMatch(app -> installedFilenames.contains(lower(app)));
                })
            .toList();

    // Step 3: merge history into installed rows with the same display name
    List<ProviderResult> remainingHistory = new ArrayList<>();
    for (ProviderResult candidate : history) {
      SearchResult.HistoryCommand command = (SearchResult.HistoryCommand) candidate.result();
      String display = command.display();
      if (display != null && !display.isEmpty()) {
        Integer index = installedIndexByDisplay.get(lower(display));
        if (index != null) {
          ProviderResult existing = installed.get(index);
          installed.set(index, existing.withScore(existing.score() + candidate.score()));
          continue;
        }
      }
      remainingHistory.add(candidate);
    }

    // Step 4: concatenate and sort
    List<ProviderResult> combined =
        new ArrayList<>(installed.size() + remainingHistory.size() + filteredCatalog.size());
    combined.addAll(installed);
    combined.addAll(remainingHistory);
    combined.addAll(filteredCatalog);
    combined.sort(ordering(query));

    // Step 5: dedup by identity, then by display name for non-history rows
    Set<String> seenIdentities = new HashSet<>();
    Set<String> seenDisplayNames = new HashSet<>();
    List<ProviderResult> ranked = new ArrayList<>(combined.size());
    for (ProviderResult candidate : combined) {
      SearchResult result = candidate.result();
      if (!seenIdentities.add(result.identityKey())) {
        continue;
      }
      String displayKey = lower(result.displayName());
      if (seenDisplayNames.contains(displayKey) && !result.isHistory()) {
        continue;
      }
      seenDisplayNames.add(displayKey);
      ranked.add(candidate);
    }
    return ranked;
  }

  /**
   * Comparator placing higher tiers first, then higher scores, then display names alphabetically
   * (case-insensitive).
   */
  static Comparator<ProviderResult> ordering(SearchQuery query) {
    return Comparator.comparingInt((ProviderResult candidate) -> priority(candidate, query))
        .reversed()
        .thenComparing(Comparator.comparingInt(ProviderResult::score).reversed())
        .thenComparing(
            candidate -> candidate.result().displayName(), String.CASE_INSENSITIVE_ORDER);
  }

  /**
   * Coarse priority bucket applied before score comparison.
   *
   * @param candidate the candidate to classify
   * @param query the current query
   * @return the tier, higher ranks first
   */
  static int priority(ProviderResult candidate, SearchQuery query) {
    SearchResult result = candidate.result();
    String queryLower = query.lowercased();
    if (result instanceof SearchResult.InstalledProgram program) {
      return lower(program.name()).equals(queryLower) ? TIER_EXACT_INSTALLED : TIER_DEFAULT;
    }
    if (result instanceof SearchResult.HistoryCommand command) {
      return lower(command.command()).equals(queryLower) ? TIER_EXACT_HISTORY : TIER_DEFAULT;
    }
    if (result instanceof SearchResult.AvailablePackage pkg) {
      return isExactMatch(pkg.entry(), queryLower) ? TIER_DEFAULT : TIER_LOW;
    }
    return TIER_LOW;
  }

  private static boolean isExactMatch(CatalogEntry entry, String queryLower) {
    return lower(entry.displayName()).equals(queryLower)
        || lower(entry.token()).equals(queryLower)
        || lower(entry.fullToken()).equals(queryLower);
  }

  static String lastPathComponent(String path) {
    Path fileName = Path.of(path).getFileName();
    return fileName == null ? path : fileName.toString();
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}

package dev.runbar.search;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link ResultReranker} invariants using jqwik: whatever mix of provider
 * output comes in, the ranked list is sorted, free of identity duplicates, never repeats a display
 * name on a non-history row, and never offers a package whose program is installed.
 */
class ResultRerankerPropertyTest {

  private static final List<String> NAMES = List.of("Notes", "notes", "Code", "Firefox", "Mail");

  @Provide
  Arbitrary<List<ProviderResult>> candidates() {
    Arbitrary<String> names = Arbitraries.of(NAMES);
    Arbitrary<Integer> scores = Arbitraries.integers().between(0, 1500);

    Arbitrary<String> dirs = Arbitraries.of("/Applications", "/Users/me/Applications");

    Arbitrary<ProviderResult> installed =
        Combinators.combine(names, scores, dirs)
            .as(
                (name, score, dir) ->
                    new ProviderResult(
                        SearchSource.INSTALLED,
                        new SearchResult.InstalledProgram(
                            name, dir + "/" + name + ".app", null, null, null),
                        score));
    Arbitrary<ProviderResult> history =
        Combinators.combine(names, names.injectNull(0.5), scores)
            .as(
                (command, display, score) ->
                    new ProviderResult(
                        SearchSource.HISTORY,
                        new SearchResult.HistoryCommand(command, display, null, false, null, null),
                        score));
    Arbitrary<ProviderResult> packages =
        Combinators.combine(names, scores)
            .as(
                (name, score) ->
                    new ProviderResult(
                        SearchSource.CATALOG,
                        new SearchResult.AvailablePackage(
                            new CatalogEntry(
                                name.toLowerCase(Locale.ROOT),
                                null,
                                List.of(name),
                                null,
                                null,
                                null,
                                null,
                                false,
                                List.of(name + ".app"))),
                        score));

    return Arbitraries.oneOf(installed, history, packages).list().ofMaxSize(12);
  }

  @Provide
  Arbitrary<String> queries() {
    return Arbitraries.of("", "notes", "code", "fire", "mail", "NOTES");
  }

  @Property
  void identity_keys_are_unique(
      @ForAll("candidates") List<ProviderResult> input, @ForAll("queries") String query) {
    List<ProviderResult> ranked = ResultReranker.rerank(input, SearchQuery.of(query));

    Set<String> identities =
        ranked.stream().map(r -> r.result().identityKey()).collect(Collectors.toSet());
    assertThat(identities).hasSize(ranked.size());
  }

  @Property
  void non_history_rows_never_repeat_an_earlier_display_name(
      @ForAll("candidates") List<ProviderResult> input, @ForAll("queries") String query) {
    List<ProviderResult> ranked = ResultReranker.rerank(input, SearchQuery.of(query));

    Set<String> seen = new HashSet<>();
    for (ProviderResult candidate : ranked) {
      String display = candidate.result().displayName().toLowerCase(Locale.ROOT);
      if (!candidate.result().isHistory()) {
        assertThat(seen).doesNotContain(display);
      }
      seen.add(display);
    }
  }

  @Property
  void output_is_sorted_by_tier_score_and_name(
      @ForAll("candidates") List<ProviderResult> input, @ForAll("queries") String query) {
    SearchQuery searchQuery = SearchQuery.of(query);
    List<ProviderResult> ranked = ResultReranker.rerank(input, searchQuery);

    for (int i = 1; i < ranked.size(); i++) {
      assertThat(ResultReranker.ordering(searchQuery).compare(ranked.get(i - 1), ranked.get(i)))
          .isLessThanOrEqualTo(0);
    }
  }

  @Property
  void output_only_contains_input_results(
      @ForAll("candidates") List<ProviderResult> input, @ForAll("queries") String query) {
    Set<SearchResult> inputResults =
        input.stream().map(ProviderResult::result).collect(Collectors.toSet());

    List<ProviderResult> ranked = ResultReranker.rerank(input, SearchQuery.of(query));

    assertThat(ranked).allSatisfy(r -> assertThat(inputResults).contains(r.result()));
  }

  @Property
  void installed_programs_suppress_their_packages(
      @ForAll("candidates") List<ProviderResult> input, @ForAll("queries") String query) {
    Set<String> installedFiles =
        input.stream()
            .map(ProviderResult::result)
            .filter(SearchResult.InstalledProgram.class::isInstance)
            .map(r -> ResultReranker.lastPathComponent(((SearchResult.InstalledProgram) r).path()))
            .map(file -> file.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

    List<ProviderResult> ranked = ResultReranker.rerank(input, SearchQuery.of(query));

    ranked.stream()
        .map(ProviderResult::result)
        .filter(SearchResult.AvailablePackage.class::isInstance)
        .map(r -> ((SearchResult.AvailablePackage) r).entry())
        .forEach(
            entry ->
                assertThat(entry.appNames())
                    .noneMatch(app -> installedFiles.contains(app.toLowerCase(Locale.ROOT))));
  }
}

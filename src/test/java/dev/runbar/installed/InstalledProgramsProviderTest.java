package dev.runbar.installed;

import static org.assertj.core.api.Assertions.assertThat;

import dev.runbar.catalog.CatalogStore;
import dev.runbar.fixture.CatalogEntryBuilder;
import dev.runbar.search.CatalogEntry;
import dev.runbar.search.LexicalMatching;
import dev.runbar.search.ProviderResult;
import dev.runbar.search.SearchQuery;
import dev.runbar.search.SearchResult;
import dev.runbar.search.SearchSource;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class InstalledProgramsProviderTest {

  private static final CatalogEntry VSCODE =
      new CatalogEntryBuilder()
          .token("visual-studio-code")
          .names("Microsoft Visual Studio Code")
          .description("Open-source code editor")
          .appNames("Visual Studio Code.app")
          .build();
  private static final CatalogEntry FIREFOX =
      new CatalogEntryBuilder().token("firefox").names("Firefox").description("Browser").build();

  private static final ProgramRecord VISUAL_STUDIO_CODE =
      new ProgramRecord("Visual Studio Code", "/Applications/Visual Studio Code.app", null, null);
  private static final ProgramRecord TERMINAL =
      new ProgramRecord("Terminal", "/System/Applications/Utilities/Terminal.app", null, null);
  private static final ProgramRecord INSTRUMENTS =
      new ProgramRecord(
          "Instruments",
          "/Applications/Xcode.app/Contents/Applications/Instruments.app",
          null,
          null);

  private final InstalledProperties properties = new InstalledProperties();
  private final List<Integer> requestedLimits = new ArrayList<>();

  private InstalledProgramsProvider providerOver(List<ProgramRecord> programs) {
    ProgramIndex index =
        (pattern, limit) -> {
          requestedLimits.add(limit);
          return programs.stream()
              .filter(program -> LexicalMatching.matchesWildcard(pattern, program.name()))
              .limit(limit)
              .toList();
        };
    return new InstalledProgramsProvider(
        index, new CatalogStore(List.of(VSCODE, FIREFOX)), properties, "/Users/test");
  }

  private static List<String> names(List<ProviderResult> results) {
    return results.stream().map(result -> result.result().displayName()).toList();
  }

  @ParameterizedTest
  @CsvSource({
    "visual studio code, 1000",
    "vis, 900",
    "code, 950",
    "cod, 880",
    "dio, 800",
    "vsc, 100"
  })
  void scores_name_matches(String query, int expected) {
    assertThat(InstalledProgramsProvider.relevanceScore("visual studio code", query))
        .isEqualTo(expected);
  }

  @Test
  void reports_installed_results_with_their_score() {
    List<ProviderResult> results =
        providerOver(List.of(VISUAL_STUDIO_CODE)).search(SearchQuery.of("Code"));

    assertThat(results).hasSize(1);
    assertThat(results.get(0).source()).isEqualTo(SearchSource.INSTALLED);
    assertThat(results.get(0).score()).isEqualTo(950);
    assertThat(requestedLimits).containsExactly(300);
  }

  @Test
  void empty_query_does_not_touch_the_index() {
    assertThat(providerOver(List.of(VISUAL_STUDIO_CODE)).search(SearchQuery.of(" "))).isEmpty();
    assertThat(requestedLimits).isEmpty();
  }

  @Test
  void index_failure_yields_no_results() {
    ProgramIndex failing =
        (pattern, limit) -> {
          throw new IllegalStateException("index unavailable");
        };
    InstalledProgramsProvider provider =
        new InstalledProgramsProvider(failing, CatalogStore.empty(), properties, "/Users/test");

    assertThat(provider.search(SearchQuery.of("code"))).isEmpty();
  }

  @Nested
  class SystemPrograms {

    private final InstalledProgramsProvider provider =
        providerOver(List.of(TERMINAL, INSTRUMENTS));

    @Test
    void short_prefix_does_not_surface_system_programs() {
      assertThat(provider.search(SearchQuery.of("term"))).isEmpty();
      assertThat(provider.search(SearchQuery.of("inst"))).isEmpty();
    }

    @Test
    void exact_name_surfaces_system_programs() {
      assertThat(names(provider.search(SearchQuery.of("terminal")))).containsExactly("Terminal");
    }

    @Test
    void confident_prefix_surfaces_system_programs() {
      assertThat(names(provider.search(SearchQuery.of("termi")))).containsExactly("Terminal");
    }

    @Test
    void single_typo_surfaces_embedded_programs() {
      List<ProviderResult> results = provider.search(SearchQuery.of("instrumens"));

      assertThat(names(results)).containsExactly("Instruments");
      assertThat(results.get(0).score()).isEqualTo(100);
    }

    @Test
    void regular_programs_need_no_confidence() {
      ProgramRecord notes = new ProgramRecord("Notes", "/Applications/Notes.app", null, null);

      assertThat(names(providerOver(List.of(notes)).search(SearchQuery.of("no"))))
          .containsExactly("Notes");
    }
  }

  @Nested
  class CatalogLinking {

    private SearchResult.InstalledProgram only(List<ProviderResult> results) {
      assertThat(results).hasSize(1);
      return (SearchResult.InstalledProgram) results.get(0).result();
    }

    @Test
    void links_by_provided_filename_and_borrows_the_description() {
      SearchResult.InstalledProgram program =
          only(providerOver(List.of(VISUAL_STUDIO_CODE)).search(SearchQuery.of("visual")));

      assertThat(program.catalogRef()).isEqualTo(VSCODE);
      assertThat(program.description()).isEqualTo("Open-source code editor");
    }

    @Test
    void links_by_filename_without_extension() {
      ProgramRecord nightly =
          new ProgramRecord("Firefox Nightly", "/Applications/Firefox.app", null, null);

      SearchResult.InstalledProgram program =
          only(providerOver(List.of(nightly)).search(SearchQuery.of("nightly")));

      assertThat(program.catalogRef()).isEqualTo(FIREFOX);
    }

    @Test
    void own_description_is_kept() {
      ProgramRecord firefox =
          new ProgramRecord("Firefox", "/usr/share/applications/firefox.desktop", null, "Web");

      SearchResult.InstalledProgram program =
          only(providerOver(List.of(firefox)).search(SearchQuery.of("firefox")));

      assertThat(program.catalogRef()).isEqualTo(FIREFOX);
      assertThat(program.description()).isEqualTo("Web");
    }

    @Test
    void unknown_program_has_no_catalog_package() {
      ProgramRecord notes = new ProgramRecord("Notes", null, null, null);

      SearchResult.InstalledProgram program =
          only(providerOver(List.of(notes)).search(SearchQuery.of("notes")));

      assertThat(program.catalogRef()).isNull();
      assertThat(program.description()).isNull();
    }
  }
}

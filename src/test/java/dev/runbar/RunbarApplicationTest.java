package dev.runbar;

import static org.assertj.core.api.Assertions.assertThat;

import dev.runbar.search.SearchConductor;
import dev.runbar.search.SearchProvider;
import dev.runbar.search.SearchResult;
import dev.runbar.search.SearchSource;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class RunbarApplicationTest {

  @Autowired List<SearchProvider> providers;
  @Autowired SearchConductor conductor;

  @Test
  void every_source_is_wired_into_the_conductor() {
    assertThat(providers)
        .extracting(SearchProvider::source)
        .containsExactlyInAnyOrder(
            SearchSource.INSTALLED, SearchSource.CATALOG, SearchSource.HISTORY);
  }

  @Test
  void bundled_catalog_is_searchable() throws Exception {
    List<SearchResult> results = conductor.searchOnce("firefox").get(5, TimeUnit.SECONDS);

    assertThat(results)
        .filteredOn(SearchResult.AvailablePackage.class::isInstance)
        .extracting(SearchResult::displayName)
        .contains("Mozilla Firefox");
  }
}

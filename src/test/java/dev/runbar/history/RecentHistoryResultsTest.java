package dev.runbar.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.runbar.search.HistoryTarget;
import dev.runbar.search.SearchResult;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecentHistoryResultsTest {

  private static final Instant AT = Instant.parse("2026-01-05T10:00:00Z");

  @Mock CommandHistory history;

  @Mock HistoryTargetResolver resolver;

  RecentHistoryResults recents;

  @BeforeEach
  void setUp() {
    recents = new RecentHistoryResults(history, resolver);
  }

  @Test
  void lists_recent_commands_marked_as_recents_with_resolved_targets() {
    HistoryTarget docs = new HistoryTarget(HistoryTarget.Kind.URL, "https://d.io");
    when(history.recentEntries(2))
        .thenReturn(
            List.of(
                new HistoryEntry("code", null, null, null, AT),
                new HistoryEntry("docs", "Docs", null, docs, AT.minusSeconds(5))));
    when(resolver.resolve(null)).thenReturn(Optional.empty());
    when(resolver.resolve(docs))
        .thenReturn(Optional.of(new SearchResult.UrlTarget("https://d.io")));

    List<SearchResult> results = recents.recentResults(2);

    assertThat(results)
        .containsExactly(
            new SearchResult.HistoryCommand("code", null, null, true, null, null),
            new SearchResult.HistoryCommand(
                "docs", "Docs", null, true, docs, new SearchResult.UrlTarget("https://d.io")));
  }

  @Test
  void empty_history_has_no_recents() {
    when(history.recentEntries(8)).thenReturn(List.of());

    assertThat(recents.recentResults(8)).isEmpty();
    verifyNoInteractions(resolver);
  }
}

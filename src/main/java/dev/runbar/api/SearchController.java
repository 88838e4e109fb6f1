package dev.runbar.api;

import dev.runbar.search.RecordedScores;
import dev.runbar.search.ScoreObserver;
import dev.runbar.search.SearchConductor;
import dev.runbar.search.SearchResult;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs one search per request. An empty {@code q} returns the recent history rows.
 *
 * <p>{@code GET /api/search/scores} returns the final scores of the last reranked search when
 * score recording is enabled, and 404 otherwise.
 */
@RestController
@RequestMapping("/api/search")
public class SearchController {

  private final SearchConductor conductor;
  private final ScoreObserver scoreObserver;

  public SearchController(SearchConductor conductor, ScoreObserver scoreObserver) {
    this.conductor = conductor;
    this.scoreObserver = scoreObserver;
  }

  @GetMapping
  public CompletableFuture<List<SearchResult>> search(
      @RequestParam(name = "q", defaultValue = "") String query) {
    return conductor.searchOnce(query);
  }

  @GetMapping("/scores")
  public ResponseEntity<RecordedScores> lastScores() {
    return ResponseEntity.of(scoreObserver.lastScores());
  }
}

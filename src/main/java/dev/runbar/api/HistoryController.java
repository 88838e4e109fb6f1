package dev.runbar.api;

import dev.runbar.history.CommandHistory;
import dev.runbar.search.RecentResultsSource;
import dev.runbar.search.SearchResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Command-history endpoints: record a successful launch, forget a command, list recents and
 * complete a typed prefix.
 */
@RestController
@RequestMapping("/api/history")
public class HistoryController {

  private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

  static final int COMPLETION_LIMIT = 10;

  private final CommandHistory history;
  private final RecentResultsSource recentResults;

  public HistoryController(CommandHistory history, RecentResultsSource recentResults) {
    this.history = history;
    this.recentResults = recentResults;
  }

  @PostMapping
  public ResponseEntity<Void> record(@Valid @RequestBody RecordCommandRequest request) {
    history.record(request.command(), request.display(), request.subtitle(), request.target());
    log.debug("Recorded command '{}'", request.command().strip());
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping
  public ResponseEntity<Void> remove(@RequestParam String command) {
    if (!history.remove(command)) {
      return ResponseEntity.notFound().build();
    }
    log.debug("Removed command '{}'", command.strip());
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/recent")
  public List<SearchResult> recent(
      @RequestParam(defaultValue = "8") @Min(1) @Max(200) int limit) {
    return recentResults.recentResults(limit);
  }

  @GetMapping("/completion")
  public CompletionResponse completion(@RequestParam String prefix) {
    return new CompletionResponse(
        prefix,
        history.bestCompletion(prefix).orElse(null),
        history.completions(prefix, COMPLETION_LIMIT));
  }
}

package dev.runbar.history;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the command history, bound from {@code runbar.history.*}.
 *
 * <ul>
 *   <li>{@code file} - JSON file the history is persisted to
 *   <li>{@code max-entries} - entries kept, oldest dropped first (default 200)
 *   <li>{@code match-limit} - fuzzy matches turned into candidates per search (default 8)
 *   <li>{@code base-score} - score every history candidate starts from (default 200)
 *   <li>{@code prune-window} - candidates trailing the best one by more than this are dropped
 *       (default 120)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "runbar.history")
public class HistoryProperties {

  private Path file = Path.of(System.getProperty("user.home"), ".runbar", "history.json");
  private int maxEntries = 200;
  private int matchLimit = 8;
  private int baseScore = 200;
  private int pruneWindow = 120;

  @PostConstruct
  void validate() {
    if (file == null) {
      throw new IllegalStateException("runbar.history.file must be set");
    }
    if (maxEntries < 1 || maxEntries > 10_000) {
      throw new IllegalStateException(
          "runbar.history.max-entries must be in [1, 10000], got: " + maxEntries);
    }
    if (matchLimit < 1 || matchLimit > 50) {
      throw new IllegalStateException(
          "runbar.history.match-limit must be in [1, 50], got: " + matchLimit);
    }
    if (baseScore < 0 || baseScore > 1000) {
      throw new IllegalStateException(
          "runbar.history.base-score must be in [0, 1000], got: " + baseScore);
    }
    if (pruneWindow < 0) {
      throw new IllegalStateException(
          "runbar.history.prune-window must be >= 0, got: " + pruneWindow);
    }
  }

  public Path getFile() {
    return file;
  }

  public void setFile(Path file) {
    this.file = file;
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  public void setMaxEntries(int maxEntries) {
    this.maxEntries = maxEntries;
  }

  public int getMatchLimit() {
    return matchLimit;
  }

  public void setMatchLimit(int matchLimit) {
    this.matchLimit = matchLimit;
  }

  public int getBaseScore() {
    return baseScore;
  }

  public void setBaseScore(int baseScore) {
    this.baseScore = baseScore;
  }

  public int getPruneWindow() {
    return pruneWindow;
  }

  public void setPruneWindow(int pruneWindow) {
    this.pruneWindow = pruneWindow;
  }
}

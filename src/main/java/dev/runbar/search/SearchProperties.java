package dev.runbar.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search conductor.
 *
 * <p>Properties are bound from {@code runbar.search.*} in application.yml /
 * application.properties.
 *
 * <ul>
 *   <li>{@code empty-query-history-limit} - rows shown for an empty query (default 8, bounded [1,
 *       50])
 *   <li>{@code provider-timeout} - how long the conductor waits for a single provider before
 *       treating it as empty (default 2s, bounded [10ms, 30s])
 *   <li>{@code path-listing-limit} - maximum entries listed for a typed directory path (default
 *       50, bounded [1, 1000])
 *   <li>{@code record-scores} - keep the last delivered scores for debug annotation (default false)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "runbar.search")
public class SearchProperties {

  private int emptyQueryHistoryLimit = 8;
  private Duration providerTimeout = Duration.ofSeconds(2);
  private int pathListingLimit = 50;
  private boolean recordScores = false;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (emptyQueryHistoryLimit < 1 || emptyQueryHistoryLimit > 50) {
      throw new IllegalStateException(
          "runbar.search.empty-query-history-limit must be in [1, 50], got: "
              + emptyQueryHistoryLimit);
    }
    if (providerTimeout == null
        || providerTimeout.compareTo(Duration.ofMillis(10)) < 0
        || providerTimeout.compareTo(Duration.ofSeconds(30)) > 0) {
      throw new IllegalStateException(
          "runbar.search.provider-timeout must be in [10ms, 30s], got: " + providerTimeout);
    }
    if (pathListingLimit < 1 || pathListingLimit > 1000) {
      throw new IllegalStateException(
          "runbar.search.path-listing-limit must be in [1, 1000], got: " + pathListingLimit);
    }
  }

  public int getEmptyQueryHistoryLimit() {
    return emptyQueryHistoryLimit;
  }

  public void setEmptyQueryHistoryLimit(int emptyQueryHistoryLimit) {
    this.emptyQueryHistoryLimit = emptyQueryHistoryLimit;
  }

  public Duration getProviderTimeout() {
    return providerTimeout;
  }

  public void setProviderTimeout(Duration providerTimeout) {
    this.providerTimeout = providerTimeout;
  }

  public int getPathListingLimit() {
    return pathListingLimit;
  }

  public void setPathListingLimit(int pathListingLimit) {
    this.pathListingLimit = pathListingLimit;
  }

  public boolean isRecordScores() {
    return recordScores;
  }

  public void setRecordScores(boolean recordScores) {
    this.recordScores = recordScores;
  }
}

package dev.runbar.config;

import dev.runbar.search.LastScoresRecorder;
import dev.runbar.search.ScoreObserver;
import dev.runbar.search.SearchProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads and hooks used by the search conductor.
 *
 * <p>Provider calls run on a small shared pool. Joining and reranking run on a single thread, so
 * result lists are assembled one search at a time. Program index rescans get their own thread so
 * a slow disk never holds a provider slot.
 */
@Configuration
public class SearchRuntimeConfig {

  static final int PROVIDER_POOL_SIZE = 4;

  @Bean(name = "searchProviderExecutor")
  public ThreadPoolTaskExecutor searchProviderExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(PROVIDER_POOL_SIZE);
    executor.setMaxPoolSize(PROVIDER_POOL_SIZE);
    executor.setThreadNamePrefix("search-provider-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "searchAggregationExecutor")
  public ThreadPoolTaskExecutor searchAggregationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix("search-aggregate-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "programIndexRefreshExecutor")
  public ThreadPoolTaskExecutor programIndexRefreshExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix("program-index-");
    executor.initialize();
    return executor;
  }

  /**
   * Records the scores of the last delivered search when {@code runbar.search.record-scores} is
   * on; otherwise scores are discarded.
   */
  @Bean
  public ScoreObserver scoreObserver(SearchProperties properties) {
    return properties.isRecordScores() ? new LastScoresRecorder() : ScoreObserver.NONE;
  }
}

package dev.runbar.search;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration layer: fans a query out to every {@link SearchProvider} in parallel, joins
 * their candidates, reranks them into one list and delivers it, guarded by a generation counter so
 * only the newest search ever reaches the caller.
 *
 * <p>Pipeline: build {@link SearchQuery} -> take a new generation -> dispatch classifier and
 * providers on the provider executor (each bounded by the provider timeout, failures become empty
 * lists) -> join on the aggregation executor -> drop if superseded -> {@link ResultReranker} ->
 * prepend URL/path results -> hop to the caller's delivery executor -> drop if superseded ->
 * callback.
 *
 * <p>Provider calls of a superseded search that have not started yet are skipped when a thread
 * picks them up. Calls already running are not interrupted; their results are discarded. The
 * provider timeout counts from the moment a call starts running, so time spent queued behind other
 * searches never cuts off a fresh call.
 */
@Service
public class SearchConductor {

  private static final Logger log = LoggerFactory.getLogger(SearchConductor.class);

  private final List<SearchProvider> providers;
  private final RecentResultsSource recentResults;
  private final QueryClassifier queryClassifier;
  private final Executor providerExecutor;
  private final Executor aggregationExecutor;
  private final ScoreObserver scoreObserver;
  private final SearchProperties properties;
  private final AtomicLong generation = new AtomicLong();

  public SearchConductor(
      List<SearchProvider> providers,
      RecentResultsSource recentResults,
      QueryClassifier queryClassifier,
      @Qualifier("searchProviderExecutor") Executor providerExecutor,
      @Qualifier("searchAggregationExecutor") Executor aggregationExecutor,
      ScoreObserver scoreObserver,
      SearchProperties properties) {
    this.providers = List.copyOf(providers);
    this.recentResults = recentResults;
    this.queryClassifier = queryClassifier;
    this.providerExecutor = providerExecutor;
    this.aggregationExecutor = aggregationExecutor;
    this.scoreObserver = scoreObserver;
    this.properties = properties;
  }

  /**
   * Starts a search and returns immediately. The callback fires at most once, on the delivery
   * executor, and only if no newer search has started by then. An empty query delivers the most
   * recent history rows without consulting any provider.
   *
   * @param rawQuery the text as typed
   * @param deliveryExecutor where the callback runs, e.g. the UI thread
   * @param callback receives the final ordered results
   */
  public void search(
      String rawQuery, Executor deliveryExecutor, Consumer<List<SearchResult>> callback) {
    SearchQuery query = SearchQuery.of(rawQuery);
    long searchGeneration = generation.incrementAndGet();
    BooleanSupplier current = () -> isCurrentGeneration(searchGeneration);

    run(query, current)
        .thenAccept(
            outcome -> {
              if (outcome.isEmpty()) {
                log.debug("Search generation {} superseded before reranking", searchGeneration);
                return;
              }
              deliveryExecutor.execute(
                  () -> {
                    if (!current.getAsBoolean()) {
                      log.debug("Search generation {} superseded at delivery", searchGeneration);
                      return;
                    }
                    callback.accept(outcome.get());
                  });
            })
        .exceptionally(
            ex -> {
              log.error("Search generation {} failed", searchGeneration, ex);
              return null;
            });
  }

  /**
   * Starts a search and returns immediately, delivering the callback on the thread that finishes
   * the reranking.
   *
   * @param rawQuery the text as typed
   * @param callback receives the final ordered results
   */
  public void search(String rawQuery, Consumer<List<SearchResult>> callback) {
    search(rawQuery, Runnable::run, callback);
  }

  /**
   * Runs one search outside the generation protocol, for request/response callers where every
   * request stands alone.
   *
   * @param rawQuery the text as typed
   * @return future completed with the final ordered results
   */
  public CompletableFuture<List<SearchResult>> searchOnce(String rawQuery) {
    return run(SearchQuery.of(rawQuery), () -> true)
        .thenApply(outcome -> outcome.orElse(List.of()));
  }

  private CompletableFuture<Optional<List<SearchResult>>> run(
      SearchQuery query, BooleanSupplier current) {
    if (query.isEmpty()) {
      return CompletableFuture.supplyAsync(
          () -> {
            List<SearchResult> recents =
                recentResults.recentResults(properties.getEmptyQueryHistoryLimit());
            if (!current.getAsBoolean()) {
              return Optional.<List<SearchResult>>empty();
            }
            scoreObserver.onScores(query, Map.of());
            return Optional.of(recents);
          },
          aggregationExecutor);
    }

    CompletableFuture<List<SearchResult>> synthetic =
        dispatch("query classifier", query, current, () -> queryClassifier.classify(query));
    List<CompletableFuture<List<ProviderResult>>> calls = new ArrayList<>(providers.size());
    for (SearchProvider provider : providers) {
      calls.add(dispatch(provider.source().name(), query, current, () -> provider.search(query)));
    }

    List<CompletableFuture<?>> everything = new ArrayList<>(calls);
    everything.add(synthetic);
    return CompletableFuture.allOf(everything.toArray(new CompletableFuture<?>[0]))
        .thenApplyAsync(
            ignored -> {
              if (!current.getAsBoolean()) {
                return Optional.<List<SearchResult>>empty();
              }
              List<ProviderResult> collected = new ArrayList<>();
              calls.forEach(call -> collected.addAll(call.join()));
              return Optional.of(assemble(query, synthetic.join(), collected));
            },
            aggregationExecutor);
  }

  private List<SearchResult> assemble(
      SearchQuery query, List<SearchResult> synthetic, List<ProviderResult> collected) {
    List<ProviderResult> ranked = ResultReranker.rerank(collected, query);

    Set<String> syntheticKeys =
        synthetic.stream().map(SearchResult::identityKey).collect(Collectors.toSet());
    List<SearchResult> results = new ArrayList<>(synthetic.size() + ranked.size());
    results.addAll(synthetic);
    Map<String, Integer> scores = new LinkedHashMap<>();
    for (ProviderResult candidate : ranked) {
      String identity = candidate.result().identityKey();
      if (syntheticKeys.contains(identity)) {
        continue;
      }
      results.add(candidate.result());
      scores.put(identity, candidate.score());
    }
    scoreObserver.onScores(query, scores);

    log.debug(
        "Query '{}' ranked {} results from {} candidates",
        query.trimmed(),
        results.size(),
        collected.size());
    return results;
  }

  /**
   * Runs one provider call on the provider executor. A call whose search is no longer current when
   * a thread picks it up is skipped. Otherwise the configured timeout starts with the call, and
   * any failure or timeout turns into an empty list.
   */
  private <T> CompletableFuture<List<T>> dispatch(
      String name, SearchQuery query, BooleanSupplier current, Supplier<List<T>> call) {
    CompletableFuture<List<T>> result = new CompletableFuture<>();
    try {
      providerExecutor.execute(
          () -> {
            if (!current.getAsBoolean()) {
              log.debug("Skipping provider {} for superseded query '{}'", name, query.trimmed());
              result.complete(List.of());
              return;
            }
            result.orTimeout(properties.getProviderTimeout().toMillis(), TimeUnit.MILLISECONDS);
            try {
              result.complete(call.get());
            } catch (RuntimeException e) {
              result.completeExceptionally(e);
            }
          });
    } catch (RejectedExecutionException e) {
      result.completeExceptionally(e);
    }
    return result.exceptionally(
        ex -> {
          Throwable cause =
              ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
          if (cause instanceof TimeoutException) {
            log.warn(
                "Provider {} timed out after {} for query '{}'",
                name,
                properties.getProviderTimeout(),
                query.trimmed());
          } else {
            log.warn("Provider {} failed for query '{}'", name, query.trimmed(), cause);
          }
          return List.of();
        });
  }

  private boolean isCurrentGeneration(long searchGeneration) {
    return generation.get() == searchGeneration;
  }
}

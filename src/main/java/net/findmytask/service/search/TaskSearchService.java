package net.findmytask.service.search;

import lombok.extern.slf4j.Slf4j;
import net.findmytask.config.SearchProperties;
import net.findmytask.domain.search.SearchQuery;
import net.findmytask.domain.search.SearchResult;
import net.findmytask.model.Task;
import net.findmytask.util.SearchQueryParser;
import net.findmytask.util.SearchQueryUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;

/**
 * Ranks tasks against a query.
 *
 * <p>Every task is scored by {@link TaskScoringStrategy}; non-matches are dropped and the
 * rest are stably sorted by descending relevance, so equal scores keep input order.
 * "Now" is read from the injected {@link Clock} once per call and shared by every task.</p>
 *
 * <p>Collections at or above {@code search.parallel-threshold} are split into chunks and
 * scored on the {@code searchScoringExecutor}. Chunks are re-joined in input order before
 * sorting, so the parallel path returns exactly what the sequential path would.</p>
 */
@Service
@Slf4j
public class TaskSearchService {

    private static final Comparator<SearchResult> BY_RELEVANCE_DESC =
        Comparator.comparingDouble(SearchResult::relevanceScore).reversed();

    private final TaskScoringStrategy scoringStrategy;
    private final Executor scoringExecutor;
    private final Clock clock;
    private final int parallelThreshold;
    private final int batchSize;

    public TaskSearchService(TaskScoringStrategy scoringStrategy,
                             @Qualifier("searchScoringExecutor") Executor scoringExecutor,
                             Clock clock,
                             SearchProperties searchProperties) {
        this.scoringStrategy = scoringStrategy;
        this.scoringExecutor = scoringExecutor;
        this.clock = clock;
        this.parallelThreshold = searchProperties.getParallelThreshold();
        this.batchSize = searchProperties.getBatchSize();
    }

    /**
     * Parses {@code queryString} and ranks {@code tasks} against it.
     */
    public List<SearchResult> search(Collection<Task> tasks, String queryString) {
        SearchQuery query = SearchQueryParser.parse(queryString);
        log.debug("Parsed query '{}' into {} term(s) with operator {}",
            SearchQueryUtils.logPreview(queryString), query.terms().size(), query.operator());
        return search(tasks, query);
    }

    /**
     * Ranks {@code tasks} against an already parsed query.
     *
     * @return matching tasks, highest relevance first; empty for an empty collection or query
     */
    public List<SearchResult> search(Collection<Task> tasks, SearchQuery query) {
        if (tasks == null || tasks.isEmpty() || query == null || query.isEmpty()) {
            return List.of();
        }
        List<Task> snapshot = tasks.stream().filter(Objects::nonNull).toList();
        Instant now = clock.instant();

        List<SearchResult> results = snapshot.size() >= parallelThreshold && scoringExecutor != null
            ? scoreInParallel(snapshot, query, now)
            : scoreRange(snapshot, 0, snapshot.size(), query, now);

        log.debug("Search over {} task(s) produced {} result(s)", snapshot.size(), results.size());
        return rank(results);
    }

    /**
     * Ranks tasks in batches of {@code search.batch-size}, checking {@code cancelled} before
     * each batch. When cancellation is observed the results of the batches already scored are
     * ranked and returned.
     */
    public List<SearchResult> search(Collection<Task> tasks, SearchQuery query, BooleanSupplier cancelled) {
        if (tasks == null || tasks.isEmpty() || query == null || query.isEmpty()) {
            return List.of();
        }
        List<Task> snapshot = tasks.stream().filter(Objects::nonNull).toList();
        Instant now = clock.instant();
        List<SearchResult> results = new ArrayList<>();

        for (int start = 0; start < snapshot.size(); start += batchSize) {
            if (cancelled != null && cancelled.getAsBoolean()) {
                log.debug("Search cancelled after {} of {} task(s)", start, snapshot.size());
                break;
            }
            int end = Math.min(snapshot.size(), start + batchSize);
            results.addAll(scoreRange(snapshot, start, end, query, now));
        }
        return rank(results);
    }

    private List<SearchResult> scoreInParallel(List<Task> tasks, SearchQuery query, Instant now) {
        List<CompletableFuture<List<SearchResult>>> chunks = new ArrayList<>();
        for (int start = 0; start < tasks.size(); start += batchSize) {
            int from = start;
            int to = Math.min(tasks.size(), start + batchSize);
            chunks.add(submitChunk(tasks, from, to, query, now));
        }

        List<SearchResult> results = new ArrayList<>();
        try {
            for (CompletableFuture<List<SearchResult>> chunk : chunks) {
                results.addAll(chunk.join());
            }
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("Parallel task scoring failed: {}", cause.getMessage(), cause);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Parallel task scoring failed", cause);
        }
        return results;
    }

    private CompletableFuture<List<SearchResult>> submitChunk(List<Task> tasks, int from, int to,
                                                              SearchQuery query, Instant now) {
        try {
            return CompletableFuture.supplyAsync(() -> scoreRange(tasks, from, to, query, now), scoringExecutor);
        } catch (RejectedExecutionException ex) {
            log.debug("Scoring executor saturated; scoring tasks {}..{} on caller thread", from, to);
            return CompletableFuture.completedFuture(scoreRange(tasks, from, to, query, now));
        }
    }

    private List<SearchResult> scoreRange(List<Task> tasks, int from, int to, SearchQuery query, Instant now) {
        List<SearchResult> results = new ArrayList<>();
        for (int i = from; i < to; i++) {
            scoringStrategy.scoreTask(tasks.get(i), query, now).ifPresent(results::add);
        }
        return results;
    }

    private static List<SearchResult> rank(List<SearchResult> results) {
        // List.sort is stable, so ties keep input order
        results.sort(BY_RELEVANCE_DESC);
        return List.copyOf(results);
    }
}

package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.model.DailyRecord;
import com.boxofficeintel.daily.model.FeatureVector;
import com.boxofficeintel.daily.model.MatchConfidence;
import com.boxofficeintel.daily.model.MatchResult;
import com.boxofficeintel.daily.model.MovieIdentity;
import com.boxofficeintel.daily.output.FeatureTableRouter;
import com.boxofficeintel.daily.output.RawRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Matches every stored record against a fresh catalog snapshot and rebuilds the feature table.
 *
 * The pass reads the raw store once, fans the per-movie aggregation out over a fixed pool and
 * writes the full table in movie-id order. Nothing is carried over from earlier passes, so the
 * same records and catalog always produce the same table.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeatureAggregationService {

    private static final Logger AUDIT = LoggerFactory.getLogger("match-audit");

    private final RawRecordStore store;
    private final CatalogLoader catalogLoader;
    private final MovieMatcher matcher;
    private final MovieFeatureAggregator aggregator;
    private final FeatureTableRouter router;
    private final BoxOfficeProperties properties;

    public AggregationSummary aggregateAll() {
        return aggregateAll(catalogLoader.load());
    }

    public AggregationSummary aggregateAll(MovieCatalog catalog) {
        List<DailyRecord> records = store.loadAll();
        log.info("Aggregating {} raw records", records.size());

        Map<String, MovieIdentity> movies = new TreeMap<>();
        Map<String, List<DailyRecord>> byMovie = new TreeMap<>();
        int exact = 0;
        int fuzzy = 0;
        int ambiguous = 0;
        int unmatched = 0;

        for (DailyRecord record : records) {
            MatchResult result = matcher.match(record, catalog);
            if (!result.isMatched()) {
                unmatched++;
                AUDIT.info("UNMATCHED date={} key={} title='{}' method={}",
                        result.recordDate(), result.recordKey(), record.getSourceTitle(), result.method());
                continue;
            }
            if (result.confidence() == MatchConfidence.EXACT) {
                exact++;
            } else {
                fuzzy++;
            }
            if (MatchResult.METHOD_AMBIGUOUS.equals(result.method())) {
                ambiguous++;
                AUDIT.info("AMBIGUOUS_RESOLVED date={} key={} title='{}' movie={}",
                        result.recordDate(), result.recordKey(), record.getSourceTitle(), result.movieId());
            }
            movies.putIfAbsent(result.movieId(), result.movie());
            byMovie.computeIfAbsent(result.movieId(), k -> new ArrayList<>()).add(record);
        }

        List<FeatureVector> vectors = aggregateInParallel(movies, byMovie);
        router.write(vectors);

        AggregationSummary summary = new AggregationSummary(
                records.size(), exact, fuzzy, ambiguous, unmatched, vectors.size());
        log.info("Aggregation complete: {}", summary);
        return summary;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<FeatureVector> aggregateInParallel(Map<String, MovieIdentity> movies,
                                                    Map<String, List<DailyRecord>> byMovie) {
        int workers = Math.max(1, properties.getAggregation().getWorkerThreads());
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<FeatureVector>> futures = new ArrayList<>();
            for (Map.Entry<String, List<DailyRecord>> entry : byMovie.entrySet()) {
                MovieIdentity movie = movies.get(entry.getKey());
                List<DailyRecord> movieRecords = List.copyOf(entry.getValue());
                futures.add(executor.submit(() -> aggregator.aggregate(movie, movieRecords)));
            }

            List<FeatureVector> vectors = new ArrayList<>(futures.size());
            for (Future<FeatureVector> future : futures) {
                vectors.add(future.get());
            }
            return vectors;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Aggregation interrupted", e);
        } catch (ExecutionException e) {
            log.error("Aggregation failed: {}", e.getCause().getMessage(), e.getCause());
            throw new IllegalStateException("Aggregation failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
}

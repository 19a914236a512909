package com.mouse.apex.service;

import com.mouse.apex.config.PipelineConfig;
import com.mouse.apex.enums.AnalysisMode;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.interfaces.PredictionCache;
import com.mouse.apex.manager.PredictionOrchestrator;
import com.mouse.apex.model.CacheEntry;
import com.mouse.apex.model.CacheKey;
import com.mouse.apex.model.DateFilter;
import com.mouse.apex.model.PipelineResult;
import com.mouse.apex.model.Prediction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cache-through entry point for predictions.
 * <p>
 * Freshness is checked here at read time. Concurrent misses on the same key each run
 * the pipeline and the last writer wins; no in-flight coalescing is done.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

    private final PredictionOrchestrator orchestrator;
    private final PredictionCache predictionCache;
    private final PipelineMetricsService metricsService;
    private final PipelineConfig pipelineConfig;
    private final Clock clock;

    /** Single best pick; an empty shortlist surfaces as NoHighValueFixturesException. */
    public Prediction getApexPrediction(SportEnum sport, DateFilter dateFilter) {
        return getResult(sport, dateFilter, AnalysisMode.BEST_PICK).getPredictions().get(0);
    }

    /** Every analysable fixture, best edge first; empty when nothing clears the scan. */
    public List<Prediction> getAllPredictions(SportEnum sport, DateFilter dateFilter) {
        return getResult(sport, dateFilter, AnalysisMode.ANALYZE_ALL).getPredictions();
    }

    public PipelineResult getResult(SportEnum sport, DateFilter dateFilter, AnalysisMode mode) {
        CacheKey key = CacheKey.of(sport, dateFilter, mode);
        Instant now = clock.instant();
        Duration ttl = ttl();

        Optional<CacheEntry<PipelineResult>> cached = predictionCache.get(key);
        if (cached.isPresent() && cached.get().isFresh(now, ttl)) {
            metricsService.recordCacheLookup(true);
            log.debug("CACHE_HIT | Key: {} | AgeSec: {}", key,
                    Duration.between(cached.get().timestamp(), now).toSeconds());
            return cached.get().payload();
        }

        metricsService.recordCacheLookup(false);
        log.info("CACHE_REFRESH | Key: {} | Reason: {}", key, cached.isPresent() ? "expired" : "miss");
        PipelineResult result = orchestrator.run(sport, dateFilter, mode);
        predictionCache.put(key, result);
        return result;
    }

    /** Recomputes and overwrites the entry regardless of freshness. */
    public PipelineResult refresh(SportEnum sport, DateFilter dateFilter, AnalysisMode mode) {
        CacheKey key = CacheKey.of(sport, dateFilter, mode);
        PipelineResult result = orchestrator.run(sport, dateFilter, mode);
        predictionCache.put(key, result);
        log.info("CACHE_REFRESH | Key: {} | Reason: forced | Predictions: {}", key, result.getPredictions().size());
        return result;
    }

    public int cachedResultCount() {
        return predictionCache.size();
    }

    private Duration ttl() {
        return Duration.ofSeconds(pipelineConfig.getCacheTtlSeconds());
    }
}

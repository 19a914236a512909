package com.mouse.apex.service;

import com.mouse.apex.interfaces.PredictionCache;
import com.mouse.apex.model.CacheEntry;
import com.mouse.apex.model.CacheKey;
import com.mouse.apex.model.PipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache. Entries are overwritten on the next put for the same key
 * and are never evicted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryPredictionCache implements PredictionCache {

    private final Clock clock;
    private final Map<CacheKey, CacheEntry<PipelineResult>> store = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry<PipelineResult>> get(CacheKey key) {
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public CacheEntry<PipelineResult> put(CacheKey key, PipelineResult payload) {
        CacheEntry<PipelineResult> entry = new CacheEntry<>(key, payload, clock.instant());
        CacheEntry<PipelineResult> previous = store.put(key, entry);
        log.debug("CACHE_PUT | Key: {} | Predictions: {} | Replaced: {}",
                key, payload.getPredictions().size(), previous != null);
        return entry;
    }

    @Override
    public int size() {
        return store.size();
    }
}

package com.mouse.apex.interfaces;

import com.mouse.apex.model.CacheEntry;
import com.mouse.apex.model.CacheKey;
import com.mouse.apex.model.PipelineResult;

import java.util.Optional;

/**
 * Storage for pipeline results. Expiry is the caller's concern: implementations store
 * and return entries with their timestamps and never evict on their own.
 */
public interface PredictionCache {

    Optional<CacheEntry<PipelineResult>> get(CacheKey key);

    CacheEntry<PipelineResult> put(CacheKey key, PipelineResult payload);

    /** Number of stored entries, stale ones included. */
    int size();
}

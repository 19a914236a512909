package com.mouse.apex.model;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<T>(CacheKey key, T payload, Instant timestamp) {

    public boolean isFresh(Instant now, Duration ttl) {
        return now.isBefore(timestamp.plus(ttl));
    }
}

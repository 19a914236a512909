package com.mouse.apex.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
public class PipelineConfig {

    // ==================== Concurrency ====================

    @Value("${prediction.thread.pool.size:8}")
    private int threadPoolSize;

    @Value("${prediction.collaborator.timeout.ms:10000}")
    private long collaboratorTimeoutMs;

    // ==================== Scan ====================

    /** Minimum initial edge (percentage points) for a fixture to be shortlisted. */
    @Value("${prediction.scan.edge.threshold:3.0}")
    private double scanEdgeThreshold;

    /** Win probability assumed for every fixture during the cheap scan. */
    @Value("${prediction.scan.assumed.probability:0.55}")
    private double scanAssumedProbability;

    @Value("${prediction.best-pick.top-n:3}")
    private int bestPickTopN;

    // ==================== Cache ====================

    @Value("${prediction.cache.ttl.seconds:300}")
    private long cacheTtlSeconds;

    @Value("${prediction.cache.warmup.enabled:false}")
    private boolean warmupEnabled;
}

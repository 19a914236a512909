package com.mouse.apex.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class PipelineMetricsService {

    private final AtomicInteger runs = new AtomicInteger(0);
    private final AtomicInteger failedRuns = new AtomicInteger(0);
    private final AtomicInteger fixturesAnalysed = new AtomicInteger(0);
    private final AtomicInteger fixturesDropped = new AtomicInteger(0);
    private final AtomicInteger collaboratorFailures = new AtomicInteger(0);
    private final AtomicInteger cacheHits = new AtomicInteger(0);
    private final AtomicInteger cacheMisses = new AtomicInteger(0);

    public void recordRun(boolean success) {
        runs.incrementAndGet();
        if (!success) {
            failedRuns.incrementAndGet();
        }
    }

    public void recordFixtures(int analysed, int dropped) {
        fixturesAnalysed.addAndGet(analysed);
        fixturesDropped.addAndGet(dropped);
    }

    public void recordCollaboratorFailure() {
        collaboratorFailures.incrementAndGet();
    }

    public void recordCacheLookup(boolean hit) {
        if (hit) {
            cacheHits.incrementAndGet();
        } else {
            cacheMisses.incrementAndGet();
        }
    }

    public Map<String, Object> getMetrics() {
        int total = runs.get();
        int lookups = cacheHits.get() + cacheMisses.get();
        int fixtures = fixturesAnalysed.get() + fixturesDropped.get();

        return Map.of(
                "runs", total,
                "failedRuns", failedRuns.get(),
                "fixturesAnalysed", fixturesAnalysed.get(),
                "fixturesDropped", fixturesDropped.get(),
                "dropRate", fixtures > 0 ? (fixturesDropped.get() * 100.0 / fixtures) : 0.0,
                "collaboratorFailures", collaboratorFailures.get(),
                "cacheHits", cacheHits.get(),
                "cacheMisses", cacheMisses.get(),
                "cacheHitRate", lookups > 0 ? (cacheHits.get() * 100.0 / lookups) : 0.0
        );
    }

    @Scheduled(fixedRate = 300000)
    public void logMetrics() {
        Map<String, Object> metrics = getMetrics();
        log.info("📊 Pipeline Metrics: {}", metrics);

        double dropRate = (double) metrics.get("dropRate");
        if (dropRate > 20.0) {
            log.warn("⚠️ HIGH FIXTURE DROP RATE: {}%", String.format("%.2f", dropRate));
        }
    }
}

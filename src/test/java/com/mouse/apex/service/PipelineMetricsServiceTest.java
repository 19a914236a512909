package com.mouse.apex.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMetricsServiceTest {

    private final PipelineMetricsService metrics = new PipelineMetricsService();

    @Test
    void getMetrics_aggregatesCountersAndRates() {
        metrics.recordRun(true);
        metrics.recordRun(false);
        metrics.recordFixtures(3, 1);
        metrics.recordCollaboratorFailure();
        metrics.recordCacheLookup(true);
        metrics.recordCacheLookup(true);
        metrics.recordCacheLookup(false);
        metrics.recordCacheLookup(false);

        Map<String, Object> snapshot = metrics.getMetrics();

        assertThat(snapshot)
                .containsEntry("runs", 2)
                .containsEntry("failedRuns", 1)
                .containsEntry("fixturesAnalysed", 3)
                .containsEntry("fixturesDropped", 1)
                .containsEntry("collaboratorFailures", 1)
                .containsEntry("dropRate", 25.0)
                .containsEntry("cacheHitRate", 50.0);
    }

    @Test
    void getMetrics_noActivity_ratesAreZero() {
        assertThat(metrics.getMetrics()).containsEntry("dropRate", 0.0).containsEntry("cacheHitRate", 0.0);
    }
}

package com.mouse.apex.model;

import com.mouse.apex.enums.AnalysisMode;
import com.mouse.apex.enums.PipelineState;
import com.mouse.apex.enums.SportEnum;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Telemetry for one pipeline run. */
@Value
@Builder(toBuilder = true)
public class PipelineReport {
    String runId;
    AnalysisMode mode;
    SportEnum sport;
    String dateFilter;
    PipelineState state;
    List<String> sources;
    int fixturesScanned;
    int shortlisted;
    int analysed;
    int dropped;
    boolean signalAggregatorAvailable;
    boolean matchDataAvailable;
    Instant startedAt;
    Instant completedAt;
}

package com.mouse.apex.controller;

import com.mouse.apex.adapter.OddsApiRequestCounter;
import com.mouse.apex.enums.AnalysisMode;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.NoHighValueFixturesException;
import com.mouse.apex.model.DateFilter;
import com.mouse.apex.model.PipelineReport;
import com.mouse.apex.model.PipelineResult;
import com.mouse.apex.service.PipelineMetricsService;
import com.mouse.apex.service.PredictionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PredictionControllerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    @Mock
    PredictionService predictionService;

    private OddsApiRequestCounter requestCounter;
    private PredictionController controller;

    @BeforeEach
    void setup() {
        requestCounter = new OddsApiRequestCounter(500);
        controller = new PredictionController(predictionService, new PipelineMetricsService(), requestCounter,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void getAllPredictions_emptyResultCarriesMessageAndClockTimestamp() {
        PipelineResult empty = new PipelineResult(List.of(), PipelineReport.builder().runId("r1").build());
        when(predictionService.getResult(SportEnum.BASKETBALL, DateFilter.parse("today"), AnalysisMode.ANALYZE_ALL))
                .thenReturn(empty);

        ResponseEntity<Map<String, Object>> response = controller.getAllPredictions("basketball", "today");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("count", 0)
                .containsEntry("timestamp", NOW)
                .containsKey("message");
    }

    @Test
    void getApexPick_unknownSport_rejected() {
        assertThatThrownBy(() -> controller.getApexPick("curling", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported sport: curling");
    }

    @Test
    void getMetrics_includesQuotaAndCacheSize() {
        when(predictionService.cachedResultCount()).thenReturn(3);
        requestCounter.tryAcquire();

        Map<String, Object> body = controller.getMetrics().getBody();

        assertThat(body)
                .containsEntry("cachedResults", 3)
                .containsEntry("oddsApiRequestsUsed", 1)
                .containsEntry("oddsApiRequestsRemaining", 499)
                .containsEntry("timestamp", NOW)
                .containsKey("runs");
    }

    @Test
    void healthCheck_usesInjectedClock() {
        assertThat(controller.healthCheck().getBody())
                .containsEntry("status", "UP")
                .containsEntry("timestamp", NOW);
    }

    @Test
    void handleNoFixtures_mapsToNotFound() {
        ResponseEntity<Map<String, Object>> response = controller.handleNoFixtures(
                new NoHighValueFixturesException("No high-value fixtures found for Football"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody())
                .containsEntry("error", "No high-value fixtures found for Football")
                .containsEntry("status", 404)
                .containsEntry("timestamp", NOW);
    }
}

package com.mouse.apex.controller;

import com.mouse.apex.adapter.OddsApiRequestCounter;
import com.mouse.apex.enums.AnalysisMode;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.NoHighValueFixturesException;
import com.mouse.apex.exception.PredictionPipelineException;
import com.mouse.apex.model.DateFilter;
import com.mouse.apex.model.PipelineResult;
import com.mouse.apex.service.PipelineMetricsService;
import com.mouse.apex.service.PredictionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/predictions")
public class PredictionController {

    private final PredictionService predictionService;
    private final PipelineMetricsService metricsService;
    private final OddsApiRequestCounter requestCounter;
    private final Clock clock;

    /**
     * Best pick for a sport.
     *
     * @param sport sport name, e.g. Football or soccer. Default: Football
     * @param date  today, tomorrow, upcoming, past, all or yyyy-MM-dd. Default: all
     */
    @GetMapping("/apex")
    public ResponseEntity<Map<String, Object>> getApexPick(
            @RequestParam(defaultValue = "Football") String sport,
            @RequestParam(required = false) String date
    ) {
        log.info("GET /api/v1/predictions/apex - sport={}, date={}", sport, date);
        SportEnum sportEnum = parseSport(sport);
        PipelineResult result = predictionService.getResult(sportEnum, DateFilter.parse(date), AnalysisMode.BEST_PICK);

        Map<String, Object> response = new HashMap<>();
        response.put("prediction", result.best().orElse(null));
        response.put("report", result.getReport());
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    /**
     * Every analysable fixture, best edge first.
     */
    @GetMapping("/all")
    public ResponseEntity<Map<String, Object>> getAllPredictions(
            @RequestParam(defaultValue = "Football") String sport,
            @RequestParam(required = false) String date
    ) {
        log.info("GET /api/v1/predictions/all - sport={}, date={}", sport, date);
        SportEnum sportEnum = parseSport(sport);
        PipelineResult result = predictionService.getResult(sportEnum, DateFilter.parse(date), AnalysisMode.ANALYZE_ALL);

        Map<String, Object> response = new HashMap<>();
        response.put("predictions", result.getPredictions());
        response.put("count", result.getPredictions().size());
        response.put("report", result.getReport());
        response.put("timestamp", clock.instant());
        if (result.getPredictions().isEmpty()) {
            response.put("message", "No fixtures cleared the edge threshold");
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> getMetrics() {
        Map<String, Object> response = new HashMap<>(metricsService.getMetrics());
        response.put("oddsApiRequestsUsed", requestCounter.getUsed());
        response.put("oddsApiRequestsRemaining", requestCounter.getRemaining());
        response.put("cachedResults", predictionService.cachedResultCount());
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> status = new HashMap<>();
        status.put("status", "UP");
        status.put("timestamp", clock.instant());
        return ResponseEntity.ok(status);
    }

    @ExceptionHandler(NoHighValueFixturesException.class)
    public ResponseEntity<Map<String, Object>> handleNoFixtures(NoHighValueFixturesException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(PredictionPipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineFailure(PredictionPipelineException e) {
        log.error("Prediction request failed: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static SportEnum parseSport(String sport) {
        return SportEnum.fromName(sport)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported sport: " + sport));
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        body.put("status", status.value());
        body.put("timestamp", clock.instant());
        return ResponseEntity.status(status).body(body);
    }
}

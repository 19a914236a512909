package com.mouse.apex.controller;

import com.mouse.apex.enums.FixtureStatus;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.CollaboratorUnavailableException;
import com.mouse.apex.model.DateFilter;
import com.mouse.apex.model.FixtureListing;
import com.mouse.apex.service.FixtureListingService;
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
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/fixtures")
public class FixtureController {

    private final FixtureListingService fixtureListingService;
    private final Clock clock;

    /**
     * Lists fixtures the odds source currently quotes.
     *
     * @param sport  sport name, or All. Default: All
     * @param league exact league name
     * @param status upcoming, live or finished
     * @param date   today, tomorrow, upcoming, past, all or yyyy-MM-dd. Default: all
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listFixtures(
            @RequestParam(required = false) String sport,
            @RequestParam(required = false) String league,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String date,
            @RequestParam(defaultValue = "" + FixtureListingService.DEFAULT_LIMIT) int limit,
            @RequestParam(defaultValue = "0") int offset
    ) {
        log.info("GET /api/v1/fixtures - sport={}, league={}, status={}, date={}, limit={}, offset={}",
                sport, league, status, date, limit, offset);
        FixtureListing listing = fixtureListingService.list(parseSport(sport), league, parseStatus(status),
                DateFilter.parse(date), limit, offset);

        Map<String, Object> response = new HashMap<>();
        response.put("fixtures", listing.getFixtures());
        response.put("total", listing.getTotal());
        response.put("filteredCount", listing.getFilteredCount());
        response.put("limit", listing.getLimit());
        response.put("offset", listing.getOffset());
        response.put("dateRange", listing.getDateRange());
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(CollaboratorUnavailableException e) {
        log.error("Fixture listing failed: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static SportEnum parseSport(String sport) {
        if (sport == null || sport.isBlank() || "all".equalsIgnoreCase(sport.trim())) {
            return null;
        }
        return SportEnum.fromName(sport)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported sport: " + sport));
    }

    private static FixtureStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return FixtureStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported status: " + status, e);
        }
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        body.put("status", status.value());
        body.put("timestamp", clock.instant());
        return ResponseEntity.status(status).body(body);
    }
}

package com.mouse.apex.service;

import com.mouse.apex.enums.FixtureStatus;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.CollaboratorUnavailableException;
import com.mouse.apex.interfaces.OddsSourceAdapter;
import com.mouse.apex.model.DateFilter;
import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.FixtureListing;
import com.mouse.apex.model.OddsQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Fixture browsing over whatever the odds source currently quotes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FixtureListingService {

    public static final int DEFAULT_LIMIT = 100;
    static final int EMPTY_RANGE_DAYS = 2;

    private final OddsSourceAdapter oddsSourceAdapter;
    private final Clock clock;

    /**
     * Filters, sorts by kickoff (unknown kickoffs last) and pages the fixtures.
     *
     * @param sport      sport to list, or null for every sport
     * @param league     exact league name, case-insensitive, or null
     * @param status     fixture status, or null
     * @param dateFilter kickoff filter
     * @throws CollaboratorUnavailableException when a single requested sport cannot be fetched
     * @throws IllegalArgumentException         for a negative limit or offset
     */
    public FixtureListing list(SportEnum sport, String league, FixtureStatus status, DateFilter dateFilter,
                               int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        List<Fixture> all = fetch(sport);

        List<Fixture> filtered = all.stream()
                .filter(f -> league == null || league.isBlank() || league.trim().equalsIgnoreCase(f.getLeague()))
                .filter(f -> status == null || status == f.getStatus())
                .filter(f -> dateFilter.matches(f.getKickoff(), clock))
                .sorted(Comparator.comparing(Fixture::getKickoff, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

        List<Fixture> page = filtered.stream().skip(offset).limit(limit).toList();
        log.info("Fixtures listed | Sport: {} | League: {} | Status: {} | Filter: {} | Total: {} | Filtered: {} | Page: {}",
                sport != null ? sport : "ALL", league, status, dateFilter, all.size(), filtered.size(), page.size());

        return FixtureListing.builder()
                .fixtures(page)
                .total(all.size())
                .filteredCount(filtered.size())
                .limit(limit)
                .offset(offset)
                .dateRange(dateRange(filtered))
                .build();
    }

    private List<Fixture> fetch(SportEnum sport) {
        if (sport != null) {
            return fixtures(oddsSourceAdapter.getOdds(sport));
        }
        List<Fixture> fixtures = new ArrayList<>();
        for (SportEnum each : SportEnum.values()) {
            try {
                fixtures.addAll(fixtures(oddsSourceAdapter.getOdds(each)));
            } catch (CollaboratorUnavailableException e) {
                log.warn("Skipping sport in fixture listing | Sport: {} | Error: {}", each, e.getMessage());
            }
        }
        return fixtures;
    }

    private static List<Fixture> fixtures(List<OddsQuote> quotes) {
        return quotes.stream().map(OddsQuote::getFixture).filter(Objects::nonNull).toList();
    }

    /**
     * Kickoff days of the first and last listed fixtures; today through two days
     * ahead when nothing matched.
     */
    private FixtureListing.DateRange dateRange(List<Fixture> filtered) {
        List<LocalDate> days = filtered.stream()
                .map(Fixture::getKickoff)
                .filter(Objects::nonNull)
                .map(k -> LocalDate.ofInstant(k, ZoneOffset.UTC))
                .toList();
        if (days.isEmpty()) {
            LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
            return new FixtureListing.DateRange(today, today.plusDays(EMPTY_RANGE_DAYS));
        }
        return new FixtureListing.DateRange(days.get(0), days.get(days.size() - 1));
    }
}

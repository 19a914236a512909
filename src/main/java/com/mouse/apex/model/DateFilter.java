package com.mouse.apex.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Kickoff filter: {@code all}, {@code today}, {@code tomorrow}, {@code upcoming},
 * {@code past} or an ISO date. Calendar days are UTC.
 */
@Getter
@EqualsAndHashCode
public final class DateFilter {

    public static final String ALL = "all";
    public static final String TODAY = "today";
    public static final String TOMORROW = "tomorrow";
    public static final String UPCOMING = "upcoming";
    public static final String PAST = "past";

    private final String value;
    @EqualsAndHashCode.Exclude
    private final LocalDate date;

    private DateFilter(String value, LocalDate date) {
        this.value = value;
        this.date = date;
    }

    public static DateFilter all() {
        return new DateFilter(ALL, null);
    }

    /**
     * @throws IllegalArgumentException for anything that is neither a keyword nor a date
     */
    public static DateFilter parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return all();
        }
        String value = raw.trim().toLowerCase();
        switch (value) {
            case ALL, TODAY, TOMORROW, UPCOMING, PAST -> {
                return new DateFilter(value, null);
            }
            default -> {
                try {
                    LocalDate date = LocalDate.parse(value);
                    return new DateFilter(date.toString(), date);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Unsupported date filter: " + raw, e);
                }
            }
        }
    }

    public boolean matches(Instant kickoff, Clock clock) {
        if (ALL.equals(value)) {
            return true;
        }
        if (kickoff == null) {
            return false;
        }
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        LocalDate kickoffDay = LocalDate.ofInstant(kickoff, ZoneOffset.UTC);
        return switch (value) {
            case TODAY -> kickoffDay.equals(today);
            case TOMORROW -> kickoffDay.equals(today.plusDays(1));
            case UPCOMING -> kickoff.isAfter(now);
            case PAST -> kickoff.isBefore(now);
            default -> kickoffDay.equals(date);
        };
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.mouse.apex.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * One page of fixtures. {@code total} counts every fixture fetched before filtering,
 * {@code filteredCount} those that passed the filters.
 */
@Value
@Builder
public class FixtureListing {
    List<Fixture> fixtures;
    int total;
    int filteredCount;
    int limit;
    int offset;
    DateRange dateRange;

    public record DateRange(LocalDate from, LocalDate to) {
    }
}

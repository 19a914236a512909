package com.mouse.apex.model;

import com.mouse.apex.enums.AnalysisMode;
import com.mouse.apex.enums.SportEnum;

public record CacheKey(SportEnum sport, String dateFilter, AnalysisMode mode) {

    public static CacheKey of(SportEnum sport, DateFilter dateFilter, AnalysisMode mode) {
        return new CacheKey(sport, dateFilter.getValue(), mode);
    }
}

package com.mouse.apex.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Categories of contextual signals. The default weight is the share (out of 100)
 * a category carries when the aggregator has no reason to choose another.
 */
@Getter
@RequiredArgsConstructor
public enum FactorCategory {
    TACTICAL("Tactical", 35.0),
    FORM("Form", 25.0),
    SITUATIONAL("Situational", 20.0),
    PSYCHOLOGICAL("Psychological", 10.0),
    ENVIRONMENTAL("Environmental", 10.0),
    SOCIAL("Social", 5.0),
    REFEREE("Referee", 5.0),
    BETTING_MARKET("Betting Market", 8.0),
    VENUE("Venue", 7.0),
    FATIGUE("Fatigue", 5.0),
    ADVANCED("Advanced", 25.0);

    private final String displayName;
    private final double defaultWeight;

    /** Categories whose strong signals raise the factor-alignment confidence. */
    public boolean isCore() {
        return this == TACTICAL || this == FORM || this == SITUATIONAL;
    }
}

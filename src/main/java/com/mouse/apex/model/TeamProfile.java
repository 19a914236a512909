package com.mouse.apex.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-game team averages. Any field may be null when the provider has no data for it.
 */
@Value
@Builder(toBuilder = true)
public class TeamProfile {
    String name;
    Double possession;
    Double cornersPerGame;
    Double yellowCardsPerGame;
    Double redCardsPerGame;
    Double foulsPerGame;
    Integer wins;
    Integer draws;
    Integer losses;

    public static TeamProfile unknown(String name) {
        return TeamProfile.builder().name(name).build();
    }

    public boolean hasRecord() {
        return wins != null && losses != null;
    }
}

package com.mouse.apex.model;

import com.mouse.apex.enums.LeagueType;
import com.mouse.apex.enums.Popularity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class LeagueMetadata {
    String name;
    String displayName;
    String country;
    String region;
    /** e.g. "1st Division", "Cup", "International". */
    String tier;
    LeagueType type;
    String sport;
    Popularity popularity;

    public static LeagueMetadata unknown(String leagueName) {
        String name = leagueName == null || leagueName.isBlank() ? "Unknown" : leagueName;
        return LeagueMetadata.builder()
                .name(name)
                .displayName(name)
                .country("Unknown")
                .region("Unknown")
                .tier("Unknown")
                .type(LeagueType.LEAGUE)
                .sport("Unknown")
                .popularity(Popularity.LOW)
                .build();
    }
}

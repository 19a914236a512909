package com.mouse.apex.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum SportEnum {
    FOOTBALL("Football", "soccer", "soccer_epl", true),

    BASKETBALL("Basketball", "basketball", "basketball_nba", false),

    HOCKEY("Hockey", "icehockey", "icehockey_nhl", false),

    TENNIS("Tennis", "tennis", "tennis_atp", false);

    private final String name;
    /** Sport group prefix used by The Odds API sport keys. */
    private final String oddsApiGroup;
    /** Default competition requested from The Odds API. */
    private final String oddsApiSportKey;
    /** Whether the sport's match-winner market has a draw outcome. */
    private final boolean threeWay;

    /**
     * Get Sport enum from name (case-insensitive). Accepts both the display name
     * and the odds-api group, so "soccer" resolves to FOOTBALL.
     * @param name the sport name
     * @return Optional containing the Sport if found
     */
    public static Optional<SportEnum> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(SportEnum.values())
                .filter(sport -> sport.getName().equalsIgnoreCase(trimmed)
                        || sport.getOddsApiGroup().equalsIgnoreCase(trimmed)
                        || sport.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}

package com.mouse.apex.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class MatchContext {
    TeamProfile home;
    TeamProfile away;
    boolean strictReferee;
    String venue;
    /** False when the context was built from defaults because the provider failed. */
    boolean available;

    public static MatchContext unavailable(Fixture fixture) {
        return MatchContext.builder()
                .home(TeamProfile.unknown(fixture.getHomeTeam()))
                .away(TeamProfile.unknown(fixture.getAwayTeam()))
                .available(false)
                .build();
    }
}

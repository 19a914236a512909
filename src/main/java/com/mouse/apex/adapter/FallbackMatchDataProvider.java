package com.mouse.apex.adapter;

import com.mouse.apex.interfaces.MatchDataProvider;
import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.MatchContext;
import com.mouse.apex.model.TeamProfile;
import org.springframework.stereotype.Component;

/**
 * Used when no statistics feed is wired in: every team profile is empty, so the
 * specialty markets fall back to league-average defaults.
 */
@Component
public class FallbackMatchDataProvider implements MatchDataProvider {

    @Override
    public MatchContext getMatchContext(Fixture fixture) {
        return MatchContext.builder()
                .home(TeamProfile.unknown(fixture.getHomeTeam()))
                .away(TeamProfile.unknown(fixture.getAwayTeam()))
                .strictReferee(false)
                .available(true)
                .build();
    }
}

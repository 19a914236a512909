package com.mouse.apex.model;

import com.mouse.apex.enums.FixtureStatus;
import com.mouse.apex.enums.SportEnum;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Fixture {
    String id;
    SportEnum sport;
    String league;
    String homeTeam;
    String awayTeam;
    Instant kickoff;
    FixtureStatus status;

    public String getMatchLabel() {
        return homeTeam + " vs " + awayTeam;
    }
}

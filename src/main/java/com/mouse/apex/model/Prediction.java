package com.mouse.apex.model;

import com.mouse.apex.enums.SportEnum;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class Prediction {
    String id;
    SportEnum sport;
    String league;
    LeagueMetadata leagueInfo;
    String match;
    String homeTeam;
    String awayTeam;
    Instant kickoff;

    // Headline fields mirror the primary market
    String betType;
    double bestOdds;
    String bookmaker;
    double edge;
    /** Factor-alignment confidence on a 0-10 scale. */
    double confidence;
    double expectedValue;

    TrueProbability trueProbability;
    List<MarketQuote> markets;
    MarketQuote primaryMarket;

    Narrative narrative;
    List<String> keyFeatures;
    RiskAssessment riskAssessment;
    ContingencyPick contingencyPick;

    int totalDataSources;
    List<String> mainDataSources;
    String predictionStability;
    Instant timestamp;
}

package com.mouse.apex.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the deep-dive learned about one fixture. Built on a worker thread and
 * handed back to the orchestrator; never shared between fixtures.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisBundle {
    Fixture fixture;
    OddsQuote quote;
    List<FactorObservation> signals;
    MatchContext matchContext;
    TrueProbability trueProbability;
    double factorConfidence;
    List<MarketQuote> markets;
    MarketQuote primaryMarket;
    double expectedValue;
    boolean signalsAvailable;
    boolean matchDataAvailable;
}

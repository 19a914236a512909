package com.mouse.apex.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Inputs shared by every pricing strategy for one fixture.
 */
@Value
@Builder(toBuilder = true)
public class PricingContext {
    Fixture fixture;
    OddsQuote quote;
    TrueProbability trueProbability;
    MatchContext matchContext;
    /** Adjusted match-winner probabilities; null for two-way sports. */
    ProbabilityTriple moneylineTriple;
    List<String> sources;

    public boolean isThreeWay() {
        return moneylineTriple != null;
    }
}

package com.mouse.apex.model;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.MarketLiquidity;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One priced betting line. Probabilities and edge are percentages; edge is always
 * calculated minus implied.
 */
@Value
@Builder(toBuilder = true)
public class MarketQuote {
    String id;
    MarketCategory category;
    String selection;
    Double line;
    double odds;
    String bookmaker;
    MarketLiquidity marketLiquidity;
    CalculatedProbability calculatedProbability;
    double impliedProbability;
    double edge;
    double confidenceScore;
    RecommendedStake recommendedStake;
    List<String> dataSources;
}

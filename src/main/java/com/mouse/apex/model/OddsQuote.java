package com.mouse.apex.model;

import com.mouse.apex.enums.MarketLiquidity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One bookmaker's prices for a fixture, with the list of sources that agree on them.
 */
@Value
@Builder(toBuilder = true)
public class OddsQuote {

    public static final double DEFAULT_SELECTION_ODDS = 2.0;

    Fixture fixture;
    String bookmaker;
    MoneylinePrices moneyline;
    SpreadPrice spread;
    TotalsPrices totals;
    MarketLiquidity liquidity;
    @Singular
    List<String> sources;

    /** Price of the headline selection: spread, else home moneyline, else evens. */
    public double getSelectionOdds() {
        if (spread != null) {
            return spread.odds();
        }
        if (moneyline != null) {
            return moneyline.home();
        }
        return DEFAULT_SELECTION_ODDS;
    }
}

package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.interfaces.MarketPricingStrategy;
import com.mouse.apex.model.CalculatedProbability;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityPair;
import com.mouse.apex.utils.ConfidenceScorer;
import com.mouse.apex.utils.FairOddsConverter;
import com.mouse.apex.utils.ProbabilityNormalizer;
import com.mouse.apex.utils.StakeSizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.mouse.apex.utils.NumberUtils.round1;
import static com.mouse.apex.utils.NumberUtils.round2;

/**
 * Shared quote assembly: implied probability, edge, confidence, stake and provenance
 * are derived the same way for every market.
 */
public abstract class AbstractPricingStrategy implements MarketPricingStrategy {

    static final double CALIBRATION_HALF_WIDTH = 5.0;
    static final double MIN_ODDS = 1.01;

    protected MarketQuote quote(PricingContext context, String selection, Double line, double odds,
                                double calculatedProbability, MarketLiquidity liquidity, String sourceLabel) {
        double price = round2(Math.max(MIN_ODDS, odds));
        double calculated = round1(calculatedProbability);
        double implied = round1(FairOddsConverter.impliedProbability(price));
        double edge = round1(calculated - implied);

        List<String> sources = new ArrayList<>(context.getSources());
        if (sourceLabel != null && !sources.contains(sourceLabel)) {
            sources.add(sourceLabel);
        }

        String id = marketId(context, selection);
        return MarketQuote.builder()
                .id(id)
                .category(category())
                .selection(selection)
                .line(line)
                .odds(price)
                .bookmaker(context.getQuote().getBookmaker())
                .marketLiquidity(liquidity)
                .calculatedProbability(new CalculatedProbability(calculated,
                        new CalculatedProbability.CalibratedRange(
                                round1(Math.max(0.0, calculated - CALIBRATION_HALF_WIDTH)),
                                round1(Math.min(100.0, calculated + CALIBRATION_HALF_WIDTH)))))
                .impliedProbability(implied)
                .edge(edge)
                .confidenceScore(ConfidenceScorer.score(edge, calculated, liquidity, sources.size(), id))
                .recommendedStake(StakeSizer.recommend(calculated, price))
                .dataSources(List.copyOf(sources))
                .build();
    }

    /**
     * Price for a synthesized market: the fair price shortened by a bookmaker-style margin.
     * Formula: odds = 100 / (probability * (1 + margin))
     */
    protected static double marginPrice(double probability, double margin) {
        if (probability <= 0) {
            throw new IllegalArgumentException("Cannot price a market with probability " + probability);
        }
        return Math.max(MIN_ODDS, 100.0 / (probability * (1.0 + margin)));
    }

    /**
     * Over and under legs of a synthesized line, both priced with the same margin.
     */
    protected List<MarketQuote> overUnderQuotes(PricingContext context, String market, double line,
                                                double overProbability, double margin, String sourceLabel) {
        ProbabilityPair pair = ProbabilityNormalizer.normalize(
                new ProbabilityPair(overProbability, 100.0 - overProbability));
        return List.of(
                quote(context, String.format("%s Over %.1f", market, line), line,
                        marginPrice(pair.option1(), margin), pair.option1(), MarketLiquidity.LOW, sourceLabel),
                quote(context, String.format("%s Under %.1f", market, line), line,
                        marginPrice(pair.option2(), margin), pair.option2(), MarketLiquidity.LOW, sourceLabel));
    }

    protected MarketLiquidity liquidityOr(PricingContext context, MarketLiquidity fallback) {
        MarketLiquidity quoted = context.getQuote().getLiquidity();
        return quoted != null ? quoted : fallback;
    }

    private String marketId(PricingContext context, String selection) {
        String slug = selection.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9.+-]+", "-");
        return context.getFixture().getId() + ":" + category().getKey() + ":" + slug;
    }
}

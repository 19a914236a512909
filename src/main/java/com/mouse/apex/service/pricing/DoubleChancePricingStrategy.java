package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.MoneylinePrices;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityTriple;
import com.mouse.apex.utils.ProbabilityNormalizer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.mouse.apex.utils.NumberUtils.clamp;

/**
 * 1X, X2 and 12 built from the match-winner legs.
 */
@Component
@Order(5)
public class DoubleChancePricingStrategy extends AbstractPricingStrategy {

    static final double MARGIN = 0.05;
    static final String SOURCE_LABEL = "Double chance from match odds";

    @Override
    public MarketCategory category() {
        return MarketCategory.DOUBLE_CHANCE;
    }

    @Override
    public boolean supports(PricingContext context) {
        MoneylinePrices prices = context.getQuote().getMoneyline();
        return context.isThreeWay() && prices != null && prices.hasDraw();
    }

    @Override
    public List<MarketQuote> price(PricingContext context) {
        ProbabilityTriple p = context.getMoneylineTriple();
        MoneylinePrices odds = context.getQuote().getMoneyline();
        String home = context.getFixture().getHomeTeam();
        String away = context.getFixture().getAwayTeam();

        return List.of(
                leg(context, home + " or Draw", p.home() + p.draw(), odds.home(), odds.draw()),
                leg(context, "Draw or " + away, p.draw() + p.away(), odds.draw(), odds.away()),
                leg(context, home + " or " + away, p.home() + p.away(), odds.home(), odds.away()));
    }

    /**
     * Combined price of backing both legs, shortened by the margin.
     * Formula: odds = (1 / (1/a + 1/b)) / (1 + margin)
     */
    static double combinedOdds(double first, double second) {
        double harmonic = 1.0 / (1.0 / first + 1.0 / second);
        return harmonic / (1.0 + MARGIN);
    }

    private MarketQuote leg(PricingContext context, String selection, double probability,
                            double firstOdds, double secondOdds) {
        double bounded = clamp(probability, ProbabilityNormalizer.MIN_PROB, ProbabilityNormalizer.MAX_PROB);
        return quote(context, selection, null, combinedOdds(firstOdds, secondOdds), bounded,
                MarketLiquidity.MEDIUM, SOURCE_LABEL);
    }
}

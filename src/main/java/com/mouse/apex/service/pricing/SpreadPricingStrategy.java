package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.SpreadPrice;
import com.mouse.apex.utils.ProbabilityNormalizer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.mouse.apex.utils.NumberUtils.clamp;

/**
 * Home handicap only; the bookmaker's spread quote is single-sided.
 */
@Component
@Order(2)
public class SpreadPricingStrategy extends AbstractPricingStrategy {

    static final double POINTS_PER_LINE_UNIT = 2.0;

    @Override
    public MarketCategory category() {
        return MarketCategory.SPREAD;
    }

    @Override
    public boolean supports(PricingContext context) {
        return context.getQuote().getSpread() != null;
    }

    /**
     * Formula: p = clamp(trueProb * 100 + line * 2, 5, 95)
     */
    @Override
    public List<MarketQuote> price(PricingContext context) {
        SpreadPrice spread = context.getQuote().getSpread();
        double probability = clamp(context.getTrueProbability().capped() * 100.0 + spread.line() * POINTS_PER_LINE_UNIT,
                ProbabilityNormalizer.MIN_PROB, ProbabilityNormalizer.MAX_PROB);
        String selection = String.format("%s %+.1f", context.getFixture().getHomeTeam(), spread.line());
        return List.of(quote(context, selection, spread.line(), spread.odds(), probability,
                liquidityOr(context, MarketLiquidity.MEDIUM), null));
    }
}

package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.MoneylinePrices;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityTriple;
import com.mouse.apex.utils.FairOddsConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * First-half result. Sides drift out and the draw shortens relative to full time,
 * and the model's edge carries over at reduced strength.
 */
@Component
@Order(6)
public class FirstHalfPricingStrategy extends AbstractPricingStrategy {

    static final double SIDE_ODDS_FACTOR = 1.3;
    static final double DRAW_ODDS_FACTOR = 0.7;
    static final double ADJUSTMENT_FACTOR = 0.6;
    static final String SOURCE_LABEL = "First half model";

    @Override
    public MarketCategory category() {
        return MarketCategory.FIRST_HALF;
    }

    @Override
    public boolean supports(PricingContext context) {
        MoneylinePrices prices = context.getQuote().getMoneyline();
        return context.isThreeWay() && prices != null && prices.hasDraw();
    }

    @Override
    public List<MarketQuote> price(PricingContext context) {
        MoneylinePrices full = context.getQuote().getMoneyline();
        double home = Math.max(MIN_ODDS, full.home() * SIDE_ODDS_FACTOR);
        double draw = Math.max(MIN_ODDS, full.draw() * DRAW_ODDS_FACTOR);
        double away = Math.max(MIN_ODDS, full.away() * SIDE_ODDS_FACTOR);

        ProbabilityTriple p = FairOddsConverter.threeWay(home, draw, away,
                context.getTrueProbability().adjustment() * ADJUSTMENT_FACTOR);

        return List.of(
                quote(context, "1st Half - " + context.getFixture().getHomeTeam(), null, home, p.home(),
                        MarketLiquidity.MEDIUM, SOURCE_LABEL),
                quote(context, "1st Half - Draw", null, draw, p.draw(), MarketLiquidity.MEDIUM, SOURCE_LABEL),
                quote(context, "1st Half - " + context.getFixture().getAwayTeam(), null, away, p.away(),
                        MarketLiquidity.MEDIUM, SOURCE_LABEL));
    }
}

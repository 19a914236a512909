package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.MoneylinePrices;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityPair;
import com.mouse.apex.model.ProbabilityTriple;
import com.mouse.apex.utils.FairOddsConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(1)
public class MoneylinePricingStrategy extends AbstractPricingStrategy {

    static final double SYNTHETIC_DRAW_MARGIN = 0.05;

    @Override
    public MarketCategory category() {
        return MarketCategory.MONEYLINE;
    }

    @Override
    public boolean supports(PricingContext context) {
        return context.getQuote().getMoneyline() != null;
    }

    @Override
    public List<MarketQuote> price(PricingContext context) {
        MoneylinePrices prices = context.getQuote().getMoneyline();
        Fixture fixture = context.getFixture();
        MarketLiquidity liquidity = liquidityOr(context, MarketLiquidity.HIGH);

        if (context.isThreeWay()) {
            ProbabilityTriple triple = context.getMoneylineTriple();
            String drawLabel = prices.hasDraw() ? null : "Default draw model";
            double drawOdds = prices.hasDraw()
                    ? prices.draw()
                    : marginPrice(triple.draw(), SYNTHETIC_DRAW_MARGIN);
            return List.of(
                    quote(context, fixture.getHomeTeam() + " Win", null, prices.home(), triple.home(), liquidity, null),
                    quote(context, "Draw", null, drawOdds, triple.draw(), liquidity, drawLabel),
                    quote(context, fixture.getAwayTeam() + " Win", null, prices.away(), triple.away(), liquidity, null));
        }

        ProbabilityPair pair = FairOddsConverter.twoWay(prices.home(), prices.away(),
                context.getTrueProbability().adjustment());
        return List.of(
                quote(context, fixture.getHomeTeam() + " Win", null, prices.home(), pair.option1(), liquidity, null),
                quote(context, fixture.getAwayTeam() + " Win", null, prices.away(), pair.option2(), liquidity, null));
    }
}

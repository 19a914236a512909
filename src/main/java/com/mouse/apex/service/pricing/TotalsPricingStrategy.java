package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityPair;
import com.mouse.apex.model.TotalsPrices;
import com.mouse.apex.utils.FairOddsConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(3)
public class TotalsPricingStrategy extends AbstractPricingStrategy {

    @Override
    public MarketCategory category() {
        return MarketCategory.TOTALS;
    }

    @Override
    public boolean supports(PricingContext context) {
        return context.getQuote().getTotals() != null;
    }

    @Override
    public List<MarketQuote> price(PricingContext context) {
        TotalsPrices totals = context.getQuote().getTotals();
        ProbabilityPair pair = FairOddsConverter.twoWay(totals.over(), totals.under(),
                context.getTrueProbability().adjustment());
        MarketLiquidity liquidity = liquidityOr(context, MarketLiquidity.HIGH);
        return List.of(
                quote(context, String.format("Over %.1f", totals.line()), totals.line(), totals.over(),
                        pair.option1(), liquidity, null),
                quote(context, String.format("Under %.1f", totals.line()), totals.line(), totals.under(),
                        pair.option2(), liquidity, null));
    }
}

package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityPair;
import com.mouse.apex.model.ProbabilityTriple;
import com.mouse.apex.utils.ProbabilityNormalizer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Both teams to score. No bookmaker price is assumed, so both legs are quoted at
 * their fair reciprocal odds.
 */
@Component
@Order(4)
public class BttsPricingStrategy extends AbstractPricingStrategy {

    static final double BASE_YES = 55.0;
    static final double TRUE_PROBABILITY_SCALE = 15.0;
    static final double BALANCE_SCALE = 15.0;
    static final String SOURCE_LABEL = "BTTS scoring model";

    @Override
    public MarketCategory category() {
        return MarketCategory.BTTS;
    }

    @Override
    public boolean supports(PricingContext context) {
        return context.getFixture().getSport() == SportEnum.FOOTBALL;
    }

    /**
     * Formula: yes = 55 + (trueProb - 0.5) * 15 + balance * 15,
     * balance = 1 - |home - away| / 100 when match-winner probabilities exist
     */
    @Override
    public List<MarketQuote> price(PricingContext context) {
        double yes = BASE_YES + context.getTrueProbability().adjustment() * TRUE_PROBABILITY_SCALE;
        if (context.isThreeWay()) {
            ProbabilityTriple moneyline = context.getMoneylineTriple();
            double balance = 1.0 - Math.abs(moneyline.home() - moneyline.away()) / 100.0;
            yes += balance * BALANCE_SCALE;
        }
        ProbabilityPair pair = ProbabilityNormalizer.normalize(new ProbabilityPair(yes, 100.0 - yes));

        return List.of(
                quote(context, "Both Teams To Score - Yes", null, 100.0 / pair.option1(), pair.option1(),
                        MarketLiquidity.MEDIUM, SOURCE_LABEL),
                quote(context, "Both Teams To Score - No", null, 100.0 / pair.option2(), pair.option2(),
                        MarketLiquidity.MEDIUM, SOURCE_LABEL));
    }
}

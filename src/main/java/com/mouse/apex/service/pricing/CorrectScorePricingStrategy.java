package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityTriple;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Common scorelines as fixed shares of the match-winner outcome they belong to.
 */
@Component
@Order(7)
public class CorrectScorePricingStrategy extends AbstractPricingStrategy {

    static final double MARGIN = 0.15;
    static final double MIN_PROBABILITY = 0.1;
    static final String SOURCE_LABEL = "Correct score distribution";

    enum Outcome { HOME, DRAW, AWAY }

    record Scoreline(String score, Outcome outcome, double share) {
    }

    static final List<Scoreline> SCORELINES = List.of(
            new Scoreline("1-0", Outcome.HOME, 0.25),
            new Scoreline("2-1", Outcome.HOME, 0.22),
            new Scoreline("2-0", Outcome.HOME, 0.18),
            new Scoreline("1-1", Outcome.DRAW, 0.30),
            new Scoreline("0-0", Outcome.DRAW, 0.25),
            new Scoreline("0-1", Outcome.AWAY, 0.25),
            new Scoreline("1-2", Outcome.AWAY, 0.20),
            new Scoreline("0-2", Outcome.AWAY, 0.15));

    @Override
    public MarketCategory category() {
        return MarketCategory.CORRECT_SCORE;
    }

    @Override
    public boolean supports(PricingContext context) {
        return context.isThreeWay() && context.getFixture().getSport() == SportEnum.FOOTBALL;
    }

    @Override
    public List<MarketQuote> price(PricingContext context) {
        ProbabilityTriple p = context.getMoneylineTriple();
        List<MarketQuote> quotes = new ArrayList<>();
        for (Scoreline scoreline : SCORELINES) {
            double outcome = switch (scoreline.outcome()) {
                case HOME -> p.home();
                case DRAW -> p.draw();
                case AWAY -> p.away();
            };
            double probability = Math.max(MIN_PROBABILITY, outcome * scoreline.share());
            quotes.add(quote(context, "Correct Score " + scoreline.score(), null,
                    marginPrice(probability, MARGIN), probability, MarketLiquidity.LOW, SOURCE_LABEL));
        }
        return quotes;
    }
}

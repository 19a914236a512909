package com.mouse.apex.service;

import com.mouse.apex.interfaces.MarketPricingStrategy;
import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.MatchContext;
import com.mouse.apex.model.MoneylinePrices;
import com.mouse.apex.model.OddsQuote;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityTriple;
import com.mouse.apex.model.TrueProbability;
import com.mouse.apex.utils.FairOddsConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every applicable pricing strategy, in order, against one fixture.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketGenerator {

    private final List<MarketPricingStrategy> strategies;

    /**
     * @return every priced market; moneyline first when the quote has match-winner prices
     * @throws IllegalArgumentException when the match-winner prices are unusable
     */
    public List<MarketQuote> generate(Fixture fixture, OddsQuote quote, TrueProbability trueProbability,
                                      MatchContext matchContext) {
        PricingContext context = PricingContext.builder()
                .fixture(fixture)
                .quote(quote)
                .trueProbability(trueProbability)
                .matchContext(matchContext)
                .moneylineTriple(moneylineTriple(fixture, quote.getMoneyline(), trueProbability))
                .sources(quote.getSources())
                .build();

        List<MarketQuote> markets = new ArrayList<>();
        for (MarketPricingStrategy strategy : strategies) {
            if (!strategy.supports(context)) {
                continue;
            }
            try {
                List<MarketQuote> priced = strategy.price(context);
                markets.addAll(priced);
                log.debug("Priced market | Fixture: {} | Category: {} | Quotes: {}",
                        fixture.getId(), strategy.category(), priced.size());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping market | Fixture: {} | Category: {} | Reason: {}",
                        fixture.getId(), strategy.category(), e.getMessage());
            }
        }

        log.info("Markets generated | Fixture: {} | Match: {} | Count: {}",
                fixture.getId(), fixture.getMatchLabel(), markets.size());
        return markets;
    }

    /**
     * Highest edge wins; on equal edge the earlier market is kept.
     */
    public static Optional<MarketQuote> selectPrimary(List<MarketQuote> markets) {
        MarketQuote best = null;
        for (MarketQuote market : markets) {
            if (best == null || market.getEdge() > best.getEdge()) {
                best = market;
            }
        }
        return Optional.ofNullable(best);
    }

    private static ProbabilityTriple moneylineTriple(Fixture fixture, MoneylinePrices prices,
                                                     TrueProbability trueProbability) {
        if (prices == null || !fixture.getSport().isThreeWay()) {
            return null;
        }
        return FairOddsConverter.threeWay(prices.home(), prices.draw(), prices.away(), trueProbability.adjustment());
    }
}

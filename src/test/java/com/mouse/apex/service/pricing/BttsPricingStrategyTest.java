package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.MoneylinePrices;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.model.ProbabilityTriple;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mouse.apex.service.pricing.PricingStrategyTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BttsPricingStrategyTest {

    private final BttsPricingStrategy strategy = new BttsPricingStrategy();

    @Test
    void price_balancedMatchRaisesYes() {
        PricingContext ctx = context(SportEnum.FOOTBALL, new MoneylinePrices(2.0, 3.4, 3.3),
                new ProbabilityTriple(50.0, 20.0, 30.0), 0.5);

        List<MarketQuote> quotes = strategy.price(ctx);

        assertThat(quotes).extracting(MarketQuote::getSelection)
                .containsExactly("Both Teams To Score - Yes", "Both Teams To Score - No");
        assertThat(quotes.get(0).getCalculatedProbability().ensembleAverage()).isCloseTo(67.0, within(1e-9));
        assertThat(quotes.get(1).getCalculatedProbability().ensembleAverage()).isCloseTo(33.0, within(1e-9));
        assertThat(quotes).allSatisfy(q -> {
            assertThat(q.getEdge()).isCloseTo(0.0, within(0.11));
            assertThat(q.getDataSources()).contains(BttsPricingStrategy.SOURCE_LABEL);
        });
    }

    @Test
    void price_evenSidesNeverDropBelowBase() {
        PricingContext ctx = context(SportEnum.FOOTBALL, new MoneylinePrices(2.6, 3.2, 2.6),
                new ProbabilityTriple(40.0, 20.0, 40.0), 0.5);

        List<MarketQuote> quotes = strategy.price(ctx);

        assertThat(quotes.get(0).getCalculatedProbability().ensembleAverage())
                .isCloseTo(70.0, within(1e-9))
                .isGreaterThan(BttsPricingStrategy.BASE_YES);
    }

    @Test
    void supports_footballOnly() {
        assertThat(strategy.supports(context(SportEnum.FOOTBALL, null, null, 0.5))).isTrue();
        assertThat(strategy.supports(context(SportEnum.HOCKEY, null, null, 0.5))).isFalse();
    }
}

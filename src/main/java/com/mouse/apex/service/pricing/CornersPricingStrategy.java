package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.model.CornersForecast;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.service.SpecialtyMarketsCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@Order(8)
@RequiredArgsConstructor
public class CornersPricingStrategy extends AbstractPricingStrategy {

    static final double MARGIN = 0.08;
    static final String SOURCE_LABEL = "Corners model";

    private final SpecialtyMarketsCalculator calculator;

    @Override
    public MarketCategory category() {
        return MarketCategory.CORNERS;
    }

    @Override
    public boolean supports(PricingContext context) {
        return context.getFixture().getSport() == SportEnum.FOOTBALL && context.getMatchContext() != null;
    }

    @Override
    public List<MarketQuote> price(PricingContext context) {
        CornersForecast forecast = calculator.forecastCorners(context.getMatchContext());
        String home = context.getFixture().getHomeTeam();
        String away = context.getFixture().getAwayTeam();

        List<MarketQuote> quotes = new ArrayList<>();
        overUnder(context, quotes, "Total Corners", forecast.expectedTotal(), forecast.totalLine());
        overUnder(context, quotes, home + " Corners", forecast.expectedHome(),
                SpecialtyMarketsCalculator.HOME_TEAM_CORNER_LINE);
        overUnder(context, quotes, away + " Corners", forecast.expectedAway(),
                SpecialtyMarketsCalculator.AWAY_TEAM_CORNER_LINE);
        return quotes;
    }

    private void overUnder(PricingContext context, List<MarketQuote> quotes, String market,
                           double expected, double line) {
        quotes.addAll(overUnderQuotes(context, market, line, calculator.overProbability(expected, line),
                MARGIN, SOURCE_LABEL));
    }
}

package com.mouse.apex.service.pricing;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.model.CardsForecast;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.PricingContext;
import com.mouse.apex.service.SpecialtyMarketsCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@Order(9)
@RequiredArgsConstructor
public class CardsPricingStrategy extends AbstractPricingStrategy {

    static final double MARGIN = 0.10;
    static final String SOURCE_LABEL = "Cards model";

    private final SpecialtyMarketsCalculator calculator;

    @Override
    public MarketCategory category() {
        return MarketCategory.CARDS;
    }

    @Override
    public boolean supports(PricingContext context) {
        return context.getFixture().getSport() == SportEnum.FOOTBALL && context.getMatchContext() != null;
    }

    @Override
    public List<MarketQuote> price(PricingContext context) {
        CardsForecast forecast = calculator.forecastCards(context.getMatchContext());
        List<MarketQuote> quotes = new ArrayList<>();
        for (double line : SpecialtyMarketsCalculator.CARD_LINES) {
            overUnder(context, quotes, "Total Cards", forecast.expectedYellow(), line);
        }
        overUnder(context, quotes, "Booking Points",
                forecast.expectedBookings() * SpecialtyMarketsCalculator.POINTS_PER_BOOKING,
                SpecialtyMarketsCalculator.BOOKING_POINTS_LINE);
        return quotes;
    }

    private void overUnder(PricingContext context, List<MarketQuote> quotes, String market,
                           double expected, double line) {
        quotes.addAll(overUnderQuotes(context, market, line, calculator.overProbability(expected, line),
                MARGIN, SOURCE_LABEL));
    }
}

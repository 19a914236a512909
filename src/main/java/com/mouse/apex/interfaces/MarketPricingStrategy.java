package com.mouse.apex.interfaces;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.PricingContext;

import java.util.List;

/**
 * Prices one market category for a fixture.
 */
public interface MarketPricingStrategy {

    MarketCategory category();

    /** Whether this market can be priced from what the context holds. */
    boolean supports(PricingContext context);

    List<MarketQuote> price(PricingContext context);
}

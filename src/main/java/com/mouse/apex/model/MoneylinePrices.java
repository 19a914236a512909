package com.mouse.apex.model;

/**
 * Match-winner prices in decimal odds. {@code draw} is null for two-way sports or
 * when the bookmaker does not price it.
 */
public record MoneylinePrices(double home, Double draw, double away) {

    public boolean hasDraw() {
        return draw != null;
    }
}

package com.mouse.apex.model;

/**
 * Synthesized win probability on the 0-1 scale. Only {@code capped} feeds pricing;
 * the rest is kept for diagnostics.
 */
public record TrueProbability(double raw, double capped, double marketImplied, double totalImpact) {

    /** Analytical adjustment handed to the fair-odds converter. */
    public double adjustment() {
        return capped - 0.5;
    }

    public TrueProbability withMarketImplied(double implied) {
        return new TrueProbability(raw, capped, implied, totalImpact);
    }
}

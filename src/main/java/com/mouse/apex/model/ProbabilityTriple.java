package com.mouse.apex.model;

/**
 * Home / draw / away percentages. Every triple handed to a caller has passed through
 * {@link com.mouse.apex.utils.ProbabilityNormalizer}.
 */
public record ProbabilityTriple(double home, double draw, double away) {

    public double sum() {
        return home + draw + away;
    }

    public double[] toArray() {
        return new double[]{home, draw, away};
    }

    public static ProbabilityTriple of(double[] values) {
        return new ProbabilityTriple(values[0], values[1], values[2]);
    }
}

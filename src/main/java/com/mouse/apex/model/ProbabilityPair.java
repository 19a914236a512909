package com.mouse.apex.model;

/** Two mutually exclusive outcomes in percent, e.g. over / under. */
public record ProbabilityPair(double option1, double option2) {

    public double sum() {
        return option1 + option2;
    }

    public double[] toArray() {
        return new double[]{option1, option2};
    }

    public static ProbabilityPair of(double[] values) {
        return new ProbabilityPair(values[0], values[1]);
    }
}

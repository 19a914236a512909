package com.mouse.apex.model;

public record CalculatedProbability(double ensembleAverage, CalibratedRange calibratedRange) {

    public record CalibratedRange(double lower, double upper) {
    }
}

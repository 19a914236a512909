package com.mouse.apex.model;

import com.mouse.apex.enums.FactorCategory;

/**
 * One contextual signal. {@code impact} is in percentage points (positive favours the
 * home side) and {@code weight} is its share out of 100.
 */
public record FactorObservation(FactorCategory category, String factor, double weight, double impact,
                                double confidence, String source) {

    public double contribution() {
        return impact * weight / 100.0;
    }
}

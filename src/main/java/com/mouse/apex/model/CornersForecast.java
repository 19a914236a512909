package com.mouse.apex.model;

/** Expected corner counts and the total line closest to them. */
public record CornersForecast(double expectedHome, double expectedAway, double expectedTotal,
                              double totalLine, double dataQuality) {
}

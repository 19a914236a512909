package com.mouse.apex.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum MarketLiquidity {
    HIGH("High", 15.0),
    MEDIUM("Medium", 10.0),
    LOW("Low", 5.0);

    private final String label;
    /** Points contributed to the confidence score. */
    private final double confidenceWeight;
}

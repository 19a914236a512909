package com.mouse.apex.model;

public record RecommendedStake(double units, String kellyFraction, String unitDescription,
                               double percentageOfBankroll) {
}

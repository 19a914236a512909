package com.mouse.apex.utils;

import com.mouse.apex.model.RecommendedStake;
import lombok.extern.slf4j.Slf4j;

import static com.mouse.apex.utils.NumberUtils.clamp;
import static com.mouse.apex.utils.NumberUtils.round2;

/**
 * Quarter-Kelly staking in betting units.
 */
@Slf4j
public class StakeSizer {

    public static final double KELLY_FRACTION = 0.25;
    public static final double MIN_UNITS = 0.5;
    public static final double MAX_UNITS = 3.0;

    private StakeSizer() {
    }

    /**
     * Formula: units = 0.25 * (p * (odds - 1) - (1 - p)) / (odds - 1), clamped to [0.5, 3.0]
     *
     * @param probability win probability in [0, 1]
     * @param odds        decimal odds
     * @return recommended units, always within bounds
     */
    public static double units(double probability, double odds) {
        if (!Double.isFinite(probability) || !Double.isFinite(odds) || odds <= 1.0) {
            log.warn("Invalid stake inputs, using minimum stake | Probability: {} | Odds: {}", probability, odds);
            return MIN_UNITS;
        }
        double p = clamp(probability, 0.0, 1.0);
        double b = odds - 1.0;
        double kelly = KELLY_FRACTION * (p * b - (1.0 - p)) / b;
        if (!Double.isFinite(kelly)) {
            return MIN_UNITS;
        }
        return clamp(kelly, MIN_UNITS, MAX_UNITS);
    }

    /**
     * @param probabilityPercent win probability on the 0-100 scale
     */
    public static RecommendedStake recommend(double probabilityPercent, double odds) {
        double units = round2(units(probabilityPercent / 100.0, odds));
        return new RecommendedStake(
                units,
                String.format("%.2f Units", units),
                "Quarter-Kelly formula applied",
                units);
    }
}

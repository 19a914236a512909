package com.mouse.apex.utils;

import com.mouse.apex.model.RecommendedStake;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StakeSizerTest {

    @Test
    void units_alwaysWithinBounds_acrossProbabilityAndOddsGrid() {
        double[] odds = {1.0001, 1.01, 1.5, 2.0, 3.5, 10.0, 100.0, 1000.0};
        for (double p = 0.0; p <= 1.0; p += 0.05) {
            for (double o : odds) {
                assertThat(StakeSizer.units(p, o))
                        .as("p=%s odds=%s", p, o)
                        .isBetween(StakeSizer.MIN_UNITS, StakeSizer.MAX_UNITS);
            }
        }
    }

    @Test
    void units_boundaryInputs_returnMinimum() {
        assertThat(StakeSizer.units(0.0, 2.0)).isEqualTo(StakeSizer.MIN_UNITS);
        assertThat(StakeSizer.units(0.5, 1.0000001)).isEqualTo(StakeSizer.MIN_UNITS);
        assertThat(StakeSizer.units(1.0, 1.0000001)).isBetween(StakeSizer.MIN_UNITS, StakeSizer.MAX_UNITS);
    }

    @Test
    void units_invalidInputs_returnMinimum() {
        assertThat(StakeSizer.units(Double.NaN, 2.0)).isEqualTo(StakeSizer.MIN_UNITS);
        assertThat(StakeSizer.units(0.6, 1.0)).isEqualTo(StakeSizer.MIN_UNITS);
        assertThat(StakeSizer.units(0.6, 0.5)).isEqualTo(StakeSizer.MIN_UNITS);
    }

    @Test
    void recommend_formatsUnits() {
        RecommendedStake stake = StakeSizer.recommend(60.0, 2.1);

        assertThat(stake.units()).isEqualTo(0.5);
        assertThat(stake.kellyFraction()).isEqualTo("0.50 Units");
        assertThat(stake.unitDescription()).isEqualTo("Quarter-Kelly formula applied");
    }
}

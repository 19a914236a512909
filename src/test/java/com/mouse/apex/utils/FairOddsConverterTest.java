package com.mouse.apex.utils;

import com.mouse.apex.model.ProbabilityPair;
import com.mouse.apex.model.ProbabilityTriple;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FairOddsConverterTest {

    @Test
    void impliedProbability_isReciprocalPercentage() {
        assertThat(FairOddsConverter.impliedProbability(2.0)).isCloseTo(50.0, within(1e-9));
        assertThat(FairOddsConverter.impliedProbability(4.0)).isCloseTo(25.0, within(1e-9));
    }

    @ParameterizedTest
    @ValueSource(doubles = {1.0, 0.5, 0.0, -2.0, Double.NaN, Double.POSITIVE_INFINITY})
    void impliedProbability_invalidOdds_throws(double odds) {
        assertThatThrownBy(() -> FairOddsConverter.impliedProbability(odds))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void threeWay_noAdjustment_removesMarginAndNormalizes() {
        // home 1.80, draw 3.40, away 4.50
        ProbabilityTriple p = FairOddsConverter.threeWay(1.80, 3.40, 4.50, 0.0);

        assertThat(p.home()).isCloseTo(51.9, within(0.001));
        assertThat(p.draw()).isCloseTo(27.4, within(0.001));
        assertThat(p.away()).isCloseTo(20.7, within(0.001));
        assertThat(p.sum()).isCloseTo(100.0, within(0.001));
    }

    @Test
    void marginFree_sumsToHundred() {
        ProbabilityTriple fair = FairOddsConverter.marginFree(1.80, 3.40, 4.50);

        assertThat(fair.sum()).isCloseTo(100.0, within(1e-9));
        assertThat(fair.home()).isCloseTo(51.83, within(0.01));
        assertThat(fair.draw()).isCloseTo(27.44, within(0.01));
        assertThat(fair.away()).isCloseTo(20.73, within(0.01));
    }

    @Test
    void threeWay_noAdjustment_matchesMarginFreeWithinRounding() {
        ProbabilityTriple fair = FairOddsConverter.marginFree(2.45, 3.30, 2.95);
        ProbabilityTriple p = FairOddsConverter.threeWay(2.45, 3.30, 2.95, 0.0);

        assertThat(p.home()).isCloseTo(fair.home(), within(0.15));
        assertThat(p.draw()).isCloseTo(fair.draw(), within(0.15));
        assertThat(p.away()).isCloseTo(fair.away(), within(0.15));
    }

    @Test
    void threeWay_positiveAdjustment_movesProbabilityToHome() {
        ProbabilityTriple neutral = FairOddsConverter.threeWay(2.45, 3.30, 2.95, 0.0);
        ProbabilityTriple favoured = FairOddsConverter.threeWay(2.45, 3.30, 2.95, 0.2);

        assertThat(favoured.home()).isGreaterThan(neutral.home());
        assertThat(favoured.draw()).isLessThan(neutral.draw());
        assertThat(favoured.away()).isLessThan(neutral.away());
    }

    @Test
    void threeWay_adjustmentIsClampedToHalf() {
        assertThat(FairOddsConverter.threeWay(2.45, 3.30, 2.95, 5.0))
                .isEqualTo(FairOddsConverter.threeWay(2.45, 3.30, 2.95, 0.5));
    }

    @Test
    void threeWay_missingDraw_defaultsDrawToQuarter() {
        ProbabilityTriple p = FairOddsConverter.threeWay(1.90, null, 2.00, 0.0);

        assertThat(p.draw()).isCloseTo(25.0, within(0.1));
        assertThat(p.home()).isGreaterThan(p.away());
        assertThat(p.sum()).isCloseTo(100.0, within(0.001));
    }

    @Test
    void threeWay_extremeFavourite_staysWithinBounds() {
        ProbabilityTriple p = FairOddsConverter.threeWay(1.02, 25.0, 60.0, 0.5);

        assertThat(ProbabilityNormalizer.verify(p.toArray())).isEmpty();
        assertThat(p.home()).isCloseTo(90.0, within(1e-9));
    }

    @Test
    void threeWay_invalidOdds_throws() {
        assertThatThrownBy(() -> FairOddsConverter.threeWay(1.0, 3.0, 4.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void twoWay_evenPrices_splitEvenly() {
        ProbabilityPair p = FairOddsConverter.twoWay(1.91, 1.91, 0.0);

        assertThat(p.option1()).isCloseTo(50.0, within(0.001));
        assertThat(p.option2()).isCloseTo(50.0, within(0.001));
    }

    @Test
    void twoWay_adjustmentShiftsTenPointsPerUnit() {
        ProbabilityPair p = FairOddsConverter.twoWay(1.91, 1.91, 0.1);

        assertThat(p.option1()).isCloseTo(51.0, within(0.001));
        assertThat(p.option2()).isCloseTo(49.0, within(0.001));
    }

    @Test
    void overround_sumsImpliedMinusHundred() {
        assertThat(FairOddsConverter.overround(1.91, 1.91)).isCloseTo(4.712, within(0.001));
    }
}

package com.mouse.apex.adapter;

import com.mouse.apex.enums.FactorCategory;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.model.FactorObservation;
import com.mouse.apex.model.Fixture;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicSignalAggregatorTest {

    private final HeuristicSignalAggregator aggregator = new HeuristicSignalAggregator();

    private final Fixture fixture = Fixture.builder().id("fx").sport(SportEnum.FOOTBALL)
            .homeTeam("Arsenal").awayTeam("Chelsea").build();

    @Test
    void getSignals_homeAdvantageBaseline() {
        List<FactorObservation> signals = aggregator.getSignals(fixture);

        assertThat(signals).extracting(FactorObservation::category).containsExactly(
                FactorCategory.TACTICAL, FactorCategory.SITUATIONAL, FactorCategory.PSYCHOLOGICAL);
        assertThat(signals).allSatisfy(s -> {
            assertThat(s.source()).isEqualTo(HeuristicSignalAggregator.SOURCE);
            assertThat(s.weight()).isEqualTo(s.category().getDefaultWeight());
            assertThat(s.impact()).isPositive();
        });
    }
}

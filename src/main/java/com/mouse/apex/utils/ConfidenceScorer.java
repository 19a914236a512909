package com.mouse.apex.utils;

import com.mouse.apex.enums.MarketLiquidity;
import lombok.extern.slf4j.Slf4j;

import static com.mouse.apex.utils.NumberUtils.clamp;
import static com.mouse.apex.utils.NumberUtils.round1;

/**
 * Per-market confidence on a [20, 96] scale.
 */
@Slf4j
public class ConfidenceScorer {

    public static final double MIN_SCORE = 20.0;
    public static final double MAX_SCORE = 96.0;

    private static final double BASE_SCORE = 20.0;
    private static final double EDGE_POINTS_PER_PP = 2.0;
    private static final double MAX_EDGE_POINTS = 30.0;
    private static final double PEAK_DISTANCE = 20.0;
    private static final double MAX_DISTANCE_POINTS = 20.0;
    private static final double DISTANCE_DECAY = 0.8;
    private static final double POINTS_PER_SOURCE = 2.5;
    private static final double MAX_SOURCE_POINTS = 20.0;
    private static final double NEGATIVE_EDGE_DECAY = 10.0;
    private static final int PERTURBATION_BUCKETS = 7;
    private static final double PERTURBATION_STEP = 0.5;

    private ConfidenceScorer() {
    }

    /**
     * @param edge        calculated minus implied probability, percentage points
     * @param probability calculated probability on the 0-100 scale
     * @param liquidity   market liquidity tier, LOW when unknown
     * @param sourceCount number of contributing data sources
     * @param marketId    stable identifier used for the deterministic perturbation
     * @return score in [20, 96], one decimal
     */
    public static double score(double edge, double probability, MarketLiquidity liquidity,
                               int sourceCount, String marketId) {
        double safeEdge = Double.isFinite(edge) ? edge : 0.0;
        double safeProbability = Double.isFinite(probability) ? probability : 50.0;
        MarketLiquidity tier = liquidity != null ? liquidity : MarketLiquidity.LOW;

        double score = BASE_SCORE
                + edgeComponent(safeEdge)
                + distanceComponent(safeProbability)
                + Math.min(Math.max(sourceCount, 0) * POINTS_PER_SOURCE, MAX_SOURCE_POINTS)
                + tier.getConfidenceWeight();

        if (safeEdge < 0) {
            score *= Math.exp(safeEdge / NEGATIVE_EDGE_DECAY);
        }
        score += perturbation(marketId);

        double bounded = round1(clamp(score, MIN_SCORE, MAX_SCORE));
        log.debug("Confidence | Market: {} | Edge: {} | Probability: {} | Liquidity: {} | Sources: {} | Score: {}",
                marketId, edge, probability, tier, sourceCount, bounded);
        return bounded;
    }

    static double edgeComponent(double edge) {
        if (edge <= 0) {
            return 0.0;
        }
        return Math.min(edge * EDGE_POINTS_PER_PP, MAX_EDGE_POINTS);
    }

    /** Rises to its peak at 20 points from even money, then decays again. */
    static double distanceComponent(double probability) {
        double distance = Math.abs(probability - 50.0);
        if (distance <= PEAK_DISTANCE) {
            return distance / PEAK_DISTANCE * MAX_DISTANCE_POINTS;
        }
        return Math.max(0.0, MAX_DISTANCE_POINTS - (distance - PEAK_DISTANCE) * DISTANCE_DECAY);
    }

    /** Stable offset in [-1.5, 1.5] derived from the market id. */
    static double perturbation(String marketId) {
        if (marketId == null || marketId.isEmpty()) {
            return 0.0;
        }
        int bucket = Math.floorMod(marketId.hashCode(), PERTURBATION_BUCKETS);
        return (bucket - PERTURBATION_BUCKETS / 2) * PERTURBATION_STEP;
    }
}

package com.mouse.apex.utils;

import com.mouse.apex.model.ProbabilityPair;
import com.mouse.apex.model.ProbabilityTriple;
import lombok.extern.slf4j.Slf4j;

import static com.mouse.apex.utils.NumberUtils.clamp;

/**
 * Converts bookmaker decimal odds into margin-free probabilities and applies the
 * model's analytical adjustment. All returned sets are normalized.
 */
@Slf4j
public class FairOddsConverter {

    /** Percentage points applied per unit of adjustment on three-way markets. */
    public static final double THREE_WAY_SCALE = 15.0;
    /** Percentage points applied per unit of adjustment on two-way markets. */
    public static final double TWO_WAY_SCALE = 10.0;
    public static final double DRAW_SHARE = 0.3;
    public static final double AWAY_SHARE = 0.7;
    public static final double DEFAULT_DRAW_PROBABILITY = 25.0;

    private static final double MAX_ADJUSTMENT = 0.5;

    private FairOddsConverter() {
    }

    /**
     * Naive implied probability of a single price.
     * Formula: implied % = 100 / odds
     *
     * @param odds decimal odds, must be greater than 1
     * @return implied percentage including the bookmaker's margin
     */
    public static double impliedProbability(double odds) {
        if (!Double.isFinite(odds) || odds <= 1.0) {
            throw new IllegalArgumentException("Decimal odds must be greater than 1.0 but was " + odds);
        }
        return 100.0 / odds;
    }

    /**
     * Bookmaker overround for a complete set of prices.
     * Formula: overround % = (sum(100 / odds) - 100)
     */
    public static double overround(double... odds) {
        double total = 0.0;
        for (double o : odds) {
            total += impliedProbability(o);
        }
        return total - 100.0;
    }

    /**
     * Margin-free three-way probabilities before any adjustment or normalization.
     *
     * @param drawOdds may be null when the bookmaker has no draw price
     */
    public static ProbabilityTriple marginFree(double homeOdds, Double drawOdds, double awayOdds) {
        double home = impliedProbability(homeOdds);
        double away = impliedProbability(awayOdds);
        double draw = drawOdds != null ? impliedProbability(drawOdds) : 0.0;
        double total = home + draw + away;
        return new ProbabilityTriple(home / total * 100.0, draw / total * 100.0, away / total * 100.0);
    }

    /**
     * Three-way fair probabilities with the analytical adjustment applied.
     * Formula: home += 15a, draw -= 0.3 * 15a, away -= 0.7 * 15a
     * <p>
     * Without a draw price the draw defaults to 25% and home and away give up 12.5 each.
     *
     * @param homeOdds   decimal home price
     * @param drawOdds   decimal draw price, or null
     * @param awayOdds   decimal away price
     * @param adjustment analytical edge in [-0.5, 0.5]; positive favours home
     * @return normalized triple
     */
    public static ProbabilityTriple threeWay(double homeOdds, Double drawOdds, double awayOdds, double adjustment) {
        ProbabilityTriple fair = marginFree(homeOdds, drawOdds, awayOdds);
        double shift = clampAdjustment(adjustment) * THREE_WAY_SCALE;

        double home = fair.home() + shift;
        double draw = fair.draw() - shift * DRAW_SHARE;
        double away = fair.away() - shift * AWAY_SHARE;

        if (drawOdds == null) {
            draw = DEFAULT_DRAW_PROBABILITY - shift * DRAW_SHARE;
            home -= DEFAULT_DRAW_PROBABILITY / 2.0;
            away -= DEFAULT_DRAW_PROBABILITY / 2.0;
        }

        log.debug("Three-way conversion | Odds: {}/{}/{} | Adjustment: {} | PreNormalize: {}/{}/{}",
                homeOdds, drawOdds, awayOdds, adjustment, home, draw, away);
        return ProbabilityNormalizer.normalize(new ProbabilityTriple(home, draw, away));
    }

    /**
     * Two-way fair probabilities with a symmetric adjustment.
     * Formula: option1 += 10a, option2 -= 10a
     */
    public static ProbabilityPair twoWay(double option1Odds, double option2Odds, double adjustment) {
        double first = impliedProbability(option1Odds);
        double second = impliedProbability(option2Odds);
        double total = first + second;
        double shift = clampAdjustment(adjustment) * TWO_WAY_SCALE;

        return ProbabilityNormalizer.normalize(new ProbabilityPair(
                first / total * 100.0 + shift,
                second / total * 100.0 - shift));
    }

    private static double clampAdjustment(double adjustment) {
        if (!Double.isFinite(adjustment)) {
            log.warn("Non-finite adjustment ignored: {}", adjustment);
            return 0.0;
        }
        return clamp(adjustment, -MAX_ADJUSTMENT, MAX_ADJUSTMENT);
    }
}

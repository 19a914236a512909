package com.mouse.apex.service;

import com.mouse.apex.model.CardsForecast;
import com.mouse.apex.model.CornersForecast;
import com.mouse.apex.model.MatchContext;
import com.mouse.apex.model.TeamProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.mouse.apex.utils.NumberUtils.clamp;
import static com.mouse.apex.utils.NumberUtils.round1;

/**
 * Expected counts for corners and cards, and over/under probabilities on them.
 * <p>
 * Over probabilities use a logistic curve on the normal approximation of a Poisson
 * count. Known limit: it is inaccurate for expected counts below 2, which is where
 * the red-card market lives, so red cards are only priced through booking points.
 */
@Slf4j
@Service
public class SpecialtyMarketsCalculator {

    public static final double DEFAULT_CORNERS_PER_GAME = 5.5;
    public static final double DEFAULT_POSSESSION = 50.0;
    public static final double HOME_CORNER_ADVANTAGE = 0.5;
    public static final double[] CORNER_LINES = {8.5, 9.5, 10.5, 11.5, 12.5};
    public static final double HOME_TEAM_CORNER_LINE = 5.5;
    public static final double AWAY_TEAM_CORNER_LINE = 4.5;

    public static final double DEFAULT_YELLOW_PER_GAME = 2.0;
    public static final double DEFAULT_RED_PER_GAME = 0.1;
    public static final double AVERAGE_FOULS = 12.5;
    public static final double STRICT_REFEREE_FACTOR = 1.2;
    public static final double[] CARD_LINES = {2.5, 3.5};
    public static final double BOOKING_POINTS_LINE = 30.5;
    public static final double POINTS_PER_BOOKING = 10.0;

    private static final double DATA_BONUS = 10.0;
    private static final int DATA_BONUS_THRESHOLD = 3;

    public CornersForecast forecastCorners(MatchContext context) {
        TeamProfile home = context.getHome();
        TeamProfile away = context.getAway();

        double homeExpected = orDefault(home.getCornersPerGame(), DEFAULT_CORNERS_PER_GAME)
                * possessionFactor(home) + HOME_CORNER_ADVANTAGE;
        double awayExpected = orDefault(away.getCornersPerGame(), DEFAULT_CORNERS_PER_GAME)
                * possessionFactor(away);
        double total = homeExpected + awayExpected;

        double quality = dataQuality(
                home.getCornersPerGame() != null,
                away.getCornersPerGame() != null,
                home.getPossession() != null);

        log.debug("Corners forecast | Home: {} | Away: {} | Total: {} | Quality: {}",
                round1(homeExpected), round1(awayExpected), round1(total), quality);
        return new CornersForecast(round1(homeExpected), round1(awayExpected), round1(total),
                closestLine(total, CORNER_LINES), quality);
    }

    public CardsForecast forecastCards(MatchContext context) {
        TeamProfile home = context.getHome();
        TeamProfile away = context.getAway();
        double referee = context.isStrictReferee() ? STRICT_REFEREE_FACTOR : 1.0;

        double homeFactor = aggressiveness(home) * referee;
        double awayFactor = aggressiveness(away) * referee;

        double homeYellow = orDefault(home.getYellowCardsPerGame(), DEFAULT_YELLOW_PER_GAME) * homeFactor;
        double awayYellow = orDefault(away.getYellowCardsPerGame(), DEFAULT_YELLOW_PER_GAME) * awayFactor;
        double red = orDefault(home.getRedCardsPerGame(), DEFAULT_RED_PER_GAME) * homeFactor
                + orDefault(away.getRedCardsPerGame(), DEFAULT_RED_PER_GAME) * awayFactor;
        double yellow = homeYellow + awayYellow;
        double bookings = yellow + red * 2.0;

        double quality = dataQuality(
                home.getYellowCardsPerGame() != null,
                away.getYellowCardsPerGame() != null,
                home.getFoulsPerGame() != null);

        log.debug("Cards forecast | Yellow: {} | Red: {} | Bookings: {} | StrictReferee: {}",
                round1(yellow), red, round1(bookings), context.isStrictReferee());
        return new CardsForecast(round1(homeYellow), round1(awayYellow), round1(yellow),
                Math.round(red * 100.0) / 100.0, round1(bookings), quality);
    }

    /**
     * Formula: P(over) = 1 / (1 + e^((line - expected) / sqrt(expected)))
     *
     * @return percentage on the 0-100 scale
     */
    public double overProbability(double expected, double line) {
        if (!(expected > 0)) {
            log.warn("Non-positive expected count {} for line {}", expected, line);
            return 0.0;
        }
        double z = (line - expected) / Math.sqrt(expected);
        return 100.0 / (1.0 + Math.exp(z));
    }

    /**
     * Team aggressiveness multiplier from fouls per game, 1.0 when unknown.
     * Formula: clamp(0.8 + ((fouls - 12.5) / 12.5) * 0.4, 0.7, 1.3)
     */
    double aggressiveness(TeamProfile team) {
        Double fouls = team.getFoulsPerGame();
        if (fouls == null || fouls <= 0) {
            return 1.0;
        }
        return clamp(0.8 + ((fouls - AVERAGE_FOULS) / AVERAGE_FOULS) * 0.4, 0.7, 1.3);
    }

    /** Share of known inputs as a percentage, plus a bonus once three are known. */
    double dataQuality(boolean... available) {
        int known = 0;
        for (boolean b : available) {
            if (b) known++;
        }
        double base = known * 100.0 / available.length;
        return Math.min(100.0, base + (known >= DATA_BONUS_THRESHOLD ? DATA_BONUS : 0.0));
    }

    static double closestLine(double expected, double[] lines) {
        double closest = lines[0];
        for (double line : lines) {
            if (Math.abs(expected - line) < Math.abs(expected - closest)) {
                closest = line;
            }
        }
        return closest;
    }

    private static double possessionFactor(TeamProfile team) {
        return orDefault(team.getPossession(), DEFAULT_POSSESSION) / DEFAULT_POSSESSION;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}

package com.mouse.apex.service;

import com.mouse.apex.enums.FactorCategory;
import com.mouse.apex.model.FactorObservation;
import com.mouse.apex.model.MatchContext;
import com.mouse.apex.model.TeamProfile;
import com.mouse.apex.model.TrueProbability;
import com.mouse.apex.utils.FairOddsConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.mouse.apex.utils.NumberUtils.clamp;
import static com.mouse.apex.utils.NumberUtils.round1;

/**
 * Folds a bag of factor observations into one bounded win probability.
 */
@Slf4j
@Service
public class FactorSynthesizer {

    public static final double BASE_PROBABILITY = 50.0;
    public static final double MIN_TRUE_PROBABILITY = 45.0;
    public static final double MAX_TRUE_PROBABILITY = 75.0;

    static final double BASE_CONFIDENCE = 6.5;
    static final double CONFIDENCE_STEP = 0.8;
    static final double MAX_CONFIDENCE = 9.5;
    static final double STRONG_IMPACT = 5.0;

    static final String MATCH_DATA_SOURCE = "Match data";
    static final double FORM_IMPACT_BETTER = 7.5;
    static final double FORM_IMPACT_WORSE = -2.0;
    static final double ENVIRONMENTAL_IMPACT = 3.0;

    /**
     * Formula: raw = 50 + sum(impact * weight / 100); capped = clamp(raw, 45, 75)
     *
     * @param signals          observations for one fixture, may be empty
     * @param primaryOdds      raw odds of the headline selection, used for the implied figure
     * @return raw and capped estimates on the 0-1 scale
     */
    public TrueProbability synthesize(Collection<FactorObservation> signals, double primaryOdds) {
        double totalImpact = totalImpact(signals);
        double raw = BASE_PROBABILITY + totalImpact;
        double capped = clamp(raw, MIN_TRUE_PROBABILITY, MAX_TRUE_PROBABILITY);
        double implied = impliedOrZero(primaryOdds);

        if (raw != capped) {
            log.debug("Raw probability capped | Raw: {}% | Capped: {}%", round1(raw), capped);
        }
        log.debug("Synthesized | Signals: {} | TotalImpact: {} | Raw: {}% | Capped: {}% | MarketImplied: {}%",
                signals.size(), round1(totalImpact), round1(raw), round1(capped), round1(implied));

        return new TrueProbability(raw / 100.0, capped / 100.0, implied / 100.0, totalImpact);
    }

    public double totalImpact(Collection<FactorObservation> signals) {
        double total = 0.0;
        for (FactorObservation signal : signals) {
            if (Double.isFinite(signal.impact()) && Double.isFinite(signal.weight())) {
                total += signal.contribution();
            } else {
                log.warn("Ignoring non-finite signal | Category: {} | Factor: {}", signal.category(), signal.factor());
            }
        }
        return total;
    }

    /**
     * Factor-alignment confidence on a 0-10 scale: each strong tactical, form or
     * situational signal adds 0.8 to a base of 6.5, up to 9.5.
     */
    public double alignmentConfidence(Collection<FactorObservation> signals) {
        long strong = signals.stream()
                .filter(s -> s.category() != null && s.category().isCore())
                .filter(s -> s.impact() > STRONG_IMPACT)
                .count();
        return round1(Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + strong * CONFIDENCE_STEP));
    }

    /**
     * Human-readable breakdown of the heaviest categories, strongest first.
     */
    public List<String> keyFeatures(Collection<FactorObservation> signals, int limit) {
        Map<FactorCategory, Double> byCategory = new EnumMap<>(FactorCategory.class);
        Map<FactorCategory, Double> weights = new EnumMap<>(FactorCategory.class);
        for (FactorObservation signal : signals) {
            if (signal.category() == null) continue;
            byCategory.merge(signal.category(), signal.contribution(), Double::sum);
            weights.merge(signal.category(), signal.weight(), Math::max);
        }

        List<Map.Entry<FactorCategory, Double>> entries = new ArrayList<>(byCategory.entrySet());
        entries.sort(Comparator.comparingDouble((Map.Entry<FactorCategory, Double> e) -> Math.abs(e.getValue()))
                .reversed());

        List<String> features = new ArrayList<>();
        for (Map.Entry<FactorCategory, Double> entry : entries) {
            if (features.size() >= limit) break;
            features.add(String.format("%s Analysis (%.0f%% weight): %+.1f pp",
                    entry.getKey().getDisplayName(), weights.get(entry.getKey()), entry.getValue()));
        }
        return features;
    }

    /**
     * Form and environment observations read from match data: a form signal when both
     * teams have a record, an environmental one when the venue is known.
     */
    public List<FactorObservation> contextSignals(MatchContext context) {
        List<FactorObservation> signals = new ArrayList<>();
        if (context == null || !context.isAvailable()) {
            return signals;
        }
        TeamProfile home = context.getHome();
        TeamProfile away = context.getAway();
        if (home != null && away != null && home.hasRecord() && away.hasRecord()) {
            boolean better = home.getWins() > away.getWins();
            signals.add(new FactorObservation(FactorCategory.FORM,
                    String.format("Record %d-%d vs %d-%d", home.getWins(), home.getLosses(),
                            away.getWins(), away.getLosses()),
                    FactorCategory.FORM.getDefaultWeight(), better ? FORM_IMPACT_BETTER : FORM_IMPACT_WORSE,
                    0.75, MATCH_DATA_SOURCE));
        }
        if (context.getVenue() != null) {
            signals.add(new FactorObservation(FactorCategory.ENVIRONMENTAL, "Known conditions at " + context.getVenue(),
                    FactorCategory.ENVIRONMENTAL.getDefaultWeight(), ENVIRONMENTAL_IMPACT, 0.5, MATCH_DATA_SOURCE));
        }
        return signals;
    }

    private static double impliedOrZero(double odds) {
        try {
            return FairOddsConverter.impliedProbability(odds);
        } catch (IllegalArgumentException e) {
            log.warn("No market-implied probability | Odds: {} | Reason: {}", odds, e.getMessage());
            return 0.0;
        }
    }
}

package com.mouse.apex.service;

import com.mouse.apex.enums.MarketCategory;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.model.AnalysisBundle;
import com.mouse.apex.model.ContingencyPick;
import com.mouse.apex.model.FactorObservation;
import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.Narrative;
import com.mouse.apex.model.RiskAssessment;
import com.mouse.apex.model.TrueProbability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.mouse.apex.utils.NumberUtils.round1;
import static com.mouse.apex.utils.NumberUtils.round2;

/**
 * Text and risk fields derived from a finished analysis. Pure: no collaborator calls.
 */
@Slf4j
@Service
public class NarrativeBuilder {

    static final double VAR_FACTOR = 0.95;
    static final double CVAR_FACTOR = 1.2;
    static final double CONTINGENCY_STAKE_FACTOR = 0.75;

    private static final Map<SportEnum, List<String>> SPORT_RISKS = Map.of(
            SportEnum.FOOTBALL, List.of("Early red card", "Goalkeeper injury", "Extreme weather shift"),
            SportEnum.BASKETBALL, List.of("Late scratch of a starter", "Back-to-back fatigue", "Foul trouble for key players"),
            SportEnum.HOCKEY, List.of("Goaltender change", "Power-play variance", "Empty-net swings"),
            SportEnum.TENNIS, List.of("Mid-match retirement", "Surface adaptation", "Weather delay"));

    public Narrative buildNarrative(AnalysisBundle bundle) {
        Fixture fixture = bundle.getFixture();
        MarketQuote primary = bundle.getPrimaryMarket();
        Optional<FactorObservation> strongest = strongest(bundle.getSignals(), true);
        Optional<FactorObservation> weakest = strongest(bundle.getSignals(), false);

        String gameScript = strongest
                .map(f -> String.format("%s are expected to dictate the match through their %s edge (%s). "
                                + "The model lands on %.1f%% for the home side once every signal is weighed.",
                        fixture.getHomeTeam(), f.category().getDisplayName().toLowerCase(), f.factor(),
                        bundle.getTrueProbability().capped() * 100.0))
                .orElse(String.format("No contextual signals were available for %s, so the projection "
                        + "rests on the market prices alone.", fixture.getMatchLabel()));

        String marketEdge = primary == null
                ? "No market cleared the pricing stage."
                : String.format("%s at %.2f implies %.1f%% while the model prices it at %.1f%%, "
                                + "an edge of %+.1f points.",
                        primary.getSelection(), primary.getOdds(), primary.getImpliedProbability(),
                        primary.getCalculatedProbability().ensembleAverage(), primary.getEdge());

        String failurePoint = weakest
                .filter(f -> f.impact() < 0)
                .map(f -> String.format("The pick is most exposed on %s: %s pulls %.1f points the other way.",
                        f.category().getDisplayName().toLowerCase(), f.factor(), Math.abs(f.contribution())))
                .orElse(String.format("The main threat is %s starting quickly and forcing the game out of "
                        + "the projected script.", fixture.getAwayTeam()));

        String summary = primary == null
                ? fixture.getMatchLabel()
                : String.format("%s: %s (%.2f)", fixture.getMatchLabel(), primary.getSelection(), primary.getOdds());

        log.debug("Narrative built | Fixture: {} | Strongest: {} | Weakest: {}",
                fixture.getId(), strongest.map(FactorObservation::factor).orElse("none"),
                weakest.map(FactorObservation::factor).orElse("none"));
        return new Narrative(summary, gameScript, marketEdge, failurePoint);
    }

    /**
     * VaR and CVaR are fixed multiples of the primary stake.
     */
    public RiskAssessment assessRisk(AnalysisBundle bundle) {
        MarketQuote primary = bundle.getPrimaryMarket();
        TrueProbability tp = bundle.getTrueProbability();
        double stake = primary != null ? primary.getRecommendedStake().units() : 0.0;

        String sensitivity = primary == null
                ? "No priced market to stress."
                : String.format("Edge disappears if the price shortens below %.2f.",
                        100.0 / primary.getCalculatedProbability().ensembleAverage());
        String adversarial = String.format("Uncapped estimate %.1f%% vs working estimate %.1f%%; "
                        + "a market-implied %.1f%% would remove the edge entirely.",
                tp.raw() * 100.0, tp.capped() * 100.0, tp.marketImplied() * 100.0);
        String blackSwan = bundle.isSignalsAvailable()
                ? "Low exposure: the projection does not rely on a single signal."
                : "Elevated exposure: contextual signals were unavailable for this run.";

        List<String> failures = new ArrayList<>();
        bundle.getSignals().stream()
                .filter(f -> f.impact() < 0)
                .sorted(Comparator.comparingDouble(FactorObservation::contribution))
                .limit(3)
                .forEach(f -> failures.add(f.category().getDisplayName() + ": " + f.factor()));
        if (failures.isEmpty()) {
            failures.add("Unexpected tactical adjustment");
            failures.add("Key player early injury");
        }

        return new RiskAssessment(
                round2(stake * VAR_FACTOR),
                round2(stake * CVAR_FACTOR),
                sensitivity,
                adversarial,
                blackSwan,
                SPORT_RISKS.getOrDefault(bundle.getFixture().getSport(), List.of()),
                List.copyOf(failures));
    }

    /**
     * Fallback selection: the over leg of the totals market, otherwise the runner-up market.
     */
    public ContingencyPick contingency(AnalysisBundle bundle) {
        MarketQuote primary = bundle.getPrimaryMarket();
        if (primary == null) {
            return null;
        }
        double stake = round2(primary.getRecommendedStake().units() * CONTINGENCY_STAKE_FACTOR);

        Optional<MarketQuote> over = bundle.getMarkets().stream()
                .filter(m -> m.getCategory() == MarketCategory.TOTALS)
                .filter(m -> m.getSelection().startsWith("Over"))
                .filter(m -> !m.getId().equals(primary.getId()))
                .findFirst();
        Optional<MarketQuote> fallback = over.or(() -> bundle.getMarkets().stream()
                .filter(m -> !m.getId().equals(primary.getId()))
                .max(Comparator.comparingDouble(MarketQuote::getEdge)));

        return fallback
                .map(m -> new ContingencyPick(m.getSelection(), m.getOdds(), stake,
                        String.format("Use if %s drifts below %.2f or team news changes the script.",
                                primary.getSelection(), round2(primary.getOdds() - 0.15))))
                .orElse(null);
    }

    /** High, Medium or Low depending on how much the estimate leaned on the cap and on live signals. */
    public String stability(AnalysisBundle bundle) {
        if (!bundle.isSignalsAvailable()) {
            return "Low";
        }
        TrueProbability tp = bundle.getTrueProbability();
        boolean capped = round1(tp.raw() * 100.0) != round1(tp.capped() * 100.0);
        return !capped && bundle.getFactorConfidence() >= 7.0 ? "High" : "Medium";
    }

    private static Optional<FactorObservation> strongest(List<FactorObservation> signals, boolean positive) {
        Comparator<FactorObservation> byContribution = Comparator.comparingDouble(FactorObservation::contribution);
        return positive
                ? signals.stream().filter(f -> f.category() != null).max(byContribution)
                : signals.stream().filter(f -> f.category() != null).min(byContribution);
    }
}

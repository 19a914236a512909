package com.mouse.apex.manager;

import com.mouse.apex.config.PipelineConfig;
import com.mouse.apex.enums.AnalysisMode;
import com.mouse.apex.enums.PipelineState;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.CollaboratorUnavailableException;
import com.mouse.apex.exception.FixtureAnalysisException;
import com.mouse.apex.exception.NoHighValueFixturesException;
import com.mouse.apex.exception.PredictionPipelineException;
import com.mouse.apex.interfaces.LeagueMetadataLookup;
import com.mouse.apex.interfaces.MatchDataProvider;
import com.mouse.apex.interfaces.OddsSourceAdapter;
import com.mouse.apex.interfaces.SignalAggregator;
import com.mouse.apex.model.AnalysisBundle;
import com.mouse.apex.model.DateFilter;
import com.mouse.apex.model.FactorObservation;
import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.MarketQuote;
import com.mouse.apex.model.MatchContext;
import com.mouse.apex.model.OddsQuote;
import com.mouse.apex.model.PipelineReport;
import com.mouse.apex.model.PipelineResult;
import com.mouse.apex.model.Prediction;
import com.mouse.apex.model.TrueProbability;
import com.mouse.apex.service.FactorSynthesizer;
import com.mouse.apex.service.MarketGenerator;
import com.mouse.apex.service.NarrativeBuilder;
import com.mouse.apex.service.PipelineMetricsService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import static com.mouse.apex.utils.NumberUtils.round2;

/**
 * Runs one prediction pipeline: scan, deep-dive, narrative, selection.
 * Collaborator calls fan out on the pipeline executor; every fixture's analysis is
 * computed independently and merged on the calling thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionOrchestrator {

    private static final String EMOJI_SCAN = "🔍";
    private static final String EMOJI_DIVE = "🔬";
    private static final String EMOJI_PICK = "🎯";
    private static final int KEY_FEATURE_LIMIT = 5;
    private static final int MAIN_SOURCE_LIMIT = 5;

    private final OddsSourceAdapter oddsSourceAdapter;
    private final SignalAggregator signalAggregator;
    private final MatchDataProvider matchDataProvider;
    private final LeagueMetadataLookup leagueMetadataLookup;
    private final FactorSynthesizer factorSynthesizer;
    private final MarketGenerator marketGenerator;
    private final NarrativeBuilder narrativeBuilder;
    private final PipelineMetricsService metricsService;
    private final PipelineConfig pipelineConfig;
    private final ExecutorService pipelineExecutor;
    private final Clock clock;

    /**
     * @throws NoHighValueFixturesException BEST_PICK with nothing clearing the scan threshold
     * @throws PredictionPipelineException  odds unavailable, or every BEST_PICK candidate failed
     */
    public PipelineResult run(SportEnum sport, DateFilter dateFilter, AnalysisMode mode) {
        PipelineRun run = new PipelineRun(UUID.randomUUID().toString().substring(0, 8), sport, mode);
        Instant startedAt = clock.instant();
        try {
            run.transition(PipelineState.SCANNING);
            List<OddsQuote> quotes = fetchOdds(sport);
            List<OddsQuote> shortlist = scan(quotes, dateFilter);
            log.info("{} Scan complete | Run: {} | Sport: {} | Filter: {} | Fixtures: {} | Shortlisted: {}",
                    EMOJI_SCAN, run.id, sport, dateFilter, quotes.size(), shortlist.size());

            if (shortlist.isEmpty()) {
                if (mode == AnalysisMode.BEST_PICK) {
                    throw new NoHighValueFixturesException("No high-value fixtures found for " + sport.getName());
                }
                return finish(run, List.of(), report(run, dateFilter, startedAt, quotes.size(), 0, List.of(), 0));
            }

            run.transition(PipelineState.DEEP_DIVING);
            List<OddsQuote> candidates = mode == AnalysisMode.BEST_PICK
                    ? shortlist.subList(0, Math.min(pipelineConfig.getBestPickTopN(), shortlist.size()))
                    : shortlist;
            List<AnalysisBundle> bundles = deepDiveAll(run, candidates);
            int dropped = candidates.size() - bundles.size();
            if (bundles.isEmpty() && mode == AnalysisMode.BEST_PICK) {
                throw new PredictionPipelineException("All " + candidates.size()
                        + " candidate fixtures failed analysis for " + sport.getName());
            }

            run.transition(PipelineState.BUILDING_NARRATIVE);
            List<Prediction> predictions = new ArrayList<>();
            for (AnalysisBundle bundle : bundles) {
                predictions.add(toPrediction(bundle));
            }

            run.transition(PipelineState.SELECTING);
            List<Prediction> selected = select(predictions, mode);

            PipelineReport report = report(run, dateFilter, startedAt, quotes.size(), candidates.size(), bundles, dropped);
            selected.stream().findFirst().ifPresent(best -> log.info(
                    "{} Selection complete | Run: {} | Mode: {} | Best: {} | Pick: {} | Edge: {} | EV: {}",
                    EMOJI_PICK, run.id, mode, best.getMatch(), best.getBetType(), best.getEdge(),
                    best.getExpectedValue()));
            return finish(run, selected, report);
        } catch (NoHighValueFixturesException | PredictionPipelineException e) {
            fail(run, e);
            throw e;
        } catch (RuntimeException e) {
            fail(run, e);
            throw new PredictionPipelineException("Prediction pipeline failed for " + sport.getName()
                    + ": " + e.getMessage(), e);
        }
    }

    List<OddsQuote> fetchOdds(SportEnum sport) {
        try {
            return call(() -> oddsSourceAdapter.getOdds(sport)).join();
        } catch (CompletionException e) {
            metricsService.recordCollaboratorFailure();
            Throwable cause = unwrap(e);
            throw new PredictionPipelineException("Odds source " + oddsSourceAdapter.sourceName()
                    + " unavailable: " + describe(cause), new CollaboratorUnavailableException(describe(cause), cause));
        }
    }

    /**
     * Keeps fixtures whose initial edge clears the threshold, best first.
     * Formula: initial edge = (assumedProbability * odds - 1) * 100
     */
    List<OddsQuote> scan(List<OddsQuote> quotes, DateFilter dateFilter) {
        double threshold = pipelineConfig.getScanEdgeThreshold();
        return quotes.stream()
                .filter(q -> q.getFixture() != null)
                .filter(q -> dateFilter.matches(q.getFixture().getKickoff(), clock))
                .filter(q -> initialEdge(q) > threshold)
                .sorted(Comparator.comparingDouble(this::initialEdge).reversed())
                .toList();
    }

    double initialEdge(OddsQuote quote) {
        return (pipelineConfig.getScanAssumedProbability() * quote.getSelectionOdds() - 1.0) * 100.0;
    }

    private List<AnalysisBundle> deepDiveAll(PipelineRun run, List<OddsQuote> candidates) {
        List<CompletableFuture<AnalysisBundle>> futures = new ArrayList<>();
        for (OddsQuote quote : candidates) {
            futures.add(deepDive(quote).handle((bundle, ex) -> {
                if (ex == null) {
                    return bundle;
                }
                Fixture fixture = quote.getFixture();
                log.error("Fixture analysis failed, dropping | Run: {} | Fixture: {} | Match: {} | Error: {}",
                        run.id, fixture.getId(), fixture.getMatchLabel(), describe(unwrap(ex)));
                return null;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<AnalysisBundle> bundles = futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .toList();
        log.info("{} Deep-dive complete | Run: {} | Candidates: {} | Analysed: {}",
                EMOJI_DIVE, run.id, candidates.size(), bundles.size());
        return bundles;
    }

    /**
     * Signals and match data are fetched concurrently; synthesis starts once both
     * have completed or been written off.
     */
    CompletableFuture<AnalysisBundle> deepDive(OddsQuote quote) {
        Fixture fixture = quote.getFixture();
        CompletableFuture<Fetched<List<FactorObservation>>> signals =
                recover(call(() -> signalAggregator.getSignals(fixture)), List.of(), "signal aggregator", fixture);
        CompletableFuture<Fetched<MatchContext>> context =
                recover(call(() -> matchDataProvider.getMatchContext(fixture)), MatchContext.unavailable(fixture),
                        "match data provider", fixture);
        return signals.thenCombine(context, (s, c) -> analyse(quote, s, c));
    }

    private AnalysisBundle analyse(OddsQuote quote, Fetched<List<FactorObservation>> signals,
                                   Fetched<MatchContext> context) {
        Fixture fixture = quote.getFixture();
        try {
            MatchContext matchContext = context.value() != null ? context.value() : MatchContext.unavailable(fixture);
            List<FactorObservation> observations = new ArrayList<>();
            if (signals.value() != null) {
                observations.addAll(signals.value());
            }
            observations.addAll(factorSynthesizer.contextSignals(matchContext));

            TrueProbability trueProbability = factorSynthesizer.synthesize(observations, quote.getSelectionOdds());
            List<MarketQuote> markets = marketGenerator.generate(fixture, quote, trueProbability, matchContext);
            MarketQuote primary = MarketGenerator.selectPrimary(markets)
                    .orElseThrow(() -> new FixtureAnalysisException("No market could be priced for " + fixture.getId()));

            return AnalysisBundle.builder()
                    .fixture(fixture)
                    .quote(quote)
                    .signals(List.copyOf(observations))
                    .matchContext(matchContext)
                    .trueProbability(trueProbability.withMarketImplied(primary.getImpliedProbability() / 100.0))
                    .factorConfidence(factorSynthesizer.alignmentConfidence(observations))
                    .markets(markets)
                    .primaryMarket(primary)
                    .expectedValue(round2((trueProbability.capped() * quote.getSelectionOdds() - 1.0) * 100.0))
                    .signalsAvailable(signals.available())
                    .matchDataAvailable(context.available())
                    .build();
        } catch (FixtureAnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FixtureAnalysisException("Analysis failed for " + fixture.getMatchLabel() + ": " + e.getMessage(), e);
        }
    }

    private Prediction toPrediction(AnalysisBundle bundle) {
        Fixture fixture = bundle.getFixture();
        MarketQuote primary = bundle.getPrimaryMarket();

        Set<String> sources = new LinkedHashSet<>(bundle.getQuote().getSources());
        bundle.getSignals().stream().map(FactorObservation::source).filter(Objects::nonNull).forEach(sources::add);
        bundle.getMarkets().forEach(m -> sources.addAll(m.getDataSources()));

        return Prediction.builder()
                .id(fixture.getId())
                .sport(fixture.getSport())
                .league(fixture.getLeague())
                .leagueInfo(leagueMetadataLookup.lookup(fixture.getLeague()))
                .match(fixture.getMatchLabel())
                .homeTeam(fixture.getHomeTeam())
                .awayTeam(fixture.getAwayTeam())
                .kickoff(fixture.getKickoff())
                .betType(primary.getSelection())
                .bestOdds(primary.getOdds())
                .bookmaker(primary.getBookmaker())
                .edge(primary.getEdge())
                .confidence(bundle.getFactorConfidence())
                .expectedValue(bundle.getExpectedValue())
                .trueProbability(bundle.getTrueProbability())
                .markets(bundle.getMarkets())
                .primaryMarket(primary)
                .narrative(narrativeBuilder.buildNarrative(bundle))
                .keyFeatures(factorSynthesizer.keyFeatures(bundle.getSignals(), KEY_FEATURE_LIMIT))
                .riskAssessment(narrativeBuilder.assessRisk(bundle))
                .contingencyPick(narrativeBuilder.contingency(bundle))
                .totalDataSources(sources.size())
                .mainDataSources(sources.stream().limit(MAIN_SOURCE_LIMIT).toList())
                .predictionStability(narrativeBuilder.stability(bundle))
                .timestamp(clock.instant())
                .build();
    }

    /**
     * BEST_PICK keeps the highest expected value (first wins ties); ANALYZE_ALL sorts
     * by primary-market edge, best first.
     */
    private static List<Prediction> select(List<Prediction> predictions, AnalysisMode mode) {
        if (mode == AnalysisMode.BEST_PICK) {
            Prediction best = null;
            for (Prediction p : predictions) {
                if (best == null || p.getExpectedValue() > best.getExpectedValue()) {
                    best = p;
                }
            }
            return best == null ? List.of() : List.of(best);
        }
        return predictions.stream()
                .sorted(Comparator.comparingDouble(Prediction::getEdge).reversed())
                .toList();
    }

    private PipelineResult finish(PipelineRun run, List<Prediction> predictions, PipelineReport report) {
        run.transition(PipelineState.DONE);
        metricsService.recordRun(true);
        metricsService.recordFixtures(report.getAnalysed(), report.getDropped());
        return new PipelineResult(predictions, report.toBuilder().state(run.state).build());
    }

    private void fail(PipelineRun run, RuntimeException e) {
        log.error("Pipeline failed | Run: {} | Sport: {} | Mode: {} | State: {} | Error: {}",
                run.id, run.sport, run.mode, run.state, e.getMessage());
        run.transition(PipelineState.FAILED);
        metricsService.recordRun(false);
    }

    private PipelineReport report(PipelineRun run, DateFilter dateFilter, Instant startedAt, int scanned,
                                  int shortlisted, List<AnalysisBundle> bundles, int dropped) {
        Set<String> sources = new LinkedHashSet<>();
        sources.add(oddsSourceAdapter.sourceName());
        bundles.forEach(b -> sources.addAll(b.getQuote().getSources()));

        return PipelineReport.builder()
                .runId(run.id)
                .mode(run.mode)
                .sport(run.sport)
                .dateFilter(dateFilter.getValue())
                .state(run.state)
                .sources(List.copyOf(sources))
                .fixturesScanned(scanned)
                .shortlisted(shortlisted)
                .analysed(bundles.size())
                .dropped(dropped)
                .signalAggregatorAvailable(bundles.stream().allMatch(AnalysisBundle::isSignalsAvailable))
                .matchDataAvailable(bundles.stream().allMatch(AnalysisBundle::isMatchDataAvailable))
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .build();
    }

    private <T> CompletableFuture<T> call(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, pipelineExecutor)
                .orTimeout(pipelineConfig.getCollaboratorTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    private <T> CompletableFuture<Fetched<T>> recover(CompletableFuture<T> call, T fallback, String collaborator,
                                                       Fixture fixture) {
        return call.handle((value, ex) -> {
            if (ex == null) {
                return new Fetched<>(value, true);
            }
            metricsService.recordCollaboratorFailure();
            log.warn("CollaboratorUnavailable, treating as absent | Collaborator: {} | Fixture: {} | Error: {}",
                    collaborator, fixture.getId(), describe(unwrap(ex)));
            return new Fetched<>(fallback, false);
        });
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t) {
        if (t instanceof TimeoutException) {
            return "timed out";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down pipeline executor");
        pipelineExecutor.shutdown();
        try {
            if (!pipelineExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                pipelineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            pipelineExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Fetched<T>(T value, boolean available) {
    }

    /** State of one run; only the calling thread touches it. */
    private static final class PipelineRun {
        private final String id;
        private final SportEnum sport;
        private final AnalysisMode mode;
        private PipelineState state;

        private PipelineRun(String id, SportEnum sport, AnalysisMode mode) {
            this.id = id;
            this.sport = sport;
            this.mode = mode;
        }

        private void transition(PipelineState next) {
            if (state != null && state.isTerminal()) {
                throw new IllegalStateException("Run " + id + " already finished in state " + state);
            }
            if (next != PipelineState.FAILED && state != null && next.ordinal() <= state.ordinal()) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next);
            }
            log.debug("Pipeline state | Run: {} | {} -> {}", id, state, next);
            state = next;
        }
    }
}

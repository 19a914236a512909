package com.mouse.apex.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.apex.config.OddsApiConfig;
import com.mouse.apex.enums.FixtureStatus;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.CollaboratorUnavailableException;
import com.mouse.apex.interfaces.OddsSourceAdapter;
import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.MoneylinePrices;
import com.mouse.apex.model.OddsQuote;
import com.mouse.apex.model.SpreadPrice;
import com.mouse.apex.model.TotalsPrices;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Odds from The Odds API v4 (decimal h2h, spreads and totals). Each event becomes one
 * quote priced by the first bookmaker that offers match-winner odds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TheOddsApiAdapter implements OddsSourceAdapter {

    public static final String SOURCE_NAME = "The Odds API";
    static final int MAX_EVENTS = 10;
    static final Duration LIVE_WINDOW = Duration.ofHours(3);
    private static final String USED_HEADER = "x-requests-used";

    private final OkHttpClient oddsApiHttpClient;
    private final ObjectMapper objectMapper;
    private final OddsApiConfig oddsApiConfig;
    private final OddsApiRequestCounter requestCounter;
    private final Clock clock;

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public List<OddsQuote> getOdds(SportEnum sport) {
        if (!oddsApiConfig.isConfigured()) {
            throw new CollaboratorUnavailableException("Odds API key is not configured");
        }
        if (!requestCounter.tryAcquire()) {
            throw new CollaboratorUnavailableException("Odds API monthly request limit of "
                    + requestCounter.getLimit() + " reached");
        }

        HttpUrl url = HttpUrl.get(oddsApiConfig.getBaseUrl()).newBuilder()
                .addPathSegment("sports")
                .addPathSegment(sport.getOddsApiSportKey())
                .addPathSegment("odds")
                .addQueryParameter("apiKey", oddsApiConfig.getApiKey())
                .addQueryParameter("regions", oddsApiConfig.getRegions())
                .addQueryParameter("markets", oddsApiConfig.getMarkets())
                .addQueryParameter("oddsFormat", "decimal")
                .build();
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = oddsApiHttpClient.newCall(request).execute()) {
            syncQuota(response);
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new CollaboratorUnavailableException("Odds API returned HTTP " + response.code()
                        + " for " + sport.getOddsApiSportKey());
            }
            List<OddsQuote> quotes = parseEvents(body.string(), sport);
            log.info("Odds fetched | Source: {} | Sport: {} | Quotes: {} | RemainingRequests: {}",
                    SOURCE_NAME, sport, quotes.size(), requestCounter.getRemaining());
            return quotes;
        } catch (IOException e) {
            throw new CollaboratorUnavailableException("Odds API request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Events without usable match-winner prices are skipped.
     */
    public List<OddsQuote> parseEvents(String json, SportEnum sport) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException("Malformed Odds API payload: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new CollaboratorUnavailableException("Odds API payload is not an event array");
        }

        List<OddsQuote> quotes = new ArrayList<>();
        for (JsonNode event : root) {
            if (quotes.size() >= MAX_EVENTS) break;
            OddsQuote quote = parseEvent(event, sport);
            if (quote != null) {
                quotes.add(quote);
            }
        }
        return quotes;
    }

    private OddsQuote parseEvent(JsonNode event, SportEnum sport) {
        String home = event.path("home_team").asText(null);
        String away = event.path("away_team").asText(null);
        if (home == null || away == null) {
            log.debug("Skipping event without teams | Id: {}", event.path("id").asText());
            return null;
        }

        JsonNode bookmakers = event.path("bookmakers");
        JsonNode bookmaker = null;
        for (JsonNode candidate : bookmakers) {
            if (market(candidate, "h2h") != null) {
                bookmaker = candidate;
                break;
            }
        }
        if (bookmaker == null) {
            log.debug("Skipping event without match-winner prices | Id: {} | Match: {} vs {}",
                    event.path("id").asText(), home, away);
            return null;
        }

        Instant kickoff = parseInstant(event.path("commence_time").asText(null));
        Fixture fixture = Fixture.builder()
                .id(event.path("id").asText())
                .sport(sport)
                .league(event.path("sport_title").asText("Unknown League"))
                .homeTeam(home)
                .awayTeam(away)
                .kickoff(kickoff)
                .status(statusOf(kickoff))
                .build();

        String bookmakerTitle = bookmaker.path("title").asText("Multiple Bookmakers");
        return OddsQuote.builder()
                .fixture(fixture)
                .bookmaker(bookmakerTitle)
                .moneyline(moneyline(market(bookmaker, "h2h"), home, away))
                .spread(spread(market(bookmaker, "spreads"), home))
                .totals(totals(market(bookmaker, "totals")))
                .liquidity(liquidity(bookmakers.size()))
                .source(SOURCE_NAME)
                .source(bookmakerTitle)
                .build();
    }

    private static JsonNode market(JsonNode bookmaker, String key) {
        for (JsonNode market : bookmaker.path("markets")) {
            if (key.equals(market.path("key").asText())) {
                return market;
            }
        }
        return null;
    }

    private static JsonNode outcome(JsonNode market, String name) {
        for (JsonNode outcome : market.path("outcomes")) {
            if (name.equals(outcome.path("name").asText())) {
                return outcome;
            }
        }
        return null;
    }

    private static MoneylinePrices moneyline(JsonNode market, String home, String away) {
        JsonNode homeOutcome = outcome(market, home);
        JsonNode awayOutcome = outcome(market, away);
        if (homeOutcome == null || awayOutcome == null) {
            return null;
        }
        JsonNode draw = outcome(market, "Draw");
        return new MoneylinePrices(
                homeOutcome.path("price").asDouble(),
                draw != null ? draw.path("price").asDouble() : null,
                awayOutcome.path("price").asDouble());
    }

    private static SpreadPrice spread(JsonNode market, String home) {
        if (market == null) {
            return null;
        }
        JsonNode homeOutcome = outcome(market, home);
        if (homeOutcome == null || !homeOutcome.has("point")) {
            return null;
        }
        return new SpreadPrice(homeOutcome.path("point").asDouble(), homeOutcome.path("price").asDouble());
    }

    private static TotalsPrices totals(JsonNode market) {
        if (market == null) {
            return null;
        }
        JsonNode over = outcome(market, "Over");
        JsonNode under = outcome(market, "Under");
        if (over == null || under == null) {
            return null;
        }
        return new TotalsPrices(over.path("point").asDouble(), over.path("price").asDouble(),
                under.path("price").asDouble());
    }

    static MarketLiquidity liquidity(int bookmakerCount) {
        if (bookmakerCount >= 10) return MarketLiquidity.HIGH;
        if (bookmakerCount >= 4) return MarketLiquidity.MEDIUM;
        return MarketLiquidity.LOW;
    }

    FixtureStatus statusOf(Instant kickoff) {
        Instant now = clock.instant();
        if (kickoff == null || kickoff.isAfter(now)) {
            return FixtureStatus.UPCOMING;
        }
        boolean sameDay = LocalDate.ofInstant(kickoff, ZoneOffset.UTC).equals(LocalDate.ofInstant(now, ZoneOffset.UTC));
        if (sameDay && Duration.between(kickoff, now).compareTo(LIVE_WINDOW) < 0) {
            return FixtureStatus.LIVE;
        }
        return FixtureStatus.FINISHED;
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable commence_time: {}", value);
            return null;
        }
    }

    private void syncQuota(Response response) {
        String used = response.header(USED_HEADER);
        if (used == null) {
            return;
        }
        try {
            requestCounter.syncUsed(Integer.parseInt(used.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {} header: {}", USED_HEADER, used);
        }
    }
}

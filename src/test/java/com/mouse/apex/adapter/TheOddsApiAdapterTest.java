package com.mouse.apex.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.apex.config.OddsApiConfig;
import com.mouse.apex.enums.FixtureStatus;
import com.mouse.apex.enums.MarketLiquidity;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.CollaboratorUnavailableException;
import com.mouse.apex.model.MoneylinePrices;
import com.mouse.apex.model.OddsQuote;
import com.mouse.apex.model.SpreadPrice;
import com.mouse.apex.model.TotalsPrices;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class TheOddsApiAdapterTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    @Mock
    OkHttpClient httpClient;

    private OddsApiConfig config;
    private OddsApiRequestCounter counter;
    private TheOddsApiAdapter adapter;

    @BeforeEach
    void setup() {
        config = new OddsApiConfig();
        config.setApiKey("test-key");
        config.setBaseUrl("https://api.the-odds-api.com/v4");
        config.setRegions("uk");
        config.setMarkets("h2h,spreads,totals");
        counter = new OddsApiRequestCounter(500);
        adapter = new TheOddsApiAdapter(httpClient, new ObjectMapper(), config, counter,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void parseEvents_mapsPricesFromFirstBookmakerWithMatchOdds() throws IOException {
        List<OddsQuote> quotes = adapter.parseEvents(resource("/odds/soccer_epl.json"), SportEnum.FOOTBALL);

        assertThat(quotes).hasSize(2);
        OddsQuote arsenal = quotes.get(0);
        assertThat(arsenal.getFixture().getId()).isEqualTo("e912304de2b2ce35b473ce2ecd3d1502");
        assertThat(arsenal.getFixture().getMatchLabel()).isEqualTo("Arsenal vs Chelsea");
        assertThat(arsenal.getFixture().getLeague()).isEqualTo("EPL");
        assertThat(arsenal.getFixture().getKickoff()).isEqualTo(Instant.parse("2026-10-19T18:00:00Z"));
        assertThat(arsenal.getFixture().getStatus()).isEqualTo(FixtureStatus.UPCOMING);
        assertThat(arsenal.getBookmaker()).isEqualTo("Pinnacle");
        assertThat(arsenal.getMoneyline()).isEqualTo(new MoneylinePrices(1.90, 3.50, 4.00));
        assertThat(arsenal.getSpread()).isEqualTo(new SpreadPrice(-0.5, 1.95));
        assertThat(arsenal.getTotals()).isEqualTo(new TotalsPrices(2.5, 1.85, 2.00));
        assertThat(arsenal.getLiquidity()).isEqualTo(MarketLiquidity.LOW);
        assertThat(arsenal.getSources()).containsExactly("The Odds API", "Pinnacle");
        assertThat(arsenal.getSelectionOdds()).isEqualTo(1.95);
    }

    @Test
    void parseEvents_matchOddsOnly_selectionFallsBackToHomePrice() throws IOException {
        OddsQuote everton = adapter.parseEvents(resource("/odds/soccer_epl.json"), SportEnum.FOOTBALL).get(1);

        assertThat(everton.getSpread()).isNull();
        assertThat(everton.getTotals()).isNull();
        assertThat(everton.getSelectionOdds()).isEqualTo(2.60);
        assertThat(everton.getFixture().getStatus()).isEqualTo(FixtureStatus.LIVE);
    }

    @Test
    void parseEvents_capsEventCount() {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < 12; i++) {
            if (i > 0) json.append(',');
            json.append("""
                    {"id":"e%d","sport_title":"NBA","commence_time":"2026-10-20T00:00:00Z",
                     "home_team":"H%d","away_team":"A%d",
                     "bookmakers":[{"title":"DraftKings","markets":[{"key":"h2h","outcomes":[
                       {"name":"H%d","price":1.8},{"name":"A%d","price":2.1}]}]}]}
                    """.formatted(i, i, i, i, i));
        }
        json.append(']');

        List<OddsQuote> quotes = adapter.parseEvents(json.toString(), SportEnum.BASKETBALL);

        assertThat(quotes).hasSize(TheOddsApiAdapter.MAX_EVENTS);
        assertThat(quotes.get(0).getMoneyline().hasDraw()).isFalse();
    }

    @Test
    void parseEvents_malformedPayload_throws() {
        assertThatThrownBy(() -> adapter.parseEvents("{not json", SportEnum.FOOTBALL))
                .isInstanceOf(CollaboratorUnavailableException.class);
        assertThatThrownBy(() -> adapter.parseEvents("{\"message\":\"quota\"}", SportEnum.FOOTBALL))
                .isInstanceOf(CollaboratorUnavailableException.class);
    }

    @Test
    void getOdds_withoutApiKey_throwsBeforeCallingOut() {
        config.setApiKey("");

        assertThatThrownBy(() -> adapter.getOdds(SportEnum.FOOTBALL))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessageContaining("not configured");
        verifyNoInteractions(httpClient);
        assertThat(counter.getUsed()).isZero();
    }

    @Test
    void getOdds_monthlyLimitReached_throwsBeforeCallingOut() {
        counter.syncUsed(500);

        assertThatThrownBy(() -> adapter.getOdds(SportEnum.FOOTBALL))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessageContaining("limit");
        verifyNoInteractions(httpClient);
    }

    @Test
    void liquidity_tiersByBookmakerCount() {
        assertThat(TheOddsApiAdapter.liquidity(12)).isEqualTo(MarketLiquidity.HIGH);
        assertThat(TheOddsApiAdapter.liquidity(5)).isEqualTo(MarketLiquidity.MEDIUM);
        assertThat(TheOddsApiAdapter.liquidity(1)).isEqualTo(MarketLiquidity.LOW);
    }

    @Test
    void statusOf_classifiesKickoffAgainstClock() {
        assertThat(adapter.statusOf(NOW.plusSeconds(60))).isEqualTo(FixtureStatus.UPCOMING);
        assertThat(adapter.statusOf(NOW.minusSeconds(3600))).isEqualTo(FixtureStatus.LIVE);
        assertThat(adapter.statusOf(NOW.minusSeconds(4 * 3600))).isEqualTo(FixtureStatus.FINISHED);
        assertThat(adapter.statusOf(null)).isEqualTo(FixtureStatus.UPCOMING);
    }

    private String resource(String path) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(path)) {
            assertThat(in).as("resource %s", path).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

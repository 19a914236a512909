package com.mouse.apex.service;

import com.mouse.apex.enums.FixtureStatus;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.CollaboratorUnavailableException;
import com.mouse.apex.interfaces.OddsSourceAdapter;
import com.mouse.apex.model.DateFilter;
import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.FixtureListing;
import com.mouse.apex.model.OddsQuote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FixtureListingServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    @Mock
    OddsSourceAdapter oddsSourceAdapter;

    private FixtureListingService service;

    @BeforeEach
    void setup() {
        service = new FixtureListingService(oddsSourceAdapter, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void list_sortsByKickoffAndReportsCounts() {
        when(oddsSourceAdapter.getOdds(SportEnum.FOOTBALL)).thenReturn(footballQuotes());

        FixtureListing listing = service.list(SportEnum.FOOTBALL, null, null, DateFilter.all(), 100, 0);

        assertThat(listing.getFixtures()).extracting(Fixture::getId).containsExactly("d", "a", "b", "c");
        assertThat(listing.getTotal()).isEqualTo(4);
        assertThat(listing.getFilteredCount()).isEqualTo(4);
        assertThat(listing.getDateRange()).isEqualTo(
                new FixtureListing.DateRange(LocalDate.parse("2026-10-17"), LocalDate.parse("2026-10-20")));
    }

    @Test
    void list_appliesLeagueStatusAndDateFilters() {
        when(oddsSourceAdapter.getOdds(SportEnum.FOOTBALL)).thenReturn(footballQuotes());

        FixtureListing listing = service.list(SportEnum.FOOTBALL, "premier league", FixtureStatus.UPCOMING,
                DateFilter.parse("today"), 100, 0);

        assertThat(listing.getFixtures()).extracting(Fixture::getId).containsExactly("b");
        assertThat(listing.getTotal()).isEqualTo(4);
        assertThat(listing.getFilteredCount()).isEqualTo(1);
    }

    @Test
    void list_liveStatusUsesAdapterStatus() {
        when(oddsSourceAdapter.getOdds(SportEnum.FOOTBALL)).thenReturn(footballQuotes());

        FixtureListing listing = service.list(SportEnum.FOOTBALL, null, FixtureStatus.LIVE, DateFilter.all(), 100, 0);

        assertThat(listing.getFixtures()).extracting(Fixture::getId).containsExactly("a");
    }

    @Test
    void list_pagesAfterFiltering() {
        when(oddsSourceAdapter.getOdds(SportEnum.FOOTBALL)).thenReturn(footballQuotes());

        FixtureListing listing = service.list(SportEnum.FOOTBALL, null, null, DateFilter.all(), 2, 1);

        assertThat(listing.getFixtures()).extracting(Fixture::getId).containsExactly("a", "b");
        assertThat(listing.getFilteredCount()).isEqualTo(4);
        assertThat(listing.getLimit()).isEqualTo(2);
        assertThat(listing.getOffset()).isEqualTo(1);
    }

    @Test
    void list_nothingMatches_rangeDefaultsToNextTwoDays() {
        when(oddsSourceAdapter.getOdds(SportEnum.FOOTBALL)).thenReturn(footballQuotes());

        FixtureListing listing = service.list(SportEnum.FOOTBALL, "Serie A", null, DateFilter.all(), 100, 0);

        assertThat(listing.getFixtures()).isEmpty();
        assertThat(listing.getDateRange()).isEqualTo(
                new FixtureListing.DateRange(LocalDate.parse("2026-10-19"), LocalDate.parse("2026-10-21")));
    }

    @Test
    void list_allSports_skipsUnavailableSport() {
        when(oddsSourceAdapter.getOdds(SportEnum.FOOTBALL)).thenReturn(footballQuotes());
        when(oddsSourceAdapter.getOdds(SportEnum.BASKETBALL))
                .thenThrow(new CollaboratorUnavailableException("quota exhausted"));

        FixtureListing listing = service.list(null, null, null, DateFilter.all(), 100, 0);

        assertThat(listing.getTotal()).isEqualTo(4);
    }

    @Test
    void list_singleSportUnavailable_propagates() {
        when(oddsSourceAdapter.getOdds(SportEnum.HOCKEY))
                .thenThrow(new CollaboratorUnavailableException("quota exhausted"));

        assertThatThrownBy(() -> service.list(SportEnum.HOCKEY, null, null, DateFilter.all(), 100, 0))
                .isInstanceOf(CollaboratorUnavailableException.class);
    }

    @Test
    void list_negativeLimit_rejected() {
        assertThatThrownBy(() -> service.list(SportEnum.FOOTBALL, null, null, DateFilter.all(), -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<OddsQuote> footballQuotes() {
        return List.of(
                quote("b", "Premier League", "2026-10-19T19:00:00Z", FixtureStatus.UPCOMING),
                quote("c", "La Liga", "2026-10-20T18:00:00Z", FixtureStatus.UPCOMING),
                quote("a", "Premier League", "2026-10-19T08:30:00Z", FixtureStatus.LIVE),
                quote("d", "Premier League", "2026-10-17T15:00:00Z", FixtureStatus.FINISHED));
    }

    private static OddsQuote quote(String id, String league, String kickoff, FixtureStatus status) {
        Fixture fixture = Fixture.builder()
                .id(id)
                .sport(SportEnum.FOOTBALL)
                .league(league)
                .homeTeam("Home " + id)
                .awayTeam("Away " + id)
                .kickoff(Instant.parse(kickoff))
                .status(status)
                .build();
        return OddsQuote.builder().fixture(fixture).bookmaker("Pinnacle").build();
    }
}

package com.scoutintel.transferroom.output;

import com.scoutintel.transferroom.exception.UpsertException;
import com.scoutintel.transferroom.model.CompetitionRecord;
import com.scoutintel.transferroom.model.UpsertOutcome;
import com.scoutintel.transferroom.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompetitionStoreTest {

    private TestDatabase db;
    private CompetitionStore store;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        store = new CompetitionStore(db.jdbc());
    }

    private static CompetitionRecord premierLeague(String name) {
        return CompetitionRecord.builder()
                .externalId(1)
                .name(name)
                .externalCountryId(44)
                .countryName("England")
                .divisionLevel(1)
                .teamsJson("[{\"TeamId\":10}]")
                .avgTeamRating(new BigDecimal("78.40"))
                .build();
    }

    private Map<Integer, String> countries() {
        Map<Integer, String> countries = new LinkedHashMap<>();
        countries.put(44, "England");
        countries.put(31, "Netherlands");
        return countries;
    }

    @Test
    void upsertsCountriesAndReturnsTheirInternalIds() {
        Map<Integer, Long> first = store.upsertCountries(countries());
        Map<Integer, Long> second = store.upsertCountries(countries());

        assertThat(first).containsOnlyKeys(44, 31);
        assertThat(second).isEqualTo(first);
        assertThat(db.count("transferroom_countries")).isEqualTo(2);
    }

    @Test
    void secondUpsertOfSameCompetitionUpdatesInPlace() {
        Map<Integer, Long> countryMap = store.upsertCountries(countries());

        UpsertOutcome first = store.upsertCompetition(premierLeague("Premier League"), countryMap);
        UpsertOutcome second = store.upsertCompetition(premierLeague("English Premier League"), countryMap);

        assertThat(first).isEqualTo(UpsertOutcome.INSERTED);
        assertThat(second).isEqualTo(UpsertOutcome.UPDATED);
        assertThat(db.count("transferroom_competitions")).isEqualTo(1);

        String name = db.jdbc().getJdbcTemplate().queryForObject(
                "SELECT competition_name FROM transferroom_competitions WHERE transferroom_competition_id = 1",
                String.class);
        assertThat(name).isEqualTo("English Premier League");
    }

    @Test
    void resolvesCountryFromTheSyncMap() {
        Map<Integer, Long> countryMap = store.upsertCountries(countries());

        store.upsertCompetition(premierLeague("Premier League"), countryMap);

        Long countryId = db.jdbc().getJdbcTemplate().queryForObject(
                "SELECT country_id FROM transferroom_competitions WHERE transferroom_competition_id = 1",
                Long.class);
        assertThat(countryId).isEqualTo(countryMap.get(44));
    }

    @Test
    void unknownCountryIsStoredAsNull() {
        store.upsertCompetition(premierLeague("Premier League"), Map.of());

        Long countryId = db.jdbc().getJdbcTemplate().queryForObject(
                "SELECT country_id FROM transferroom_competitions WHERE transferroom_competition_id = 1",
                Long.class);
        assertThat(countryId).isNull();
        assertThat(store.findCompetitionId(1)).isPresent();
    }

    @Test
    void competitionWithoutIdIsRejected() {
        CompetitionRecord record = CompetitionRecord.builder().name("Nameless").build();

        assertThatThrownBy(() -> store.upsertCompetition(record, Map.of()))
                .isInstanceOf(UpsertException.class)
                .hasMessageContaining("record has no Id");
    }

    @Test
    void constraintViolationSurfacesAsUpsertException() {
        CompetitionRecord record = premierLeague("Premier League");
        record.setDivisionLevel(42);

        assertThatThrownBy(() -> store.upsertCompetition(record, Map.of()))
                .isInstanceOf(UpsertException.class)
                .satisfies(e -> assertThat(((UpsertException) e).getExternalId()).isEqualTo(1));
        assertThat(db.count("transferroom_competitions")).isZero();
    }
}

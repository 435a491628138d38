package com.scoutintel.transferroom.output;

import com.scoutintel.transferroom.exception.UpsertException;
import com.scoutintel.transferroom.model.CompetitionRecord;
import com.scoutintel.transferroom.model.UpsertOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upserts countries and competitions, keyed by their TransferRoom ids.
 */
@Component
@Slf4j
public class CompetitionStore {

    private static final List<ColumnBinding<Map.Entry<Integer, String>>> COUNTRY_COLUMNS = List.of(
            ColumnBinding.of("transferroom_country_id", Types.INTEGER, Map.Entry::getKey),
            ColumnBinding.of("country_name", Types.VARCHAR, Map.Entry::getValue)
    );

    private static final List<ColumnBinding<CompetitionRecord>> COMPETITION_COLUMNS = List.of(
            ColumnBinding.of("transferroom_competition_id", Types.INTEGER, CompetitionRecord::getExternalId),
            ColumnBinding.of("competition_name", Types.VARCHAR, CompetitionRecord::getName),
            ColumnBinding.of("country_id", Types.BIGINT, CompetitionRecord::getCountryId),
            ColumnBinding.of("transferroom_country_id", Types.INTEGER, CompetitionRecord::getExternalCountryId),
            ColumnBinding.of("country_name", Types.VARCHAR, CompetitionRecord::getCountryName),
            ColumnBinding.of("division_level", Types.INTEGER, CompetitionRecord::getDivisionLevel),
            ColumnBinding.json("teams_data", CompetitionRecord::getTeamsJson),
            ColumnBinding.of("avg_team_rating", Types.NUMERIC, CompetitionRecord::getAvgTeamRating),
            ColumnBinding.of("avg_starter_rating", Types.NUMERIC, CompetitionRecord::getAvgStarterRating)
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final UpsertStatement<Map.Entry<Integer, String>> countryUpsert;
    private final UpsertStatement<CompetitionRecord> competitionUpsert;

    public CompetitionStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        DatabaseDialect dialect = DatabaseDialect.detect(jdbc.getJdbcTemplate().getDataSource());
        this.countryUpsert = UpsertStatement.build(dialect, "transferroom_countries",
                "transferroom_country_id", COUNTRY_COLUMNS, List.of("updated_at"));
        this.competitionUpsert = UpsertStatement.build(dialect, "transferroom_competitions",
                "transferroom_competition_id", COMPETITION_COLUMNS, List.of("updated_at", "last_synced_at"));
    }

    /**
     * Upsert every country and return TransferRoom country id → internal country_id.
     * Run once per sync, before any competition is written.
     */
    public Map<Integer, Long> upsertCountries(Map<Integer, String> countries) {
        log.info("Upserting {} countries...", countries.size());
        Map<Integer, Long> countryMap = new LinkedHashMap<>();
        for (Map.Entry<Integer, String> country : countries.entrySet()) {
            jdbc.update(countryUpsert.sql(), countryUpsert.parameters(country));
            Long internalId = jdbc.queryForObject(
                    "SELECT country_id FROM transferroom_countries WHERE transferroom_country_id = :id",
                    new MapSqlParameterSource("id", country.getKey()),
                    Long.class);
            countryMap.put(country.getKey(), internalId);
        }
        log.info("Upserted {} countries", countryMap.size());
        return countryMap;
    }

    /**
     * Insert or overwrite one competition. A country id missing from the map is stored as null.
     */
    public UpsertOutcome upsertCompetition(CompetitionRecord competition, Map<Integer, Long> countryMap) {
        Integer externalId = competition.getExternalId();
        if (externalId == null) {
            throw new UpsertException("competition", null, "record has no Id");
        }
        competition.setCountryId(competition.getExternalCountryId() == null
                ? null
                : countryMap.get(competition.getExternalCountryId()));

        try {
            boolean exists = findCompetitionId(externalId).isPresent();
            jdbc.update(competitionUpsert.sql(), competitionUpsert.parameters(competition));
            return exists ? UpsertOutcome.UPDATED : UpsertOutcome.INSERTED;
        } catch (DataAccessException e) {
            throw new UpsertException("competition", externalId, e.getMostSpecificCause().getMessage(), e);
        }
    }

    public Optional<Long> findCompetitionId(Integer externalCompetitionId) {
        List<Long> ids = jdbc.queryForList(
                "SELECT competition_id FROM transferroom_competitions WHERE transferroom_competition_id = :id",
                new MapSqlParameterSource("id", externalCompetitionId),
                Long.class);
        return ids.stream().findFirst();
    }
}

package com.scoutintel.transferroom.output;

import com.scoutintel.transferroom.exception.UpsertException;
import com.scoutintel.transferroom.model.PlayerRecord;
import com.scoutintel.transferroom.model.UpsertOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Types;
import java.util.List;
import java.util.Optional;

/**
 * Upserts players keyed by TR_ID, resolving the competition foreign key on the way in.
 */
@Component
@Slf4j
public class PlayerStore {

    private static final List<ColumnBinding<PlayerRecord>> COLUMNS = List.of(
            ColumnBinding.of("transferroom_player_id", Types.INTEGER, PlayerRecord::getExternalId),
            ColumnBinding.of("wyscout_id", Types.INTEGER, PlayerRecord::getWyscoutId),
            ColumnBinding.of("trmarkt_id", Types.INTEGER, PlayerRecord::getTrmarktId),
            ColumnBinding.of("name", Types.VARCHAR, PlayerRecord::getName),
            ColumnBinding.of("birth_date", Types.DATE, PlayerRecord::getBirthDate),
            ColumnBinding.of("parent_team_id", Types.INTEGER, PlayerRecord::getParentTeamId),
            ColumnBinding.of("current_team_id", Types.INTEGER, PlayerRecord::getCurrentTeamId),
            ColumnBinding.of("parent_team", Types.VARCHAR, PlayerRecord::getParentTeam),
            ColumnBinding.of("current_team", Types.VARCHAR, PlayerRecord::getCurrentTeam),
            ColumnBinding.json("team_history", PlayerRecord::getTeamHistory),
            ColumnBinding.of("country", Types.VARCHAR, PlayerRecord::getCountry),
            ColumnBinding.of("country_id", Types.INTEGER, PlayerRecord::getCountryId),
            ColumnBinding.of("competition_id", Types.BIGINT, PlayerRecord::getCompetitionId),
            ColumnBinding.of("transferroom_competition_id", Types.INTEGER, PlayerRecord::getExternalCompetitionId),
            ColumnBinding.of("competition", Types.VARCHAR, PlayerRecord::getCompetition),
            ColumnBinding.of("division_level", Types.INTEGER, PlayerRecord::getDivisionLevel),
            ColumnBinding.of("competition_name_mapped", Types.VARCHAR, PlayerRecord::getCompetitionNameMapped),
            ColumnBinding.of("parent_country", Types.VARCHAR, PlayerRecord::getParentCountry),
            ColumnBinding.of("parent_country_id", Types.INTEGER, PlayerRecord::getParentCountryId),
            ColumnBinding.of("parent_competition", Types.VARCHAR, PlayerRecord::getParentCompetition),
            ColumnBinding.of("parent_division_level", Types.INTEGER, PlayerRecord::getParentDivisionLevel),
            ColumnBinding.of("nationality1", Types.VARCHAR, PlayerRecord::getNationality1),
            ColumnBinding.of("nationality1_country_id", Types.INTEGER, PlayerRecord::getNationality1CountryId),
            ColumnBinding.of("nationality2", Types.VARCHAR, PlayerRecord::getNationality2),
            ColumnBinding.of("nationality2_country_id", Types.INTEGER, PlayerRecord::getNationality2CountryId),
            ColumnBinding.of("first_position", Types.VARCHAR, PlayerRecord::getFirstPosition),
            ColumnBinding.of("second_position", Types.VARCHAR, PlayerRecord::getSecondPosition),
            ColumnBinding.of("first_position_full", Types.VARCHAR, PlayerRecord::getFirstPositionFull),
            ColumnBinding.of("second_position_full", Types.VARCHAR, PlayerRecord::getSecondPositionFull),
            ColumnBinding.of("playing_style", Types.VARCHAR, PlayerRecord::getPlayingStyle),
            ColumnBinding.of("preferred_foot", Types.VARCHAR, PlayerRecord::getPreferredFoot),
            ColumnBinding.of("contract_expiry", Types.DATE, PlayerRecord::getContractExpiry),
            ColumnBinding.of("agency", Types.VARCHAR, PlayerRecord::getAgency),
            ColumnBinding.of("agency_verified", Types.BOOLEAN, PlayerRecord::getAgencyVerified),
            ColumnBinding.of("estimated_salary", Types.VARCHAR, PlayerRecord::getEstimatedSalary),
            ColumnBinding.of("shortlisted", Types.VARCHAR, PlayerRecord::getShortlisted),
            ColumnBinding.of("current_club_recent_mins_perc", Types.NUMERIC, PlayerRecord::getCurrentClubRecentMinsPerc),
            ColumnBinding.of("gbe_score", Types.INTEGER, PlayerRecord::getGbeScore),
            ColumnBinding.of("gbe_result", Types.VARCHAR, PlayerRecord::getGbeResult),
            ColumnBinding.of("gbe_int_app_pts", Types.INTEGER, PlayerRecord::getGbeIntAppPts),
            ColumnBinding.of("gbe_dom_mins_pts", Types.INTEGER, PlayerRecord::getGbeDomMinsPts),
            ColumnBinding.of("gbe_cont_mins_pts", Types.INTEGER, PlayerRecord::getGbeContMinsPts),
            ColumnBinding.of("gbe_league_pos_pts", Types.INTEGER, PlayerRecord::getGbeLeaguePosPts),
            ColumnBinding.of("gbe_cont_prog_pts", Types.INTEGER, PlayerRecord::getGbeContProgPts),
            ColumnBinding.of("gbe_league_std_pts", Types.INTEGER, PlayerRecord::getGbeLeagueStdPts),
            ColumnBinding.of("xtv", Types.NUMERIC, PlayerRecord::getXtv),
            ColumnBinding.of("xtv_change_6m_perc", Types.NUMERIC, PlayerRecord::getXtvChange6mPerc),
            ColumnBinding.of("xtv_change_12m_perc", Types.NUMERIC, PlayerRecord::getXtvChange12mPerc),
            ColumnBinding.json("xtv_history", PlayerRecord::getXtvHistory),
            ColumnBinding.of("base_value", Types.NUMERIC, PlayerRecord::getBaseValue),
            ColumnBinding.json("base_value_history", PlayerRecord::getBaseValueHistory),
            ColumnBinding.of("rating", Types.NUMERIC, PlayerRecord::getRating),
            ColumnBinding.of("potential", Types.NUMERIC, PlayerRecord::getPotential),
            ColumnBinding.of("available_sale", Types.BOOLEAN, PlayerRecord::getAvailableSale),
            ColumnBinding.of("available_asking_price", Types.NUMERIC, PlayerRecord::getAvailableAskingPrice),
            ColumnBinding.of("available_sell_on", Types.NUMERIC, PlayerRecord::getAvailableSellOn),
            ColumnBinding.of("available_loan", Types.BOOLEAN, PlayerRecord::getAvailableLoan),
            ColumnBinding.of("available_monthly_loan_fee", Types.NUMERIC, PlayerRecord::getAvailableMonthlyLoanFee),
            ColumnBinding.of("available_currency", Types.VARCHAR, PlayerRecord::getAvailableCurrency),
            ColumnBinding.json("raw_data", PlayerRecord::getRawPayload)
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final UpsertStatement<PlayerRecord> upsert;

    public PlayerStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        DatabaseDialect dialect = DatabaseDialect.detect(jdbc.getJdbcTemplate().getDataSource());
        this.upsert = UpsertStatement.build(dialect, "transferroom_players",
                "transferroom_player_id", COLUMNS, List.of("updated_at", "last_synced_at"));
    }

    /**
     * Insert or overwrite one player.
     *
     * competition_id is looked up from transferroom_competitions at write time; if the
     * competition has not been synced yet the column stays null and a later player
     * sync will fill it in.
     */
    public UpsertOutcome upsertPlayer(PlayerRecord player) {
        Integer externalId = player.getExternalId();
        if (externalId == null) {
            throw new UpsertException("player", null, "record has no TR_ID");
        }

        try {
            player.setCompetitionId(player.getExternalCompetitionId() == null
                    ? null
                    : findCompetitionId(player.getExternalCompetitionId()).orElse(null));

            boolean exists = findPlayerId(externalId).isPresent();
            jdbc.update(upsert.sql(), upsert.parameters(player));
            return exists ? UpsertOutcome.UPDATED : UpsertOutcome.INSERTED;
        } catch (DataAccessException e) {
            throw new UpsertException("player", externalId, e.getMostSpecificCause().getMessage(), e);
        }
    }

    public Optional<Long> findPlayerId(Integer externalPlayerId) {
        List<Long> ids = jdbc.queryForList(
                "SELECT player_id FROM transferroom_players WHERE transferroom_player_id = :id",
                new MapSqlParameterSource("id", externalPlayerId),
                Long.class);
        return ids.stream().findFirst();
    }

    private Optional<Long> findCompetitionId(Integer externalCompetitionId) {
        List<Long> ids = jdbc.queryForList(
                "SELECT competition_id FROM transferroom_competitions WHERE transferroom_competition_id = :id",
                new MapSqlParameterSource("id", externalCompetitionId),
                Long.class);
        if (ids.isEmpty()) {
            log.debug("Competition {} not synced yet, leaving competition_id null", externalCompetitionId);
        }
        return ids.stream().findFirst();
    }
}

package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scoutintel.transferroom.model.PlayerRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps raw TransferRoom player objects (as returned by GET /players) to {@link PlayerRecord}.
 *
 * Field names follow the external schema verbatim, including its mixed casing
 * (TR_ID, wyscout_id, xTVHistory, CompetitionName_Mapped). competitionId is resolved
 * later by the store.
 */
@Component
@RequiredArgsConstructor
public class PlayerRecordMapper {

    private final PayloadNormalizer normalizer;

    public PlayerRecord map(JsonNode raw) {
        String firstPosition = normalizer.text(raw.get("FirstPosition"));
        String secondPosition = normalizer.text(raw.get("SecondPosition"));

        return PlayerRecord.builder()
                .externalId(integer(raw, "TR_ID"))
                .wyscoutId(integer(raw, "wyscout_id"))
                .trmarktId(integer(raw, "trmarkt_id"))
                .name(text(raw, "Name"))
                .birthDate(normalizer.toDate(raw.get("BirthDate")))

                .parentTeamId(integer(raw, "ParentTeamId"))
                .currentTeamId(integer(raw, "CurrentTeamId"))
                .parentTeam(text(raw, "ParentTeam"))
                .currentTeam(text(raw, "CurrentTeam"))
                .teamHistory(normalizer.toCanonicalJson(raw.get("TeamHistory")))

                .country(text(raw, "Country"))
                .countryId(integer(raw, "CountryId"))
                .externalCompetitionId(integer(raw, "CompetitionId"))
                .competition(text(raw, "Competition"))
                .divisionLevel(integer(raw, "DivisionLevel"))
                .competitionNameMapped(text(raw, "CompetitionName_Mapped"))

                .parentCountry(text(raw, "ParentCountry"))
                .parentCountryId(integer(raw, "ParentCountryId"))
                .parentCompetition(text(raw, "ParentCompetition"))
                .parentDivisionLevel(integer(raw, "ParentDivisionLevel"))

                .nationality1(text(raw, "Nationality1"))
                .nationality1CountryId(integer(raw, "Nationality1CountryId"))
                .nationality2(text(raw, "Nationality2"))
                .nationality2CountryId(integer(raw, "Nationality2CountryId"))

                .firstPosition(firstPosition)
                .secondPosition(secondPosition)
                .firstPositionFull(normalizer.positionName(firstPosition))
                .secondPositionFull(normalizer.positionName(secondPosition))
                .playingStyle(text(raw, "PlayingStyle"))
                .preferredFoot(text(raw, "PreferredFoot"))

                .contractExpiry(normalizer.toDate(raw.get("ContractExpiry")))
                .agency(text(raw, "Agency"))
                .agencyVerified(normalizer.toBoolean(raw.get("AgencyVerified")))
                .estimatedSalary(text(raw, "EstimatedSalary"))

                .shortlisted(text(raw, "Shortlisted"))
                .currentClubRecentMinsPerc(normalizer.toDecimal(raw.get("CurrentClubRecentMinsPerc")))

                .gbeScore(integer(raw, "GBEScore"))
                .gbeResult(text(raw, "GBEResult"))
                .gbeIntAppPts(integer(raw, "GBEIntAppPts"))
                .gbeDomMinsPts(integer(raw, "GBEDomMinsPts"))
                .gbeContMinsPts(integer(raw, "GBEContMinsPts"))
                .gbeLeaguePosPts(integer(raw, "GBELeaguePosPts"))
                .gbeContProgPts(integer(raw, "GBEContProgPts"))
                .gbeLeagueStdPts(integer(raw, "GBELeagueStdPts"))

                .xtv(normalizer.toDecimal(raw.get("xTV")))
                .xtvChange6mPerc(normalizer.toDecimal(raw.get("xTVChange6mPerc")))
                .xtvChange12mPerc(normalizer.toDecimal(raw.get("xTVChange12mPerc")))
                .xtvHistory(normalizer.toCanonicalJson(raw.get("xTVHistory")))
                .baseValue(normalizer.toDecimal(raw.get("BaseValue")))
                .baseValueHistory(normalizer.toCanonicalJson(raw.get("BaseValueHistory")))
                .rating(normalizer.toDecimal(raw.get("Rating")))
                .potential(normalizer.toDecimal(raw.get("Potential")))

                .availableSale(normalizer.toBoolean(raw.get("AvailableSale")))
                .availableAskingPrice(normalizer.toDecimal(raw.get("AvailableAskingPrice")))
                .availableSellOn(normalizer.toDecimal(raw.get("AvailableSellOn")))
                .availableLoan(normalizer.toBoolean(raw.get("AvailableLoan")))
                .availableMonthlyLoanFee(normalizer.toDecimal(raw.get("AvailableMonthlyLoanFee")))
                .availableCurrency(text(raw, "AvailableCurrency"))

                .rawPayload(normalizer.writeJson(raw))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String text(JsonNode raw, String field) {
        return normalizer.text(raw.get(field));
    }

    private Integer integer(JsonNode raw, String field) {
        return normalizer.toInteger(raw.get(field));
    }
}

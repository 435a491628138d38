package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scoutintel.transferroom.model.CompetitionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps raw TransferRoom competition objects to {@link CompetitionRecord}.
 * countryId is left unset; the store fills it from the per-sync country map.
 */
@Component
@RequiredArgsConstructor
public class CompetitionRecordMapper {

    private final PayloadNormalizer normalizer;

    public CompetitionRecord map(JsonNode raw) {
        return CompetitionRecord.builder()
                .externalId(normalizer.toInteger(raw.get("Id")))
                .name(normalizer.text(raw.get("CompetitionName")))
                .externalCountryId(normalizer.toInteger(raw.get("CountryId")))
                .countryName(normalizer.text(raw.get("Country")))
                .divisionLevel(normalizer.toInteger(raw.get("DivisionLevel")))
                .teamsJson(normalizer.toCanonicalJson(raw.get("Teams")))
                .avgTeamRating(normalizer.toDecimal(raw.get("AvgTeamRating")))
                .avgStarterRating(normalizer.toDecimal(raw.get("AvgStarterRating")))
                .build();
    }

    /**
     * Distinct countries referenced by a competition batch, keyed by TransferRoom country id.
     * Entries missing either the id or the name are skipped; a later name wins.
     */
    public Map<Integer, String> countriesOf(List<JsonNode> rawCompetitions) {
        Map<Integer, String> countries = new LinkedHashMap<>();
        for (JsonNode raw : rawCompetitions) {
            if (raw == null || !raw.isObject()) continue;
            Integer countryId = normalizer.toInteger(raw.get("CountryId"));
            String countryName = normalizer.text(raw.get("Country"));
            if (countryId != null && countryName != null) {
                countries.put(countryId, countryName);
            }
        }
        return countries;
    }
}

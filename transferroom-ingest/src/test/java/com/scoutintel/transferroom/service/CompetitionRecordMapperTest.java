package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutintel.transferroom.model.CompetitionRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CompetitionRecordMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CompetitionRecordMapper mapper = new CompetitionRecordMapper(new PayloadNormalizer(objectMapper));

    @Test
    void mapsCompetitionFields() throws Exception {
        CompetitionRecord competition = mapper.map(objectMapper.readTree("""
                {"Id": 1, "CompetitionName": "Premier League", "Country": "England", "CountryId": 44,
                 "DivisionLevel": 1, "AvgTeamRating": 78.4, "AvgStarterRating": "80.1",
                 "Teams": [{"TeamId": 10}]}
                """));

        assertThat(competition.getExternalId()).isEqualTo(1);
        assertThat(competition.getName()).isEqualTo("Premier League");
        assertThat(competition.getExternalCountryId()).isEqualTo(44);
        assertThat(competition.getCountryName()).isEqualTo("England");
        assertThat(competition.getDivisionLevel()).isEqualTo(1);
        assertThat(competition.getAvgTeamRating()).isEqualByComparingTo("78.4");
        assertThat(competition.getAvgStarterRating()).isEqualByComparingTo("80.1");
        assertThat(competition.getTeamsJson()).isEqualTo("[{\"TeamId\":10}]");
        assertThat(competition.getCountryId()).isNull();
    }

    @Test
    void collectsDistinctCountriesSkippingIncompleteEntries() throws Exception {
        List<JsonNode> raw = new ArrayList<>();
        objectMapper.readTree("""
                [
                  {"Id": 1, "Country": "England", "CountryId": 44},
                  {"Id": 2, "Country": "England", "CountryId": 44},
                  {"Id": 3, "Country": "Netherlands", "CountryId": 31},
                  {"Id": 4, "Country": "Nowhere"},
                  {"Id": 5, "CountryId": 99}
                ]
                """).forEach(raw::add);

        Map<Integer, String> countries = mapper.countriesOf(raw);

        assertThat(countries).containsExactly(Map.entry(44, "England"), Map.entry(31, "Netherlands"));
    }
}

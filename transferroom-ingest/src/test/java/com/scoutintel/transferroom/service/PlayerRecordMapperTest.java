package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutintel.transferroom.model.PlayerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.InputStream;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerRecordMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PlayerRecordMapper mapper = new PlayerRecordMapper(new PayloadNormalizer(objectMapper));

    private JsonNode players;

    @BeforeEach
    void loadFixture() throws Exception {
        try (InputStream in = new ClassPathResource("fixtures/players.json").getInputStream()) {
            players = objectMapper.readTree(in);
        }
    }

    @Test
    void mapsIdentityAndDates() {
        PlayerRecord player = mapper.map(players.get(0));

        assertThat(player.getExternalId()).isEqualTo(1001);
        assertThat(player.getWyscoutId()).isEqualTo(555001);
        assertThat(player.getName()).isEqualTo("Jamie Example");
        assertThat(player.getBirthDate()).isEqualTo(LocalDate.of(1995, 6, 26));
        assertThat(player.getContractExpiry()).isEqualTo(LocalDate.of(2027, 6, 30));
        assertThat(player.getExternalCompetitionId()).isEqualTo(1);
        assertThat(player.getCompetitionId()).isNull();
    }

    @Test
    void expandsPositionsAndKeepsUnknownCodes() {
        PlayerRecord player = mapper.map(players.get(0));

        assertThat(player.getFirstPosition()).isEqualTo("CB");
        assertThat(player.getFirstPositionFull()).isEqualTo("Centre-Back");
        assertThat(player.getSecondPosition()).isEqualTo("XX");
        assertThat(player.getSecondPositionFull()).isEqualTo("XX");
    }

    @Test
    void normalisesNestedJsonAndBooleans() {
        PlayerRecord player = mapper.map(players.get(0));

        assertThat(player.getTeamHistory()).isEqualTo("[{\"Team\":\"Arsenal\",\"From\":\"2019-07-01\"}]");
        assertThat(player.getXtvHistory()).isEqualTo("[{\"Date\":\"2024-01-01\",\"Value\":11000000}]");
        assertThat(player.getAgencyVerified()).isTrue();
        assertThat(player.getAvailableSale()).isTrue();
        assertThat(player.getAvailableLoan()).isFalse();
        assertThat(player.getGbeScore()).isEqualTo(85);
        assertThat(player.getRating()).isEqualByComparingTo("74.5");
    }

    @Test
    void badFieldsDefaultToNullWithoutFailingTheRecord() {
        PlayerRecord player = mapper.map(players.get(1));

        assertThat(player.getExternalId()).isEqualTo(1002);
        assertThat(player.getBirthDate()).isEqualTo(LocalDate.of(2001, 2, 3));
        assertThat(player.getTeamHistory()).isNull();
        assertThat(player.getBaseValueHistory()).isNull();
        assertThat(player.getFirstPositionFull()).isEqualTo("Forward");
        assertThat(player.getSecondPosition()).isNull();
        assertThat(player.getAgencyVerified()).isNull();
    }

    @Test
    void keepsTheFullSourceRecord() throws Exception {
        JsonNode raw = players.get(1);
        PlayerRecord player = mapper.map(raw);

        assertThat(objectMapper.readTree(player.getRawPayload())).isEqualTo(raw);
    }

    @Test
    void recordWithoutIdMapsWithNullId() throws Exception {
        PlayerRecord player = mapper.map(objectMapper.readTree("{\"Name\": \"Nobody\"}"));

        assertThat(player.getExternalId()).isNull();
        assertThat(player.getName()).isEqualTo("Nobody");
    }
}

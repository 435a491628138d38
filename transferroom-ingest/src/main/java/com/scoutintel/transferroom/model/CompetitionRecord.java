package com.scoutintel.transferroom.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Normalised competition ready for the transferroom_competitions table.
 *
 * Schema design notes:
 *  - externalId (TransferRoom "Id") is the upsert conflict key
 *  - countryId is the internal country key, resolved from the per-sync country map
 *  - countryName is a denormalised snapshot of the source "Country" field
 */
@Data
@Builder
public class CompetitionRecord {

    private Integer externalId;
    private String name;

    private Long countryId;
    private Integer externalCountryId;
    private String countryName;

    /** League tier within the country, 1 = top flight */
    private Integer divisionLevel;

    /** Canonical JSON of the source "Teams" payload, opaque to the pipeline */
    private String teamsJson;

    private BigDecimal avgTeamRating;
    private BigDecimal avgStarterRating;
}

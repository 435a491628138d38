package com.scoutintel.transferroom.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Normalised player ready for the transferroom_players table.
 *
 * Typed fields cover what downstream queries use; rawPayload keeps the full
 * source record so new API fields can be backfilled without re-fetching.
 */
@Data
@Builder
public class PlayerRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    /** TransferRoom TR_ID, the upsert conflict key */
    private Integer externalId;
    private Integer wyscoutId;
    private Integer trmarktId;
    private String name;
    private LocalDate birthDate;

    // ── Teams ───────────────────────────────────────────────────────────────
    private Integer parentTeamId;
    private Integer currentTeamId;
    private String parentTeam;
    private String currentTeam;
    /** Canonical JSON array of past engagements, oldest first as delivered */
    private String teamHistory;

    // ── Country and competition ─────────────────────────────────────────────
    private String country;
    private Integer countryId;
    /** Internal competition key; resolved at write time, null when unknown */
    private Long competitionId;
    private Integer externalCompetitionId;
    private String competition;
    private Integer divisionLevel;
    private String competitionNameMapped;

    // ── Parent club (loan players) ──────────────────────────────────────────
    private String parentCountry;
    private Integer parentCountryId;
    private String parentCompetition;
    private Integer parentDivisionLevel;

    // ── Nationality ─────────────────────────────────────────────────────────
    private String nationality1;
    private Integer nationality1CountryId;
    private String nationality2;
    private Integer nationality2CountryId;

    // ── Positions ───────────────────────────────────────────────────────────
    private String firstPosition;
    private String secondPosition;
    private String firstPositionFull;
    private String secondPositionFull;
    private String playingStyle;
    private String preferredFoot;

    // ── Contract ────────────────────────────────────────────────────────────
    private LocalDate contractExpiry;
    private String agency;
    private Boolean agencyVerified;
    /** Free-text band, e.g. "20K - 30K" */
    private String estimatedSalary;

    // ── Scouting ────────────────────────────────────────────────────────────
    private String shortlisted;
    private BigDecimal currentClubRecentMinsPerc;

    // ── GBE (governing body endorsement) ────────────────────────────────────
    private Integer gbeScore;
    private String gbeResult;
    private Integer gbeIntAppPts;
    private Integer gbeDomMinsPts;
    private Integer gbeContMinsPts;
    private Integer gbeLeaguePosPts;
    private Integer gbeContProgPts;
    private Integer gbeLeagueStdPts;

    // ── Valuation ───────────────────────────────────────────────────────────
    private BigDecimal xtv;
    private BigDecimal xtvChange6mPerc;
    private BigDecimal xtvChange12mPerc;
    private String xtvHistory;
    private BigDecimal baseValue;
    private String baseValueHistory;
    private BigDecimal rating;
    private BigDecimal potential;

    // ── Availability ────────────────────────────────────────────────────────
    private Boolean availableSale;
    private BigDecimal availableAskingPrice;
    private BigDecimal availableSellOn;
    private Boolean availableLoan;
    private BigDecimal availableMonthlyLoanFee;
    private String availableCurrency;

    // ── Metadata ────────────────────────────────────────────────────────────
    /** Full source record as canonical JSON */
    private String rawPayload;
}

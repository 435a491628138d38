package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scoutintel.transferroom.config.TransferRoomProperties;
import com.scoutintel.transferroom.model.SyncRun;
import com.scoutintel.transferroom.model.SyncRunStats;
import com.scoutintel.transferroom.model.SyncType;
import com.scoutintel.transferroom.output.CompetitionStore;
import com.scoutintel.transferroom.output.PlayerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;

/**
 * Orchestrates a sync: open a run, fetch, map, upsert in sub-batches, close the run.
 *
 * Per-record failures are counted and the run carries on. Anything else (login, a fetch
 * that exhausted its retries, the database going away) closes the run as failed and is
 * rethrown to the caller.
 */
@Service
@Slf4j
public class IngestionPipeline {

    private final TransferRoomApiClient apiClient;
    private final CompetitionSeedLoader seedLoader;
    private final CompetitionRecordMapper competitionMapper;
    private final PlayerRecordMapper playerMapper;
    private final CompetitionStore competitionStore;
    private final PlayerStore playerStore;
    private final SyncRunTracker tracker;
    private final SubBatchWriter writer;
    private final TransactionTemplate transaction;
    private final TransferRoomProperties.Ingest settings;
    private final TransferRoomSession session;

    public IngestionPipeline(TransferRoomApiClient apiClient,
                             CompetitionSeedLoader seedLoader,
                             CompetitionRecordMapper competitionMapper,
                             PlayerRecordMapper playerMapper,
                             CompetitionStore competitionStore,
                             PlayerStore playerStore,
                             SyncRunTracker tracker,
                             SubBatchWriter writer,
                             PlatformTransactionManager transactionManager,
                             TransferRoomProperties properties) {
        this.apiClient = apiClient;
        this.seedLoader = seedLoader;
        this.competitionMapper = competitionMapper;
        this.playerMapper = playerMapper;
        this.competitionStore = competitionStore;
        this.playerStore = playerStore;
        this.tracker = tracker;
        this.writer = writer;
        this.transaction = new TransactionTemplate(transactionManager);
        this.settings = properties.getIngest();
        this.session = apiClient.openSession(properties.getApi().getEmail(), properties.getApi().getPassword());
    }

    /**
     * Load the competition list, upsert its countries, then upsert every competition.
     */
    public SyncRun ingestCompetitions() {
        log.info("Starting competitions ingestion...");
        SyncRunStats stats = new SyncRunStats();
        SyncRun run = tracker.start(SyncType.COMPETITIONS);

        try {
            List<JsonNode> competitions = seedLoader.load(session);
            stats.addFetched(competitions.size());

            Map<Integer, String> countries = competitionMapper.countriesOf(competitions);
            Map<Integer, Long> countryMap = transaction.execute(status -> competitionStore.upsertCountries(countries));

            writer.write("competition", competitions, settings.getCommitBatchSize(),
                    raw -> raw.path("Id").asText(null),
                    raw -> competitionStore.upsertCompetition(competitionMapper.map(raw), countryMap),
                    stats);

            log.info("Competitions ingestion complete: {} succeeded, {} failed",
                    stats.getRecordsSucceeded(), stats.getRecordsFailed());
            return tracker.complete(run, stats);

        } catch (RuntimeException e) {
            log.error("Competitions ingestion failed: {}", e.getMessage(), e);
            throw failRun(run, stats, e);
        }
    }

    /**
     * Page through GET /players until an empty page, or until maxRecords records have
     * been processed when a ceiling is given.
     *
     * @param maxRecords ceiling on processed records, or null for no ceiling
     */
    public SyncRun ingestPlayers(Integer maxRecords) {
        if (maxRecords != null && maxRecords < 0) {
            throw new IllegalArgumentException("maxRecords must not be negative: " + maxRecords);
        }
        log.info("Starting players ingestion from API (ceiling: {})", maxRecords == null ? "none" : maxRecords);
        SyncRunStats stats = new SyncRunStats();
        SyncRun run = tracker.start(SyncType.PLAYERS);

        try {
            int pageSize = settings.getPageSize();
            int offset = 0;
            int processed = 0;

            while (true) {
                if (maxRecords != null && processed >= maxRecords) {
                    log.info("Reached player ceiling of {}", maxRecords);
                    break;
                }

                List<JsonNode> page = apiClient.fetchPlayers(session, offset, pageSize);
                if (page.isEmpty()) {
                    log.info("No more players to fetch");
                    break;
                }
                stats.addFetched(page.size());

                List<JsonNode> toProcess = maxRecords == null
                        ? page
                        : page.subList(0, Math.min(page.size(), maxRecords - processed));

                writer.write("player", toProcess, settings.getCommitBatchSize(),
                        raw -> raw.path("TR_ID").asText(null),
                        raw -> playerStore.upsertPlayer(playerMapper.map(raw)),
                        stats);
                processed += toProcess.size();

                log.info("Progress: {}/{} players processed", processed, stats.getRecordsFetched());
                offset += pageSize;
                pause();
            }

            log.info("Players ingestion complete: {} processed, {} succeeded, {} failed",
                    processed, stats.getRecordsSucceeded(), stats.getRecordsFailed());
            return tracker.complete(run, stats);

        } catch (RuntimeException e) {
            log.error("Players ingestion failed: {}", e.getMessage(), e);
            throw failRun(run, stats, e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RuntimeException failRun(SyncRun run, SyncRunStats stats, RuntimeException cause) {
        try {
            tracker.fail(run, stats, cause);
        } catch (RuntimeException closeError) {
            log.error("Could not record failure of sync run {}: {}", run.getId(), closeError.getMessage());
            cause.addSuppressed(closeError);
        }
        return cause;
    }

    private void pause() {
        long delayMs = settings.getPageDelay().toMillis();
        if (delayMs <= 0) return;
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

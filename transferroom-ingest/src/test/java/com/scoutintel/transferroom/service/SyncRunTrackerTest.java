package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutintel.transferroom.exception.FetchException;
import com.scoutintel.transferroom.model.SyncRun;
import com.scoutintel.transferroom.model.SyncRunStats;
import com.scoutintel.transferroom.model.SyncStatus;
import com.scoutintel.transferroom.model.SyncType;
import com.scoutintel.transferroom.model.UpsertOutcome;
import com.scoutintel.transferroom.output.SyncRunStore;
import com.scoutintel.transferroom.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncRunTrackerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SyncRunStore store;
    private SyncRunTracker tracker;

    @BeforeEach
    void setUp() {
        store = new SyncRunStore(TestDatabase.create().jdbc());
        tracker = new SyncRunTracker(store, objectMapper);
    }

    @Test
    void startWritesAnInProgressRow() {
        SyncRun run = tracker.start(SyncType.PLAYERS);

        SyncRun stored = store.findById(run.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SyncStatus.IN_PROGRESS);
        assertThat(stored.getSyncType()).isEqualTo(SyncType.PLAYERS);
        assertThat(stored.getCompletedAt()).isNull();
        assertThat(stored.getDurationSeconds()).isNull();
    }

    @Test
    void completeRecordsCountersAndDuration() {
        SyncRun run = tracker.start(SyncType.COMPETITIONS);
        SyncRunStats stats = new SyncRunStats();
        stats.addFetched(3);
        stats.recordOutcome(UpsertOutcome.INSERTED);
        stats.recordOutcome(UpsertOutcome.UPDATED);
        stats.recordFailure("competition 3: division_level out of range");

        tracker.complete(run, stats);

        SyncRun stored = store.findById(run.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SyncStatus.COMPLETED);
        assertThat(stored.getRecordsFetched()).isEqualTo(3);
        assertThat(stored.getRecordsInserted()).isEqualTo(1);
        assertThat(stored.getRecordsUpdated()).isEqualTo(1);
        assertThat(stored.getRecordsFailed()).isEqualTo(1);
        assertThat(stored.getErrorMessage()).isNull();
        assertThat(stored.getCompletedAt()).isAfterOrEqualTo(stored.getStartedAt());
        assertThat(stored.getDurationSeconds()).isNotNull().isGreaterThanOrEqualTo(0L);
    }

    @Test
    void failRecordsTheErrorMessage() {
        SyncRun run = tracker.start(SyncType.PLAYERS);

        tracker.fail(run, new SyncRunStats(), new FetchException("/players", "Request failed: 503"));

        SyncRun stored = store.findById(run.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SyncStatus.FAILED);
        assertThat(stored.getErrorMessage()).isEqualTo("Request failed: 503 [/players]");
        assertThat(stored.getCompletedAt()).isAfterOrEqualTo(stored.getStartedAt());
    }

    @Test
    void failureWithoutMessageFallsBackToExceptionType() {
        SyncRun run = tracker.start(SyncType.PLAYERS);

        tracker.fail(run, new SyncRunStats(), new IllegalStateException());

        assertThat(store.findById(run.getId()).orElseThrow().getErrorMessage())
                .isEqualTo("java.lang.IllegalStateException");
    }

    @Test
    void metadataKeepsAtMostTenErrors() throws Exception {
        SyncRun run = tracker.start(SyncType.PLAYERS);
        SyncRunStats stats = new SyncRunStats();
        stats.addFetched(25);
        for (int i = 1; i <= 25; i++) {
            stats.recordFailure("player " + i + ": boom");
        }

        tracker.complete(run, stats);

        SyncRun stored = store.findById(run.getId()).orElseThrow();
        JsonNode errors = objectMapper.readTree(stored.getMetadata()).get("errors");
        assertThat(stored.getRecordsFailed()).isEqualTo(25);
        assertThat(errors).hasSize(10);
        assertThat(errors.get(0).asText()).isEqualTo("player 1: boom");
    }

    @Test
    void aRunCanOnlyBeClosedOnce() {
        SyncRun run = tracker.start(SyncType.COMPETITIONS);
        tracker.complete(run, new SyncRunStats());

        assertThatThrownBy(() -> tracker.fail(run, new SyncRunStats(), new RuntimeException("late")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.findById(run.getId()).orElseThrow().getStatus()).isEqualTo(SyncStatus.COMPLETED);
    }

    @Test
    void storeRefusesToReopenATerminalRow() {
        SyncRun run = tracker.start(SyncType.COMPETITIONS);
        tracker.complete(run, new SyncRunStats());

        SyncRun stale = SyncRun.builder()
                .id(run.getId())
                .syncType(SyncType.COMPETITIONS)
                .status(SyncStatus.FAILED)
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .build();

        assertThatThrownBy(() -> store.close(stale)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void findLatestReturnsTheNewestRunOfAType() {
        tracker.start(SyncType.PLAYERS);
        SyncRun second = tracker.start(SyncType.PLAYERS);
        tracker.start(SyncType.COMPETITIONS);

        assertThat(store.findLatest(SyncType.PLAYERS).orElseThrow().getId()).isEqualTo(second.getId());
    }
}

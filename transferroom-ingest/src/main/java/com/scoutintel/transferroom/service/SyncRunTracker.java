package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scoutintel.transferroom.model.SyncRun;
import com.scoutintel.transferroom.model.SyncRunStats;
import com.scoutintel.transferroom.model.SyncStatus;
import com.scoutintel.transferroom.model.SyncType;
import com.scoutintel.transferroom.output.SyncRunStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Opens and closes data_sync_runs rows.
 *
 * A run is written as in_progress before any data is touched and closed exactly once,
 * either completed or failed. The close carries the final counters, the duration and
 * up to {@link SyncRunStats#MAX_SAMPLED_ERRORS} sampled per-record errors as metadata.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncRunTracker {

    private final SyncRunStore store;
    private final ObjectMapper objectMapper;

    public SyncRun start(SyncType type) {
        Instant startedAt = Instant.now();
        long id = store.insert(type, startedAt);
        log.info("Sync run {} started ({})", id, type.value());
        return SyncRun.builder()
                .id(id)
                .syncType(type)
                .status(SyncStatus.IN_PROGRESS)
                .startedAt(startedAt)
                .build();
    }

    public SyncRun complete(SyncRun run, SyncRunStats stats) {
        close(run, SyncStatus.COMPLETED, stats, null);
        log.info("Sync run {} completed in {}s: fetched={}, inserted={}, updated={}, failed={}",
                run.getId(), run.getDurationSeconds(), run.getRecordsFetched(),
                run.getRecordsInserted(), run.getRecordsUpdated(), run.getRecordsFailed());
        return run;
    }

    public SyncRun fail(SyncRun run, SyncRunStats stats, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        close(run, SyncStatus.FAILED, stats, message);
        log.error("Sync run {} failed after {}s: {}", run.getId(), run.getDurationSeconds(), message);
        return run;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void close(SyncRun run, SyncStatus status, SyncRunStats stats, String errorMessage) {
        if (run.getStatus() != null && run.getStatus().isTerminal()) {
            throw new IllegalStateException("Sync run " + run.getId() + " is already " + run.getStatus().value());
        }

        Instant completedAt = Instant.now();
        long duration = Math.max(0, Duration.between(run.getStartedAt(), completedAt).getSeconds());

        SyncRun closed = SyncRun.builder()
                .id(run.getId())
                .syncType(run.getSyncType())
                .status(status)
                .startedAt(run.getStartedAt())
                .completedAt(completedAt)
                .durationSeconds(duration)
                .recordsFetched(stats.getRecordsFetched())
                .recordsInserted(stats.getRecordsInserted())
                .recordsUpdated(stats.getRecordsUpdated())
                .recordsFailed(stats.getRecordsFailed())
                .errorMessage(errorMessage)
                .metadata(metadata(stats))
                .build();
        store.close(closed);

        run.setStatus(closed.getStatus());
        run.setCompletedAt(closed.getCompletedAt());
        run.setDurationSeconds(closed.getDurationSeconds());
        run.setRecordsFetched(closed.getRecordsFetched());
        run.setRecordsInserted(closed.getRecordsInserted());
        run.setRecordsUpdated(closed.getRecordsUpdated());
        run.setRecordsFailed(closed.getRecordsFailed());
        run.setErrorMessage(closed.getErrorMessage());
        run.setMetadata(closed.getMetadata());
    }

    private String metadata(SyncRunStats stats) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode errors = root.putArray("errors");
        for (String error : stats.getErrors()) {
            errors.add(error);
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise sync run metadata", e);
        }
    }
}

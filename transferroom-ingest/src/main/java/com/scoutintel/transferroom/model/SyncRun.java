package com.scoutintel.transferroom.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Audit row for one sync invocation.
 * Stored in the data_sync_runs table; never deleted, frozen once the status is terminal.
 */
@Data
@Builder
public class SyncRun {

    private Long id;
    private SyncType syncType;
    private SyncStatus status;
    private Instant startedAt;
    private Instant completedAt;    // null while in progress
    private Long durationSeconds;
    private int recordsFetched;
    private int recordsInserted;
    private int recordsUpdated;
    private int recordsFailed;
    private String errorMessage;    // null unless failed
    private String metadata;        // {"errors": [...]}
}

package com.scoutintel.transferroom.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running counters for a sync run, plus a bounded sample of per-record error messages.
 */
@Getter
public class SyncRunStats {

    public static final int MAX_SAMPLED_ERRORS = 10;

    private int recordsFetched;
    private int recordsInserted;
    private int recordsUpdated;
    private int recordsFailed;
    private final List<String> errors = new ArrayList<>();

    public void addFetched(int count) {
        recordsFetched += count;
    }

    public void recordOutcome(UpsertOutcome outcome) {
        switch (outcome) {
            case INSERTED -> recordsInserted++;
            case UPDATED -> recordsUpdated++;
        }
    }

    public void recordFailure(String error) {
        recordsFailed++;
        if (errors.size() < MAX_SAMPLED_ERRORS) {
            errors.add(error);
        }
    }

    /**
     * Fold the tally of a committed sub-batch into this run's totals.
     * Fetched counts are not carried over; they are tracked per page.
     */
    public void absorb(SyncRunStats batch) {
        recordsInserted += batch.recordsInserted;
        recordsUpdated += batch.recordsUpdated;
        recordsFailed += batch.recordsFailed;
        for (String error : batch.errors) {
            if (errors.size() >= MAX_SAMPLED_ERRORS) break;
            errors.add(error);
        }
    }

    public int getRecordsSucceeded() {
        return recordsInserted + recordsUpdated;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}

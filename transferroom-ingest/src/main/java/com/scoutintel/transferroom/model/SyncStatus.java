package com.scoutintel.transferroom.model;

/**
 * Lifecycle of a sync run: in_progress, then exactly one of completed or failed.
 */
public enum SyncStatus {

    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    SyncStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public static SyncStatus fromValue(String value) {
        for (SyncStatus status : values()) {
            if (status.value.equals(value)) return status;
        }
        throw new IllegalArgumentException("Unknown sync status: " + value);
    }
}

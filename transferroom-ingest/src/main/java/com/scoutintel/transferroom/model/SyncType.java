package com.scoutintel.transferroom.model;

/**
 * Entity type a sync run covers. The lower-case value is what lands in data_sync_runs.sync_type.
 */
public enum SyncType {

    COMPETITIONS("competitions"),
    PLAYERS("players");

    private final String value;

    SyncType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SyncType fromValue(String value) {
        for (SyncType type : values()) {
            if (type.value.equals(value)) return type;
        }
        throw new IllegalArgumentException("Unknown sync type: " + value);
    }
}

package com.scoutintel.transferroom.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED
}

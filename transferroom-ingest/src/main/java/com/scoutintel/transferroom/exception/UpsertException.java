package com.scoutintel.transferroom.exception;

import lombok.Getter;

/**
 * Writing a single record failed. Counted against the run, never fatal to it.
 */
@Getter
public class UpsertException extends IngestionException {

    private final String entity;
    private final Object externalId;

    public UpsertException(String entity, Object externalId, String message) {
        super(entity + " " + externalId + ": " + message);
        this.entity = entity;
        this.externalId = externalId;
    }

    public UpsertException(String entity, Object externalId, String message, Throwable cause) {
        super(entity + " " + externalId + ": " + message, cause);
        this.entity = entity;
        this.externalId = externalId;
    }
}

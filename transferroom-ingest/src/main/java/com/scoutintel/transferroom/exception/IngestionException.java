package com.scoutintel.transferroom.exception;

/**
 * Base type for failures raised by the ingestion pipeline.
 * Thrown directly for run-level failures that fit no narrower type, e.g. an unreadable seed file.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}

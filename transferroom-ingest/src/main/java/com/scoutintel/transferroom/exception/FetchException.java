package com.scoutintel.transferroom.exception;

import lombok.Getter;

/**
 * A TransferRoom API call failed after client-level retries, or returned something other than a list.
 */
@Getter
public class FetchException extends IngestionException {

    private final String endpoint;

    public FetchException(String endpoint, String message) {
        super(message + " [" + endpoint + "]");
        this.endpoint = endpoint;
    }

    public FetchException(String endpoint, String message, Throwable cause) {
        super(message + " [" + endpoint + "]", cause);
        this.endpoint = endpoint;
    }
}

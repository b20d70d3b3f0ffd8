package com.adlanda.knowledgesync.exception;

/**
 * The source cannot be listed at all: missing root, failed authentication, exhausted retries on the root listing.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

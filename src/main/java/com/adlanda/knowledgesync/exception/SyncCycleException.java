package com.adlanda.knowledgesync.exception;

/**
 * A sync cycle aborted before its items were accounted for. The checkpoint was not advanced.
 */
public class SyncCycleException extends RuntimeException {

    public SyncCycleException(String message, Throwable cause) {
        super(message, cause);
    }
}

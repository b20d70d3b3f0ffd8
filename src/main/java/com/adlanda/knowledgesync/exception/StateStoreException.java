package com.adlanda.knowledgesync.exception;

/**
 * Neither the durable checkpoint backend nor the fallback file could be used.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

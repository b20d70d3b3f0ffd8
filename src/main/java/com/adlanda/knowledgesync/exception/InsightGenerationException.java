package com.adlanda.knowledgesync.exception;

/**
 * The model call failed or its response could not be read as a list of insights.
 * The queue task is retried.
 */
public class InsightGenerationException extends RuntimeException {

    public InsightGenerationException(String message) {
        super(message);
    }

    public InsightGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

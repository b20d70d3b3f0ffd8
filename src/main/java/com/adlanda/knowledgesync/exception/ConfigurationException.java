package com.adlanda.knowledgesync.exception;

/**
 * Invalid or missing configuration detected before any cycle runs.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}

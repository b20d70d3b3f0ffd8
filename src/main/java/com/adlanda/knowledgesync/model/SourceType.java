package com.adlanda.knowledgesync.model;

/**
 * Where documents are synchronized from.
 */
public enum SourceType {
    LOCAL,
    REMOTE
}

package com.adlanda.knowledgesync.model;

/**
 * Lifecycle of an insights queue task.
 *
 * PENDING to PROCESSING via claim; PROCESSING to COMPLETED, to PENDING (retry) or to FAILED;
 * FAILED to PENDING only through an explicit reset. COMPLETED is terminal.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}

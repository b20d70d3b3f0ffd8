package com.adlanda.knowledgesync.model;

public enum InsightStatus {
    OPEN,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}

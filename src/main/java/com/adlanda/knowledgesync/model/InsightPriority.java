package com.adlanda.knowledgesync.model;

import java.util.Locale;

public enum InsightPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Parses a priority label, defaulting to MEDIUM for anything unrecognized.
     */
    public static InsightPriority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}

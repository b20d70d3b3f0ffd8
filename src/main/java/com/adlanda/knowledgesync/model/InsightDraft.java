package com.adlanda.knowledgesync.model;

import java.time.LocalDate;
import java.util.List;

/**
 * An insight as returned by the insight generator, before it is attached to a document and persisted.
 */
public record InsightDraft(
        InsightType type,
        String title,
        String description,
        InsightPriority priority,
        double confidence,
        String projectName,
        String assignedTo,
        LocalDate dueDate,
        List<String> keywords
) {
    public static final double DEFAULT_CONFIDENCE = 0.7;
}

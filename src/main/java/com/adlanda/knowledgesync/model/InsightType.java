package com.adlanda.knowledgesync.model;

import java.util.Locale;
import java.util.Optional;

public enum InsightType {
    ACTION_ITEM,
    DECISION,
    RISK,
    MILESTONE,
    BLOCKER,
    DEPENDENCY,
    BUDGET_UPDATE,
    TIMELINE_CHANGE,
    STAKEHOLDER_FEEDBACK,
    TECHNICAL_ISSUE,
    OPPORTUNITY,
    CONCERN;

    /**
     * Parses the snake_case form used in model output, e.g. {@code action_item}.
     */
    public static Optional<InsightType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT).replace(' ', '_')));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

package com.adlanda.knowledgesync.insights;

import com.adlanda.knowledgesync.model.InsightDraft;

import java.util.List;

/**
 * Derives structured insights from a document's text.
 */
public interface InsightGenerator {

    /**
     * @return the insights found, empty if the document has none
     * @throws com.adlanda.knowledgesync.exception.InsightGenerationException if the generator fails and the
     *         document should be retried
     */
    List<InsightDraft> generateInsights(String title, String content);
}

package com.adlanda.knowledgesync.insights;

import com.adlanda.knowledgesync.entity.Insight;
import com.adlanda.knowledgesync.model.InsightDraft;
import com.adlanda.knowledgesync.repository.InsightRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Persists generated insights, replacing whatever an earlier run produced for the same document.
 */
@Service
public class InsightRecorder {

    private final InsightRepository insightRepository;

    public InsightRecorder(InsightRepository insightRepository) {
        this.insightRepository = insightRepository;
    }

    @Transactional
    public int replace(String documentId, List<InsightDraft> drafts) {
        insightRepository.deleteBySourceDocumentId(documentId);

        List<Insight> insights = drafts.stream()
                .map(draft -> toEntity(documentId, draft))
                .toList();
        insightRepository.saveAll(insights);
        return insights.size();
    }

    /**
     * Deletes all insights derived from a document.
     */
    public int clear(String documentId) {
        return insightRepository.deleteBySourceDocumentId(documentId);
    }

    private static Insight toEntity(String documentId, InsightDraft draft) {
        Insight insight = new Insight(draft.type(), draft.title(), documentId);
        insight.setDescription(draft.description());
        insight.setPriority(draft.priority());
        insight.setConfidenceScore(draft.confidence());
        insight.setProjectName(limit(draft.projectName(), 300));
        insight.setAssignedTo(limit(draft.assignedTo(), 300));
        insight.setDueDate(draft.dueDate());
        if (draft.keywords() != null && !draft.keywords().isEmpty()) {
            insight.setKeywords(limit(String.join(",", draft.keywords()), 1000));
        }
        return insight;
    }

    // Column widths of project_insights
    private static String limit(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}

package com.adlanda.knowledgesync.insights;

import com.adlanda.knowledgesync.config.InsightsProperties;
import com.adlanda.knowledgesync.service.DocumentIngestedEvent;
import com.adlanda.knowledgesync.service.DocumentRemovedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Keeps the insights side in step with ingestion.
 *
 * Freshly ingested documents are queued; enqueue failures never fail the sync item, the
 * retroactive endpoint picks the document up later. Removed documents lose their insights
 * and their queue task; failures there propagate so the removal is retried.
 */
@Component
public class InsightsTrigger {

    private static final Logger log = LoggerFactory.getLogger(InsightsTrigger.class);

    private final InsightsQueue queue;
    private final InsightRecorder recorder;
    private final InsightsProperties properties;

    public InsightsTrigger(InsightsQueue queue, InsightRecorder recorder, InsightsProperties properties) {
        this.queue = queue;
        this.recorder = recorder;
        this.properties = properties;
    }

    @EventListener
    public void onDocumentIngested(DocumentIngestedEvent event) {
        if (!properties.isEnqueueOnIngest()) {
            return;
        }
        try {
            queue.enqueue(event.documentId());
        } catch (RuntimeException e) {
            log.warn("Could not queue document {} for insights: {}", event.documentId(), e.getMessage());
        }
    }

    @EventListener
    public void onDocumentRemoved(DocumentRemovedEvent event) {
        int insights = recorder.clear(event.documentId());
        queue.forget(event.documentId());
        if (insights > 0) {
            log.info("Deleted {} insights of removed document {}", insights, event.documentId());
        }
    }
}

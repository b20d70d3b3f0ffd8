package com.adlanda.knowledgesync.controller;

import com.adlanda.knowledgesync.config.InsightsProperties;
import com.adlanda.knowledgesync.insights.InsightsQueue;
import com.adlanda.knowledgesync.model.QueueStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for inspecting and managing the insights queue.
 */
@RestController
@RequestMapping("/api/v1/insights/queue")
public class QueueController {

    private final InsightsQueue queue;
    private final InsightsProperties properties;

    public QueueController(InsightsQueue queue, InsightsProperties properties) {
        this.queue = queue;
        this.properties = properties;
    }

    /**
     * Task counts by status.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        QueueStats stats = queue.stats();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pending", stats.pending());
        body.put("processing", stats.processing());
        body.put("completed", stats.completed());
        body.put("failed", stats.failed());
        body.put("total", stats.total());
        body.put("oldestPendingSeconds", stats.oldestPendingAge() == null ? null : stats.oldestPendingAge().toSeconds());
        return ResponseEntity.ok(body);
    }

    /**
     * Queues every ingested document that was never queued.
     */
    @PostMapping("/retroactive")
    public ResponseEntity<Map<String, Object>> queueRetroactive() {
        return ResponseEntity.ok(Map.of("queued", queue.queueUnprocessed()));
    }

    @PostMapping("/reset-failed")
    public ResponseEntity<Map<String, Object>> resetFailed() {
        return ResponseEntity.ok(Map.of("reset", queue.resetFailed()));
    }

    /**
     * Returns tasks stuck in processing longer than {@code insights.worker.stale-after} to pending.
     */
    @PostMapping("/reset-stale")
    public ResponseEntity<Map<String, Object>> resetStale() {
        return ResponseEntity.ok(Map.of("reset", queue.resetStaleProcessing(properties.getWorker().getStaleAfter())));
    }
}

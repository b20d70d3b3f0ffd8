package com.adlanda.knowledgesync.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Knowledge Sync",
                "version", appVersion,
                "endpoints", Map.of(
                        "queueStats", "GET /api/v1/insights/queue/stats - Insights queue counts",
                        "retroactive", "POST /api/v1/insights/queue/retroactive - Queue documents never processed",
                        "resetFailed", "POST /api/v1/insights/queue/reset-failed - Retry failed tasks",
                        "resetStale", "POST /api/v1/insights/queue/reset-stale - Reclaim tasks stuck in processing",
                        "health", "GET /actuator/health - Health check including last sync cycle"
                )
        ));
    }
}

package com.docstream.config;

import com.docstream.processing.GeminiServiceInterface;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final QueueHealthIndicator queueHealthIndicator;
    private final GeminiServiceInterface geminiService;

    public HealthController(QueueHealthIndicator queueHealthIndicator, GeminiServiceInterface geminiService) {
        this.queueHealthIndicator = queueHealthIndicator;
        this.geminiService = geminiService;
    }

    /**
     * Queue and summarizer are reported separately; only the queue decides overall health.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean queueConnected = queueHealthIndicator.isQueueConnected();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", queueConnected ? "healthy" : "unhealthy");
        response.put("queue_connected", queueConnected);
        response.put("summarizer_available", geminiService.isAvailable());
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.ok(response);
    }
}

package com.docstream.api;

import com.docstream.api.validation.PdfValidator;
import com.docstream.jobs.JobStateStore;
import com.docstream.processing.GeminiServiceInterface;
import com.docstream.queue.JobStreamQueue;
import com.docstream.shared.model.JobStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/debug")
@Tag(name = "Debug", description = "Operational statistics")
public class StatsController {

    private static final Logger logger = LoggerFactory.getLogger(StatsController.class);

    private final JobStateStore jobStateStore;
    private final JobStreamQueue jobStreamQueue;
    private final GeminiServiceInterface geminiService;
    private final PdfValidator pdfValidator;
    private final long visibilityTimeoutSeconds;
    private final int maxDeliveryAttempts;

    public StatsController(JobStateStore jobStateStore,
                           JobStreamQueue jobStreamQueue,
                           GeminiServiceInterface geminiService,
                           PdfValidator pdfValidator,
                           @Value("${app.queue.visibility-timeout-seconds:300}") long visibilityTimeoutSeconds,
                           @Value("${app.queue.max-delivery-attempts:3}") int maxDeliveryAttempts) {
        this.jobStateStore = jobStateStore;
        this.jobStreamQueue = jobStreamQueue;
        this.geminiService = geminiService;
        this.pdfValidator = pdfValidator;
        this.visibilityTimeoutSeconds = visibilityTimeoutSeconds;
        this.maxDeliveryAttempts = maxDeliveryAttempts;
    }

    @GetMapping("/stats")
    @Operation(summary = "Job and queue statistics", description = "Job counts by status, queue metrics and effective configuration")
    public Map<String, Object> stats() {
        Map<String, Object> response = new LinkedHashMap<>();

        Map<JobStatus, Long> byStatus = jobStateStore.countByStatus();
        Map<String, Long> jobsByStatus = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<JobStatus, Long> entry : byStatus.entrySet()) {
            jobsByStatus.put(entry.getKey().value(), entry.getValue());
            total += entry.getValue();
        }
        response.put("total_jobs", total);
        response.put("jobs_by_status", jobsByStatus);

        try {
            response.put("queue_metrics", jobStreamQueue.metrics());
        } catch (DataAccessException e) {
            logger.warn("Queue metrics unavailable: {}", e.getMessage());
            Map<String, Object> unavailable = new LinkedHashMap<>();
            unavailable.put("error", e.getMessage());
            response.put("queue_metrics", unavailable);
        }

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("max_upload_mb", pdfValidator.getMaxUploadMb());
        config.put("summarizer_available", geminiService.isAvailable());
        config.put("summarizer_model", geminiService.getModel());
        config.put("stream_name", jobStreamQueue.getStreamName());
        config.put("stream_group", jobStreamQueue.getGroupName());
        config.put("job_ttl_seconds", jobStateStore.getTtl().getSeconds());
        config.put("visibility_timeout_seconds", visibilityTimeoutSeconds);
        config.put("max_delivery_attempts", maxDeliveryAttempts);
        response.put("config_echo", config);

        return response;
    }
}

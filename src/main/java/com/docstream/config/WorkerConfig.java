package com.docstream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerConfig implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger logger = LoggerFactory.getLogger(WorkerConfig.class);

    @Value("${docstream.worker.enabled:true}")
    private boolean workerEnabled;

    @Value("${docstream.worker.concurrency:2}")
    private int concurrency;

    @Value("${app.queue.stream-name:pdf_jobs}")
    private String streamName;

    @Value("${app.queue.group-name:pdf_group}")
    private String groupName;

    @Value("${app.queue.visibility-timeout-seconds:300}")
    private long visibilityTimeoutSeconds;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        logger.info("Worker enabled = {}, concurrency = {}, stream = {}, group = {}, visibility timeout = {}s",
                workerEnabled, concurrency, streamName, groupName, visibilityTimeoutSeconds);
    }

    public boolean isWorkerEnabled() {
        return workerEnabled;
    }
}

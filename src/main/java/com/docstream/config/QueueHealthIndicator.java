package com.docstream.config;

import com.docstream.queue.JobStreamQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Reports the job store connection and the queue stream/group independently.
 */
@Component
public class QueueHealthIndicator implements HealthIndicator {

    private final DataSource dataSource;
    private final JobStreamQueue jobStreamQueue;

    public QueueHealthIndicator(DataSource dataSource, JobStreamQueue jobStreamQueue) {
        this.dataSource = dataSource;
        this.jobStreamQueue = jobStreamQueue;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(5)) {
                details.put("database", "DOWN");
                details.put("connection", "Invalid");
                return Health.down().withDetails(details).build();
            }
            details.put("database", "UP");
        } catch (SQLException e) {
            details.put("database", "DOWN");
            details.put("error", e.getMessage());
            return Health.down().withDetails(details).build();
        }

        boolean queueConnected = jobStreamQueue.isConnected();
        details.put("queue", queueConnected ? "UP" : "DOWN");
        details.put("stream", jobStreamQueue.getStreamName());
        details.put("group", jobStreamQueue.getGroupName());
        return (queueConnected ? Health.up() : Health.down()).withDetails(details).build();
    }

    public boolean isQueueConnected() {
        return "UP".equals(health().getStatus().getCode());
    }
}

package com.docstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class DocStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocStreamApplication.class, args);
    }

    /**
     * Scheduling drives the pending-entry reaper and retention purge, which only run alongside workers.
     */
    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "docstream.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {
    }
}

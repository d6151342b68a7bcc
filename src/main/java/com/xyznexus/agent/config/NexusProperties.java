package com.xyznexus.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for the orchestration core.
 * Bound from application.yml under the "nexus" prefix.
 */
@ConfigurationProperties(prefix = "nexus")
@Data
public class NexusProperties {

    private Orchestrator orchestrator = new Orchestrator();
    private Http http = new Http();
    private Idempotency idempotency = new Idempotency();

    @Data
    public static class Orchestrator {
        /** Hard upper bound on reasoning steps per specialist loop */
        private int maxIterations = 10;
        /** Deadline for a whole run, routing through synthesis */
        private Duration runTimeout = Duration.ofSeconds(300);
        /** Deadline for a single capability invocation */
        private Duration toolTimeout = Duration.ofSeconds(30);
        private int specialistPoolSize = 6;
        private int toolPoolSize = 8;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(120);
        private int maxConnections = 50;
    }

    @Data
    public static class Idempotency {
        private Duration ttl = Duration.ofHours(24);
    }
}

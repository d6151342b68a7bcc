package com.xyznexus.agent.observability;

import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.model.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full trace of one orchestration run.
 *
 * Collection: run_traces
 *
 * Captures input / output, routing, per-specialist iterations and outcome,
 * token usage, capability calls in execution order and failure details.
 */
@Document(collection = "run_traces")
@CompoundIndexes({
    @CompoundIndex(name = "idx_user_date", def = "{'userId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "idx_session_date", def = "{'sessionId': 1, 'createdAt': -1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunTrace {

    @Id
    private String id;

    @Indexed(unique = true)
    private String runId;

    private String sessionId;
    private String userId;
    private String userRole;
    private String query;

    private RoutingDecision routingDecision;
    private List<String> specialists;
    private String finalResponse;

    @Indexed
    private RunStatus status;
    private boolean degraded;

    /** specialist id -> reasoning steps used */
    private Map<String, Integer> iterationsBySpecialist;

    /** specialist id -> COMPLETED | BOUND_REACHED | DEGRADED | TIMED_OUT */
    private Map<String, String> specialistOutcomes;

    private long totalLatencyMs;
    private int reasoningCalls;
    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    /** Capability calls in execution order: specialist, toolName, latencyMs, error, resultPreview */
    private List<Map<String, Object>> toolCalls;

    private String errorMessage;

    @CreatedDate
    private Instant createdAt;
}

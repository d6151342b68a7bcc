package com.xyznexus.agent.observability;

import com.xyznexus.agent.core.RunState;
import com.xyznexus.agent.core.SpecialistOutcome;
import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.model.Specialist;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists run traces and exposes analytics.
 *
 * Trace persistence is @Async and never blocks the response.
 * Analytics queries are synchronous (called explicitly by the traces endpoint).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final RunTraceRepository traceRepository;

    /**
     * Persist a finished run asynchronously.
     * Called at the end of every run from the Coordinator, failed runs included.
     */
    @Async("traceTaskExecutor")
    public void persistTrace(RunState state, RunContext runCtx) {
        try {
            RunTrace trace = toTrace(state, runCtx);
            traceRepository.save(trace);

            log.info("Trace persisted [runId={}, status={}, latency={}ms, tokens={}]",
                    state.getRunId(), trace.getStatus(), trace.getTotalLatencyMs(), trace.getTotalTokens());

        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist run trace for runId={}", state.getRunId(), e);
        }
    }

    RunTrace toTrace(RunState state, RunContext runCtx) {
        RoutingDecision decision = state.getRoutingDecision();

        Map<String, Integer> iterations = new LinkedHashMap<>();
        state.getIterationsBySpecialist().forEach((s, n) -> iterations.put(s.id(), n));

        Map<String, String> outcomes = new LinkedHashMap<>();
        for (SpecialistOutcome outcome : state.getOutcomes()) {
            outcomes.put(outcome.getSpecialist().id(), outcome.getStatus().name());
        }

        return RunTrace.builder()
                .runId(state.getRunId())
                .sessionId(state.getSessionId())
                .userId(state.getUserId())
                .userRole(state.getUserRole())
                .query(truncate(state.getQuery(), 4000))
                .routingDecision(decision)
                .specialists(decision != null
                        ? decision.specialists().stream().map(Specialist::id).toList()
                        : List.of())
                .finalResponse(truncate(state.getFinalResponse(), 8000))
                .status(state.getStatus())
                .degraded(state.isDegraded())
                .iterationsBySpecialist(iterations)
                .specialistOutcomes(outcomes)
                .totalLatencyMs(runCtx.elapsedMs())
                .reasoningCalls(runCtx.getReasoningCalls())
                .promptTokens(runCtx.getPromptTokens())
                .completionTokens(runCtx.getCompletionTokens())
                .totalTokens(runCtx.totalTokens())
                .toolCalls(toolCallDocs(runCtx.getToolCallRecords()))
                .errorMessage(state.getErrorMessage())
                .build();
    }

    public List<RunTrace> getTracesForUser(String userId) {
        return traceRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<RunTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    /**
     * Summary analytics for a user: avg latency, token usage last 24h, status and routing breakdown.
     */
    public Map<String, Object> getAnalytics(String userId) {
        Instant since24h = Instant.now().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatencyForUser(userId);
        Long tokensLast24h = traceRepository.totalTokensUsedSince(userId, since24h);

        return Map.of(
                "userId", userId,
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0L,
                "totalTokensLast24h", tokensLast24h != null ? tokensLast24h : 0L,
                "statusBreakdown", toCounts(traceRepository.statusBreakdownForUser(userId)),
                "routingBreakdown", toCounts(traceRepository.routingBreakdownForUser(userId))
        );
    }

    private Map<String, Long> toCounts(List<RunTraceRepository.StatusCount> rows) {
        return rows.stream()
                .filter(r -> r.id() != null)
                .collect(Collectors.toMap(RunTraceRepository.StatusCount::id,
                        RunTraceRepository.StatusCount::count, Long::sum, LinkedHashMap::new));
    }

    private List<Map<String, Object>> toolCallDocs(List<RunContext.ToolCallRecord> records) {
        return records.stream()
                .map(r -> {
                    Map<String, Object> doc = new LinkedHashMap<>();
                    doc.put("specialist", r.specialist());
                    doc.put("toolName", r.toolName());
                    doc.put("latencyMs", r.latencyMs());
                    doc.put("error", r.error());
                    doc.put("resultPreview", truncate(r.result(), 200));
                    return doc;
                })
                .toList();
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}

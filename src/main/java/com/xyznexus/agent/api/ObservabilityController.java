package com.xyznexus.agent.api;

import com.xyznexus.agent.observability.RunTrace;
import com.xyznexus.agent.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for run traces and analytics.
 *
 * GET /api/v1/traces/{userId}              all run traces for a user
 * GET /api/v1/traces/session/{sessionId}   traces for a specific session
 * GET /api/v1/traces/{userId}/analytics    aggregated stats (latency, tokens, status, routing)
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/{userId}")
    public ResponseEntity<List<RunTrace>> getTraces(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getTracesForUser(userId));
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<RunTrace>> getSessionTraces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForSession(sessionId));
    }

    @GetMapping("/{userId}/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getAnalytics(userId));
    }
}

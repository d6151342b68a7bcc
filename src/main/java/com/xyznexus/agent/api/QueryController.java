package com.xyznexus.agent.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xyznexus.agent.core.Coordinator;
import com.xyznexus.agent.core.RunResult;
import com.xyznexus.agent.model.QueryRequest;
import com.xyznexus.agent.model.QueryResponse;
import com.xyznexus.agent.model.RunStatus;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.resilience.IdempotencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query endpoint with idempotency support.
 *
 * POST /api/v1/query
 *   Optional header: Idempotency-Key: <uuid>
 *   If provided, duplicate requests within the TTL return the cached response.
 *   A duplicate arriving while the first request is still running gets 409.
 *
 * A run where every specialist failed answers 503 with the apology text.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final Coordinator coordinator;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Query request [sessionId={}, userId={}, idempotencyKey={}]",
                request.getSessionId(), request.getUserId(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            var cached = idempotencyService.getCachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                try {
                    QueryResponse cachedResponse = objectMapper.readValue(cached.get(), QueryResponse.class);
                    log.info("Returning cached response for idempotency key={}", idempotencyKey);
                    return ResponseEntity.ok(cachedResponse);
                } catch (JsonProcessingException e) {
                    log.warn("Failed to deserialize cached response, proceeding fresh", e);
                    idempotencyService.releaseKey(idempotencyKey);
                }
            }
            if (!idempotencyService.claimKey(idempotencyKey)) {
                log.warn("Idempotency key already in flight, rejecting duplicate [idempotencyKey={}]", idempotencyKey);
                return ResponseEntity.status(HttpStatus.CONFLICT).build();
            }
        }

        QueryResponse response;
        try {
            RunResult result = coordinator.run(request.getQuery(), request.getUserId(),
                    request.getUserRole(), request.getSessionId());
            response = toResponse(request, result);
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (response.getStatus() == RunStatus.FAILED) {
            // Failed runs are not cached so a retry runs fresh
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }

        if (idempotent) {
            try {
                idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(response));
            } catch (JsonProcessingException e) {
                log.warn("Failed to cache idempotency response", e);
            }
        }
        return ResponseEntity.ok(response);
    }

    private QueryResponse toResponse(QueryRequest request, RunResult result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("runId", result.getRunId());
        metadata.put("userId", request.getUserId() != null ? request.getUserId() : "anonymous");
        metadata.put("userRole", request.getUserRole());
        metadata.put("iterations", toIds(result.getIterationsBySpecialist()));
        metadata.put("specialistOutcomes", toIds(result.getSpecialistOutcomes()));
        metadata.put("totalTokens", result.getTotalTokens());

        return QueryResponse.builder()
                .sessionId(result.getSessionId())
                .query(result.getQuery())
                .routingDecision(result.getRoutingDecision())
                .response(result.getFinalResponse())
                .agentsInvolved(result.getSpecialistsInvolved().stream().map(Specialist::id).toList())
                .status(result.getStatus())
                .degraded(result.isDegraded())
                .executionTimeMs(result.getElapsedMs())
                .timestamp(Instant.now().toString())
                .metadata(metadata)
                .build();
    }

    private static Map<String, Object> toIds(Map<Specialist, ?> bySpecialist) {
        Map<String, Object> byId = new LinkedHashMap<>();
        bySpecialist.forEach((specialist, value) -> byId.put(specialist.id(), value));
        return byId;
    }
}

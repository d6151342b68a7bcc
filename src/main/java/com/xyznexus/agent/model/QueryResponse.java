package com.xyznexus.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private String sessionId;
    private String query;
    private RoutingDecision routingDecision;
    private String response;

    @Builder.Default
    private List<String> agentsInvolved = new ArrayList<>();

    private RunStatus status;
    private boolean degraded;
    private long executionTimeMs;
    private String timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}

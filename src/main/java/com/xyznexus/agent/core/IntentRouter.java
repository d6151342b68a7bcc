package com.xyznexus.agent.core;

import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.llm.ReasoningClient;
import com.xyznexus.agent.llm.ReasoningResponse;
import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.observability.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Classifies a query into one {@link RoutingDecision}. Replies that are not
 * exactly one of the labels fall back to CLARIFY; the router never picks zero
 * specialists and carries on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IntentRouter {

    static final String ROUTING_DIRECTIVE = """
            You are the Orchestrator for XYZ AI Nexus, a multi-agent system.

            Your role is to understand the user's intent and decide which specialist agent(s)
            should handle the question.

            Available Specialist Agents:
            - UPSTREAM: Production data, lifting schedules, well status, field operations
            - LOGISTICS: Vessel tracking, weather, shipping delays, delivery status
            - FINANCE: Revenue calculations, cost analysis, profitability, market trends

            Routing Rules:
            - If query is about PRODUCTION/VOLUMES/WELLS: route to UPSTREAM
            - If query is about SHIPPING/VESSELS/WEATHER/DELIVERY: route to LOGISTICS
            - If query is about REVENUE/COSTS/PROFITS/PRICES: route to FINANCE
            - If query involves MULTIPLE domains: identify ALL relevant agents
            - If query is ambiguous: ask for clarification

            Examples:
            "What's the production in Rokan?" -> UPSTREAM
            "Where is MT XYZ Prime?" -> LOGISTICS
            "How much revenue from 500k barrels?" -> FINANCE
            "Status of Rokan production and its shipment to Balongan?" -> UPSTREAM_LOGISTICS
            "Profitability of Rokan block considering shipping delays?" -> ALL_AGENTS

            Your response must be ONE of:
            UPSTREAM, LOGISTICS, FINANCE, UPSTREAM_LOGISTICS, UPSTREAM_FINANCE,
            LOGISTICS_FINANCE, ALL_AGENTS, CLARIFY

            Respond with ONLY the routing decision, nothing else.
            """;

    private final ReasoningClient reasoningClient;

    /**
     * @throws ReasoningServiceException when the classification call itself fails
     */
    public RoutingDecision classify(String runId, String query, RunContext runCtx) {
        ReasoningResponse response = reasoningClient.generate(
                ROUTING_DIRECTIVE, List.of(Message.user("User query: " + query)), List.of());
        runCtx.addTokens(response.getPromptTokens(), response.getCompletionTokens());

        String raw = response.getMessage() != null ? response.getMessage().getContent() : null;
        if (!RoutingDecision.isKnownLabel(raw)) {
            log.warn("Classification ambiguous, defaulting to CLARIFY [runId={}, raw='{}']", runId, raw);
            return RoutingDecision.CLARIFY;
        }

        RoutingDecision decision = RoutingDecision.parse(raw);
        log.info("Intent classified [runId={}, routing={}]", runId, decision);
        return decision;
    }
}

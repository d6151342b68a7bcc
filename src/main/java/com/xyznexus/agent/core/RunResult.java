package com.xyznexus.agent.core;

import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.model.RunStatus;
import com.xyznexus.agent.model.Specialist;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * What {@link Coordinator#run} hands back to the caller.
 */
@Value
@Builder
public class RunResult {

    String runId;
    String sessionId;
    String query;
    RoutingDecision routingDecision;
    String finalResponse;
    /** Specialists the routing decision activated, in precedence order */
    List<Specialist> specialistsInvolved;
    RunStatus status;
    boolean degraded;
    Map<Specialist, Integer> iterationsBySpecialist;
    Map<Specialist, SpecialistOutcome.Status> specialistOutcomes;
    long elapsedMs;
    int totalTokens;

    static RunResult from(RunState state, long elapsedMs, int totalTokens) {
        RoutingDecision decision = state.getRoutingDecision();
        Map<Specialist, SpecialistOutcome.Status> outcomes = new EnumMap<>(Specialist.class);
        state.getOutcomes().forEach(o -> outcomes.put(o.getSpecialist(), o.getStatus()));
        return RunResult.builder()
                .runId(state.getRunId())
                .sessionId(state.getSessionId())
                .query(state.getQuery())
                .routingDecision(decision)
                .finalResponse(state.getFinalResponse())
                .specialistsInvolved(decision != null ? decision.specialists() : List.of())
                .status(state.getStatus())
                .degraded(state.isDegraded())
                .iterationsBySpecialist(state.getIterationsBySpecialist())
                .specialistOutcomes(Collections.unmodifiableMap(outcomes))
                .elapsedMs(elapsedMs)
                .totalTokens(totalTokens)
                .build();
    }
}

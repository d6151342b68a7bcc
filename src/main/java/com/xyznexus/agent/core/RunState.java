package com.xyznexus.agent.core;

import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.model.RunStatus;
import com.xyznexus.agent.model.Specialist;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable record of one query, owned by the {@link Coordinator} for the life of
 * the run and discarded afterwards.
 *
 * The root history is read-only; each specialist loop works on its own
 * {@link SpecialistBranch}. Joined fields (outcomes, iterations, final response)
 * are written only from the coordinating thread.
 */
@Getter
public class RunState {

    private final String runId;
    private final String sessionId;
    private final String userId;
    private final String userRole;
    private final String query;
    private final List<Message> history;

    private RoutingDecision routingDecision;
    private String finalResponse;
    private RunStatus status;
    private boolean degraded;
    private String errorMessage;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<Specialist, SpecialistOutcome> outcomes = new EnumMap<>(Specialist.class);

    RunState(String runId, String sessionId, String userId, String userRole, String query) {
        this.runId = runId;
        this.sessionId = sessionId;
        this.userId = userId;
        this.userRole = userRole;
        this.query = query;
        this.history = List.of(Message.user(query));
    }

    void setRoutingDecision(RoutingDecision routingDecision) {
        this.routingDecision = routingDecision;
    }

    SpecialistBranch branchFor(Specialist specialist) {
        return new SpecialistBranch(specialist, history);
    }

    void recordOutcome(SpecialistOutcome outcome) {
        outcomes.put(outcome.getSpecialist(), outcome);
        if (outcome.isDegraded()) {
            degraded = true;
        }
    }

    void markDegraded() {
        degraded = true;
    }

    void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    /**
     * Sets the answer of the run. A run has exactly one final response, so a
     * second call is a programming error.
     */
    void complete(String response, RunStatus runStatus) {
        if (finalResponse != null) {
            throw new IllegalStateException("Final response already set for run " + runId);
        }
        this.finalResponse = response;
        this.status = runStatus;
    }

    public Map<Specialist, Integer> getIterationsBySpecialist() {
        Map<Specialist, Integer> iterations = new EnumMap<>(Specialist.class);
        outcomes.forEach((specialist, outcome) -> iterations.put(specialist, outcome.getIterations()));
        return Collections.unmodifiableMap(iterations);
    }

    public Map<Specialist, Boolean> getCompleted() {
        Map<Specialist, Boolean> completed = new EnumMap<>(Specialist.class);
        outcomes.forEach((specialist, outcome) ->
                completed.put(specialist, outcome.getStatus() != SpecialistOutcome.Status.TIMED_OUT));
        return Collections.unmodifiableMap(completed);
    }

    /** Outcomes in specialist precedence order. */
    public List<SpecialistOutcome> getOutcomes() {
        return Collections.unmodifiableList(new ArrayList<>(outcomes.values()));
    }
}

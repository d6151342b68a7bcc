package com.xyznexus.agent.core;

import com.xyznexus.agent.config.NexusProperties;
import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.model.RunStatus;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.observability.RunContext;
import com.xyznexus.agent.observability.TraceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of one orchestration run.
 *
 * Per-run flow:
 * 1. Classify the query (IntentRouter); CLARIFY short-circuits with a fixed question.
 *    A router that misses the run deadline fails the run
 * 2. Fan out: one SpecialistLoop per routed specialist, all on the specialist executor,
 *    each seeded with the same read-only root history
 * 3. Fan in: wait for every loop, bounded by the run deadline; late loops are cancelled
 * 4. One usable output is the answer as-is, several go to the Synthesizer in
 *    upstream, logistics, finance order; a synthesis that misses the deadline
 *    falls back to the labelled outputs
 * 5. Async: persist the run trace
 */
@Service
@Slf4j
public class Coordinator {

    public static final String CLARIFICATION_TEXT = "I need more information to help you. "
            + "Could you please clarify your question? "
            + "Are you asking about production data, shipping logistics, or financial analysis?";

    public static final String APOLOGY_TEXT = "I'm sorry, I was unable to process your request right now. "
            + "Please try again in a few moments.";

    private final IntentRouter intentRouter;
    private final SpecialistLoop specialistLoop;
    private final Synthesizer synthesizer;
    private final TraceService traceService;
    private final ExecutorService specialistExecutor;
    private final long runTimeoutMs;

    public Coordinator(IntentRouter intentRouter,
                       SpecialistLoop specialistLoop,
                       Synthesizer synthesizer,
                       TraceService traceService,
                       @Qualifier("specialistExecutor") ExecutorService specialistExecutor,
                       NexusProperties properties) {
        this.intentRouter = intentRouter;
        this.specialistLoop = specialistLoop;
        this.synthesizer = synthesizer;
        this.traceService = traceService;
        this.specialistExecutor = specialistExecutor;
        this.runTimeoutMs = properties.getOrchestrator().getRunTimeout().toMillis();
    }

    public RunResult run(String query, String userId, String userRole) {
        return run(query, userId, userRole, null);
    }

    public RunResult run(String query, String userId, String userRole, String sessionId) {
        String runId = UUID.randomUUID().toString();
        String resolvedSession = (sessionId != null && !sessionId.isBlank()) ? sessionId : runId;
        RunState state = new RunState(runId, resolvedSession,
                userId != null ? userId : "anonymous",
                userRole != null ? userRole : "user",
                query);
        RunContext runCtx = new RunContext();
        long deadline = System.currentTimeMillis() + runTimeoutMs;

        log.info("Run started [runId={}, sessionId={}, userId={}, query='{}']",
                runId, resolvedSession, state.getUserId(), query);

        try {
            execute(state, runCtx, deadline);
        } catch (RuntimeException e) {
            // Anything escaping here is a defect, but the caller still gets an answer
            log.error("Run failed unexpectedly [runId={}]", runId, e);
            state.setErrorMessage(e.getMessage());
            if (state.getFinalResponse() == null) {
                state.complete(APOLOGY_TEXT, RunStatus.FAILED);
            }
        } finally {
            traceService.persistTrace(state, runCtx);
        }

        log.info("Run complete [runId={}, routing={}, status={}, degraded={}, latency={}ms, tokens={}]",
                runId, state.getRoutingDecision(), state.getStatus(), state.isDegraded(),
                runCtx.elapsedMs(), runCtx.totalTokens());

        return RunResult.from(state, runCtx.elapsedMs(), runCtx.totalTokens());
    }

    private void execute(RunState state, RunContext runCtx, long deadline) {
        RoutingDecision decision;
        try {
            decision = withinDeadline(state.getRunId(), "routing",
                    () -> intentRouter.classify(state.getRunId(), state.getQuery(), runCtx), deadline);
        } catch (ReasoningServiceException e) {
            log.error("Routing failed [runId={}]: {}", state.getRunId(), e.getMessage());
            state.setErrorMessage("Routing failed: " + e.getMessage());
            state.complete(APOLOGY_TEXT, RunStatus.FAILED);
            return;
        }
        state.setRoutingDecision(decision);

        if (decision == RoutingDecision.CLARIFY) {
            state.complete(CLARIFICATION_TEXT, RunStatus.CLARIFICATION);
            return;
        }

        fanOutAndJoin(state, decision.specialists(), runCtx, deadline);

        List<SpecialistOutcome> usable = state.getOutcomes().stream()
                .filter(SpecialistOutcome::hasUsableContent)
                .toList();

        if (usable.isEmpty()) {
            log.error("All specialists failed [runId={}, outcomes={}]", state.getRunId(), describe(state));
            state.setErrorMessage("All specialists failed");
            state.complete(APOLOGY_TEXT, RunStatus.FAILED);
            return;
        }

        if (usable.size() < decision.specialists().size()) {
            state.markDegraded();
        }

        if (usable.size() == 1) {
            state.complete(usable.get(0).getContent(), statusOf(state));
            return;
        }

        String answer;
        try {
            answer = withinDeadline(state.getRunId(), "synthesis",
                    () -> synthesizer.synthesize(state.getRunId(), state.getQuery(), usable, runCtx), deadline);
        } catch (ReasoningServiceException e) {
            log.error("Synthesis failed, returning labelled specialist outputs [runId={}]: {}",
                    state.getRunId(), e.getMessage());
            state.markDegraded();
            answer = Synthesizer.labelled(usable);
        }
        state.complete(answer, statusOf(state));
    }

    /**
     * Starts one loop per specialist and waits for all of them. Results are
     * collected in precedence order, so completion order never matters.
     */
    private void fanOutAndJoin(RunState state, List<Specialist> specialists, RunContext runCtx, long deadline) {
        Map<Specialist, SpecialistBranch> branches = new LinkedHashMap<>();
        Map<Specialist, Future<SpecialistOutcome>> futures = new LinkedHashMap<>();

        for (Specialist specialist : specialists) {
            SpecialistBranch branch = state.branchFor(specialist);
            branches.put(specialist, branch);
            try {
                futures.put(specialist, specialistExecutor.submit(
                        () -> specialistLoop.run(state.getRunId(), branch, runCtx)));
            } catch (RejectedExecutionException e) {
                log.error("Specialist executor saturated [runId={}, specialist={}]",
                        state.getRunId(), specialist.id());
                state.recordOutcome(SpecialistOutcome.timedOut(branch, "Specialist executor saturated"));
            }
        }

        log.info("Fan-out complete [runId={}, specialists={}]", state.getRunId(),
                futures.keySet().stream().map(Specialist::id).toList());

        for (Map.Entry<Specialist, Future<SpecialistOutcome>> entry : futures.entrySet()) {
            Specialist specialist = entry.getKey();
            SpecialistBranch branch = branches.get(specialist);
            state.recordOutcome(await(state.getRunId(), branch, entry.getValue(), deadline));
        }
    }

    private SpecialistOutcome await(String runId, SpecialistBranch branch,
                                    Future<SpecialistOutcome> future, long deadline) {
        try {
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Specialist exceeded run deadline, cancelling [runId={}, specialist={}, iterations={}]",
                    runId, branch.getSpecialist().id(), branch.getIterations());
            branch.cancel();
            future.cancel(true);
            return SpecialistOutcome.timedOut(branch, "Exceeded run deadline of " + runTimeoutMs + "ms");
        } catch (ExecutionException e) {
            log.error("Specialist loop crashed [runId={}, specialist={}]",
                    runId, branch.getSpecialist().id(), e.getCause());
            return SpecialistOutcome.builder()
                    .specialist(branch.getSpecialist())
                    .iterations(branch.getIterations())
                    .status(SpecialistOutcome.Status.DEGRADED)
                    .error(String.valueOf(e.getCause().getMessage()))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            branch.cancel();
            future.cancel(true);
            return SpecialistOutcome.timedOut(branch, "Run interrupted");
        }
    }

    /**
     * Runs a single reasoning step on the specialist executor and waits no longer
     * than the run deadline allows. Timeouts, saturation and interrupts surface as
     * {@link ReasoningServiceException}; the step is cancelled when abandoned.
     */
    private <T> T withinDeadline(String runId, String phase, Callable<T> step, long deadline) {
        Future<T> future;
        try {
            future = specialistExecutor.submit(step);
        } catch (RejectedExecutionException e) {
            throw new ReasoningServiceException("Executor saturated during " + phase, e);
        }
        try {
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Step exceeded run deadline, cancelling [runId={}, phase={}]", runId, phase);
            future.cancel(true);
            throw new ReasoningServiceException(
                    "Exceeded run deadline of " + runTimeoutMs + "ms during " + phase, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new ReasoningServiceException(phase + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ReasoningServiceException("Run interrupted during " + phase, e);
        }
    }

    private RunStatus statusOf(RunState state) {
        return state.isDegraded() ? RunStatus.DEGRADED : RunStatus.COMPLETED;
    }

    private List<String> describe(RunState state) {
        List<String> parts = new ArrayList<>();
        state.getOutcomes().forEach(o -> parts.add(o.getSpecialist().id() + "=" + o.getStatus()));
        return parts;
    }
}

package com.xyznexus.agent.core;

import com.xyznexus.agent.config.NexusProperties;
import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.llm.ReasoningClient;
import com.xyznexus.agent.llm.ReasoningResponse;
import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.model.ToolCall;
import com.xyznexus.agent.observability.RunContext;
import com.xyznexus.agent.specialist.SpecialistCatalog;
import com.xyznexus.agent.specialist.SpecialistProfile;
import com.xyznexus.agent.tool.CapabilityRegistry;
import com.xyznexus.agent.tool.CapabilityResult;
import com.xyznexus.agent.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reason / call-tools loop of a single specialist.
 *
 * Per step:
 * 1. REASON: send the specialist directive and the private branch to the reasoning service
 * 2. No capability requests in the reply: DONE, the reply text is the contribution
 * 3. Otherwise CALL_TOOLS: run every requested capability in parallel, append one
 *    tool message per request in request order, then REASON again
 *
 * The loop stops on its own after {@code maxIterations} reasoning steps even if the
 * service keeps asking for capabilities. It never throws: reasoning failures end it
 * degraded and capability failures are fed back as tool messages.
 */
@Service
@Slf4j
public class SpecialistLoop {

    static final String BOUND_REACHED_FALLBACK = "I was unable to complete the task within the allowed steps.";

    private final ReasoningClient reasoningClient;
    private final CapabilityRegistry capabilityRegistry;
    private final SpecialistCatalog catalog;
    private final ExecutorService toolExecutor;
    private final int maxIterations;
    private final long toolTimeoutMs;

    public SpecialistLoop(ReasoningClient reasoningClient,
                          CapabilityRegistry capabilityRegistry,
                          SpecialistCatalog catalog,
                          @Qualifier("toolExecutor") ExecutorService toolExecutor,
                          NexusProperties properties) {
        this.reasoningClient = reasoningClient;
        this.capabilityRegistry = capabilityRegistry;
        this.catalog = catalog;
        this.toolExecutor = toolExecutor;
        this.maxIterations = properties.getOrchestrator().getMaxIterations();
        this.toolTimeoutMs = properties.getOrchestrator().getToolTimeout().toMillis();
    }

    public SpecialistOutcome run(String runId, SpecialistBranch branch, RunContext runCtx) {
        Specialist specialist = branch.getSpecialist();
        SpecialistProfile profile = catalog.profile(specialist);
        List<ToolDefinition> tools = capabilityRegistry.definitionsFor(specialist);
        int capabilityCalls = 0;

        log.info("Specialist loop started [runId={}, specialist={}]", runId, specialist.id());

        for (int i = 0; i < maxIterations; i++) {
            if (branch.isCancelled() || Thread.currentThread().isInterrupted()) {
                log.warn("Specialist loop cancelled [runId={}, specialist={}, iterations={}]",
                        runId, specialist.id(), branch.getIterations());
                return SpecialistOutcome.timedOut(branch, "Cancelled at run deadline");
            }

            int iteration = branch.nextIteration();
            log.info("Specialist iteration {}/{} [runId={}, specialist={}]",
                    iteration, maxIterations, runId, specialist.id());

            ReasoningResponse response;
            try {
                response = reasoningClient.generate(profile.getDirective(), branch.snapshot(), tools);
            } catch (ReasoningServiceException e) {
                log.error("Reasoning failed, finishing degraded [runId={}, specialist={}, iteration={}]: {}",
                        runId, specialist.id(), iteration, e.getMessage());
                return outcome(branch, SpecialistOutcome.Status.DEGRADED,
                        branch.lastAssistantText(), e.getMessage(), capabilityCalls);
            }
            runCtx.addTokens(response.getPromptTokens(), response.getCompletionTokens());

            Message reply = response.getMessage();
            if (reply == null) {
                log.error("Reasoning service returned no message [runId={}, specialist={}]", runId, specialist.id());
                return outcome(branch, SpecialistOutcome.Status.DEGRADED,
                        branch.lastAssistantText(), "Empty reply from reasoning service", capabilityCalls);
            }
            branch.append(reply);

            if (!reply.hasToolCalls()) {
                log.info("Specialist finished [runId={}, specialist={}, iterations={}, capabilityCalls={}]",
                        runId, specialist.id(), iteration, capabilityCalls);
                return outcome(branch, SpecialistOutcome.Status.COMPLETED,
                        reply.hasText() ? reply.getContent() : branch.lastAssistantText(), null, capabilityCalls);
            }

            if (iteration >= maxIterations) {
                break;
            }

            List<ToolCall> calls = reply.getToolCalls();
            capabilityCalls += calls.size();
            log.info("Specialist requested {} capabilities {} [runId={}, specialist={}]",
                    calls.size(), calls.stream().map(ToolCall::getToolName).toList(), runId, specialist.id());

            for (CapabilityResult result : callCapabilities(runId, specialist, calls, runCtx)) {
                branch.append(result.toMessage());
            }
        }

        log.warn("Specialist hit max iterations ({}) [runId={}, specialist={}]",
                maxIterations, runId, specialist.id());
        String lastText = branch.lastAssistantText();
        return outcome(branch, SpecialistOutcome.Status.BOUND_REACHED,
                lastText != null ? lastText : BOUND_REACHED_FALLBACK, null, capabilityCalls);
    }

    /**
     * Invokes every call independently on the tool executor and returns the results
     * in request order. One slow or failing capability never cancels its siblings.
     */
    private List<CapabilityResult> callCapabilities(String runId, Specialist specialist,
                                                    List<ToolCall> calls, RunContext runCtx) {
        List<Future<CapabilityResult>> futures = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            futures.add(submit(specialist, call));
        }

        long deadline = System.currentTimeMillis() + toolTimeoutMs;
        List<CapabilityResult> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            Future<CapabilityResult> future = futures.get(i);
            CapabilityResult result;
            try {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                result = future.get(remaining, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Capability timed out [runId={}, specialist={}, capability={}]",
                        runId, specialist.id(), call.getToolName());
                result = CapabilityResult.failure(call, "Capability timed out after " + toolTimeoutMs + "ms",
                        toolTimeoutMs);
            } catch (ExecutionException e) {
                log.error("Capability execution failed [runId={}, specialist={}, capability={}]",
                        runId, specialist.id(), call.getToolName(), e.getCause());
                result = CapabilityResult.failure(call, "Capability execution failed: " + e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                result = CapabilityResult.failure(call, "Cancelled");
            }
            runCtx.recordToolCall(specialist.id(), call.getToolName(), call.getArguments(),
                    result.getLatencyMs(), result.isError(), result.getContent());
            results.add(result);
        }
        return results;
    }

    private Future<CapabilityResult> submit(Specialist specialist, ToolCall call) {
        try {
            return toolExecutor.submit(() -> capabilityRegistry.invoke(specialist, call));
        } catch (RejectedExecutionException e) {
            log.error("Capability executor saturated, rejecting [{}]", call.getToolName());
            return CompletableFuture.completedFuture(
                    CapabilityResult.failure(call, "Capability executor is saturated, try again later"));
        }
    }

    private SpecialistOutcome outcome(SpecialistBranch branch, SpecialistOutcome.Status status,
                                      String content, String error, int capabilityCalls) {
        return SpecialistOutcome.builder()
                .specialist(branch.getSpecialist())
                .content(content)
                .iterations(branch.getIterations())
                .status(status)
                .error(error)
                .capabilityCalls(capabilityCalls)
                .build();
    }
}

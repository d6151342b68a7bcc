package com.xyznexus.agent.core;

import com.xyznexus.agent.config.NexusProperties;
import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.model.ToolCall;
import com.xyznexus.agent.observability.RunContext;
import com.xyznexus.agent.specialist.SpecialistCatalog;
import com.xyznexus.agent.tool.CapabilityRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.xyznexus.agent.core.ScriptedReasoningClient.UPSTREAM;
import static com.xyznexus.agent.core.ScriptedReasoningClient.call;
import static com.xyznexus.agent.core.ScriptedReasoningClient.hasToolResults;
import static com.xyznexus.agent.core.ScriptedReasoningClient.text;
import static com.xyznexus.agent.core.ScriptedReasoningClient.toolCalls;
import static org.assertj.core.api.Assertions.assertThat;

class SpecialistLoopTest {

    private ExecutorService toolExecutor;
    private NexusProperties properties;
    private ScriptedReasoningClient client;
    private RunContext runCtx;

    @BeforeEach
    void setUp() {
        toolExecutor = Executors.newFixedThreadPool(4);
        properties = new NexusProperties();
        properties.getOrchestrator().setMaxIterations(3);
        client = new ScriptedReasoningClient();
        runCtx = new RunContext();
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
    }

    private SpecialistLoop loop(CapabilityRegistry registry) {
        return new SpecialistLoop(client, registry, new SpecialistCatalog(registry), toolExecutor, properties);
    }

    private SpecialistBranch branch() {
        return new SpecialistBranch(Specialist.UPSTREAM, List.of(Message.user("What's the production in Rokan?")));
    }

    @Test
    void run_noCapabilityRequest_completesAfterOneIteration() {
        client.on(UPSTREAM, (history, tools) -> text("Rokan produces 150,000 BOPD."));

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.COMPLETED);
        assertThat(outcome.getContent()).isEqualTo("Rokan produces 150,000 BOPD.");
        assertThat(outcome.getIterations()).isEqualTo(1);
        assertThat(outcome.getCapabilityCalls()).isZero();
        assertThat(runCtx.getReasoningCalls()).isEqualTo(1);
    }

    @Test
    void run_specialistSeesOnlyItsOwnCapabilities() {
        client.on(UPSTREAM, (history, tools) -> text("done"));

        loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(client.calls(UPSTREAM).get(0).tools())
                .extracting(t -> t.getName())
                .containsExactlyInAnyOrder("get_production_data", "get_lifting_schedule", "get_well_status");
    }

    @Test
    void run_toolResultFedBack_thenCompletes() {
        client.on(UPSTREAM, (history, tools) -> hasToolResults(history)
                ? text("Rokan is at 150,000 BOPD.")
                : toolCalls(null, call("call-1", "get_production_data", Map.of("block_name", "Rokan"))));

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.COMPLETED);
        assertThat(outcome.getIterations()).isEqualTo(2);
        assertThat(outcome.getCapabilityCalls()).isEqualTo(1);

        List<Message> secondCallHistory = client.calls(UPSTREAM).get(1).history();
        Message toolMessage = secondCallHistory.get(secondCallHistory.size() - 1);
        assertThat(toolMessage.getRole()).isEqualTo(Message.Role.tool);
        assertThat(toolMessage.getToolCallId()).isEqualTo("call-1");
        assertThat(toolMessage.getContent()).contains("150000");
        // the assistant request precedes its result
        assertThat(secondCallHistory.get(secondCallHistory.size() - 2).getToolCalls())
                .extracting(t -> t.getId()).containsExactly("call-1");
        assertThat(runCtx.getToolCallRecords()).hasSize(1);
    }

    @Test
    void run_reasoningAlwaysRequestsCapabilities_stopsAtIterationBound() {
        client.on(UPSTREAM, (history, tools) ->
                toolCalls(null, call("c" + history.size(), "get_production_data", Map.of("block_name", "Rokan"))));

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.BOUND_REACHED);
        assertThat(outcome.getIterations()).isEqualTo(3);
        assertThat(client.calls(UPSTREAM)).hasSize(3);
        // no capabilities run after the last reasoning step
        assertThat(outcome.getCapabilityCalls()).isEqualTo(2);
        assertThat(outcome.getContent()).isEqualTo(SpecialistLoop.BOUND_REACHED_FALLBACK);
        assertThat(outcome.isDegraded()).isFalse();
    }

    @Test
    void run_boundReached_lastReasoningTextIsContribution() {
        AtomicInteger step = new AtomicInteger();
        client.on(UPSTREAM, (history, tools) -> toolCalls("Partial answer " + step.incrementAndGet(),
                call("c" + step.get(), "get_production_data", Map.of("block_name", "Cepu"))));

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.BOUND_REACHED);
        assertThat(outcome.getContent()).isEqualTo("Partial answer 3");
    }

    @Test
    void run_capabilityError_fedBackAsToolMessageAndLoopContinues() {
        client.on(UPSTREAM, (history, tools) -> hasToolResults(history)
                ? text("Block name was missing, please specify a block.")
                : toolCalls(null, call("call-err", "get_production_data", Map.of())));

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.COMPLETED);
        List<Message> history = client.calls(UPSTREAM).get(1).history();
        Message toolMessage = history.get(history.size() - 1);
        assertThat(toolMessage.isError()).isTrue();
        assertThat(toolMessage.getToolCallId()).isEqualTo("call-err");
        assertThat(toolMessage.getContent()).startsWith("ERROR:").contains("block_name");
    }

    @Test
    void run_malformedCapabilityArguments_fedBackAndLoopCompletes() {
        ToolCall malformed = ToolCall.builder().id("call-bad").toolName("get_production_data")
                .argumentError("Arguments are not a valid JSON object: {block_name: Rokan").build();
        client.on(UPSTREAM, (history, tools) -> hasToolResults(history)
                ? text("Rokan produces 150,000 BOPD.")
                : toolCalls(null, malformed));

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.COMPLETED);
        assertThat(outcome.getContent()).isEqualTo("Rokan produces 150,000 BOPD.");
        List<Message> history = client.calls(UPSTREAM).get(1).history();
        Message toolMessage = history.get(history.size() - 1);
        assertThat(toolMessage.isError()).isTrue();
        assertThat(toolMessage.getToolCallId()).isEqualTo("call-bad");
        assertThat(toolMessage.getContent()).contains("not a valid JSON object");
    }

    @Test
    void run_multipleCapabilities_resultsAppendedInRequestOrder() {
        CapabilityRegistry registry = TestCapabilities.registry(TestCapabilities.slow("slow_probe", 200));
        client.on(UPSTREAM, (history, tools) -> hasToolResults(history)
                ? text("done")
                : toolCalls(null,
                        call("first", "slow_probe", Map.of()),
                        call("second", "get_production_data", Map.of("block_name", "Mahakam")),
                        call("third", "no_such_capability", Map.of())));

        SpecialistOutcome outcome = loop(registry).run("run-1", branch(), runCtx);

        assertThat(outcome.getCapabilityCalls()).isEqualTo(3);
        List<Message> toolMessages = client.calls(UPSTREAM).get(1).history().stream()
                .filter(m -> m.getRole() == Message.Role.tool)
                .toList();
        assertThat(toolMessages).extracting(Message::getToolCallId).containsExactly("first", "second", "third");
        assertThat(toolMessages).extracting(Message::isError).containsExactly(false, false, true);
    }

    @Test
    void run_capabilityExceedsToolTimeout_becomesErrorResult() {
        properties.getOrchestrator().setToolTimeout(Duration.ofMillis(100));
        CapabilityRegistry registry = TestCapabilities.registry(TestCapabilities.slow("stuck_probe", 5_000));
        client.on(UPSTREAM, (history, tools) -> hasToolResults(history)
                ? text("The probe did not answer in time.")
                : toolCalls(null, call("c1", "stuck_probe", Map.of())));

        SpecialistOutcome outcome = loop(registry).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.COMPLETED);
        List<Message> history = client.calls(UPSTREAM).get(1).history();
        assertThat(history.get(history.size() - 1).getContent()).startsWith("ERROR:").contains("timed out");
    }

    @Test
    void run_reasoningFailure_finishesDegradedWithLastText() {
        client.on(UPSTREAM, (history, tools) -> {
            if (hasToolResults(history)) {
                throw new ReasoningServiceException("quota exceeded");
            }
            return toolCalls("Rokan looks normal so far.",
                    call("c1", "get_production_data", Map.of("block_name", "Rokan")));
        });

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.DEGRADED);
        assertThat(outcome.getContent()).isEqualTo("Rokan looks normal so far.");
        assertThat(outcome.getError()).contains("quota exceeded");
        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.hasUsableContent()).isTrue();
    }

    @Test
    void run_reasoningFailureOnFirstStep_hasNoUsableContent() {
        client.on(UPSTREAM, (history, tools) -> {
            throw new ReasoningServiceException("connection refused");
        });

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch(), runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.DEGRADED);
        assertThat(outcome.hasUsableContent()).isFalse();
        assertThat(outcome.getIterations()).isEqualTo(1);
    }

    @Test
    void run_cancelledBranch_stopsBeforeReasoning() {
        SpecialistBranch branch = branch();
        branch.cancel();

        SpecialistOutcome outcome = loop(TestCapabilities.registry()).run("run-1", branch, runCtx);

        assertThat(outcome.getStatus()).isEqualTo(SpecialistOutcome.Status.TIMED_OUT);
        assertThat(outcome.hasUsableContent()).isFalse();
        assertThat(client.calls(UPSTREAM)).isEmpty();
    }

    @Test
    void run_branchIsPrivate_rootSnapshotUntouched() {
        List<Message> root = List.of(Message.user("What's the production in Rokan?"));
        SpecialistBranch branch = new SpecialistBranch(Specialist.UPSTREAM, root);
        AtomicReference<Integer> seen = new AtomicReference<>();
        client.on(UPSTREAM, (history, tools) -> {
            seen.set(history.size());
            return hasToolResults(history)
                    ? text("done")
                    : toolCalls(null, call("c1", "get_production_data", Map.of("block_name", "Rokan")));
        });

        loop(TestCapabilities.registry()).run("run-1", branch, runCtx);

        assertThat(root).hasSize(1);
        assertThat(seen.get()).isEqualTo(3);
    }
}

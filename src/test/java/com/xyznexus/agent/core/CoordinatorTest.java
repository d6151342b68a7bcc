package com.xyznexus.agent.core;

import com.xyznexus.agent.config.NexusProperties;
import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.model.RunStatus;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.observability.RunContext;
import com.xyznexus.agent.observability.TraceService;
import com.xyznexus.agent.specialist.SpecialistCatalog;
import com.xyznexus.agent.tool.CapabilityRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.xyznexus.agent.core.ScriptedReasoningClient.FINANCE;
import static com.xyznexus.agent.core.ScriptedReasoningClient.LOGISTICS;
import static com.xyznexus.agent.core.ScriptedReasoningClient.ROUTER;
import static com.xyznexus.agent.core.ScriptedReasoningClient.SYNTHESIS;
import static com.xyznexus.agent.core.ScriptedReasoningClient.UPSTREAM;
import static com.xyznexus.agent.core.ScriptedReasoningClient.call;
import static com.xyznexus.agent.core.ScriptedReasoningClient.hasToolResults;
import static com.xyznexus.agent.core.ScriptedReasoningClient.pause;
import static com.xyznexus.agent.core.ScriptedReasoningClient.text;
import static com.xyznexus.agent.core.ScriptedReasoningClient.toolCalls;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CoordinatorTest {

    @Mock TraceService traceService;

    private ExecutorService specialistExecutor;
    private ExecutorService toolExecutor;
    private NexusProperties properties;
    private ScriptedReasoningClient client;

    @BeforeEach
    void setUp() {
        specialistExecutor = Executors.newFixedThreadPool(3);
        toolExecutor = Executors.newFixedThreadPool(4);
        properties = new NexusProperties();
        properties.getOrchestrator().setRunTimeout(Duration.ofSeconds(10));
        client = new ScriptedReasoningClient();
    }

    @AfterEach
    void tearDown() {
        specialistExecutor.shutdownNow();
        toolExecutor.shutdownNow();
    }

    private Coordinator coordinator() {
        CapabilityRegistry registry = TestCapabilities.registry();
        SpecialistLoop loop = new SpecialistLoop(client, registry, new SpecialistCatalog(registry),
                toolExecutor, properties);
        return new Coordinator(new IntentRouter(client), loop, new Synthesizer(client),
                traceService, specialistExecutor, properties);
    }

    @Test
    void run_clarify_noSpecialistLoopStarts() {
        client.on(ROUTER, (history, tools) -> text("CLARIFY"));

        RunResult result = coordinator().run("hello", "user-1", "analyst");

        assertThat(result.getRoutingDecision()).isEqualTo(RoutingDecision.CLARIFY);
        assertThat(result.getFinalResponse()).isEqualTo(Coordinator.CLARIFICATION_TEXT);
        assertThat(result.getStatus()).isEqualTo(RunStatus.CLARIFICATION);
        assertThat(result.getSpecialistsInvolved()).isEmpty();
        assertThat(result.getIterationsBySpecialist()).isEmpty();
        assertThat(client.calls(UPSTREAM)).isEmpty();
        assertThat(client.calls(LOGISTICS)).isEmpty();
        assertThat(client.calls(FINANCE)).isEmpty();
        verify(traceService).persistTrace(any(RunState.class), any(RunContext.class));
    }

    @Test
    void run_unrecognisedLabel_treatedAsClarify() {
        client.on(ROUTER, (history, tools) -> text("MAYBE"));

        RunResult result = coordinator().run("Tell me about stuff", "user-1", "user");

        assertThat(result.getRoutingDecision()).isEqualTo(RoutingDecision.CLARIFY);
        assertThat(result.getFinalResponse()).isEqualTo(Coordinator.CLARIFICATION_TEXT);
        assertThat(result.getIterationsBySpecialist()).isEmpty();
        assertThat(client.calls(UPSTREAM)).isEmpty();
        assertThat(client.calls(SYNTHESIS)).isEmpty();
    }

    @Test
    void run_singleSpecialist_outputReturnedVerbatimWithoutSynthesis() {
        client.on(ROUTER, (history, tools) -> text("  upstream \n"))
              .on(UPSTREAM, (history, tools) -> text("Rokan produces 150,000 BOPD today."));

        RunResult result = coordinator().run("What's the production in Rokan?", "user-1", "user");

        assertThat(result.getRoutingDecision()).isEqualTo(RoutingDecision.UPSTREAM);
        assertThat(result.getFinalResponse()).isEqualTo("Rokan produces 150,000 BOPD today.");
        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.isDegraded()).isFalse();
        assertThat(result.getSpecialistsInvolved()).containsExactly(Specialist.UPSTREAM);
        assertThat(client.calls(SYNTHESIS)).isEmpty();
    }

    @Test
    void run_allAgents_synthesisOrderIndependentOfCompletionOrder() {
        client.on(ROUTER, (history, tools) -> text("ALL_AGENTS"))
              .on(UPSTREAM, (history, tools) -> {
                  pause(400);
                  return text("UPSTREAM-OUTPUT");
              })
              .on(LOGISTICS, (history, tools) -> {
                  pause(200);
                  return text("LOGISTICS-OUTPUT");
              })
              .on(FINANCE, (history, tools) -> text("FINANCE-OUTPUT"))
              .on(SYNTHESIS, (history, tools) -> text("Integrated answer"));

        RunResult result = coordinator().run("Profitability of Rokan considering shipping delays?", "u", "user");

        assertThat(result.getFinalResponse()).isEqualTo("Integrated answer");
        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(client.calls(SYNTHESIS)).hasSize(1);

        String directive = client.calls(SYNTHESIS).get(0).directive();
        int upstream = directive.indexOf("[upstream]\nUPSTREAM-OUTPUT");
        int logistics = directive.indexOf("[logistics]\nLOGISTICS-OUTPUT");
        int finance = directive.indexOf("[finance]\nFINANCE-OUTPUT");
        assertThat(upstream).isNotNegative();
        assertThat(logistics).isGreaterThan(upstream);
        assertThat(finance).isGreaterThan(logistics);
    }

    @Test
    void run_upstreamLogistics_endToEndWithIsolatedBranches() {
        client.on(ROUTER, (history, tools) -> text("UPSTREAM_LOGISTICS"))
              .on(UPSTREAM, (history, tools) -> hasToolResults(history)
                      ? text("Rokan: 150,000 BOPD, 450 MMSCFD.")
                      : toolCalls(null, call("u1", "get_production_data", Map.of("block_name", "Rokan"))))
              .on(LOGISTICS, (history, tools) -> hasToolResults(history)
                      ? text("MT XYZ Prime is en route to Kilang Balongan.")
                      : toolCalls(null,
                              call("l1", "track_vessel", Map.of("vessel_name", "MT XYZ Prime")),
                              call("l2", "get_weather_forecast", Map.of("location", "Selat Sunda"))))
              .on(SYNTHESIS, (history, tools) -> text("Rokan is producing normally and its cargo is on the way."));

        RunResult result = coordinator().run(
                "Status of Rokan production and its shipment to Balongan?", "user-7", "planner");

        assertThat(result.getRoutingDecision()).isEqualTo(RoutingDecision.UPSTREAM_LOGISTICS);
        assertThat(result.getSpecialistsInvolved()).containsExactly(Specialist.UPSTREAM, Specialist.LOGISTICS);
        assertThat(result.getIterationsBySpecialist())
                .containsEntry(Specialist.UPSTREAM, 2)
                .containsEntry(Specialist.LOGISTICS, 2)
                .doesNotContainKey(Specialist.FINANCE);
        assertThat(result.getFinalResponse()).isEqualTo("Rokan is producing normally and its cargo is on the way.");
        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(client.calls(FINANCE)).isEmpty();

        // specialists never see each other's capability traffic
        assertThat(capabilityResultsSeenBy(LOGISTICS)).containsOnly("track_vessel", "get_weather_forecast");
        assertThat(capabilityResultsSeenBy(UPSTREAM)).containsOnly("get_production_data");

        String directive = client.calls(SYNTHESIS).get(0).directive();
        assertThat(directive.indexOf("Rokan: 150,000 BOPD"))
                .isLessThan(directive.indexOf("MT XYZ Prime is en route"));
    }

    private List<String> capabilityResultsSeenBy(String specialistMarker) {
        return client.calls(specialistMarker).stream()
                .flatMap(c -> c.history().stream())
                .filter(m -> m.getRole() == Message.Role.tool)
                .map(Message::getName)
                .toList();
    }

    @Test
    void run_specialistExceedsDeadline_proceedsDegradedWithRemainingOutput() {
        properties.getOrchestrator().setRunTimeout(Duration.ofMillis(500));
        client.on(ROUTER, (history, tools) -> text("UPSTREAM_FINANCE"))
              .on(UPSTREAM, (history, tools) -> text("Rokan produces 150,000 BOPD."))
              .on(FINANCE, (history, tools) -> {
                  pause(10_000);
                  return text("never returned");
              });

        long start = System.currentTimeMillis();
        RunResult result = coordinator().run("Revenue from Rokan production?", "u", "user");

        assertThat(System.currentTimeMillis() - start).isLessThan(5_000);
        assertThat(result.getFinalResponse()).isEqualTo("Rokan produces 150,000 BOPD.");
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getStatus()).isEqualTo(RunStatus.DEGRADED);
        assertThat(result.getSpecialistOutcomes())
                .containsEntry(Specialist.UPSTREAM, SpecialistOutcome.Status.COMPLETED)
                .containsEntry(Specialist.FINANCE, SpecialistOutcome.Status.TIMED_OUT);
        assertThat(client.calls(SYNTHESIS)).isEmpty();
    }

    @Test
    void run_allSpecialistsFail_returnsApologyWithFailedStatus() {
        client.on(ROUTER, (history, tools) -> text("LOGISTICS_FINANCE"))
              .on(LOGISTICS, (history, tools) -> {
                  throw new ReasoningServiceException("rate limited");
              })
              .on(FINANCE, (history, tools) -> {
                  throw new ReasoningServiceException("rate limited");
              });

        RunResult result = coordinator().run("Cost of the delayed shipment?", "u", "user");

        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.getFinalResponse()).isEqualTo(Coordinator.APOLOGY_TEXT);
        assertThat(result.getSpecialistOutcomes())
                .containsEntry(Specialist.LOGISTICS, SpecialistOutcome.Status.DEGRADED)
                .containsEntry(Specialist.FINANCE, SpecialistOutcome.Status.DEGRADED);
        assertThat(client.calls(SYNTHESIS)).isEmpty();
    }

    @Test
    void run_oneOfTwoSpecialistsFails_survivorReturnedDirectly() {
        client.on(ROUTER, (history, tools) -> text("LOGISTICS_FINANCE"))
              .on(LOGISTICS, (history, tools) -> {
                  throw new ReasoningServiceException("server error");
              })
              .on(FINANCE, (history, tools) -> text("Revenue is USD 42.5M."));

        RunResult result = coordinator().run("Revenue impact of the delayed cargo?", "u", "user");

        assertThat(result.getFinalResponse()).isEqualTo("Revenue is USD 42.5M.");
        assertThat(result.getStatus()).isEqualTo(RunStatus.DEGRADED);
        assertThat(result.getSpecialistsInvolved()).containsExactly(Specialist.LOGISTICS, Specialist.FINANCE);
        assertThat(client.calls(SYNTHESIS)).isEmpty();
    }

    @Test
    void run_routerFailure_failsWithApology() {
        client.on(ROUTER, (history, tools) -> {
            throw new ReasoningServiceException("circuit open");
        });

        RunResult result = coordinator().run("What's the production in Rokan?", "u", "user");

        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.getFinalResponse()).isEqualTo(Coordinator.APOLOGY_TEXT);
        assertThat(result.getRoutingDecision()).isNull();
        assertThat(result.getSpecialistsInvolved()).isEmpty();
    }

    @Test
    void run_synthesisFails_labelledOutputsReturnedDegraded() {
        client.on(ROUTER, (history, tools) -> text("UPSTREAM_FINANCE"))
              .on(UPSTREAM, (history, tools) -> text("Rokan: 150,000 BOPD."))
              .on(FINANCE, (history, tools) -> text("Revenue: USD 12.75M per day."))
              .on(SYNTHESIS, (history, tools) -> {
                  throw new ReasoningServiceException("timeout");
              });

        RunResult result = coordinator().run("Daily revenue of Rokan?", "u", "user");

        assertThat(result.getStatus()).isEqualTo(RunStatus.DEGRADED);
        assertThat(result.getFinalResponse())
                .isEqualTo("[upstream]\nRokan: 150,000 BOPD.\n\n[finance]\nRevenue: USD 12.75M per day.");
    }

    @Test
    void run_routerExceedsDeadline_failsWithoutStartingSpecialists() {
        properties.getOrchestrator().setRunTimeout(Duration.ofMillis(500));
        client.on(ROUTER, (history, tools) -> {
                  pause(10_000);
                  return text("UPSTREAM");
              })
              .on(UPSTREAM, (history, tools) -> text("never asked"));

        long start = System.currentTimeMillis();
        RunResult result = coordinator().run("What's the production in Rokan?", "u", "user");

        assertThat(System.currentTimeMillis() - start).isLessThan(1_500);
        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.getFinalResponse()).isEqualTo(Coordinator.APOLOGY_TEXT);
        assertThat(result.getRoutingDecision()).isNull();
        assertThat(result.getSpecialistOutcomes()).isEmpty();
        assertThat(client.calls(UPSTREAM)).isEmpty();
    }

    @Test
    void run_synthesisExceedsDeadline_labelledOutputsReturnedDegraded() {
        properties.getOrchestrator().setRunTimeout(Duration.ofMillis(800));
        client.on(ROUTER, (history, tools) -> text("UPSTREAM_FINANCE"))
              .on(UPSTREAM, (history, tools) -> text("Rokan: 150,000 BOPD."))
              .on(FINANCE, (history, tools) -> text("Revenue: USD 12.75M per day."))
              .on(SYNTHESIS, (history, tools) -> {
                  pause(10_000);
                  return text("late synthesis");
              });

        long start = System.currentTimeMillis();
        RunResult result = coordinator().run("Daily revenue of Rokan?", "u", "user");

        assertThat(System.currentTimeMillis() - start).isLessThan(2_000);
        assertThat(result.getStatus()).isEqualTo(RunStatus.DEGRADED);
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getFinalResponse())
                .isEqualTo("[upstream]\nRokan: 150,000 BOPD.\n\n[finance]\nRevenue: USD 12.75M per day.");
        assertThat(result.getSpecialistOutcomes())
                .containsEntry(Specialist.UPSTREAM, SpecialistOutcome.Status.COMPLETED)
                .containsEntry(Specialist.FINANCE, SpecialistOutcome.Status.COMPLETED);
    }

    @Test
    void run_sessionIdDefaultsToRunId() {
        client.on(ROUTER, (history, tools) -> text("CLARIFY"));

        RunResult withoutSession = coordinator().run("hello there", "u", "user");
        RunResult withSession = coordinator().run("hello there", "u", "user", "session-42");

        assertThat(withoutSession.getSessionId()).isEqualTo(withoutSession.getRunId());
        assertThat(withSession.getSessionId()).isEqualTo("session-42");
    }

    @Test
    void run_everySpecialistSeededWithSameRootSnapshot() {
        client.on(ROUTER, (history, tools) -> text("ALL_AGENTS"))
              .on(UPSTREAM, (history, tools) -> text("u"))
              .on(LOGISTICS, (history, tools) -> text("l"))
              .on(FINANCE, (history, tools) -> text("f"))
              .on(SYNTHESIS, (history, tools) -> text("all"));

        coordinator().run("Profitability of Rokan block considering shipping delays?", "u", "user");

        List<Message> expected = List.of(Message.user("Profitability of Rokan block considering shipping delays?"));
        assertThat(client.calls(UPSTREAM).get(0).history()).isEqualTo(expected);
        assertThat(client.calls(LOGISTICS).get(0).history()).isEqualTo(expected);
        assertThat(client.calls(FINANCE).get(0).history()).isEqualTo(expected);
    }
}

package com.xyznexus.agent.observability;

import com.xyznexus.agent.core.RunState;
import com.xyznexus.agent.core.SpecialistOutcome;
import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.model.RunStatus;
import com.xyznexus.agent.model.Specialist;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraceServiceTest {

    @Mock RunTraceRepository traceRepository;

    @InjectMocks
    TraceService traceService;

    private static RunState finishedRun() {
        RunState state = mock(RunState.class);
        lenient().when(state.getRunId()).thenReturn("run-1");
        lenient().when(state.getSessionId()).thenReturn("session-1");
        lenient().when(state.getUserId()).thenReturn("user-1");
        lenient().when(state.getUserRole()).thenReturn("analyst");
        lenient().when(state.getQuery()).thenReturn("Rokan status and shipment?");
        lenient().when(state.getRoutingDecision()).thenReturn(RoutingDecision.UPSTREAM_LOGISTICS);
        lenient().when(state.getFinalResponse()).thenReturn("All good");
        lenient().when(state.getStatus()).thenReturn(RunStatus.DEGRADED);
        lenient().when(state.isDegraded()).thenReturn(true);
        lenient().when(state.getIterationsBySpecialist())
                .thenReturn(Map.of(Specialist.UPSTREAM, 2, Specialist.LOGISTICS, 1));
        lenient().when(state.getOutcomes()).thenReturn(List.of(
                SpecialistOutcome.builder().specialist(Specialist.UPSTREAM)
                        .status(SpecialistOutcome.Status.COMPLETED).iterations(2).content("ok").build(),
                SpecialistOutcome.builder().specialist(Specialist.LOGISTICS)
                        .status(SpecialistOutcome.Status.TIMED_OUT).iterations(1).build()));
        return state;
    }

    @Test
    void persistTrace_savesRunSummary() {
        RunContext runCtx = new RunContext();
        runCtx.addTokens(100, 20);
        runCtx.recordToolCall("upstream", "get_production_data", Map.of("block_name", "Rokan"),
                12, false, "{\"oil_production_bopd\":150000}");

        traceService.persistTrace(finishedRun(), runCtx);

        ArgumentCaptor<RunTrace> captor = ArgumentCaptor.forClass(RunTrace.class);
        verify(traceRepository).save(captor.capture());
        RunTrace trace = captor.getValue();
        assertThat(trace.getRunId()).isEqualTo("run-1");
        assertThat(trace.getSpecialists()).containsExactly("upstream", "logistics");
        assertThat(trace.getStatus()).isEqualTo(RunStatus.DEGRADED);
        assertThat(trace.getIterationsBySpecialist()).containsEntry("upstream", 2).containsEntry("logistics", 1);
        assertThat(trace.getSpecialistOutcomes()).containsEntry("logistics", "TIMED_OUT");
        assertThat(trace.getTotalTokens()).isEqualTo(120);
        assertThat(trace.getReasoningCalls()).isEqualTo(1);
        assertThat(trace.getToolCalls()).hasSize(1);
        assertThat(trace.getToolCalls().get(0))
                .containsEntry("specialist", "upstream")
                .containsEntry("toolName", "get_production_data")
                .containsEntry("error", false);
    }

    @Test
    void persistTrace_repositoryFailure_doesNotThrow() {
        when(traceRepository.save(any(RunTrace.class))).thenThrow(new RuntimeException("mongo down"));
        // Should not throw: trace persistence is best-effort
        traceService.persistTrace(finishedRun(), new RunContext());
    }

    @Test
    void getAnalytics_aggregatesRepositoryQueries() {
        when(traceRepository.avgLatencyForUser("user-1")).thenReturn(1234.6);
        when(traceRepository.totalTokensUsedSince(eq("user-1"), any(Instant.class))).thenReturn(5000L);
        when(traceRepository.statusBreakdownForUser("user-1")).thenReturn(List.of(
                new RunTraceRepository.StatusCount("COMPLETED", 3),
                new RunTraceRepository.StatusCount("FAILED", 1)));
        when(traceRepository.routingBreakdownForUser("user-1")).thenReturn(List.of(
                new RunTraceRepository.StatusCount("UPSTREAM", 4)));

        Map<String, Object> analytics = traceService.getAnalytics("user-1");

        assertThat(analytics)
                .containsEntry("avgLatencyMs", 1235L)
                .containsEntry("totalTokensLast24h", 5000L)
                .containsEntry("statusBreakdown", Map.of("COMPLETED", 3L, "FAILED", 1L))
                .containsEntry("routingBreakdown", Map.of("UPSTREAM", 4L));
    }

    @Test
    void getAnalytics_noTraces_zeroDefaults() {
        when(traceRepository.statusBreakdownForUser("nobody")).thenReturn(List.of());
        when(traceRepository.routingBreakdownForUser("nobody")).thenReturn(List.of());

        Map<String, Object> analytics = traceService.getAnalytics("nobody");

        assertThat(analytics).containsEntry("avgLatencyMs", 0L).containsEntry("totalTokensLast24h", 0L);
    }
}

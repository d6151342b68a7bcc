package com.xyznexus.agent.core;

import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.llm.ReasoningClient;
import com.xyznexus.agent.llm.ReasoningResponse;
import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.observability.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Merges the outputs of several specialists into one answer with a single
 * reasoning call and no capabilities.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Synthesizer {

    static final String SYNTHESIS_DIRECTIVE = """
            You are synthesizing responses from multiple XYZ specialist agents into one answer.

            Create a cohesive, integrated final response that:
            - connects the findings of each specialist where they relate to each other
            - keeps every concrete number, unit, vessel name and risk flag
            - does not invent data that none of the specialists reported
            - states plainly when a specialist could not provide its part

            Specialist responses, in order:

            %s
            """;

    private final ReasoningClient reasoningClient;

    /**
     * @param outcomes usable outputs in specialist precedence order
     * @throws ReasoningServiceException when the combination call fails
     */
    public String synthesize(String runId, String query, List<SpecialistOutcome> outcomes, RunContext runCtx) {
        String directive = SYNTHESIS_DIRECTIVE.formatted(labelled(outcomes));
        log.info("Synthesizing {} specialist outputs [runId={}, specialists={}]", outcomes.size(), runId,
                outcomes.stream().map(o -> o.getSpecialist().id()).toList());

        ReasoningResponse response = reasoningClient.generate(directive, List.of(Message.user(query)), List.of());
        runCtx.addTokens(response.getPromptTokens(), response.getCompletionTokens());

        Message reply = response.getMessage();
        if (reply == null || !reply.hasText()) {
            throw new ReasoningServiceException("Synthesis returned no text");
        }
        return reply.getContent();
    }

    /** Specialist outputs joined with headers, used as-is when synthesis is unavailable. */
    static String labelled(List<SpecialistOutcome> outcomes) {
        return outcomes.stream()
                .map(o -> "[" + o.getSpecialist().id() + "]\n" + o.getContent().strip())
                .collect(Collectors.joining("\n\n"));
    }
}

package com.xyznexus.agent.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a capability's schema sent to the reasoning service.
 * Decouples the wire format from the {@link Capability} implementation.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema;

    public static ToolDefinition from(Capability capability) {
        return ToolDefinition.builder()
                .name(capability.getName())
                .description(capability.getDescription())
                .inputSchema(capability.getInputSchema())
                .build();
    }

    /**
     * OpenAI-compatible tool format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}

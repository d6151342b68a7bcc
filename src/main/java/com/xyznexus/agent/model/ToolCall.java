package com.xyznexus.agent.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A single capability invocation requested by the reasoning service.
 */
@Value
@Builder(toBuilder = true)
public class ToolCall {

    /** Id assigned by the provider; tool result messages echo it back as toolCallId */
    String id;

    String toolName;

    @Builder.Default
    Map<String, Object> arguments = Map.of();

    /** Set when the provider sent arguments that are not a JSON object; arguments are then empty */
    String argumentError;
}

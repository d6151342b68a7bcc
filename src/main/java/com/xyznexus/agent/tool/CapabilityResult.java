package com.xyznexus.agent.tool;

import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.model.ToolCall;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one capability invocation: a serialized result record, or the
 * error text of a failed invocation.
 */
@Value
@Builder
public class CapabilityResult {

    String toolCallId;
    String capabilityName;
    String content;
    boolean error;
    long latencyMs;

    public static CapabilityResult success(ToolCall call, String json, long latencyMs) {
        return CapabilityResult.builder()
                .toolCallId(call.getId())
                .capabilityName(call.getToolName())
                .content(json)
                .latencyMs(latencyMs)
                .build();
    }

    public static CapabilityResult failure(ToolCall call, String cause) {
        return failure(call, cause, 0);
    }

    public static CapabilityResult failure(ToolCall call, String cause, long latencyMs) {
        return CapabilityResult.builder()
                .toolCallId(call.getId())
                .capabilityName(call.getToolName())
                .content("ERROR: " + cause)
                .error(true)
                .latencyMs(latencyMs)
                .build();
    }

    /** The tool-role message fed back to the specialist on its next reasoning step. */
    public Message toMessage() {
        return Message.builder()
                .role(Message.Role.tool)
                .toolCallId(toolCallId)
                .name(capabilityName)
                .content(content)
                .error(error)
                .build();
    }
}

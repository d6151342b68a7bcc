package com.xyznexus.agent.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One entry of a conversation history. Immutable once built; histories are
 * only ever appended to.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    Role role;
    String content;

    /** Present when role = tool: links back to the assistant's tool call id */
    String toolCallId;

    /** Present when role = tool: the capability that produced this result */
    String name;

    /**
     * Present when role = assistant and the reasoning service requested capability calls.
     * Echoed back on the next request so results can be correlated to their requests.
     */
    @Builder.Default
    List<ToolCall> toolCalls = List.of();

    /** Set on tool messages whose capability invocation failed */
    boolean error;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasText() {
        return content != null && !content.isBlank();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(Role.assistant)
                .content(content)
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }
}

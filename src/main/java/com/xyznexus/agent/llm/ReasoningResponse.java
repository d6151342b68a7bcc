package com.xyznexus.agent.llm;

import com.xyznexus.agent.model.Message;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReasoningResponse {

    /** Assistant message; carries tool calls when the service wants capabilities invoked */
    Message message;

    @Builder.Default
    int promptTokens = 0;

    @Builder.Default
    int completionTokens = 0;

    public static ReasoningResponse of(Message message) {
        return ReasoningResponse.builder().message(message).build();
    }

    public boolean isToolCallRequired() {
        return message != null && message.hasToolCalls();
    }
}

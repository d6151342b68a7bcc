package com.xyznexus.agent.llm;

import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.tool.ToolDefinition;

import java.util.List;

public interface ReasoningClient {

    /**
     * Send a directive and the conversation so far to the reasoning service.
     *
     * @param directive system directive placed before the history
     * @param history   conversation so far (user + assistant + tool results)
     * @param tools     capabilities the service may request; empty for plain text generation
     * @return the assistant reply, either final text or one or more capability requests
     * @throws ReasoningServiceException when no reply could be obtained
     */
    ReasoningResponse generate(String directive, List<Message> history, List<ToolDefinition> tools);
}

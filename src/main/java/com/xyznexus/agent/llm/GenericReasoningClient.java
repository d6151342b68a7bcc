package com.xyznexus.agent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.exception.ReasoningServiceUnavailableException;
import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.model.ToolCall;
import com.xyznexus.agent.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * OpenAI-compatible chat completions client. Works with DeepSeek and OpenAI.
 *
 * Error handling strategy:
 *
 * | Error                  | Exception                                     |
 * |------------------------|-----------------------------------------------|
 * | 401 invalid key        | ReasoningServiceException (not retried)       |
 * | 400 / other 4xx        | ReasoningServiceException (not retried)       |
 * | 429 rate limit         | ReasoningServiceUnavailableException (retried)|
 * | 5xx server error       | ReasoningServiceUnavailableException (retried)|
 * | network / read timeout | ReasoningServiceUnavailableException (retried)|
 * | malformed response     | ReasoningServiceException (not retried)       |
 */
@Slf4j
public class GenericReasoningClient implements ReasoningClient {

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericReasoningClient(LlmProviderProperties props,
                                  ObjectMapper objectMapper,
                                  String providerName,
                                  RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public ReasoningResponse generate(String directive, List<Message> history, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(directive, history, tools);

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                history.size(), tools.size(), providerName, props.getModel());

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw clientError(res.getStatusCode().value(), body);
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new ReasoningServiceUnavailableException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ReasoningServiceException e) {
            throw e;
        } catch (ResourceAccessException e) {
            throw new ReasoningServiceUnavailableException(providerName + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ReasoningServiceException(providerName + " call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ReasoningServiceException(providerName + " returned an empty body");
        }
        return parseResponse(response);
    }

    private ReasoningServiceException clientError(int statusCode, String body) {
        if (statusCode == 401) {
            return new ReasoningServiceException(
                    providerName + " API key is invalid. Check your "
                            + providerName.toUpperCase() + "_API_KEY environment variable.");
        }
        if (statusCode == 429) {
            return new ReasoningServiceUnavailableException(providerName + " rate limit exceeded. Will retry.");
        }
        return new ReasoningServiceException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(String directive, List<Message> history, List<ToolDefinition> tools) {
        List<Map<String, Object>> formattedMessages = new ArrayList<>();
        formattedMessages.add(Map.of("role", "system", "content", directive));
        history.stream().map(this::formatMessage).forEach(formattedMessages::add);

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        return body;
    }

    Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent());
        } else if (msg.getRole() == Message.Role.assistant) {
            // the tool_calls array must be echoed back or the provider cannot
            // correlate the following tool messages to their requests
            m.put("content", msg.getContent());
            if (msg.hasToolCalls()) {
                m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
            }
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(tc.getArguments()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }

        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    ReasoningResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ReasoningServiceException(providerName + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage — prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice  = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        if (message == null) {
            throw new ReasoningServiceException(providerName + " returned a choice without a message");
        }

        log.debug("{} finish_reason: {}", providerName, choice.get("finish_reason"));

        String content = (String) message.get("content");
        List<Map<String, Object>> rawToolCalls = (List<Map<String, Object>>) message.get("tool_calls");

        List<ToolCall> toolCalls = new ArrayList<>();
        if (rawToolCalls != null) {
            for (Map<String, Object> raw : rawToolCalls) {
                toolCalls.add(parseToolCall(raw));
            }
        }

        return ReasoningResponse.builder()
                .message(Message.assistant(content, toolCalls))
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    @SuppressWarnings("unchecked")
    private ToolCall parseToolCall(Map<String, Object> raw) {
        Map<String, Object> function = (Map<String, Object>) raw.get("function");
        if (function == null || function.get("name") == null) {
            throw new ReasoningServiceException(providerName + " returned a tool call without a function name");
        }

        Map<String, Object> args = Map.of();
        String argumentError = null;
        Object rawArgs = function.get("arguments");
        try {
            if (rawArgs != null && !rawArgs.toString().isBlank()) {
                args = objectMapper.readValue(rawArgs.toString(), new TypeReference<>() {});
            }
        } catch (JsonProcessingException e) {
            // Reported back to the specialist by the registry so the model can retry the call
            log.warn("{} sent unparseable tool arguments for [{}]: {}", providerName, function.get("name"), rawArgs);
            argumentError = "Arguments are not a valid JSON object: " + rawArgs;
        }

        String id = (String) raw.get("id");
        return ToolCall.builder()
                .id(id != null ? id : "call-" + UUID.randomUUID().toString().substring(0, 8))
                .toolName((String) function.get("name"))
                .arguments(args != null ? args : Map.of())
                .argumentError(argumentError)
                .build();
    }
}

package com.xyznexus.agent.resilience;

import com.xyznexus.agent.exception.ReasoningServiceException;
import com.xyznexus.agent.exception.ReasoningServiceUnavailableException;
import com.xyznexus.agent.llm.ReasoningClient;
import com.xyznexus.agent.llm.ReasoningResponse;
import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active provider client that adds retry + circuit breaker.
 *
 * Retry config (application.yml, instance "reasoningService"):
 * - 3 attempts, exponential backoff 2s → 4s
 * - only ReasoningServiceUnavailableException is retried
 *
 * Circuit breaker config:
 * - opens after 50% failures in a sliding window of 10 calls
 * - 30s before half-open probe calls
 *
 * Fallbacks rethrow as ReasoningServiceException so a specialist loop
 * finishes degraded instead of treating canned text as an answer.
 */
@Component
@Primary
@Slf4j
public class ResilientReasoningClient implements ReasoningClient {

    private final ReasoningClient delegate;

    public ResilientReasoningClient(@Qualifier("activeReasoningClient") ReasoningClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "reasoningService", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "reasoningService", fallbackMethod = "circuitBreakerFallback")
    public ReasoningResponse generate(String directive, List<Message> history, List<ToolDefinition> tools) {
        return delegate.generate(directive, history, tools);
    }

    public ReasoningResponse retryFallback(String directive,
                                           List<Message> history,
                                           List<ToolDefinition> tools,
                                           Exception ex) {
        log.error("Reasoning call failed after all retries: {}", ex.getMessage());
        throw asReasoningFailure(ex);
    }

    public ReasoningResponse circuitBreakerFallback(String directive,
                                                    List<Message> history,
                                                    List<ToolDefinition> tools,
                                                    Exception ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("Reasoning circuit breaker is OPEN — rejecting call: {}", ex.getMessage());
            throw new ReasoningServiceUnavailableException("Reasoning service circuit is open", ex);
        }
        throw asReasoningFailure(ex);
    }

    static ReasoningServiceException asReasoningFailure(Exception ex) {
        if (ex instanceof ReasoningServiceException rse) {
            return rse;
        }
        return new ReasoningServiceUnavailableException("Reasoning service call failed: " + ex.getMessage(), ex);
    }
}

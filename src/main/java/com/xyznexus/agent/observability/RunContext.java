package com.xyznexus.agent.observability;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run observability data, collected throughout and flushed to a
 * {@link RunTrace} at the end.
 *
 * Specialist loops of one run write to it concurrently, so every field is
 * thread-safe. Kept apart from RunState so observability never affects
 * orchestration decisions.
 */
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new CopyOnWriteArrayList<>();
    private final AtomicInteger promptTokens = new AtomicInteger();
    private final AtomicInteger completionTokens = new AtomicInteger();
    private final AtomicInteger reasoningCalls = new AtomicInteger();

    public void recordToolCall(String specialist, String toolName, Object args,
                               long latencyMs, boolean error, String result) {
        toolCallRecords.add(new ToolCallRecord(specialist, toolName, args, latencyMs, error, result));
    }

    public void addTokens(int prompt, int completion) {
        reasoningCalls.incrementAndGet();
        promptTokens.addAndGet(prompt);
        completionTokens.addAndGet(completion);
    }

    public List<ToolCallRecord> getToolCallRecords() {
        return List.copyOf(toolCallRecords);
    }

    public int getPromptTokens() {
        return promptTokens.get();
    }

    public int getCompletionTokens() {
        return completionTokens.get();
    }

    public int getReasoningCalls() {
        return reasoningCalls.get();
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens.get() + completionTokens.get();
    }

    public record ToolCallRecord(
            String specialist,
            String toolName,
            Object args,
            long latencyMs,
            boolean error,
            String result
    ) {}
}

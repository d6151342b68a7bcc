package com.xyznexus.agent.core;

import com.xyznexus.agent.model.Message;
import com.xyznexus.agent.model.Specialist;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One specialist's private copy of the conversation, seeded from the root
 * snapshot of the run. Only the owning loop appends to it; the coordinator
 * reads the iteration counter and may cancel it.
 */
public class SpecialistBranch {

    private final Specialist specialist;
    private final List<Message> messages;
    private final AtomicInteger iterations = new AtomicInteger();
    private volatile boolean cancelled;

    SpecialistBranch(Specialist specialist, List<Message> rootSnapshot) {
        this.specialist = specialist;
        this.messages = new ArrayList<>(rootSnapshot);
    }

    public Specialist getSpecialist() {
        return specialist;
    }

    int nextIteration() {
        return iterations.incrementAndGet();
    }

    public int getIterations() {
        return iterations.get();
    }

    void append(Message message) {
        messages.add(message);
    }

    /** Copy handed to the reasoning client so it never sees later appends. */
    List<Message> snapshot() {
        return List.copyOf(messages);
    }

    /** Last assistant message with non-blank text, or null. */
    String lastAssistantText() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message m = messages.get(i);
            if (m.getRole() == Message.Role.assistant && m.hasText()) {
                return m.getContent();
            }
        }
        return null;
    }

    void cancel() {
        cancelled = true;
    }

    boolean isCancelled() {
        return cancelled;
    }
}

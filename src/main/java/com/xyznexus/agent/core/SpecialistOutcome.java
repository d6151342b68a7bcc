package com.xyznexus.agent.core;

import com.xyznexus.agent.model.Specialist;
import lombok.Builder;
import lombok.Value;

/**
 * What one specialist loop contributed to the run.
 */
@Value
@Builder
public class SpecialistOutcome {

    public enum Status {
        /** Final text produced without further capability requests */
        COMPLETED,
        /** Iteration bound reached; last reasoning output is the contribution */
        BOUND_REACHED,
        /** Reasoning service failed; contribution is the last text seen, if any */
        DEGRADED,
        /** Cancelled at the run deadline; contributes nothing */
        TIMED_OUT
    }

    Specialist specialist;
    String content;
    int iterations;
    Status status;
    String error;
    int capabilityCalls;

    public boolean hasUsableContent() {
        return status != Status.TIMED_OUT && content != null && !content.isBlank();
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED || status == Status.TIMED_OUT;
    }

    static SpecialistOutcome timedOut(SpecialistBranch branch, String reason) {
        return SpecialistOutcome.builder()
                .specialist(branch.getSpecialist())
                .iterations(branch.getIterations())
                .status(Status.TIMED_OUT)
                .error(reason)
                .build();
    }
}

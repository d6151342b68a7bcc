package com.xyznexus.agent.model;

public enum RunStatus {
    /** Every routed specialist produced a usable answer */
    COMPLETED,
    /** Router could not classify the query; the fixed clarification text was returned */
    CLARIFICATION,
    /** An answer was produced but at least one specialist failed, timed out, or synthesis fell back */
    DEGRADED,
    /** No usable answer; the generic apology was returned */
    FAILED
}

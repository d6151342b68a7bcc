package com.xyznexus.agent.tool;

import com.xyznexus.agent.exception.CapabilityException;
import com.xyznexus.agent.model.Specialist;

import java.util.Map;

/**
 * Contract every specialist capability must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the reasoning service so it knows how to invoke the capability.
 *
 * Failures are reported by throwing {@link CapabilityException}; the registry
 * turns them into error results, so one failure never stops the loop.
 */
public interface Capability {

    /** The specialist this capability belongs to */
    Specialist getSpecialist();

    /** Unique snake_case name the reasoning service uses to invoke this capability */
    String getName();

    /** Primary signal the reasoning service uses to decide when to call it */
    String getDescription();

    /** JSON Schema (as a Map) describing the input parameters */
    Map<String, Object> getInputSchema();

    /**
     * Execute with already schema-checked arguments and return a JSON-serializable record.
     *
     * @throws CapabilityException with a human-readable cause when no result can be produced
     */
    Map<String, Object> invoke(Map<String, Object> arguments);
}

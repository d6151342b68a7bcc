package com.xyznexus.agent.specialist;

import com.xyznexus.agent.model.Specialist;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A specialist's identity: directive, description and the capabilities it may call.
 */
@Value
@Builder
public class SpecialistProfile {

    Specialist specialist;
    String displayName;
    String description;
    /** System directive sent on every reasoning step of this specialist's loop */
    String directive;
    List<String> responsibilities;
    List<String> capabilityNames;
}

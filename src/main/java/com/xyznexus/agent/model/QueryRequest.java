package com.xyznexus.agent.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class QueryRequest {

    @NotBlank(message = "query must not be blank")
    @Size(min = 3, message = "query must be at least 3 characters")
    private String query;

    /** Optional. Defaults to "anonymous". */
    private String userId;

    /** Optional. Generated when absent. */
    private String sessionId;

    /** Carried through for downstream authorization; not enforced here. */
    private String userRole = "user";
}

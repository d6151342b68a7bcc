package com.xyznexus.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Domain specialists, declared in synthesis precedence order.
 */
public enum Specialist {

    UPSTREAM("upstream"),
    LOGISTICS("logistics"),
    FINANCE("finance");

    private final String id;

    Specialist(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}

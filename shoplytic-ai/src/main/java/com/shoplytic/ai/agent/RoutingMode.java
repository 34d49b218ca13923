package com.shoplytic.ai.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RoutingMode {
    /** Answered by the routing model itself, no handler ran. */
    DIRECT,
    SINGLE,
    SEQUENTIAL,
    PARALLEL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}

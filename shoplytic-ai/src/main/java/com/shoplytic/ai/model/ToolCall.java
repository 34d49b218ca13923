package com.shoplytic.ai.model;

/**
 * A function call proposed by the model. Arguments are kept as the raw JSON
 * object text and parsed by whoever executes the call.
 */
public record ToolCall(String id, String name, String argumentsJson) {

    public ToolCall {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            argumentsJson = "{}";
        }
    }
}

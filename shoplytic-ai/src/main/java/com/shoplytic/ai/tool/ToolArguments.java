package com.shoplytic.ai.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.exception.AgentProtocolException;
import com.shoplytic.ai.model.ToolCall;

/**
 * Binds the JSON arguments of a tool call to a typed argument class.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static <T> T bind(ObjectMapper objectMapper, String agent, ToolCall call, Class<T> type) {
        try {
            return objectMapper.readValue(call.argumentsJson(), type);
        } catch (JsonProcessingException e) {
            throw AgentProtocolException.malformedArguments(agent, call.name(), e);
        }
    }
}

package com.shoplytic.ai.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.shoplytic.ai.exception.AgentProtocolException;
import com.shoplytic.ai.model.ToolCall;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads tool call arguments and checks that a batch of calls has no two
 * calls with the same name and arguments.
 */
final class CallSignatures {

    private CallSignatures() {
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> arguments(ObjectMapper objectMapper, String agent, ToolCall call) {
        Object parsed;
        try {
            parsed = objectMapper.readValue(call.argumentsJson(), Object.class);
        } catch (JsonProcessingException e) {
            throw AgentProtocolException.malformedArguments(agent, call.name(), e);
        }
        if (!(parsed instanceof Map)) {
            throw AgentProtocolException.malformedArguments(agent, call.name(),
                    new IllegalArgumentException("arguments are not a JSON object"));
        }
        return (Map<String, Object>) parsed;
    }

    /**
     * Name plus arguments re-serialized with sorted keys, so that key order
     * does not make two identical calls look different.
     */
    static String signature(ObjectMapper objectMapper, String agent, ToolCall call) {
        Map<String, Object> arguments = arguments(objectMapper, agent, call);
        try {
            return call.name() + ":" + objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw AgentProtocolException.malformedArguments(agent, call.name(), e);
        }
    }

    static void requireDistinct(ObjectMapper objectMapper, String agent, List<ToolCall> calls) {
        Set<String> seen = new HashSet<>();
        for (ToolCall call : calls) {
            if (!seen.add(signature(objectMapper, agent, call))) {
                throw AgentProtocolException.duplicateToolCall(agent, call.name());
            }
        }
    }
}

package com.shoplytic.ai.tool;

import com.shoplytic.ai.model.ToolCall;
import com.shoplytic.ai.model.ToolSpec;

import java.util.List;
import java.util.Map;

/**
 * The tools one handler may call.
 */
public interface ToolRegistry {

    List<ToolSpec> specs();

    /**
     * Runs the call. Business failures and timeouts come back as result text.
     *
     * @throws com.shoplytic.ai.exception.AgentProtocolException when the arguments cannot be read
     */
    ToolExecution execute(ToolCall call, ToolContext context);

    /**
     * Search parameters to echo back to the caller for this call, read from
     * its arguments before it runs. Empty for calls that are not searches.
     */
    default Map<String, Object> searchParameters(ToolCall call, ToolContext context) {
        return Map.of();
    }
}

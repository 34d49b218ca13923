package com.shoplytic.ai.exception;

/**
 * The model broke the tool-calling contract: it proposed the same call twice
 * in one step or sent arguments that are not valid JSON. Aborts the turn.
 */
public class AgentProtocolException extends RuntimeException {

    private final String agent;

    public AgentProtocolException(String agent, String message) {
        super(message);
        this.agent = agent;
    }

    public AgentProtocolException(String agent, String message, Throwable cause) {
        super(message, cause);
        this.agent = agent;
    }

    public String getAgent() {
        return agent;
    }

    public static AgentProtocolException duplicateToolCall(String agent, String toolName) {
        return new AgentProtocolException(agent,
                String.format("%s violated rule: duplicate tool calls with same args: %s", agent, toolName));
    }

    public static AgentProtocolException malformedArguments(String agent, String toolName, Throwable cause) {
        return new AgentProtocolException(agent,
                String.format("%s sent malformed arguments for %s", agent, toolName), cause);
    }
}

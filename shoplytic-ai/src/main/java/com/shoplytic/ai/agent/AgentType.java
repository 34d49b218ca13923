package com.shoplytic.ai.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Handlers the orchestrator can route to, each exposed to the routing model
 * as one function.
 */
public enum AgentType {

    GENERAL_INFO("general_info", "query_general_info",
            "Query the general information agent for company policies, product offerings, refund policies, "
                    + "shipping information, and general company information. Use for: policy questions, FAQ, "
                    + "company info, shipping/return policies.",
            "The user's question about general information",
            false),
    ORDER("order", "query_order_agent",
            "Query the order agent for product search, order creation, order status, and product recommendations. "
                    + "Use for: product search, purchasing, order management, product details.",
            "The user's question or request related to orders",
            true);

    private final String value;
    private final String functionName;
    private final String description;
    private final String queryDescription;
    private final boolean collapsible;

    AgentType(String value, String functionName, String description, String queryDescription, boolean collapsible) {
        this.value = value;
        this.functionName = functionName;
        this.description = description;
        this.queryDescription = queryDescription;
        this.collapsible = collapsible;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String functionName() {
        return functionName;
    }

    public String description() {
        return description;
    }

    public String queryDescription() {
        return queryDescription;
    }

    /**
     * Whether several calls to this handler in one turn are merged into a
     * single call carrying the user's original query.
     */
    public boolean collapsible() {
        return collapsible;
    }

    public static Optional<AgentType> fromFunctionName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.functionName.equals(name))
                .findFirst();
    }
}

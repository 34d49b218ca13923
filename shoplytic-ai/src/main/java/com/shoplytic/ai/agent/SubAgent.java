package com.shoplytic.ai.agent;

import com.shoplytic.ai.model.ChatMessage;

import java.util.List;

/**
 * A handler the orchestrator can route a query to.
 */
public interface SubAgent {

    AgentType type();

    /**
     * @param query         what the handler should answer
     * @param sessionId     session whose cart, shipping details and orders the handler may touch
     * @param history       earlier conversation, oldest first
     * @param minSimilarity retrieval threshold for this turn
     */
    AgentResult invoke(String query, String sessionId, List<ChatMessage> history, double minSimilarity);
}

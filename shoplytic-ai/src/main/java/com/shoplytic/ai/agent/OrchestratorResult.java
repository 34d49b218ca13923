package com.shoplytic.ai.agent;

import com.shoplytic.rag.dto.SearchResult;

import java.util.List;
import java.util.Map;

/**
 * Outcome of routing and answering one query.
 */
public record OrchestratorResult(
        String traceId,
        String response,
        RoutingMode routingMode,
        List<String> agentsUsed,
        List<SearchResult> sources,
        Map<String, Object> searchParameters
) {
}

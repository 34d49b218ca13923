package com.shoplytic.ai.agent;

import com.shoplytic.rag.dto.SearchResult;

import java.util.List;
import java.util.Map;

/**
 * What a handler hands back to the orchestrator.
 *
 * @param response         the handler's answer text
 * @param sources          documents retrieved while answering
 * @param searchParameters arguments of the catalog searches it ran, for echoing to the caller
 */
public record AgentResult(String response, List<SearchResult> sources, Map<String, Object> searchParameters) {

    public AgentResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        searchParameters = searchParameters == null ? Map.of() : searchParameters;
    }
}

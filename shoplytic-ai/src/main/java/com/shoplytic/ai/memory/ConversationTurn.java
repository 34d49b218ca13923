package com.shoplytic.ai.memory;

import com.shoplytic.rag.dto.SearchResult;

import java.util.List;

/**
 * One answered query. Only catalog results are kept as sources.
 */
public record ConversationTurn(String query, String response, List<SearchResult> productSources) {

    public ConversationTurn {
        productSources = productSources == null ? List.of() : List.copyOf(productSources);
    }
}

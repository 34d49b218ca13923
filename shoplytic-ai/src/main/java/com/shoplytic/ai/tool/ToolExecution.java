package com.shoplytic.ai.tool;

import com.shoplytic.rag.dto.SearchResult;

import java.util.List;

/**
 * Result text handed back to the model, plus any retrieved documents the
 * tool used to produce it.
 */
public record ToolExecution(String result, List<SearchResult> sources) {

    public ToolExecution {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static ToolExecution of(String result) {
        return new ToolExecution(result, List.of());
    }
}

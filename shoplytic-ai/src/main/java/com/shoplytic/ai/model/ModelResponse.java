package com.shoplytic.ai.model;

import java.util.List;

public record ModelResponse(String content, List<ToolCall> toolCalls) {

    public ModelResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelResponse text(String content) {
        return new ModelResponse(content, List.of());
    }

    public static ModelResponse calls(List<ToolCall> toolCalls) {
        return new ModelResponse("", toolCalls);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}

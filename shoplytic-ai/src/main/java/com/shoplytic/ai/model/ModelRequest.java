package com.shoplytic.ai.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ModelRequest {

    @Singular
    List<ChatMessage> messages;

    @Singular
    List<ToolSpec> tools;

    @Builder.Default
    ToolChoice toolChoice = ToolChoice.AUTO;

    Integer maxOutputTokens;

    Float temperature;

    /** Asks the provider to answer with a JSON document. */
    boolean jsonResponse;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}

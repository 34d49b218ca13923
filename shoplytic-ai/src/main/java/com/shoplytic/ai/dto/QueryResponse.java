package com.shoplytic.ai.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the query endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    /**
     * Search parameters used by the product search, or {@code {"query": ...}} when none ran.
     */
    private Map<String, Object> input;

    private String answer;

    @JsonProperty("agents_used")
    private List<String> agentsUsed;

    @JsonProperty("routing_mode")
    private String routingMode;

    private List<SourceDTO> sources;

    @JsonProperty("session_id")
    private String sessionId;
}

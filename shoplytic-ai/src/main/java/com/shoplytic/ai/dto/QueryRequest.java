package com.shoplytic.ai.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the query endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank(message = "Please enter a question.")
    private String query;

    /**
     * Minimum similarity for retrieved documents; the configured default when absent.
     */
    @JsonProperty("min_similarity")
    @DecimalMin(value = "0.0", message = "min_similarity must be between 0 and 1.")
    @DecimalMax(value = "1.0", message = "min_similarity must be between 0 and 1.")
    private Double minSimilarity;
}

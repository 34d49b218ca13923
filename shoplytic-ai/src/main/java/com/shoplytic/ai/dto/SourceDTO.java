package com.shoplytic.ai.dto;

import com.shoplytic.rag.dto.SearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDTO {

    private String content;
    private Map<String, Object> metadata;
    private double similarity;

    public static SourceDTO fromResult(SearchResult result) {
        return SourceDTO.builder()
                .content(result.getContent())
                .metadata(result.getMetadata() == null ? Map.of() : result.getMetadata())
                .similarity(result.getSimilarity())
                .build();
    }
}

package com.shoplytic.rag.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A retrieved document that passed the similarity threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    public static final String PRODUCT_ID = "product_id";

    private String id;

    private String content;

    private Map<String, Object> metadata;

    /** 1 - distance; higher is more similar */
    private double similarity;

    public Object metadataValue(String key) {
        return metadata == null ? null : metadata.get(key);
    }

    public boolean isProduct() {
        return metadataValue(PRODUCT_ID) != null;
    }
}

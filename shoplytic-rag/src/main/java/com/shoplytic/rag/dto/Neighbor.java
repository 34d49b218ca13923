package com.shoplytic.rag.dto;

import java.util.Map;

/**
 * A raw hit from the vector store. Lower distance means closer.
 */
public record Neighbor(String id, String content, Map<String, Object> metadata, double distance) {
}

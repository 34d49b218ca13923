package com.shoplytic.rag.service;

import com.shoplytic.rag.dto.SearchResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Text renderings of retrieval results as handed to the model.
 */
public final class SearchResultFormatter {

    public static final String NO_HANDBOOK_RESULTS = "No relevant information found.";
    public static final String NO_PRODUCT_RESULTS = "No products found matching your criteria.";

    private SearchResultFormatter() {
    }

    public static String handbook(List<SearchResult> results) {
        if (results.isEmpty()) {
            return NO_HANDBOOK_RESULTS;
        }
        return results.stream()
                .map(result -> "Source: " + value(result, "handbook_name", "Handbook") + "\n"
                        + "Section: " + value(result, "Header 1", "") + " " + value(result, "Header 2", "") + "\n"
                        + "Content: " + result.getContent())
                .collect(Collectors.joining("\n\n"));
    }

    public static String products(List<SearchResult> results) {
        if (results.isEmpty()) {
            return NO_PRODUCT_RESULTS;
        }
        return results.stream()
                .map(result -> productHeader(result) + "\nContent: " + result.getContent())
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * Identifier, brand, category and price of a catalog result, without its text.
     */
    public static String productHeader(SearchResult result) {
        return "Product ID: " + value(result, SearchResult.PRODUCT_ID, "N/A") + "\n"
                + "Brand: " + value(result, RetrievalService.BRAND, "N/A") + "\n"
                + "Category: " + value(result, RetrievalService.CATEGORY, "N/A") + "\n"
                + "Price: $" + value(result, RetrievalService.PRICE, "N/A");
    }

    private static String value(SearchResult result, String key, String fallback) {
        Object value = result.metadataValue(key);
        return value == null ? fallback : value.toString();
    }
}

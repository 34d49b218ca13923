package com.shoplytic.rag.service;

import com.shoplytic.rag.dto.Neighbor;
import com.shoplytic.rag.dto.SearchResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts distance-ranked neighbors into similarity-scored results.
 * <p>
 * Similarity is {@code 1 - distance}. Neighbors below the threshold are
 * dropped, input order is kept, and at most {@code k} results are returned.
 */
public final class SimilarityFilter {

    private SimilarityFilter() {
    }

    public static List<SearchResult> filter(List<Neighbor> ranked, double minSimilarity, int k) {
        List<SearchResult> accepted = new ArrayList<>();
        if (k <= 0) {
            return accepted;
        }
        for (Neighbor neighbor : ranked) {
            double similarity = 1.0 - neighbor.distance();
            if (similarity < minSimilarity) {
                continue;
            }
            accepted.add(SearchResult.builder()
                    .id(neighbor.id())
                    .content(neighbor.content())
                    .metadata(neighbor.metadata())
                    .similarity(similarity)
                    .build());
            if (accepted.size() >= k) {
                break;
            }
        }
        return accepted;
    }
}

package com.shoplytic.rag.service;

import com.shoplytic.rag.dto.Neighbor;
import com.shoplytic.rag.dto.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityFilterTest {

    private static Neighbor neighbor(String id, double distance) {
        return new Neighbor(id, "text " + id, Map.of(), distance);
    }

    @Test
    @DisplayName("Keeps order, drops items below threshold and converts distance to similarity")
    void filtersAndConverts() {
        List<SearchResult> results = SimilarityFilter.filter(
                List.of(neighbor("a", 0.1), neighbor("b", 0.5), neighbor("c", 0.2)), 0.7, 5);

        assertThat(results).extracting(SearchResult::getId).containsExactly("a", "c");
        assertThat(results.get(0).getSimilarity()).isCloseTo(0.9, within(1e-9));
        assertThat(results).allSatisfy(r -> assertThat(r.getSimilarity()).isGreaterThanOrEqualTo(0.7));
    }

    @Test
    void stopsAtK() {
        List<SearchResult> results = SimilarityFilter.filter(
                List.of(neighbor("a", 0.0), neighbor("b", 0.05), neighbor("c", 0.1)), 0.5, 2);

        assertThat(results).extracting(SearchResult::getId).containsExactly("a", "b");
    }

    @Test
    void thresholdIsInclusive() {
        assertThat(SimilarityFilter.filter(List.of(neighbor("a", 0.25)), 0.75, 3)).hasSize(1);
        assertThat(SimilarityFilter.filter(List.of(neighbor("a", 0.25)), 0.76, 3)).isEmpty();
    }

    @Test
    void emptyInputOrZeroK() {
        assertThat(SimilarityFilter.filter(List.of(), 0.0, 3)).isEmpty();
        assertThat(SimilarityFilter.filter(List.of(neighbor("a", 0.0)), 0.0, 0)).isEmpty();
    }
}

package com.shoplytic.rag.service;

import com.shoplytic.rag.config.VectorCollection;
import com.shoplytic.rag.dto.Neighbor;
import com.shoplytic.rag.dto.ProductSearchCriteria;
import com.shoplytic.rag.dto.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handbook retrieval and catalog search on top of the vector store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalService {

    static final String CATEGORY = "category";
    static final String BRAND = "brand";
    static final String FEATURED = "is_featured";
    static final String PRICE = "price";

    private final VectorSearchService vectorSearchService;

    public List<SearchResult> retrieveHandbook(String query, int k, double minSimilarity) {
        List<Neighbor> neighbors = vectorSearchService.findNeighbors(VectorCollection.HANDBOOK, query, k, Map.of());
        List<SearchResult> results = SimilarityFilter.filter(neighbors, minSimilarity, k);
        log.debug("Handbook retrieval: query='{}', candidates={}, kept={}", query, neighbors.size(), results.size());
        return results;
    }

    /**
     * Category, brand and featured flag are applied by the store. Price bounds
     * are applied afterwards, so three times as many candidates are requested
     * when a price bound is present. A result without a price is dropped only
     * when a minimum price is set; a price that cannot be parsed is kept.
     */
    public List<SearchResult> searchProducts(ProductSearchCriteria criteria, double minSimilarity) {
        Map<String, String> filters = new LinkedHashMap<>();
        if (criteria.getCategory() != null) {
            filters.put(CATEGORY, criteria.getCategory());
        }
        if (criteria.getBrand() != null) {
            filters.put(BRAND, criteria.getBrand());
        }
        if (criteria.getFeatured() != null) {
            filters.put(FEATURED, criteria.getFeatured().toString());
        }

        int k = criteria.getK();
        int fetchK = criteria.hasPriceFilter() ? k * 3 : k;

        List<Neighbor> neighbors = vectorSearchService.findNeighbors(
                VectorCollection.PRODUCTS, criteria.getQuery(), fetchK, filters);
        List<SearchResult> results = SimilarityFilter.filter(neighbors, minSimilarity, fetchK);

        if (criteria.hasPriceFilter()) {
            results = results.stream()
                    .filter(result -> withinPriceRange(result, criteria.getMinPrice(), criteria.getMaxPrice()))
                    .limit(k)
                    .toList();
        }

        log.info("Product search: query='{}', filters={}, minPrice={}, maxPrice={}, candidates={}, returned={}",
                criteria.getQuery(), filters, criteria.getMinPrice(), criteria.getMaxPrice(),
                neighbors.size(), results.size());
        return results;
    }

    static boolean withinPriceRange(SearchResult result, Double minPrice, Double maxPrice) {
        Object raw = result.metadataValue(PRICE);
        if (raw == null) {
            return minPrice == null;
        }
        double price;
        try {
            price = raw instanceof Number number ? number.doubleValue() : Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            return true;
        }
        if (minPrice != null && price < minPrice) {
            return false;
        }
        return maxPrice == null || price <= maxPrice;
    }
}

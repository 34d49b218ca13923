package com.shoplytic.rag.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSearchCriteria {

    private String query;

    @Builder.Default
    private int k = 3;

    private String category;
    private String brand;
    private Double minPrice;
    private Double maxPrice;
    private Boolean featured;

    public boolean hasPriceFilter() {
        return minPrice != null || maxPrice != null;
    }
}

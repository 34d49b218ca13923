package com.shoplytic.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Filters of the catalog listing. Null fields are not applied; {@code active}
 * defaults to true so inactive products stay hidden unless asked for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductFilter {

    private String search;
    private String category;
    private String brand;
    private BigDecimal minPrice;
    private BigDecimal maxPrice;

    /** Comma-separated; a product matches when it carries at least one. */
    private String tags;

    private Boolean featured;

    @Builder.Default
    private Boolean active = true;

    public List<String> tagList() {
        if (tags == null) {
            return List.of();
        }
        return Arrays.stream(tags.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .map(String::toLowerCase)
                .toList();
    }
}

package com.shoplytic.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {

    private List<ProductDTO> products;
    private long total;

    /** 1-based. */
    private int page;

    @JsonProperty("page_size")
    private int pageSize;
}

package com.shoplytic.product.controller;

import com.shoplytic.product.dto.ProductFilter;
import com.shoplytic.product.dto.ProductListResponse;
import com.shoplytic.product.service.ProductService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequestMapping("/user/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    /**
     * Searches the catalog by name, description or SKU and filters it.
     * Only active products are listed unless {@code is_active} says otherwise.
     */
    @GetMapping
    public ResponseEntity<ProductListResponse> getProducts(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String brand,
            @RequestParam(name = "min_price", required = false) BigDecimal minPrice,
            @RequestParam(name = "max_price", required = false) BigDecimal maxPrice,
            @RequestParam(required = false) String tags,
            @RequestParam(name = "is_featured", required = false) Boolean featured,
            @RequestParam(name = "is_active", required = false, defaultValue = "true") Boolean active,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
        ProductFilter filter = ProductFilter.builder()
                .search(search)
                .category(category)
                .brand(brand)
                .minPrice(minPrice)
                .maxPrice(maxPrice)
                .tags(tags)
                .featured(featured)
                .active(active)
                .build();
        return ResponseEntity.ok(productService.listProducts(filter, page, pageSize));
    }
}

package com.shoplytic.product.dto;

import com.shoplytic.product.entity.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDTO {

    private Long id;
    private String sku;
    private String name;
    private String description;
    private BigDecimal price;
    private Integer stockQuantity;
    private String category;
    private String brand;
    private String primaryImage;
    private Boolean active;
    private Boolean featured;
    private List<String> tags;
    private LocalDateTime createdAt;

    public static ProductDTO fromEntity(Product product) {
        return ProductDTO.builder()
                .id(product.getId())
                .sku(product.getSku())
                .name(product.getName())
                .description(product.getDescription())
                .price(product.getPrice())
                .stockQuantity(product.getStockQuantity())
                .category(product.getCategory())
                .brand(product.getBrand())
                .primaryImage(product.getPrimaryImage())
                .active(product.getActive())
                .featured(product.getFeatured())
                .tags(product.getTags() == null ? List.of() : new ArrayList<>(product.getTags()))
                .createdAt(product.getCreatedAt())
                .build();
    }

    public boolean isPurchasable() {
        return Boolean.TRUE.equals(active);
    }
}

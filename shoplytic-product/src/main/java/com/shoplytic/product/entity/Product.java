package com.shoplytic.product.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Catalog product. The catalog is maintained elsewhere; this service only
 * reads it, so the mapping is immutable.
 */
@Entity
@Immutable
@Table(name = "products", indexes = {
    @Index(name = "idx_product_sku", columnList = "sku"),
    @Index(name = "idx_product_category", columnList = "category"),
    @Index(name = "idx_product_brand", columnList = "brand")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"description"})
@EqualsAndHashCode(of = "id")
public class Product {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(unique = true, length = 100)
    private String sku;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "stock_quantity", nullable = false)
    @Builder.Default
    private Integer stockQuantity = 0;

    @Column(length = 100)
    private String category;

    @Column(length = 100)
    private String brand;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(name = "primary_image", length = 500)
    private String primaryImage;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "is_featured", nullable = false)
    @Builder.Default
    private Boolean featured = false;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Case-insensitive match against any of the given lower-case tags.
     */
    public boolean hasAnyTag(List<String> wanted) {
        if (tags == null) {
            return false;
        }
        return tags.stream()
                .filter(Objects::nonNull)
                .map(String::toLowerCase)
                .anyMatch(wanted::contains);
    }

    public boolean hasStockFor(int quantity) {
        return stockQuantity != null && stockQuantity >= quantity;
    }
}

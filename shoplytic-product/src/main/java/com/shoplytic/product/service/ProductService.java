package com.shoplytic.product.service;

import com.shoplytic.product.dto.ProductDTO;
import com.shoplytic.product.dto.ProductFilter;
import com.shoplytic.product.dto.ProductListResponse;
import com.shoplytic.product.entity.Product;
import com.shoplytic.product.exception.ProductException;
import com.shoplytic.product.repository.ProductRepository;
import com.shoplytic.product.repository.ProductSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductService {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by("id"));

    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    public Optional<ProductDTO> findProduct(Long id) {
        if (id == null) {
            log.debug("Product lookup without id");
            return Optional.empty();
        }
        return productRepository.findById(id).map(ProductDTO::fromEntity);
    }

    /**
     * Catalog listing, newest first.
     *
     * @param filter   search text and filters; null fields are ignored
     * @param page     1-based page number
     * @param pageSize items per page, at most {@value #MAX_PAGE_SIZE}
     */
    @Transactional(readOnly = true)
    public ProductListResponse listProducts(ProductFilter filter, int page, int pageSize) {
        validate(filter, page, pageSize);
        Specification<Product> criteria = ProductSpecifications.matching(filter);
        List<String> tags = filter.tagList();

        log.debug("Listing products: filter={}, page={}, pageSize={}", filter, page, pageSize);

        List<ProductDTO> products;
        long total;
        if (tags.isEmpty()) {
            Page<Product> result = productRepository.findAll(criteria, PageRequest.of(page - 1, pageSize, NEWEST_FIRST));
            products = result.map(ProductDTO::fromEntity).getContent();
            total = result.getTotalElements();
        } else {
            // Tags sit in a JSON column, so they are matched after the query and paged here.
            List<Product> tagged = productRepository.findAll(criteria, NEWEST_FIRST).stream()
                    .filter(product -> product.hasAnyTag(tags))
                    .toList();
            total = tagged.size();
            products = tagged.stream()
                    .skip((long) (page - 1) * pageSize)
                    .limit(pageSize)
                    .map(ProductDTO::fromEntity)
                    .toList();
        }

        return ProductListResponse.builder()
                .products(products)
                .total(total)
                .page(page)
                .pageSize(pageSize)
                .build();
    }

    private static void validate(ProductFilter filter, int page, int pageSize) {
        if (page < 1) {
            throw ProductException.invalidPage(page);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw ProductException.invalidPageSize(pageSize, MAX_PAGE_SIZE);
        }
        BigDecimal min = filter.getMinPrice();
        BigDecimal max = filter.getMaxPrice();
        if ((min != null && min.signum() < 0) || (max != null && max.signum() < 0)) {
            throw ProductException.negativePrice();
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw ProductException.invalidPriceRange();
        }
    }
}

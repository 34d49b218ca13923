package com.shoplytic.product.exception;

import org.springframework.http.HttpStatus;

public class ProductException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ProductException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static ProductException invalidPriceRange() {
        return new ProductException(
                "Minimum price cannot exceed maximum price.",
                HttpStatus.BAD_REQUEST,
                "INVALID_PRICE_RANGE"
        );
    }

    public static ProductException negativePrice() {
        return new ProductException(
                "Price filters cannot be negative.",
                HttpStatus.BAD_REQUEST,
                "INVALID_PRICE"
        );
    }

    public static ProductException invalidPage(int page) {
        return new ProductException(
                String.format("Page %d does not exist. Pages start at 1.", page),
                HttpStatus.BAD_REQUEST,
                "INVALID_PAGE"
        );
    }

    public static ProductException invalidPageSize(int pageSize, int max) {
        return new ProductException(
                String.format("Page size %d is not allowed. Choose between 1 and %d.", pageSize, max),
                HttpStatus.BAD_REQUEST,
                "INVALID_PAGE_SIZE"
        );
    }
}

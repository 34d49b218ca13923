package com.shoplytic.order.exception;

import org.springframework.http.HttpStatus;

import java.math.BigDecimal;

public class OrderException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public OrderException(String message, HttpStatus status, String errorCode) {
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

    // Cart-related exceptions
    public static OrderException emptyCart() {
        return new OrderException(
                "Your cart is empty. Please add items to your cart before purchasing.",
                HttpStatus.BAD_REQUEST,
                "EMPTY_CART"
        );
    }

    public static OrderException itemAlreadyInCart(String productName) {
        return new OrderException(
                String.format("%s is already in your cart. Use edit_item_in_cart to update the quantity.", productName),
                HttpStatus.CONFLICT,
                "ITEM_ALREADY_IN_CART"
        );
    }

    public static OrderException productNotInCart(Long productId) {
        return new OrderException(
                String.format("Product with ID %d not found in cart.", productId),
                HttpStatus.NOT_FOUND,
                "PRODUCT_NOT_IN_CART"
        );
    }

    public static OrderException invalidQuantity() {
        return new OrderException(
                "Quantity must be greater than 0. Use remove_from_cart to remove items.",
                HttpStatus.BAD_REQUEST,
                "INVALID_QUANTITY"
        );
    }

    // Product-related exceptions (within order context)
    public static OrderException productIdRequired() {
        return new OrderException(
                "Please specify the product_id of the item.",
                HttpStatus.BAD_REQUEST,
                "PRODUCT_ID_REQUIRED"
        );
    }

    public static OrderException productNotFound(Long productId) {
        return new OrderException(
                String.format("Product with ID %d not found.", productId),
                HttpStatus.NOT_FOUND,
                "PRODUCT_NOT_FOUND"
        );
    }

    public static OrderException productNotAvailable(String productName) {
        return new OrderException(
                String.format("Product '%s' is not available for purchase.", productName),
                HttpStatus.BAD_REQUEST,
                "PRODUCT_NOT_AVAILABLE"
        );
    }

    public static OrderException insufficientStock(String productName, int available) {
        return new OrderException(
                String.format("Insufficient stock. Only %d available for '%s'.", available, productName),
                HttpStatus.BAD_REQUEST,
                "INSUFFICIENT_STOCK"
        );
    }

    // Shipping-related exceptions
    public static OrderException shippingInfoRequired() {
        return new OrderException(
                "Please provide shipping information before purchasing. "
                        + "Use create_shipping_info or provide your shipping details.",
                HttpStatus.BAD_REQUEST,
                "SHIPPING_INFO_REQUIRED"
        );
    }

    public static OrderException shippingInfoNotFound() {
        return new OrderException(
                "No shipping information found to update. Please create shipping information first.",
                HttpStatus.NOT_FOUND,
                "SHIPPING_INFO_NOT_FOUND"
        );
    }

    public static OrderException invalidShippingInfo(String detail) {
        return new OrderException(detail, HttpStatus.BAD_REQUEST, "INVALID_SHIPPING_INFO");
    }

    // Voucher-related exceptions
    public static OrderException voucherRequired() {
        return new OrderException(
                "Please provide a voucher code to complete your purchase.",
                HttpStatus.BAD_REQUEST,
                "VOUCHER_REQUIRED"
        );
    }

    public static OrderException voucherNotFound(String code) {
        return new OrderException(
                String.format("Invalid voucher code '%s'. Please check and try again.", code),
                HttpStatus.NOT_FOUND,
                "VOUCHER_NOT_FOUND"
        );
    }

    public static OrderException voucherExpired(String code) {
        return new OrderException(
                String.format("Voucher '%s' has expired.", code),
                HttpStatus.BAD_REQUEST,
                "VOUCHER_EXPIRED"
        );
    }

    /**
     * The voucher is marked consumed but no order references it.
     */
    public static OrderException voucherStateInconsistent(String code) {
        return new OrderException(
                String.format("Voucher '%s' is marked as used but no matching order exists. "
                        + "Please contact support.", code),
                HttpStatus.CONFLICT,
                "VOUCHER_STATE_INCONSISTENT"
        );
    }

    public static OrderException insufficientVoucherBalance(BigDecimal cartTotal, BigDecimal voucherAmount) {
        BigDecimal shortfall = cartTotal.subtract(voucherAmount);
        return new OrderException(
                String.format("Insufficient voucher balance. Your cart total is $%.2f, but your voucher is worth $%.2f "
                                + "($%.2f short). Please remove some items or use a voucher with sufficient balance.",
                        cartTotal, voucherAmount, shortfall),
                HttpStatus.BAD_REQUEST,
                "INSUFFICIENT_VOUCHER_BALANCE"
        );
    }

    // Order-related exceptions
    public static OrderException orderNotFound(Long orderId) {
        return new OrderException(
                String.format("Order with ID %d not found.", orderId),
                HttpStatus.NOT_FOUND,
                "ORDER_NOT_FOUND"
        );
    }
}

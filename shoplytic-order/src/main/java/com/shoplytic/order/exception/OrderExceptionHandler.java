package com.shoplytic.order.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Error bodies for the cart, order and voucher endpoints:
 * {@code timestamp}, {@code status}, {@code error} (shown to the shopper) and {@code errorCode}.
 */
@RestControllerAdvice(basePackages = "com.shoplytic.order")
@Slf4j
public class OrderExceptionHandler {

    @ExceptionHandler(OrderException.class)
    public ResponseEntity<Map<String, Object>> handleOrderException(OrderException ex) {
        log.warn("Order request rejected: {} [{}]", ex.getMessage(), ex.getErrorCode());
        return error(ex.getStatus(), ex.getMessage(), ex.getErrorCode());
    }

    /**
     * Two requests of the same session raced on a unique row, e.g. voucher issuing.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(DataIntegrityViolationException ex) {
        log.warn("Conflicting write in order domain: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.CONFLICT,
                "Your request overlapped with another one. Please try again.",
                "CONCURRENT_UPDATE");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String errorCode) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("status", status.value());
        body.put("error", message);
        body.put("errorCode", errorCode);
        return ResponseEntity.status(status).body(body);
    }
}

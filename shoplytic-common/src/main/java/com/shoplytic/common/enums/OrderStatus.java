package com.shoplytic.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Voucher purchases are settled in a single transaction, so a stored order
 * is always {@code COMPLETED}; a failed attempt leaves no row behind.
 */
public enum OrderStatus {
    COMPLETED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}

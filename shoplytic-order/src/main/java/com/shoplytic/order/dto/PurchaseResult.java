package com.shoplytic.order.dto;

import java.math.BigDecimal;

/**
 * Outcome of a purchase call. {@code alreadyPlaced} marks an idempotent replay
 * of a purchase that was committed earlier with the same voucher.
 */
public record PurchaseResult(
        OrderDTO order,
        boolean alreadyPlaced,
        BigDecimal remainingVoucherBalance,
        ShippingInfoDTO shipping
) {

    public static PurchaseResult placed(OrderDTO order, BigDecimal remaining, ShippingInfoDTO shipping) {
        return new PurchaseResult(order, false, remaining, shipping);
    }

    public static PurchaseResult replay(OrderDTO order) {
        return new PurchaseResult(order, true, null, null);
    }
}

package com.shoplytic.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Money {

    private Money() {
    }

    public static BigDecimal scale(BigDecimal amount) {
        return (amount == null ? BigDecimal.ZERO : amount).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Formats an amount as {@code $1234.50}.
     */
    public static String format(BigDecimal amount) {
        return "$" + scale(amount).toPlainString();
    }
}

package org.nowstart.copytrade.data.dto;

import java.math.BigDecimal;

public record OrderResult(
        boolean success,
        String orderId,
        String message,
        BigDecimal executedPrice,
        BigDecimal executedQuantity,
        Integer executedLeverage
) {

    public static OrderResult filled(String orderId, BigDecimal price, BigDecimal quantity, Integer leverage) {
        return new OrderResult(true, orderId, "Order placed successfully", price, quantity, leverage);
    }

    public static OrderResult rejected(String message) {
        return new OrderResult(false, null, message, null, null, null);
    }
}

package org.nowstart.copytrade.data.dto;

import java.math.BigDecimal;
import org.nowstart.copytrade.data.type.TradeSide;

public record OrderSpec(
        String pair,
        TradeSide side,
        BigDecimal quantity,
        int leverage,
        BigDecimal price,
        BigDecimal stopLossPrice,
        BigDecimal takeProfitPrice,
        String clientOrderId
) {
}

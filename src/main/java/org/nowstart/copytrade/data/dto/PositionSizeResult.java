package org.nowstart.copytrade.data.dto;

import java.math.BigDecimal;
import java.util.List;

public record PositionSizeResult(
        String pair,
        BigDecimal qty,
        int leverage,
        BigDecimal notional,
        BigDecimal requiredMargin,
        InstrumentMeta meta,
        List<String> warnings
) {

    public boolean exceedsMaxLeverage() {
        return meta != null && leverage > meta.maxLeverage();
    }
}

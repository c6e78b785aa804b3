package org.nowstart.copytrade.data.dto;

import java.math.BigDecimal;
import java.util.Locale;

public record InstrumentMeta(
        String pair,
        BigDecimal stepSize,
        BigDecimal minQty,
        BigDecimal minNotional,
        int maxLeverage
) {

    /**
     * Shape the venue returns when it has no real metadata for a USDT pair: integral step, min quantity 1, 1x leverage.
     */
    public boolean looksLikeFallback() {
        if (pair == null || !pair.toUpperCase(Locale.ROOT).contains("USDT")) {
            return false;
        }
        return stepSize != null
                && stepSize.compareTo(BigDecimal.ONE) >= 0
                && minQty != null
                && minQty.compareTo(BigDecimal.ONE) == 0
                && maxLeverage == 1;
    }
}

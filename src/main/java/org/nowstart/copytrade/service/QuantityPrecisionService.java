package org.nowstart.copytrade.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

/**
 * Submission rounding for pairs whose accepted precision differs from their step size. Always rounds down.
 */
@Service
@RefreshScope
@RequiredArgsConstructor
public class QuantityPrecisionService {

    private final CopyTradingProperties copyTradingProperties;

    public BigDecimal apply(String pair, BigDecimal quantity) {
        if (quantity == null) {
            return null;
        }

        String key = normalize(pair);
        boolean wholeOnly = copyTradingProperties.wholeQuantityPairs().stream()
                .anyMatch(candidate -> normalize(candidate).equals(key));
        if (wholeOnly) {
            return quantity.setScale(0, RoundingMode.DOWN);
        }

        Integer decimals = findDecimals(key);
        if (decimals != null && quantity.scale() > decimals) {
            return quantity.setScale(decimals, RoundingMode.DOWN);
        }
        return quantity;
    }

    private Integer findDecimals(String key) {
        for (Map.Entry<String, Integer> entry : copyTradingProperties.quantityDecimals().entrySet()) {
            if (normalize(entry.getKey()).equals(key)) {
                return Math.max(0, entry.getValue());
            }
        }
        return null;
    }

    private String normalize(String pair) {
        if (pair == null) {
            return "";
        }
        String upper = pair.trim().toUpperCase(Locale.ROOT);
        return upper.startsWith("B-") ? upper.substring(2) : upper;
    }
}

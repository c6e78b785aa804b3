package org.nowstart.copytrade.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.data.type.TradeSide;

public record MirrorTradeDto(
        String id,
        String primaryTradeId,
        String followerId,
        String pair,
        TradeSide side,
        BigDecimal requestedPrice,
        BigDecimal requestedQuantity,
        Integer requestedLeverage,
        BigDecimal executedPrice,
        BigDecimal executedQuantity,
        Integer executedLeverage,
        MirrorTradeStatus status,
        String venueOrderId,
        String errorMessage,
        BigDecimal pnl,
        BigDecimal exitPrice,
        Instant executedAt,
        Instant createdAt
) {
}

package org.nowstart.copytrade.data.dto;

import java.math.BigDecimal;

public record MirrorTradeStatsDto(
        long totalTrades,
        long executedTrades,
        long failedTrades,
        long pendingTrades,
        BigDecimal successRate,
        BigDecimal realizedPnl
) {
}

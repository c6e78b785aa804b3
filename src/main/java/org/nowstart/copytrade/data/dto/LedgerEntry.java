package org.nowstart.copytrade.data.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record LedgerEntry(
        String id,
        String parentId,
        String positionId,
        BigDecimal amount,
        String stage,
        Instant createdAt
) {
}

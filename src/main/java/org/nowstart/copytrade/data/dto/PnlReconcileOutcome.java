package org.nowstart.copytrade.data.dto;

import java.math.BigDecimal;
import org.nowstart.copytrade.data.type.PnlReconcileStatus;

public record PnlReconcileOutcome(
        String mirrorTradeId,
        PnlReconcileStatus status,
        BigDecimal pnl,
        BigDecimal exitPrice,
        String message
) {

    public static PnlReconcileOutcome of(String mirrorTradeId, PnlReconcileStatus status, String message) {
        return new PnlReconcileOutcome(mirrorTradeId, status, null, null, message);
    }
}

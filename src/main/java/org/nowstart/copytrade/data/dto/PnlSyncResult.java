package org.nowstart.copytrade.data.dto;

import java.util.List;

public record PnlSyncResult(
        int updated,
        int pending,
        int errors,
        List<PnlReconcileOutcome> details
) {
}

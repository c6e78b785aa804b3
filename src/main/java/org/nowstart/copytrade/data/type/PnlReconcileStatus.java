package org.nowstart.copytrade.data.type;

public enum PnlReconcileStatus {
    UPDATED,
    NOT_SETTLED,
    ALREADY_RECONCILED,
    NOT_ELIGIBLE,
    FAILED
}

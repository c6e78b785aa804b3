package org.nowstart.copytrade.data.type;

public enum MirrorTradeStatus {
    PENDING,
    EXECUTED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

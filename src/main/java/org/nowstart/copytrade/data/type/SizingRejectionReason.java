package org.nowstart.copytrade.data.type;

public enum SizingRejectionReason {
    INVALID_PARAMETERS,
    METADATA_UNAVAILABLE,
    POSITION_TOO_SMALL,
    INSUFFICIENT_FUNDS
}

package org.nowstart.copytrade.data.exception;

import lombok.Getter;
import org.nowstart.copytrade.data.type.SizingRejectionReason;

@Getter
public class PositionSizingException extends RuntimeException {

    private final SizingRejectionReason reason;

    public PositionSizingException(SizingRejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}

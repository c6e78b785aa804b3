package org.nowstart.copytrade.data.exception;

import lombok.Getter;

/**
 * Terminal outcome of a rate-limited, retried venue call. The message is already humanized.
 */
@Getter
public class VenueCallException extends RuntimeException {

    private final boolean retryable;
    private final int attempts;

    public VenueCallException(String message, boolean retryable, int attempts, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.attempts = attempts;
    }
}

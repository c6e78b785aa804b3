package org.nowstart.copytrade.data.exception;

/**
 * Pre-flight or pipeline rejection of a single mirror trade. The message is stored on the record as-is.
 */
public class MirrorExecutionException extends RuntimeException {

    public MirrorExecutionException(String message) {
        super(message);
    }
}

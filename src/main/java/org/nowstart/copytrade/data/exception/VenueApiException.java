package org.nowstart.copytrade.data.exception;

import lombok.Getter;

/**
 * Raw failure reported by the venue. {@code status} is the HTTP status, or {@code -1} when the request never
 * produced a response (connection refused, reset, client-side timeout).
 */
@Getter
public class VenueApiException extends RuntimeException {

    public static final int NO_RESPONSE = -1;

    private final int status;
    private final String venueMessage;

    public VenueApiException(int status, String venueMessage) {
        this(status, venueMessage, null);
    }

    public VenueApiException(int status, String venueMessage, Throwable cause) {
        super(status == NO_RESPONSE ? venueMessage : "HTTP " + status + ": " + venueMessage, cause);
        this.status = status;
        this.venueMessage = venueMessage;
    }

    public static VenueApiException noResponse(String message, Throwable cause) {
        return new VenueApiException(NO_RESPONSE, message, cause);
    }

    public boolean hasResponse() {
        return status != NO_RESPONSE;
    }
}

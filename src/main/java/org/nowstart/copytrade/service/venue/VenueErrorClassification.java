package org.nowstart.copytrade.service.venue;

public record VenueErrorClassification(
        boolean retryable,
        String message
) {
}

package org.nowstart.copytrade.service.venue;

import feign.FeignException;
import feign.RetryableException;
import java.io.IOException;
import java.util.Locale;
import org.nowstart.copytrade.data.exception.VenueApiException;
import org.springframework.stereotype.Component;

@Component
public class VenueErrorClassifier {

    public boolean isRetryable(Throwable error) {
        return classify(error).retryable();
    }

    public VenueErrorClassification classify(Throwable error) {
        VenueApiException venueError = findCause(error, VenueApiException.class);
        if (venueError != null) {
            if (!venueError.hasResponse()) {
                return new VenueErrorClassification(true, "Connection failed: " + describe(venueError.getVenueMessage(), venueError));
            }
            return classifyStatus(venueError.getStatus(), venueError.getVenueMessage());
        }

        FeignException feignError = findCause(error, FeignException.class);
        if (feignError != null) {
            if (feignError instanceof RetryableException || feignError.status() < 0) {
                return new VenueErrorClassification(true, "Connection failed: " + describe(feignError.getMessage(), feignError));
            }
            return classifyStatus(feignError.status(), feignError.contentUTF8());
        }

        if (findCause(error, IOException.class) != null) {
            return new VenueErrorClassification(true, "Connection failed: " + describe(error.getMessage(), error));
        }

        return new VenueErrorClassification(false, describe(error.getMessage(), error));
    }

    private VenueErrorClassification classifyStatus(int status, String venueMessage) {
        String message = venueMessage == null || venueMessage.isBlank() ? "no message" : venueMessage;

        if (status >= 500) {
            return new VenueErrorClassification(true, "Exchange unavailable (HTTP " + status + "): " + message);
        }
        if (status == 429) {
            return new VenueErrorClassification(true, "Rate limit exceeded");
        }
        if (status == 401) {
            return new VenueErrorClassification(false, "Invalid API credentials");
        }
        if (status == 403) {
            return new VenueErrorClassification(false, "API access forbidden - check trading permissions");
        }
        if (status == 400) {
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("timeout") || lower.contains("temporary")) {
                return new VenueErrorClassification(true, "Bad request: " + message);
            }
            return new VenueErrorClassification(false, humanizeBadRequest(lower, message));
        }
        return new VenueErrorClassification(false, "Order rejected (HTTP " + status + "): " + message);
    }

    private String humanizeBadRequest(String lower, String message) {
        if (lower.contains("insufficient") || lower.contains("balance") || lower.contains("margin")) {
            return "Insufficient balance or margin: " + message;
        }
        if (lower.contains("quantity") || lower.contains("qty")) {
            return "Invalid quantity: " + message;
        }
        if (lower.contains("price")) {
            return "Invalid price: " + message;
        }
        if (lower.contains("leverage")) {
            return "Invalid leverage: " + message;
        }
        return "Bad request: " + message;
    }

    private String describe(String message, Throwable error) {
        if (message != null && !message.isBlank()) {
            return message;
        }
        return error.getClass().getSimpleName();
    }

    private <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
            depth++;
        }
        return null;
    }
}

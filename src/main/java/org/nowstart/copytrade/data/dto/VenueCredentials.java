package org.nowstart.copytrade.data.dto;

public record VenueCredentials(
        String apiKey,
        String apiSecret
) {

    @Override
    public String toString() {
        return "VenueCredentials[apiKey=" + mask(apiKey) + ", apiSecret=***]";
    }

    private static String mask(String value) {
        if (value == null || value.length() <= 4) {
            return "***";
        }
        return value.substring(0, 4) + "***";
    }
}

package org.nowstart.copytrade.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoinDcxInstrumentResponse(
        CoinDcxInstrument instrument
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CoinDcxInstrument(
            String pair,
            String status,
            String quantity_increment,
            String min_quantity,
            String min_notional,
            String max_leverage_long,
            String max_leverage_short
    ) {
    }
}

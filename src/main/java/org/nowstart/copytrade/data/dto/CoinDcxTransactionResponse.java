package org.nowstart.copytrade.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoinDcxTransactionResponse(
        String id,
        String pair,
        String parent_id,
        String position_id,
        String amount,
        String stage,
        String currency_short_name,
        Long created_at
) {
}

package org.nowstart.copytrade.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoinDcxWalletResponse(
        String id,
        String currency_short_name,
        String balance,
        String locked_balance,
        String cross_order_margin,
        String cross_user_margin
) {
}

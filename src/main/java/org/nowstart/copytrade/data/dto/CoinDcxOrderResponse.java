package org.nowstart.copytrade.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoinDcxOrderResponse(
        String id,
        String pair,
        String side,
        String status,
        String order_type,
        String price,
        String avg_price,
        String total_quantity,
        String leverage,
        String client_order_id,
        Long created_at
) {
}

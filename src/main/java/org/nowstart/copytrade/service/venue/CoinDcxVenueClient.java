package org.nowstart.copytrade.service.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.dto.CoinDcxInstrumentResponse;
import org.nowstart.copytrade.data.dto.CoinDcxOrderResponse;
import org.nowstart.copytrade.data.dto.CoinDcxTransactionResponse;
import org.nowstart.copytrade.data.dto.CoinDcxWalletResponse;
import org.nowstart.copytrade.data.dto.InstrumentMeta;
import org.nowstart.copytrade.data.dto.LedgerEntry;
import org.nowstart.copytrade.data.dto.OrderResult;
import org.nowstart.copytrade.data.dto.OrderSpec;
import org.nowstart.copytrade.data.dto.VenueCredentials;
import org.nowstart.copytrade.data.exception.VenueApiException;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.nowstart.copytrade.repository.CoinDcxFeignClient;
import org.nowstart.copytrade.service.auth.CoinDcxRequestSigner;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RefreshScope
@RequiredArgsConstructor
public class CoinDcxVenueClient implements VenueClient {

    static final String FUTURES_PAIR_PREFIX = "B-";
    // HTML 오류 페이지 등 긴 응답 본문 상한
    static final int MAX_ERROR_TEXT_LENGTH = 300;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final CoinDcxFeignClient coinDcxFeignClient;
    private final CoinDcxRequestSigner coinDcxRequestSigner;
    private final CopyTradingProperties copyTradingProperties;

    @Override
    public InstrumentMeta getInstrumentMeta(String pair) {
        CoinDcxInstrumentResponse response = call(() -> coinDcxFeignClient.getInstrument(
                toFuturesPair(pair),
                copyTradingProperties.marginCurrency()
        ));
        if (response == null || response.instrument() == null) {
            throw new VenueApiException(404, "Instrument not found: " + pair);
        }

        CoinDcxInstrumentResponse.CoinDcxInstrument instrument = response.instrument();
        return new InstrumentMeta(
                pair,
                parseDecimal(instrument.quantity_increment()),
                parseDecimal(instrument.min_quantity()),
                parseDecimal(instrument.min_notional()),
                parseDecimal(instrument.max_leverage_long()).intValue()
        );
    }

    @Override
    public OrderResult createOrder(VenueCredentials credentials, OrderSpec orderSpec) {
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("side", orderSpec.side().venueValue());
        order.put("pair", toFuturesPair(orderSpec.pair()));
        order.put("order_type", "limit_order");
        order.put("price", orderSpec.price().toPlainString());
        order.put("total_quantity", orderSpec.quantity().toPlainString());
        order.put("leverage", orderSpec.leverage());
        order.put("notification", "email_notification");
        order.put("time_in_force", "good_till_cancel");
        order.put("hidden", false);
        order.put("post_only", false);
        if (orderSpec.stopLossPrice() != null) {
            order.put("stop_loss_price", orderSpec.stopLossPrice().toPlainString());
        }
        if (orderSpec.takeProfitPrice() != null) {
            order.put("take_profit_price", orderSpec.takeProfitPrice().toPlainString());
        }
        if (orderSpec.clientOrderId() != null) {
            order.put("client_order_id", orderSpec.clientOrderId());
        }

        String body = coinDcxRequestSigner.body(Map.of("order", order));
        String signature = coinDcxRequestSigner.sign(body, credentials.apiSecret());
        List<CoinDcxOrderResponse> created = call(() -> coinDcxFeignClient.createOrder(credentials.apiKey(), signature, body));

        if (created == null || created.isEmpty()) {
            return new OrderResult(true, null, "Order response was empty", null, null, null);
        }

        CoinDcxOrderResponse response = created.get(0);
        BigDecimal avgPrice = parseDecimal(response.avg_price());
        BigDecimal executedPrice = avgPrice.signum() > 0 ? avgPrice : orElse(parseDecimal(response.price()), orderSpec.price());
        BigDecimal executedQuantity = orElse(parseDecimal(response.total_quantity()), orderSpec.quantity());
        int leverage = parseDecimal(response.leverage()).intValue();

        return OrderResult.filled(
                response.id(),
                executedPrice,
                executedQuantity,
                leverage > 0 ? leverage : orderSpec.leverage()
        );
    }

    @Override
    public List<LedgerEntry> getTransactions(VenueCredentials credentials, String orderId) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("order_id", orderId);
        fields.put("stage", "all");
        fields.put("page", "1");
        fields.put("size", "100");

        String body = coinDcxRequestSigner.body(fields);
        String signature = coinDcxRequestSigner.sign(body, credentials.apiSecret());
        List<CoinDcxTransactionResponse> rows = call(() -> coinDcxFeignClient.getTransactions(credentials.apiKey(), signature, body));
        if (rows == null) {
            return List.of();
        }

        return rows.stream()
                .map(row -> new LedgerEntry(
                        row.id(),
                        row.parent_id(),
                        row.position_id(),
                        parseDecimal(row.amount()),
                        row.stage(),
                        row.created_at() == null ? null : Instant.ofEpochMilli(row.created_at())
                ))
                .toList();
    }

    @Override
    public BigDecimal getWalletBalance(VenueCredentials credentials, String currency) {
        String body = coinDcxRequestSigner.body(Map.of());
        String signature = coinDcxRequestSigner.sign(body, credentials.apiSecret());
        List<CoinDcxWalletResponse> wallets = call(() -> coinDcxFeignClient.getWallets(credentials.apiKey(), signature, body));
        if (wallets == null) {
            return BigDecimal.ZERO;
        }

        return wallets.stream()
                .filter(wallet -> currency.equalsIgnoreCase(wallet.currency_short_name()))
                .findFirst()
                .map(wallet -> parseDecimal(wallet.balance()))
                .orElseGet(() -> {
                    log.info("No futures wallet found for currency. currency={}", currency);
                    return BigDecimal.ZERO;
                });
    }

    static String toFuturesPair(String pair) {
        return pair.startsWith(FUTURES_PAIR_PREFIX) ? pair : FUTURES_PAIR_PREFIX + pair;
    }

    private <T> T call(Supplier<T> request) {
        try {
            return request.get();
        } catch (FeignException e) {
            if (e.status() < 0) {
                throw VenueApiException.noResponse(e.getMessage(), e);
            }
            throw new VenueApiException(e.status(), extractMessage(e), e);
        }
    }

    private String extractMessage(FeignException exception) {
        String body = exception.contentUTF8();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = OBJECT_MAPPER.readTree(body);
                JsonNode message = node.get("message");
                if (message != null && !message.asText().isBlank()) {
                    return abbreviate(message.asText());
                }
            } catch (IOException e) {
                log.debug("CoinDCX error body is not JSON. status={}", exception.status());
            }
            return abbreviate(body.strip());
        }

        String message = exception.getMessage();
        if (message != null && !message.isBlank()) {
            return abbreviate(message);
        }
        return "CoinDCX API request failed";
    }

    private String abbreviate(String text) {
        if (text.length() <= MAX_ERROR_TEXT_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_ERROR_TEXT_LENGTH) + "...";
    }

    private BigDecimal orElse(BigDecimal value, BigDecimal fallback) {
        return value.signum() > 0 ? value : fallback;
    }

    private BigDecimal parseDecimal(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value);
    }
}

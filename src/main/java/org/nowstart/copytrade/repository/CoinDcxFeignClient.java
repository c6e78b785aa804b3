package org.nowstart.copytrade.repository;

import java.util.List;
import org.nowstart.copytrade.config.CoinDcxFeignConfig;
import org.nowstart.copytrade.data.dto.CoinDcxInstrumentResponse;
import org.nowstart.copytrade.data.dto.CoinDcxOrderResponse;
import org.nowstart.copytrade.data.dto.CoinDcxTransactionResponse;
import org.nowstart.copytrade.data.dto.CoinDcxWalletResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "coinDcxClient",
        url = "${copytrade.trading.base-url}",
        configuration = CoinDcxFeignConfig.class
)
public interface CoinDcxFeignClient {

    String API_KEY_HEADER = "X-AUTH-APIKEY";
    String SIGNATURE_HEADER = "X-AUTH-SIGNATURE";

    @GetMapping("/exchange/v1/derivatives/futures/data/instrument")
    CoinDcxInstrumentResponse getInstrument(
            @RequestParam("pair") String pair,
            @RequestParam("margin_currency_short_name") String marginCurrency
    );

    @PostMapping(value = "/exchange/v1/derivatives/futures/orders/create", consumes = "application/json")
    List<CoinDcxOrderResponse> createOrder(
            @RequestHeader(API_KEY_HEADER) String apiKey,
            @RequestHeader(SIGNATURE_HEADER) String signature,
            @RequestBody String body
    );

    @PostMapping(value = "/exchange/v1/derivatives/futures/positions/transactions", consumes = "application/json")
    List<CoinDcxTransactionResponse> getTransactions(
            @RequestHeader(API_KEY_HEADER) String apiKey,
            @RequestHeader(SIGNATURE_HEADER) String signature,
            @RequestBody String body
    );

    @PostMapping(value = "/exchange/v1/derivatives/futures/wallets", consumes = "application/json")
    List<CoinDcxWalletResponse> getWallets(
            @RequestHeader(API_KEY_HEADER) String apiKey,
            @RequestHeader(SIGNATURE_HEADER) String signature,
            @RequestBody String body
    );
}

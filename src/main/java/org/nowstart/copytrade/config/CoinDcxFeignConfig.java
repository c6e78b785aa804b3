package org.nowstart.copytrade.config;

import feign.Request;
import feign.RequestInterceptor;
import feign.Retryer;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.nowstart.copytrade.service.auth.CoinDcxRequestSigner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CoinDcxFeignConfig {

    @Bean
    public CoinDcxRequestSigner coinDcxRequestSigner(Clock clock) {
        return new CoinDcxRequestSigner(clock);
    }

    // retries are owned by VenueCallExecutor
    @Bean
    public Retryer coinDcxRetryer() {
        return Retryer.NEVER_RETRY;
    }

    @Bean
    public Request.Options coinDcxRequestOptions(CopyTradingProperties copyTradingProperties) {
        return new Request.Options(
                copyTradingProperties.connectTimeout().toMillis(),
                TimeUnit.MILLISECONDS,
                copyTradingProperties.readTimeout().toMillis(),
                TimeUnit.MILLISECONDS,
                true
        );
    }

    @Bean
    public RequestInterceptor coinDcxHeaderInterceptor() {
        return template -> {
            template.header("Accept", "application/json");
            template.header("Content-Type", "application/json");
            template.header("User-Agent", "copytrade/1.0");
        };
    }
}

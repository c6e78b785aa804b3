package org.nowstart.copytrade.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "copytrade.trading")
public record CopyTradingProperties(
        // CoinDCX REST API 기본 URL
        @NotBlank @DefaultValue("https://api.coindcx.com") String baseUrl,
        // 실주문 대신 거래소 응답을 시뮬레이션(dry-run) 할지 여부
        @DefaultValue("false") boolean dryRun,
        // 거래소 호출당 최대 시도 횟수(최초 호출 포함)
        @Positive @DefaultValue("3") int maxRetries,
        // 첫 재시도 대기 시간, 이후 재시도마다 2배
        @NotNull @DefaultValue("1000ms") Duration retryBaseDelay,
        // 같은 팔로워 계정으로 나가는 호출 사이 최소 간격
        @NotNull @DefaultValue("2000ms") Duration minApiInterval,
        // 거래소 연결 타임아웃
        @NotNull @DefaultValue("5s") Duration connectTimeout,
        // 거래소 응답 타임아웃
        @NotNull @DefaultValue("15s") Duration readTimeout,
        // 필요 증거금 대비 지갑 잔고 여유 배수(수수료 포함)
        @DecimalMin("1.0") @DefaultValue("1.10") BigDecimal marginBuffer,
        // 증거금 통화
        @NotBlank @DefaultValue("USDT") String marginCurrency,
        // 미러 주문 실행 워커 기본 스레드 수(부족하면 추가 생성)
        @Positive @DefaultValue("8") int executorThreads,
        // dry-run 모드 체결 성공 확률(0~1)
        @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.9") BigDecimal dryRunSuccessRate,
        // 상품 메타데이터 캐시 유지 시간
        @NotNull @DefaultValue("10m") Duration instrumentCacheTtl,
        // 정수 수량만 허용하는 페어 목록
        List<String> wholeQuantityPairs,
        // 페어별 주문 수량 최대 소수 자릿수
        Map<String, Integer> quantityDecimals,
        // 계산된 레버리지가 상품 최대치를 넘으면 주문하지 않고 실패 처리
        @DefaultValue("false") boolean rejectLeverageAboveMax
) {

    public List<String> wholeQuantityPairs() {
        return wholeQuantityPairs == null ? List.of() : wholeQuantityPairs;
    }

    public Map<String, Integer> quantityDecimals() {
        return quantityDecimals == null ? Map.of() : quantityDecimals;
    }
}

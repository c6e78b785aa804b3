package org.nowstart.copytrade.data.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record PositionSizeRequest(
        @NotBlank(message = "pair is required") String pair,
        @NotNull(message = "entry is required") @DecimalMin(value = "0", inclusive = false) BigDecimal entry,
        @NotNull(message = "stopLoss is required") @DecimalMin(value = "0", inclusive = false) BigDecimal stopLoss,
        @NotNull(message = "fund is required") @DecimalMin(value = "0", inclusive = false) BigDecimal fund,
        @NotNull(message = "riskPct is required") @DecimalMin(value = "0", inclusive = false) @DecimalMax("100") BigDecimal riskPct
) {
}

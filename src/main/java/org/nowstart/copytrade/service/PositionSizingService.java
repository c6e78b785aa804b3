package org.nowstart.copytrade.service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.copytrade.data.dto.InstrumentMeta;
import org.nowstart.copytrade.data.dto.PositionSizeRequest;
import org.nowstart.copytrade.data.dto.PositionSizeResult;
import org.nowstart.copytrade.data.exception.PositionSizingException;
import org.nowstart.copytrade.data.type.SizingRejectionReason;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PositionSizingService {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
    private static final int QUOTIENT_EXTRA_SCALE = 10;
    private static final int MARGIN_SCALE = 8;
    private static final BigDecimal MAX_INT_LEVERAGE = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final InstrumentMetaService instrumentMetaService;

    public PositionSizeResult preview(PositionSizeRequest request) {
        InstrumentMeta meta = instrumentMetaService.get(request.pair()).orElse(null);
        return calculate(request.entry(), request.stopLoss(), request.fund(), request.riskPct(), request.pair(), meta);
    }

    /**
     * Sizes a position so that hitting the stop loses {@code riskPct} of {@code fund}, then adjusts it to the
     * instrument's step, minimum quantity and minimum notional. Leverage is the smallest integer that keeps the
     * required margin within {@code fund}.
     */
    public PositionSizeResult calculate(
            BigDecimal entry,
            BigDecimal stopLoss,
            BigDecimal fund,
            BigDecimal riskPct,
            String pair,
            InstrumentMeta meta
    ) {
        validateInput(entry, stopLoss, fund, riskPct, pair);

        if (meta == null || meta.looksLikeFallback()) {
            throw new PositionSizingException(
                    SizingRejectionReason.METADATA_UNAVAILABLE,
                    "Instrument metadata unavailable for " + pair
            );
        }
        if (meta.stepSize() == null || meta.stepSize().signum() <= 0) {
            throw new PositionSizingException(
                    SizingRejectionReason.METADATA_UNAVAILABLE,
                    "Instrument step size is not positive for " + pair
            );
        }

        BigDecimal stepSize = meta.stepSize();
        int decimals = Math.max(0, stepSize.stripTrailingZeros().scale());
        List<String> warnings = new ArrayList<>();

        BigDecimal riskAmount = fund.multiply(riskPct).divide(ONE_HUNDRED);
        BigDecimal perUnitRisk = entry.subtract(stopLoss).abs();
        BigDecimal rawQty = riskAmount.divide(perUnitRisk, decimals + QUOTIENT_EXTRA_SCALE, RoundingMode.DOWN);

        BigDecimal qty = floorToStep(rawQty, stepSize, decimals);
        BigDecimal minQty = safe(meta.minQty());
        if (minQty.signum() > 0 && qty.compareTo(minQty) < 0) {
            qty = ceilToStep(minQty, stepSize, decimals);
            warnings.add("Quantity raised to exchange minimum " + qty.toPlainString());
        }
        if (qty.signum() <= 0) {
            throw new PositionSizingException(
                    SizingRejectionReason.POSITION_TOO_SMALL,
                    "Calculated quantity rounds to zero for " + pair
            );
        }

        BigDecimal notional = qty.multiply(entry);
        BigDecimal minNotional = safe(meta.minNotional());
        if (notional.compareTo(minNotional) < 0) {
            throw new PositionSizingException(
                    SizingRejectionReason.POSITION_TOO_SMALL,
                    "Position notional " + notional.toPlainString() + " is below exchange minimum " + minNotional.toPlainString()
            );
        }

        BigDecimal rawLeverage = notional.divide(fund, 0, RoundingMode.CEILING);
        if (rawLeverage.compareTo(MAX_INT_LEVERAGE) > 0) {
            throw invalid("Stop loss too close to entry: required leverage " + rawLeverage.toPlainString() + "x is out of range");
        }
        int leverage = Math.max(1, rawLeverage.intValueExact());
        BigDecimal requiredMargin = notional.divide(BigDecimal.valueOf(leverage), MARGIN_SCALE, RoundingMode.HALF_UP);
        if (requiredMargin.compareTo(fund) > 0) {
            throw new PositionSizingException(
                    SizingRejectionReason.INSUFFICIENT_FUNDS,
                    "Required margin " + requiredMargin.toPlainString() + " exceeds fund " + fund.toPlainString()
            );
        }

        if (meta.maxLeverage() > 0 && leverage > meta.maxLeverage()) {
            warnings.add("High leverage " + leverage + "x may be rejected by exchange (max: " + meta.maxLeverage() + "x)");
        }

        return new PositionSizeResult(pair, qty, leverage, notional, requiredMargin, meta, List.copyOf(warnings));
    }

    private void validateInput(BigDecimal entry, BigDecimal stopLoss, BigDecimal fund, BigDecimal riskPct, String pair) {
        if (pair == null || pair.isBlank()) {
            throw invalid("Pair is required");
        }
        if (entry == null || entry.signum() <= 0) {
            throw invalid("Entry price must be greater than 0");
        }
        if (stopLoss == null || stopLoss.signum() <= 0) {
            throw invalid("Stop loss must be greater than 0");
        }
        if (entry.compareTo(stopLoss) == 0) {
            throw invalid("Entry price and stop loss must differ");
        }
        if (fund == null || fund.signum() <= 0) {
            throw invalid("Fund must be greater than 0");
        }
        if (riskPct == null || riskPct.signum() <= 0 || riskPct.compareTo(ONE_HUNDRED) > 0) {
            throw invalid("Risk percent must be in (0, 100]");
        }
    }

    private PositionSizingException invalid(String message) {
        return new PositionSizingException(SizingRejectionReason.INVALID_PARAMETERS, message);
    }

    static BigDecimal floorToStep(BigDecimal value, BigDecimal stepSize, int decimals) {
        BigInteger scaledValue = value.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigInteger();
        BigInteger scaledStep = scaledStep(stepSize, decimals);
        BigInteger units = scaledValue.divide(scaledStep);
        return new BigDecimal(units.multiply(scaledStep), decimals);
    }

    static BigDecimal ceilToStep(BigDecimal value, BigDecimal stepSize, int decimals) {
        BigInteger scaledValue = value.movePointRight(decimals).setScale(0, RoundingMode.CEILING).toBigInteger();
        BigInteger scaledStep = scaledStep(stepSize, decimals);
        BigInteger[] division = scaledValue.divideAndRemainder(scaledStep);
        BigInteger units = division[1].signum() == 0 ? division[0] : division[0].add(BigInteger.ONE);
        return new BigDecimal(units.multiply(scaledStep), decimals);
    }

    private static BigInteger scaledStep(BigDecimal stepSize, int decimals) {
        return stepSize.movePointRight(decimals).setScale(0, RoundingMode.UNNECESSARY).toBigIntegerExact();
    }

    private BigDecimal safe(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}

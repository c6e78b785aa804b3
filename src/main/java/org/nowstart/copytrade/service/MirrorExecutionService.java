package org.nowstart.copytrade.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.dto.InstrumentMeta;
import org.nowstart.copytrade.data.dto.OrderResult;
import org.nowstart.copytrade.data.dto.OrderSpec;
import org.nowstart.copytrade.data.dto.PositionSizeResult;
import org.nowstart.copytrade.data.dto.VenueCredentials;
import org.nowstart.copytrade.data.entity.Follower;
import org.nowstart.copytrade.data.entity.MirrorTrade;
import org.nowstart.copytrade.data.entity.PrimaryTrade;
import org.nowstart.copytrade.data.exception.CopyTradeApiException;
import org.nowstart.copytrade.data.exception.CredentialDecryptionException;
import org.nowstart.copytrade.data.exception.MirrorExecutionException;
import org.nowstart.copytrade.data.exception.PositionSizingException;
import org.nowstart.copytrade.data.exception.VenueCallException;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.data.type.SizingRejectionReason;
import org.nowstart.copytrade.repository.FollowerRepository;
import org.nowstart.copytrade.repository.MirrorTradeRepository;
import org.nowstart.copytrade.repository.PrimaryTradeRepository;
import org.nowstart.copytrade.service.auth.CredentialCipher;
import org.nowstart.copytrade.service.venue.OrderExecutor;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Runs one pending mirror trade to a terminal state. Every rejection ends up as a FAILED record with a readable
 * message; nothing thrown here escapes to other followers.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class MirrorExecutionService {

    static final String FOLLOWER_NOT_FOUND = "Follower not found";
    static final String FOLLOWER_INACTIVE = "Follower is inactive";
    static final String LOW_FUND = "Insufficient funds: wallet balance below allocated fund";

    private final MirrorTradeRepository mirrorTradeRepository;
    private final FollowerRepository followerRepository;
    private final PrimaryTradeRepository primaryTradeRepository;
    private final InstrumentMetaService instrumentMetaService;
    private final PositionSizingService positionSizingService;
    private final QuantityPrecisionService quantityPrecisionService;
    private final CredentialCipher credentialCipher;
    private final OrderExecutor orderExecutor;
    private final MirrorTradeStateMachine mirrorTradeStateMachine;
    private final CopyTradingProperties copyTradingProperties;
    private final Clock clock;

    public MirrorTrade execute(String mirrorTradeId) {
        MirrorTrade mirror = mirrorTradeRepository.findById(mirrorTradeId)
                .orElseThrow(() -> new CopyTradeApiException(HttpStatus.NOT_FOUND, "mirror_trade_not_found", "Mirror trade not found"));
        if (mirror.getStatus() != MirrorTradeStatus.PENDING) {
            log.info("Skipping mirror trade that is no longer pending. mirrorTradeId={}, status={}", mirrorTradeId, mirror.getStatus());
            return mirror;
        }

        try {
            OrderResult result = place(mirror);
            if (!result.success()) {
                return mirrorTradeStateMachine.markFailed(mirrorTradeId, result.message());
            }
            return mirrorTradeStateMachine.markExecuted(mirrorTradeId, result);
        } catch (MirrorExecutionException | PositionSizingException | VenueCallException | CredentialDecryptionException e) {
            return mirrorTradeStateMachine.markFailed(mirrorTradeId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected mirror execution failure. mirrorTradeId={}", mirrorTradeId, e);
            return mirrorTradeStateMachine.markFailed(mirrorTradeId, "Execution failed: " + e.getMessage());
        }
    }

    private OrderResult place(MirrorTrade mirror) {
        Follower follower = followerRepository.findById(mirror.getFollowerId())
                .orElseThrow(() -> new MirrorExecutionException(FOLLOWER_NOT_FOUND));
        if (!follower.isActive()) {
            throw new MirrorExecutionException(FOLLOWER_INACTIVE);
        }
        if (follower.isLowFund()) {
            throw new MirrorExecutionException(LOW_FUND);
        }
        guardDailyLimit(follower);

        PrimaryTrade primary = primaryTradeRepository.findById(mirror.getPrimaryTradeId())
                .orElseThrow(() -> new MirrorExecutionException("Primary trade not found"));
        if (primary.getStopLoss() == null || primary.getStopLoss().signum() <= 0) {
            throw new MirrorExecutionException("Primary trade has no stop loss; position cannot be sized");
        }

        InstrumentMeta meta = instrumentMetaService.get(primary.getPair())
                .orElseThrow(() -> new PositionSizingException(
                        SizingRejectionReason.METADATA_UNAVAILABLE,
                        "Instrument metadata unavailable for " + primary.getPair()
                ));
        PositionSizeResult sizing = positionSizingService.calculate(
                primary.getPrice(),
                primary.getStopLoss(),
                follower.getFund(),
                follower.getRiskPerTrade(),
                primary.getPair(),
                meta
        );
        for (String warning : sizing.warnings()) {
            log.warn("event=sizing_warning mirror_trade_id={} pair={} warning={}", mirror.getId(), primary.getPair(), warning);
        }
        if (sizing.exceedsMaxLeverage() && copyTradingProperties.rejectLeverageAboveMax()) {
            throw new MirrorExecutionException(
                    "Leverage " + sizing.leverage() + "x exceeds exchange maximum " + meta.maxLeverage() + "x"
            );
        }

        BigDecimal quantity = quantityPrecisionService.apply(primary.getPair(), sizing.qty());
        BigDecimal notional = validateRoundedQuantity(primary, meta, quantity);
        BigDecimal requiredMargin = notional.divide(BigDecimal.valueOf(sizing.leverage()), 8, RoundingMode.HALF_UP);
        guardMargin(follower, requiredMargin);

        VenueCredentials credentials = orderExecutor.isSimulated() ? null : credentialCipher.decrypt(follower);
        OrderSpec orderSpec = new OrderSpec(
                primary.getPair(),
                primary.getSide(),
                quantity,
                sizing.leverage(),
                primary.getPrice(),
                primary.getStopLoss(),
                primary.getTakeProfit1(),
                mirror.getId()
        );

        log.info(
                "event=mirror_order_submit mirror_trade_id={} follower_id={} pair={} side={} qty={} leverage={} margin={} simulated={}",
                mirror.getId(),
                follower.getId(),
                orderSpec.pair(),
                orderSpec.side(),
                quantity,
                sizing.leverage(),
                requiredMargin,
                orderExecutor.isSimulated()
        );
        return orderExecutor.execute(follower.getId(), credentials, orderSpec);
    }

    private void guardDailyLimit(Follower follower) {
        Integer maxTradesPerDay = follower.getMaxTradesPerDay();
        if (maxTradesPerDay == null || maxTradesPerDay <= 0) {
            return;
        }

        long executedToday = mirrorTradeRepository.countByFollowerIdAndStatusAndExecutedAtAfter(
                follower.getId(),
                MirrorTradeStatus.EXECUTED,
                LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay(ZoneOffset.UTC).toInstant()
        );
        if (executedToday >= maxTradesPerDay) {
            throw new MirrorExecutionException("Daily trade limit reached (" + maxTradesPerDay + ")");
        }
    }

    private BigDecimal validateRoundedQuantity(PrimaryTrade primary, InstrumentMeta meta, BigDecimal quantity) {
        BigDecimal minQty = meta.minQty() == null ? BigDecimal.ZERO : meta.minQty();
        if (quantity.signum() <= 0 || quantity.compareTo(minQty) < 0) {
            throw new MirrorExecutionException(
                    "Quantity " + quantity.toPlainString() + " is below exchange minimum " + minQty.toPlainString() + " after precision rounding"
            );
        }

        BigDecimal notional = quantity.multiply(primary.getPrice());
        BigDecimal minNotional = meta.minNotional() == null ? BigDecimal.ZERO : meta.minNotional();
        if (notional.compareTo(minNotional) < 0) {
            throw new MirrorExecutionException(
                    "Order notional " + notional.toPlainString() + " is below exchange minimum " + minNotional.toPlainString() + " after precision rounding"
            );
        }
        return notional;
    }

    private void guardMargin(Follower follower, BigDecimal requiredMargin) {
        BigDecimal walletBalance = follower.getWalletBalance();
        if (walletBalance == null) {
            return;
        }

        BigDecimal buffer = copyTradingProperties.marginBuffer();
        BigDecimal requiredWithBuffer = requiredMargin.multiply(buffer);
        if (walletBalance.compareTo(requiredWithBuffer) < 0) {
            String bufferPercent = buffer.subtract(BigDecimal.ONE).movePointRight(2).stripTrailingZeros().toPlainString();
            throw new MirrorExecutionException(
                    "Insufficient funds: required margin " + requiredWithBuffer.setScale(2, RoundingMode.HALF_UP).toPlainString()
                            + " (incl. " + bufferPercent + "% buffer) exceeds wallet balance "
                            + walletBalance.setScale(2, RoundingMode.HALF_UP).toPlainString()
            );
        }
    }
}

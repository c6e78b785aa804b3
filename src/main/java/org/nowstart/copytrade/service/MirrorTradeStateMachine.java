package org.nowstart.copytrade.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.dto.OrderResult;
import org.nowstart.copytrade.data.entity.AuditEvent;
import org.nowstart.copytrade.data.entity.MirrorTrade;
import org.nowstart.copytrade.data.exception.CopyTradeApiException;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.repository.AuditEventRepository;
import org.nowstart.copytrade.repository.MirrorTradeRepository;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sole writer of a mirror trade's execution outcome and P&L. Status only moves PENDING to EXECUTED or FAILED;
 * calls against a terminal record are ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MirrorTradeStateMachine {

    static final String NO_ORDER_ID_MESSAGE = "Venue returned no usable order id";
    static final String DEFAULT_FAILURE_MESSAGE = "Execution failed";
    // MirrorTrade.errorMessage 컬럼 길이
    static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private static final Set<String> PLACEHOLDER_ORDER_IDS = Set.of("unknown", "null", "undefined", "0");

    private final MirrorTradeRepository mirrorTradeRepository;
    private final AuditEventRepository auditEventRepository;
    private final Clock clock;

    @Transactional
    public MirrorTrade markExecuted(String mirrorTradeId, OrderResult result) {
        MirrorTrade mirror = load(mirrorTradeId);
        if (mirror.getStatus().isTerminal()) {
            log.warn("event=mirror_transition_ignored mirror_trade_id={} status={} target=EXECUTED", mirrorTradeId, mirror.getStatus());
            return mirror;
        }

        String orderId = result == null ? null : result.orderId();
        if (!isUsableOrderId(orderId)) {
            return fail(mirror, NO_ORDER_ID_MESSAGE);
        }

        mirror.setStatus(MirrorTradeStatus.EXECUTED);
        mirror.setVenueOrderId(orderId);
        mirror.setExecutedPrice(result.executedPrice());
        mirror.setExecutedQuantity(result.executedQuantity());
        mirror.setExecutedLeverage(result.executedLeverage());
        mirror.setExecutedAt(clock.instant());
        mirror.setErrorMessage(null);
        mirrorTradeRepository.save(mirror);

        writeAudit("MIRROR_EXECUTED", mirror.getId(), "followerId=" + mirror.getFollowerId() + ", orderId=" + orderId);
        log.info(
                "event=mirror_executed mirror_trade_id={} follower_id={} pair={} side={} order_id={} qty={} price={} leverage={}",
                mirror.getId(),
                mirror.getFollowerId(),
                mirror.getPair(),
                mirror.getSide(),
                orderId,
                mirror.getExecutedQuantity(),
                mirror.getExecutedPrice(),
                mirror.getExecutedLeverage()
        );
        return mirror;
    }

    @Transactional
    public MirrorTrade markFailed(String mirrorTradeId, String message) {
        MirrorTrade mirror = load(mirrorTradeId);
        if (mirror.getStatus().isTerminal()) {
            log.warn("event=mirror_transition_ignored mirror_trade_id={} status={} target=FAILED", mirrorTradeId, mirror.getStatus());
            return mirror;
        }
        return fail(mirror, message);
    }

    /**
     * @return {@code true} when the stored P&L changed
     */
    @Transactional
    public boolean recordPnl(String mirrorTradeId, BigDecimal pnl, BigDecimal exitPrice) {
        MirrorTrade mirror = load(mirrorTradeId);
        if (mirror.getStatus() != MirrorTradeStatus.EXECUTED) {
            log.warn("event=pnl_ignored mirror_trade_id={} status={}", mirrorTradeId, mirror.getStatus());
            return false;
        }
        if (sameValue(mirror.getPnl(), pnl) && sameValue(mirror.getExitPrice(), exitPrice)) {
            return false;
        }

        mirror.setPnl(pnl);
        if (exitPrice != null) {
            mirror.setExitPrice(exitPrice);
        }
        mirror.setPnlUpdatedAt(clock.instant());
        mirrorTradeRepository.save(mirror);

        writeAudit("MIRROR_PNL_RECORDED", mirror.getId(), "pnl=" + pnl + ", exitPrice=" + exitPrice);
        log.info(
                "event=pnl_reconciled mirror_trade_id={} follower_id={} order_id={} pnl={} exit_price={}",
                mirror.getId(),
                mirror.getFollowerId(),
                mirror.getVenueOrderId(),
                pnl,
                exitPrice
        );
        return true;
    }

    static boolean isUsableOrderId(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return false;
        }
        return !PLACEHOLDER_ORDER_IDS.contains(orderId.trim().toLowerCase(Locale.ROOT));
    }

    private MirrorTrade fail(MirrorTrade mirror, String message) {
        String errorMessage = message == null || message.isBlank() ? DEFAULT_FAILURE_MESSAGE : truncate(message);
        mirror.setStatus(MirrorTradeStatus.FAILED);
        mirror.setErrorMessage(errorMessage);
        mirrorTradeRepository.save(mirror);

        writeAudit("MIRROR_FAILED", mirror.getId(), "followerId=" + mirror.getFollowerId() + ", reason=" + errorMessage);
        log.warn(
                "event=mirror_failed mirror_trade_id={} follower_id={} pair={} reason={}",
                mirror.getId(),
                mirror.getFollowerId(),
                mirror.getPair(),
                errorMessage
        );
        return mirror;
    }

    private MirrorTrade load(String mirrorTradeId) {
        return mirrorTradeRepository.findById(mirrorTradeId)
                .orElseThrow(() -> new CopyTradeApiException(HttpStatus.NOT_FOUND, "mirror_trade_not_found", "Mirror trade not found"));
    }

    private boolean sameValue(BigDecimal current, BigDecimal next) {
        if (current == null || next == null) {
            return Objects.equals(current, next);
        }
        return current.compareTo(next) == 0;
    }

    private void writeAudit(String type, String mirrorTradeId, String payload) {
        AuditEvent event = AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .type(type)
                .mirrorTradeId(mirrorTradeId)
                .payload(payload)
                .build();
        auditEventRepository.save(event);
    }

    private String truncate(String message) {
        if (message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH - 3) + "...";
    }
}

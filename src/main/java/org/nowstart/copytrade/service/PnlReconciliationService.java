package org.nowstart.copytrade.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.dto.LedgerEntry;
import org.nowstart.copytrade.data.dto.PnlReconcileOutcome;
import org.nowstart.copytrade.data.dto.PnlSyncResult;
import org.nowstart.copytrade.data.dto.VenueCredentials;
import org.nowstart.copytrade.data.entity.Follower;
import org.nowstart.copytrade.data.entity.MirrorTrade;
import org.nowstart.copytrade.data.exception.CopyTradeApiException;
import org.nowstart.copytrade.data.exception.CredentialDecryptionException;
import org.nowstart.copytrade.data.exception.VenueCallException;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.data.type.PnlReconcileStatus;
import org.nowstart.copytrade.data.type.TradeSide;
import org.nowstart.copytrade.repository.FollowerRepository;
import org.nowstart.copytrade.repository.MirrorTradeRepository;
import org.nowstart.copytrade.service.auth.CredentialCipher;
import org.nowstart.copytrade.service.venue.SimulatedOrderExecutor;
import org.nowstart.copytrade.service.venue.VenueCallExecutor;
import org.nowstart.copytrade.service.venue.VenueClient;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class PnlReconciliationService {

    private static final int EXIT_PRICE_SCALE = 8;

    private final MirrorTradeRepository mirrorTradeRepository;
    private final FollowerRepository followerRepository;
    private final CredentialCipher credentialCipher;
    private final VenueClient venueClient;
    private final VenueCallExecutor venueCallExecutor;
    private final MirrorTradeStateMachine mirrorTradeStateMachine;
    private final CopyTradingProperties copyTradingProperties;

    public PnlReconcileOutcome reconcile(String mirrorTradeId) {
        MirrorTrade mirror = mirrorTradeRepository.findById(mirrorTradeId)
                .orElseThrow(() -> new CopyTradeApiException(HttpStatus.NOT_FOUND, "mirror_trade_not_found", "Mirror trade not found"));
        return reconcile(mirror);
    }

    public PnlReconcileOutcome reconcile(MirrorTrade mirror) {
        String orderId = mirror.getVenueOrderId();
        if (mirror.getStatus() != MirrorTradeStatus.EXECUTED || orderId == null || orderId.isBlank()) {
            return PnlReconcileOutcome.of(mirror.getId(), PnlReconcileStatus.NOT_ELIGIBLE, "Mirror trade has no executed venue order");
        }
        if (SimulatedOrderExecutor.isSimulatedOrderId(orderId)) {
            return PnlReconcileOutcome.of(mirror.getId(), PnlReconcileStatus.NOT_ELIGIBLE, "Dry-run order has no venue ledger");
        }
        if (mirror.getPnl() != null) {
            return new PnlReconcileOutcome(mirror.getId(), PnlReconcileStatus.ALREADY_RECONCILED, mirror.getPnl(), mirror.getExitPrice(), "P&L already recorded");
        }

        Follower follower = followerRepository.findById(mirror.getFollowerId()).orElse(null);
        if (follower == null) {
            return PnlReconcileOutcome.of(mirror.getId(), PnlReconcileStatus.FAILED, "Follower not found");
        }

        List<LedgerEntry> entries;
        try {
            VenueCredentials credentials = credentialCipher.decrypt(follower);
            entries = venueCallExecutor.execute(
                    follower.getId(),
                    "ledger",
                    () -> venueClient.getTransactions(credentials, orderId)
            );
        } catch (CredentialDecryptionException | VenueCallException e) {
            log.warn("event=pnl_reconcile_failed mirror_trade_id={} order_id={} reason={}", mirror.getId(), orderId, e.getMessage());
            return PnlReconcileOutcome.of(mirror.getId(), PnlReconcileStatus.FAILED, e.getMessage());
        }

        if (entries == null || entries.isEmpty()) {
            log.info("No ledger entries yet. mirrorTradeId={}, orderId={}", mirror.getId(), orderId);
            return PnlReconcileOutcome.of(mirror.getId(), PnlReconcileStatus.NOT_SETTLED, "No ledger entries yet");
        }

        Optional<BigDecimal> realized = matchRealizedPnl(entries, orderId);
        if (realized.isEmpty()) {
            log.info("Position not settled yet. mirrorTradeId={}, orderId={}, entries={}", mirror.getId(), orderId, entries.size());
            return PnlReconcileOutcome.of(mirror.getId(), PnlReconcileStatus.NOT_SETTLED, "Position not settled yet");
        }

        BigDecimal pnl = realized.get();
        BigDecimal exitPrice = deriveExitPrice(
                mirror.getSide(),
                mirror.getExecutedPrice(),
                mirror.getExecutedQuantity(),
                mirror.getExecutedLeverage(),
                pnl
        );
        mirrorTradeStateMachine.recordPnl(mirror.getId(), pnl, exitPrice);
        return new PnlReconcileOutcome(mirror.getId(), PnlReconcileStatus.UPDATED, pnl, exitPrice, "P&L recorded");
    }

    public PnlSyncResult reconcileAll() {
        if (copyTradingProperties.dryRun()) {
            log.info("event=pnl_sync skipped=true reason=dry_run");
            return new PnlSyncResult(0, 0, 0, List.of());
        }

        List<MirrorTrade> candidates = mirrorTradeRepository.findByStatusAndVenueOrderIdIsNotNullAndPnlIsNull(MirrorTradeStatus.EXECUTED);
        List<PnlReconcileOutcome> details = new ArrayList<>();
        int updated = 0;
        int pending = 0;
        int errors = 0;

        for (MirrorTrade mirror : candidates) {
            PnlReconcileOutcome outcome;
            try {
                outcome = reconcile(mirror);
            } catch (RuntimeException e) {
                log.error("Failed to reconcile mirror trade P&L. mirrorTradeId={}", mirror.getId(), e);
                outcome = PnlReconcileOutcome.of(mirror.getId(), PnlReconcileStatus.FAILED, e.getMessage());
            }

            switch (outcome.status()) {
                case UPDATED -> updated++;
                case NOT_SETTLED -> pending++;
                case FAILED -> errors++;
                default -> {
                }
            }
            details.add(outcome);
        }

        log.info("event=pnl_sync candidates={} updated={} pending={} errors={}", candidates.size(), updated, pending, errors);
        return new PnlSyncResult(updated, pending, errors, List.copyOf(details));
    }

    /**
     * The entry whose parent is the order identifies the position; the realized P&L is the first non-zero entry
     * on that position posted by a different parent (the closing order).
     */
    static Optional<BigDecimal> matchRealizedPnl(List<LedgerEntry> entries, String orderId) {
        Optional<String> positionId = entries.stream()
                .filter(entry -> orderId.equals(entry.parentId()))
                .map(LedgerEntry::positionId)
                .filter(id -> id != null && !id.isBlank())
                .findFirst();
        if (positionId.isEmpty()) {
            return Optional.empty();
        }

        return entries.stream()
                .filter(entry -> positionId.get().equals(entry.positionId()))
                .filter(entry -> !orderId.equals(entry.parentId()))
                .map(LedgerEntry::amount)
                .filter(amount -> amount != null && amount.signum() != 0)
                .findFirst();
    }

    static BigDecimal deriveExitPrice(TradeSide side, BigDecimal entryPrice, BigDecimal quantity, Integer leverage, BigDecimal pnl) {
        if (side == null || entryPrice == null || quantity == null || leverage == null || pnl == null) {
            return null;
        }
        if (quantity.signum() <= 0 || leverage <= 0 || pnl.signum() == 0) {
            return null;
        }

        BigDecimal move = pnl.divide(quantity.multiply(BigDecimal.valueOf(leverage)), EXIT_PRICE_SCALE, RoundingMode.HALF_UP);
        BigDecimal exitPrice = side == TradeSide.BUY ? entryPrice.add(move) : entryPrice.subtract(move);
        return exitPrice.setScale(EXIT_PRICE_SCALE, RoundingMode.HALF_UP);
    }
}

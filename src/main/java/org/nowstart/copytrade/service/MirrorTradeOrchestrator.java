package org.nowstart.copytrade.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.dto.MirrorDispatchResult;
import org.nowstart.copytrade.data.entity.Follower;
import org.nowstart.copytrade.data.entity.MirrorTrade;
import org.nowstart.copytrade.data.entity.PrimaryTrade;
import org.nowstart.copytrade.data.exception.CopyTradeApiException;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.repository.FollowerRepository;
import org.nowstart.copytrade.repository.MirrorTradeRepository;
import org.nowstart.copytrade.repository.PrimaryTradeRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class MirrorTradeOrchestrator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final FollowerRepository followerRepository;
    private final PrimaryTradeRepository primaryTradeRepository;
    private final MirrorTradeRepository mirrorTradeRepository;
    private final MirrorExecutionService mirrorExecutionService;
    private final MirrorTradeStateMachine mirrorTradeStateMachine;
    private final Executor mirrorExecutionExecutor;

    public MirrorTradeOrchestrator(
            FollowerRepository followerRepository,
            PrimaryTradeRepository primaryTradeRepository,
            MirrorTradeRepository mirrorTradeRepository,
            MirrorExecutionService mirrorExecutionService,
            MirrorTradeStateMachine mirrorTradeStateMachine,
            @Qualifier("mirrorExecutionExecutor") Executor mirrorExecutionExecutor
    ) {
        this.followerRepository = followerRepository;
        this.primaryTradeRepository = primaryTradeRepository;
        this.mirrorTradeRepository = mirrorTradeRepository;
        this.mirrorExecutionService = mirrorExecutionService;
        this.mirrorTradeStateMachine = mirrorTradeStateMachine;
        this.mirrorExecutionExecutor = mirrorExecutionExecutor;
    }

    public MirrorDispatchResult mirrorById(String primaryTradeId) {
        PrimaryTrade primary = primaryTradeRepository.findById(primaryTradeId)
                .orElseThrow(() -> new CopyTradeApiException(HttpStatus.NOT_FOUND, "primary_trade_not_found", "Primary trade not found"));
        return mirror(primary);
    }

    /**
     * Creates one pending mirror per active follower and hands each to the worker pool. Returns without waiting
     * for any execution; use {@link MirrorBatchTracker#await} on the result when a join point is needed.
     */
    public MirrorDispatchResult mirror(PrimaryTrade primary) {
        List<Follower> followers = followerRepository.findByActiveTrue();
        if (followers == null || followers.isEmpty()) {
            log.info("event=mirror_dispatch primary_trade_id={} followers=0", primary.getId());
            return new MirrorDispatchResult(true, "No active followers", List.of(), List.of(), new MirrorBatchTracker(primary.getId(), 0));
        }

        List<String> mirrorTradeIds = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Follower follower : followers) {
            try {
                mirrorTradeIds.add(createPending(primary, follower).getId());
            } catch (RuntimeException e) {
                log.warn("Failed to create mirror trade. primaryTradeId={}, followerId={}", primary.getId(), follower.getId(), e);
                errors.add("Follower " + follower.getId() + ": " + e.getMessage());
            }
        }

        MirrorBatchTracker batch = new MirrorBatchTracker(primary.getId(), mirrorTradeIds.size());
        for (String mirrorTradeId : mirrorTradeIds) {
            dispatch(mirrorTradeId, batch);
        }

        log.info(
                "event=mirror_dispatch primary_trade_id={} pair={} side={} followers={} dispatched={} errors={}",
                primary.getId(),
                primary.getPair(),
                primary.getSide(),
                followers.size(),
                mirrorTradeIds.size(),
                errors.size()
        );

        boolean success = !mirrorTradeIds.isEmpty();
        String message = success
                ? "Copy trading initiated for " + mirrorTradeIds.size() + " followers"
                : "No mirror trades could be created";
        return new MirrorDispatchResult(success, message, List.copyOf(mirrorTradeIds), List.copyOf(errors), batch);
    }

    private MirrorTrade createPending(PrimaryTrade primary, Follower follower) {
        BigDecimal requestedQuantity = primary.getTotal() == null || follower.getRiskPerTrade() == null
                ? null
                : primary.getTotal().multiply(follower.getRiskPerTrade()).divide(ONE_HUNDRED);

        MirrorTrade mirror = MirrorTrade.builder()
                .id(UUID.randomUUID().toString())
                .primaryTradeId(primary.getId())
                .followerId(follower.getId())
                .pair(primary.getPair())
                .side(primary.getSide())
                .requestedPrice(primary.getPrice())
                .requestedQuantity(requestedQuantity)
                .requestedLeverage(primary.getLeverage())
                .status(MirrorTradeStatus.PENDING)
                .build();
        return mirrorTradeRepository.save(mirror);
    }

    private void dispatch(String mirrorTradeId, MirrorBatchTracker batch) {
        try {
            mirrorExecutionExecutor.execute(() -> run(mirrorTradeId, batch));
        } catch (RejectedExecutionException e) {
            log.error("Mirror execution rejected by worker pool. mirrorTradeId={}", mirrorTradeId, e);
            failQuietly(mirrorTradeId, "Execution rejected: worker pool unavailable");
            batch.complete(false);
        }
    }

    private void run(String mirrorTradeId, MirrorBatchTracker batch) {
        boolean executed = false;
        try {
            MirrorTrade result = mirrorExecutionService.execute(mirrorTradeId);
            executed = result.getStatus() == MirrorTradeStatus.EXECUTED;
        } catch (RuntimeException e) {
            log.error("Mirror execution task failed. mirrorTradeId={}", mirrorTradeId, e);
            failQuietly(mirrorTradeId, "Execution failed: " + e.getMessage());
        } finally {
            batch.complete(executed);
        }
    }

    private void failQuietly(String mirrorTradeId, String message) {
        try {
            mirrorTradeStateMachine.markFailed(mirrorTradeId, message);
        } catch (RuntimeException e) {
            log.error("Failed to record mirror failure. mirrorTradeId={}", mirrorTradeId, e);
        }
    }
}

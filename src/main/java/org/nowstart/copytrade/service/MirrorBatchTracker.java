package org.nowstart.copytrade.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Completion counter for the tasks dispatched for one primary trade.
 */
@Slf4j
public class MirrorBatchTracker {

    @Getter
    private final String primaryTradeId;
    @Getter
    private final int size;
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final CountDownLatch latch;

    public MirrorBatchTracker(String primaryTradeId, int size) {
        this.primaryTradeId = primaryTradeId;
        this.size = size;
        this.latch = new CountDownLatch(size);
    }

    public void complete(boolean success) {
        if (!success) {
            failed.incrementAndGet();
        }
        int done = completed.incrementAndGet();
        latch.countDown();
        if (done == size) {
            log.info(
                    "event=mirror_batch_completed primary_trade_id={} total={} failed={}",
                    primaryTradeId,
                    size,
                    failed.get()
            );
        }
    }

    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int completedCount() {
        return completed.get();
    }

    public int failedCount() {
        return failed.get();
    }

    public boolean isDone() {
        return latch.getCount() == 0;
    }
}

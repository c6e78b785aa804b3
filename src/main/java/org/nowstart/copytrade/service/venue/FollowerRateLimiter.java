package org.nowstart.copytrade.service.venue;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps calls made for the same key at least {@code minInterval} apart. Each caller reserves its slot atomically
 * and then sleeps outside of any lock, so different keys never wait on each other.
 */
@Slf4j
public class FollowerRateLimiter {

    private final long intervalNanos;
    private final ConcurrentHashMap<String, Long> reservedSlots = new ConcurrentHashMap<>();

    public FollowerRateLimiter(Duration minInterval) {
        this.intervalNanos = Math.max(0L, minInterval.toNanos());
    }

    public void acquire(String key) {
        long now = System.nanoTime();
        long slot = reservedSlots.compute(key, (ignored, last) -> last == null ? now : Math.max(now, last + intervalNanos));
        long waitNanos = slot - now;
        if (waitNanos <= 0) {
            return;
        }

        log.debug("event=rate_limit_wait key={} wait_ms={}", key, TimeUnit.NANOSECONDS.toMillis(waitNanos));
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for venue rate limit slot. key=" + key, e);
        }
    }

    public Duration minInterval() {
        return Duration.ofNanos(intervalNanos);
    }
}

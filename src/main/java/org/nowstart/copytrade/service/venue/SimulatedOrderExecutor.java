package org.nowstart.copytrade.service.venue;

import java.math.BigDecimal;
import java.util.Random;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.dto.OrderResult;
import org.nowstart.copytrade.data.dto.OrderSpec;
import org.nowstart.copytrade.data.dto.VenueCredentials;

/**
 * Dry-run order path. Respects the follower rate limit but never calls the venue.
 */
@Slf4j
public class SimulatedOrderExecutor implements OrderExecutor {

    public static final String ORDER_ID_PREFIX = "dryrun-";

    private final FollowerRateLimiter rateLimiter;
    private final Random random;
    private final double successRate;

    public SimulatedOrderExecutor(FollowerRateLimiter rateLimiter, Random random, BigDecimal successRate) {
        this.rateLimiter = rateLimiter;
        this.random = random;
        this.successRate = successRate.doubleValue();
    }

    @Override
    public OrderResult execute(String followerId, VenueCredentials credentials, OrderSpec orderSpec) {
        rateLimiter.acquire(followerId);

        if (random.nextDouble() >= successRate) {
            log.info("Dry-run order rejected. followerId={}, pair={}, side={}", followerId, orderSpec.pair(), orderSpec.side());
            return OrderResult.rejected("Simulated order rejection (dry-run)");
        }

        String orderId = ORDER_ID_PREFIX + UUID.randomUUID();
        log.info(
                "Dry-run order filled. followerId={}, orderId={}, pair={}, side={}, qty={}, price={}, leverage={}",
                followerId,
                orderId,
                orderSpec.pair(),
                orderSpec.side(),
                orderSpec.quantity(),
                orderSpec.price(),
                orderSpec.leverage()
        );
        return OrderResult.filled(orderId, orderSpec.price(), orderSpec.quantity(), orderSpec.leverage());
    }

    @Override
    public boolean isSimulated() {
        return true;
    }

    public static boolean isSimulatedOrderId(String orderId) {
        return orderId != null && orderId.startsWith(ORDER_ID_PREFIX);
    }
}

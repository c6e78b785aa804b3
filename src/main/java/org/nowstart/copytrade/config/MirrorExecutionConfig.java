package org.nowstart.copytrade.config;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.nowstart.copytrade.data.property.CredentialProperties;
import org.nowstart.copytrade.service.auth.CredentialCipher;
import org.nowstart.copytrade.service.venue.FollowerRateLimiter;
import org.nowstart.copytrade.service.venue.LiveOrderExecutor;
import org.nowstart.copytrade.service.venue.OrderExecutor;
import org.nowstart.copytrade.service.venue.SimulatedOrderExecutor;
import org.nowstart.copytrade.service.venue.VenueCallExecutor;
import org.nowstart.copytrade.service.venue.VenueClient;
import org.nowstart.copytrade.service.venue.VenueErrorClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MirrorExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "mirrorExecutionExecutor", destroyMethod = "shutdown")
    public ExecutorService mirrorExecutionExecutor(CopyTradingProperties copyTradingProperties) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "mirror-exec-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        // direct hand-off: a task never queues behind a slow follower
        return new ThreadPoolExecutor(
                copyTradingProperties.executorThreads(),
                Integer.MAX_VALUE,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                threadFactory
        );
    }

    @Bean
    public FollowerRateLimiter followerRateLimiter(CopyTradingProperties copyTradingProperties) {
        return new FollowerRateLimiter(copyTradingProperties.minApiInterval());
    }

    @Bean
    public VenueCallExecutor venueCallExecutor(
            FollowerRateLimiter followerRateLimiter,
            VenueErrorClassifier venueErrorClassifier,
            CopyTradingProperties copyTradingProperties
    ) {
        return new VenueCallExecutor(followerRateLimiter, venueErrorClassifier, copyTradingProperties);
    }

    @Bean
    public CredentialCipher credentialCipher(CredentialProperties credentialProperties) {
        if (credentialProperties.encryptionKey() == null || credentialProperties.encryptionKey().isBlank()) {
            log.warn("copytrade.security.encryption-key is not set. Follower credentials cannot be decrypted.");
        }
        return new CredentialCipher(credentialProperties.encryptionKey());
    }

    @Bean
    public OrderExecutor orderExecutor(
            CopyTradingProperties copyTradingProperties,
            VenueClient venueClient,
            VenueCallExecutor venueCallExecutor,
            FollowerRateLimiter followerRateLimiter
    ) {
        if (copyTradingProperties.dryRun()) {
            log.info("Dry-run mode enabled. Mirror orders will be simulated. successRate={}", copyTradingProperties.dryRunSuccessRate());
            return new SimulatedOrderExecutor(followerRateLimiter, new Random(), copyTradingProperties.dryRunSuccessRate());
        }
        return new LiveOrderExecutor(venueClient, venueCallExecutor);
    }
}

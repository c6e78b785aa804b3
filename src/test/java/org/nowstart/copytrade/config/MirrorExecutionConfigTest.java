package org.nowstart.copytrade.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.nowstart.copytrade.CopyTradeFixtures;
import org.nowstart.copytrade.data.property.CredentialProperties;
import org.nowstart.copytrade.service.auth.CredentialCipher;
import org.nowstart.copytrade.service.venue.FollowerRateLimiter;
import org.nowstart.copytrade.service.venue.LiveOrderExecutor;
import org.nowstart.copytrade.service.venue.OrderExecutor;
import org.nowstart.copytrade.service.venue.SimulatedOrderExecutor;
import org.nowstart.copytrade.service.venue.VenueCallExecutor;
import org.nowstart.copytrade.service.venue.VenueClient;
import org.nowstart.copytrade.service.venue.VenueErrorClassifier;

class MirrorExecutionConfigTest {

    private final MirrorExecutionConfig config = new MirrorExecutionConfig();

    @Test
    void orderExecutor_usesSimulationInDryRun() {
        OrderExecutor executor = config.orderExecutor(
                CopyTradeFixtures.dryRunProperties(),
                mock(VenueClient.class),
                mock(VenueCallExecutor.class),
                new FollowerRateLimiter(Duration.ZERO)
        );

        assertThat(executor).isInstanceOf(SimulatedOrderExecutor.class);
        assertThat(executor.isSimulated()).isTrue();
    }

    @Test
    void orderExecutor_usesVenueWhenLive() {
        OrderExecutor executor = config.orderExecutor(
                CopyTradeFixtures.properties(),
                mock(VenueClient.class),
                mock(VenueCallExecutor.class),
                new FollowerRateLimiter(Duration.ZERO)
        );

        assertThat(executor).isInstanceOf(LiveOrderExecutor.class);
        assertThat(executor.isSimulated()).isFalse();
    }

    @Test
    void mirrorExecutionExecutor_startsTaskWhileCoreThreadsAreBlocked() throws Exception {
        ExecutorService executor = config.mirrorExecutionExecutor(CopyTradeFixtures.properties());
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch fastDone = new CountDownLatch(1);
        try {
            for (int i = 0; i < 2; i++) {
                executor.execute(() -> {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            executor.execute(fastDone::countDown);

            assertThat(fastDone.await(1, TimeUnit.SECONDS)).isTrue();
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void mirrorExecutionExecutor_runsTasksOnNamedThreads() throws Exception {
        ExecutorService executor = config.mirrorExecutionExecutor(CopyTradeFixtures.properties());
        try {
            String threadName = executor.submit(() -> Thread.currentThread().getName()).get();

            assertThat(threadName).startsWith("mirror-exec-");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void credentialCipher_isBuiltFromConfiguredKey() {
        CredentialCipher cipher = config.credentialCipher(new CredentialProperties("passphrase"));

        assertThat(cipher.decrypt(cipher.encrypt("secret"))).isEqualTo("secret");
    }

    @Test
    void venueCallExecutor_isCreated() {
        VenueCallExecutor executor = config.venueCallExecutor(
                new FollowerRateLimiter(Duration.ZERO),
                new VenueErrorClassifier(),
                CopyTradeFixtures.properties()
        );

        assertThat(executor.execute("follower-1", "noop", () -> "ok")).isEqualTo("ok");
    }
}

package org.nowstart.copytrade.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.copytrade.CopyTradeFixtures;
import org.nowstart.copytrade.data.dto.InstrumentMeta;
import org.nowstart.copytrade.data.dto.OrderResult;
import org.nowstart.copytrade.data.dto.OrderSpec;
import org.nowstart.copytrade.data.dto.VenueCredentials;
import org.nowstart.copytrade.data.entity.AuditEvent;
import org.nowstart.copytrade.data.entity.Follower;
import org.nowstart.copytrade.data.entity.MirrorTrade;
import org.nowstart.copytrade.data.entity.PrimaryTrade;
import org.nowstart.copytrade.data.exception.CredentialDecryptionException;
import org.nowstart.copytrade.data.exception.VenueApiException;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.data.type.TradeSide;
import org.nowstart.copytrade.repository.AuditEventRepository;
import org.nowstart.copytrade.repository.FollowerRepository;
import org.nowstart.copytrade.repository.MirrorTradeRepository;
import org.nowstart.copytrade.repository.PrimaryTradeRepository;
import org.nowstart.copytrade.service.auth.CredentialCipher;
import org.nowstart.copytrade.service.venue.FollowerRateLimiter;
import org.nowstart.copytrade.service.venue.LiveOrderExecutor;
import org.nowstart.copytrade.service.venue.OrderExecutor;
import org.nowstart.copytrade.service.venue.SimulatedOrderExecutor;
import org.nowstart.copytrade.service.venue.VenueCallExecutor;
import org.nowstart.copytrade.service.venue.VenueClient;
import org.nowstart.copytrade.service.venue.VenueErrorClassifier;

@ExtendWith(MockitoExtension.class)
class MirrorExecutionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final VenueCredentials CREDENTIALS = new VenueCredentials("api-key", "api-secret");

    @Mock
    private MirrorTradeRepository mirrorTradeRepository;
    @Mock
    private FollowerRepository followerRepository;
    @Mock
    private PrimaryTradeRepository primaryTradeRepository;
    @Mock
    private AuditEventRepository auditEventRepository;
    @Mock
    private InstrumentMetaService instrumentMetaService;
    @Mock
    private CredentialCipher credentialCipher;
    @Mock
    private VenueClient venueClient;

    private MirrorTrade mirror;
    private Follower follower;

    @BeforeEach
    void setUp() {
        mirror = CopyTradeFixtures.pendingMirror("m-1", "f-1");
        follower = CopyTradeFixtures.follower("f-1");

        lenient().when(mirrorTradeRepository.findById("m-1")).thenReturn(Optional.of(mirror));
        lenient().when(mirrorTradeRepository.save(any(MirrorTrade.class))).thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(auditEventRepository.save(any(AuditEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(followerRepository.findById("f-1")).thenReturn(Optional.of(follower));
        lenient().when(primaryTradeRepository.findById("primary-1")).thenReturn(Optional.of(CopyTradeFixtures.primaryTrade()));
        lenient().when(instrumentMetaService.get("BTCUSDT")).thenReturn(Optional.of(CopyTradeFixtures.btcMeta()));
        lenient().when(credentialCipher.decrypt(any(Follower.class))).thenReturn(CREDENTIALS);
    }

    @Test
    void execute_placesSizedOrderAndMarksExecuted() {
        when(venueClient.createOrder(eq(CREDENTIALS), any(OrderSpec.class)))
                .thenReturn(OrderResult.filled("ord-1", new BigDecimal("45000"), new BigDecimal("0.005"), 3));

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.EXECUTED);
        assertThat(result.getVenueOrderId()).isEqualTo("ord-1");

        ArgumentCaptor<OrderSpec> submitted = ArgumentCaptor.forClass(OrderSpec.class);
        verify(venueClient).createOrder(eq(CREDENTIALS), submitted.capture());
        assertThat(submitted.getValue().pair()).isEqualTo("BTCUSDT");
        assertThat(submitted.getValue().side()).isEqualTo(TradeSide.BUY);
        assertThat(submitted.getValue().quantity()).isEqualByComparingTo("0.005");
        assertThat(submitted.getValue().leverage()).isEqualTo(3);
        assertThat(submitted.getValue().stopLossPrice()).isEqualByComparingTo("44000");
        assertThat(submitted.getValue().takeProfitPrice()).isEqualByComparingTo("47000");
        assertThat(submitted.getValue().clientOrderId()).isEqualTo("m-1");
    }

    @Test
    void execute_retriesTransientVenueFailures() {
        when(venueClient.createOrder(eq(CREDENTIALS), any(OrderSpec.class)))
                .thenThrow(new VenueApiException(503, "Service Unavailable"))
                .thenThrow(new VenueApiException(503, "Service Unavailable"))
                .thenReturn(OrderResult.filled("ord-2", new BigDecimal("45000"), new BigDecimal("0.005"), 3));

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.EXECUTED);
        assertThat(result.getVenueOrderId()).isEqualTo("ord-2");
        verify(venueClient, times(3)).createOrder(eq(CREDENTIALS), any(OrderSpec.class));
    }

    @Test
    void execute_failsAfterRetriesAreExhausted() {
        when(venueClient.createOrder(eq(CREDENTIALS), any(OrderSpec.class)))
                .thenThrow(new VenueApiException(503, "Service Unavailable"));

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("Exchange unavailable (HTTP 503): Service Unavailable (after 3 attempts)");
        verify(venueClient, times(3)).createOrder(eq(CREDENTIALS), any(OrderSpec.class));
    }

    @Test
    void execute_doesNotRetryPermissionErrors() {
        when(venueClient.createOrder(eq(CREDENTIALS), any(OrderSpec.class)))
                .thenThrow(new VenueApiException(403, "Forbidden"));

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("API access forbidden - check trading permissions");
        verify(venueClient, times(1)).createOrder(eq(CREDENTIALS), any(OrderSpec.class));
    }

    @Test
    void execute_skipsVenueForLowFundFollower() {
        follower.setLowFund(true);

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo(MirrorExecutionService.LOW_FUND);
        verifyNoInteractions(venueClient, credentialCipher);
    }

    @Test
    void execute_failsForInactiveOrMissingFollower() {
        follower.setActive(false);

        MirrorTrade inactive = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(inactive.getErrorMessage()).isEqualTo(MirrorExecutionService.FOLLOWER_INACTIVE);

        MirrorTrade orphan = CopyTradeFixtures.pendingMirror("m-2", "ghost");
        when(mirrorTradeRepository.findById("m-2")).thenReturn(Optional.of(orphan));
        when(followerRepository.findById("ghost")).thenReturn(Optional.empty());

        MirrorTrade missing = liveService(CopyTradeFixtures.properties()).execute("m-2");

        assertThat(missing.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(missing.getErrorMessage()).isEqualTo(MirrorExecutionService.FOLLOWER_NOT_FOUND);
        verifyNoInteractions(venueClient);
    }

    @Test
    void execute_rejectsWhenWalletCannotCoverBufferedMargin() {
        follower.setWalletBalance(new BigDecimal("50"));

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage())
                .isEqualTo("Insufficient funds: required margin 82.50 (incl. 10% buffer) exceeds wallet balance 50.00");
        verifyNoInteractions(venueClient);
    }

    @Test
    void execute_stopsAtDailyTradeLimit() {
        follower.setMaxTradesPerDay(2);
        when(mirrorTradeRepository.countByFollowerIdAndStatusAndExecutedAtAfter(
                "f-1",
                MirrorTradeStatus.EXECUTED,
                Instant.parse("2026-03-01T00:00:00Z")
        )).thenReturn(2L);

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("Daily trade limit reached (2)");
        verifyNoInteractions(venueClient);
    }

    @Test
    void execute_rejectsLeverageAboveMaximumWhenConfigured() {
        CopyTradingProperties properties = CopyTradeFixtures.properties(false, Duration.ZERO, true, List.of(), Map.of());
        when(instrumentMetaService.get("BTCUSDT")).thenReturn(Optional.of(
                new InstrumentMeta("BTCUSDT", new BigDecimal("0.001"), new BigDecimal("0.001"), new BigDecimal("5"), 2)
        ));

        MirrorTrade result = liveService(properties).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("Leverage 3x exceeds exchange maximum 2x");
        verifyNoInteractions(venueClient);
    }

    @Test
    void execute_failsWhenPrecisionRoundingDropsBelowMinimum() {
        CopyTradingProperties properties = CopyTradeFixtures.properties(false, Duration.ZERO, false, List.of("BTCUSDT"), Map.of());

        MirrorTrade result = liveService(properties).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).startsWith("Quantity 0 is below exchange minimum 0.001");
        verifyNoInteractions(venueClient);
    }

    @Test
    void execute_failsWithoutStopLoss() {
        PrimaryTrade primary = PrimaryTrade.builder()
                .id("primary-1")
                .pair("BTCUSDT")
                .side(TradeSide.BUY)
                .price(new BigDecimal("45000"))
                .leverage(10)
                .total(new BigDecimal("2"))
                .build();
        when(primaryTradeRepository.findById("primary-1")).thenReturn(Optional.of(primary));

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).contains("no stop loss");
    }

    @Test
    void execute_failsWhenMetadataUnavailable() {
        when(instrumentMetaService.get("BTCUSDT")).thenReturn(Optional.empty());

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("Instrument metadata unavailable for BTCUSDT");
    }

    @Test
    void execute_failsWhenCredentialsCannotBeDecrypted() {
        when(credentialCipher.decrypt(any(Follower.class))).thenThrow(new CredentialDecryptionException("Failed to decrypt credential"));

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("Failed to decrypt credential");
        verifyNoInteractions(venueClient);
    }

    @Test
    void execute_dryRunFillsWithoutCredentialsOrVenue() {
        Random random = mock(Random.class);
        when(random.nextDouble()).thenReturn(0.1);
        CopyTradingProperties properties = CopyTradeFixtures.dryRunProperties();
        OrderExecutor simulated = new SimulatedOrderExecutor(
                new FollowerRateLimiter(Duration.ZERO),
                random,
                properties.dryRunSuccessRate()
        );

        MirrorTrade result = service(properties, simulated).execute("m-1");

        assertThat(result.getStatus()).isEqualTo(MirrorTradeStatus.EXECUTED);
        assertThat(result.getVenueOrderId()).startsWith(SimulatedOrderExecutor.ORDER_ID_PREFIX);
        assertThat(result.getExecutedQuantity()).isEqualByComparingTo("0.005");
        verifyNoInteractions(venueClient, credentialCipher);
    }

    @Test
    void execute_ignoresMirrorThatIsNoLongerPending() {
        mirror.setStatus(MirrorTradeStatus.EXECUTED);

        MirrorTrade result = liveService(CopyTradeFixtures.properties()).execute("m-1");

        assertThat(result).isSameAs(mirror);
        verify(followerRepository, never()).findById(anyString());
        verify(mirrorTradeRepository, never()).save(any());
    }

    private MirrorExecutionService liveService(CopyTradingProperties properties) {
        VenueCallExecutor venueCallExecutor = new VenueCallExecutor(
                new FollowerRateLimiter(properties.minApiInterval()),
                new VenueErrorClassifier(),
                properties
        );
        return service(properties, new LiveOrderExecutor(venueClient, venueCallExecutor));
    }

    private MirrorExecutionService service(CopyTradingProperties properties, OrderExecutor orderExecutor) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new MirrorExecutionService(
                mirrorTradeRepository,
                followerRepository,
                primaryTradeRepository,
                instrumentMetaService,
                new PositionSizingService(instrumentMetaService),
                new QuantityPrecisionService(properties),
                credentialCipher,
                orderExecutor,
                new MirrorTradeStateMachine(mirrorTradeRepository, auditEventRepository, clock),
                properties,
                clock
        );
    }
}

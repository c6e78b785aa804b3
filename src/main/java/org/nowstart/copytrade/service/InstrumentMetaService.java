package org.nowstart.copytrade.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.dto.InstrumentMeta;
import org.nowstart.copytrade.data.exception.VenueCallException;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.nowstart.copytrade.service.venue.VenueCallExecutor;
import org.nowstart.copytrade.service.venue.VenueClient;
import org.springframework.stereotype.Service;

/**
 * Read-through cache of instrument constraints. Concurrent lookups of the same pair share one venue call.
 * Failed lookups and fallback-shaped metadata are not cached.
 */
@Slf4j
@Service
public class InstrumentMetaService {

    static final String PUBLIC_CALLER = "public";

    private final VenueClient venueClient;
    private final VenueCallExecutor venueCallExecutor;
    private final Cache<String, InstrumentMeta> cache;

    public InstrumentMetaService(
            VenueClient venueClient,
            VenueCallExecutor venueCallExecutor,
            CopyTradingProperties copyTradingProperties,
            Clock clock
    ) {
        this.venueClient = venueClient;
        this.venueCallExecutor = venueCallExecutor;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(copyTradingProperties.instrumentCacheTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    public Optional<InstrumentMeta> get(String pair) {
        return Optional.ofNullable(cache.get(normalize(pair), this::load));
    }

    public void evict(String pair) {
        cache.invalidate(normalize(pair));
    }

    // null keeps the pair out of the cache
    private InstrumentMeta load(String pair) {
        InstrumentMeta meta;
        try {
            meta = venueCallExecutor.execute(PUBLIC_CALLER, "instrument_meta", () -> venueClient.getInstrumentMeta(pair));
        } catch (VenueCallException e) {
            log.warn("event=instrument_meta_unavailable pair={} reason={}", pair, e.getMessage());
            return null;
        }

        if (meta == null || meta.looksLikeFallback()) {
            log.warn("event=instrument_meta_unavailable pair={} reason=fallback_defaults", pair);
            return null;
        }

        log.info(
                "event=instrument_meta_loaded pair={} step={} min_qty={} min_notional={} max_leverage={}",
                pair,
                meta.stepSize(),
                meta.minQty(),
                meta.minNotional(),
                meta.maxLeverage()
        );
        return meta;
    }

    private String normalize(String pair) {
        return pair == null ? "" : pair.trim().toUpperCase(Locale.ROOT);
    }
}

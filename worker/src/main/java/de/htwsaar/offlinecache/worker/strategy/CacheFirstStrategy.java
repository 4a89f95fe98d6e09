package de.htwsaar.offlinecache.worker.strategy;

import de.htwsaar.offlinecache.worker.classify.StrategyTag;
import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.NetworkClient;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import de.htwsaar.offlinecache.worker.domain.Resolution;
import de.htwsaar.offlinecache.worker.store.CacheEntry;
import de.htwsaar.offlinecache.worker.store.CachePartition;
import de.htwsaar.offlinecache.worker.store.LogicalPartition;
import de.htwsaar.offlinecache.worker.store.StoreManager;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cache-First für statische Assets (Partition {@code static}).
 *
 * <p>Treffer werden ohne Netzwerk ausgeliefert. Bei einem Miss wird geladen und jede Antwort mit
 * Status {@code [200, 400)} gespeichert, versehen mit {@code sw-cached-at} und
 * {@code sw-cache-version}. Fällt das Netzwerk aus, wird die Partition erneut befragt; ohne
 * Eintrag folgt eine synthetische {@code 503 text/plain}.</p>
 */
@Component
public class CacheFirstStrategy implements StrategyExecutor {

    private static final Logger log = LoggerFactory.getLogger(CacheFirstStrategy.class);

    private final StoreManager storeManager;
    private final NetworkClient networkClient;
    private final CacheEngineConfig config;
    private final Clock clock;

    /**
     * Erstellt die Strategie mit Constructor Injection.
     *
     * @param storeManager  Besitzer der Partitionen
     * @param networkClient Port zum Netzwerk
     * @param config        Engine-Konfiguration (Versionskennung)
     * @param clock         Zeitquelle
     */
    public CacheFirstStrategy(
            StoreManager storeManager, NetworkClient networkClient, CacheEngineConfig config, Clock clock) {
        this.storeManager = Objects.requireNonNull(storeManager, "storeManager must not be null");
        this.networkClient = Objects.requireNonNull(networkClient, "networkClient must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public StrategyTag tag() {
        return StrategyTag.CACHE_FIRST;
    }

    @Override
    public CompletableFuture<Resolution> handle(InterceptedRequest request) {
        RequestKey key = request.key();
        CachePartition partition = storeManager.openPartition(LogicalPartition.STATIC);

        Optional<CacheEntry> cached = storeManager.get(partition, key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key.url());
            return CompletableFuture.completedFuture(Resolution.hit(cached.get().response()));
        }

        log.debug("Cache miss, fetching: {}", key.url());
        return NetworkCalls.fetch(networkClient, request).handle((response, ex) -> ex == null
                ? onResponse(partition, key, response)
                : onFailure(key, NetworkCalls.unwrap(ex)));
    }

    private Resolution onResponse(CachePartition partition, RequestKey key, CapturedResponse response) {
        if (!response.isCacheable()) {
            return Resolution.miss(response);
        }
        Instant now = clock.instant();
        CapturedResponse stamped = response
                .withHeader(CacheHeaders.CACHED_AT, Long.toString(now.toEpochMilli()))
                .withHeader(CacheHeaders.CACHE_VERSION, config.version());
        storeManager.put(partition, key, stamped, now);
        return Resolution.miss(stamped);
    }

    private Resolution onFailure(RequestKey key, Throwable cause) {
        log.info("Network failed for {} ({}), trying static cache", key.url(), cause.getMessage());
        Optional<CacheEntry> fallback = storeManager.get(storeManager.openPartition(LogicalPartition.STATIC), key);
        if (fallback.isPresent()) {
            return Resolution.staleFallback(fallback.get().response());
        }
        return Resolution.offline(OfflineResponses.resourceUnavailable());
    }
}

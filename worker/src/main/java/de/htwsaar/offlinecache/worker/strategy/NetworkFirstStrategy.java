package de.htwsaar.offlinecache.worker.strategy;

import de.htwsaar.offlinecache.worker.classify.StrategyTag;
import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.NetworkClient;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import de.htwsaar.offlinecache.worker.domain.Resolution;
import de.htwsaar.offlinecache.worker.expiration.ExpirationPolicy;
import de.htwsaar.offlinecache.worker.store.CacheEntry;
import de.htwsaar.offlinecache.worker.store.CachePartition;
import de.htwsaar.offlinecache.worker.store.LogicalPartition;
import de.htwsaar.offlinecache.worker.store.StoreManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Network-First für API-Aufrufe (Partition {@code api}).
 *
 * <p>2xx-Antworten werden mit {@code sw-cached-at} gespeichert; andere Status gehen ungespeichert
 * durch. Nur bei Transportfehler (oder Timeout, falls konfiguriert) greift der Cache, und nur,
 * solange der Eintrag laut {@link ExpirationPolicy} nicht abgelaufen ist.</p>
 */
@Component
public class NetworkFirstStrategy implements StrategyExecutor {

    private static final Logger log = LoggerFactory.getLogger(NetworkFirstStrategy.class);

    private final StoreManager storeManager;
    private final NetworkClient networkClient;
    private final ExpirationPolicy expirationPolicy;
    private final Duration timeout;
    private final Clock clock;

    /**
     * Erstellt die Strategie mit Constructor Injection.
     *
     * @param storeManager     Besitzer der Partitionen
     * @param networkClient    Port zum Netzwerk
     * @param expirationPolicy Altersprüfung für den Offline-Fallback
     * @param config           Engine-Konfiguration (Timeout)
     * @param clock            Zeitquelle
     */
    public NetworkFirstStrategy(
            StoreManager storeManager,
            NetworkClient networkClient,
            ExpirationPolicy expirationPolicy,
            CacheEngineConfig config,
            Clock clock) {
        this.storeManager = Objects.requireNonNull(storeManager, "storeManager must not be null");
        this.networkClient = Objects.requireNonNull(networkClient, "networkClient must not be null");
        this.expirationPolicy = Objects.requireNonNull(expirationPolicy, "expirationPolicy must not be null");
        this.timeout = Objects.requireNonNull(config, "config must not be null").networkFirstTimeout();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public StrategyTag tag() {
        return StrategyTag.NETWORK_FIRST;
    }

    @Override
    public CompletableFuture<Resolution> handle(InterceptedRequest request) {
        RequestKey key = request.key();
        log.debug("Network first: {}", key.url());

        CompletableFuture<CapturedResponse> fetch = NetworkCalls.fetch(networkClient, request);
        if (!timeout.isZero()) {
            // the underlying exchange keeps running; only this resolution stops waiting
            fetch = fetch.copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return fetch.handle((response, ex) -> ex == null
                ? onResponse(key, response)
                : onFailure(key, NetworkCalls.unwrap(ex)));
    }

    private Resolution onResponse(RequestKey key, CapturedResponse response) {
        if (!response.isOk()) {
            return Resolution.miss(response);
        }
        Instant now = clock.instant();
        CapturedResponse stamped = response.withHeader(CacheHeaders.CACHED_AT, Long.toString(now.toEpochMilli()));
        storeManager.put(storeManager.openPartition(LogicalPartition.API), key, stamped, now);
        return Resolution.miss(stamped);
    }

    private Resolution onFailure(RequestKey key, Throwable cause) {
        log.info("Network failed for {} ({}), trying api cache", key.url(), cause.toString());
        Instant now = clock.instant();
        CachePartition partition = storeManager.openPartition(LogicalPartition.API);
        Optional<CacheEntry> cached = storeManager.get(partition, key);
        if (cached.isPresent() && !expirationPolicy.isExpired(cached.get(), now)) {
            return Resolution.staleFallback(cached.get().response());
        }
        if (cached.isPresent()) {
            log.debug("Cached entry for {} expired, answering offline", key.url());
        }
        return Resolution.offline(OfflineResponses.dataUnavailable(now));
    }
}

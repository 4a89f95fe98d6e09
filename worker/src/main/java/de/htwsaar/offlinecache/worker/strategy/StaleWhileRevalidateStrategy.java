package de.htwsaar.offlinecache.worker.strategy;

import de.htwsaar.offlinecache.worker.classify.StrategyTag;
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
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stale-While-Revalidate für Seiten (Partition {@code dynamic}).
 *
 * <p>Jede Anfrage startet eine Hintergrund-Revalidierung, deren 2xx-Ergebnis den Eintrag ersetzt.
 * Ein vorhandener Eintrag wird sofort geliefert, ohne auf das Netzwerk zu warten.</p>
 */
@Component
public class StaleWhileRevalidateStrategy implements StrategyExecutor {

    private static final Logger log = LoggerFactory.getLogger(StaleWhileRevalidateStrategy.class);

    private final StoreManager storeManager;
    private final NetworkClient networkClient;
    private final Clock clock;

    public StaleWhileRevalidateStrategy(StoreManager storeManager, NetworkClient networkClient, Clock clock) {
        this.storeManager = Objects.requireNonNull(storeManager, "storeManager must not be null");
        this.networkClient = Objects.requireNonNull(networkClient, "networkClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public StrategyTag tag() {
        return StrategyTag.STALE_WHILE_REVALIDATE;
    }

    @Override
    public CompletableFuture<Resolution> handle(InterceptedRequest request) {
        RequestKey key = request.key();
        CachePartition partition = storeManager.openPartition(LogicalPartition.DYNAMIC);
        Optional<CacheEntry> cached = storeManager.get(partition, key);

        CompletableFuture<CapturedResponse> revalidation = revalidate(partition, request);

        if (cached.isPresent()) {
            log.debug("Stale cache hit: {}", key.url());
            return CompletableFuture.completedFuture(Resolution.hit(cached.get().response()));
        }

        log.debug("No cache, waiting for network: {}", key.url());
        return revalidation.handle((response, ex) -> {
            if (ex == null) return Resolution.miss(response);
            return storeManager.get(storeManager.openPartition(LogicalPartition.DYNAMIC), key)
                    .map(entry -> Resolution.staleFallback(entry.response()))
                    .orElseGet(() -> Resolution.offline(OfflineResponses.serviceUnavailable()));
        });
    }

    private CompletableFuture<CapturedResponse> revalidate(CachePartition partition, InterceptedRequest request) {
        RequestKey key = request.key();
        return NetworkCalls.fetch(networkClient, request).whenComplete((response, ex) -> {
            if (ex != null) {
                log.warn("Network failed for {}: {}", key.url(), NetworkCalls.unwrap(ex).toString());
                return;
            }
            if (response.isOk()) {
                storeManager.put(partition, key, response, clock.instant());
            } else if (response.status() == 401 && key.url().contains("manifest.json")) {
                log.warn("manifest.json answered 401, check the deploy configuration");
            }
        });
    }
}

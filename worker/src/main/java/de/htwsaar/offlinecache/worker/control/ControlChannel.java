package de.htwsaar.offlinecache.worker.control;

import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.dto.ControlMessageType;
import de.htwsaar.offlinecache.worker.lifecycle.WorkerLifecycle;
import de.htwsaar.offlinecache.worker.store.CacheStats;
import de.htwsaar.offlinecache.worker.store.LogicalPartition;
import de.htwsaar.offlinecache.worker.store.StoreManager;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Führt Kommandos des Hosts aus und baut die Antwort {@code <KOMMANDO>_RESPONSE}.
 *
 * <p>Die Antwort geht ausschließlich an den Absender zurück; das Future wird asynchron erfüllt.</p>
 */
@Service
public class ControlChannel implements ControlCommand.Handler<CompletableFuture<ControlEnvelope>> {

    private static final Logger log = LoggerFactory.getLogger(ControlChannel.class);

    private final StoreManager storeManager;
    private final WorkerLifecycle lifecycle;

    /**
     * Erstellt den Channel mit Constructor Injection.
     *
     * @param storeManager Besitzer der Partitionen
     * @param lifecycle    Zustandsautomat (für {@code SKIP_WAITING})
     */
    public ControlChannel(StoreManager storeManager, WorkerLifecycle lifecycle) {
        this.storeManager = Objects.requireNonNull(storeManager, "storeManager must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
    }

    /**
     * Parst und führt eine Nachricht aus.
     *
     * @param envelope eingehende Nachricht
     * @return Future der Antwort
     * @throws ControlMessageException bei unbekanntem oder fehlerhaftem Kommando
     */
    public CompletableFuture<ControlEnvelope> handle(ControlEnvelope envelope) {
        return handle(ControlCommand.parse(envelope));
    }

    public CompletableFuture<ControlEnvelope> handle(ControlCommand command) {
        log.debug("Control message {}", command.type());
        return command.accept(this);
    }

    @Override
    public CompletableFuture<ControlEnvelope> onCacheStats(ControlCommand.CacheStats command) {
        CacheStats stats = storeManager.stats();
        Map<String, Object> caches = new LinkedHashMap<>();
        stats.caches().forEach((name, partition) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("count", partition.count());
            entry.put("urls", partition.urls());
            caches.put(name, entry);
        });

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("caches", caches);
        payload.put("totalCaches", stats.totalCaches());
        payload.put("totalEntries", stats.totalEntries());
        return reply(command.type(), payload);
    }

    @Override
    public CompletableFuture<ControlEnvelope> onClearCache(ControlCommand.ClearCache command) {
        int cleared = storeManager.clearManaged();
        return reply(command.type(), Map.of("cleared", cleared));
    }

    @Override
    public CompletableFuture<ControlEnvelope> onPrecacheUrls(ControlCommand.PrecacheUrls command) {
        return storeManager
                .precache(storeManager.openPartition(LogicalPartition.DYNAMIC), command.urls())
                .thenApply(result -> {
                    if (!result.isComplete()) {
                        log.info("Precache via control channel skipped {}", result.failed());
                    }
                    return ControlEnvelope.response(command.type(), Map.of("cached", result.succeeded()));
                });
    }

    @Override
    public CompletableFuture<ControlEnvelope> onSkipWaiting(ControlCommand.SkipWaiting command) {
        return reply(command.type(), Map.of("state", lifecycle.skipWaiting().name()));
    }

    private static CompletableFuture<ControlEnvelope> reply(ControlMessageType type, Map<String, Object> payload) {
        return CompletableFuture.completedFuture(ControlEnvelope.response(type, payload));
    }
}

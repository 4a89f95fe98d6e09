package de.htwsaar.offlinecache.worker.lifecycle;

import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.store.LogicalPartition;
import de.htwsaar.offlinecache.worker.store.PrecacheResult;
import de.htwsaar.offlinecache.worker.store.StoreManager;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Zustandsautomat des Workers: Installation (Precache), Warten, Aktivierung (Purge + Übernahme).
 *
 * <p>Übergänge: {@code UNINSTALLED → INSTALLING → INSTALLED → ACTIVATING → ACTIVE}; eine strikte
 * Installation mit Fehlern endet in {@code REDUNDANT}. Erst im Zustand {@code ACTIVE} greifen die
 * Strategien; vorher reicht der Dispatcher alles ans Netzwerk durch.</p>
 */
@Service
public class WorkerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycle.class);

    private final CacheEngineConfig config;
    private final StoreManager storeManager;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.UNINSTALLED);

    /**
     * Erstellt den Lebenszyklus mit Constructor Injection.
     *
     * @param config       Engine-Konfiguration (Manifest, Version, Modi)
     * @param storeManager Besitzer der Partitionen
     */
    public WorkerLifecycle(CacheEngineConfig config, StoreManager storeManager) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.storeManager = Objects.requireNonNull(storeManager, "storeManager must not be null");
    }

    public WorkerState state() {
        return state.get();
    }

    /** {@code true}, sobald der Worker aktiv ist und alle Anfragen kontrolliert. */
    public boolean controlsClients() {
        return state.get() == WorkerState.ACTIVE;
    }

    /**
     * Installiert den Worker: cacht das Precache-Manifest in die Partition {@code static}.
     *
     * <p>Lenient (Standard): Fehler einzelner URLs werden geloggt, der Worker wird trotzdem
     * {@code INSTALLED}. Strikt: jeder Fehler führt zu {@code REDUNDANT} und das Future schlägt mit
     * {@link InstallationFailedException} fehl.</p>
     *
     * @return Future mit dem Precache-Ergebnis
     * @throws IllegalStateException wenn der Worker nicht im Zustand {@code UNINSTALLED} ist
     */
    public CompletableFuture<PrecacheResult> install() {
        if (!state.compareAndSet(WorkerState.UNINSTALLED, WorkerState.INSTALLING)) {
            throw new IllegalStateException("Cannot install worker in state " + state.get());
        }
        log.info("Installing worker version {}", config.version());

        return storeManager
                .precache(storeManager.openPartition(LogicalPartition.STATIC), config.precacheManifest())
                .thenApply(result -> {
                    if (!result.isComplete()) {
                        if (config.strictInstall()) {
                            state.set(WorkerState.REDUNDANT);
                            log.error("Installation failed, precache incomplete: {}", result.failed());
                            throw new InstallationFailedException(result.failed());
                        }
                        log.warn("Precache incomplete, continuing without: {}", result.failed());
                    }
                    state.set(WorkerState.INSTALLED);
                    log.info("Worker installed, {} URLs precached", result.succeeded().size());
                    return result;
                });
    }

    /**
     * Aktiviert einen installierten Worker: löscht Partitionen anderer Versionen, legt die
     * aktuellen Partitionen an und übernimmt alle Clients. Ohne Wirkung, wenn bereits aktiv.
     *
     * @return gelöschte Partitionsnamen
     * @throws IllegalStateException wenn der Worker weder installiert noch aktiv ist
     */
    public List<String> activate() {
        if (state.get() == WorkerState.ACTIVE) return List.of();
        if (!state.compareAndSet(WorkerState.INSTALLED, WorkerState.ACTIVATING)) {
            throw new IllegalStateException("Cannot activate worker in state " + state.get());
        }
        log.info("Activating worker version {}", config.version());

        List<String> purged = storeManager.purgeObsolete(config.version());
        for (LogicalPartition partition : LogicalPartition.values()) {
            storeManager.openPartition(partition);
        }
        state.set(WorkerState.ACTIVE);
        log.info("Worker active, controlling all clients ({} obsolete partitions removed)", purged.size());
        return purged;
    }

    /**
     * Verlässt den Wartezustand sofort. Im Zustand {@code ACTIVE} ohne Wirkung.
     *
     * @return Zustand nach dem Aufruf
     */
    public WorkerState skipWaiting() {
        if (state.get() == WorkerState.INSTALLED) {
            activate();
        } else {
            log.debug("Skip waiting ignored in state {}", state.get());
        }
        return state.get();
    }

    /**
     * Installiert und aktiviert (bei Skip-Waiting) den Worker.
     *
     * @return Future mit dem Zustand nach dem Start
     */
    public CompletableFuture<WorkerState> start() {
        return install().thenApply(result -> {
            if (config.skipWaiting()) {
                activate();
            } else {
                log.info("Worker waiting for SKIP_WAITING");
            }
            return state.get();
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start().whenComplete((s, ex) -> {
            if (ex != null) {
                log.error("Worker startup failed, requests pass through to the network", ex);
            }
        });
    }
}

package de.htwsaar.offlinecache.worker.store;

import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.NetworkClient;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Einziger Besitzer der Cache-Partitionen: anlegen, schreiben, precachen, veraltete Versionen löschen.
 *
 * <p>Strategien leihen sich Partitionen nur für die Dauer einer Anfrage. Ein abgelehnter
 * Schreibvorgang ({@link QuotaExceededException}) wird hier abgefangen und als {@code false}
 * gemeldet; die Anfrage liefert trotzdem die bereits geladene Netzwerk-Antwort aus.</p>
 */
@Service
public class StoreManager {

    private static final Logger log = LoggerFactory.getLogger(StoreManager.class);

    private final CacheEngineConfig config;
    private final CacheStorage storage;
    private final NetworkClient networkClient;
    private final Clock clock;

    /**
     * Erstellt den Service mit Constructor Injection.
     *
     * @param config        Engine-Konfiguration (Präfix, Version, Serving-Origin)
     * @param storage       Storage-Substrat
     * @param networkClient Port zum Netzwerk (für Precache)
     * @param clock         Zeitquelle
     */
    public StoreManager(CacheEngineConfig config, CacheStorage storage, NetworkClient networkClient, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.networkClient = Objects.requireNonNull(networkClient, "networkClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Öffnet die aktuelle Version einer verwalteten Partition; legt sie bei Bedarf an.
     *
     * @param partition logische Partition
     * @return Partition der aktuellen Version
     */
    public CachePartition openPartition(LogicalPartition partition) {
        return storage.open(currentName(partition).physicalName());
    }

    /**
     * @param partition logische Partition
     * @return physischer Name der aktuellen Version, z. B. {@code offline-static-v1.0.1}
     */
    public PartitionName currentName(LogicalPartition partition) {
        return PartitionName.of(config.cachePrefix(), partition, config.version());
    }

    /**
     * Löscht alle verwalteten Partitionen, deren Version von {@code currentVersion} abweicht.
     * Partitionen mit fremdem Namen bleiben unberührt.
     *
     * @param currentVersion aktuelle Versionskennung
     * @return gelöschte physische Namen
     */
    public List<String> purgeObsolete(String currentVersion) {
        List<String> purged = new ArrayList<>();
        for (String name : storage.names()) {
            Optional<PartitionName> parsed = PartitionName.parse(name, config.cachePrefix());
            if (parsed.isEmpty() || !parsed.get().isManaged()) continue;
            if (parsed.get().version().equals(currentVersion)) continue;
            if (storage.delete(name)) {
                log.info("Purged obsolete cache partition {}", name);
                purged.add(name);
            }
        }
        return purged;
    }

    /**
     * @param partition geliehene Partition
     * @param key       Anfrage-Identität
     * @return Eintrag oder leer (Cache-Miss)
     */
    public Optional<CacheEntry> get(CachePartition partition, RequestKey key) {
        return partition.match(key);
    }

    /**
     * Schreibt eine Antwort (überschreibt vorhandene Einträge).
     *
     * @param partition geliehene Partition
     * @param key       Anfrage-Identität
     * @param response  Antwort
     * @param storedAt  Schreibzeitpunkt
     * @return {@code true}, wenn der Eintrag gespeichert wurde
     */
    public boolean put(CachePartition partition, RequestKey key, CapturedResponse response, Instant storedAt) {
        try {
            boolean written = partition.put(key, response, storedAt, config.version()).isPresent();
            if (!written) {
                log.debug("Skipped write to deleted partition {} for {}", partition.name(), key.url());
            }
            return written;
        } catch (QuotaExceededException ex) {
            log.warn("Cache write rejected for {} in {}: {}", key.url(), partition.name(), ex.getMessage());
            return false;
        }
    }

    /**
     * Lädt alle URLs parallel und speichert 2xx-Antworten. Fehler werden gesammelt, nie geworfen.
     *
     * @param partition Zielpartition
     * @param urls      wurzelrelative oder absolute URLs
     * @return Future mit erfolgreichen und fehlgeschlagenen URLs (Eingabereihenfolge)
     */
    public CompletableFuture<PrecacheResult> precache(CachePartition partition, List<String> urls) {
        List<String> input = urls == null ? List.of() : List.copyOf(urls);
        List<CompletableFuture<Boolean>> outcomes = new ArrayList<>(input.size());
        for (String url : input) {
            outcomes.add(precacheOne(partition, url));
        }

        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0])).thenApply(ignored -> {
            List<String> succeeded = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            for (int i = 0; i < input.size(); i++) {
                if (outcomes.get(i).join()) succeeded.add(input.get(i));
                else failed.add(input.get(i));
            }
            log.info("Precached {} of {} URLs into {}", succeeded.size(), input.size(), partition.name());
            return new PrecacheResult(succeeded, failed);
        });
    }

    /**
     * Statistik aller Partitionen im Storage (verwaltete und fremde). Ohne Seiteneffekte.
     *
     * @return Momentaufnahme
     */
    public CacheStats stats() {
        Map<String, CacheStats.PartitionStats> caches = new LinkedHashMap<>();
        int totalEntries = 0;
        for (String name : storage.names()) {
            Optional<CachePartition> partition = storage.find(name);
            if (partition.isEmpty()) continue;
            List<String> urls = partition.get().keys().stream().map(RequestKey::url).toList();
            caches.put(name, new CacheStats.PartitionStats(urls.size(), urls));
            totalEntries += urls.size();
        }
        return new CacheStats(caches, caches.size(), totalEntries);
    }

    /**
     * Löscht alle verwalteten Partitionen, unabhängig von ihrer Version. Idempotent.
     *
     * @return Anzahl gelöschter Partitionen
     */
    public int clearManaged() {
        int cleared = 0;
        for (String name : storage.names()) {
            Optional<PartitionName> parsed = PartitionName.parse(name, config.cachePrefix());
            if (parsed.isEmpty() || !parsed.get().isManaged()) continue;
            if (storage.delete(name)) cleared++;
        }
        log.info("Cleared {} cache partitions", cleared);
        return cleared;
    }

    /**
     * @return physische Namen aller Partitionen im Storage, in Anlage-Reihenfolge
     */
    public List<String> partitionNames() {
        return storage.names();
    }

    /**
     * @return gemeinsames Byte-Kontingent des Storages (belegte und maximale Bytes)
     */
    public StorageQuota quota() {
        return storage.quota();
    }

    /**
     * Übernimmt eine Partition, die nicht von dieser Engine angelegt wurde (fremder Code oder
     * Vorgängerversion). Der Name wird unverändert verwendet.
     *
     * @param physicalName physischer Name
     * @return vorhandene oder neu angelegte Partition
     */
    public CachePartition registerForeign(String physicalName) {
        CachePartition partition = storage.open(physicalName);
        log.debug("Registered partition {}", physicalName);
        return partition;
    }

    private CompletableFuture<Boolean> precacheOne(CachePartition partition, String url) {
        final URI uri;
        try {
            uri = config.resolve(url);
        } catch (IllegalArgumentException | NullPointerException ex) {
            log.warn("Skipping invalid precache URL {}", url);
            return CompletableFuture.completedFuture(false);
        }

        CompletableFuture<CapturedResponse> fetch;
        try {
            fetch = networkClient.fetch(InterceptedRequest.get(uri));
        } catch (RuntimeException ex) {
            fetch = CompletableFuture.failedFuture(ex);
        }

        return fetch.handle((response, ex) -> {
            if (ex != null) {
                log.warn("Precache fetch failed for {}: {}", url, ex.getMessage());
                return false;
            }
            if (!response.isOk()) {
                log.warn("Precache of {} answered {}", url, response.status());
                return false;
            }
            return put(partition, RequestKey.get(uri), response, clock.instant());
        });
    }
}

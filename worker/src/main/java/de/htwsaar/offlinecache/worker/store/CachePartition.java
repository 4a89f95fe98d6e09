package de.htwsaar.offlinecache.worker.store;

import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Eine benannte Partition des Storages: Schlüssel → unveränderlicher {@link CacheEntry}.
 *
 * <p>Thread-Safety: {@link ConcurrentHashMap}; ein Schreibvorgang ersetzt einen Eintrag atomar
 * (last write wins). Schreibvorgänge teilen sich das Read-Lock, {@link #drop()} hält das
 * Write-Lock: nach dem Löschen ist kein Byte mehr im Kontingent gebucht.</p>
 */
public final class CachePartition {

    private final String name;
    private final StorageQuota quota;
    private final ConcurrentMap<RequestKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ReadWriteLock dropLock = new ReentrantReadWriteLock();
    private boolean dropped;

    /**
     * @param name  physischer Partitionsname
     * @param quota gemeinsames Byte-Kontingent des Storages
     */
    CachePartition(String name, StorageQuota quota) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.quota = Objects.requireNonNull(quota, "quota must not be null");
    }

    public String name() {
        return name;
    }

    /**
     * @param key Anfrage-Identität
     * @return Eintrag oder leer (Cache-Miss)
     */
    public Optional<CacheEntry> match(RequestKey key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Schreibt einen Eintrag (Überschreiben erlaubt).
     *
     * <p>{@code storedAt} ist je Schlüssel monoton: liegt der neue Zeitpunkt vor dem des
     * vorhandenen Eintrags, wird der vorhandene übernommen.</p>
     *
     * @param key      Anfrage-Identität
     * @param response Antwort
     * @param storedAt Schreibzeitpunkt
     * @param version  Versionskennung
     * @return geschriebener Eintrag oder leer, wenn die Partition bereits gelöscht wurde
     * @throws QuotaExceededException wenn das Kontingent den Eintrag nicht aufnehmen kann
     */
    Optional<CacheEntry> put(RequestKey key, CapturedResponse response, Instant storedAt, String version) {
        dropLock.readLock().lock();
        try {
            if (dropped) return Optional.empty();
            CacheEntry written = entries.compute(key, (k, existing) -> {
                Instant effective = existing != null && existing.storedAt().isAfter(storedAt)
                        ? existing.storedAt()
                        : storedAt;
                CacheEntry next = new CacheEntry(k, response, effective, version);
                long freed = existing == null ? 0 : existing.sizeBytes();
                quota.adjust(next.sizeBytes() - freed);
                return next;
            });
            return Optional.of(written);
        } finally {
            dropLock.readLock().unlock();
        }
    }

    /** Schlüssel in stabiler Reihenfolge (nach URL, dann Methode). */
    public List<RequestKey> keys() {
        List<RequestKey> keys = new ArrayList<>(entries.keySet());
        keys.sort(Comparator.comparing(RequestKey::url).thenComparing(RequestKey::method));
        return keys;
    }

    public int size() {
        return entries.size();
    }

    /** Gibt alle Bytes frei und verhindert weitere Schreibvorgänge über alte Referenzen. */
    void drop() {
        dropLock.writeLock().lock();
        try {
            dropped = true;
            entries.values().forEach(e -> quota.release(e.sizeBytes()));
            entries.clear();
        } finally {
            dropLock.writeLock().unlock();
        }
    }
}

package de.htwsaar.offlinecache.worker.store;

import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Unveränderlicher Cache-Eintrag. Wird nur als Ganzes ersetzt.
 *
 * @param key      normalisierte Anfrage-Identität
 * @param response gespeicherte Antwort
 * @param storedAt Schreibzeitpunkt
 * @param version  Versionskennung der besitzenden Partition
 */
public record CacheEntry(RequestKey key, CapturedResponse response, Instant storedAt, String version) {

    public CacheEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(storedAt, "storedAt must not be null");
        Objects.requireNonNull(version, "version must not be null");
    }

    /** Belegte Bytes im Kontingent (nur Body). */
    public long sizeBytes() {
        return response.bodyLength();
    }

    public Duration ageAt(Instant now) {
        return Duration.between(storedAt, now);
    }
}

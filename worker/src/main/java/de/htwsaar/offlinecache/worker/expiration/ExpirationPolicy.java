package de.htwsaar.offlinecache.worker.expiration;

import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.store.CacheEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Altersprüfung für Cache-Einträge.
 *
 * <p>Ein Eintrag ist abgelaufen, wenn {@code now - storedAt > ttl}. Genau an der Grenze gilt er
 * noch als frisch. Wird nur von Network-First herangezogen.</p>
 */
@Component
public class ExpirationPolicy {

    private final Duration defaultTtl;

    public ExpirationPolicy(CacheEngineConfig config) {
        this.defaultTtl = Objects.requireNonNull(config, "config must not be null").networkFirstTtl();
    }

    /**
     * @param entry Cache-Eintrag
     * @param now   aktueller Zeitpunkt
     * @return {@code true}, wenn der Eintrag älter als die Standard-TTL ist
     */
    public boolean isExpired(CacheEntry entry, Instant now) {
        return isExpired(entry, now, defaultTtl);
    }

    /**
     * @param entry Cache-Eintrag
     * @param now   aktueller Zeitpunkt
     * @param ttl   maximales Alter
     * @return {@code true}, wenn {@code now - storedAt > ttl}
     */
    public boolean isExpired(CacheEntry entry, Instant now, Duration ttl) {
        Objects.requireNonNull(entry, "entry must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        return entry.ageAt(now).compareTo(ttl) > 0;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }
}

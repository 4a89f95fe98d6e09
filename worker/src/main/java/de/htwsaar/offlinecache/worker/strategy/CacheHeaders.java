package de.htwsaar.offlinecache.worker.strategy;

/**
 * Informative Header, die beim Cachen an die gespeicherte Antwort angehängt werden.
 */
public final class CacheHeaders {

    /** Schreibzeitpunkt in Epoch-Millis. */
    public static final String CACHED_AT = "sw-cached-at";

    /** Versionskennung der Engine (nur Cache-First). */
    public static final String CACHE_VERSION = "sw-cache-version";

    private CacheHeaders() {}
}

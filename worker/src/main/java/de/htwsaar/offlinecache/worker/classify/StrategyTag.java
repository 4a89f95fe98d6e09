package de.htwsaar.offlinecache.worker.classify;

/**
 * Strategie, mit der eine Anfrage aufgelöst wird. Wird pro Anfrage neu bestimmt, nie gespeichert.
 */
public enum StrategyTag {
    CACHE_FIRST("cache-first"),
    NETWORK_FIRST("network-first"),
    STALE_WHILE_REVALIDATE("stale-while-revalidate"),
    NETWORK_ONLY("network-only");

    private final String wireName;

    StrategyTag(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

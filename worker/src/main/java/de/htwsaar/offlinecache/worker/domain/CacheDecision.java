package de.htwsaar.offlinecache.worker.domain;

/**
 * Fachliche Entscheidung, woher eine Antwort stammt.
 */
public enum CacheDecision {
    /** direkt aus dem Cache, ohne Netzwerk */
    HIT,
    /** vom Netzwerk (ggf. anschließend gecacht) */
    MISS,
    /** Netzwerk fehlgeschlagen, Cache-Eintrag als Ersatz */
    STALE_FALLBACK,
    /** Netzwerk fehlgeschlagen, kein Eintrag: synthetisierte 503 */
    OFFLINE,
    /** ohne Cache-Beteiligung durchgereicht */
    BYPASS
}

package de.htwsaar.offlinecache.worker.domain;

import java.util.Objects;

/**
 * Fachliches Ergebnis einer Strategie: Antwort plus Herkunft.
 *
 * @param response Antwort an den Aufrufer
 * @param decision HIT, MISS, STALE_FALLBACK, OFFLINE oder BYPASS
 */
public record Resolution(CapturedResponse response, CacheDecision decision) {

    public Resolution {
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
    }

    public static Resolution hit(CapturedResponse response) {
        return new Resolution(response, CacheDecision.HIT);
    }

    public static Resolution miss(CapturedResponse response) {
        return new Resolution(response, CacheDecision.MISS);
    }

    public static Resolution staleFallback(CapturedResponse response) {
        return new Resolution(response, CacheDecision.STALE_FALLBACK);
    }

    public static Resolution offline(CapturedResponse response) {
        return new Resolution(response, CacheDecision.OFFLINE);
    }

    public static Resolution bypass(CapturedResponse response) {
        return new Resolution(response, CacheDecision.BYPASS);
    }
}

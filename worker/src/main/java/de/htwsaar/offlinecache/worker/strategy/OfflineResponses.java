package de.htwsaar.offlinecache.worker.strategy;

import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Synthetisierte 503-Antworten für den Offline-Fall.
 */
public final class OfflineResponses {

    public static final int SERVICE_UNAVAILABLE = 503;

    static final String RESOURCE_UNAVAILABLE = "Offline - resource not available";
    static final String DATA_UNAVAILABLE = "Offline - data not available";
    static final String UNAVAILABLE = "Service Unavailable";

    private OfflineResponses() {}

    /** Seitenartige Ressource (Cache-First): {@code 503 text/plain}. */
    public static CapturedResponse resourceUnavailable() {
        return CapturedResponse.of(SERVICE_UNAVAILABLE, "text/plain", RESOURCE_UNAVAILABLE);
    }

    /**
     * API-artige Ressource (Network-First): {@code 503 application/json {error, timestamp}}.
     *
     * @param now Zeitstempel der Antwort
     * @return Antwort
     */
    public static CapturedResponse dataUnavailable(Instant now) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", DATA_UNAVAILABLE);
        body.put("timestamp", now.toString());
        return CapturedResponse.of(SERVICE_UNAVAILABLE, "application/json", JacksonCodec.toJson(body));
    }

    /** Allgemeiner Ausfall (SWR, Network-Only, Dispatcher). */
    public static CapturedResponse serviceUnavailable() {
        return CapturedResponse.of(SERVICE_UNAVAILABLE, "text/plain", UNAVAILABLE);
    }
}

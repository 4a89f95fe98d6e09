package de.htwsaar.offlinecache.common.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Geschlossene Menge der Kommandos des Control-Channels.
 *
 * <p>Der Wire-Name entspricht dem Enum-Namen ({@code CACHE_STATS}, ...). Die Antwort eines Kommandos
 * trägt den Typ {@code <KOMMANDO>_RESPONSE}.</p>
 */
public enum ControlMessageType {
    CACHE_STATS,
    CLEAR_CACHE,
    PRECACHE_URLS,
    SKIP_WAITING;

    /** Typ der Antwort-Nachricht, die genau an den Absender zurückgeht. */
    public String responseType() {
        return name() + "_RESPONSE";
    }

    /**
     * Löst einen Wire-Namen auf. Groß-/Kleinschreibung und umgebender Whitespace werden ignoriert.
     *
     * @param wireName Typ aus dem Nachrichten-Envelope
     * @return Kommando-Typ oder leer, wenn unbekannt
     */
    public static Optional<ControlMessageType> fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) return Optional.empty();
        String normalized = wireName.trim();
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}

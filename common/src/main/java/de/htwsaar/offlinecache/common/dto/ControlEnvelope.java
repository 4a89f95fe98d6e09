package de.htwsaar.offlinecache.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Nachrichten-Envelope des Control-Channels: {@code {type, payload?}}.
 *
 * <p>Wird sowohl für Kommandos (Host → Worker) als auch für Antworten (Worker → Absender)
 * verwendet.</p>
 *
 * @param type    Nachrichtentyp, z. B. {@code CACHE_STATS} oder {@code CACHE_STATS_RESPONSE}
 * @param payload optionaler Payload (JSON-Objekt)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ControlEnvelope(String type, Map<String, Object> payload) {

    /**
     * Baut ein Kommando ohne Payload.
     *
     * @param type Kommando-Typ
     * @return Envelope
     */
    public static ControlEnvelope command(ControlMessageType type) {
        return new ControlEnvelope(type.name(), null);
    }

    /**
     * Baut ein Kommando mit Payload.
     *
     * @param type    Kommando-Typ
     * @param payload Payload
     * @return Envelope
     */
    public static ControlEnvelope command(ControlMessageType type, Map<String, Object> payload) {
        return new ControlEnvelope(type.name(), payload);
    }

    /**
     * Baut die Antwort auf ein Kommando.
     *
     * @param type    beantworteter Kommando-Typ
     * @param payload Antwort-Payload
     * @return Envelope mit Typ {@code <KOMMANDO>_RESPONSE}
     */
    public static ControlEnvelope response(ControlMessageType type, Map<String, Object> payload) {
        return new ControlEnvelope(type.responseType(), payload);
    }
}

package de.htwsaar.offlinecache.worker.control;

import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.dto.ControlMessageType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Geschlossene Menge der Kommandos des Control-Channels.
 *
 * <p>Die Auswertung erfolgt über {@link Handler}: jede Implementierung muss alle Kommandos
 * behandeln, ein neues Kommando bricht den Build jedes Handlers.</p>
 */
public sealed interface ControlCommand
        permits ControlCommand.CacheStats,
                ControlCommand.ClearCache,
                ControlCommand.PrecacheUrls,
                ControlCommand.SkipWaiting {

    ControlMessageType type();

    <R> R accept(Handler<R> handler);

    /**
     * Besucher über alle Kommandos.
     *
     * @param <R> Ergebnistyp
     */
    interface Handler<R> {
        R onCacheStats(CacheStats command);

        R onClearCache(ClearCache command);

        R onPrecacheUrls(PrecacheUrls command);

        R onSkipWaiting(SkipWaiting command);
    }

    /** Statistik aller Partitionen, rein lesend. */
    record CacheStats() implements ControlCommand {
        @Override
        public ControlMessageType type() {
            return ControlMessageType.CACHE_STATS;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onCacheStats(this);
        }
    }

    /** Löscht alle verwalteten Partitionen. */
    record ClearCache() implements ControlCommand {
        @Override
        public ControlMessageType type() {
            return ControlMessageType.CLEAR_CACHE;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onClearCache(this);
        }
    }

    /**
     * Lädt URLs in die Partition {@code dynamic}.
     *
     * @param urls wurzelrelative oder absolute URLs
     */
    record PrecacheUrls(List<String> urls) implements ControlCommand {
        public PrecacheUrls {
            urls = List.copyOf(urls);
        }

        @Override
        public ControlMessageType type() {
            return ControlMessageType.PRECACHE_URLS;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onPrecacheUrls(this);
        }
    }

    /** Aktiviert einen wartenden Worker. */
    record SkipWaiting() implements ControlCommand {
        @Override
        public ControlMessageType type() {
            return ControlMessageType.SKIP_WAITING;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onSkipWaiting(this);
        }
    }

    /**
     * Übersetzt ein Envelope in ein Kommando.
     *
     * @param envelope eingehende Nachricht
     * @return Kommando
     * @throws ControlMessageException bei unbekanntem Typ oder fehlerhaftem Payload
     */
    static ControlCommand parse(ControlEnvelope envelope) {
        if (envelope == null) throw new ControlMessageException("Message must not be empty");
        ControlMessageType type = ControlMessageType.fromWireName(envelope.type())
                .orElseThrow(() -> new ControlMessageException("Unknown message type: " + envelope.type()));

        return switch (type) {
            case CACHE_STATS -> new CacheStats();
            case CLEAR_CACHE -> new ClearCache();
            case PRECACHE_URLS -> new PrecacheUrls(urlsOf(envelope.payload()));
            case SKIP_WAITING -> new SkipWaiting();
        };
    }

    private static List<String> urlsOf(Map<String, Object> payload) {
        Object raw = payload == null ? null : payload.get("urls");
        if (!(raw instanceof List<?> list)) {
            throw new ControlMessageException("PRECACHE_URLS requires payload.urls as array");
        }
        List<String> urls = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String s) || s.isBlank()) {
                throw new ControlMessageException("payload.urls must contain non-blank strings");
            }
            urls.add(s);
        }
        return urls;
    }
}

package de.htwsaar.offlinecache.worker.domain;

import java.util.concurrent.CompletableFuture;

/**
 * Port zur Abstraktion des Netzwerk-Transports.
 * Strategien kennen nur diesen Port, der HTTP-Adapter ist austauschbar (Tests, anderer Client).
 */
public interface NetworkClient {

    /**
     * Führt die Anfrage gegen das Netzwerk aus.
     *
     * <p>Jede Antwort mit Statuscode (auch 4xx/5xx) gilt als erfolgreich abgeschlossen. Nur
     * Transportfehler lassen das Future mit einer {@link NetworkFailureException} fehlschlagen.
     * Eine laufende Anfrage wird nie abgebrochen.</p>
     *
     * @param request abgefangene Anfrage
     * @return Future der Antwort
     */
    CompletableFuture<CapturedResponse> fetch(InterceptedRequest request);
}

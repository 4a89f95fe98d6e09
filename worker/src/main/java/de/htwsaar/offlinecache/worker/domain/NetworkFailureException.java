package de.htwsaar.offlinecache.worker.domain;

/**
 * Fachliche Exception für Transportfehler (Fetch abgelehnt, Verbindung fehlgeschlagen, Timeout).
 * Cachende Strategien behandeln sie lokal; bei Network-Only übersetzt der Dispatcher sie in eine 503.
 */
public class NetworkFailureException extends RuntimeException {

    /**
     * Erstellt eine neue Exception.
     *
     * @param message Fehlerbeschreibung
     * @param cause   ursprüngliche Ursache
     */
    public NetworkFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

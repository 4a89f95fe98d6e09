package de.htwsaar.offlinecache.worker.control;

/**
 * Nachricht des Control-Channels ist unbekannt oder fehlerhaft. Wird an der HTTP-Kante auf
 * {@code 400} abgebildet; der Worker-Zustand bleibt unverändert.
 */
public class ControlMessageException extends RuntimeException {

    public ControlMessageException(String message) {
        super(message);
    }
}

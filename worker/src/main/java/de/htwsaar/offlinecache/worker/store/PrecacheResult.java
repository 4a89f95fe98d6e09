package de.htwsaar.offlinecache.worker.store;

import java.util.List;

/**
 * Ergebnis eines Precache-Laufs; beide Listen in der Reihenfolge der Eingabe.
 *
 * @param succeeded gespeicherte URLs
 * @param failed    URLs mit Transportfehler, Nicht-2xx-Status oder abgelehntem Schreibvorgang
 */
public record PrecacheResult(List<String> succeeded, List<String> failed) {

    public PrecacheResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}

package de.htwsaar.offlinecache.worker.store;

/**
 * Der Storage hat einen Schreibvorgang abgelehnt, weil das Byte-Kontingent erschöpft ist.
 * Wird am {@link StoreManager} abgefangen; die Anfrage selbst schlägt nie deswegen fehl.
 */
public class QuotaExceededException extends RuntimeException {

    private final long requestedBytes;
    private final long availableBytes;

    /**
     * Erstellt eine neue Exception.
     *
     * @param requestedBytes zusätzlich benötigte Bytes
     * @param availableBytes noch freie Bytes
     */
    public QuotaExceededException(long requestedBytes, long availableBytes) {
        super("Storage quota exceeded: requested " + requestedBytes + " bytes, available " + availableBytes);
        this.requestedBytes = requestedBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequestedBytes() {
        return requestedBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }
}

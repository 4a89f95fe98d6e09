package de.htwsaar.offlinecache.worker.store;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Byte-Kontingent des Storages über alle Partitionen hinweg.
 *
 * <p>Thread-Safety: lock-frei über {@link AtomicLong}. {@code maxBytes <= 0} bedeutet unbegrenzt.</p>
 */
public final class StorageQuota {

    private final long maxBytes;
    private final AtomicLong usedBytes = new AtomicLong(0);

    /**
     * @param maxBytes maximale Body-Bytes (0 = unbegrenzt)
     */
    public StorageQuota(long maxBytes) {
        this.maxBytes = Math.max(0, maxBytes);
    }

    public static StorageQuota unbounded() {
        return new StorageQuota(0);
    }

    /**
     * Reserviert (positives Delta) oder gibt frei (negatives Delta).
     *
     * @param deltaBytes Änderung der belegten Bytes
     * @throws QuotaExceededException wenn eine Reservierung das Kontingent überschreiten würde
     */
    public void adjust(long deltaBytes) {
        if (deltaBytes <= 0 || maxBytes == 0) {
            usedBytes.addAndGet(deltaBytes);
            return;
        }
        while (true) {
            long current = usedBytes.get();
            long next = current + deltaBytes;
            if (next > maxBytes) {
                throw new QuotaExceededException(deltaBytes, Math.max(0, maxBytes - current));
            }
            if (usedBytes.compareAndSet(current, next)) return;
        }
    }

    public void release(long bytes) {
        if (bytes > 0) usedBytes.addAndGet(-bytes);
    }

    public long usedBytes() {
        return usedBytes.get();
    }

    public long maxBytes() {
        return maxBytes;
    }
}

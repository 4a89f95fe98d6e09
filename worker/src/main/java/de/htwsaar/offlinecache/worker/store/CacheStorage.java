package de.htwsaar.offlinecache.worker.store;

import java.util.List;
import java.util.Optional;

/**
 * Abstraktion des Storage-Substrats (Gegenstück zur {@code CacheStorage}-API des Browsers).
 *
 * <p>Überlebt Versionswechsel der Engine: ein neuer {@link StoreManager} findet hier die
 * Partitionen der Vorgängerversion und kann sie bei der Aktivierung löschen. Partitionen fremden
 * Codes liegen ebenfalls hier.</p>
 */
public interface CacheStorage {

    /**
     * Öffnet eine Partition und legt sie an, falls sie fehlt. Idempotent.
     *
     * @param name physischer Name
     * @return Partition
     */
    CachePartition open(String name);

    /**
     * @param name physischer Name
     * @return vorhandene Partition oder leer
     */
    Optional<CachePartition> find(String name);

    /**
     * Löscht eine Partition samt Einträgen.
     *
     * @param name physischer Name
     * @return {@code true}, wenn eine Partition gelöscht wurde
     */
    boolean delete(String name);

    /** Alle Partitionsnamen in Anlage-Reihenfolge. */
    List<String> names();

    /** Gemeinsames Byte-Kontingent. */
    StorageQuota quota();
}

package de.htwsaar.offlinecache.worker.store;

import java.util.List;
import java.util.Map;

/**
 * Momentaufnahme aller Partitionen, Payload von {@code CACHE_STATS_RESPONSE}.
 *
 * @param caches       Partitionsname → Statistik
 * @param totalCaches  Anzahl Partitionen
 * @param totalEntries Summe aller Einträge
 */
public record CacheStats(Map<String, PartitionStats> caches, int totalCaches, int totalEntries) {

    /**
     * Statistik einer Partition.
     *
     * @param count Anzahl Einträge
     * @param urls  URLs der Einträge
     */
    public record PartitionStats(int count, List<String> urls) {}
}

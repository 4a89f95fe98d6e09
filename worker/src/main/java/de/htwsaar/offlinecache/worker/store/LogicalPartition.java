package de.htwsaar.offlinecache.worker.store;

import java.util.Arrays;
import java.util.Optional;

/**
 * Die drei von der Engine verwalteten logischen Partitionen.
 */
public enum LogicalPartition {
    /** Precache-Manifest und Cache-First-Assets */
    STATIC("static"),
    /** Stale-While-Revalidate und {@code PRECACHE_URLS} */
    DYNAMIC("dynamic"),
    /** Network-First-Antworten */
    API("api");

    private final String logicalName;

    LogicalPartition(String logicalName) {
        this.logicalName = logicalName;
    }

    public String logicalName() {
        return logicalName;
    }

    /**
     * Sucht die verwaltete Partition zu einem logischen Namen.
     *
     * @param logicalName z. B. {@code static}
     * @return Partition oder leer, wenn der Name nicht verwaltet wird
     */
    public static Optional<LogicalPartition> fromLogicalName(String logicalName) {
        return Arrays.stream(values())
                .filter(p -> p.logicalName.equals(logicalName))
                .findFirst();
    }
}

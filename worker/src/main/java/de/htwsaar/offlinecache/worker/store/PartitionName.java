package de.htwsaar.offlinecache.worker.store;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identität einer Partition: {@code (logischer Name, Versionskennung)}.
 * Physischer Name: {@code <prefix>-<logical>-v<version>}, z. B. {@code offline-api-v1.0.1}.
 *
 * @param prefix      Namenspräfix der Anwendung
 * @param logicalName logischer Name ({@code static}, {@code dynamic}, {@code api} oder fremd)
 * @param version     Versionskennung
 */
public record PartitionName(String prefix, String logicalName, String version) {

    private static final Pattern SUFFIX = Pattern.compile("^([A-Za-z0-9_]+)-v(.+)$");

    public PartitionName {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(logicalName, "logicalName must not be null");
        Objects.requireNonNull(version, "version must not be null");
    }

    public static PartitionName of(String prefix, LogicalPartition partition, String version) {
        return new PartitionName(prefix, partition.logicalName(), version);
    }

    public String physicalName() {
        return prefix + "-" + logicalName + "-v" + version;
    }

    /** {@code true}, wenn der logische Name einer der drei verwalteten Partitionen entspricht. */
    public boolean isManaged() {
        return LogicalPartition.fromLogicalName(logicalName).isPresent();
    }

    /**
     * Zerlegt einen physischen Namen. Namen mit anderem Präfix oder anderem Aufbau gehören
     * nicht zur Engine und liefern leer.
     *
     * @param physicalName physischer Partitionsname
     * @param prefix       erwartetes Präfix
     * @return zerlegter Name oder leer
     */
    public static Optional<PartitionName> parse(String physicalName, String prefix) {
        if (physicalName == null || prefix == null) return Optional.empty();
        String head = prefix + "-";
        if (!physicalName.startsWith(head)) return Optional.empty();
        Matcher m = SUFFIX.matcher(physicalName.substring(head.length()));
        if (!m.matches()) return Optional.empty();
        return Optional.of(new PartitionName(prefix, m.group(1), m.group(2)));
    }

    @Override
    public String toString() {
        return physicalName();
    }
}

package de.htwsaar.offlinecache.worker.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PartitionNameTest {

    @Test
    void shouldBuildPhysicalName() {
        assertEquals("offline-api-v1.0.1", PartitionName.of("offline", LogicalPartition.API, "1.0.1").physicalName());
    }

    @Test
    void shouldParseManagedAndUnmanagedNames() {
        PartitionName parsed = PartitionName.parse("offline-dynamic-v2.0.0-rc1", "offline").orElseThrow();
        assertEquals("dynamic", parsed.logicalName());
        assertEquals("2.0.0-rc1", parsed.version());
        assertTrue(parsed.isManaged());

        PartitionName images = PartitionName.parse("offline-images-v1", "offline").orElseThrow();
        assertFalse(images.isManaged());
    }

    @Test
    void shouldRejectForeignNames() {
        assertTrue(PartitionName.parse("workbox-precache", "offline").isEmpty());
        assertTrue(PartitionName.parse("other-static-v1.0.1", "offline").isEmpty());
        assertTrue(PartitionName.parse("offline-static", "offline").isEmpty());
        assertTrue(PartitionName.parse(null, "offline").isEmpty());
    }
}

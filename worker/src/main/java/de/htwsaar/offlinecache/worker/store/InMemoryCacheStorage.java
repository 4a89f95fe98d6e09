package de.htwsaar.offlinecache.worker.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-Memory-Storage. Keine Persistenz über Prozessneustarts hinweg.
 *
 * <p>Thread-Safety: {@link ConcurrentHashMap#computeIfAbsent} macht {@link #open} idempotent auch
 * bei parallelen Aufrufen.</p>
 */
public final class InMemoryCacheStorage implements CacheStorage {

    private record Slot(long order, CachePartition partition) {}

    private final Map<String, Slot> partitions = new ConcurrentHashMap<>();
    private final AtomicLong counter = new AtomicLong();
    private final StorageQuota quota;

    /**
     * @param quota Byte-Kontingent (darf nicht {@code null} sein)
     */
    public InMemoryCacheStorage(StorageQuota quota) {
        this.quota = Objects.requireNonNull(quota, "quota must not be null");
    }

    @Override
    public CachePartition open(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("partition name must not be blank");
        return partitions
                .computeIfAbsent(name, n -> new Slot(counter.incrementAndGet(), new CachePartition(n, quota)))
                .partition();
    }

    @Override
    public Optional<CachePartition> find(String name) {
        if (name == null) return Optional.empty();
        Slot slot = partitions.get(name);
        return slot == null ? Optional.empty() : Optional.of(slot.partition());
    }

    @Override
    public boolean delete(String name) {
        if (name == null) return false;
        Slot removed = partitions.remove(name);
        if (removed == null) return false;
        removed.partition().drop();
        return true;
    }

    @Override
    public List<String> names() {
        List<Slot> slots = new ArrayList<>(partitions.values());
        slots.sort((a, b) -> Long.compare(a.order(), b.order()));
        return slots.stream().map(s -> s.partition().name()).toList();
    }

    @Override
    public StorageQuota quota() {
        return quota;
    }
}

package de.htwsaar.offlinecache.worker;

import de.htwsaar.offlinecache.worker.classify.StrategyTag;
import de.htwsaar.offlinecache.worker.domain.CacheDecision;
import java.time.Clock;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Erfasst Laufzeitmetriken des Workers: Anfragen je Strategie und je Entscheidung.
 *
 * <p>Die Werte liegen nur im Speicher der laufenden Instanz.
 */
@Service
@Profile("worker")
public class WorkerMetricsService {

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final Map<StrategyTag, AtomicLong> byStrategy = new EnumMap<>(StrategyTag.class);
    private final Map<CacheDecision, AtomicLong> byDecision = new EnumMap<>(CacheDecision.class);
    private final Deque<Long> requestTimestampsMs = new ConcurrentLinkedDeque<>();
    private final Clock clock;

    /** Erstellt den Service mit der System-Uhr. */
    public WorkerMetricsService() {
        this(Clock.systemUTC());
    }

    /**
     * Erstellt den Service mit einer expliziten Uhr (nützlich für Tests).
     *
     * @param clock Zeitquelle
     */
    public WorkerMetricsService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (StrategyTag tag : StrategyTag.values()) byStrategy.put(tag, new AtomicLong(0));
        for (CacheDecision decision : CacheDecision.values()) byDecision.put(decision, new AtomicLong(0));
    }

    /**
     * Erfasst eine aufgelöste Anfrage.
     *
     * @param strategy gewählte Strategie
     * @param decision Herkunft der Antwort
     */
    public void record(StrategyTag strategy, CacheDecision decision) {
        totalRequests.incrementAndGet();
        byStrategy.get(strategy).incrementAndGet();
        byDecision.get(decision).incrementAndGet();
        requestTimestampsMs.addLast(clock.millis());
    }

    /**
     * Liefert eine Momentaufnahme inklusive exakter Request-Zahl im Zeitfenster.
     *
     * @param windowSeconds Zeitfenster in Sekunden
     * @param cachedEntries aktuelle Anzahl gecachter Einträge über alle Partitionen
     * @return Snapshot
     */
    public WorkerStatsSnapshot snapshot(int windowSeconds, long cachedEntries) {
        int safeWindow = Math.max(1, windowSeconds);
        long nowMs = clock.millis();
        purgeOldRequests(nowMs, safeWindow);

        Map<String, Long> strategies = new LinkedHashMap<>();
        byStrategy.forEach((tag, count) -> strategies.put(tag.wireName(), count.get()));
        Map<String, Long> decisions = new LinkedHashMap<>();
        byDecision.forEach((decision, count) -> decisions.put(decision.name(), count.get()));

        long hits = byDecision.get(CacheDecision.HIT).get();
        long misses = byDecision.get(CacheDecision.MISS).get();
        long totalCacheDecisions = hits + misses;
        double hitRatio = totalCacheDecisions == 0 ? 0.0 : (double) hits / totalCacheDecisions;

        return new WorkerStatsSnapshot(
                totalRequests.get(),
                requestTimestampsMs.size(),
                strategies,
                decisions,
                hitRatio,
                Math.max(0, cachedEntries));
    }

    private void purgeOldRequests(long nowMs, int windowSeconds) {
        long threshold = nowMs - (windowSeconds * 1000L);
        while (true) {
            Long first = requestTimestampsMs.peekFirst();
            if (first == null || first >= threshold) {
                break;
            }
            requestTimestampsMs.pollFirst();
        }
    }

    /**
     * Unveränderlicher Snapshot der Worker-Metriken.
     *
     * @param totalRequests     Gesamtanzahl Requests seit Start
     * @param requestsPerWindow exakte Anzahl Requests im Zeitfenster
     * @param byStrategy        Requests je Strategie (Wire-Name)
     * @param byDecision        Requests je Entscheidung
     * @param cacheHitRatio     HIT / (HIT + MISS) zwischen 0 und 1
     * @param cachedEntries     aktuell gecachte Einträge
     */
    public record WorkerStatsSnapshot(
            long totalRequests,
            long requestsPerWindow,
            Map<String, Long> byStrategy,
            Map<String, Long> byDecision,
            double cacheHitRatio,
            long cachedEntries) {}
}

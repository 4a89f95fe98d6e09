package de.htwsaar.offlinecache.worker.web;

import de.htwsaar.offlinecache.worker.WorkerMetricsService;
import de.htwsaar.offlinecache.worker.store.StoreManager;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin-API für Worker-Metriken.
 */
@RestController
@RequestMapping("/_worker/admin/stats")
@Profile("worker")
public class WorkerAdminStatsController {

    private final WorkerMetricsService metricsService;
    private final StoreManager storeManager;

    /**
     * Constructor Injection.
     *
     * @param metricsService Metriken-Service
     * @param storeManager   Quelle der Eintragsanzahl
     */
    public WorkerAdminStatsController(WorkerMetricsService metricsService, StoreManager storeManager) {
        this.metricsService = metricsService;
        this.storeManager = storeManager;
    }

    /**
     * Liefert einen Metriken-Snapshot des Workers.
     *
     * @param windowSec Zeitfenster in Sekunden für Request-Rate (Standard: 60)
     * @return Metriken-Snapshot
     */
    @GetMapping
    public ResponseEntity<WorkerMetricsService.WorkerStatsSnapshot> getStats(
            @RequestParam(value = "windowSec", defaultValue = "60") int windowSec) {
        return ResponseEntity.ok(metricsService.snapshot(windowSec, storeManager.stats().totalEntries()));
    }
}

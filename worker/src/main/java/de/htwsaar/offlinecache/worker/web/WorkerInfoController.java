package de.htwsaar.offlinecache.worker.web;

import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.lifecycle.WorkerLifecycle;
import de.htwsaar.offlinecache.worker.store.StorageQuota;
import de.htwsaar.offlinecache.worker.store.StoreManager;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liefert Version, Zustand, Partitionen und Speicherbelegung des Workers.
 *
 * <p>{@code storage.maxBytes = 0} bedeutet unbegrenzt.
 */
@RestController
@RequestMapping("/_worker/info")
@Profile("worker")
public class WorkerInfoController {

    private final CacheEngineConfig config;
    private final WorkerLifecycle lifecycle;
    private final StoreManager storeManager;

    /**
     * Constructor Injection.
     *
     * @param config       Engine-Konfiguration
     * @param lifecycle    Zustandsautomat
     * @param storeManager Besitzer der Partitionen
     */
    public WorkerInfoController(CacheEngineConfig config, WorkerLifecycle lifecycle, StoreManager storeManager) {
        this.config = config;
        this.lifecycle = lifecycle;
        this.storeManager = storeManager;
    }

    /**
     * @return Worker-Info als JSON
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("version", config.version());
        info.put("state", lifecycle.state().name());
        info.put("servingOrigin", config.servingOrigin().toString());
        info.put("partitions", storeManager.partitionNames());

        StorageQuota quota = storeManager.quota();
        Map<String, Object> storage = new LinkedHashMap<>();
        storage.put("usedBytes", quota.usedBytes());
        storage.put("maxBytes", quota.maxBytes());
        info.put("storage", storage);
        return ResponseEntity.ok(info);
    }
}

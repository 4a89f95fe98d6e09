package de.htwsaar.offlinecache.worker.web;

import de.htwsaar.offlinecache.worker.lifecycle.WorkerLifecycle;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health- und Readiness-Probes des Workers. Bereit ist der Worker erst im Zustand {@code ACTIVE}.
 */
@RestController
@RequestMapping("/_worker")
@Profile("worker")
public class WorkerProbeController {

    private final WorkerLifecycle lifecycle;

    public WorkerProbeController(WorkerLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    /** @return HTTP 200 "ok" */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /** @return HTTP 200 "ready" oder 503 mit dem aktuellen Zustand */
    @GetMapping("/ready")
    public ResponseEntity<String> ready() {
        if (lifecycle.controlsClients()) {
            return ResponseEntity.ok("ready");
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(lifecycle.state().name());
    }
}

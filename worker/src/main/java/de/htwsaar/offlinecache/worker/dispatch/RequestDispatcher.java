package de.htwsaar.offlinecache.worker.dispatch;

import de.htwsaar.offlinecache.worker.WorkerMetricsService;
import de.htwsaar.offlinecache.worker.classify.PatternClassifier;
import de.htwsaar.offlinecache.worker.classify.StrategyTag;
import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.Resolution;
import de.htwsaar.offlinecache.worker.lifecycle.WorkerLifecycle;
import de.htwsaar.offlinecache.worker.strategy.OfflineResponses;
import de.htwsaar.offlinecache.worker.strategy.StrategyExecutor;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Einstiegspunkt für jede abgefangene Anfrage: filtert, klassifiziert und delegiert an die
 * passende Strategie.
 *
 * <p>Network-Only gilt, solange der Worker nicht aktiv ist, für fremde Origins (außer
 * vertrauenswürdigen), für ignorierte Pfade und für alle Methoden außer GET. Das zurückgegebene
 * Future schlägt nie fehl: jeder Fehler wird zu einer synthetischen 503.</p>
 */
@Service
@Profile("worker")
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final CacheEngineConfig config;
    private final PatternClassifier classifier;
    private final WorkerLifecycle lifecycle;
    private final WorkerMetricsService metrics;
    private final Map<StrategyTag, StrategyExecutor> executors = new EnumMap<>(StrategyTag.class);
    private final String servingOrigin;

    /**
     * Erstellt den Dispatcher mit Constructor Injection.
     *
     * @param config     Engine-Konfiguration
     * @param classifier Pattern-Klassifizierer
     * @param lifecycle  Zustandsautomat
     * @param metrics    Metriken-Service
     * @param executors  alle Strategien; je {@link StrategyTag} genau eine
     */
    public RequestDispatcher(
            CacheEngineConfig config,
            PatternClassifier classifier,
            WorkerLifecycle lifecycle,
            WorkerMetricsService metrics,
            List<StrategyExecutor> executors) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        for (StrategyExecutor executor : executors) {
            if (this.executors.put(executor.tag(), executor) != null) {
                throw new IllegalArgumentException("Duplicate executor for " + executor.tag());
            }
        }
        for (StrategyTag tag : StrategyTag.values()) {
            if (!this.executors.containsKey(tag)) {
                throw new IllegalArgumentException("Missing executor for " + tag);
            }
        }
        this.servingOrigin = InterceptedRequest.originOf(config.servingOrigin());
    }

    /**
     * Löst eine abgefangene Anfrage auf.
     *
     * @param request abgefangene Anfrage
     * @return Future, das immer mit einer Antwort erfüllt wird
     */
    public CompletableFuture<Resolution> dispatch(InterceptedRequest request) {
        StrategyTag tag = route(request);
        log.debug("{} {} -> {}", request.method(), request.url(), tag.wireName());

        CompletableFuture<Resolution> pending;
        try {
            pending = executors.get(tag).handle(request);
        } catch (RuntimeException ex) {
            pending = CompletableFuture.failedFuture(ex);
        }

        return pending.handle((resolution, ex) -> {
            Resolution result = resolution;
            if (ex != null) {
                log.warn("{} failed for {}: {}", tag.wireName(), request.url(), ex.toString());
                result = Resolution.offline(OfflineResponses.serviceUnavailable());
            }
            metrics.record(tag, result.decision());
            return result;
        });
    }

    /**
     * Bestimmt die Strategie einer Anfrage inklusive aller Vorfilter.
     *
     * @param request abgefangene Anfrage
     * @return Strategie
     */
    public StrategyTag route(InterceptedRequest request) {
        if (!lifecycle.controlsClients()) return StrategyTag.NETWORK_ONLY;
        if (!isInterceptedOrigin(request)) return StrategyTag.NETWORK_ONLY;
        if (isIgnoredPath(request.url().getPath())) return StrategyTag.NETWORK_ONLY;
        if (!request.isGet()) return StrategyTag.NETWORK_ONLY;
        return classifier.classify(request.pathAndQuery());
    }

    private boolean isInterceptedOrigin(InterceptedRequest request) {
        String origin = request.origin();
        return origin.equals(servingOrigin) || config.trustedOrigins().contains(origin);
    }

    /** Einträge mit führendem {@code /} gelten exakt, alle anderen als Teilstring. */
    private boolean isIgnoredPath(String path) {
        String p = path == null ? "" : path;
        for (String ignored : config.ignoredPaths()) {
            if (ignored.startsWith("/") ? p.equals(ignored) : p.contains(ignored)) return true;
        }
        return false;
    }
}

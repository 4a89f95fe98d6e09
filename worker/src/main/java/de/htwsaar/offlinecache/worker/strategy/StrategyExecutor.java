package de.htwsaar.offlinecache.worker.strategy;

import de.htwsaar.offlinecache.worker.classify.StrategyTag;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.Resolution;
import java.util.concurrent.CompletableFuture;

/**
 * Löst eine abgefangene Anfrage nach einer festen Strategie auf.
 *
 * <p>Das Future schlägt nur bei unerwarteten Fehlern fehl; Netzwerkausfälle werden von den
 * cachenden Strategien selbst in Cache-Fallbacks oder synthetische 503-Antworten übersetzt.</p>
 */
public interface StrategyExecutor {

    /** Strategie, die dieser Executor umsetzt. */
    StrategyTag tag();

    /**
     * @param request abgefangene GET-Anfrage
     * @return Future mit Antwort und {@link de.htwsaar.offlinecache.worker.domain.CacheDecision}
     */
    CompletableFuture<Resolution> handle(InterceptedRequest request);
}

package de.htwsaar.offlinecache.worker.strategy;

import de.htwsaar.offlinecache.worker.classify.StrategyTag;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.NetworkClient;
import de.htwsaar.offlinecache.worker.domain.Resolution;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

/**
 * Reicht die Anfrage unverändert ans Netzwerk durch. Transportfehler übersetzt der Dispatcher.
 */
@Component
public class NetworkOnlyStrategy implements StrategyExecutor {

    private final NetworkClient networkClient;

    public NetworkOnlyStrategy(NetworkClient networkClient) {
        this.networkClient = Objects.requireNonNull(networkClient, "networkClient must not be null");
    }

    @Override
    public StrategyTag tag() {
        return StrategyTag.NETWORK_ONLY;
    }

    @Override
    public CompletableFuture<Resolution> handle(InterceptedRequest request) {
        return NetworkCalls.fetch(networkClient, request).thenApply(Resolution::bypass);
    }
}

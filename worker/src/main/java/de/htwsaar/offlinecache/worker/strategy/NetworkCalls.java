package de.htwsaar.offlinecache.worker.strategy;

import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.NetworkClient;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Hilfsfunktionen rund um den {@link NetworkClient}-Port. */
final class NetworkCalls {

    private NetworkCalls() {}

    /** Ruft den Port auf; synchron geworfene Fehler landen im Future. */
    static CompletableFuture<CapturedResponse> fetch(NetworkClient client, InterceptedRequest request) {
        try {
            CompletableFuture<CapturedResponse> future = client.fetch(request);
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("network client returned no future"));
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    /** Entpackt {@link CompletionException}/{@link ExecutionException}. */
    static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

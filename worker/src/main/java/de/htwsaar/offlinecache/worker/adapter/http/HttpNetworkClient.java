package de.htwsaar.offlinecache.worker.adapter.http;

import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.NetworkClient;
import de.htwsaar.offlinecache.worker.domain.NetworkFailureException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP-Adapter zum Netzwerk auf Basis von {@link HttpClient#sendAsync}.
 *
 * <p>Enthält alle HTTP-Details (Header-Filter, URL-Umschreibung). Anfragen an den Serving-Origin
 * werden an den Upstream weitergeleitet; vertrauenswürdige fremde Origins werden direkt
 * angesprochen. Transportfehler werden zu {@link NetworkFailureException}.</p>
 */
public final class HttpNetworkClient implements NetworkClient {

    /** Header, die {@link HttpClient} selbst setzt oder ablehnt, plus Hop-by-Hop-Header. */
    private static final Set<String> SKIPPED_REQUEST_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade",
            "keep-alive", "proxy-connection", "te", "trailer", "transfer-encoding");

    private static final Set<String> SKIPPED_RESPONSE_HEADERS = Set.of(
            ":status", "connection", "content-length", "keep-alive", "transfer-encoding");

    private final HttpClient httpClient;
    private final String servingOrigin;
    private final String upstreamBase;

    /**
     * Erstellt den HTTP-Adapter.
     *
     * @param httpClient    HTTP-Client (darf nicht {@code null} sein)
     * @param servingOrigin Origin, unter dem der Worker ausliefert
     * @param upstreamBase  Basis-URI des Upstreams für Anfragen an den Serving-Origin
     */
    public HttpNetworkClient(HttpClient httpClient, URI servingOrigin, URI upstreamBase) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.servingOrigin = InterceptedRequest.originOf(Objects.requireNonNull(servingOrigin, "servingOrigin must not be null"));
        String base = Objects.requireNonNull(upstreamBase, "upstreamBase must not be null").toString();
        this.upstreamBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public CompletableFuture<CapturedResponse> fetch(InterceptedRequest request) {
        final URI target;
        final HttpRequest httpRequest;
        try {
            target = targetUri(request);
            httpRequest = buildRequest(request, target);
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(
                    new NetworkFailureException("Invalid request to " + request.url(), ex));
        }

        CompletableFuture<CapturedResponse> result = new CompletableFuture<>();
        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray()).whenComplete((resp, ex) -> {
            if (ex != null) {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                result.completeExceptionally(new NetworkFailureException("Network request failed: " + target, cause));
            } else {
                result.complete(toCaptured(resp));
            }
        });
        return result;
    }

    /** Serving-Origin → Upstream, alles andere unverändert. */
    URI targetUri(InterceptedRequest request) {
        if (!request.origin().equals(servingOrigin)) {
            return request.url();
        }
        return URI.create(upstreamBase + request.pathAndQuery());
    }

    private static HttpRequest buildRequest(InterceptedRequest request, URI target) {
        HttpRequest.BodyPublisher body = request.body().length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(target).method(request.method(), body);
        request.headers().forEach((name, values) -> {
            if (SKIPPED_REQUEST_HEADERS.contains(name.toLowerCase(Locale.ROOT))) return;
            for (String value : values) {
                builder.header(name, value);
            }
        });
        return builder.build();
    }

    private static CapturedResponse toCaptured(HttpResponse<byte[]> resp) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        resp.headers().map().forEach((name, values) -> {
            if (!SKIPPED_RESPONSE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) headers.put(name, values);
        });
        return new CapturedResponse(resp.statusCode(), headers, resp.body());
    }
}

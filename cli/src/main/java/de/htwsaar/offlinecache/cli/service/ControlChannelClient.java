package de.htwsaar.offlinecache.cli.service;

import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.util.HttpUtils;
import de.htwsaar.offlinecache.cli.util.UriUtils;
import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;

/**
 * HTTP-Client für den Control-Channel und die Betriebs-Endpunkte eines Workers.
 *
 * <p>Kommandos werden als {@code {type, payload}} an {@code POST /_worker/messages} gesendet; die
 * Antwort kommt im selben HTTP-Austausch zurück.
 */
public final class ControlChannelClient {

    static final String MESSAGES_PATH = "_worker/messages";

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * @param httpClient     gemeinsamer HTTP-Client
     * @param requestTimeout Timeout pro Request
     */
    public ControlChannelClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    /**
     * Sendet ein Kommando an den Worker.
     *
     * @param host     Basis-URL des Workers
     * @param envelope Kommando
     * @return Statuscode und Antwort-Body oder I/O-Fehler
     */
    public HttpCallResult send(URI host, ControlEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        HttpRequest request = HttpRequest.newBuilder(UriUtils.resolve(host, MESSAGES_PATH))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(JacksonCodec.toJson(envelope)))
                .build();
        return HttpUtils.sendForStringBody(httpClient, request);
    }

    /**
     * Liest einen Betriebs-Endpunkt (Health, Readiness, Metriken).
     *
     * @param host Basis-URL des Workers
     * @param path relativer Pfad, z. B. {@code _worker/health}
     * @return Statuscode und Antwort-Body oder I/O-Fehler
     */
    public HttpCallResult get(URI host, String path) {
        HttpRequest request = HttpRequest.newBuilder(UriUtils.resolve(host, path))
                .timeout(requestTimeout)
                .GET()
                .build();
        return HttpUtils.sendForStringBody(httpClient, request);
    }
}

package de.htwsaar.offlinecache.worker.domain;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Eine abgefangene ausgehende Anfrage, wie sie der Dispatcher an die Strategien übergibt.
 *
 * @param method  HTTP-Methode
 * @param url     absolute URL
 * @param headers Request-Header (case-insensitiv)
 * @param body    Request-Body (leer bei GET)
 */
public record InterceptedRequest(String method, URI url, Map<String, List<String>> headers, byte[] body) {

    public InterceptedRequest {
        Objects.requireNonNull(url, "url must not be null");
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        Map<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) h.put(name, List.copyOf(values));
            });
        }
        headers = Collections.unmodifiableMap(h);
        body = body == null ? new byte[0] : body;
    }

    /**
     * Einfache GET-Anfrage ohne Header.
     *
     * @param url absolute URL
     * @return Anfrage
     */
    public static InterceptedRequest get(URI url) {
        return new InterceptedRequest("GET", url, Map.of(), null);
    }

    public RequestKey key() {
        return RequestKey.of(method, url);
    }

    /** Pfad plus Query, Eingabe des Pattern-Klassifizierers. */
    public String pathAndQuery() {
        String path = url.getRawPath() == null || url.getRawPath().isEmpty() ? "/" : url.getRawPath();
        return url.getRawQuery() == null ? path : path + "?" + url.getRawQuery();
    }

    /** Origin im Sinne von {@code scheme://host[:port]}. */
    public String origin() {
        return originOf(url);
    }

    public boolean isGet() {
        return "GET".equals(method);
    }

    /**
     * Normalisiert den Origin einer URI; Default-Ports (80/443) werden weggelassen.
     *
     * @param uri absolute URI
     * @return Origin in Kleinbuchstaben
     */
    public static String originOf(URI uri) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
        return scheme + "://" + host + (defaultPort ? "" : ":" + port);
    }
}

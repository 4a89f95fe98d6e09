package de.htwsaar.offlinecache.worker.domain;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Transport-agnostische, unveränderliche HTTP-Antwort ohne Servlet- oder Spring-Web-Typen.
 *
 * <p>Header-Namen werden case-insensitiv behandelt. Änderungen ({@link #withHeader}) erzeugen eine
 * neue Instanz. Der Body wird beim Anlegen und bei jedem Lesen über {@link #body()} kopiert.</p>
 *
 * @param status  HTTP-Statuscode
 * @param headers Header (Name → Werte), case-insensitiv
 * @param body    Body-Bytes (nie {@code null})
 */
public record CapturedResponse(int status, Map<String, List<String>> headers, byte[] body) {

    public static final String CONTENT_TYPE = "Content-Type";

    public CapturedResponse {
        headers = copyHeaders(headers);
        body = body == null ? new byte[0] : body.clone();
    }

    /** @return Kopie der Body-Bytes */
    @Override
    public byte[] body() {
        return body.clone();
    }

    /** @return Länge des Bodys in Bytes, ohne Kopie */
    public int bodyLength() {
        return body.length;
    }

    /**
     * Baut eine Antwort mit genau einem Content-Type-Header.
     *
     * @param status      Statuscode
     * @param contentType Content-Type oder {@code null}
     * @param body        Body-Text (UTF-8)
     * @return Antwort
     */
    public static CapturedResponse of(int status, String contentType, String body) {
        Map<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (contentType != null) h.put(CONTENT_TYPE, List.of(contentType));
        return new CapturedResponse(status, h, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    /** {@code true} für 2xx, entspricht {@code response.ok}. */
    public boolean isOk() {
        return status >= 200 && status < 300;
    }

    /** {@code true} für {@code [200, 400)}, die breitere Grenze von Cache-First. */
    public boolean isCacheable() {
        return status >= 200 && status < 400;
    }

    /**
     * Liefert den ersten Wert eines Headers.
     *
     * @param name Header-Name (case-insensitiv)
     * @return erster Wert oder leer
     */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    public Optional<String> contentType() {
        return header(CONTENT_TYPE);
    }

    /**
     * Kopie mit gesetztem (ersetztem) Header.
     *
     * @param name  Header-Name
     * @param value Wert
     * @return neue Antwort
     */
    public CapturedResponse withHeader(String name, String value) {
        Map<String, List<String>> next = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        next.putAll(headers);
        next.put(name, List.of(value));
        return new CapturedResponse(status, next, body);
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            source.forEach((name, values) -> {
                if (name != null && values != null) {
                    copy.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "CapturedResponse[status=" + status + ", headers=" + headers + ", bodyLength=" + body.length + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CapturedResponse other = (CapturedResponse) o;
        return status == other.status && headers.equals(other.headers) && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, headers, Arrays.hashCode(body));
    }
}

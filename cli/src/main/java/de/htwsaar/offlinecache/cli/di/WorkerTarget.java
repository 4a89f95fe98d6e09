package de.htwsaar.offlinecache.cli.di;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Aktuell angesprochener Worker.
 *
 * <p>Commands ohne {@code -H} verwenden dieses Ziel; die Shell kann es mit {@code use <url>} umstellen.
 * Startwert: System-Property {@value #HOST_PROPERTY}, dann Umgebungsvariable {@value #HOST_ENV},
 * sonst {@value #DEFAULT_HOST}.
 */
public final class WorkerTarget {

    public static final String HOST_PROPERTY = "offline-cache.host";
    public static final String HOST_ENV = "OFFLINE_CACHE_HOST";
    public static final String DEFAULT_HOST = "http://localhost:8080";

    private final AtomicReference<URI> current;

    public WorkerTarget(URI initial) {
        this.current = new AtomicReference<>(validate(Objects.requireNonNull(initial, "initial must not be null")));
    }

    public static WorkerTarget localDefault() {
        return new WorkerTarget(URI.create(DEFAULT_HOST));
    }

    /**
     * Ermittelt das Startziel aus System-Properties und Umgebung.
     *
     * @param env        Umgebungsvariablen
     * @param properties System-Properties
     * @return Ziel; ungültige Werte fallen nicht stillschweigend auf den Default zurück
     * @throws IllegalArgumentException wenn der konfigurierte Wert keine http(s)-URL ist
     */
    public static WorkerTarget fromEnvironment(Map<String, String> env, Properties properties) {
        String configured = properties.getProperty(HOST_PROPERTY);
        if (configured == null || configured.isBlank()) configured = env.get(HOST_ENV);
        if (configured == null || configured.isBlank()) return localDefault();
        return new WorkerTarget(parse(configured));
    }

    public URI current() {
        return current.get();
    }

    /**
     * Stellt auf einen anderen Worker um.
     *
     * @param url Basis-URL, z. B. {@code http://localhost:9090}
     * @return neues Ziel
     * @throws IllegalArgumentException bei relativer URL oder anderem Schema als http/https
     */
    public URI switchTo(String url) {
        URI next = parse(url);
        current.set(next);
        return next;
    }

    /** Host und Port für den Shell-Prompt, z. B. {@code localhost:8080}. */
    public String label() {
        URI uri = current.get();
        return uri.getPort() < 0 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }

    private static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("worker url must not be blank");
        }
        try {
            return validate(URI.create(url.trim()));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("invalid worker url: " + url.trim(), ex);
        }
    }

    private static URI validate(URI uri) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("worker url must be an absolute http(s) url: " + uri);
        }
        return uri;
    }
}

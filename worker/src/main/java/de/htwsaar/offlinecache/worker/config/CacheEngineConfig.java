package de.htwsaar.offlinecache.worker.config;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Konfiguration der Cache-Engine, einmal beim Start gebaut, danach unveränderlich.
 *
 * <p>Ersetzt globale Konstanten (Cache-Namen, Version, Mustertabellen). Eine neue Version
 * ({@code version}) ist der einzige Auslöser für das Löschen veralteter Partitionen bei der
 * nächsten Aktivierung.</p>
 *
 * @param servingOrigin       Origin, unter dem der Worker ausliefert (z. B. {@code http://localhost:8080})
 * @param cachePrefix         Präfix der Partitionsnamen (z. B. {@code offline})
 * @param version             Versionskennung, eingebettet in alle verwalteten Partitionsnamen
 * @param precacheManifest    wurzelrelative URLs, die bei der Installation gecacht werden
 * @param strictInstall       {@code true}: ein fehlgeschlagener Manifest-Eintrag bricht die Installation ab
 * @param skipWaiting         {@code true}: Aktivierung direkt nach der Installation
 * @param networkFirstTtl     maximales Alter eines Network-First-Eintrags als Offline-Ersatz
 * @param networkFirstTimeout Timeout des Network-First-Fetches ({@link Duration#ZERO} = keiner)
 * @param trustedOrigins      fremde Origins, die trotzdem abgefangen werden
 * @param ignoredPaths        Pfad-Fragmente, die nie abgefangen werden (z. B. {@code /sw.js})
 * @param patterns            Mustertabelle des Klassifizierers
 */
public record CacheEngineConfig(
        URI servingOrigin,
        String cachePrefix,
        String version,
        List<String> precacheManifest,
        boolean strictInstall,
        boolean skipWaiting,
        Duration networkFirstTtl,
        Duration networkFirstTimeout,
        Set<String> trustedOrigins,
        List<String> ignoredPaths,
        PatternTable patterns) {

    public static final Duration DEFAULT_NETWORK_FIRST_TTL = Duration.ofMinutes(5);

    public CacheEngineConfig {
        Objects.requireNonNull(servingOrigin, "servingOrigin must not be null");
        Objects.requireNonNull(patterns, "patterns must not be null");
        if (cachePrefix == null || cachePrefix.isBlank()) throw new IllegalArgumentException("cachePrefix must not be blank");
        if (version == null || version.isBlank()) throw new IllegalArgumentException("version must not be blank");
        cachePrefix = cachePrefix.trim();
        version = version.trim();
        precacheManifest = List.copyOf(precacheManifest);
        networkFirstTtl = networkFirstTtl == null || networkFirstTtl.isNegative() ? DEFAULT_NETWORK_FIRST_TTL : networkFirstTtl;
        networkFirstTimeout =
                networkFirstTimeout == null || networkFirstTimeout.isNegative() ? Duration.ZERO : networkFirstTimeout;
        trustedOrigins = Set.copyOf(trustedOrigins);
        ignoredPaths = List.copyOf(ignoredPaths);
    }

    /**
     * Standardkonfiguration für einen Origin.
     *
     * @param servingOrigin Origin des Workers
     * @return Konfiguration mit Version {@code 1.0.1}, lenienter Installation und Skip-Waiting
     */
    public static CacheEngineConfig defaults(URI servingOrigin) {
        return new CacheEngineConfig(
                servingOrigin,
                "offline",
                "1.0.1",
                List.of("/", "/index.html", "/manifest.json"),
                false,
                true,
                DEFAULT_NETWORK_FIRST_TTL,
                Duration.ZERO,
                Set.of(),
                List.of("/sw.js", "_next/", "__webpack"),
                PatternTable.defaults());
    }

    public CacheEngineConfig withVersion(String nextVersion) {
        return new CacheEngineConfig(servingOrigin, cachePrefix, nextVersion, precacheManifest, strictInstall,
                skipWaiting, networkFirstTtl, networkFirstTimeout, trustedOrigins, ignoredPaths, patterns);
    }

    public CacheEngineConfig withPrecacheManifest(List<String> manifest) {
        return new CacheEngineConfig(servingOrigin, cachePrefix, version, manifest, strictInstall,
                skipWaiting, networkFirstTtl, networkFirstTimeout, trustedOrigins, ignoredPaths, patterns);
    }

    public CacheEngineConfig withStrictInstall(boolean strict) {
        return new CacheEngineConfig(servingOrigin, cachePrefix, version, precacheManifest, strict,
                skipWaiting, networkFirstTtl, networkFirstTimeout, trustedOrigins, ignoredPaths, patterns);
    }

    public CacheEngineConfig withSkipWaiting(boolean skip) {
        return new CacheEngineConfig(servingOrigin, cachePrefix, version, precacheManifest, strictInstall,
                skip, networkFirstTtl, networkFirstTimeout, trustedOrigins, ignoredPaths, patterns);
    }

    public CacheEngineConfig withNetworkFirstTimeout(Duration timeout) {
        return new CacheEngineConfig(servingOrigin, cachePrefix, version, precacheManifest, strictInstall,
                skipWaiting, networkFirstTtl, timeout, trustedOrigins, ignoredPaths, patterns);
    }

    public CacheEngineConfig withTrustedOrigins(Set<String> origins) {
        return new CacheEngineConfig(servingOrigin, cachePrefix, version, precacheManifest, strictInstall,
                skipWaiting, networkFirstTtl, networkFirstTimeout, origins, ignoredPaths, patterns);
    }

    /**
     * Löst eine wurzelrelative URL gegen den Serving-Origin auf; absolute URLs bleiben unverändert.
     *
     * @param url wurzelrelative oder absolute URL
     * @return absolute URI
     */
    public URI resolve(String url) {
        return servingOrigin.resolve(url.trim());
    }
}

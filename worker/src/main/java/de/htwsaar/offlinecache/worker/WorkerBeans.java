package de.htwsaar.offlinecache.worker;

import de.htwsaar.offlinecache.worker.adapter.http.HttpNetworkClient;
import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.config.PatternTable;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.NetworkClient;
import de.htwsaar.offlinecache.worker.store.CacheStorage;
import de.htwsaar.offlinecache.worker.store.InMemoryCacheStorage;
import de.htwsaar.offlinecache.worker.store.StorageQuota;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Zentrale Spring-Verdrahtung der Worker-Komponenten.
 *
 * <p>Schichtung: Controller → Dispatcher → Strategien → Store/Ports → Adapter</p>
 */
@Configuration
@Profile("worker")
public class WorkerBeans {

    /**
     * Systemuhr für den gesamten Worker-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Asynchroner HTTP-Client für alle Netzwerkzugriffe.
     *
     * @param connectTimeoutMs Verbindungs-Timeout in ms (Standard: 5000)
     * @return HttpClient
     */
    @Bean
    public HttpClient httpClient(@Value("${worker.network.connect-timeout-ms:5000}") long connectTimeoutMs) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, connectTimeoutMs)))
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * Baut die unveränderliche Engine-Konfiguration aus den Properties.
     *
     * @param servingOrigin     Origin des Workers
     * @param prefix            Präfix der Partitionsnamen (Standard: "offline")
     * @param version           Versionskennung (Standard: "1.0.1")
     * @param manifest          Precache-Manifest
     * @param strictInstall     strikte Installation (Standard: false)
     * @param skipWaiting       Aktivierung direkt nach der Installation (Standard: true)
     * @param networkFirstTtlMs maximales Alter für den Network-First-Fallback in ms (Standard: 300000)
     * @param timeoutMs         Network-First-Timeout in ms (Standard: 0 = keiner)
     * @param trustedOrigins    fremde Origins, die trotzdem abgefangen werden
     * @param ignoredPaths      nie abgefangene Pfade
     * @param cacheFirst        Muster für Cache-First (leer = Standardtabelle)
     * @param networkFirst      Muster für Network-First (leer = Standardtabelle)
     * @param swr               Muster für Stale-While-Revalidate (leer = Standardtabelle)
     * @return Engine-Konfiguration
     */
    @Bean
    public CacheEngineConfig cacheEngineConfig(
            @Value("${worker.serving-origin:http://localhost:8080}") String servingOrigin,
            @Value("${worker.cache.prefix:offline}") String prefix,
            @Value("${worker.cache.version:1.0.1}") String version,
            @Value("${worker.precache.manifest:/,/index.html,/manifest.json}") List<String> manifest,
            @Value("${worker.install.strict:false}") boolean strictInstall,
            @Value("${worker.lifecycle.skip-waiting:true}") boolean skipWaiting,
            @Value("${worker.network-first.ttl-ms:300000}") long networkFirstTtlMs,
            @Value("${worker.network-first.timeout-ms:0}") long timeoutMs,
            @Value("${worker.trusted-origins:}") List<String> trustedOrigins,
            @Value("${worker.ignored-paths:/sw.js,_next/,__webpack}") List<String> ignoredPaths,
            @Value("${worker.patterns.cache-first:}") List<String> cacheFirst,
            @Value("${worker.patterns.network-first:}") List<String> networkFirst,
            @Value("${worker.patterns.stale-while-revalidate:}") List<String> swr) {

        Set<String> origins = new LinkedHashSet<>();
        for (String origin : trustedOrigins) {
            if (!origin.isBlank()) origins.add(InterceptedRequest.originOf(URI.create(origin.trim())));
        }
        return new CacheEngineConfig(
                URI.create(servingOrigin),
                prefix,
                version,
                manifest.stream().map(String::trim).filter(s -> !s.isEmpty()).toList(),
                strictInstall,
                skipWaiting,
                Duration.ofMillis(Math.max(0, networkFirstTtlMs)),
                Duration.ofMillis(Math.max(0, timeoutMs)),
                origins,
                ignoredPaths.stream().map(String::trim).filter(s -> !s.isEmpty()).toList(),
                patternTable(cacheFirst, networkFirst, swr));
    }

    private static PatternTable patternTable(List<String> cacheFirst, List<String> networkFirst, List<String> swr) {
        PatternTable defaults = PatternTable.defaults();
        return new PatternTable(
                orDefault(PatternTable.compile(cacheFirst), defaults.cacheFirst()),
                orDefault(PatternTable.compile(networkFirst), defaults.networkFirst()),
                orDefault(PatternTable.compile(swr), defaults.staleWhileRevalidate()));
    }

    private static List<Pattern> orDefault(List<Pattern> configured, List<Pattern> fallback) {
        return configured.isEmpty() ? fallback : configured;
    }

    /**
     * In-Memory-Storage mit gemeinsamem Byte-Kontingent.
     *
     * @param quotaBytes maximale Body-Bytes (Standard: 50 MiB, 0 = unbegrenzt)
     * @return Storage-Substrat
     */
    @Bean
    public CacheStorage cacheStorage(@Value("${worker.cache.quota-bytes:52428800}") long quotaBytes) {
        return new InMemoryCacheStorage(new StorageQuota(quotaBytes));
    }

    /**
     * Adapter-Implementierung des {@link NetworkClient}-Ports via HTTP.
     *
     * @param httpClient      HTTP-Client
     * @param config          Engine-Konfiguration (Serving-Origin)
     * @param upstreamBaseUrl Basis-URL des Upstreams
     * @return {@link HttpNetworkClient}
     */
    @Bean
    public NetworkClient networkClient(
            HttpClient httpClient,
            CacheEngineConfig config,
            @Value("${worker.upstream.base-url}") String upstreamBaseUrl) {
        return new HttpNetworkClient(httpClient, config.servingOrigin(), URI.create(upstreamBaseUrl));
    }
}

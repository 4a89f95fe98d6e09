package de.htwsaar.offlinecache.worker.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;

import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.config.PatternTable;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PatternClassifierTest {

    private final PatternClassifier classifier =
            new PatternClassifier(CacheEngineConfig.defaults(URI.create("http://app.test")));

    @ParameterizedTest
    @CsvSource({
        "/assets/logo.png, CACHE_FIRST",
        "/chunk-abc123.js, CACHE_FIRST",
        "/index-Xy9.css, CACHE_FIRST",
        "/fonts/inter.woff2, CACHE_FIRST",
        "/api/patients?page=2, NETWORK_FIRST",
        "/auth/login, NETWORK_FIRST",
        "/services/gemini/chat, NETWORK_FIRST",
        "/about.html, STALE_WHILE_REVALIDATE",
        "/, STALE_WHILE_REVALIDATE",
        "/manifest.json, STALE_WHILE_REVALIDATE",
        "/patients/42, NETWORK_ONLY",
        "/api.json, NETWORK_ONLY"
    })
    @DisplayName("Standardtabelle ordnet typische URLs zu")
    void shouldClassifyWithDefaultTable(String url, StrategyTag expected) {
        assertEquals(expected, classifier.classify(url));
    }

    @Test
    @DisplayName("Cache-First hat Vorrang vor Network-First")
    void shouldPreferCacheFirstOverNetworkFirst() {
        assertEquals(StrategyTag.CACHE_FIRST, classifier.classify("/api/bundle.js"));
        assertEquals(StrategyTag.CACHE_FIRST, classifier.classify("/assets/api/"));
    }

    @Test
    @DisplayName("Query-String gehört zur Eingabe: Endungs-Muster greifen nicht mehr")
    void shouldSearchPathAndQuery() {
        assertEquals(StrategyTag.NETWORK_ONLY, classifier.classify("/app.js?v=3"));
        assertEquals(StrategyTag.NETWORK_FIRST, classifier.classify("/search?q=/api/"));
    }

    @Test
    void shouldBeTotalForNullAndEmpty() {
        assertEquals(StrategyTag.NETWORK_ONLY, classifier.classify(null));
        assertEquals(StrategyTag.NETWORK_ONLY, classifier.classify(""));
    }

    @Test
    void shouldUseConfiguredTable() {
        PatternTable table = new PatternTable(
                PatternTable.compile(List.of("\\.bin$")),
                PatternTable.compile(List.of("^/rpc/")),
                List.of());
        CacheEngineConfig base = CacheEngineConfig.defaults(URI.create("http://app.test"));
        CacheEngineConfig config = new CacheEngineConfig(
                base.servingOrigin(),
                base.cachePrefix(),
                base.version(),
                base.precacheManifest(),
                base.strictInstall(),
                base.skipWaiting(),
                base.networkFirstTtl(),
                base.networkFirstTimeout(),
                base.trustedOrigins(),
                base.ignoredPaths(),
                table);
        PatternClassifier custom = new PatternClassifier(config);

        assertEquals(StrategyTag.CACHE_FIRST, custom.classify("/data/blob.bin"));
        assertEquals(StrategyTag.NETWORK_FIRST, custom.classify("/rpc/call"));
        assertEquals(StrategyTag.NETWORK_ONLY, custom.classify("/index.html"));
    }

    @Test
    void shouldExposeWireNames() {
        assertEquals("stale-while-revalidate", StrategyTag.STALE_WHILE_REVALIDATE.wireName());
        assertEquals("network-only", StrategyTag.NETWORK_ONLY.wireName());
    }
}

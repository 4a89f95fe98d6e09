package de.htwsaar.offlinecache.worker.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.domain.CacheDecision;
import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import de.htwsaar.offlinecache.worker.domain.Resolution;
import de.htwsaar.offlinecache.worker.store.CacheEntry;
import de.htwsaar.offlinecache.worker.store.InMemoryCacheStorage;
import de.htwsaar.offlinecache.worker.store.LogicalPartition;
import de.htwsaar.offlinecache.worker.store.StorageQuota;
import de.htwsaar.offlinecache.worker.support.FakeNetworkClient;
import de.htwsaar.offlinecache.worker.support.TestEngine;
import java.net.URI;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CacheFirstStrategyTest {

    private static final String LOGO = TestEngine.ORIGIN + "/assets/logo.png";

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = TestEngine.create();
    }

    @Test
    @DisplayName("Miss lädt, stempelt und speichert; der zweite Aufruf ist ein Hit ohne Netzwerk")
    void shouldCacheOnMissAndServeHitWithoutNetwork() {
        engine.network.respond(LOGO, CapturedResponse.of(200, "image/png", "png-bytes"));

        Resolution first = engine.cacheFirst.handle(request()).join();
        Resolution second = engine.cacheFirst.handle(request()).join();

        assertEquals(CacheDecision.MISS, first.decision());
        assertEquals(Long.toString(TestEngine.START.toEpochMilli()),
                first.response().header(CacheHeaders.CACHED_AT).orElseThrow());
        assertEquals("1.0.1", first.response().header(CacheHeaders.CACHE_VERSION).orElseThrow());
        assertEquals(CacheDecision.HIT, second.decision());
        assertEquals("png-bytes", second.response().bodyText());
        assertEquals("image/png", second.response().contentType().orElseThrow());
        assertEquals(1, engine.network.callCount(LOGO));
    }

    @Test
    @DisplayName("3xx zählt für Cache-First als cachebar")
    void shouldCacheRedirects() {
        engine.network.respond(LOGO, CapturedResponse.of(304, null, ""));

        engine.cacheFirst.handle(request()).join();

        assertTrue(cached().isPresent());
    }

    @Test
    void shouldReturnErrorsUnstored() {
        engine.network.respond(LOGO, 404, "gone");

        Resolution resolution = engine.cacheFirst.handle(request()).join();

        assertEquals(404, resolution.response().status());
        assertFalse(resolution.response().header(CacheHeaders.CACHED_AT).isPresent());
        assertTrue(cached().isEmpty());
    }

    @Test
    void shouldAnswerOfflineWithPlainText503() {
        engine.network.goOffline();

        Resolution resolution = engine.cacheFirst.handle(request()).join();

        assertEquals(CacheDecision.OFFLINE, resolution.decision());
        assertEquals(503, resolution.response().status());
        assertEquals("text/plain", resolution.response().contentType().orElseThrow());
        assertEquals("Offline - resource not available", resolution.response().bodyText());
    }

    @Test
    @DisplayName("Eintrag, der während des Fetches auftaucht, dient als Offline-Ersatz")
    void shouldFallBackToEntryWrittenDuringFetch() {
        var pending = engine.network.hold(LOGO);

        var future = engine.cacheFirst.handle(request());
        engine.storeManager.put(
                engine.storeManager.openPartition(LogicalPartition.STATIC),
                RequestKey.get(TestEngine.url("/assets/logo.png")),
                CapturedResponse.of(200, "image/png", "precached"),
                TestEngine.START);
        pending.completeExceptionally(new IllegalStateException("connection reset"));

        Resolution resolution = future.join();
        assertEquals(CacheDecision.STALE_FALLBACK, resolution.decision());
        assertEquals("precached", resolution.response().bodyText());
    }

    @Test
    @DisplayName("abgelehnter Schreibvorgang liefert trotzdem die Netzwerk-Antwort")
    void shouldServeNetworkResponseWhenStoreRejectsWrite() {
        engine = TestEngine.create(
                CacheEngineConfig.defaults(URI.create(TestEngine.ORIGIN)),
                new InMemoryCacheStorage(new StorageQuota(4)),
                new FakeNetworkClient());
        engine.network.respond(LOGO, CapturedResponse.of(200, "image/png", "png-bytes"));

        Resolution resolution = engine.cacheFirst.handle(request()).join();

        assertEquals(CacheDecision.MISS, resolution.decision());
        assertEquals(200, resolution.response().status());
        assertEquals("png-bytes", resolution.response().bodyText());
        assertTrue(cached().isEmpty());
        assertEquals(0, engine.storeManager.quota().usedBytes());
    }

    private InterceptedRequest request() {
        return InterceptedRequest.get(TestEngine.url("/assets/logo.png"));
    }

    private Optional<CacheEntry> cached() {
        return engine.storeManager.get(
                engine.storeManager.openPartition(LogicalPartition.STATIC),
                RequestKey.get(TestEngine.url("/assets/logo.png")));
    }
}

package de.htwsaar.offlinecache.worker.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.offlinecache.worker.domain.CacheDecision;
import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import de.htwsaar.offlinecache.worker.domain.Resolution;
import de.htwsaar.offlinecache.worker.store.CacheEntry;
import de.htwsaar.offlinecache.worker.store.LogicalPartition;
import de.htwsaar.offlinecache.worker.support.TestEngine;
import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StaleWhileRevalidateStrategyTest {

    private static final String PAGE = TestEngine.ORIGIN + "/about.html";

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = TestEngine.create();
    }

    @Test
    @DisplayName("Eintrag wird sofort geliefert, Revalidierung ersetzt ihn im Hintergrund")
    void shouldServeStaleAndRevalidateInBackground() {
        engine.network.respond(PAGE, CapturedResponse.of(200, "text/html", "v1"));
        engine.staleWhileRevalidate.handle(request()).join();

        CompletableFuture<CapturedResponse> pending = engine.network.hold(PAGE);
        Resolution resolution = engine.staleWhileRevalidate.handle(request()).join();

        assertEquals(CacheDecision.HIT, resolution.decision());
        assertEquals("v1", resolution.response().bodyText());
        assertEquals("v1", entry().orElseThrow().response().bodyText());

        pending.complete(CapturedResponse.of(200, "text/html", "v2"));
        assertEquals("v2", entry().orElseThrow().response().bodyText());
    }

    @Test
    void shouldAwaitNetworkWhenNothingIsCached() {
        engine.network.respond(PAGE, CapturedResponse.of(200, "text/html", "fresh"));

        Resolution resolution = engine.staleWhileRevalidate.handle(request()).join();

        assertEquals(CacheDecision.MISS, resolution.decision());
        assertEquals("fresh", resolution.response().bodyText());
        assertTrue(entry().isPresent());
        assertFalse(entry().get().response().header(CacheHeaders.CACHED_AT).isPresent());
    }

    @Test
    void shouldNotReplaceEntryWithErrorResponse() {
        engine.network.respond(PAGE, CapturedResponse.of(200, "text/html", "good"));
        engine.staleWhileRevalidate.handle(request()).join();
        engine.network.respond(PAGE, 500, "bad");

        Resolution resolution = engine.staleWhileRevalidate.handle(request()).join();

        assertEquals("good", resolution.response().bodyText());
        assertEquals("good", entry().orElseThrow().response().bodyText());
    }

    @Test
    void shouldPassThroughUnauthorizedManifest() {
        String manifest = TestEngine.ORIGIN + "/manifest.json";
        engine.network.respond(manifest, 401, "unauthorized");

        Resolution resolution = engine.staleWhileRevalidate
                .handle(InterceptedRequest.get(URI.create(manifest)))
                .join();

        assertEquals(401, resolution.response().status());
    }

    @Test
    void shouldAnswerServiceUnavailableWhenOfflineAndUncached() {
        engine.network.goOffline();

        Resolution resolution = engine.staleWhileRevalidate.handle(request()).join();

        assertEquals(CacheDecision.OFFLINE, resolution.decision());
        assertEquals(503, resolution.response().status());
        assertEquals("Service Unavailable", resolution.response().bodyText());
    }

    @Test
    @DisplayName("Offline mit Eintrag: Hit, fehlgeschlagene Revalidierung bleibt folgenlos")
    void shouldServeCachedWhenOffline() {
        engine.network.respond(PAGE, CapturedResponse.of(200, "text/html", "cached"));
        engine.staleWhileRevalidate.handle(request()).join();
        engine.network.goOffline();

        Resolution resolution = engine.staleWhileRevalidate.handle(request()).join();

        assertEquals(CacheDecision.HIT, resolution.decision());
        assertEquals("cached", entry().orElseThrow().response().bodyText());
    }

    private InterceptedRequest request() {
        return InterceptedRequest.get(URI.create(PAGE));
    }

    private Optional<CacheEntry> entry() {
        return engine.storeManager.get(
                engine.storeManager.openPartition(LogicalPartition.DYNAMIC), RequestKey.get(URI.create(PAGE)));
    }
}

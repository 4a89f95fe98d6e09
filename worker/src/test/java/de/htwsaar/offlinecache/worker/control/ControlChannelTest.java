package de.htwsaar.offlinecache.worker.control;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.dto.ControlMessageType;
import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import de.htwsaar.offlinecache.worker.store.LogicalPartition;
import de.htwsaar.offlinecache.worker.support.TestEngine;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ControlChannelTest {

    @Test
    @DisplayName("CACHE_STATS zählt alle Partitionen, verwaltete und fremde")
    void shouldReportCacheStats() {
        TestEngine engine = TestEngine.create().activated();
        engine.storeManager.put(
                engine.storeManager.openPartition(LogicalPartition.API),
                RequestKey.get(TestEngine.url("/api/a")),
                CapturedResponse.of(200, null, "a"),
                TestEngine.START);
        engine.storeManager.registerForeign("legacy");

        ControlEnvelope reply = engine.controlChannel.handle(ControlEnvelope.command(ControlMessageType.CACHE_STATS)).join();

        assertEquals("CACHE_STATS_RESPONSE", reply.type());
        assertEquals(4, reply.payload().get("totalCaches"));
        assertEquals(1, reply.payload().get("totalEntries"));
        Map<?, ?> caches = (Map<?, ?>) reply.payload().get("caches");
        Map<?, ?> api = (Map<?, ?>) caches.get("offline-api-v1.0.1");
        assertEquals(1, api.get("count"));
        assertEquals(List.of(TestEngine.ORIGIN + "/api/a"), api.get("urls"));
    }

    @Test
    @DisplayName("CLEAR_CACHE und danach CACHE_STATS liefern keine Einträge")
    void shouldClearAndReportEmptyStats() {
        TestEngine engine = TestEngine.create().activated();
        engine.storeManager.registerForeign("offline-static-v0.1");

        ControlEnvelope cleared = engine.controlChannel.handle(ControlEnvelope.command(ControlMessageType.CLEAR_CACHE)).join();
        ControlEnvelope stats = engine.controlChannel.handle(ControlEnvelope.command(ControlMessageType.CACHE_STATS)).join();
        ControlEnvelope again = engine.controlChannel.handle(ControlEnvelope.command(ControlMessageType.CLEAR_CACHE)).join();

        assertEquals("CLEAR_CACHE_RESPONSE", cleared.type());
        assertEquals(4, cleared.payload().get("cleared"));
        assertEquals(0, stats.payload().get("totalCaches"));
        assertEquals(0, stats.payload().get("totalEntries"));
        assertEquals(0, again.payload().get("cleared"));
    }

    @Test
    @DisplayName("PRECACHE_URLS listet nur erfolgreich gecachte URLs")
    void shouldPrecacheIntoDynamic() {
        TestEngine engine = TestEngine.create().activated();
        engine.network.respond(TestEngine.ORIGIN + "/a", 200, "a").respond(TestEngine.ORIGIN + "/b", 404, "nope");

        ControlEnvelope reply = engine.controlChannel
                .handle(ControlEnvelope.command(ControlMessageType.PRECACHE_URLS, Map.of("urls", List.of("/a", "/b"))))
                .join();

        assertEquals("PRECACHE_URLS_RESPONSE", reply.type());
        assertEquals(List.of("/a"), reply.payload().get("cached"));
        assertEquals(
                "a",
                engine.storeManager
                        .get(engine.storeManager.openPartition(LogicalPartition.DYNAMIC),
                                RequestKey.get(URI.create(TestEngine.ORIGIN + "/a")))
                        .orElseThrow()
                        .response()
                        .bodyText());
    }

    @Test
    void shouldActivateWaitingWorkerOnSkipWaiting() {
        TestEngine engine = TestEngine.create(
                CacheEngineConfig.defaults(URI.create(TestEngine.ORIGIN)).withSkipWaiting(false));
        engine.lifecycle.start().join();

        ControlEnvelope reply = engine.controlChannel.handle(ControlEnvelope.command(ControlMessageType.SKIP_WAITING)).join();

        assertEquals("SKIP_WAITING_RESPONSE", reply.type());
        assertEquals("ACTIVE", reply.payload().get("state"));
    }

    @Test
    void shouldRejectUnknownMessagesWithoutSideEffects() {
        TestEngine engine = TestEngine.create().activated();
        List<String> before = engine.storeManager.partitionNames();

        assertThrows(ControlMessageException.class,
                () -> engine.controlChannel.handle(new ControlEnvelope("CLEAR_NOTIFICATIONS", null)));
        assertEquals(before, engine.storeManager.partitionNames());
    }
}

package de.htwsaar.offlinecache.worker.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.domain.RequestKey;
import de.htwsaar.offlinecache.worker.store.InMemoryCacheStorage;
import de.htwsaar.offlinecache.worker.store.LogicalPartition;
import de.htwsaar.offlinecache.worker.store.PrecacheResult;
import de.htwsaar.offlinecache.worker.store.StorageQuota;
import de.htwsaar.offlinecache.worker.support.FakeNetworkClient;
import de.htwsaar.offlinecache.worker.support.TestEngine;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WorkerLifecycleTest {

    private static final String ORIGIN = TestEngine.ORIGIN;

    @Test
    @DisplayName("Installation cacht das Manifest in static, Aktivierung übernimmt die Clients")
    void shouldInstallAndActivate() {
        TestEngine engine = TestEngine.create();
        okManifest(engine.network);

        PrecacheResult result = engine.lifecycle.install().join();
        assertEquals(WorkerState.INSTALLED, engine.lifecycle.state());
        assertFalse(engine.lifecycle.controlsClients());
        assertTrue(result.isComplete());

        engine.lifecycle.activate();
        assertEquals(WorkerState.ACTIVE, engine.lifecycle.state());
        assertTrue(engine.lifecycle.controlsClients());
        assertEquals(
                List.of("offline-static-v1.0.1", "offline-dynamic-v1.0.1", "offline-api-v1.0.1"),
                engine.storeManager.partitionNames());
        assertTrue(engine.storeManager
                .get(engine.storeManager.openPartition(LogicalPartition.STATIC),
                        RequestKey.get(URI.create(ORIGIN + "/index.html")))
                .isPresent());
    }

    @Test
    void shouldInstallLenientlyDespiteFailures() {
        TestEngine engine = TestEngine.create();
        engine.network.respond(ORIGIN + "/", 200, "home").fail(ORIGIN + "/index.html");

        PrecacheResult result = engine.lifecycle.install().join();

        assertEquals(WorkerState.INSTALLED, engine.lifecycle.state());
        assertEquals(List.of("/index.html", "/manifest.json"), result.failed());
    }

    @Test
    @DisplayName("strikte Installation mit Fehler endet in REDUNDANT")
    void shouldBecomeRedundantWhenStrictInstallFails() {
        TestEngine engine = TestEngine.create(
                CacheEngineConfig.defaults(URI.create(ORIGIN)).withStrictInstall(true));
        engine.network.respond(ORIGIN + "/", 200, "home");

        CompletionException ex = assertThrows(CompletionException.class, () -> engine.lifecycle.install().join());

        InstallationFailedException cause = assertInstanceOf(InstallationFailedException.class, ex.getCause());
        assertEquals(List.of("/index.html", "/manifest.json"), cause.getFailedUrls());
        assertEquals(WorkerState.REDUNDANT, engine.lifecycle.state());
        assertThrows(IllegalStateException.class, engine.lifecycle::activate);
    }

    @Test
    @DisplayName("ohne Skip-Waiting wartet der Worker bis SKIP_WAITING")
    void shouldWaitWithoutSkipWaiting() {
        TestEngine engine = TestEngine.create(
                CacheEngineConfig.defaults(URI.create(ORIGIN)).withSkipWaiting(false));

        assertEquals(WorkerState.INSTALLED, engine.lifecycle.start().join());
        assertEquals(WorkerState.ACTIVE, engine.lifecycle.skipWaiting());
        assertEquals(WorkerState.ACTIVE, engine.lifecycle.skipWaiting());
    }

    @Test
    void shouldActivateImmediatelyWithSkipWaiting() {
        TestEngine engine = TestEngine.create();

        assertEquals(WorkerState.ACTIVE, engine.lifecycle.start().join());
    }

    @Test
    @DisplayName("Versionswechsel: neue Version löscht alte Partitionen bei der Aktivierung")
    void shouldPurgePreviousVersionOnActivation() {
        InMemoryCacheStorage storage = new InMemoryCacheStorage(StorageQuota.unbounded());
        FakeNetworkClient network = new FakeNetworkClient();
        okManifest(network);
        CacheEngineConfig v1 = CacheEngineConfig.defaults(URI.create(ORIGIN));

        TestEngine.create(v1, storage, network).activated();
        storage.open("user-downloads");

        TestEngine second = TestEngine.create(v1.withVersion("1.0.2"), storage, network);
        second.lifecycle.install().join();
        assertTrue(storage.names().contains("offline-static-v1.0.1"));

        List<String> purged = second.lifecycle.activate();

        assertEquals(
                List.of("offline-static-v1.0.1", "offline-dynamic-v1.0.1", "offline-api-v1.0.1"), purged);
        assertEquals(
                List.of("user-downloads", "offline-static-v1.0.2", "offline-dynamic-v1.0.2", "offline-api-v1.0.2"),
                storage.names());
    }

    @Test
    void shouldRejectSecondInstall() {
        TestEngine engine = TestEngine.create().activated();

        assertThrows(IllegalStateException.class, engine.lifecycle::install);
    }

    private static void okManifest(FakeNetworkClient network) {
        network.respond(ORIGIN + "/", 200, "home")
                .respond(ORIGIN + "/index.html", 200, "index")
                .respond(ORIGIN + "/manifest.json", 200, "{}");
    }
}

package de.htwsaar.offlinecache.common.serialization;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.dto.ControlMessageType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonCodecTest {

    @Test
    void testToJson_omitsMissingPayload() {
        String json = JacksonCodec.toJson(ControlEnvelope.command(ControlMessageType.CACHE_STATS));

        assertEquals("{\"type\":\"CACHE_STATS\"}", json);
    }

    @Test
    void testToJson_writesInstantsAsIsoStrings() {
        String json = JacksonCodec.toJson(Map.of("timestamp", Instant.parse("2026-01-01T10:15:30Z")));

        assertTrue(json.contains("\"2026-01-01T10:15:30Z\""));
    }

    @Test
    void testFromJson_readsPrecacheCommand() {
        String json = "{\"type\":\"PRECACHE_URLS\",\"payload\":{\"urls\":[\"/a\",\"/b\"]},\"messageId\":7}";

        ControlEnvelope envelope = JacksonCodec.fromJson(json, ControlEnvelope.class);

        assertEquals("PRECACHE_URLS", envelope.type());
        assertEquals(List.of("/a", "/b"), envelope.payload().get("urls"));
    }

    @Test
    void testFromJson_InvalidJson_ThrowsException() {
        // Kein gültiges JSON
        String invalidJson = "{type: kaputt}";
        assertThrows(OfflineCacheSerializationException.class, () -> {
            JacksonCodec.fromJson(invalidJson, ControlEnvelope.class);
        });
    }
}

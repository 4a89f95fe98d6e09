package de.htwsaar.offlinecache.common.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ControlMessageTypeTest {

    @Test
    void responseTypeAppendsSuffix() {
        assertEquals("CACHE_STATS_RESPONSE", ControlMessageType.CACHE_STATS.responseType());
        assertEquals("PRECACHE_URLS_RESPONSE", ControlMessageType.PRECACHE_URLS.responseType());
    }

    @Test
    void fromWireNameIsLenientAboutCaseAndWhitespace() {
        assertEquals(Optional.of(ControlMessageType.CLEAR_CACHE), ControlMessageType.fromWireName(" clear_cache "));
    }

    @Test
    void fromWireNameRejectsUnknownAndBlankTypes() {
        assertTrue(ControlMessageType.fromWireName("GET_NOTIFICATIONS").isEmpty());
        assertTrue(ControlMessageType.fromWireName("  ").isEmpty());
        assertTrue(ControlMessageType.fromWireName(null).isEmpty());
    }

    @Test
    void responseEnvelopeCarriesResponseType() {
        ControlEnvelope reply = ControlEnvelope.response(ControlMessageType.CLEAR_CACHE, Map.of("cleared", 3));

        assertEquals("CLEAR_CACHE_RESPONSE", reply.type());
        assertEquals(3, reply.payload().get("cleared"));
    }
}

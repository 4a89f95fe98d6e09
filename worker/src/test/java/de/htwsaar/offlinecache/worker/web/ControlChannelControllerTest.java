package de.htwsaar.offlinecache.worker.web;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import de.htwsaar.offlinecache.worker.control.ControlChannel;
import de.htwsaar.offlinecache.worker.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ControlChannelControllerTest {

    private TestEngine engine;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        engine = TestEngine.create().activated();
        ControlChannel channel = engine.controlChannel;
        mockMvc = MockMvcBuilders.standaloneSetup(new ControlChannelController(channel)).build();
    }

    @Test
    void shouldAnswerCacheStats() throws Exception {
        MvcResult pending = mockMvc.perform(post("/_worker/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"CACHE_STATS\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("CACHE_STATS_RESPONSE"))
                .andExpect(jsonPath("$.payload.totalCaches").value(3))
                .andExpect(jsonPath("$.payload.caches", hasKey("offline-static-v1.0.1")));
    }

    @Test
    void shouldAnswerPrecacheWithCachedUrls() throws Exception {
        engine.network.respond(TestEngine.ORIGIN + "/a", 200, "a");

        MvcResult pending = mockMvc.perform(post("/_worker/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"PRECACHE_URLS\",\"payload\":{\"urls\":[\"/a\",\"/b\"]}}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("PRECACHE_URLS_RESPONSE"))
                .andExpect(jsonPath("$.payload.cached", contains("/a")));
    }

    @Test
    @DisplayName("unbekannter Typ: 400 mit ERROR-Envelope")
    void shouldRejectUnknownType() throws Exception {
        mockMvc.perform(post("/_worker/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"GET_NOTIFICATIONS\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("ERROR"))
                .andExpect(jsonPath("$.payload.error", containsString("GET_NOTIFICATIONS")));
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        mockMvc.perform(post("/_worker/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("ERROR"));
    }

    @Test
    void shouldRejectEmptyBody() throws Exception {
        mockMvc.perform(post("/_worker/messages").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest());
    }
}

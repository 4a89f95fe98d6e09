package de.htwsaar.offlinecache.worker.web;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Probes, Info und Admin-Statistik des Workers. */
class WorkerProbeControllerTest {

    private TestEngine engine;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        engine = TestEngine.create();
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new WorkerProbeController(engine.lifecycle),
                        new WorkerInfoController(engine.config, engine.lifecycle, engine.storeManager),
                        new WorkerAdminStatsController(engine.metrics, engine.storeManager))
                .build();
    }

    @Test
    void shouldReportReadyOnlyWhenActive() throws Exception {
        mockMvc.perform(get("/_worker/health")).andExpect(status().isOk()).andExpect(content().string("ok"));
        mockMvc.perform(get("/_worker/ready"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(content().string("UNINSTALLED"));

        engine.activated();

        mockMvc.perform(get("/_worker/ready")).andExpect(status().isOk()).andExpect(content().string("ready"));
    }

    @Test
    void shouldDescribeWorker() throws Exception {
        engine.activated();

        mockMvc.perform(get("/_worker/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("1.0.1"))
                .andExpect(jsonPath("$.state").value("ACTIVE"))
                .andExpect(jsonPath("$.partitions", hasSize(3)))
                .andExpect(jsonPath("$.storage.usedBytes").isNumber())
                .andExpect(jsonPath("$.storage.maxBytes").value(0));
    }

    @Test
    void shouldExposeMetricsSnapshot() throws Exception {
        engine.activated();
        engine.dispatcher.dispatch(InterceptedRequest.get(TestEngine.url("/patients/1"))).join();

        mockMvc.perform(get("/_worker/admin/stats").param("windowSec", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRequests").value(1))
                .andExpect(jsonPath("$.byStrategy['network-only']").value(1))
                .andExpect(jsonPath("$.byDecision.BYPASS").value(1))
                .andExpect(jsonPath("$.cachedEntries").value(0));
    }
}

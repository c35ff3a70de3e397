package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.service.MetricSeriesStore;
import com.sandy.adpulse.monitor.service.impl.AlertEngineService;
import com.sandy.adpulse.monitor.service.impl.MonitoringScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class MonitoringControllerApiTest {
    @Autowired MockMvc mockMvc;
    @Autowired MonitoringScheduler monitoringScheduler;
    @Autowired MetricSeriesStore seriesStore;
    @Autowired AlertEngineService alertEngineService;

    @BeforeEach
    void setup() {
        monitoringScheduler.stop();
        seriesStore.clear();
        alertEngineService.drainPending();
    }

    @AfterEach
    void tearDown() {
        monitoringScheduler.stop();
    }

    @Test
    void startStopStatus() throws Exception {
        mockMvc.perform(get("/api/monitoring/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active", is(false)));

        mockMvc.perform(post("/api/monitoring/start"))
                .andExpect(jsonPath("$.message", is("started")));
        mockMvc.perform(post("/api/monitoring/start"))
                .andExpect(jsonPath("$.message", is("already running")));
        mockMvc.perform(get("/api/monitoring/status"))
                .andExpect(jsonPath("$.active", is(true)))
                .andExpect(jsonPath("$.startedAt", notNullValue()));

        mockMvc.perform(post("/api/monitoring/stop"))
                .andExpect(jsonPath("$.message", is("stopped")));
        mockMvc.perform(post("/api/monitoring/stop"))
                .andExpect(jsonPath("$.message", is("not running")));
    }

    @Test
    void ingestAndReadSeries() throws Exception {
        String body = """
                [{"metric":"spend","value":120.5,"timestamp":"2024-03-04T10:00:00","campaignId":"cmp-1"},
                 {"metric":"spend","value":99.0,"timestamp":"2024-03-04T09:00:00"},
                 {"metric":"","value":1.0},
                 {"metric":"ctr","value":1.8}]
                """;
        mockMvc.perform(post("/api/metrics").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received", is(4)))
                .andExpect(jsonPath("$.accepted", is(3)));

        mockMvc.perform(get("/api/monitoring/status"))
                .andExpect(jsonPath("$.pendingSamples", is(3)));

        mockMvc.perform(get("/api/metrics"))
                .andExpect(jsonPath("$", containsInAnyOrder("spend", "ctr")));

        mockMvc.perform(get("/api/metrics/spend"))
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].value", is(99.0)))
                .andExpect(jsonPath("$[1].campaignId", is("cmp-1")));
        mockMvc.perform(get("/api/metrics/spend").param("since", "2024-03-04T09:30:00"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].value", is(120.5)));
        mockMvc.perform(get("/api/metrics/spend").param("limit", "1"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].value", is(120.5)));
    }
}

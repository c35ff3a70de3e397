package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.AlertThreshold;
import com.sandy.adpulse.monitor.model.MetricSample;
import com.sandy.adpulse.monitor.model.Severity;
import com.sandy.adpulse.monitor.model.ThresholdOperator;
import com.sandy.adpulse.monitor.repository.ActiveAlertRepository;
import com.sandy.adpulse.monitor.repository.AlertThresholdRepository;
import com.sandy.adpulse.monitor.service.impl.AlertEngineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AlertControllerApiTest {
    @Autowired MockMvc mockMvc;
    @Autowired AlertThresholdRepository thresholdRepository;
    @Autowired ActiveAlertRepository alertRepository;
    @Autowired AlertEngineService alertEngineService;

    Long alertId;

    @BeforeEach
    void setup() {
        alertRepository.deleteAll();
        thresholdRepository.deleteAll();
        alertEngineService.drainPending();
        thresholdRepository.save(AlertThreshold.builder().id("low-ctr").name("Low CTR").metric("ctr")
                .operator(ThresholdOperator.LT).value(1.0).severity(Severity.MEDIUM).active(true)
                .cooldownPeriodMinutes(30).build());
        ActiveAlert a = alertEngineService.evaluate(MetricSample.builder().metric("ctr").value(0.5)
                .timestamp(LocalDateTime.now()).build()).get(0);
        alertId = a.getId();
    }

    @Test
    void listAndStats() throws Exception {
        mockMvc.perform(get("/api/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].status", is("active")))
                .andExpect(jsonPath("$[0].severity", is("medium")))
                .andExpect(jsonPath("$[0].message", is("CTR (0.50%) fell below threshold of 1.00%")));

        mockMvc.perform(get("/api/alerts/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.byStatus.active", is(1)))
                .andExpect(jsonPath("$.byStatus.resolved", is(0)))
                .andExpect(jsonPath("$.severityOpen.medium", is(1)))
                .andExpect(jsonPath("$.recent24hCount", is(1)))
                .andExpect(jsonPath("$.totalTriggerCount", is(1)));
    }

    @Test
    void acknowledgeThenResolve() throws Exception {
        mockMvc.perform(post("/api/alerts/" + alertId + "/ack").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"acknowledgedBy\":\"analyst\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("acknowledged")))
                .andExpect(jsonPath("$.acknowledgedBy", is("analyst")));

        mockMvc.perform(post("/api/alerts/" + alertId + "/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("resolved")))
                .andExpect(jsonPath("$.resolvedAt", notNullValue()));

        mockMvc.perform(post("/api/alerts/" + alertId + "/resolve"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success", is(false)));

        mockMvc.perform(get("/api/alerts")).andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(get("/api/alerts").param("status", "resolved")).andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void unknownAlertIs404() throws Exception {
        mockMvc.perform(post("/api/alerts/999999/ack")).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/alerts/999999/resolve")).andExpect(status().isNotFound());
    }

    @Test
    void manualScanDrainsQueue() throws Exception {
        mockMvc.perform(post("/api/metrics").contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"metric\":\"ctr\",\"value\":0.2}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted", is(1)));
        // still in cooldown from setup
        mockMvc.perform(post("/api/alerts/scan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.message", is("created 0 alerts")));
    }
}

package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.repository.AlertThresholdRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ThresholdControllerApiTest {
    @Autowired MockMvc mockMvc;
    @Autowired AlertThresholdRepository thresholdRepository;

    @BeforeEach
    void setup() {
        thresholdRepository.deleteAll();
    }

    @Test
    void createListUpdateDelete() throws Exception {
        String body = """
                {"id":"high-cpc","name":"High CPC","metric":"cpc","operator":"gt","value":2.5,
                 "severity":"high","active":true,"cooldownPeriodMinutes":20,"triggerCount":99,
                 "channels":[{"type":"webhook","target":"http://localhost:9/hook","active":true}]}
                """;
        mockMvc.perform(post("/api/thresholds").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is("high-cpc")))
                .andExpect(jsonPath("$.operator", is("gt")))
                .andExpect(jsonPath("$.triggerCount", is(0)))
                .andExpect(jsonPath("$.channels", hasSize(1)))
                .andExpect(jsonPath("$.channels[0].type", is("webhook")));

        mockMvc.perform(get("/api/thresholds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        String update = """
                {"name":"High CPC","metric":"cpc","operator":"greater_than","value":3.0,
                 "severity":"critical","active":false,"cooldownPeriodMinutes":20}
                """;
        mockMvc.perform(put("/api/thresholds/high-cpc").contentType(MediaType.APPLICATION_JSON).content(update))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value", is(3.0)))
                .andExpect(jsonPath("$.severity", is("critical")))
                .andExpect(jsonPath("$.active", is(false)));

        mockMvc.perform(delete("/api/thresholds/high-cpc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)));
        mockMvc.perform(delete("/api/thresholds/high-cpc"))
                .andExpect(status().isNotFound());
    }

    @Test
    void invalidBetweenIsRejected() throws Exception {
        String body = """
                {"name":"CPM band","metric":"cpm","operator":"between","value":10,"maxValue":5,
                 "severity":"low","active":true,"cooldownPeriodMinutes":5}
                """;
        mockMvc.perform(post("/api/thresholds").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.message", containsString("maxValue")));
    }

    @Test
    void unknownThresholdIs404() throws Exception {
        mockMvc.perform(get("/api/thresholds/nope")).andExpect(status().isNotFound());
        mockMvc.perform(put("/api/thresholds/nope").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric\":\"spend\",\"operator\":\"gt\",\"value\":1,\"severity\":\"low\"}"))
                .andExpect(status().isNotFound());
    }
}

package com.rollup.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollup.service.api.dto.EventIngestRequest;
import com.rollup.service.api.dto.EventIngestRequest.EventDto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Smoke tests for the Event Rollup Service.
 *
 * Runs against the in-memory repository; events go through ingest, a manual flush and the
 * stats endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class RollupServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    // ==================== Infrastructure ====================

    @Test
    @Order(1)
    void healthEndpointWorks() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.rollupBuffer.status").value("UP"));
    }

    @Test
    @Order(2)
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    @Order(3)
    void configReportsEffectiveSettings() throws Exception {
        mockMvc.perform(get("/api/analytics/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.enabled").value(true))
                .andExpect(jsonPath("$.data.flushIntervalMs").value(600000))
                .andExpect(jsonPath("$.data.neo4jEnabled").value(false));
    }

    // ==================== Ingest ====================

    @Test
    @Order(4)
    void ingestEvents_missingPath_returns400() throws Exception {
        var request = EventIngestRequest.builder()
                .events(List.of(EventDto.builder().sessionId("s1").build()))
                .build();

        mockMvc.perform(post("/api/analytics/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    @Order(5)
    void ingestEvents_emptyBatch_returns400() throws Exception {
        mockMvc.perform(post("/api/analytics/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    @Order(6)
    @DisplayName("Ingested events are visible in every report after a flush")
    void ingestFlushAndQuery() throws Exception {
        var request = EventIngestRequest.builder()
                .events(List.of(
                        event("smoke-1", "/smoke/home", "https://google.com/search?q=x", "Chrome", "Windows"),
                        event("smoke-2", "/smoke/home", "https://google.com/", "Firefox", "Linux"),
                        event("smoke-1", "/smoke/pricing", null, "Chrome", "Windows")))
                .build();

        mockMvc.perform(post("/api/analytics/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").value(3));

        mockMvc.perform(post("/api/analytics/flush"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pendingRollups").value(0))
                .andExpect(jsonPath("$.data.lastSuccessfulFlush").exists());

        mockMvc.perform(get("/api/analytics/stats").param("range", "today"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.summary.totalPv").value(3))
                .andExpect(jsonPath("$.data.summary.totalUv").value(2))
                .andExpect(jsonPath("$.data.daily.length()").value(1));

        mockMvc.perform(get("/api/analytics/top-pages").param("range", "today").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pages.length()").value(1))
                .andExpect(jsonPath("$.data.pages[0].path").value("/smoke/home"))
                .andExpect(jsonPath("$.data.pages[0].pv").value(2));

        mockMvc.perform(get("/api/analytics/top-sources").param("range", "today"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sources[0].source").value("google.com"))
                .andExpect(jsonPath("$.data.sources[0].visitors").value(2));

        mockMvc.perform(get("/api/analytics/devices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.browsers[0].name").value("Chrome"))
                .andExpect(jsonPath("$.data.os[*].name").value(hasItem("Linux")));
    }

    @Test
    @Order(7)
    void malformedLimitFallsBackToDefault() throws Exception {
        mockMvc.perform(get("/api/analytics/top-pages").param("limit", "abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    @Order(8)
    void unknownRouteReturns404() throws Exception {
        mockMvc.perform(get("/api/analytics/nope"))
                .andExpect(status().isNotFound());
    }

    private static EventDto event(String sessionId, String path, String referrer, String browser, String os) {
        return EventDto.builder()
                .sessionId(sessionId)
                .path(path)
                .referrer(referrer)
                .browser(browser)
                .os(os)
                .durationMs(1500L)
                .build();
    }
}

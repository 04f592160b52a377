package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.DiscoveryReport;
import com.gatediscovery.engine.dto.GpsQualityGrade;
import com.gatediscovery.engine.exception.SessionNotFoundException;
import com.gatediscovery.engine.service.DiscoveryReportService;
import com.gatediscovery.engine.service.VenueSessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = VenueSessionController.class)
@DisplayName("VenueSessionController")
class VenueSessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VenueSessionService sessionService;

    @MockBean
    private DiscoveryReportService reportService;

    @Test
    @DisplayName("The discovery report is served for a known session")
    void discoveryReport_Ok() throws Exception {
        // given
        given(reportService.report(1L)).willReturn(new DiscoveryReport(1L, 400L, 300L, 75.0, 240L, 60.0, 12.35,
            GpsQualityGrade.EXCELLENT, 3L, 2L, 37L, true, "Gate discovery ready, 3 gates found",
            Instant.parse("2026-06-01T20:00:00Z")));

        // when & then
        mockMvc.perform(get("/api/sessions/1/discovery-report"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.gpsCoveragePct").value(75.0))
            .andExpect(jsonPath("$.gpsQuality").value("EXCELLENT"))
            .andExpect(jsonPath("$.orphanCount").value(37))
            .andExpect(jsonPath("$.canEnforce").value(true));
    }

    @Test
    @DisplayName("An unknown session answers 404")
    void discoveryReport_UnknownSession() throws Exception {
        given(reportService.report(404L)).willThrow(new SessionNotFoundException(404L));

        mockMvc.perform(get("/api/sessions/404/discovery-report"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("S001"));
    }
}

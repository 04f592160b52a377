package com.gatediscovery.engine.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatediscovery.engine.dto.CheckinReceipt;
import com.gatediscovery.engine.dto.CheckinRequest;
import com.gatediscovery.engine.exception.GateNotFoundException;
import com.gatediscovery.engine.service.CheckinIngestionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CheckinController.class)
@DisplayName("CheckinController")
class CheckinControllerTest {

    private static final String URL = "/api/sessions/1/checkins";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private CheckinIngestionService ingestionService;

    @Test
    @DisplayName("A new check-in is stored and answered with 201")
    void newCheckin_Created() throws Exception {
        // given
        given(ingestionService.ingest(eq(1L), any(CheckinRequest.class)))
            .willReturn(new CheckinReceipt(501L, 1L, 7L, 1.0, true, false));

        // when & then
        mockMvc.perform(post(URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request("WB-1001"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.eventId").value(501))
            .andExpect(jsonPath("$.gateId").value(7))
            .andExpect(jsonPath("$.clusteringEligible").value(true));
    }

    @Test
    @DisplayName("A repeated client event is answered with 200")
    void duplicateCheckin_Ok() throws Exception {
        // given
        given(ingestionService.ingest(eq(1L), any(CheckinRequest.class)))
            .willReturn(new CheckinReceipt(501L, 1L, 7L, 1.0, true, true));

        // when & then
        mockMvc.perform(post(URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request("WB-1001"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.duplicate").value(true));
    }

    @Test
    @DisplayName("A blank wristband id is rejected before ingestion")
    void blankWristband_BadRequest() throws Exception {
        mockMvc.perform(post(URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(" "))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("C001"))
            .andExpect(jsonPath("$.message").value("wristbandId: Wristband ID cannot be blank"));

        verify(ingestionService, never()).ingest(any(), any());
    }

    @Test
    @DisplayName("A check-in from the future is rejected")
    void futureTimestamp_BadRequest() throws Exception {
        String body = "{\"wristbandId\":\"WB-1\",\"category\":\"GENERAL\",\"timestamp\":\""
            + Instant.now().plusSeconds(3600) + "\"}";

        mockMvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("A gate unknown in the session is answered with 404")
    void unknownGate_NotFound() throws Exception {
        // given
        given(ingestionService.ingest(eq(1L), any(CheckinRequest.class)))
            .willThrow(new GateNotFoundException(1L, 404L));

        // when & then
        mockMvc.perform(post(URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request("WB-1001"))))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("G001"));
    }

    private static CheckinRequest request(String wristbandId) {
        return new CheckinRequest(wristbandId, "VIP", Instant.parse("2026-06-01T18:00:00Z"), 41.0082, 28.9784, 8.0,
            null, null, "scan-77");
    }
}

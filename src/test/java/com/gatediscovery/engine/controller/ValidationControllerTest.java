package com.gatediscovery.engine.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatediscovery.engine.dto.ValidationDecision;
import com.gatediscovery.engine.dto.ValidationRequest;
import com.gatediscovery.engine.dto.ValidationResult;
import com.gatediscovery.engine.service.ValidationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ValidationController.class)
@DisplayName("ValidationController")
class ValidationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ValidationService validationService;

    @Test
    @DisplayName("A category mismatch is reported as a flag, not a denial")
    void mismatch_Flagged() throws Exception {
        // given
        given(validationService.validate(eq(1L), any(ValidationRequest.class))).willReturn(new ValidationResult(
            ValidationDecision.FLAG_MISMATCH, 0.0, 10L, "VIP", "gate is enforced for another category", 3.2));

        // when & then
        mockMvc.perform(post("/api/sessions/1/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new ValidationRequest(10L, "VIP", 41.0082, 28.9784, 5.0))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.decision").value("FLAG_MISMATCH"))
            .andExpect(jsonPath("$.gateId").value(10));
    }

    @Test
    @DisplayName("A validation request without a gate is rejected")
    void missingGate_BadRequest() throws Exception {
        mockMvc.perform(post("/api/sessions/1/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"category\":\"VIP\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("gateId: Gate ID is required"));
    }
}

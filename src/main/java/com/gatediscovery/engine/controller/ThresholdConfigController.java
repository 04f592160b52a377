package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.ThresholdConfigRequest;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.service.CycleCoordinator;
import com.gatediscovery.engine.service.ThresholdConfigService;
import com.gatediscovery.engine.service.VenueSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sessions/{sessionId}/config")
@RequiredArgsConstructor
@Tag(name = "Thresholds", description = "Per-session tuning of discovery and enforcement")
public class ThresholdConfigController {

    private final ThresholdConfigService thresholdConfigService;
    private final VenueSessionService sessionService;
    private final CycleCoordinator cycleCoordinator;

    @Operation(summary = "Effective thresholds", description = "The session override, or the configured defaults.")
    @GetMapping
    public ResponseEntity<ThresholdSettings> get(@PathVariable Long sessionId) {
        sessionService.require(sessionId);
        return ResponseEntity.ok(thresholdConfigService.getEffective(sessionId));
    }

    @Operation(
            summary = "Override thresholds",
            description = "Null fields keep their current value. The merged result must satisfy every rule or " +
                    "nothing is stored."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Override stored"),
            @ApiResponse(responseCode = "400", description = "Merged thresholds break a rule")
    })
    @PutMapping
    public ResponseEntity<ThresholdSettings> update(@PathVariable Long sessionId,
                                                    @RequestBody ThresholdConfigRequest request) {
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(sessionId,
            () -> thresholdConfigService.update(sessionId, request)));
    }
}

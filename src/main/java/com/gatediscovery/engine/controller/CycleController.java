package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.CycleReport;
import com.gatediscovery.engine.exception.SessionInactiveException;
import com.gatediscovery.engine.service.CycleCoordinator;
import com.gatediscovery.engine.service.VenueSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.function.Function;

/**
 * Manual triggers for the background cycles. A session whose lock is held
 * returns a SKIPPED_BUSY report rather than waiting.
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}/cycles")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cycles", description = "On-demand discovery, enforcement and duplicate detection")
public class CycleController {

    private final CycleCoordinator cycleCoordinator;
    private final VenueSessionService sessionService;

    @Operation(summary = "Run gate discovery now")
    @PostMapping("/discovery")
    public ResponseEntity<CycleReport> discovery(@PathVariable Long sessionId) {
        return run(sessionId, cycleCoordinator::runDiscovery);
    }

    @Operation(summary = "Run binding enforcement now")
    @PostMapping("/enforcement")
    public ResponseEntity<CycleReport> enforcement(@PathVariable Long sessionId) {
        return run(sessionId, cycleCoordinator::runEnforcement);
    }

    @Operation(summary = "Run duplicate gate detection now")
    @PostMapping("/duplicates")
    public ResponseEntity<CycleReport> duplicates(@PathVariable Long sessionId) {
        return run(sessionId, cycleCoordinator::runDuplicateDetection);
    }

    private ResponseEntity<CycleReport> run(Long sessionId, Function<Long, CycleReport> cycle) {
        if (!sessionService.require(sessionId).isActive()) {
            throw new SessionInactiveException(sessionId);
        }
        log.info("Manual cycle requested for session {}", sessionId);
        return ResponseEntity.ok(cycle.apply(sessionId));
    }
}

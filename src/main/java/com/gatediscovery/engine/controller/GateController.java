package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.GateStatusRequest;
import com.gatediscovery.engine.dto.GateView;
import com.gatediscovery.engine.dto.ManualGateRequest;
import com.gatediscovery.engine.dto.MergeGateRequest;
import com.gatediscovery.engine.dto.MergeOutcome;
import com.gatediscovery.engine.dto.RenameGateRequest;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.service.CycleCoordinator;
import com.gatediscovery.engine.service.GateAdminService;
import com.gatediscovery.engine.service.GateMergeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Gate review and maintenance. Every write runs under the session lock and
 * refreshes the session's gate snapshots afterwards.
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}/gates")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Gates", description = "Discovered and manual gates with their category bindings")
public class GateController {

    private final GateAdminService gateAdminService;
    private final GateMergeService mergeService;
    private final CycleCoordinator cycleCoordinator;

    @Operation(summary = "List gates", description = "Gates with health, status, approval and bindings.")
    @GetMapping
    public ResponseEntity<List<GateView>> list(
            @PathVariable Long sessionId,
            @Parameter(description = "Only gates in this status", example = "ACTIVE")
            @RequestParam(required = false) GateStatus status) {
        return ResponseEntity.ok(gateAdminService.listGates(sessionId, status));
    }

    @Operation(summary = "Get one gate")
    @GetMapping("/{gateId}")
    public ResponseEntity<GateView> get(@PathVariable Long sessionId, @PathVariable Long gateId) {
        return ResponseEntity.ok(gateAdminService.getGate(sessionId, gateId));
    }

    @Operation(
            summary = "Create a manual gate",
            description = "Manual gates are approved on creation and keep their position; discovery never moves them."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Gate created"),
            @ApiResponse(responseCode = "409", description = "A gate already exists at that position, or session busy")
    })
    @PostMapping
    public ResponseEntity<GateView> create(@PathVariable Long sessionId,
                                           @Valid @RequestBody ManualGateRequest request) {
        GateView created = cycleCoordinator.runOperatorAction(sessionId,
            () -> gateAdminService.createManualGate(sessionId, request));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Approve a gate")
    @PostMapping("/{gateId}/approve")
    public ResponseEntity<GateView> approve(@PathVariable Long sessionId, @PathVariable Long gateId) {
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(sessionId,
            () -> gateAdminService.approve(sessionId, gateId)));
    }

    @Operation(summary = "Reject a gate", description = "Rejected gates go inactive and are not rediscovered.")
    @PostMapping("/{gateId}/reject")
    public ResponseEntity<GateView> reject(@PathVariable Long sessionId, @PathVariable Long gateId) {
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(sessionId,
            () -> gateAdminService.reject(sessionId, gateId)));
    }

    @Operation(summary = "Rename a gate")
    @PatchMapping("/{gateId}/name")
    public ResponseEntity<GateView> rename(@PathVariable Long sessionId, @PathVariable Long gateId,
                                           @Valid @RequestBody RenameGateRequest request) {
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(sessionId,
            () -> gateAdminService.rename(sessionId, gateId, request.name())));
    }

    @Operation(summary = "Change gate status", description = "ACTIVE, MAINTENANCE or INACTIVE. Merged gates stay inactive.")
    @PatchMapping("/{gateId}/status")
    public ResponseEntity<GateView> changeStatus(@PathVariable Long sessionId, @PathVariable Long gateId,
                                                 @Valid @RequestBody GateStatusRequest request) {
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(sessionId,
            () -> gateAdminService.changeStatus(sessionId, gateId, request.status())));
    }

    @Operation(
            summary = "Merge this gate into another",
            description = "Moves check-ins and bindings to the target and retires this gate, all or nothing."
    )
    @PostMapping("/{gateId}/merge")
    public ResponseEntity<MergeOutcome> merge(@PathVariable Long sessionId, @PathVariable Long gateId,
                                              @Valid @RequestBody MergeGateRequest request) {
        log.info("Operator {} merging gate {} into {} (session {})",
            request.reviewer(), gateId, request.targetGateId(), sessionId);
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(sessionId,
            () -> mergeService.mergeGates(sessionId, gateId, request.targetGateId(), request.reviewer(),
                request.reason())));
    }

    @Operation(summary = "Unbind a category from a gate")
    @PostMapping("/{gateId}/bindings/{category}/unbind")
    public ResponseEntity<GateView> unbind(@PathVariable Long sessionId, @PathVariable Long gateId,
                                           @PathVariable String category) {
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(sessionId,
            () -> gateAdminService.unbindCategory(sessionId, gateId, category)));
    }

    @Operation(summary = "Reset a binding to probation", description = "Clears its violation and demotion history.")
    @PostMapping("/{gateId}/bindings/{category}/reset")
    public ResponseEntity<GateView> reset(@PathVariable Long sessionId, @PathVariable Long gateId,
                                          @PathVariable String category) {
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(sessionId,
            () -> gateAdminService.resetBinding(sessionId, gateId, category)));
    }
}

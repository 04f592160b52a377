package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.MergeOutcome;
import com.gatediscovery.engine.dto.MergeReviewRequest;
import com.gatediscovery.engine.dto.MergeSuggestionView;
import com.gatediscovery.engine.entity.MergeStatus;
import com.gatediscovery.engine.entity.MergeSuggestion;
import com.gatediscovery.engine.service.CycleCoordinator;
import com.gatediscovery.engine.service.GateMergeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Merge suggestions", description = "Review of gates that look like the same physical place")
public class MergeSuggestionController {

    private final GateMergeService mergeService;
    private final CycleCoordinator cycleCoordinator;

    @Operation(summary = "List merge suggestions", description = "Highest confidence first.")
    @GetMapping("/sessions/{sessionId}/merge-suggestions")
    public ResponseEntity<List<MergeSuggestionView>> list(
            @PathVariable Long sessionId,
            @Parameter(description = "Only suggestions in this status", example = "PENDING")
            @RequestParam(required = false) MergeStatus status) {
        return ResponseEntity.ok(mergeService.listSuggestions(sessionId, status).stream()
            .map(MergeSuggestionView::from)
            .toList());
    }

    @Operation(summary = "Get a merge suggestion")
    @GetMapping("/merge-suggestions/{id}")
    public ResponseEntity<MergeSuggestionView> get(@PathVariable Long id) {
        return ResponseEntity.ok(MergeSuggestionView.from(mergeService.requireSuggestion(id)));
    }

    @Operation(summary = "Approve and apply a merge suggestion")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Merge applied"),
            @ApiResponse(responseCode = "409", description = "Suggestion no longer pending, gate inactive, or session busy")
    })
    @PostMapping("/merge-suggestions/{id}/approve")
    public ResponseEntity<MergeOutcome> approve(@PathVariable Long id,
                                                @Valid @RequestBody MergeReviewRequest review) {
        MergeSuggestion suggestion = mergeService.requireSuggestion(id);
        log.info("Merge suggestion {} approved by {}", id, review.reviewer());
        return ResponseEntity.ok(cycleCoordinator.runOperatorAction(suggestion.getSessionId(),
            () -> mergeService.approve(id, review)));
    }

    @Operation(summary = "Reject a merge suggestion")
    @PostMapping("/merge-suggestions/{id}/reject")
    public ResponseEntity<MergeSuggestionView> reject(@PathVariable Long id,
                                                      @Valid @RequestBody MergeReviewRequest review) {
        MergeSuggestion suggestion = mergeService.requireSuggestion(id);
        MergeSuggestion rejected = cycleCoordinator.runOperatorAction(suggestion.getSessionId(),
            () -> mergeService.reject(id, review));
        return ResponseEntity.ok(MergeSuggestionView.from(rejected));
    }
}

package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.DiscoveryReport;
import com.gatediscovery.engine.dto.SessionRequest;
import com.gatediscovery.engine.dto.SessionView;
import com.gatediscovery.engine.service.DiscoveryReportService;
import com.gatediscovery.engine.service.VenueSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sessions", description = "Venue session registry")
public class VenueSessionController {

    private final VenueSessionService sessionService;
    private final DiscoveryReportService reportService;

    @Operation(summary = "Create a venue session", description = "New sessions start active.")
    @PostMapping
    public ResponseEntity<SessionView> create(@Valid @RequestBody SessionRequest request) {
        SessionView created = SessionView.from(sessionService.create(request.name()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "List venue sessions")
    @GetMapping
    public ResponseEntity<List<SessionView>> list() {
        return ResponseEntity.ok(sessionService.list().stream().map(SessionView::from).toList());
    }

    @Operation(summary = "Get a venue session with its cycle checkpoints")
    @GetMapping("/{id}")
    public ResponseEntity<SessionView> get(@PathVariable Long id) {
        return ResponseEntity.ok(SessionView.from(sessionService.require(id)));
    }

    @Operation(
            summary = "Discovery quality report",
            description = "GPS coverage and accuracy of successful scans, gate counts, unassigned check-ins " +
                    "and a plain-language recommendation."
    )
    @GetMapping("/{id}/discovery-report")
    public ResponseEntity<DiscoveryReport> discoveryReport(@PathVariable Long id) {
        return ResponseEntity.ok(reportService.report(id));
    }

    @Operation(summary = "Activate a session", description = "Background cycles resume on the next timer tick.")
    @PostMapping("/{id}/activate")
    public ResponseEntity<SessionView> activate(@PathVariable Long id) {
        return ResponseEntity.ok(SessionView.from(sessionService.setActive(id, true)));
    }

    @Operation(
            summary = "Deactivate a session",
            description = "Running cycles stop at their next unit of work; timers skip the session. " +
                    "Check-ins are still accepted and stored."
    )
    @PostMapping("/{id}/deactivate")
    public ResponseEntity<SessionView> deactivate(@PathVariable Long id) {
        return ResponseEntity.ok(SessionView.from(sessionService.setActive(id, false)));
    }
}

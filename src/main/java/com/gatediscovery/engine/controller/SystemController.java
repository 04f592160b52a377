package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.lock.SessionCycleLock;
import com.gatediscovery.engine.service.GateSnapshotCacheService;
import com.gatediscovery.engine.service.VenueSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "System", description = "Health and cache maintenance")
public class SystemController {

    private final SessionCycleLock sessionLock;
    private final GateSnapshotCacheService snapshotCache;
    private final VenueSessionService sessionService;

    @Operation(summary = "Health check")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Gate Discovery Engine",
            "lockStrategy", sessionLock.getStrategyName(),
            "timestamp", Instant.now()
        ));
    }

    @Operation(summary = "Rebuild the cached gate snapshots of a session")
    @PostMapping("/sessions/{sessionId}/snapshots/refresh")
    public ResponseEntity<Map<String, Object>> refreshSnapshots(@PathVariable Long sessionId) {
        sessionService.require(sessionId);
        int refreshed = snapshotCache.refreshSession(sessionId);
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "sessionId", sessionId,
            "snapshotsRefreshed", refreshed
        ));
    }
}

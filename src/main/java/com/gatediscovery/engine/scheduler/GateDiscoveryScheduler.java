package com.gatediscovery.engine.scheduler;

import com.gatediscovery.engine.dto.CycleReport;
import com.gatediscovery.engine.dto.CycleStatus;
import com.gatediscovery.engine.service.CycleCoordinator;
import com.gatediscovery.engine.service.VenueSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Periodic driver of the per-session cycles.
 *
 * Each tick walks the active sessions; a failure in one session is logged and
 * the walk moves on. Locking happens inside {@link CycleCoordinator}, so a
 * session whose previous cycle is still running is skipped for this tick.
 *
 * Intervals (application.yml, gate-discovery.scheduler.*):
 * - discovery-interval-ms: default 5 minutes, backs up the scan-count milestones
 * - enforcement-interval-ms: default 10 seconds
 * - duplicate-interval-ms: default 10 minutes
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "gate-discovery.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class GateDiscoveryScheduler {

    private final CycleCoordinator cycleCoordinator;
    private final VenueSessionService sessionService;

    @Scheduled(fixedDelayString = "${gate-discovery.scheduler.discovery-interval-ms:300000}",
        initialDelayString = "${gate-discovery.scheduler.initial-delay-ms:30000}")
    public void runDiscovery() {
        runForActiveSessions("discovery", cycleCoordinator::runDiscovery);
    }

    @Scheduled(fixedDelayString = "${gate-discovery.scheduler.enforcement-interval-ms:10000}",
        initialDelayString = "${gate-discovery.scheduler.initial-delay-ms:30000}")
    public void runEnforcement() {
        runForActiveSessions("enforcement", cycleCoordinator::runEnforcement);
    }

    @Scheduled(fixedDelayString = "${gate-discovery.scheduler.duplicate-interval-ms:600000}",
        initialDelayString = "${gate-discovery.scheduler.initial-delay-ms:30000}")
    public void runDuplicateDetection() {
        runForActiveSessions("duplicate detection", cycleCoordinator::runDuplicateDetection);
    }

    private void runForActiveSessions(String cycleName, Function<Long, CycleReport> cycle) {
        List<Long> sessionIds;
        try {
            sessionIds = sessionService.activeSessionIds();
        } catch (Exception e) {
            log.error("Could not list active sessions for {}", cycleName, e);
            return;
        }
        if (sessionIds.isEmpty()) {
            log.debug("No active sessions for {}", cycleName);
            return;
        }

        int skipped = 0;
        for (Long sessionId : sessionIds) {
            try {
                CycleReport report = cycle.apply(sessionId);
                if (report.status() == CycleStatus.SKIPPED_BUSY) {
                    skipped++;
                }
            } catch (Exception e) {
                log.error("Scheduled {} failed for session {}", cycleName, sessionId, e);
            }
        }
        if (skipped > 0) {
            log.debug("Scheduled {}: {} of {} sessions busy", cycleName, skipped, sessionIds.size());
        }
    }
}

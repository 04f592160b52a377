package com.gatediscovery.engine.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Checks the discovery milestone off the request thread after a clustering-grade
 * scan was stored. A busy session simply skips; the periodic cycle catches up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiscoveryTrigger {

    private final CycleCoordinator cycleCoordinator;

    @Async
    public void onAcceptedScan(Long sessionId) {
        try {
            cycleCoordinator.runDiscoveryIfDue(sessionId)
                .ifPresent(report -> log.debug("Milestone discovery: {}", report.toLogString()));
        } catch (Exception e) {
            log.error("Milestone discovery failed for session {}", sessionId, e);
        }
    }
}

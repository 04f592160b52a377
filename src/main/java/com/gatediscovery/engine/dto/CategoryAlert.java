package com.gatediscovery.engine.dto;

import java.time.Instant;

/**
 * Broadcast on {@code /topic/alerts} when a scan is flagged or denied.
 */
public record CategoryAlert(
    Long sessionId,
    Long gateId,
    String wristbandId,
    String category,
    ValidationDecision decision,
    String reason,
    Instant timestamp
) {
}

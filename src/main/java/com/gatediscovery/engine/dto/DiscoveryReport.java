package com.gatediscovery.engine.dto;

import java.time.Instant;

/**
 * Operator read on how well a session's data supports gate discovery.
 *
 * @param totalCheckins successful scans of the session
 * @param goodGpsCheckins scans whose quality weight makes them clustering input
 * @param averageAccuracyMeters null when no scan reported an accuracy
 * @param orphanCount stored scans of any outcome that no gate has claimed yet
 * @param canEnforce true once at least two gates are active
 */
public record DiscoveryReport(
    Long sessionId,
    long totalCheckins,
    long checkinsWithGps,
    double gpsCoveragePct,
    long goodGpsCheckins,
    double goodGpsPct,
    Double averageAccuracyMeters,
    GpsQualityGrade gpsQuality,
    long activeGates,
    long gatesPendingApproval,
    long orphanCount,
    boolean canEnforce,
    String recommendation,
    Instant generatedAt
) {
}

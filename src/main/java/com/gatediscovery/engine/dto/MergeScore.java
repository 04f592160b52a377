package com.gatediscovery.engine.dto;

/**
 * Scoring of one candidate gate pair. All components are in [0, 1].
 */
public record MergeScore(
    double distanceMeters,
    double distanceScore,
    double hourlyOverlap,
    double categoryOverlap,
    double trafficSimilarity,
    double confidence
) {

    public String describe() {
        return String.format(java.util.Locale.ROOT,
            "%.1fm apart (distance score %.2f), hourly overlap %.2f, category overlap %.2f",
            distanceMeters, distanceScore, hourlyOverlap, categoryOverlap);
    }
}

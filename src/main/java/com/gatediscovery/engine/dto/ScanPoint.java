package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.CheckinEvent;

import java.time.Instant;

/**
 * Clustering input: one quality-accepted scan location.
 */
public record ScanPoint(
    Long checkinId,
    double latitude,
    double longitude,
    double qualityWeight,
    String category,
    Instant timestamp
) {

    public static ScanPoint from(CheckinEvent event) {
        return new ScanPoint(event.getId(), event.getLatitude(), event.getLongitude(),
            event.getQualityWeight(), event.getCategory(), event.getTimestamp());
    }
}

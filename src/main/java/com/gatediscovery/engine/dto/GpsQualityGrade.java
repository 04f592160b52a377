package com.gatediscovery.engine.dto;

/**
 * Grade of the average reported GPS accuracy of a session's scans.
 */
public enum GpsQualityGrade {
    NO_GPS_DATA,
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static GpsQualityGrade of(Double averageAccuracyMeters) {
        if (averageAccuracyMeters == null) {
            return NO_GPS_DATA;
        }
        if (averageAccuracyMeters <= 15.0) {
            return EXCELLENT;
        }
        if (averageAccuracyMeters <= 30.0) {
            return GOOD;
        }
        if (averageAccuracyMeters <= 50.0) {
            return FAIR;
        }
        return POOR;
    }
}

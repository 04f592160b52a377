package com.gatediscovery.engine.service;

import com.gatediscovery.engine.geo.GeoMath;
import org.springframework.stereotype.Component;

/**
 * Converts a scanner's reported GPS accuracy into a quality weight in [0, 1].
 *
 * Accuracy bands:
 * - no usable location or no accuracy: 0.0
 * - ≤ 10 m: 1.0
 * - ≤ 20 m: 0.9
 * - ≤ 30 m: 0.8
 * - ≤ 50 m: 0.6
 * - worse: 0.4
 *
 * The weight is stamped on the stored check-in. Scans under the session's
 * minimum weight (0.6 by default) are kept and still learned from, but never
 * shape a cluster or a centroid.
 */
@Component
public class GpsQualityFilter {

    public double qualityWeight(Double latitude, Double longitude, Double accuracy) {
        if (!GeoMath.isValidCoordinate(latitude, longitude)) {
            return 0.0;
        }
        if (accuracy == null || accuracy.isNaN() || accuracy < 0.0) {
            return 0.0;
        }
        if (accuracy <= 10.0) {
            return 1.0;
        }
        if (accuracy <= 20.0) {
            return 0.9;
        }
        if (accuracy <= 30.0) {
            return 0.8;
        }
        if (accuracy <= 50.0) {
            return 0.6;
        }
        return 0.4;
    }

    public boolean isClusteringEligible(double qualityWeight, double minQualityWeight) {
        return qualityWeight > 0.0 && qualityWeight >= minQualityWeight;
    }
}

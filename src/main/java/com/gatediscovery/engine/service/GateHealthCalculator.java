package com.gatediscovery.engine.service;

import com.gatediscovery.engine.entity.DerivationMethod;
import com.gatediscovery.engine.entity.Gate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Health score of a gate, 0 to 100.
 *
 * - base 50
 * - up to +30 for resolved check-in volume, linear up to 100 check-ins
 * - +15 when the centroid is a valid GPS position
 * - up to +10 for sustained activity, linear up to 30 minutes between first and last scan
 * - -20 for a discovered gate still below the minimum effective sample count
 */
@Component
public class GateHealthCalculator {

    static final double BASE = 50.0;
    static final double VOLUME_WEIGHT = 30.0;
    static final double VOLUME_SATURATION = 100.0;
    static final double LOCATION_BONUS = 15.0;
    static final double ACTIVITY_WEIGHT = 10.0;
    static final double ACTIVITY_SATURATION_MINUTES = 30.0;
    static final double THIN_EVIDENCE_PENALTY = 20.0;

    public int score(Gate gate, long resolvedCheckins, int minEffectiveSamples) {
        double score = BASE;
        score += VOLUME_WEIGHT * Math.min(1.0, resolvedCheckins / VOLUME_SATURATION);

        if (gate.hasLocation()) {
            score += LOCATION_BONUS;
        }

        if (gate.getFirstSeenAt() != null && gate.getLastSeenAt() != null) {
            double minutes = Duration.between(gate.getFirstSeenAt(), gate.getLastSeenAt()).toSeconds() / 60.0;
            score += ACTIVITY_WEIGHT * Math.min(1.0, Math.max(0.0, minutes) / ACTIVITY_SATURATION_MINUTES);
        }

        if (gate.getDerivationMethod() == DerivationMethod.CLUSTERING && gate.getSampleCount() < minEffectiveSamples) {
            score -= THIN_EVIDENCE_PENALTY;
        }

        return (int) Math.round(Math.max(0.0, Math.min(100.0, score)));
    }
}

package com.gatediscovery.engine.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Effective thresholds of one venue session: the stored override, or the process-wide defaults.
 *
 * @param maxSpatialVariance      square meters; clusters more diffuse than this are discarded
 * @param duplicateDistanceMeters gates closer than this are duplicate candidates
 * @param minQualityWeight        scans below this GPS weight are excluded from clustering
 */
public record ThresholdSettings(
    int minSamplesForGate,
    double maxSpatialVariance,
    double softThreshold,
    double hardThreshold,
    int minEffectiveSamples,
    double duplicateDistanceMeters,
    double clusterEpsilonMeters,
    double minQualityWeight,
    double orphanMaxDistanceMeters,
    double mergeReviewThreshold,
    double mergeAutoApplyThreshold,
    boolean autoApplyMerges
) {

    /**
     * Lists every rule this combination breaks. Empty means the settings are usable.
     */
    public List<String> violations() {
        List<String> errors = new ArrayList<>();
        if (softThreshold <= 0.0) {
            errors.add("softThreshold must be greater than 0");
        }
        if (hardThreshold > 1.0) {
            errors.add("hardThreshold must not exceed 1.0");
        }
        if (softThreshold >= hardThreshold) {
            errors.add("softThreshold must be lower than hardThreshold");
        }
        if (minSamplesForGate < 1) {
            errors.add("minSamplesForGate must be at least 1");
        }
        if (minEffectiveSamples < 1) {
            errors.add("minEffectiveSamples must be at least 1");
        }
        if (maxSpatialVariance <= 0.0) {
            errors.add("maxSpatialVariance must be positive");
        }
        if (clusterEpsilonMeters <= 0.0) {
            errors.add("clusterEpsilonMeters must be positive");
        }
        if (duplicateDistanceMeters <= 0.0) {
            errors.add("duplicateDistanceMeters must be positive");
        }
        if (orphanMaxDistanceMeters <= 0.0) {
            errors.add("orphanMaxDistanceMeters must be positive");
        }
        if (minQualityWeight < 0.0 || minQualityWeight > 1.0) {
            errors.add("minQualityWeight must be within [0, 1]");
        }
        if (mergeReviewThreshold <= 0.0 || mergeReviewThreshold > 1.0) {
            errors.add("mergeReviewThreshold must be within (0, 1]");
        }
        if (mergeAutoApplyThreshold <= 0.0 || mergeAutoApplyThreshold > 1.0) {
            errors.add("mergeAutoApplyThreshold must be within (0, 1]");
        }
        if (mergeReviewThreshold > mergeAutoApplyThreshold) {
            errors.add("mergeReviewThreshold must not exceed mergeAutoApplyThreshold");
        }
        return errors;
    }

    public boolean isValid() {
        return violations().isEmpty();
    }
}

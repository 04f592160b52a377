package com.gatediscovery.engine.dto;

/**
 * Partial threshold override. Null fields keep the session's current value.
 */
public record ThresholdConfigRequest(
    Integer minSamplesForGate,
    Double maxSpatialVariance,
    Double softThreshold,
    Double hardThreshold,
    Integer minEffectiveSamples,
    Double duplicateDistanceMeters,
    Double clusterEpsilonMeters,
    Double minQualityWeight,
    Double orphanMaxDistanceMeters,
    Double mergeReviewThreshold,
    Double mergeAutoApplyThreshold,
    Boolean autoApplyMerges
) {

    public ThresholdSettings applyTo(ThresholdSettings current) {
        return new ThresholdSettings(
            pick(minSamplesForGate, current.minSamplesForGate()),
            pick(maxSpatialVariance, current.maxSpatialVariance()),
            pick(softThreshold, current.softThreshold()),
            pick(hardThreshold, current.hardThreshold()),
            pick(minEffectiveSamples, current.minEffectiveSamples()),
            pick(duplicateDistanceMeters, current.duplicateDistanceMeters()),
            pick(clusterEpsilonMeters, current.clusterEpsilonMeters()),
            pick(minQualityWeight, current.minQualityWeight()),
            pick(orphanMaxDistanceMeters, current.orphanMaxDistanceMeters()),
            pick(mergeReviewThreshold, current.mergeReviewThreshold()),
            pick(mergeAutoApplyThreshold, current.mergeAutoApplyThreshold()),
            pick(autoApplyMerges, current.autoApplyMerges())
        );
    }

    private static <T> T pick(T override, T current) {
        return override != null ? override : current;
    }
}

package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.MergeStatus;
import com.gatediscovery.engine.entity.MergeSuggestion;

import java.time.Instant;

public record MergeSuggestionView(
    Long id,
    Long sessionId,
    Long sourceGateId,
    Long targetGateId,
    double distanceMeters,
    double trafficSimilarity,
    double confidence,
    MergeStatus status,
    String reasoning,
    String reviewedBy,
    Instant reviewedAt,
    String reviewReason
) {

    public static MergeSuggestionView from(MergeSuggestion suggestion) {
        return new MergeSuggestionView(
            suggestion.getId(),
            suggestion.getSessionId(),
            suggestion.getSourceGateId(),
            suggestion.getTargetGateId(),
            suggestion.getDistanceMeters(),
            suggestion.getTrafficSimilarity(),
            suggestion.getConfidence(),
            suggestion.getStatus(),
            suggestion.getReasoning(),
            suggestion.getReviewedBy(),
            suggestion.getReviewedAt(),
            suggestion.getReviewReason()
        );
    }
}

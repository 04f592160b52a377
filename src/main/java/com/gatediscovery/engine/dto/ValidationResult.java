package com.gatediscovery.engine.dto;

/**
 * @param confidence     confidence of the binding for the requested category at this gate, 0 if none
 * @param distanceMeters distance from the gate centroid, when both locations were known
 */
public record ValidationResult(
    ValidationDecision decision,
    double confidence,
    Long gateId,
    String category,
    String reason,
    Double distanceMeters
) {

    public boolean requiresAttention() {
        return decision != ValidationDecision.ALLOW;
    }
}

package com.gatediscovery.engine.entity;

/**
 * Lifecycle of a category binding.
 *
 * <pre>
 *   PROBATION --promotion--> ENFORCED
 *   ENFORCED  --demotion---> PROBATION | UNBOUND
 *   PROBATION --operator---> UNBOUND
 *   UNBOUND   --reset------> PROBATION
 * </pre>
 */
public enum BindingStatus {
    PROBATION,
    ENFORCED,
    UNBOUND;

    public boolean canTransitionTo(BindingStatus target) {
        return switch (this) {
            case PROBATION -> target == ENFORCED || target == UNBOUND;
            case ENFORCED -> target == PROBATION || target == UNBOUND;
            case UNBOUND -> target == PROBATION;
        };
    }

    /**
     * A category is recognized at a gate when its binding is enforced, or still on
     * probation but already above the soft threshold.
     */
    public static boolean isRecognized(BindingStatus status, double confidence, double softThreshold) {
        if (status == null) {
            return false;
        }
        return status == ENFORCED || (status == PROBATION && confidence >= softThreshold);
    }
}

package com.gatediscovery.engine.dto;

public enum ValidationDecision {
    ALLOW,
    /** Entry allowed, but the gate is enforced for a different category. */
    FLAG_MISMATCH,
    DENY_OUT_OF_RANGE
}

package com.gatediscovery.engine.dto;

/**
 * Reply to a streamed check-in: what was stored and, when a gate was known, the decision.
 */
public record CheckinDecision(CheckinReceipt receipt, ValidationResult validation) {
}

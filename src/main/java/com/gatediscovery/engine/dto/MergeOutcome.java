package com.gatediscovery.engine.dto;

/**
 * @param checkinsMoved     check-ins re-pointed from source to target
 * @param bindingsFolded    source bindings added into an existing target binding
 * @param bindingsMoved     source bindings re-homed at the target unchanged
 * @param suggestionsClosed other pending suggestions rejected as superseded
 */
public record MergeOutcome(
    Long sourceGateId,
    Long targetGateId,
    int checkinsMoved,
    int bindingsFolded,
    int bindingsMoved,
    int suggestionsClosed
) {
}

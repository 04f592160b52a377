package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.BindingStatus;
import com.gatediscovery.engine.entity.GateStatus;

import java.util.List;
import java.util.Optional;

/**
 * Everything validation needs about one gate, as cached in Redis.
 *
 * @param acceptedRadiusMeters max(minimum radius, 2·√variance)
 * @param softThreshold        the session's soft threshold when the snapshot was taken
 */
public record GateSnapshot(
    Long gateId,
    Long sessionId,
    String name,
    GateStatus status,
    Double latitude,
    Double longitude,
    double acceptedRadiusMeters,
    double softThreshold,
    List<BindingSnapshot> bindings
) {

    public GateSnapshot {
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
    }

    public Optional<BindingSnapshot> bindingFor(String category) {
        return bindings.stream().filter(b -> b.category().equals(category)).findFirst();
    }

    public boolean hasEnforcedBindingOtherThan(String category) {
        return bindings.stream()
            .anyMatch(b -> b.status() == BindingStatus.ENFORCED && !b.category().equals(category));
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}

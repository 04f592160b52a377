package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.ApprovalStatus;
import com.gatediscovery.engine.entity.CategoryBinding;
import com.gatediscovery.engine.entity.DerivationMethod;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

public record GateView(
    Long id,
    Long sessionId,
    String name,
    Double latitude,
    Double longitude,
    DerivationMethod derivationMethod,
    int healthScore,
    GateStatus status,
    ApprovalStatus approvalStatus,
    double spatialVariance,
    int sampleCount,
    Instant firstSeenAt,
    Instant lastSeenAt,
    Long mergedIntoGateId,
    List<BindingView> bindings
) {

    public static GateView from(Gate gate, List<CategoryBinding> bindings) {
        List<BindingView> views = bindings.stream()
            .sorted(Comparator.comparingDouble(CategoryBinding::getConfidence).reversed()
                .thenComparing(CategoryBinding::getCategory))
            .map(BindingView::from)
            .toList();
        return new GateView(
            gate.getId(),
            gate.getSessionId(),
            gate.getName(),
            gate.getLatitude(),
            gate.getLongitude(),
            gate.getDerivationMethod(),
            gate.getHealthScore(),
            gate.getStatus(),
            gate.getApprovalStatus(),
            gate.getSpatialVariance(),
            gate.getSampleCount(),
            gate.getFirstSeenAt(),
            gate.getLastSeenAt(),
            gate.getMergedIntoGateId(),
            views
        );
    }
}

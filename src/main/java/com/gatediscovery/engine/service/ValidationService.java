package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.BindingSnapshot;
import com.gatediscovery.engine.dto.GateSnapshot;
import com.gatediscovery.engine.dto.ValidationDecision;
import com.gatediscovery.engine.dto.ValidationRequest;
import com.gatediscovery.engine.dto.ValidationResult;
import com.gatediscovery.engine.entity.BindingStatus;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.geo.GeoMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Answers, for one scan, whether the category belongs at the gate.
 *
 * Rules, first match wins:
 * 1. Gate unknown in the session: not-found error
 * 2. Gate not ACTIVE: DENY_OUT_OF_RANGE
 * 3. Scan location further than accepted radius × multiplier + reported accuracy
 *    from the centroid: DENY_OUT_OF_RANGE
 * 4. Category recognized at the gate: ALLOW
 * 5. Gate enforced for another category: FLAG_MISMATCH
 * 6. Otherwise ALLOW
 *
 * Reads only the gate snapshot, never a cycle lock, so the answer for a given
 * snapshot and input is always the same.
 */
@Service
@Slf4j
public class ValidationService {

    private final GateSnapshotCacheService snapshotCache;
    private final double outOfRangeMultiplier;

    public ValidationService(GateSnapshotCacheService snapshotCache, GateDiscoveryProperties properties) {
        this.snapshotCache = snapshotCache;
        this.outOfRangeMultiplier = properties.getTuning().getOutOfRangeMultiplier();
    }

    public ValidationResult validate(Long sessionId, ValidationRequest request) {
        GateSnapshot snapshot = snapshotCache.getSnapshot(sessionId, request.gateId());
        ValidationResult result = decide(snapshot, request, outOfRangeMultiplier);
        if (result.requiresAttention()) {
            log.debug("Validation {} for category {} at gate {}: {}",
                result.decision(), request.category(), request.gateId(), result.reason());
        }
        return result;
    }

    static ValidationResult decide(GateSnapshot snapshot, ValidationRequest request, double outOfRangeMultiplier) {
        String category = request.category();
        Optional<BindingSnapshot> own = snapshot.bindingFor(category);
        double confidence = own.map(BindingSnapshot::confidence).orElse(0.0);

        if (snapshot.status() != GateStatus.ACTIVE) {
            return result(snapshot, category, ValidationDecision.DENY_OUT_OF_RANGE, confidence,
                "gate is " + snapshot.status(), null);
        }

        Double distance = null;
        if (snapshot.hasLocation() && GeoMath.isValidCoordinate(request.latitude(), request.longitude())) {
            distance = GeoMath.haversineMeters(snapshot.latitude(), snapshot.longitude(),
                request.latitude(), request.longitude());
            double accuracy = request.accuracy() != null && request.accuracy() > 0 ? request.accuracy() : 0.0;
            double allowed = snapshot.acceptedRadiusMeters() * outOfRangeMultiplier + accuracy;
            if (distance > allowed) {
                return result(snapshot, category, ValidationDecision.DENY_OUT_OF_RANGE, confidence,
                    String.format("scan is %.0fm from the gate, more than the %.0fm allowed", distance, allowed),
                    distance);
            }
        }

        boolean recognized = own
            .map(b -> BindingStatus.isRecognized(b.status(), b.confidence(), snapshot.softThreshold()))
            .orElse(false);
        if (recognized) {
            return result(snapshot, category, ValidationDecision.ALLOW, confidence,
                "category " + category + " is bound to this gate", distance);
        }

        if (snapshot.hasEnforcedBindingOtherThan(category)) {
            return result(snapshot, category, ValidationDecision.FLAG_MISMATCH, confidence,
                "gate is enforced for another category", distance);
        }

        return result(snapshot, category, ValidationDecision.ALLOW, confidence,
            "no enforced binding at this gate", distance);
    }

    private static ValidationResult result(GateSnapshot snapshot, String category, ValidationDecision decision,
                                           double confidence, String reason, Double distance) {
        return new ValidationResult(decision, confidence, snapshot.gateId(), category, reason, distance);
    }
}

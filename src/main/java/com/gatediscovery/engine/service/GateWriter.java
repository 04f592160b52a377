package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.GateCluster;
import com.gatediscovery.engine.entity.DerivationMethod;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Gate writes that must commit or fail on their own.
 *
 * Each call runs in a fresh transaction so a unique-key violation on insert
 * only rolls back that insert, and the materializer can carry on by updating
 * the gate that won the race.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GateWriter {

    private final GateRepository gateRepository;
    private final CheckinEventRepository checkinRepository;
    private final GateHealthCalculator healthCalculator;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Gate insert(Gate gate) {
        return gateRepository.saveAndFlush(gate);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Gate> reinforce(Long gateId, GateCluster cluster, int minEffectiveSamples) {
        return gateRepository.findById(gateId)
            .map(gate -> applyAndSave(gate, cluster, minEffectiveSamples));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Gate> findByCentroidKey(Long sessionId, String centroidKey) {
        return gateRepository.findBySessionIdAndCentroidKey(sessionId, centroidKey);
    }

    /**
     * Recomputes health of every active gate of the session. Returns how many changed.
     */
    @Transactional
    public int refreshHealth(Long sessionId, int minEffectiveSamples) {
        List<Gate> gates = gateRepository.findBySessionIdAndStatusOrderByIdAsc(sessionId, GateStatus.ACTIVE);
        int changed = 0;
        for (Gate gate : gates) {
            int score = healthCalculator.score(gate, checkinRepository.countByGateId(gate.getId()), minEffectiveSamples);
            if (score != gate.getHealthScore()) {
                gate.setHealthScore(score);
                gateRepository.save(gate);
                changed++;
            }
        }
        log.debug("Health refreshed for session {}: {} of {} gates changed", sessionId, changed, gates.size());
        return changed;
    }

    private Gate applyAndSave(Gate gate, GateCluster cluster, int minEffectiveSamples) {
        applyCluster(gate, cluster);
        gate.setHealthScore(healthCalculator.score(gate, checkinRepository.countByGateId(gate.getId()),
            minEffectiveSamples));
        return gateRepository.save(gate);
    }

    /**
     * Rolling update: centroid and variance are averaged with weights (gate
     * samples, cluster size); the sample count keeps the larger of the two since
     * the same scans are re-clustered on every run. Operator-placed gates keep
     * their position.
     */
    static void applyCluster(Gate gate, GateCluster cluster) {
        double existingWeight = Math.max(gate.getSampleCount(), 0);
        double clusterWeight = cluster.size();
        double total = existingWeight + clusterWeight;

        boolean movable = gate.getDerivationMethod() == DerivationMethod.CLUSTERING || !gate.hasLocation();
        if (movable) {
            if (gate.hasLocation() && existingWeight > 0) {
                gate.moveCentroid(
                    (gate.getLatitude() * existingWeight + cluster.latitude() * clusterWeight) / total,
                    (gate.getLongitude() * existingWeight + cluster.longitude() * clusterWeight) / total
                );
                gate.setSpatialVariance(
                    (gate.getSpatialVariance() * existingWeight + cluster.spatialVariance() * clusterWeight) / total);
            } else {
                gate.moveCentroid(cluster.latitude(), cluster.longitude());
                gate.setSpatialVariance(cluster.spatialVariance());
            }
        }
        gate.setSampleCount(Math.max(gate.getSampleCount(), cluster.size()));
        gate.setFirstSeenAt(Gate.earliest(gate.getFirstSeenAt(), cluster.firstSeen()));
        gate.setLastSeenAt(Gate.latest(gate.getLastSeenAt(), cluster.lastSeen()));
    }
}

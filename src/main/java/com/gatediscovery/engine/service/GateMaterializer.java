package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.GateCluster;
import com.gatediscovery.engine.dto.MaterializationResult;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.ApprovalStatus;
import com.gatediscovery.engine.entity.DerivationMethod;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.geo.GeoMath;
import com.gatediscovery.engine.repository.GateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns clusters into gates.
 *
 * For each cluster, largest first:
 * 1. An active gate of the session within the match tolerance absorbs it (rolling update)
 * 2. Otherwise a new gate is inserted under the cluster's centroid key
 * 3. If the insert hits the (session, centroid key) unique constraint, another
 *    run created the gate first; that gate is updated instead
 *
 * Step 3 is what keeps concurrent runs (two instances, or an async trigger racing
 * the timer) from producing two gates for one cluster, even without the session lock.
 *
 * Naming of new gates goes by volume within the run: the largest cluster of a
 * session's first run is "Main Gate"; clusters with at least half of the largest
 * one's volume are "Secondary Gate N"; the rest are "Access Point N".
 */
@Service
@Slf4j
public class GateMaterializer {

    static final String MAIN_GATE_NAME = "Main Gate";

    private final GateRepository gateRepository;
    private final GateWriter gateWriter;
    private final GateHealthCalculator healthCalculator;
    private final double matchToleranceMeters;

    public GateMaterializer(GateRepository gateRepository,
                            GateWriter gateWriter,
                            GateHealthCalculator healthCalculator,
                            GateDiscoveryProperties properties) {
        this.gateRepository = gateRepository;
        this.gateWriter = gateWriter;
        this.healthCalculator = healthCalculator;
        this.matchToleranceMeters = properties.getTuning().getGateMatchToleranceMeters();
    }

    public MaterializationResult materialize(Long sessionId, List<GateCluster> clusters, ThresholdSettings settings) {
        if (clusters.isEmpty()) {
            log.debug("No clusters for session {}, nothing to materialize", sessionId);
            return new MaterializationResult(0, 0, 0, List.of());
        }

        List<Gate> active = new ArrayList<>(gateRepository.findBySessionIdAndStatusOrderByIdAsc(sessionId, GateStatus.ACTIVE));
        long existingGates = gateRepository.countBySessionId(sessionId);
        boolean mainAssigned = existingGates > 0;
        long ordinal = existingGates;
        int largest = clusters.stream().mapToInt(GateCluster::size).max().orElse(0);

        int created = 0;
        int updated = 0;
        int conflicts = 0;
        Set<Long> touched = new HashSet<>();
        List<Long> gateIds = new ArrayList<>();

        List<GateCluster> ordered = new ArrayList<>(clusters);
        ordered.sort(Comparator.comparingInt(GateCluster::size).reversed().thenComparing(GateCluster::lowestMemberId));

        for (GateCluster cluster : ordered) {
            Optional<Gate> match = nearestActive(active, cluster.latitude(), cluster.longitude());
            if (match.isPresent()) {
                Optional<Gate> reinforced = gateWriter.reinforce(match.get().getId(), cluster, settings.minEffectiveSamples());
                if (reinforced.isPresent()) {
                    replace(active, reinforced.get());
                    updated++;
                    record(touched, gateIds, reinforced.get().getId());
                }
                continue;
            }

            ordinal++;
            boolean main = !mainAssigned && cluster.size() == largest;
            String name = nameFor(cluster.size(), largest, ordinal, main);
            Gate candidate = newGate(sessionId, cluster, name, settings);

            try {
                Gate saved = gateWriter.insert(candidate);
                active.add(saved);
                created++;
                mainAssigned = mainAssigned || main;
                record(touched, gateIds, saved.getId());
                log.info("Gate created: {} from {} scans at ({}, {})", saved.toLogString(), cluster.size(),
                    String.format("%.6f", cluster.latitude()), String.format("%.6f", cluster.longitude()));
            } catch (DataIntegrityViolationException e) {
                conflicts++;
                log.info("Gate for centroid key {} in session {} was created concurrently, updating it instead",
                    candidate.getCentroidKey(), sessionId);
                Optional<Gate> winner = reinforceWinner(sessionId, candidate.getCentroidKey(), cluster, settings);
                if (winner.isPresent()) {
                    if (winner.get().isActive()) {
                        replace(active, winner.get());
                    }
                    updated++;
                    record(touched, gateIds, winner.get().getId());
                } else {
                    log.warn("Centroid key {} in session {} is held by an inactive gate, cluster of {} scans skipped",
                        candidate.getCentroidKey(), sessionId, cluster.size());
                }
            }
        }

        log.info("Materialized {} clusters for session {}: {} created, {} updated, {} conflicts resolved",
            clusters.size(), sessionId, created, updated, conflicts);
        return new MaterializationResult(created, updated, conflicts, gateIds);
    }

    /**
     * Updates whichever gate holds the key. A key held by a merged-away gate
     * belongs to the gate it was merged into; a key held by a gate an operator
     * switched off is left alone.
     */
    private Optional<Gate> reinforceWinner(Long sessionId, String centroidKey, GateCluster cluster,
                                           ThresholdSettings settings) {
        Optional<Gate> holder = gateWriter.findByCentroidKey(sessionId, centroidKey);
        Set<Long> visited = new HashSet<>();
        while (holder.isPresent() && !holder.get().isActive() && holder.get().getMergedIntoGateId() != null
            && visited.add(holder.get().getId())) {
            holder = gateRepository.findById(holder.get().getMergedIntoGateId());
        }
        if (holder.isEmpty() || !holder.get().isActive()) {
            return Optional.empty();
        }
        return gateWriter.reinforce(holder.get().getId(), cluster, settings.minEffectiveSamples());
    }

    private Optional<Gate> nearestActive(List<Gate> gates, double latitude, double longitude) {
        Gate best = null;
        double bestDistance = Double.MAX_VALUE;
        for (Gate gate : gates) {
            if (!gate.isActive() || !gate.hasLocation()) {
                continue;
            }
            double distance = gate.distanceTo(latitude, longitude);
            if (distance <= matchToleranceMeters && distance < bestDistance) {
                best = gate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    private Gate newGate(Long sessionId, GateCluster cluster, String name, ThresholdSettings settings) {
        Gate gate = Gate.builder()
            .sessionId(sessionId)
            .name(name)
            .centroidKey(GeoMath.centroidKey(cluster.latitude(), cluster.longitude()))
            .derivationMethod(DerivationMethod.CLUSTERING)
            .status(GateStatus.ACTIVE)
            .approvalStatus(ApprovalStatus.PENDING)
            .spatialVariance(cluster.spatialVariance())
            .sampleCount(cluster.size())
            .firstSeenAt(cluster.firstSeen())
            .lastSeenAt(cluster.lastSeen())
            .build();
        gate.moveCentroid(cluster.latitude(), cluster.longitude());
        gate.setHealthScore(healthCalculator.score(gate, 0, settings.minEffectiveSamples()));
        return gate;
    }

    static String nameFor(int clusterSize, int largestSize, long ordinal, boolean main) {
        if (main) {
            return MAIN_GATE_NAME;
        }
        if (clusterSize * 2 >= largestSize) {
            return "Secondary Gate " + ordinal;
        }
        return "Access Point " + ordinal;
    }

    private static void replace(List<Gate> gates, Gate updated) {
        gates.removeIf(g -> g.getId().equals(updated.getId()));
        gates.add(updated);
    }

    private static void record(Set<Long> touched, List<Long> gateIds, Long gateId) {
        if (touched.add(gateId)) {
            gateIds.add(gateId);
        }
    }
}

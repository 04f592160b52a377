package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.OrphanAssignmentResult;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.AssignmentMethod;
import com.gatediscovery.engine.entity.CheckinEvent;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Attaches check-ins that have a usable location but no gate to the nearest
 * active gate within the orphan bound.
 *
 * - Candidates come from PostGIS (ST_DWithin on geography), then the haversine
 *   distance is checked again so the bound holds exactly as the rest of the
 *   engine measures it
 * - Assignment is a conditional update on {@code gate_id IS NULL}; running the
 *   job twice, or next to ingestion, cannot re-point a resolved check-in
 * - Check-ins with no gate in range stay orphaned. The walk resumes from the
 *   session's orphan cursor and wraps to the start once it reaches the last
 *   orphan, so every orphan is looked at again within a bounded number of cycles
 * - This service never creates gates
 */
@Service
@Slf4j
public class OrphanAssignmentService {

    private final CheckinEventRepository checkinRepository;
    private final GateRepository gateRepository;
    private final int pageSize;
    private final int maxPerCycle;

    public OrphanAssignmentService(CheckinEventRepository checkinRepository,
                                   GateRepository gateRepository,
                                   GateDiscoveryProperties properties) {
        this.checkinRepository = checkinRepository;
        this.gateRepository = gateRepository;
        this.pageSize = properties.getWork().getOrphanBatchSize();
        this.maxPerCycle = properties.getWork().getMaxOrphansPerCycle();
    }

    /**
     * Walks orphans in id order with a keyset cursor, up to the per-cycle limit.
     *
     * @param startAfterId checkpoint left by the previous walk, 0 to start from the first orphan
     * @param keepRunning checked before every page; false stops the walk early
     */
    @Transactional
    public OrphanAssignmentResult assignOrphans(Long sessionId, ThresholdSettings settings, long startAfterId,
                                                BooleanSupplier keepRunning) {
        long start = Math.max(0L, startAfterId);
        long cursor = start;
        boolean wrapped = start == 0L;
        boolean reachedEnd = false;
        int examined = 0;
        int assigned = 0;

        walk:
        while (examined < maxPerCycle) {
            if (!keepRunning.getAsBoolean()) {
                log.info("Orphan assignment for session {} stopped after {} check-ins", sessionId, examined);
                return new OrphanAssignmentResult(examined, assigned, cursor, true);
            }
            int limit = Math.min(pageSize, maxPerCycle - examined);
            List<CheckinEvent> page = checkinRepository.findOrphanPage(sessionId, cursor, PageRequest.of(0, limit));
            for (CheckinEvent orphan : page) {
                if (wrapped && start > 0L && orphan.getId() > start) {
                    // back where this walk began
                    reachedEnd = true;
                    break walk;
                }
                examined++;
                cursor = orphan.getId();
                Optional<Gate> gate = findNearestGate(sessionId, orphan.getLatitude(), orphan.getLongitude(),
                    settings.orphanMaxDistanceMeters());
                if (gate.isPresent()) {
                    assigned += checkinRepository.assignGateIfOrphan(orphan.getId(), gate.get().getId(),
                        AssignmentMethod.ORPHAN_BACKFILL);
                }
            }
            if (page.size() < limit) {
                if (wrapped) {
                    reachedEnd = true;
                    break;
                }
                wrapped = true;
                cursor = 0L;
            }
        }

        long nextCursor = reachedEnd ? 0L : cursor;
        log.info("Orphan assignment for session {}: {} examined, {} assigned, next walk after id {}",
            sessionId, examined, assigned, nextCursor);
        return new OrphanAssignmentResult(examined, assigned, nextCursor, false);
    }

    /**
     * Nearest active gate of the session within {@code maxDistanceMeters}; ties go to the lower id.
     */
    @Transactional(readOnly = true)
    public Optional<Gate> findNearestGate(Long sessionId, double latitude, double longitude, double maxDistanceMeters) {
        List<Gate> candidates = gateRepository.findActiveWithinDistance(sessionId, latitude, longitude, maxDistanceMeters);
        Gate best = null;
        double bestDistance = Double.MAX_VALUE;
        for (Gate gate : candidates) {
            if (!gate.isActive() || !gate.hasLocation()) {
                continue;
            }
            double distance = gate.distanceTo(latitude, longitude);
            if (distance > maxDistanceMeters) {
                continue;
            }
            if (distance < bestDistance || (distance == bestDistance && gate.getId() < best.getId())) {
                best = gate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }
}

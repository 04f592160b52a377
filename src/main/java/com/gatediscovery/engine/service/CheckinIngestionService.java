package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.CheckinReceipt;
import com.gatediscovery.engine.dto.CheckinRequest;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.AssignmentMethod;
import com.gatediscovery.engine.entity.CheckinEvent;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.VenueSession;
import com.gatediscovery.engine.exception.GateNotFoundException;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Optional;

/**
 * Stores wristband scans.
 *
 * Flow:
 * 1. Resolve the session (unknown session is rejected)
 * 2. Return the stored event when the client event id was already seen
 * 3. Weigh the GPS fix
 * 4. Resolve the gate: the scanner's gate, otherwise the nearest active gate
 *    within the orphan bound, otherwise none. The chosen gate is share-locked
 *    and merges are followed, so a check-in never lands on a retired gate
 * 5. Persist, then after commit let the discovery trigger check its milestone
 *
 * Scans to an inactive session are stored but trigger nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckinIngestionService {

    private static final int MAX_MERGE_HOPS = 16;

    private final VenueSessionService sessionService;
    private final ThresholdConfigService thresholdConfigService;
    private final CheckinEventRepository checkinRepository;
    private final GateRepository gateRepository;
    private final GpsQualityFilter qualityFilter;
    private final OrphanAssignmentService orphanService;
    private final DiscoveryTrigger discoveryTrigger;

    @Transactional
    public CheckinReceipt ingest(Long sessionId, CheckinRequest request) {
        VenueSession session = sessionService.require(sessionId);
        ThresholdSettings settings = thresholdConfigService.getEffective(sessionId);

        if (request.clientEventId() != null) {
            Optional<CheckinEvent> existing =
                checkinRepository.findBySessionIdAndClientEventId(sessionId, request.clientEventId());
            if (existing.isPresent()) {
                log.debug("Duplicate client event {} for session {}", request.clientEventId(), sessionId);
                return receipt(existing.get(), settings, true);
            }
        }

        double weight = qualityFilter.qualityWeight(request.latitude(), request.longitude(), request.accuracy());
        Long gateId = resolveGate(sessionId, request, weight, settings);

        CheckinEvent event = checkinRepository.save(CheckinEvent.builder()
            .sessionId(sessionId)
            .wristbandId(request.wristbandId())
            .category(request.category())
            .timestamp(request.timestamp())
            .latitude(request.latitude())
            .longitude(request.longitude())
            .accuracy(request.accuracy())
            .qualityWeight(weight)
            .gateId(gateId)
            .assignmentMethod(gateId != null ? AssignmentMethod.INGESTION : null)
            .outcome(request.outcome())
            .clientEventId(request.clientEventId())
            .hourBucket(CheckinEvent.hourBucketOf(request.timestamp()))
            .build());

        CheckinReceipt receipt = receipt(event, settings, false);
        log.debug("Stored {}", event.toLogString());

        if (session.isActive() && receipt.clusteringEligible()) {
            triggerAfterCommit(sessionId);
        }
        return receipt;
    }

    private Long resolveGate(Long sessionId, CheckinRequest request, double weight, ThresholdSettings settings) {
        Long candidate;
        if (request.gateId() != null) {
            candidate = gateRepository.findByIdAndSessionId(request.gateId(), sessionId)
                .map(Gate::getId)
                .orElseThrow(() -> new GateNotFoundException(sessionId, request.gateId()));
        } else if (weight <= 0.0) {
            return null;
        } else {
            candidate = orphanService.findNearestGate(sessionId, request.latitude(), request.longitude(),
                    settings.orphanMaxDistanceMeters())
                .map(Gate::getId)
                .orElse(null);
        }
        return candidate == null ? null : lockSurvivor(candidate);
    }

    /**
     * Share-locks the gate the check-in will reference, following merges. A merge
     * in flight holds the row exclusively, so this waits for it and then lands on
     * the surviving gate. A scanner may also still be configured with a gate that
     * was merged away long ago.
     */
    private Long lockSurvivor(Long gateId) {
        Long current = gateId;
        for (int hop = 0; hop < MAX_MERGE_HOPS; hop++) {
            Optional<Long> mergedInto = gateRepository.lockMergedIntoForShare(current);
            if (mergedInto.isEmpty() || mergedInto.get() == 0L) {
                return current;
            }
            current = mergedInto.get();
        }
        return current;
    }

    private void triggerAfterCommit(Long sessionId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            discoveryTrigger.onAcceptedScan(sessionId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                discoveryTrigger.onAcceptedScan(sessionId);
            }
        });
    }

    private CheckinReceipt receipt(CheckinEvent event, ThresholdSettings settings, boolean duplicate) {
        return new CheckinReceipt(
            event.getId(),
            event.getSessionId(),
            event.getGateId(),
            event.getQualityWeight(),
            qualityFilter.isClusteringEligible(event.getQualityWeight(), settings.minQualityWeight()),
            duplicate
        );
    }
}

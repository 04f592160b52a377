package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.GateView;
import com.gatediscovery.engine.dto.ManualGateRequest;
import com.gatediscovery.engine.entity.ApprovalStatus;
import com.gatediscovery.engine.entity.BindingStatus;
import com.gatediscovery.engine.entity.CategoryBinding;
import com.gatediscovery.engine.entity.DerivationMethod;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.exception.BindingNotFoundException;
import com.gatediscovery.engine.exception.GateNotFoundException;
import com.gatediscovery.engine.exception.InvalidBindingTransitionException;
import com.gatediscovery.engine.geo.GeoMath;
import com.gatediscovery.engine.repository.CategoryBindingRepository;
import com.gatediscovery.engine.repository.GateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Operator reads and edits of gates and their category bindings.
 *
 * Writes are expected to run through {@link CycleCoordinator#runOperatorAction}
 * so they never interleave with a background cycle of the same session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GateAdminService {

    private final VenueSessionService sessionService;
    private final GateRepository gateRepository;
    private final CategoryBindingRepository bindingRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<GateView> listGates(Long sessionId, GateStatus status) {
        sessionService.require(sessionId);
        List<Gate> gates = status == null
            ? gateRepository.findBySessionIdOrderByIdAsc(sessionId)
            : gateRepository.findBySessionIdAndStatusOrderByIdAsc(sessionId, status);
        Map<Long, List<CategoryBinding>> bindingsByGate = bindingRepository.findBySessionId(sessionId).stream()
            .collect(Collectors.groupingBy(CategoryBinding::getGateId));
        return gates.stream()
            .map(gate -> GateView.from(gate, bindingsByGate.getOrDefault(gate.getId(), List.of())))
            .toList();
    }

    @Transactional(readOnly = true)
    public GateView getGate(Long sessionId, Long gateId) {
        Gate gate = requireGate(sessionId, gateId);
        return GateView.from(gate, bindingRepository.findByGateId(gateId));
    }

    /**
     * Creates an approved gate at an operator-given position. Without a position
     * the gate never attracts orphans or takes part in duplicate detection.
     */
    @Transactional
    public GateView createManualGate(Long sessionId, ManualGateRequest request) {
        sessionService.require(sessionId);
        boolean located = GeoMath.isValidCoordinate(request.latitude(), request.longitude());
        if (request.latitude() != null && !located) {
            throw new IllegalArgumentException("Manual gate location is not a usable coordinate");
        }

        Instant now = Instant.now(clock);
        Gate gate = Gate.builder()
            .sessionId(sessionId)
            .name(request.name().trim())
            .centroidKey(located
                ? GeoMath.centroidKey(request.latitude(), request.longitude())
                : "manual:" + UUID.randomUUID())
            .derivationMethod(DerivationMethod.MANUAL)
            .status(GateStatus.ACTIVE)
            .approvalStatus(ApprovalStatus.APPROVED)
            .firstSeenAt(now)
            .lastSeenAt(now)
            .build();
        if (located) {
            gate.moveCentroid(request.latitude(), request.longitude());
        }
        Gate saved = gateRepository.saveAndFlush(gate);
        log.info("Manual gate created: {}", saved.toLogString());
        return GateView.from(saved, List.of());
    }

    @Transactional
    public GateView rename(Long sessionId, Long gateId, String name) {
        Gate gate = requireGate(sessionId, gateId);
        gate.setName(name.trim());
        return save(gate);
    }

    /**
     * Approving a previously rejected gate puts it back in service.
     */
    @Transactional
    public GateView approve(Long sessionId, Long gateId) {
        Gate gate = requireGate(sessionId, gateId);
        if (gate.getApprovalStatus() == ApprovalStatus.REJECTED && gate.getMergedIntoGateId() == null) {
            gate.setStatus(GateStatus.ACTIVE);
        }
        gate.setApprovalStatus(ApprovalStatus.APPROVED);
        log.info("Gate {} approved", gateId);
        return save(gate);
    }

    /**
     * A rejected gate is taken out of service. It keeps its centroid key, so
     * discovery does not recreate a gate at the same spot.
     */
    @Transactional
    public GateView reject(Long sessionId, Long gateId) {
        Gate gate = requireGate(sessionId, gateId);
        gate.setApprovalStatus(ApprovalStatus.REJECTED);
        gate.setStatus(GateStatus.INACTIVE);
        log.info("Gate {} rejected", gateId);
        return save(gate);
    }

    @Transactional
    public GateView changeStatus(Long sessionId, Long gateId, GateStatus status) {
        Gate gate = requireGate(sessionId, gateId);
        if (gate.getMergedIntoGateId() != null && status != GateStatus.INACTIVE) {
            throw new IllegalArgumentException(
                "Gate " + gateId + " was merged into gate " + gate.getMergedIntoGateId() + " and stays inactive");
        }
        if (gate.getStatus() != status) {
            log.info("Gate {} status {} -> {}", gateId, gate.getStatus(), status);
            gate.setStatus(status);
        }
        return save(gate);
    }

    @Transactional
    public GateView unbindCategory(Long sessionId, Long gateId, String category) {
        CategoryBinding binding = requireBinding(sessionId, gateId, category);
        transition(binding, BindingStatus.UNBOUND, binding::unbind);
        return getGate(sessionId, gateId);
    }

    @Transactional
    public GateView resetBinding(Long sessionId, Long gateId, String category) {
        CategoryBinding binding = requireBinding(sessionId, gateId, category);
        transition(binding, BindingStatus.PROBATION, binding::resetToProbation);
        return getGate(sessionId, gateId);
    }

    private void transition(CategoryBinding binding, BindingStatus target, Runnable change) {
        BindingStatus from = binding.getStatus();
        try {
            change.run();
        } catch (IllegalStateException e) {
            throw new InvalidBindingTransitionException(e.getMessage());
        }
        bindingRepository.save(binding);
        log.info("Binding {}@gate {} moved {} -> {} by operator", binding.getCategory(), binding.getGateId(),
            from, target);
    }

    private Gate requireGate(Long sessionId, Long gateId) {
        return gateRepository.findByIdAndSessionId(gateId, sessionId)
            .orElseThrow(() -> new GateNotFoundException(sessionId, gateId));
    }

    private CategoryBinding requireBinding(Long sessionId, Long gateId, String category) {
        requireGate(sessionId, gateId);
        return bindingRepository.findByGateIdAndCategory(gateId, category.trim())
            .orElseThrow(() -> new BindingNotFoundException(gateId, category));
    }

    private GateView save(Gate gate) {
        Gate saved = gateRepository.save(gate);
        return GateView.from(saved, bindingRepository.findByGateId(saved.getId()));
    }
}

package com.gatediscovery.engine.service;

import com.gatediscovery.engine.entity.VenueSession;
import com.gatediscovery.engine.exception.SessionNotFoundException;
import com.gatediscovery.engine.repository.VenueSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Registry of venue sessions and the checkpoints of their background cycles.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VenueSessionService {

    private final VenueSessionRepository sessionRepository;

    @Transactional
    public VenueSession create(String name) {
        VenueSession session = sessionRepository.save(VenueSession.builder().name(name.trim()).build());
        log.info("Venue session created: id={}, name={}", session.getId(), session.getName());
        return session;
    }

    @Transactional(readOnly = true)
    public List<VenueSession> list() {
        return sessionRepository.findAll(Sort.by("id"));
    }

    @Transactional(readOnly = true)
    public VenueSession require(Long sessionId) {
        return sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Cancellation check used between units of background work.
     */
    @Transactional(readOnly = true)
    public boolean isActive(Long sessionId) {
        return sessionRepository.findActiveFlag(sessionId).orElse(false);
    }

    @Transactional(readOnly = true)
    public List<Long> activeSessionIds() {
        return sessionRepository.findActiveIds();
    }

    @Transactional
    public VenueSession setActive(Long sessionId, boolean active) {
        VenueSession session = require(sessionId);
        if (session.isActive() != active) {
            session.setActive(active);
            sessionRepository.save(session);
            log.info("Venue session {} {}", sessionId, active ? "activated" : "deactivated");
        }
        return session;
    }

    @Transactional
    public void recordDiscoveryRun(Long sessionId, long acceptedScanCount, Instant at) {
        VenueSession session = require(sessionId);
        session.setLastDiscoveryScanCount(acceptedScanCount);
        session.setLastDiscoveryAt(at);
        sessionRepository.save(session);
    }

    @Transactional
    public void recordOrphanCursor(Long sessionId, long cursor) {
        VenueSession session = require(sessionId);
        session.setOrphanCursor(cursor);
        sessionRepository.save(session);
    }

    @Transactional
    public void recordEnforcementRun(Long sessionId, Instant at) {
        VenueSession session = require(sessionId);
        session.setLastEnforcementAt(at);
        sessionRepository.save(session);
    }

    @Transactional
    public void recordDuplicateScan(Long sessionId, Instant at) {
        VenueSession session = require(sessionId);
        session.setLastDuplicateScanAt(at);
        sessionRepository.save(session);
    }
}

package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.VenueSession;

import java.time.Instant;

public record SessionView(
    Long id,
    String name,
    boolean active,
    long lastDiscoveryScanCount,
    long orphanCursor,
    Instant lastDiscoveryAt,
    Instant lastEnforcementAt,
    Instant lastDuplicateScanAt,
    Instant createdAt
) {

    public static SessionView from(VenueSession session) {
        return new SessionView(
            session.getId(),
            session.getName(),
            session.isActive(),
            session.getLastDiscoveryScanCount(),
            session.getOrphanCursor(),
            session.getLastDiscoveryAt(),
            session.getLastEnforcementAt(),
            session.getLastDuplicateScanAt(),
            session.getCreatedAt()
        );
    }
}

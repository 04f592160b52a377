package com.gatediscovery.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * A venue event whose gates are discovered and enforced independently of every
 * other session. Deactivating a session stops its background cycles.
 */
@Entity
@Table(name = "venue_sessions")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VenueSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    /**
     * Accepted-scan count when discovery last ran; milestone triggers compare against it.
     */
    @Column(name = "last_discovery_scan_count", nullable = false)
    @Builder.Default
    private long lastDiscoveryScanCount = 0L;

    /**
     * Id the orphan backfill resumes after; 0 starts from the first orphan.
     */
    @Column(name = "orphan_cursor", nullable = false, columnDefinition = "bigint not null default 0")
    @Builder.Default
    private long orphanCursor = 0L;

    @Column(name = "last_discovery_at")
    private Instant lastDiscoveryAt;

    @Column(name = "last_enforcement_at")
    private Instant lastEnforcementAt;

    @Column(name = "last_duplicate_scan_at")
    private Instant lastDuplicateScanAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}

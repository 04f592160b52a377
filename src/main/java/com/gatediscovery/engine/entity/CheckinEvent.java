package com.gatediscovery.engine.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * One wristband scan at a venue session.
 *
 * Identity and location fields are written once. Only the gate reference
 * (orphan backfill, merge re-pointing) and the {@code learned} marker change
 * after insert, and both go through bulk conditional updates in
 * {@code CheckinEventRepository}, so this class exposes no setters.
 */
@Entity
@Table(
    name = "checkin_events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_checkin_session_client_event", columnNames = {"session_id", "client_event_id"})
    },
    indexes = {
        @Index(name = "idx_checkin_session_gate", columnList = "session_id, gate_id"),
        @Index(name = "idx_checkin_session_learned", columnList = "session_id, learned"),
        @Index(name = "idx_checkin_session_scanned", columnList = "session_id, scanned_at"),
        @Index(name = "idx_checkin_gate_hour", columnList = "gate_id, hour_bucket")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CheckinEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private Long sessionId;

    @Column(name = "wristband_id", nullable = false, updatable = false, length = 100)
    private String wristbandId;

    @Column(nullable = false, updatable = false, length = 50)
    private String category;

    @Column(name = "scanned_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(updatable = false)
    private Double latitude;

    @Column(updatable = false)
    private Double longitude;

    /**
     * Reported GPS accuracy radius in meters.
     */
    @Column(updatable = false)
    private Double accuracy;

    @Column(name = "quality_weight", nullable = false, updatable = false)
    private double qualityWeight;

    @Column(name = "gate_id")
    private Long gateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_method", length = 20)
    private AssignmentMethod assignmentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private CheckinOutcome outcome;

    @Column(name = "client_event_id", updatable = false, length = 100)
    private String clientEventId;

    /**
     * Epoch hours of the scan timestamp, the bucket used for traffic comparisons.
     */
    @Column(name = "hour_bucket", nullable = false, updatable = false)
    private long hourBucket;

    @Column(nullable = false)
    @Builder.Default
    private boolean learned = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean hasLocation() {
        return latitude != null && longitude != null && qualityWeight > 0.0;
    }

    public static long hourBucketOf(Instant timestamp) {
        return Math.floorDiv(timestamp.getEpochSecond(), 3600L);
    }

    public String toLogString() {
        return String.format("Checkin[id=%d, session=%d, category=%s, gate=%s, weight=%.1f]",
            id, sessionId, category, gateId, qualityWeight);
    }
}

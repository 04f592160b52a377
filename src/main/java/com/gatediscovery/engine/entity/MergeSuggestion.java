package com.gatediscovery.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Proposal to fold {@code sourceGateId} into {@code targetGateId}.
 *
 * Only PENDING suggestions change. Once approved, rejected or auto-applied the
 * row is an audit record.
 */
@Entity
@Table(
    name = "merge_suggestions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_merge_session_pair", columnNames = {"session_id", "source_gate_id", "target_gate_id"})
    },
    indexes = {
        @Index(name = "idx_merge_session_status", columnList = "session_id, status")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MergeSuggestion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "source_gate_id", nullable = false)
    private Long sourceGateId;

    @Column(name = "target_gate_id", nullable = false)
    private Long targetGateId;

    @Column(name = "distance_meters", nullable = false)
    private double distanceMeters;

    @Column(name = "traffic_similarity", nullable = false)
    private double trafficSimilarity;

    @Column(nullable = false)
    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private MergeStatus status = MergeStatus.PENDING;

    @Column(length = 1000)
    private String reasoning;

    @Column(name = "reviewed_by", length = 100)
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "review_reason", length = 500)
    private String reviewReason;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isPending() {
        return status == MergeStatus.PENDING;
    }

    public boolean involves(Long gateId) {
        return sourceGateId.equals(gateId) || targetGateId.equals(gateId);
    }

    public void close(MergeStatus outcome, String reviewer, String reason, Instant at) {
        if (!isPending()) {
            throw new IllegalStateException("Merge suggestion " + id + " is already " + status);
        }
        this.status = outcome;
        this.reviewedBy = reviewer;
        this.reviewReason = reason;
        this.reviewedAt = at;
    }
}

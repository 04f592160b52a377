package com.gatediscovery.engine.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Learned association between a gate and a ticket category.
 *
 * State changes go through the methods below, which refuse transitions that
 * {@link BindingStatus#canTransitionTo} does not allow. The gate id is the only
 * field with a setter, for moving a binding onto a merge survivor.
 */
@Entity
@Table(
    name = "category_bindings",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_binding_gate_category", columnNames = {"gate_id", "category"})
    },
    indexes = {
        @Index(name = "idx_binding_session_category", columnList = "session_id, category")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CategoryBinding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Setter
    @Column(name = "gate_id", nullable = false)
    private Long gateId;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(nullable = false, length = 50)
    private String category;

    @Column(name = "sample_count", nullable = false)
    @Builder.Default
    private int sampleCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private double confidence = 0.0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private BindingStatus status = BindingStatus.PROBATION;

    @Column(name = "violation_count", nullable = false)
    @Builder.Default
    private int violationCount = 0;

    @Column(name = "last_violation_at")
    private Instant lastViolationAt;

    @Column(name = "demotion_count", nullable = false)
    @Builder.Default
    private int demotionCount = 0;

    @Column(name = "enforced_at")
    private Instant enforcedAt;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public static CategoryBinding start(Long sessionId, Long gateId, String category) {
        return CategoryBinding.builder()
            .sessionId(sessionId)
            .gateId(gateId)
            .category(category)
            .build();
    }

    public boolean isEnforced() {
        return status == BindingStatus.ENFORCED;
    }

    public boolean isRecognized(double softThreshold) {
        return BindingStatus.isRecognized(status, confidence, softThreshold);
    }

    public void recordSample() {
        sampleCount++;
    }

    public void recordViolation(Instant at) {
        violationCount++;
        lastViolationAt = Gate.latest(lastViolationAt, at);
    }

    /**
     * violations / (samples + violations); 0 for an untouched binding.
     */
    public double violationRate() {
        int total = sampleCount + violationCount;
        return total == 0 ? 0.0 : (double) violationCount / total;
    }

    public void updateConfidence(double value) {
        this.confidence = Math.max(0.0, Math.min(1.0, value));
    }

    public void promote(Instant at) {
        transitionTo(BindingStatus.ENFORCED);
        enforcedAt = at;
    }

    /**
     * Steps an enforced binding down after a sustained violation sequence.
     * Returns the status it landed in.
     */
    public BindingStatus demote(int demotionsBeforeUnbind) {
        if (status != BindingStatus.ENFORCED) {
            throw new IllegalStateException("Only an enforced binding can be demoted, was " + status);
        }
        demotionCount++;
        transitionTo(demotionCount >= demotionsBeforeUnbind ? BindingStatus.UNBOUND : BindingStatus.PROBATION);
        enforcedAt = null;
        return status;
    }

    public void unbind() {
        transitionTo(BindingStatus.UNBOUND);
        enforcedAt = null;
    }

    public void resetToProbation() {
        transitionTo(BindingStatus.PROBATION);
        violationCount = 0;
        demotionCount = 0;
        lastViolationAt = null;
        confidence = 0.0;
    }

    /**
     * Adds a merged-away gate's evidence for the same category. The status stays
     * this binding's own.
     */
    public void absorb(CategoryBinding other) {
        sampleCount += other.getSampleCount();
        violationCount += other.getViolationCount();
        lastViolationAt = Gate.latest(lastViolationAt, other.getLastViolationAt());
    }

    private void transitionTo(BindingStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Binding %s@gate %d cannot move from %s to %s", category, gateId, status, target));
        }
        status = target;
    }

    public String toLogString() {
        return String.format("Binding[gate=%d, category=%s, status=%s, samples=%d, confidence=%.3f, violations=%d]",
            gateId, category, status, sampleCount, confidence, violationCount);
    }
}

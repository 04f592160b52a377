package com.gatediscovery.engine.entity;

import com.gatediscovery.engine.dto.ThresholdSettings;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Stored threshold override of one venue session. Sessions without a row use
 * the {@code gate-discovery.defaults} values.
 */
@Entity
@Table(
    name = "adaptive_threshold_configs",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_threshold_session", columnNames = {"session_id"})
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdaptiveThresholdConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "min_samples_for_gate", nullable = false)
    private int minSamplesForGate;

    @Column(name = "max_spatial_variance", nullable = false)
    private double maxSpatialVariance;

    @Column(name = "soft_threshold", nullable = false)
    private double softThreshold;

    @Column(name = "hard_threshold", nullable = false)
    private double hardThreshold;

    @Column(name = "min_effective_samples", nullable = false)
    private int minEffectiveSamples;

    @Column(name = "duplicate_distance_meters", nullable = false)
    private double duplicateDistanceMeters;

    @Column(name = "cluster_epsilon_meters", nullable = false)
    private double clusterEpsilonMeters;

    @Column(name = "min_quality_weight", nullable = false)
    private double minQualityWeight;

    @Column(name = "orphan_max_distance_meters", nullable = false)
    private double orphanMaxDistanceMeters;

    @Column(name = "merge_review_threshold", nullable = false)
    private double mergeReviewThreshold;

    @Column(name = "merge_auto_apply_threshold", nullable = false)
    private double mergeAutoApplyThreshold;

    @Column(name = "auto_apply_merges", nullable = false)
    private boolean autoApplyMerges;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public ThresholdSettings toSettings() {
        return new ThresholdSettings(
            minSamplesForGate,
            maxSpatialVariance,
            softThreshold,
            hardThreshold,
            minEffectiveSamples,
            duplicateDistanceMeters,
            clusterEpsilonMeters,
            minQualityWeight,
            orphanMaxDistanceMeters,
            mergeReviewThreshold,
            mergeAutoApplyThreshold,
            autoApplyMerges
        );
    }

    public void apply(ThresholdSettings settings) {
        this.minSamplesForGate = settings.minSamplesForGate();
        this.maxSpatialVariance = settings.maxSpatialVariance();
        this.softThreshold = settings.softThreshold();
        this.hardThreshold = settings.hardThreshold();
        this.minEffectiveSamples = settings.minEffectiveSamples();
        this.duplicateDistanceMeters = settings.duplicateDistanceMeters();
        this.clusterEpsilonMeters = settings.clusterEpsilonMeters();
        this.minQualityWeight = settings.minQualityWeight();
        this.orphanMaxDistanceMeters = settings.orphanMaxDistanceMeters();
        this.mergeReviewThreshold = settings.mergeReviewThreshold();
        this.mergeAutoApplyThreshold = settings.mergeAutoApplyThreshold();
        this.autoApplyMerges = settings.autoApplyMerges();
    }
}

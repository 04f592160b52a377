package com.gatediscovery.engine.config;

import com.gatediscovery.engine.dto.ThresholdSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process-wide settings bound from {@code gate-discovery.*}.
 *
 * <p>{@link Defaults} are the thresholds a venue session uses until an operator
 * stores an override for it. {@link Tuning} holds knobs that apply to every session.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "gate-discovery")
public class GateDiscoveryProperties {

    private Defaults defaults = new Defaults();
    private Tuning tuning = new Tuning();
    private Work work = new Work();
    private Lock lock = new Lock();
    private Cache cache = new Cache();
    private Scheduler scheduler = new Scheduler();

    @Getter
    @Setter
    public static class Defaults {
        private int minSamplesForGate = 5;
        private double maxSpatialVariance = 625.0;
        private double softThreshold = 0.70;
        private double hardThreshold = 0.80;
        private int minEffectiveSamples = 20;
        private double duplicateDistanceMeters = 25.0;
        private double clusterEpsilonMeters = 25.0;
        private double minQualityWeight = 0.6;
        private double orphanMaxDistanceMeters = 50.0;
        private double mergeReviewThreshold = 0.70;
        private double mergeAutoApplyThreshold = 0.95;
        private boolean autoApplyMerges = false;

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
    }

    @Getter
    @Setter
    public static class Tuning {
        /** Existing active gate within this distance absorbs a new cluster instead of a new gate. */
        private double gateMatchToleranceMeters = 20.0;
        private int firstDiscoveryAt = 50;
        private int discoveryRefreshEvery = 100;
        private int violationDemotionCount = 10;
        private double violationRateThreshold = 0.25;
        private int demotionsBeforeUnbind = 2;
        private double confidencePriorSamples = 5.0;
        private double outOfRangeMultiplier = 3.0;
        private double minAcceptedRadiusMeters = 30.0;
    }

    @Getter
    @Setter
    public static class Work {
        private int discoveryWindowHours = 4;
        private int maxClusteringPoints = 5000;
        private int learnerBatchSize = 500;
        private int learnerMaxBatches = 10;
        private int orphanBatchSize = 200;
        private int maxOrphansPerCycle = 2000;
    }

    @Getter
    @Setter
    public static class Lock {
        /** local or redis. */
        private String strategy = "local";
        private long ttlSeconds = 300;
        /** How long an operator merge waits for a running cycle before reporting the session busy. */
        private long operatorWaitMillis = 2000;
    }

    @Getter
    @Setter
    public static class Cache {
        private long snapshotTtlMinutes = 60;
        /** Read by the scheduled snapshot refresh through its placeholder. */
        private long refreshIntervalMinutes = 15;
    }

    /**
     * Timer intervals. The scheduler reads them through {@code @Scheduled} placeholders.
     */
    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
        private long initialDelayMs = 30000;
        private long discoveryIntervalMs = 300000;
        private long enforcementIntervalMs = 10000;
        private long duplicateIntervalMs = 600000;
    }
}

package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.MergeScore;
import com.gatediscovery.engine.dto.TrafficProfile;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Scores how likely two nearby gates are one physical gate.
 *
 * - distance score = 1 − d / bound
 * - hourly overlap = histogram intersection of the gates' normalized per-hour check-in counts
 * - category overlap = histogram intersection of their category mixes
 * - traffic similarity = 0.6 · hourly + 0.4 · category
 * - confidence = 0.5 · distance + 0.3 · hourly + 0.2 · category
 */
@Component
public class MergeSimilarityScorer {

    static final double DISTANCE_WEIGHT = 0.5;
    static final double HOURLY_WEIGHT = 0.3;
    static final double CATEGORY_WEIGHT = 0.2;

    static final double TRAFFIC_HOURLY_WEIGHT = 0.6;
    static final double TRAFFIC_CATEGORY_WEIGHT = 0.4;

    public MergeScore score(double distanceMeters, double distanceBoundMeters, TrafficProfile a, TrafficProfile b) {
        double distanceScore = Math.max(0.0, Math.min(1.0, 1.0 - distanceMeters / distanceBoundMeters));
        double hourly = histogramIntersection(a.hourly(), b.hourly());
        double category = histogramIntersection(a.categories(), b.categories());

        double trafficSimilarity = TRAFFIC_HOURLY_WEIGHT * hourly + TRAFFIC_CATEGORY_WEIGHT * category;
        double confidence = DISTANCE_WEIGHT * distanceScore + HOURLY_WEIGHT * hourly + CATEGORY_WEIGHT * category;

        return new MergeScore(distanceMeters, distanceScore, hourly, category, trafficSimilarity, confidence);
    }

    /**
     * Σ min(a_k / Σa, b_k / Σb). 1.0 for identical distributions, 0.0 when
     * either side is empty or they share no key.
     */
    static <K> double histogramIntersection(Map<K, Long> a, Map<K, Long> b) {
        long totalA = a.values().stream().mapToLong(Long::longValue).sum();
        long totalB = b.values().stream().mapToLong(Long::longValue).sum();
        if (totalA == 0 || totalB == 0) {
            return 0.0;
        }
        double overlap = 0.0;
        for (Map.Entry<K, Long> entry : a.entrySet()) {
            Long other = b.get(entry.getKey());
            if (other != null) {
                overlap += Math.min((double) entry.getValue() / totalA, (double) other / totalB);
            }
        }
        return Math.min(1.0, overlap);
    }
}

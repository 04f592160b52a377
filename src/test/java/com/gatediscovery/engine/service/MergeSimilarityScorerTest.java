package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.MergeScore;
import com.gatediscovery.engine.dto.TrafficProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MergeSimilarityScorer")
class MergeSimilarityScorerTest {

    private final MergeSimilarityScorer scorer = new MergeSimilarityScorer();

    @Test
    @DisplayName("Gates 8 m apart with identical traffic score 0.84")
    void closeGatesSameTraffic() {
        TrafficProfile a = new TrafficProfile(Map.of(100L, 30L, 101L, 20L), Map.of("GENERAL", 50L));
        TrafficProfile b = new TrafficProfile(Map.of(100L, 15L, 101L, 10L), Map.of("GENERAL", 25L));

        MergeScore score = scorer.score(8.0, 25.0, a, b);

        assertThat(score.distanceScore()).isCloseTo(0.68, within(1e-9));
        assertThat(score.hourlyOverlap()).isCloseTo(1.0, within(1e-9));
        assertThat(score.categoryOverlap()).isCloseTo(1.0, within(1e-9));
        assertThat(score.trafficSimilarity()).isCloseTo(1.0, within(1e-9));
        assertThat(score.confidence()).isCloseTo(0.84, within(1e-9));
    }

    @Test
    @DisplayName("Gates busy at different hours with different categories score on distance only")
    void disjointTraffic() {
        TrafficProfile a = new TrafficProfile(Map.of(100L, 40L), Map.of("VIP", 40L));
        TrafficProfile b = new TrafficProfile(Map.of(105L, 40L), Map.of("GENERAL", 40L));

        MergeScore score = scorer.score(5.0, 25.0, a, b);

        assertThat(score.trafficSimilarity()).isZero();
        assertThat(score.confidence()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("A gate with no traffic has no overlap")
    void emptyProfile() {
        TrafficProfile a = new TrafficProfile(Map.of(100L, 40L), Map.of("VIP", 40L));

        MergeScore score = scorer.score(0.0, 25.0, a, TrafficProfile.EMPTY);

        assertThat(score.hourlyOverlap()).isZero();
        assertThat(score.confidence()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Histogram intersection compares normalized shares")
    void histogramIntersection_PartialOverlap() {
        Map<String, Long> a = Map.of("GENERAL", 75L, "VIP", 25L);
        Map<String, Long> b = Map.of("GENERAL", 50L, "VIP", 50L);

        assertThat(MergeSimilarityScorer.histogramIntersection(a, b)).isCloseTo(0.75, within(1e-9));
        assertThat(MergeSimilarityScorer.histogramIntersection(b, a)).isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("Distance score is clamped at the bound")
    void distanceBeyondBound_Clamped() {
        MergeScore score = scorer.score(40.0, 25.0, TrafficProfile.EMPTY, TrafficProfile.EMPTY);

        assertThat(score.distanceScore()).isZero();
        assertThat(score.confidence()).isZero();
    }
}

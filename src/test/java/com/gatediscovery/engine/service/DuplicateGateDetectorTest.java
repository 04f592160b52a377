package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.DuplicateScanResult;
import com.gatediscovery.engine.dto.ThresholdConfigRequest;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.DerivationMethod;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.entity.MergeStatus;
import com.gatediscovery.engine.entity.MergeSuggestion;
import com.gatediscovery.engine.exception.StaleMergeStateException;
import com.gatediscovery.engine.geo.GeoMath;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import com.gatediscovery.engine.repository.MergeSuggestionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("DuplicateGateDetector")
class DuplicateGateDetectorTest {

    private static final Long SESSION_ID = 1L;
    private static final double ORIGIN_LAT = 41.0082;
    private static final double ORIGIN_LON = 28.9784;
    private static final double METERS_PER_DEGREE = GeoMath.EARTH_RADIUS_METERS * Math.PI / 180.0;

    @Mock
    private GateRepository gateRepository;
    @Mock
    private CheckinEventRepository checkinRepository;
    @Mock
    private MergeSuggestionRepository suggestionRepository;
    @Mock
    private GateMergeService mergeService;

    private DuplicateGateDetector detector;
    private ThresholdSettings defaults;

    @BeforeEach
    void setUp() {
        detector = new DuplicateGateDetector(gateRepository, checkinRepository, suggestionRepository,
            new MergeSimilarityScorer(), mergeService);
        defaults = new GateDiscoveryProperties().getDefaults().toSettings();
    }

    @Test
    @DisplayName("Two gates 8 m apart with the same traffic get one pending suggestion")
    void closeTwins_PendingSuggestion() {
        // given
        Gate busy = gate(1L, 60, 0.0);
        Gate quiet = gate(2L, 25, 8.0);
        givenGates(busy, quiet);
        givenSameTraffic();
        given(suggestionRepository.save(any(MergeSuggestion.class))).willAnswer(inv -> withId(inv.getArgument(0), 99L));

        // when
        DuplicateScanResult result = detector.detect(SESSION_ID, defaults);

        // then
        ArgumentCaptor<MergeSuggestion> saved = ArgumentCaptor.forClass(MergeSuggestion.class);
        verify(suggestionRepository).save(saved.capture());
        MergeSuggestion suggestion = saved.getValue();
        assertThat(suggestion.getSourceGateId()).isEqualTo(2L);
        assertThat(suggestion.getTargetGateId()).isEqualTo(1L);
        assertThat(suggestion.getStatus()).isEqualTo(MergeStatus.PENDING);
        assertThat(suggestion.getDistanceMeters()).isCloseTo(8.0, within(0.01));
        assertThat(suggestion.getConfidence()).isBetween(defaults.mergeReviewThreshold(),
            defaults.mergeAutoApplyThreshold());
        assertThat(suggestion.getConfidence()).isCloseTo(0.84, within(0.001));
        assertThat(result).isEqualTo(new DuplicateScanResult(1, 1, 0));
        verify(mergeService, never()).autoApply(anyLong());
    }

    @Test
    @DisplayName("With auto-apply on, a pair above the auto-apply threshold is merged")
    void autoApply_MergesAboveThreshold() {
        // given
        ThresholdSettings settings = new ThresholdConfigRequest(null, null, null, null, null, null, null, null,
            null, null, 0.80, true).applyTo(defaults);
        givenGates(gate(1L, 60, 0.0), gate(2L, 25, 8.0));
        givenSameTraffic();
        given(suggestionRepository.save(any(MergeSuggestion.class))).willAnswer(inv -> withId(inv.getArgument(0), 99L));

        // when
        DuplicateScanResult result = detector.detect(SESSION_ID, settings);

        // then
        verify(mergeService).autoApply(99L);
        assertThat(result.mergesApplied()).isEqualTo(1);
    }

    @Test
    @DisplayName("A stale auto-merge is skipped without failing the scan")
    void autoApply_StaleSkipped() {
        // given
        ThresholdSettings settings = new ThresholdConfigRequest(null, null, null, null, null, null, null, null,
            null, null, 0.80, true).applyTo(defaults);
        givenGates(gate(1L, 60, 0.0), gate(2L, 25, 8.0));
        givenSameTraffic();
        given(suggestionRepository.save(any(MergeSuggestion.class))).willAnswer(inv -> withId(inv.getArgument(0), 99L));
        given(mergeService.autoApply(99L)).willThrow(new StaleMergeStateException("gate 2 is INACTIVE"));

        // when
        DuplicateScanResult result = detector.detect(SESSION_ID, settings);

        // then
        assertThat(result).isEqualTo(new DuplicateScanResult(1, 1, 0));
    }

    @Test
    @DisplayName("Gates beyond the duplicate distance are not compared")
    void farApart_NotCompared() {
        // given
        givenGates(gate(1L, 60, 0.0), gate(2L, 25, 40.0));

        // when
        DuplicateScanResult result = detector.detect(SESSION_ID, defaults);

        // then
        assertThat(result).isEqualTo(new DuplicateScanResult(0, 0, 0));
        verify(suggestionRepository, never()).save(any());
    }

    @Test
    @DisplayName("A pair the operator already rejected is not suggested again")
    void decidedPair_NotReEmitted() {
        // given
        givenGates(gate(1L, 60, 0.0), gate(2L, 25, 8.0));
        givenSameTraffic();
        MergeSuggestion rejected = MergeSuggestion.builder()
            .id(5L).sessionId(SESSION_ID).sourceGateId(2L).targetGateId(1L).status(MergeStatus.REJECTED)
            .build();
        given(suggestionRepository.findFirstForPair(SESSION_ID, 2L, 1L)).willReturn(Optional.of(rejected));

        // when
        DuplicateScanResult result = detector.detect(SESSION_ID, defaults);

        // then
        assertThat(result.suggestionsEmitted()).isZero();
        verify(suggestionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Survivor is the gate with more samples, then the lower id")
    void survivorOf() {
        Gate a = gate(1L, 10, 0.0);
        Gate b = gate(2L, 30, 5.0);
        Gate c = gate(3L, 10, 5.0);

        assertThat(DuplicateGateDetector.survivorOf(a, b)).isSameAs(b);
        assertThat(DuplicateGateDetector.survivorOf(c, a)).isSameAs(a);
    }

    private void givenGates(Gate... gates) {
        given(gateRepository.findBySessionIdAndStatusOrderByIdAsc(SESSION_ID, GateStatus.ACTIVE))
            .willReturn(List.of(gates));
    }

    private void givenSameTraffic() {
        given(checkinRepository.countByGateAndHour(eq(SESSION_ID), anyCollection())).willReturn(List.of(
            new Object[]{1L, 480_000L, 30L},
            new Object[]{1L, 480_001L, 30L},
            new Object[]{2L, 480_000L, 12L},
            new Object[]{2L, 480_001L, 12L}
        ));
        given(checkinRepository.countByGateAndCategory(eq(SESSION_ID), anyCollection())).willReturn(List.of(
            new Object[]{1L, "GENERAL", 60L},
            new Object[]{2L, "GENERAL", 24L}
        ));
    }

    private static MergeSuggestion withId(MergeSuggestion suggestion, Long id) {
        suggestion.setId(id);
        return suggestion;
    }

    private static Gate gate(Long id, int samples, double northMeters) {
        Gate gate = Gate.builder()
            .id(id)
            .sessionId(SESSION_ID)
            .name("Gate " + id)
            .derivationMethod(DerivationMethod.CLUSTERING)
            .status(GateStatus.ACTIVE)
            .sampleCount(samples)
            .build();
        gate.moveCentroid(ORIGIN_LAT + northMeters / METERS_PER_DEGREE, ORIGIN_LON);
        return gate;
    }
}

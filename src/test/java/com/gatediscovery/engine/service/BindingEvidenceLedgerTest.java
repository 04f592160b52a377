package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.LearningBatchResult;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.BindingStatus;
import com.gatediscovery.engine.entity.CategoryBinding;
import com.gatediscovery.engine.entity.CheckinEvent;
import com.gatediscovery.engine.entity.CheckinOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("BindingEvidenceLedger")
class BindingEvidenceLedgerTest {

    private static final Long SESSION_ID = 1L;
    private static final Long GATE_ID = 10L;
    private static final Long OTHER_GATE_ID = 11L;
    private static final Instant NOW = Instant.parse("2024-06-01T19:00:00Z");

    private final GateDiscoveryProperties properties = new GateDiscoveryProperties();
    private final ThresholdSettings settings = properties.getDefaults().toSettings();

    private long nextEventId = 1;

    @Test
    @DisplayName("A gate used only by GENERAL enforces GENERAL at the 20th scan")
    void singleCategory_PromotedAtMinimumSamples() {
        BindingEvidenceLedger ledger = ledger(List.of());

        List<BindingStatus> statuses = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            ledger.learn(event(GATE_ID, "GENERAL"));
            statuses.add(ledger.binding(GATE_ID, "GENERAL").orElseThrow().getStatus());
        }

        assertThat(statuses.subList(0, 19)).containsOnly(BindingStatus.PROBATION);
        assertThat(statuses.subList(19, 60)).containsOnly(BindingStatus.ENFORCED);
        CategoryBinding binding = ledger.binding(GATE_ID, "GENERAL").orElseThrow();
        assertThat(binding.getSampleCount()).isEqualTo(60);
        assertThat(binding.getConfidence()).isCloseTo(60.0 / 65.0, within(1e-9));
        assertThat(binding.getEnforcedAt()).isEqualTo(NOW);
        assertThat(ledger.result()).isEqualTo(new LearningBatchResult(60, 0, 1, 0));
    }

    @Test
    @DisplayName("Confidence never falls while only the bound category keeps arriving")
    void confidence_MonotonicWithoutViolations() {
        BindingEvidenceLedger ledger = ledger(List.of());

        double previous = 0.0;
        for (int i = 0; i < 40; i++) {
            ledger.learn(event(GATE_ID, "GENERAL"));
            double current = ledger.binding(GATE_ID, "GENERAL").orElseThrow().getConfidence();
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    @DisplayName("A category split evenly over two gates is never enforced")
    void sharedCategory_NotPromoted() {
        BindingEvidenceLedger ledger = ledger(List.of());

        for (int i = 0; i < 40; i++) {
            ledger.learn(event(i % 2 == 0 ? GATE_ID : OTHER_GATE_ID, "GENERAL"));
        }

        assertThat(ledger.binding(GATE_ID, "GENERAL").orElseThrow().getStatus()).isEqualTo(BindingStatus.PROBATION);
        assertThat(ledger.binding(GATE_ID, "GENERAL").orElseThrow().getConfidence()).isLessThan(0.5);
        assertThat(ledger.result().promotions()).isZero();
    }

    @Test
    @DisplayName("Ten foreign scans at an enforced gate demote its binding and keep it below the hard threshold")
    void sustainedViolations_Demote() {
        CategoryBinding general = enforcedGeneral(20);
        BindingEvidenceLedger ledger = ledger(List.of(general));

        for (int i = 0; i < 10; i++) {
            ledger.learn(event(GATE_ID, "VIP"));
        }

        assertThat(general.getStatus()).isEqualTo(BindingStatus.PROBATION);
        assertThat(general.getViolationCount()).isEqualTo(10);
        assertThat(general.getDemotionCount()).isEqualTo(1);
        // 1.0 share x 20/25 evidence x (1 - 10/30) violation penalty
        assertThat(general.getConfidence()).isCloseTo(0.8 * (2.0 / 3.0), within(1e-9));
        assertThat(ledger.result().violations()).isEqualTo(10);
        assertThat(ledger.result().demotions()).isEqualTo(1);
        assertThat(ledger.dirty()).contains(general);
    }

    @Test
    @DisplayName("Nine foreign scans record violations without demoting")
    void fewViolations_StayEnforced() {
        CategoryBinding general = enforcedGeneral(20);
        BindingEvidenceLedger ledger = ledger(List.of(general));

        for (int i = 0; i < 9; i++) {
            ledger.learn(event(GATE_ID, "VIP"));
        }

        assertThat(general.getStatus()).isEqualTo(BindingStatus.ENFORCED);
        assertThat(general.getViolationCount()).isEqualTo(9);
    }

    @Test
    @DisplayName("A category already recognized at the gate is not a violation")
    void recognizedCategory_NoViolation() {
        CategoryBinding general = enforcedGeneral(30);
        CategoryBinding vip = CategoryBinding.builder()
            .sessionId(SESSION_ID).gateId(GATE_ID).category("VIP")
            .sampleCount(15).confidence(0.75).status(BindingStatus.PROBATION)
            .build();
        BindingEvidenceLedger ledger = ledger(List.of(general, vip));

        ledger.learn(event(GATE_ID, "VIP"));

        assertThat(general.getViolationCount()).isZero();
        assertThat(vip.getSampleCount()).isEqualTo(16);
    }

    @Test
    @DisplayName("Scans at a gate without enforced bindings are never violations")
    void noEnforcedBinding_NoViolation() {
        BindingEvidenceLedger ledger = ledger(List.of());

        ledger.learn(event(GATE_ID, "GENERAL"));
        ledger.learn(event(GATE_ID, "VIP"));

        assertThat(ledger.result().violations()).isZero();
    }

    @Test
    @DisplayName("Confidence formula: share x evidence x (1 - violation rate)")
    void confidenceFormula() {
        assertThat(BindingEvidenceLedger.confidence(0, 10, 0.0, 5.0)).isZero();
        assertThat(BindingEvidenceLedger.confidence(20, 20, 0.0, 5.0)).isCloseTo(0.8, within(1e-9));
        assertThat(BindingEvidenceLedger.confidence(20, 40, 0.0, 5.0)).isCloseTo(0.4, within(1e-9));
        assertThat(BindingEvidenceLedger.confidence(20, 20, 0.5, 5.0)).isCloseTo(0.4, within(1e-9));
    }

    private BindingEvidenceLedger ledger(List<CategoryBinding> bindings) {
        return new BindingEvidenceLedger(SESSION_ID, bindings, settings, properties.getTuning(), NOW);
    }

    private CategoryBinding enforcedGeneral(int samples) {
        return CategoryBinding.builder()
            .sessionId(SESSION_ID)
            .gateId(GATE_ID)
            .category("GENERAL")
            .sampleCount(samples)
            .confidence(BindingEvidenceLedger.confidence(samples, samples, 0.0, 5.0))
            .status(BindingStatus.ENFORCED)
            .enforcedAt(NOW.minusSeconds(3600))
            .build();
    }

    private CheckinEvent event(Long gateId, String category) {
        long id = nextEventId++;
        Instant at = NOW.minusSeconds(1000 - id);
        return CheckinEvent.builder()
            .id(id)
            .sessionId(SESSION_ID)
            .wristbandId("WB-" + id)
            .category(category)
            .timestamp(at)
            .qualityWeight(1.0)
            .gateId(gateId)
            .outcome(CheckinOutcome.SUCCESS)
            .hourBucket(CheckinEvent.hourBucketOf(at))
            .build();
    }
}

package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.GateView;
import com.gatediscovery.engine.dto.ManualGateRequest;
import com.gatediscovery.engine.entity.ApprovalStatus;
import com.gatediscovery.engine.entity.BindingStatus;
import com.gatediscovery.engine.entity.CategoryBinding;
import com.gatediscovery.engine.entity.DerivationMethod;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.exception.BindingNotFoundException;
import com.gatediscovery.engine.exception.InvalidBindingTransitionException;
import com.gatediscovery.engine.repository.CategoryBindingRepository;
import com.gatediscovery.engine.repository.GateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("GateAdminService")
class GateAdminServiceTest {

    private static final Long SESSION_ID = 1L;
    private static final Instant NOW = Instant.parse("2026-06-01T20:00:00Z");

    @Mock
    private VenueSessionService sessionService;
    @Mock
    private GateRepository gateRepository;
    @Mock
    private CategoryBindingRepository bindingRepository;

    private GateAdminService adminService;

    @BeforeEach
    void setUp() {
        adminService = new GateAdminService(sessionService, gateRepository, bindingRepository,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("A manual gate is approved and keyed by its position")
    void createManualGate_Located() {
        // given
        given(gateRepository.saveAndFlush(any(Gate.class))).willAnswer(inv -> {
            Gate gate = inv.getArgument(0);
            gate.setId(30L);
            return gate;
        });

        // when
        GateView view = adminService.createManualGate(SESSION_ID, new ManualGateRequest("  VIP Lane ", 41.0082, 28.9784));

        // then
        assertThat(view.id()).isEqualTo(30L);
        assertThat(view.name()).isEqualTo("VIP Lane");
        assertThat(view.derivationMethod()).isEqualTo(DerivationMethod.MANUAL);
        assertThat(view.approvalStatus()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(view.latitude()).isEqualTo(41.0082);
        assertThat(view.firstSeenAt()).isEqualTo(NOW);
        verify(sessionService).require(SESSION_ID);
    }

    @Test
    @DisplayName("A manual gate without a position gets a unique non-geographic key")
    void createManualGate_Unlocated() {
        // given
        given(gateRepository.saveAndFlush(any(Gate.class))).willAnswer(inv -> inv.getArgument(0));

        // when
        adminService.createManualGate(SESSION_ID, new ManualGateRequest("Staff Door", null, null));

        // then
        ArgumentCaptor<Gate> saved = ArgumentCaptor.forClass(Gate.class);
        verify(gateRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getCentroidKey()).startsWith("manual:");
        assertThat(saved.getValue().hasLocation()).isFalse();
    }

    @Test
    @DisplayName("Rejecting a gate takes it out of service but keeps its key")
    void reject_Deactivates() {
        // given
        Gate gate = gate(7L);
        givenGate(gate);
        given(gateRepository.save(gate)).willReturn(gate);

        // when
        GateView view = adminService.reject(SESSION_ID, 7L);

        // then
        assertThat(view.status()).isEqualTo(GateStatus.INACTIVE);
        assertThat(view.approvalStatus()).isEqualTo(ApprovalStatus.REJECTED);
        assertThat(gate.getCentroidKey()).isEqualTo("41.0082,28.9784");
    }

    @Test
    @DisplayName("Approving a rejected gate puts it back in service")
    void approve_ReactivatesRejected() {
        // given
        Gate gate = gate(7L);
        gate.setApprovalStatus(ApprovalStatus.REJECTED);
        gate.setStatus(GateStatus.INACTIVE);
        givenGate(gate);
        given(gateRepository.save(gate)).willReturn(gate);

        // when
        GateView view = adminService.approve(SESSION_ID, 7L);

        // then
        assertThat(view.status()).isEqualTo(GateStatus.ACTIVE);
        assertThat(view.approvalStatus()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    @DisplayName("A merged gate cannot be switched back on")
    void changeStatus_MergedGateStaysInactive() {
        // given
        Gate gate = gate(7L);
        gate.retireInto(3L);
        givenGate(gate);

        // when & then
        assertThatThrownBy(() -> adminService.changeStatus(SESSION_ID, 7L, GateStatus.ACTIVE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("merged into gate 3");
        verify(gateRepository, never()).save(any());
    }

    @Test
    @DisplayName("Unbinding an already unbound category is an invalid transition")
    void unbind_AlreadyUnbound() {
        // given
        givenGate(gate(7L));
        given(bindingRepository.findByGateIdAndCategory(7L, "VIP"))
            .willReturn(Optional.of(binding("VIP", BindingStatus.UNBOUND)));

        // when & then
        assertThatThrownBy(() -> adminService.unbindCategory(SESSION_ID, 7L, "VIP"))
            .isInstanceOf(InvalidBindingTransitionException.class);
        verify(bindingRepository, never()).save(any());
    }

    @Test
    @DisplayName("Resetting an unbound category starts its probation over")
    void resetBinding_ClearsHistory() {
        // given
        givenGate(gate(7L));
        CategoryBinding binding = CategoryBinding.builder()
            .id(70L)
            .gateId(7L)
            .sessionId(SESSION_ID)
            .category("VIP")
            .status(BindingStatus.UNBOUND)
            .sampleCount(40)
            .violationCount(14)
            .demotionCount(2)
            .confidence(0.31)
            .build();
        given(bindingRepository.findByGateIdAndCategory(7L, "VIP")).willReturn(Optional.of(binding));
        given(bindingRepository.findByGateId(7L)).willReturn(List.of(binding));

        // when
        GateView view = adminService.resetBinding(SESSION_ID, 7L, " VIP ");

        // then
        assertThat(view.bindings()).singleElement().satisfies(b -> {
            assertThat(b.status()).isEqualTo(BindingStatus.PROBATION);
            assertThat(b.violationCount()).isZero();
            assertThat(b.demotionCount()).isZero();
            assertThat(b.confidence()).isZero();
        });
        verify(bindingRepository).save(binding);
    }

    @Test
    @DisplayName("A category never seen at the gate has no binding to change")
    void unbind_MissingBinding() {
        // given
        givenGate(gate(7L));
        given(bindingRepository.findByGateIdAndCategory(7L, "PRESS")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> adminService.unbindCategory(SESSION_ID, 7L, "PRESS"))
            .isInstanceOf(BindingNotFoundException.class);
    }

    private void givenGate(Gate gate) {
        given(gateRepository.findByIdAndSessionId(gate.getId(), SESSION_ID)).willReturn(Optional.of(gate));
    }

    private static CategoryBinding binding(String category, BindingStatus status) {
        return CategoryBinding.builder()
            .id(70L)
            .gateId(7L)
            .sessionId(SESSION_ID)
            .category(category)
            .status(status)
            .sampleCount(40)
            .build();
    }

    private static Gate gate(Long id) {
        Gate gate = Gate.builder()
            .id(id)
            .sessionId(SESSION_ID)
            .name("Gate " + id)
            .centroidKey("41.0082,28.9784")
            .derivationMethod(DerivationMethod.CLUSTERING)
            .status(GateStatus.ACTIVE)
            .build();
        gate.moveCentroid(41.0082, 28.9784);
        return gate;
    }
}

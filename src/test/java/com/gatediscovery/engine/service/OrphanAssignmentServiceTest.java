package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.OrphanAssignmentResult;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.AssignmentMethod;
import com.gatediscovery.engine.entity.CheckinEvent;
import com.gatediscovery.engine.entity.DerivationMethod;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.geo.GeoMath;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrphanAssignmentService")
class OrphanAssignmentServiceTest {

    private static final Long SESSION_ID = 1L;
    private static final double ORIGIN_LAT = 41.0082;
    private static final double ORIGIN_LON = 28.9784;
    private static final double METERS_PER_DEGREE = GeoMath.EARTH_RADIUS_METERS * Math.PI / 180.0;

    @Mock
    private CheckinEventRepository checkinRepository;
    @Mock
    private GateRepository gateRepository;

    private OrphanAssignmentService service;
    private ThresholdSettings settings;

    @BeforeEach
    void setUp() {
        GateDiscoveryProperties properties = new GateDiscoveryProperties();
        service = new OrphanAssignmentService(checkinRepository, gateRepository, properties);
        settings = properties.getDefaults().toSettings();
    }

    @Test
    @DisplayName("An orphan 30 m from a gate is attached to it")
    void orphanInRange_Assigned() {
        // given
        CheckinEvent orphan = orphan(501L, 30.0);
        given(checkinRepository.findOrphanPage(eq(SESSION_ID), eq(0L), any())).willReturn(List.of(orphan));
        given(gateRepository.findActiveWithinDistance(eq(SESSION_ID), anyDouble(), anyDouble(), eq(50.0)))
            .willReturn(List.of(gate(7L, 0.0)));
        given(checkinRepository.assignGateIfOrphan(501L, 7L, AssignmentMethod.ORPHAN_BACKFILL)).willReturn(1);

        // when
        OrphanAssignmentResult result = service.assignOrphans(SESSION_ID, settings, 0L, () -> true);

        // then
        assertThat(result).isEqualTo(new OrphanAssignmentResult(1, 1, 0L, false));
    }

    @Test
    @DisplayName("A candidate the database returns beyond the bound is not used")
    void candidateBeyondBound_Ignored() {
        Optional<Gate> nearest = givenCandidates(gate(7L, 60.0)).findNearestGate(SESSION_ID, ORIGIN_LAT, ORIGIN_LON, 50.0);

        assertThat(nearest).isEmpty();
    }

    @Test
    @DisplayName("The nearest gate wins, inactive gates never do")
    void nearestActiveGateWins() {
        Gate closeButInactive = gate(3L, 2.0);
        closeButInactive.setStatus(GateStatus.INACTIVE);

        Optional<Gate> nearest = givenCandidates(closeButInactive, gate(8L, 20.0), gate(9L, 10.0))
            .findNearestGate(SESSION_ID, ORIGIN_LAT, ORIGIN_LON, 50.0);

        assertThat(nearest).map(Gate::getId).contains(9L);
    }

    @Test
    @DisplayName("An orphan with no gate in range stays orphaned")
    void noGateInRange_StaysOrphan() {
        // given
        given(checkinRepository.findOrphanPage(eq(SESSION_ID), eq(0L), any())).willReturn(List.of(orphan(501L, 0.0)));
        given(gateRepository.findActiveWithinDistance(eq(SESSION_ID), anyDouble(), anyDouble(), anyDouble()))
            .willReturn(List.of());

        // when
        OrphanAssignmentResult result = service.assignOrphans(SESSION_ID, settings, 0L, () -> true);

        // then
        assertThat(result.assigned()).isZero();
        verify(checkinRepository, never()).assignGateIfOrphan(anyLong(), anyLong(), any());
    }

    @Test
    @DisplayName("A deactivated session stops the walk before the first page")
    void stopSignal_StopsEarly() {
        OrphanAssignmentResult result = service.assignOrphans(SESSION_ID, settings, 0L, () -> false);

        assertThat(result).isEqualTo(new OrphanAssignmentResult(0, 0, 0L, true));
        verify(checkinRepository, never()).findOrphanPage(anyLong(), anyLong(), any());
    }

    @Test
    @DisplayName("Orphans that never find a gate do not starve the ones after them")
    void unreachableOrphans_WalkResumesAndWraps() {
        // given
        GateDiscoveryProperties properties = new GateDiscoveryProperties();
        properties.getWork().setMaxOrphansPerCycle(2);
        properties.getWork().setOrphanBatchSize(2);
        OrphanAssignmentService smallWindow = new OrphanAssignmentService(checkinRepository, gateRepository, properties);

        CheckinEvent first = orphan(1L, 0.0);
        CheckinEvent second = orphan(2L, 0.0);
        CheckinEvent third = orphan(3L, 0.0);
        given(checkinRepository.findOrphanPage(eq(SESSION_ID), eq(0L), any())).willAnswer(inv -> {
            Pageable page = inv.getArgument(2);
            return List.of(first, second, third).subList(0, page.getPageSize());
        });
        given(checkinRepository.findOrphanPage(eq(SESSION_ID), eq(2L), any())).willReturn(List.of(third));
        given(gateRepository.findActiveWithinDistance(eq(SESSION_ID), anyDouble(), anyDouble(), anyDouble()))
            .willReturn(List.of());

        // when
        OrphanAssignmentResult firstRun = smallWindow.assignOrphans(SESSION_ID, settings, 0L, () -> true);
        OrphanAssignmentResult secondRun = smallWindow.assignOrphans(SESSION_ID, settings,
            firstRun.nextCursor(), () -> true);

        // then
        assertThat(firstRun).isEqualTo(new OrphanAssignmentResult(2, 0, 2L, false));
        assertThat(secondRun).isEqualTo(new OrphanAssignmentResult(2, 0, 1L, false));
        verify(checkinRepository).findOrphanPage(eq(SESSION_ID), eq(2L), any());
        verify(gateRepository, times(4)).findActiveWithinDistance(eq(SESSION_ID), anyDouble(), anyDouble(), anyDouble());
    }

    @Test
    @DisplayName("A walk that reaches the last orphan starts the next one from the beginning")
    void walkReachesEnd_CursorResets() {
        // given
        given(checkinRepository.findOrphanPage(eq(SESSION_ID), eq(40L), any())).willReturn(List.of(orphan(41L, 0.0)));
        given(checkinRepository.findOrphanPage(eq(SESSION_ID), eq(0L), any()))
            .willReturn(List.of(orphan(12L, 0.0), orphan(41L, 0.0)));
        given(gateRepository.findActiveWithinDistance(eq(SESSION_ID), anyDouble(), anyDouble(), anyDouble()))
            .willReturn(List.of());

        // when
        OrphanAssignmentResult result = service.assignOrphans(SESSION_ID, settings, 40L, () -> true);

        // then
        assertThat(result).isEqualTo(new OrphanAssignmentResult(2, 0, 0L, false));
    }

    private OrphanAssignmentService givenCandidates(Gate... gates) {
        given(gateRepository.findActiveWithinDistance(eq(SESSION_ID), anyDouble(), anyDouble(), anyDouble()))
            .willReturn(List.of(gates));
        return service;
    }

    private static CheckinEvent orphan(Long id, double northMeters) {
        return CheckinEvent.builder()
            .id(id)
            .sessionId(SESSION_ID)
            .wristbandId("WB-" + id)
            .category("GENERAL")
            .latitude(ORIGIN_LAT + northMeters / METERS_PER_DEGREE)
            .longitude(ORIGIN_LON)
            .accuracy(8.0)
            .qualityWeight(1.0)
            .build();
    }

    private static Gate gate(Long id, double northMeters) {
        Gate gate = Gate.builder()
            .id(id)
            .sessionId(SESSION_ID)
            .name("Gate " + id)
            .derivationMethod(DerivationMethod.CLUSTERING)
            .status(GateStatus.ACTIVE)
            .build();
        gate.moveCentroid(ORIGIN_LAT + northMeters / METERS_PER_DEGREE, ORIGIN_LON);
        return gate;
    }
}

package com.gatediscovery.engine.scheduler;

import com.gatediscovery.engine.dto.CycleReport;
import com.gatediscovery.engine.dto.CycleStatus;
import com.gatediscovery.engine.dto.CycleType;
import com.gatediscovery.engine.service.CycleCoordinator;
import com.gatediscovery.engine.service.VenueSessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("GateDiscoveryScheduler")
class GateDiscoverySchedulerTest {

    @Mock
    private CycleCoordinator cycleCoordinator;
    @Mock
    private VenueSessionService sessionService;

    @InjectMocks
    private GateDiscoveryScheduler scheduler;

    @Test
    @DisplayName("A failing session does not stop the other sessions' cycles")
    void failingSession_OthersStillRun() {
        // given
        given(sessionService.activeSessionIds()).willReturn(List.of(1L, 2L, 3L));
        given(cycleCoordinator.runEnforcement(1L)).willReturn(report(1L, CycleStatus.COMPLETED));
        given(cycleCoordinator.runEnforcement(2L)).willThrow(new IllegalStateException("deadlock detected"));
        given(cycleCoordinator.runEnforcement(3L)).willReturn(report(3L, CycleStatus.SKIPPED_BUSY));

        // when
        scheduler.runEnforcement();

        // then
        verify(cycleCoordinator).runEnforcement(1L);
        verify(cycleCoordinator).runEnforcement(2L);
        verify(cycleCoordinator).runEnforcement(3L);
    }

    @Test
    @DisplayName("No active sessions means no cycles")
    void noActiveSessions() {
        given(sessionService.activeSessionIds()).willReturn(List.of());

        scheduler.runDiscovery();

        verify(cycleCoordinator, never()).runDiscovery(any());
    }

    @Test
    @DisplayName("A failure listing sessions skips the tick")
    void listingFails_TickSkipped() {
        given(sessionService.activeSessionIds()).willThrow(new IllegalStateException("connection refused"));

        scheduler.runDuplicateDetection();

        verify(cycleCoordinator, never()).runDuplicateDetection(any());
    }

    private static CycleReport report(Long sessionId, CycleStatus status) {
        return CycleReport.skipped(sessionId, CycleType.ENFORCEMENT, status);
    }
}

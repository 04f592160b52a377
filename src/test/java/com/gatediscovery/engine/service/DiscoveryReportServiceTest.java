package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.DiscoveryReport;
import com.gatediscovery.engine.dto.GpsQualityGrade;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.ApprovalStatus;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.exception.SessionNotFoundException;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("DiscoveryReportService")
class DiscoveryReportServiceTest {

    private static final Long SESSION_ID = 1L;
    private static final Instant NOW = Instant.parse("2026-06-01T20:00:00Z");

    @Mock
    private VenueSessionService sessionService;
    @Mock
    private ThresholdConfigService thresholdConfigService;
    @Mock
    private CheckinEventRepository checkinRepository;
    @Mock
    private GateRepository gateRepository;

    private DiscoveryReportService reportService;
    private ThresholdSettings settings;

    @BeforeEach
    void setUp() {
        reportService = new DiscoveryReportService(sessionService, thresholdConfigService, checkinRepository,
            gateRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        settings = new GateDiscoveryProperties().getDefaults().toSettings();
    }

    @Test
    @DisplayName("Coverage, accuracy grade, gate counts and orphans are reported together")
    void report_SummarizesSession() {
        // given
        given(thresholdConfigService.getEffective(SESSION_ID)).willReturn(settings);
        given(checkinRepository.summarizeGpsCoverage(SESSION_ID, settings.minQualityWeight()))
            .willReturn(coverage(400L, 300L, 240L, 12.345));
        given(gateRepository.countBySessionIdAndStatus(SESSION_ID, GateStatus.ACTIVE)).willReturn(3L);
        given(gateRepository.countBySessionIdAndStatusAndApprovalStatus(
            SESSION_ID, GateStatus.ACTIVE, ApprovalStatus.PENDING)).willReturn(2L);
        given(checkinRepository.countBySessionIdAndGateIdIsNull(SESSION_ID)).willReturn(37L);

        // when
        DiscoveryReport report = reportService.report(SESSION_ID);

        // then
        assertThat(report.totalCheckins()).isEqualTo(400L);
        assertThat(report.gpsCoveragePct()).isEqualTo(75.0);
        assertThat(report.goodGpsPct()).isEqualTo(60.0);
        assertThat(report.averageAccuracyMeters()).isEqualTo(12.35);
        assertThat(report.gpsQuality()).isEqualTo(GpsQualityGrade.EXCELLENT);
        assertThat(report.activeGates()).isEqualTo(3L);
        assertThat(report.gatesPendingApproval()).isEqualTo(2L);
        assertThat(report.orphanCount()).isEqualTo(37L);
        assertThat(report.canEnforce()).isTrue();
        assertThat(report.recommendation()).isEqualTo("Gate discovery ready, 3 gates found");
        assertThat(report.generatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("A session without scans reports zeros and no GPS data")
    void report_EmptySession() {
        // given
        given(thresholdConfigService.getEffective(SESSION_ID)).willReturn(settings);
        given(checkinRepository.summarizeGpsCoverage(SESSION_ID, settings.minQualityWeight()))
            .willReturn(coverage(0L, null, null, null));

        // when
        DiscoveryReport report = reportService.report(SESSION_ID);

        // then
        assertThat(report.gpsCoveragePct()).isZero();
        assertThat(report.averageAccuracyMeters()).isNull();
        assertThat(report.gpsQuality()).isEqualTo(GpsQualityGrade.NO_GPS_DATA);
        assertThat(report.canEnforce()).isFalse();
        assertThat(report.recommendation()).startsWith("Need at least 50 check-ins");
    }

    @Test
    @DisplayName("An unknown session is a not-found error")
    void report_UnknownSession() {
        given(sessionService.require(404L)).willThrow(new SessionNotFoundException(404L));

        assertThatThrownBy(() -> reportService.report(404L)).isInstanceOf(SessionNotFoundException.class);
        verify(checkinRepository, never()).summarizeGpsCoverage(anyLong(), anyDouble());
    }

    @ParameterizedTest(name = "total={0}, goodGps={1}, gates={2}")
    @CsvSource({
        "49, 49, 4, Need at least 50 check-ins for reliable gate discovery",
        "200, 9, 4, GPS data quality too low for gate discovery",
        "200, 150, 0, 'No gates discovered yet, check scanner GPS settings'",
        "200, 150, 1, 'Only one gate found, more data may reveal others'"
    })
    @DisplayName("The recommendation names the first thing holding discovery back")
    void recommendation(long total, long goodGps, long gates, String expected) {
        assertThat(DiscoveryReportService.recommendation(total, goodGps, gates)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} m -> {1}")
    @CsvSource({"15.0, EXCELLENT", "15.01, GOOD", "30.0, GOOD", "50.0, FAIR", "50.5, POOR"})
    @DisplayName("Average accuracy is graded in 15 / 30 / 50 m steps")
    void accuracyGrade(double meters, GpsQualityGrade expected) {
        assertThat(GpsQualityGrade.of(meters)).isEqualTo(expected);
    }

    private static CheckinEventRepository.GpsCoverage coverage(Long total, Long withGps, Long goodGps,
                                                               Double averageAccuracy) {
        return new CheckinEventRepository.GpsCoverage() {
            @Override
            public Long getTotal() {
                return total;
            }

            @Override
            public Long getWithGps() {
                return withGps;
            }

            @Override
            public Long getGoodGps() {
                return goodGps;
            }

            @Override
            public Double getAverageAccuracy() {
                return averageAccuracy;
            }
        };
    }
}

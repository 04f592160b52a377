package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.DiscoveryReport;
import com.gatediscovery.engine.dto.GpsQualityGrade;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.ApprovalStatus;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Summarizes GPS coverage and discovery progress of a session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscoveryReportService {

    static final long MIN_CHECKINS_FOR_DISCOVERY = 50;
    static final long MIN_GOOD_GPS_CHECKINS = 10;

    private final VenueSessionService sessionService;
    private final ThresholdConfigService thresholdConfigService;
    private final CheckinEventRepository checkinRepository;
    private final GateRepository gateRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DiscoveryReport report(Long sessionId) {
        sessionService.require(sessionId);
        ThresholdSettings settings = thresholdConfigService.getEffective(sessionId);

        CheckinEventRepository.GpsCoverage coverage =
            checkinRepository.summarizeGpsCoverage(sessionId, settings.minQualityWeight());
        long total = orZero(coverage.getTotal());
        long withGps = orZero(coverage.getWithGps());
        long goodGps = orZero(coverage.getGoodGps());
        Double averageAccuracy = coverage.getAverageAccuracy() == null
            ? null : round(coverage.getAverageAccuracy());

        long activeGates = gateRepository.countBySessionIdAndStatus(sessionId, GateStatus.ACTIVE);
        long pending = gateRepository.countBySessionIdAndStatusAndApprovalStatus(
            sessionId, GateStatus.ACTIVE, ApprovalStatus.PENDING);
        long orphans = checkinRepository.countBySessionIdAndGateIdIsNull(sessionId);

        DiscoveryReport report = new DiscoveryReport(
            sessionId,
            total,
            withGps,
            percent(withGps, total),
            goodGps,
            percent(goodGps, total),
            averageAccuracy,
            GpsQualityGrade.of(averageAccuracy),
            activeGates,
            pending,
            orphans,
            activeGates >= 2,
            recommendation(total, goodGps, activeGates),
            Instant.now(clock)
        );
        log.debug("Discovery report for session {}: {} scans, {} gates, {} orphans",
            sessionId, total, activeGates, orphans);
        return report;
    }

    static String recommendation(long total, long goodGps, long activeGates) {
        if (total < MIN_CHECKINS_FOR_DISCOVERY) {
            return "Need at least " + MIN_CHECKINS_FOR_DISCOVERY + " check-ins for reliable gate discovery";
        }
        if (goodGps < MIN_GOOD_GPS_CHECKINS) {
            return "GPS data quality too low for gate discovery";
        }
        if (activeGates == 0) {
            return "No gates discovered yet, check scanner GPS settings";
        }
        if (activeGates == 1) {
            return "Only one gate found, more data may reveal others";
        }
        return "Gate discovery ready, " + activeGates + " gates found";
    }

    static double percent(long part, long total) {
        return total == 0 ? 0.0 : round(part * 100.0 / total);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}

package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.CycleReport;
import com.gatediscovery.engine.dto.CycleStatus;
import com.gatediscovery.engine.dto.CycleType;
import com.gatediscovery.engine.dto.DuplicateScanResult;
import com.gatediscovery.engine.dto.GateCluster;
import com.gatediscovery.engine.dto.LearningBatchResult;
import com.gatediscovery.engine.dto.MaterializationResult;
import com.gatediscovery.engine.dto.OrphanAssignmentResult;
import com.gatediscovery.engine.dto.ScanPoint;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.VenueSession;
import com.gatediscovery.engine.exception.SessionBusyException;
import com.gatediscovery.engine.lock.SessionCycleLock;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs the background cycles of a venue session, one at a time.
 *
 * Every cycle takes the session lock without waiting; if another cycle holds
 * it the call returns SKIPPED_BUSY and the work is picked up by the next
 * trigger. All cycles are idempotent reconciliations, so skipping is safe.
 *
 * Cycles:
 * - discovery: cluster recent accepted scans, materialize gates, attach orphans, refresh health
 * - enforcement: re-point check-ins left on merged gates, then learn category bindings
 *   from unlearned check-ins in bounded batches
 * - duplicates: score close gate pairs, emit merge suggestions, optionally auto-merge
 *
 * A session marked inactive stops its running cycle at the next unit of work.
 * Operator actions that change gates use {@link #runOperatorAction}, which
 * waits briefly for the lock and reports the session busy otherwise.
 */
@Service
@Slf4j
public class CycleCoordinator {

    private final SessionCycleLock sessionLock;
    private final VenueSessionService sessionService;
    private final ThresholdConfigService thresholdConfigService;
    private final CheckinEventRepository checkinRepository;
    private final SpatialClusteringEngine clusteringEngine;
    private final GateMaterializer materializer;
    private final GateWriter gateWriter;
    private final OrphanAssignmentService orphanService;
    private final CategoryBindingLearner learner;
    private final GateMergeService mergeService;
    private final DuplicateGateDetector duplicateDetector;
    private final GateSnapshotCacheService snapshotCache;
    private final GateDiscoveryProperties properties;
    private final Clock clock;

    public CycleCoordinator(SessionCycleLock sessionLock,
                            VenueSessionService sessionService,
                            ThresholdConfigService thresholdConfigService,
                            CheckinEventRepository checkinRepository,
                            SpatialClusteringEngine clusteringEngine,
                            GateMaterializer materializer,
                            GateWriter gateWriter,
                            OrphanAssignmentService orphanService,
                            CategoryBindingLearner learner,
                            GateMergeService mergeService,
                            DuplicateGateDetector duplicateDetector,
                            GateSnapshotCacheService snapshotCache,
                            GateDiscoveryProperties properties,
                            Clock clock) {
        this.sessionLock = sessionLock;
        this.sessionService = sessionService;
        this.thresholdConfigService = thresholdConfigService;
        this.checkinRepository = checkinRepository;
        this.clusteringEngine = clusteringEngine;
        this.materializer = materializer;
        this.gateWriter = gateWriter;
        this.orphanService = orphanService;
        this.learner = learner;
        this.mergeService = mergeService;
        this.duplicateDetector = duplicateDetector;
        this.snapshotCache = snapshotCache;
        this.properties = properties;
        this.clock = clock;
    }

    public CycleReport runDiscovery(Long sessionId) {
        return runLocked(sessionId, CycleType.DISCOVERY, this::discover);
    }

    public CycleReport runEnforcement(Long sessionId) {
        return runLocked(sessionId, CycleType.ENFORCEMENT, this::enforce);
    }

    public CycleReport runDuplicateDetection(Long sessionId) {
        return runLocked(sessionId, CycleType.DUPLICATES, this::detectDuplicates);
    }

    /**
     * Runs discovery if the session crossed a scan milestone since the last run:
     * the first run at {@code firstDiscoveryAt} accepted scans, then every
     * {@code discoveryRefreshEvery} more.
     */
    public Optional<CycleReport> runDiscoveryIfDue(Long sessionId) {
        VenueSession session = sessionService.require(sessionId);
        if (!session.isActive()) {
            return Optional.empty();
        }
        ThresholdSettings settings = thresholdConfigService.getEffective(sessionId);
        long accepted = checkinRepository.countAccepted(sessionId, settings.minQualityWeight());
        GateDiscoveryProperties.Tuning tuning = properties.getTuning();
        if (!discoveryDue(accepted, session.getLastDiscoveryScanCount(), tuning.getFirstDiscoveryAt(),
            tuning.getDiscoveryRefreshEvery())) {
            return Optional.empty();
        }
        log.info("Session {} reached {} accepted scans, triggering discovery", sessionId, accepted);
        return Optional.of(runDiscovery(sessionId));
    }

    static boolean discoveryDue(long acceptedScans, long scansAtLastRun, int firstAt, int refreshEvery) {
        if (scansAtLastRun <= 0) {
            return acceptedScans >= firstAt;
        }
        return acceptedScans - scansAtLastRun >= refreshEvery;
    }

    /**
     * Runs an operator change under the session lock, then refreshes the
     * session's gate snapshots.
     *
     * @throws SessionBusyException if a cycle keeps the lock longer than the configured wait
     */
    public <T> T runOperatorAction(Long sessionId, Supplier<T> action) {
        Duration wait = Duration.ofMillis(properties.getLock().getOperatorWaitMillis());
        if (!sessionLock.tryAcquire(sessionId, wait)) {
            log.warn("Session {} still busy after {}ms, operator action rejected", sessionId, wait.toMillis());
            throw new SessionBusyException(sessionId);
        }
        T result;
        try {
            result = action.get();
        } finally {
            sessionLock.release(sessionId);
        }
        snapshotCache.refreshSession(sessionId);
        return result;
    }

    private CycleReport runLocked(Long sessionId, CycleType type,
                                  Function<Long, CycleReport.CycleReportBuilder> body) {
        if (!sessionService.isActive(sessionId)) {
            log.debug("Skipping {} for inactive session {}", type, sessionId);
            return CycleReport.skipped(sessionId, type, CycleStatus.SKIPPED_INACTIVE);
        }
        if (!sessionLock.tryAcquire(sessionId)) {
            log.debug("Skipping {} for session {}: another cycle is running ({} lock)",
                type, sessionId, sessionLock.getStrategyName());
            return CycleReport.skipped(sessionId, type, CycleStatus.SKIPPED_BUSY);
        }

        long startTime = System.currentTimeMillis();
        try {
            CycleReport report = body.apply(sessionId)
                .sessionId(sessionId)
                .cycle(type)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
            log.info("Cycle finished: {}", report.toLogString());
            return report;
        } finally {
            sessionLock.release(sessionId);
        }
    }

    private CycleReport.CycleReportBuilder discover(Long sessionId) {
        ThresholdSettings settings = thresholdConfigService.getEffective(sessionId);
        GateDiscoveryProperties.Work work = properties.getWork();
        Instant now = Instant.now(clock);

        long accepted = checkinRepository.countAccepted(sessionId, settings.minQualityWeight());
        Instant since = now.minus(Duration.ofHours(work.getDiscoveryWindowHours()));
        List<ScanPoint> points = checkinRepository
            .findClusteringWindow(sessionId, settings.minQualityWeight(), since,
                PageRequest.of(0, work.getMaxClusteringPoints()))
            .stream()
            .map(ScanPoint::from)
            .toList();

        List<GateCluster> clusters = clusteringEngine.cluster(points, settings.clusterEpsilonMeters(),
            settings.minSamplesForGate(), settings.maxSpatialVariance());
        CycleReport.CycleReportBuilder report = CycleReport.builder().clustersFound(clusters.size());
        if (!sessionService.isActive(sessionId)) {
            return report.status(CycleStatus.STOPPED);
        }

        MaterializationResult materialized = materializer.materialize(sessionId, clusters, settings);
        report.gatesCreated(materialized.created()).gatesUpdated(materialized.updated());
        if (!sessionService.isActive(sessionId)) {
            return report.status(CycleStatus.STOPPED);
        }

        long orphanCursor = sessionService.require(sessionId).getOrphanCursor();
        OrphanAssignmentResult orphans = orphanService.assignOrphans(sessionId, settings, orphanCursor,
            () -> sessionService.isActive(sessionId));
        report.orphansExamined(orphans.examined()).orphansAssigned(orphans.assigned());
        sessionService.recordOrphanCursor(sessionId, orphans.nextCursor());
        if (orphans.stopped()) {
            return report.status(CycleStatus.STOPPED);
        }

        gateWriter.refreshHealth(sessionId, settings.minEffectiveSamples());
        sessionService.recordDiscoveryRun(sessionId, accepted, now);
        snapshotCache.refreshSession(sessionId);
        return report.status(CycleStatus.COMPLETED);
    }

    private CycleReport.CycleReportBuilder enforce(Long sessionId) {
        ThresholdSettings settings = thresholdConfigService.getEffective(sessionId);
        int maxBatches = properties.getWork().getLearnerMaxBatches();
        mergeService.repointRetiredGateCheckins(sessionId);

        LearningBatchResult total = LearningBatchResult.empty();
        CycleStatus status = CycleStatus.COMPLETED;
        for (int batch = 0; batch < maxBatches; batch++) {
            if (!sessionService.isActive(sessionId)) {
                status = CycleStatus.STOPPED;
                break;
            }
            LearningBatchResult result = learner.learnBatch(sessionId, settings);
            total = total.plus(result);
            if (result.processed() < learner.batchSize()) {
                break;
            }
        }

        if (total.processed() > 0) {
            snapshotCache.refreshSession(sessionId);
        }
        sessionService.recordEnforcementRun(sessionId, Instant.now(clock));
        return CycleReport.builder()
            .status(status)
            .eventsLearned(total.processed())
            .violations(total.violations())
            .promotions(total.promotions())
            .demotions(total.demotions());
    }

    private CycleReport.CycleReportBuilder detectDuplicates(Long sessionId) {
        ThresholdSettings settings = thresholdConfigService.getEffective(sessionId);
        DuplicateScanResult result = duplicateDetector.detect(sessionId, settings);
        if (result.mergesApplied() > 0) {
            snapshotCache.refreshSession(sessionId);
        }
        sessionService.recordDuplicateScan(sessionId, Instant.now(clock));
        return CycleReport.builder()
            .status(CycleStatus.COMPLETED)
            .suggestionsEmitted(result.suggestionsEmitted())
            .mergesApplied(result.mergesApplied());
    }
}

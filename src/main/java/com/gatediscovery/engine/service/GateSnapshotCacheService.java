package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.BindingSnapshot;
import com.gatediscovery.engine.dto.GateSnapshot;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.CategoryBinding;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.exception.GateNotFoundException;
import com.gatediscovery.engine.repository.CategoryBindingRepository;
import com.gatediscovery.engine.repository.GateRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Redis cache of per-gate validation snapshots.
 *
 * Validation runs on every scan, so it reads from here instead of joining gates,
 * bindings and thresholds in PostgreSQL each time. The database stays the source
 * of truth:
 * - cache miss: snapshot is built from the database and written back
 * - Redis failure: snapshot is built from the database and the error is logged
 *
 * Freshness:
 * 1. Warm-up of every active session on startup
 * 2. Refresh of a session after each cycle or operator change that touches it
 * 3. Scheduled refresh of all active sessions
 * 4. TTL on every entry as a backstop
 */
@Service
@Slf4j
public class GateSnapshotCacheService {

    private static final String SNAPSHOT_KEY_PREFIX = "gate:snapshot:";

    private final RedisTemplate<String, GateSnapshot> snapshotRedisTemplate;
    private final GateRepository gateRepository;
    private final CategoryBindingRepository bindingRepository;
    private final ThresholdConfigService thresholdConfigService;
    private final VenueSessionService sessionService;
    private final GateDiscoveryProperties.Tuning tuning;
    private final long ttlMinutes;

    public GateSnapshotCacheService(RedisTemplate<String, GateSnapshot> snapshotRedisTemplate,
                                    GateRepository gateRepository,
                                    CategoryBindingRepository bindingRepository,
                                    ThresholdConfigService thresholdConfigService,
                                    VenueSessionService sessionService,
                                    GateDiscoveryProperties properties) {
        this.snapshotRedisTemplate = snapshotRedisTemplate;
        this.gateRepository = gateRepository;
        this.bindingRepository = bindingRepository;
        this.thresholdConfigService = thresholdConfigService;
        this.sessionService = sessionService;
        this.tuning = properties.getTuning();
        this.ttlMinutes = properties.getCache().getSnapshotTtlMinutes();
    }

    @PostConstruct
    public void warmUpCache() {
        log.info("Starting gate snapshot warm-up...");
        long startTime = System.currentTimeMillis();
        try {
            int cached = refreshActiveSessions();
            log.info("Gate snapshot warm-up completed: {} gates cached in {}ms",
                cached, System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            // Validation falls back to the database until the next refresh
            log.error("Gate snapshot warm-up failed", e);
        }
    }

    @Scheduled(fixedRateString = "${gate-discovery.cache.refresh-interval-minutes:15}",
               timeUnit = TimeUnit.MINUTES,
               initialDelay = 15)
    public void scheduledCacheRefresh() {
        try {
            int refreshed = refreshActiveSessions();
            log.info("Scheduled snapshot refresh completed: {} gates refreshed", refreshed);
        } catch (Exception e) {
            log.error("Scheduled snapshot refresh failed", e);
        }
    }

    /**
     * Snapshot of one gate. Throws {@link GateNotFoundException} when the gate is
     * not part of the session.
     */
    public GateSnapshot getSnapshot(Long sessionId, Long gateId) {
        String key = snapshotKey(sessionId, gateId);
        try {
            GateSnapshot cached = snapshotRedisTemplate.opsForValue().get(key);
            if (cached != null) {
                return cached;
            }
        } catch (RuntimeException e) {
            log.warn("Snapshot read failed for gate {} (session {}), using database: {}",
                gateId, sessionId, e.getMessage());
            return loadFromDatabase(sessionId, gateId);
        }

        GateSnapshot snapshot = loadFromDatabase(sessionId, gateId);
        try {
            store(snapshot);
        } catch (RuntimeException e) {
            log.warn("Snapshot write failed for gate {} (session {}): {}", gateId, sessionId, e.getMessage());
        }
        return snapshot;
    }

    /**
     * Rebuilds the snapshots of every gate of the session, inactive ones included
     * so that validation sees their status. Returns the number written, 0 when
     * Redis is unavailable.
     */
    public int refreshSession(Long sessionId) {
        List<Gate> gates = gateRepository.findBySessionIdOrderByIdAsc(sessionId);
        Map<Long, List<CategoryBinding>> bindings = bindingRepository.findBySessionId(sessionId).stream()
            .collect(Collectors.groupingBy(CategoryBinding::getGateId));
        ThresholdSettings settings = thresholdConfigService.getEffective(sessionId);

        try {
            for (Gate gate : gates) {
                store(buildSnapshot(gate, bindings.getOrDefault(gate.getId(), List.of()), settings));
            }
        } catch (RuntimeException e) {
            log.warn("Snapshot refresh for session {} failed, validation will read the database: {}",
                sessionId, e.getMessage());
            return 0;
        }
        log.debug("Refreshed {} gate snapshots for session {}", gates.size(), sessionId);
        return gates.size();
    }

    public GateSnapshot buildSnapshot(Gate gate, List<CategoryBinding> bindings, ThresholdSettings settings) {
        List<BindingSnapshot> bindingSnapshots = bindings.stream()
            .sorted(Comparator.comparing(CategoryBinding::getCategory))
            .map(BindingSnapshot::from)
            .toList();
        return new GateSnapshot(
            gate.getId(),
            gate.getSessionId(),
            gate.getName(),
            gate.getStatus(),
            gate.hasLocation() ? gate.getLatitude() : null,
            gate.hasLocation() ? gate.getLongitude() : null,
            acceptedRadius(gate.getSpatialVariance(), tuning.getMinAcceptedRadiusMeters()),
            settings.softThreshold(),
            bindingSnapshots
        );
    }

    /**
     * max(minimum radius, 2·√variance): two standard deviations of the scans that formed the gate.
     */
    static double acceptedRadius(double spatialVariance, double minimumRadius) {
        return Math.max(minimumRadius, 2.0 * Math.sqrt(Math.max(0.0, spatialVariance)));
    }

    private GateSnapshot loadFromDatabase(Long sessionId, Long gateId) {
        Gate gate = gateRepository.findByIdAndSessionId(gateId, sessionId)
            .orElseThrow(() -> new GateNotFoundException(sessionId, gateId));
        return buildSnapshot(gate, bindingRepository.findByGateId(gateId),
            thresholdConfigService.getEffective(sessionId));
    }

    private int refreshActiveSessions() {
        int total = 0;
        for (Long sessionId : sessionService.activeSessionIds()) {
            total += refreshSession(sessionId);
        }
        return total;
    }

    private void store(GateSnapshot snapshot) {
        snapshotRedisTemplate.opsForValue().set(snapshotKey(snapshot.sessionId(), snapshot.gateId()), snapshot,
            ttlMinutes, TimeUnit.MINUTES);
    }

    private static String snapshotKey(Long sessionId, Long gateId) {
        return SNAPSHOT_KEY_PREFIX + sessionId + ":" + gateId;
    }
}

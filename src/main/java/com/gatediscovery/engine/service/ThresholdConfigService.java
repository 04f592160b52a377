package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.ThresholdConfigRequest;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.AdaptiveThresholdConfig;
import com.gatediscovery.engine.exception.InvalidThresholdConfigException;
import com.gatediscovery.engine.repository.AdaptiveThresholdConfigRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Resolves the thresholds in force for a session and stores operator overrides.
 *
 * Defaults are read once from {@code gate-discovery.defaults} and checked at
 * startup; a bad default fails the application instead of every later cycle.
 */
@Service
@Slf4j
public class ThresholdConfigService {

    private final AdaptiveThresholdConfigRepository configRepository;
    private final VenueSessionService sessionService;
    private final ThresholdSettings defaults;

    public ThresholdConfigService(AdaptiveThresholdConfigRepository configRepository,
                                  VenueSessionService sessionService,
                                  GateDiscoveryProperties properties) {
        this.configRepository = configRepository;
        this.sessionService = sessionService;
        this.defaults = properties.getDefaults().toSettings();
        List<String> violations = defaults.violations();
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Invalid gate-discovery.defaults: " + String.join("; ", violations));
        }
    }

    public ThresholdSettings defaults() {
        return defaults;
    }

    @Transactional(readOnly = true)
    public ThresholdSettings getEffective(Long sessionId) {
        return configRepository.findBySessionId(sessionId)
            .map(AdaptiveThresholdConfig::toSettings)
            .orElse(defaults);
    }

    /**
     * Applies a partial override on top of the current settings. Nothing is
     * written when the merged result breaks a rule.
     */
    @Transactional
    public ThresholdSettings update(Long sessionId, ThresholdConfigRequest request) {
        sessionService.require(sessionId);
        ThresholdSettings merged = request.applyTo(getEffective(sessionId));

        List<String> violations = merged.violations();
        if (!violations.isEmpty()) {
            log.warn("Rejected threshold override for session {}: {}", sessionId, violations);
            throw new InvalidThresholdConfigException(violations);
        }

        AdaptiveThresholdConfig config = configRepository.findBySessionId(sessionId)
            .orElseGet(() -> AdaptiveThresholdConfig.builder().sessionId(sessionId).build());
        config.apply(merged);
        configRepository.save(config);

        log.info("Threshold override stored for session {}: soft={}, hard={}, minSamples={}, epsilon={}m",
            sessionId, merged.softThreshold(), merged.hardThreshold(), merged.minSamplesForGate(),
            merged.clusterEpsilonMeters());
        return merged;
    }
}

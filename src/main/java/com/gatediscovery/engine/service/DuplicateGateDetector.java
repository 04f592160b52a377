package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.DuplicateScanResult;
import com.gatediscovery.engine.dto.MergeScore;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.dto.TrafficProfile;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;
import com.gatediscovery.engine.entity.MergeSuggestion;
import com.gatediscovery.engine.exception.BusinessException;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import com.gatediscovery.engine.repository.MergeSuggestionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds pairs of active gates that are probably one physical gate.
 *
 * Every pair closer than the duplicate distance is scored by
 * {@link MergeSimilarityScorer}. Pairs at or above the review threshold get a
 * PENDING suggestion (refreshed if one is already pending; decided suggestions
 * are left alone). With auto-apply enabled, pairs at or above the auto-apply
 * threshold are merged straight away.
 *
 * The surviving gate is the one with more samples, the lower id on a tie.
 *
 * Suggestion writes and each auto-merge commit separately, so one merge that
 * turns out stale does not undo the rest of the scan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuplicateGateDetector {

    private final GateRepository gateRepository;
    private final CheckinEventRepository checkinRepository;
    private final MergeSuggestionRepository suggestionRepository;
    private final MergeSimilarityScorer scorer;
    private final GateMergeService mergeService;

    public DuplicateScanResult detect(Long sessionId, ThresholdSettings settings) {
        List<Gate> gates = gateRepository.findBySessionIdAndStatusOrderByIdAsc(sessionId, GateStatus.ACTIVE).stream()
            .filter(Gate::hasLocation)
            .toList();
        if (gates.size() < 2) {
            return new DuplicateScanResult(0, 0, 0);
        }

        Map<Long, TrafficProfile> profiles = loadProfiles(sessionId, gates.stream().map(Gate::getId).toList());

        int compared = 0;
        int emitted = 0;
        List<Long> autoApply = new ArrayList<>();
        for (int i = 0; i < gates.size(); i++) {
            for (int j = i + 1; j < gates.size(); j++) {
                Gate a = gates.get(i);
                Gate b = gates.get(j);
                double distance = a.distanceTo(b.getLatitude(), b.getLongitude());
                if (distance >= settings.duplicateDistanceMeters()) {
                    continue;
                }
                compared++;

                MergeScore score = scorer.score(distance, settings.duplicateDistanceMeters(),
                    profiles.getOrDefault(a.getId(), TrafficProfile.EMPTY),
                    profiles.getOrDefault(b.getId(), TrafficProfile.EMPTY));
                if (score.confidence() < settings.mergeReviewThreshold()) {
                    continue;
                }

                Gate target = survivorOf(a, b);
                Gate source = target == a ? b : a;
                Optional<MergeSuggestion> suggestion = upsert(sessionId, source, target, score);
                if (suggestion.isEmpty()) {
                    continue;
                }
                emitted++;
                if (settings.autoApplyMerges() && score.confidence() >= settings.mergeAutoApplyThreshold()) {
                    autoApply.add(suggestion.get().getId());
                }
            }
        }

        int merges = 0;
        for (Long suggestionId : autoApply) {
            try {
                mergeService.autoApply(suggestionId);
                merges++;
            } catch (BusinessException e) {
                // An earlier auto-merge in this scan already retired one of the gates
                log.warn("Auto-merge of suggestion {} skipped: {}", suggestionId, e.getMessage());
            }
        }

        log.info("Duplicate scan for session {}: {} close pairs, {} suggestions, {} auto-merged",
            sessionId, compared, emitted, merges);
        return new DuplicateScanResult(compared, emitted, merges);
    }

    static Gate survivorOf(Gate a, Gate b) {
        if (a.getSampleCount() != b.getSampleCount()) {
            return a.getSampleCount() > b.getSampleCount() ? a : b;
        }
        return a.getId() < b.getId() ? a : b;
    }

    private Optional<MergeSuggestion> upsert(Long sessionId, Gate source, Gate target, MergeScore score) {
        Optional<MergeSuggestion> existing = suggestionRepository.findFirstForPair(sessionId, source.getId(), target.getId());
        if (existing.isPresent() && !existing.get().isPending()) {
            return Optional.empty();
        }
        MergeSuggestion suggestion = existing.orElseGet(() -> MergeSuggestion.builder().sessionId(sessionId).build());
        suggestion.setSourceGateId(source.getId());
        suggestion.setTargetGateId(target.getId());
        suggestion.setDistanceMeters(score.distanceMeters());
        suggestion.setTrafficSimilarity(score.trafficSimilarity());
        suggestion.setConfidence(score.confidence());
        suggestion.setReasoning(String.format("Merge %s into %s: %s",
            source.getName(), target.getName(), score.describe()));
        MergeSuggestion saved = suggestionRepository.save(suggestion);
        log.debug("Merge suggestion {} for gates {} -> {} at confidence {}",
            saved.getId(), source.getId(), target.getId(), String.format("%.3f", score.confidence()));
        return Optional.of(saved);
    }

    private Map<Long, TrafficProfile> loadProfiles(Long sessionId, List<Long> gateIds) {
        Map<Long, Map<Long, Long>> hourly = new HashMap<>();
        for (Object[] row : checkinRepository.countByGateAndHour(sessionId, gateIds)) {
            hourly.computeIfAbsent(((Number) row[0]).longValue(), k -> new HashMap<>())
                .put(((Number) row[1]).longValue(), ((Number) row[2]).longValue());
        }
        Map<Long, Map<String, Long>> categories = new HashMap<>();
        for (Object[] row : checkinRepository.countByGateAndCategory(sessionId, gateIds)) {
            categories.computeIfAbsent(((Number) row[0]).longValue(), k -> new HashMap<>())
                .put((String) row[1], ((Number) row[2]).longValue());
        }

        Map<Long, TrafficProfile> profiles = new HashMap<>();
        for (Long gateId : gateIds) {
            profiles.put(gateId, new TrafficProfile(
                hourly.getOrDefault(gateId, Map.of()),
                categories.getOrDefault(gateId, Map.of())));
        }
        return profiles;
    }
}

package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.MergeOutcome;
import com.gatediscovery.engine.dto.MergeReviewRequest;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.CategoryBinding;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.MergeStatus;
import com.gatediscovery.engine.entity.MergeSuggestion;
import com.gatediscovery.engine.exception.GateNotFoundException;
import com.gatediscovery.engine.exception.MergeSuggestionNotFoundException;
import com.gatediscovery.engine.exception.StaleMergeStateException;
import com.gatediscovery.engine.repository.CategoryBindingRepository;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import com.gatediscovery.engine.repository.GateRepository;
import com.gatediscovery.engine.repository.MergeSuggestionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Folds one gate into another, and records the review decision on merge suggestions.
 *
 * A merge is one transaction:
 * 1. Both gates must still be active, and a suggestion being applied must still be pending
 * 2. Check-ins of the source are re-pointed to the target
 * 3. Source bindings are added into the target's binding for the same category,
 *    or moved over when the target has none (the target's status always wins)
 * 4. Target centroid, variance and sample count are recombined, health recomputed
 * 5. The source becomes INACTIVE with {@code mergedIntoGateId} set
 * 6. Other pending suggestions naming the source are rejected as superseded
 *
 * If any step fails nothing is applied: no check-in or binding is left pointing
 * at a half-merged gate. Both gate rows stay locked until commit, so ingestion
 * cannot store a check-in on the source while it is being retired.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GateMergeService {

    static final String SYSTEM_REVIEWER = "system";

    private final GateRepository gateRepository;
    private final CheckinEventRepository checkinRepository;
    private final CategoryBindingRepository bindingRepository;
    private final MergeSuggestionRepository suggestionRepository;
    private final GateHealthCalculator healthCalculator;
    private final CategoryBindingLearner learner;
    private final ThresholdConfigService thresholdConfigService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public MergeSuggestion requireSuggestion(Long suggestionId) {
        return suggestionRepository.findById(suggestionId)
            .orElseThrow(() -> new MergeSuggestionNotFoundException(suggestionId));
    }

    @Transactional(readOnly = true)
    public List<MergeSuggestion> listSuggestions(Long sessionId, MergeStatus status) {
        return status == null
            ? suggestionRepository.findBySessionIdOrderByConfidenceDesc(sessionId)
            : suggestionRepository.findBySessionIdAndStatusOrderByConfidenceDesc(sessionId, status);
    }

    @Transactional
    public MergeOutcome approve(Long suggestionId, MergeReviewRequest review) {
        MergeSuggestion suggestion = requirePending(suggestionId);
        MergeOutcome outcome = merge(suggestion.getSessionId(), suggestion.getSourceGateId(),
            suggestion.getTargetGateId(), suggestion.getId());
        suggestion.close(MergeStatus.APPROVED, review.reviewer(), review.reason(), Instant.now(clock));
        suggestionRepository.save(suggestion);
        return outcome;
    }

    @Transactional
    public MergeSuggestion reject(Long suggestionId, MergeReviewRequest review) {
        MergeSuggestion suggestion = requirePending(suggestionId);
        suggestion.close(MergeStatus.REJECTED, review.reviewer(), review.reason(), Instant.now(clock));
        log.info("Merge suggestion {} rejected by {}", suggestionId, review.reviewer());
        return suggestionRepository.save(suggestion);
    }

    @Transactional
    public MergeOutcome autoApply(Long suggestionId) {
        MergeSuggestion suggestion = requirePending(suggestionId);
        MergeOutcome outcome = merge(suggestion.getSessionId(), suggestion.getSourceGateId(),
            suggestion.getTargetGateId(), suggestion.getId());
        suggestion.close(MergeStatus.AUTO_APPLIED, SYSTEM_REVIEWER,
            String.format("confidence %.2f above auto-apply threshold", suggestion.getConfidence()),
            Instant.now(clock));
        suggestionRepository.save(suggestion);
        return outcome;
    }

    /**
     * Operator-initiated merge. A pending suggestion for the same pair is closed as approved.
     */
    @Transactional
    public MergeOutcome mergeGates(Long sessionId, Long sourceGateId, Long targetGateId, String reviewer,
                                   String reason) {
        Optional<MergeSuggestion> pairSuggestion = suggestionRepository
            .findFirstForPair(sessionId, sourceGateId, targetGateId)
            .filter(MergeSuggestion::isPending);
        MergeOutcome outcome = merge(sessionId, sourceGateId, targetGateId,
            pairSuggestion.map(MergeSuggestion::getId).orElse(null));
        pairSuggestion.ifPresent(s -> {
            s.close(MergeStatus.APPROVED, reviewer, reason, Instant.now(clock));
            suggestionRepository.save(s);
        });
        return outcome;
    }

    private MergeSuggestion requirePending(Long suggestionId) {
        MergeSuggestion suggestion = requireSuggestion(suggestionId);
        if (!suggestion.isPending()) {
            throw new StaleMergeStateException(
                "Merge suggestion " + suggestionId + " is already " + suggestion.getStatus());
        }
        return suggestion;
    }

    /**
     * Re-points check-ins stored against a gate that has since been merged away,
     * following merge chains to the surviving gate. Enforcement runs this before
     * learning, so no binding is started on a retired gate.
     */
    @Transactional
    public int repointRetiredGateCheckins(Long sessionId) {
        Map<Long, Long> mergedInto = new TreeMap<>();
        for (Gate retired : gateRepository.findBySessionIdAndMergedIntoGateIdIsNotNull(sessionId)) {
            mergedInto.put(retired.getId(), retired.getMergedIntoGateId());
        }
        if (mergedInto.isEmpty() || checkinRepository.countByGateIdIn(mergedInto.keySet()) == 0) {
            return 0;
        }
        int moved = 0;
        for (Long retiredId : mergedInto.keySet()) {
            moved += checkinRepository.repointGate(retiredId, survivorOf(retiredId, mergedInto));
        }
        if (moved > 0) {
            log.warn("Session {}: {} check-ins stored on merged gates were re-pointed to their survivors",
                sessionId, moved);
        }
        return moved;
    }

    static Long survivorOf(Long gateId, Map<Long, Long> mergedInto) {
        Long current = gateId;
        for (int hop = 0; hop < mergedInto.size() && mergedInto.containsKey(current); hop++) {
            current = mergedInto.get(current);
        }
        return current;
    }

    private Gate lockGate(Long sessionId, Long gateId) {
        return gateRepository.findByIdAndSessionIdForUpdate(gateId, sessionId)
            .orElseThrow(() -> new GateNotFoundException(sessionId, gateId));
    }

    private MergeOutcome merge(Long sessionId, Long sourceGateId, Long targetGateId, Long appliedSuggestionId) {
        if (sourceGateId.equals(targetGateId)) {
            throw new IllegalArgumentException("A gate cannot be merged into itself");
        }
        // lower id first so two merges over the same pair cannot deadlock
        Gate source;
        Gate target;
        if (sourceGateId < targetGateId) {
            source = lockGate(sessionId, sourceGateId);
            target = lockGate(sessionId, targetGateId);
        } else {
            target = lockGate(sessionId, targetGateId);
            source = lockGate(sessionId, sourceGateId);
        }
        if (!source.isActive()) {
            throw new StaleMergeStateException("Source gate " + sourceGateId + " is " + source.getStatus());
        }
        if (!target.isActive()) {
            throw new StaleMergeStateException("Target gate " + targetGateId + " is " + target.getStatus());
        }

        int checkinsMoved = checkinRepository.repointGate(sourceGateId, targetGateId);

        Map<String, CategoryBinding> targetBindings = bindingRepository.findByGateId(targetGateId).stream()
            .collect(Collectors.toMap(CategoryBinding::getCategory, Function.identity()));
        Set<String> categories = new TreeSet<>();
        int folded = 0;
        int moved = 0;
        for (CategoryBinding sourceBinding : bindingRepository.findByGateId(sourceGateId)) {
            categories.add(sourceBinding.getCategory());
            CategoryBinding targetBinding = targetBindings.get(sourceBinding.getCategory());
            if (targetBinding != null) {
                targetBinding.absorb(sourceBinding);
                bindingRepository.save(targetBinding);
                bindingRepository.delete(sourceBinding);
                folded++;
            } else {
                sourceBinding.setGateId(targetGateId);
                bindingRepository.save(sourceBinding);
                moved++;
            }
        }

        ThresholdSettings settings = thresholdConfigService.getEffective(sessionId);
        target.absorb(source);
        target.setHealthScore(healthCalculator.score(target, checkinRepository.countByGateId(targetGateId),
            settings.minEffectiveSamples()));
        gateRepository.save(target);

        source.retireInto(targetGateId);
        gateRepository.save(source);

        int superseded = 0;
        Instant now = Instant.now(clock);
        for (MergeSuggestion other : suggestionRepository.findPendingInvolving(sessionId, sourceGateId)) {
            if (other.getId().equals(appliedSuggestionId)) {
                continue;
            }
            other.close(MergeStatus.REJECTED, SYSTEM_REVIEWER,
                "superseded by merge of gate " + sourceGateId + " into " + targetGateId, now);
            suggestionRepository.save(other);
            superseded++;
        }

        learner.recalculate(sessionId, categories, settings);

        log.info("Gate {} merged into {}: {} check-ins moved, {} bindings folded, {} moved, {} suggestions superseded",
            sourceGateId, targetGateId, checkinsMoved, folded, moved, superseded);
        return new MergeOutcome(sourceGateId, targetGateId, checkinsMoved, folded, moved, superseded);
    }
}

package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.LearningBatchResult;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.BindingStatus;
import com.gatediscovery.engine.entity.CategoryBinding;
import com.gatediscovery.engine.entity.CheckinEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory view of a session's bindings while a batch of check-ins is learned.
 *
 * Per check-in at gate G with category C:
 * 1. If G has an enforced binding and C is not recognized at G, the strongest
 *    enforced binding of G records a violation (and may be demoted)
 * 2. Binding (G, C) is created on probation if missing, and counts the sample
 * 3. Confidence of every binding of C in the session is recomputed:
 *    share × n/(n + prior) × (1 − violation rate)
 * 4. (G, C) is promoted once confidence and sample count both reach their thresholds
 *
 * Everything touched is collected in {@link #dirty()} for the caller to save.
 */
@Slf4j
final class BindingEvidenceLedger {

    private static final Comparator<CategoryBinding> STRONGEST = Comparator
        .comparingDouble(CategoryBinding::getConfidence)
        .thenComparingInt(CategoryBinding::getSampleCount)
        .thenComparing(CategoryBinding::getCategory, Comparator.reverseOrder());

    private final Long sessionId;
    private final ThresholdSettings settings;
    private final GateDiscoveryProperties.Tuning tuning;
    private final Instant now;

    private final Map<Long, Map<String, CategoryBinding>> byGate = new HashMap<>();
    private final Map<String, List<CategoryBinding>> byCategory = new HashMap<>();
    private final Set<CategoryBinding> dirty = Collections.newSetFromMap(new IdentityHashMap<>());

    private int processed;
    private int violations;
    private int promotions;
    private int demotions;

    BindingEvidenceLedger(Long sessionId, Collection<CategoryBinding> bindings, ThresholdSettings settings,
                          GateDiscoveryProperties.Tuning tuning, Instant now) {
        this.sessionId = sessionId;
        this.settings = settings;
        this.tuning = tuning;
        this.now = now;
        bindings.forEach(this::index);
    }

    void learn(CheckinEvent event) {
        Long gateId = event.getGateId();
        String category = event.getCategory();
        Map<String, CategoryBinding> atGate = byGate.computeIfAbsent(gateId, k -> new HashMap<>());
        CategoryBinding own = atGate.get(category);

        boolean recognized = own != null && own.isRecognized(settings.softThreshold());
        if (!recognized) {
            strongestEnforced(atGate.values()).ifPresent(enforced -> recordViolation(enforced, event));
        }

        if (own == null) {
            own = CategoryBinding.start(sessionId, gateId, category);
            index(own);
        }
        own.recordSample();
        dirty.add(own);
        recompute(category);

        if (own.getStatus() == BindingStatus.PROBATION
            && own.getConfidence() >= settings.hardThreshold()
            && own.getSampleCount() >= settings.minEffectiveSamples()) {
            own.promote(now);
            promotions++;
            log.info("Binding promoted to ENFORCED: {}", own.toLogString());
        }
        processed++;
    }

    /**
     * Recomputes confidence of every binding of the category from current counts.
     */
    void recompute(String category) {
        List<CategoryBinding> bindings = byCategory.getOrDefault(category, List.of());
        long total = bindings.stream().mapToLong(CategoryBinding::getSampleCount).sum();
        for (CategoryBinding binding : bindings) {
            double value = confidence(binding.getSampleCount(), total, binding.violationRate(),
                tuning.getConfidencePriorSamples());
            if (value != binding.getConfidence()) {
                binding.updateConfidence(value);
                dirty.add(binding);
            }
        }
    }

    static double confidence(int samples, long categoryTotal, double violationRate, double priorSamples) {
        if (samples <= 0 || categoryTotal <= 0) {
            return 0.0;
        }
        double share = (double) samples / categoryTotal;
        double evidence = samples / (samples + priorSamples);
        return share * evidence * (1.0 - violationRate);
    }

    private void recordViolation(CategoryBinding enforced, CheckinEvent event) {
        enforced.recordViolation(event.getTimestamp());
        violations++;
        dirty.add(enforced);
        log.debug("Violation at gate {}: category {} scanned where {} is enforced",
            event.getGateId(), event.getCategory(), enforced.getCategory());

        if (enforced.getViolationCount() >= tuning.getViolationDemotionCount()
            && enforced.violationRate() >= tuning.getViolationRateThreshold()) {
            BindingStatus landed = enforced.demote(tuning.getDemotionsBeforeUnbind());
            demotions++;
            log.info("Binding demoted to {} after sustained violations: {}", landed, enforced.toLogString());
        }
        recompute(enforced.getCategory());
    }

    private static Optional<CategoryBinding> strongestEnforced(Collection<CategoryBinding> bindings) {
        return bindings.stream().filter(CategoryBinding::isEnforced).max(STRONGEST);
    }

    private void index(CategoryBinding binding) {
        byGate.computeIfAbsent(binding.getGateId(), k -> new HashMap<>()).put(binding.getCategory(), binding);
        byCategory.computeIfAbsent(binding.getCategory(), k -> new ArrayList<>()).add(binding);
    }

    Collection<CategoryBinding> dirty() {
        return dirty;
    }

    Optional<CategoryBinding> binding(Long gateId, String category) {
        return Optional.ofNullable(byGate.getOrDefault(gateId, Map.of()).get(category));
    }

    LearningBatchResult result() {
        return new LearningBatchResult(processed, violations, promotions, demotions);
    }
}

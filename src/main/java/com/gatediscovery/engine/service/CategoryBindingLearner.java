package com.gatediscovery.engine.service;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import com.gatediscovery.engine.dto.LearningBatchResult;
import com.gatediscovery.engine.dto.ThresholdSettings;
import com.gatediscovery.engine.entity.CategoryBinding;
import com.gatediscovery.engine.entity.CheckinEvent;
import com.gatediscovery.engine.repository.CategoryBindingRepository;
import com.gatediscovery.engine.repository.CheckinEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Learns which ticket categories belong at which gate.
 *
 * Input is every successful check-in that has a gate and has not been learned
 * yet, oldest first, one bounded batch per call. The binding updates and the
 * events' {@code learned} flags commit in the same transaction, so a check-in
 * is counted exactly once even if a cycle dies half way and runs again.
 *
 * The arithmetic lives in {@link BindingEvidenceLedger}.
 */
@Service
@Slf4j
public class CategoryBindingLearner {

    private final CheckinEventRepository checkinRepository;
    private final CategoryBindingRepository bindingRepository;
    private final GateDiscoveryProperties.Tuning tuning;
    private final int batchSize;
    private final Clock clock;

    public CategoryBindingLearner(CheckinEventRepository checkinRepository,
                                  CategoryBindingRepository bindingRepository,
                                  GateDiscoveryProperties properties,
                                  Clock clock) {
        this.checkinRepository = checkinRepository;
        this.bindingRepository = bindingRepository;
        this.tuning = properties.getTuning();
        this.batchSize = properties.getWork().getLearnerBatchSize();
        this.clock = clock;
    }

    public int batchSize() {
        return batchSize;
    }

    @Transactional
    public LearningBatchResult learnBatch(Long sessionId, ThresholdSettings settings) {
        List<CheckinEvent> events = checkinRepository.findUnlearned(sessionId, PageRequest.of(0, batchSize));
        if (events.isEmpty()) {
            return LearningBatchResult.empty();
        }

        BindingEvidenceLedger ledger = new BindingEvidenceLedger(sessionId,
            bindingRepository.findBySessionId(sessionId), settings, tuning, Instant.now(clock));
        events.forEach(ledger::learn);

        bindingRepository.saveAll(ledger.dirty());
        checkinRepository.markLearned(events.stream().map(CheckinEvent::getId).toList());

        LearningBatchResult result = ledger.result();
        log.debug("Learned {} check-ins for session {}: {} violations, {} promotions, {} demotions",
            result.processed(), sessionId, result.violations(), result.promotions(), result.demotions());
        return result;
    }

    /**
     * Brings confidences in line with the current counts, e.g. after a merge
     * folded two gates' evidence together. Statuses are left to the next batch.
     */
    @Transactional
    public void recalculate(Long sessionId, Collection<String> categories, ThresholdSettings settings) {
        if (categories.isEmpty()) {
            return;
        }
        List<CategoryBinding> bindings = bindingRepository.findBySessionId(sessionId);
        BindingEvidenceLedger ledger = new BindingEvidenceLedger(sessionId, bindings, settings, tuning,
            Instant.now(clock));
        categories.forEach(ledger::recompute);
        bindingRepository.saveAll(ledger.dirty());
    }
}

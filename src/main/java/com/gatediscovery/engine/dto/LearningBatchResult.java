package com.gatediscovery.engine.dto;

public record LearningBatchResult(int processed, int violations, int promotions, int demotions) {

    public static LearningBatchResult empty() {
        return new LearningBatchResult(0, 0, 0, 0);
    }

    public LearningBatchResult plus(LearningBatchResult other) {
        return new LearningBatchResult(
            processed + other.processed,
            violations + other.violations,
            promotions + other.promotions,
            demotions + other.demotions
        );
    }
}

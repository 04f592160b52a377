package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.BindingStatus;
import com.gatediscovery.engine.entity.CategoryBinding;

import java.time.Instant;

public record BindingView(
    String category,
    BindingStatus status,
    double confidence,
    int sampleCount,
    int violationCount,
    Instant lastViolationAt,
    int demotionCount,
    Instant enforcedAt
) {

    public static BindingView from(CategoryBinding binding) {
        return new BindingView(
            binding.getCategory(),
            binding.getStatus(),
            binding.getConfidence(),
            binding.getSampleCount(),
            binding.getViolationCount(),
            binding.getLastViolationAt(),
            binding.getDemotionCount(),
            binding.getEnforcedAt()
        );
    }
}

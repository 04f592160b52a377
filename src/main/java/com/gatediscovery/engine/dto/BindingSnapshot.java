package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.BindingStatus;
import com.gatediscovery.engine.entity.CategoryBinding;

public record BindingSnapshot(String category, BindingStatus status, double confidence, int sampleCount) {

    public static BindingSnapshot from(CategoryBinding binding) {
        return new BindingSnapshot(binding.getCategory(), binding.getStatus(), binding.getConfidence(),
            binding.getSampleCount());
    }
}

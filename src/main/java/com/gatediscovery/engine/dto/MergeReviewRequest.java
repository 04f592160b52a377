package com.gatediscovery.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MergeReviewRequest(
    @NotBlank(message = "Reviewer cannot be blank")
    @Size(max = 100)
    String reviewer,

    @Size(max = 500)
    String reason
) {
}

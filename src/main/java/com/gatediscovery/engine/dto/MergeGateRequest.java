package com.gatediscovery.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Operator request to fold the path gate into {@code targetGateId}.
 */
public record MergeGateRequest(
    @NotNull(message = "Target gate ID is required")
    Long targetGateId,

    @NotBlank(message = "Reviewer cannot be blank")
    @Size(max = 100)
    String reviewer,

    @Size(max = 500)
    String reason
) {
}

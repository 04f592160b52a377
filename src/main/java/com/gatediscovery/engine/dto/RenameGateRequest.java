package com.gatediscovery.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RenameGateRequest(
    @NotBlank(message = "Gate name cannot be blank")
    @Size(max = 200)
    String name
) {
}

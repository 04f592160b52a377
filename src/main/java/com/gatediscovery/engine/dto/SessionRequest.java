package com.gatediscovery.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SessionRequest(
    @NotBlank(message = "Session name cannot be blank")
    @Size(max = 200)
    String name
) {
}

package com.gatediscovery.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * STOMP payload for {@code /app/validate}.
 */
public record ValidationStreamMessage(
    @NotNull Long sessionId,
    @NotNull @Valid ValidationRequest validation
) {
}

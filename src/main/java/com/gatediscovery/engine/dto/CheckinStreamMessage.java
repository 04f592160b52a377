package com.gatediscovery.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * STOMP payload for {@code /app/checkin}.
 */
public record CheckinStreamMessage(
    @NotNull Long sessionId,
    @NotNull @Valid CheckinRequest checkin
) {
}

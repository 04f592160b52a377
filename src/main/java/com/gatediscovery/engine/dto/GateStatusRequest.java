package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.GateStatus;
import jakarta.validation.constraints.NotNull;

public record GateStatusRequest(@NotNull(message = "Status is required") GateStatus status) {
}

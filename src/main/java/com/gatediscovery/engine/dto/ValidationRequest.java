package com.gatediscovery.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ValidationRequest(
    @NotNull(message = "Gate ID is required")
    Long gateId,

    @NotBlank(message = "Category cannot be blank")
    String category,

    Double latitude,

    Double longitude,

    Double accuracy
) {

    public ValidationRequest {
        if (category != null) {
            category = category.trim();
        }
    }

    public static ValidationRequest of(Long gateId, CheckinRequest checkin) {
        return new ValidationRequest(gateId, checkin.category(), checkin.latitude(), checkin.longitude(),
            checkin.accuracy());
    }
}

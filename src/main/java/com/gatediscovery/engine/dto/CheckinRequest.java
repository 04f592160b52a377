package com.gatediscovery.engine.dto;

import com.gatediscovery.engine.entity.CheckinOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * A wristband scan as reported by a scanner.
 *
 * Location fields are unconstrained. A missing, out-of-range or
 * null-island location is still a valid check-in. It is stored with quality
 * weight 0 and simply never used for clustering.
 *
 * @param gateId        gate the scanner is configured for, if it knows one
 * @param accuracy      reported GPS accuracy radius in meters
 * @param clientEventId scanner-generated id; a repeated id returns the stored event
 */
public record CheckinRequest(
    @NotBlank(message = "Wristband ID cannot be blank")
    @Size(max = 100)
    String wristbandId,

    @NotBlank(message = "Category cannot be blank")
    @Size(max = 50)
    String category,

    @NotNull(message = "Timestamp is required")
    Instant timestamp,

    Double latitude,

    Double longitude,

    Double accuracy,

    Long gateId,

    CheckinOutcome outcome,

    @Size(max = 100)
    String clientEventId
) {

    public CheckinRequest {
        if (category != null) {
            category = category.trim();
        }
        if (outcome == null) {
            outcome = CheckinOutcome.SUCCESS;
        }
        // One minute of tolerance for scanner clock skew
        if (timestamp != null && timestamp.isAfter(Instant.now().plusSeconds(60))) {
            throw new IllegalArgumentException("Check-in timestamp cannot be in the future");
        }
    }

    public CheckinRequest withOutcome(CheckinOutcome newOutcome) {
        return new CheckinRequest(wristbandId, category, timestamp, latitude, longitude, accuracy,
            gateId, newOutcome, clientEventId);
    }

    public String toLogString() {
        return String.format("Checkin[wristband=%s, category=%s, gate=%s, lat=%s, lon=%s, acc=%s]",
            wristbandId, category, gateId, latitude, longitude, accuracy);
    }
}

package com.gatediscovery.engine.dto;

import java.util.Map;

/**
 * Check-in counts of one gate by hour bucket and by category.
 */
public record TrafficProfile(Map<Long, Long> hourly, Map<String, Long> categories) {

    public static final TrafficProfile EMPTY = new TrafficProfile(Map.of(), Map.of());

    public TrafficProfile {
        hourly = Map.copyOf(hourly);
        categories = Map.copyOf(categories);
    }
}

package com.gatediscovery.engine.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A dense group of scans that becomes, or reinforces, one gate.
 *
 * @param memberIds       check-in ids in ascending order
 * @param spatialVariance mean squared haversine distance of members to the centroid (m²)
 * @param categoryCounts  scans per category, sorted by category
 */
public record GateCluster(
    List<Long> memberIds,
    double latitude,
    double longitude,
    double spatialVariance,
    Instant firstSeen,
    Instant lastSeen,
    Map<String, Integer> categoryCounts
) {

    public GateCluster {
        memberIds = List.copyOf(memberIds);
        categoryCounts = Map.copyOf(categoryCounts);
    }

    public int size() {
        return memberIds.size();
    }

    public Long lowestMemberId() {
        return memberIds.get(0);
    }
}

package com.gatediscovery.engine.dto;

import lombok.Builder;

/**
 * Outcome of one background cycle. Counters irrelevant to the cycle type stay 0.
 */
@Builder
public record CycleReport(
    Long sessionId,
    CycleType cycle,
    CycleStatus status,
    int clustersFound,
    int gatesCreated,
    int gatesUpdated,
    int orphansExamined,
    int orphansAssigned,
    int eventsLearned,
    int violations,
    int promotions,
    int demotions,
    int suggestionsEmitted,
    int mergesApplied,
    long durationMs
) {

    public static CycleReport skipped(Long sessionId, CycleType cycle, CycleStatus status) {
        return CycleReport.builder().sessionId(sessionId).cycle(cycle).status(status).build();
    }

    public String toLogString() {
        return switch (cycle) {
            case DISCOVERY -> String.format(
                "discovery[session=%d, status=%s, clusters=%d, created=%d, updated=%d, orphans=%d/%d, %dms]",
                sessionId, status, clustersFound, gatesCreated, gatesUpdated, orphansAssigned, orphansExamined,
                durationMs);
            case ENFORCEMENT -> String.format(
                "enforcement[session=%d, status=%s, learned=%d, violations=%d, promotions=%d, demotions=%d, %dms]",
                sessionId, status, eventsLearned, violations, promotions, demotions, durationMs);
            case DUPLICATES -> String.format(
                "duplicates[session=%d, status=%s, suggestions=%d, merges=%d, %dms]",
                sessionId, status, suggestionsEmitted, mergesApplied, durationMs);
        };
    }
}

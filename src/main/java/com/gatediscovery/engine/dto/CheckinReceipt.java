package com.gatediscovery.engine.dto;

/**
 * @param duplicate true when the client event id was seen before and nothing new was stored
 */
public record CheckinReceipt(
    Long eventId,
    Long sessionId,
    Long gateId,
    double qualityWeight,
    boolean clusteringEligible,
    boolean duplicate
) {
}

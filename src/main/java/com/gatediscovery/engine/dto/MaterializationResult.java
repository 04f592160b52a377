package com.gatediscovery.engine.dto;

import java.util.List;

/**
 * @param conflictsResolved inserts that lost a unique-key race and updated the winner instead
 */
public record MaterializationResult(int created, int updated, int conflictsResolved, List<Long> gateIds) {
}

package com.gatediscovery.engine.dto;

/**
 * @param nextCursor id the next walk resumes after; 0 once the walk reached the last orphan
 * @param stopped true when the session was deactivated before the window was exhausted
 */
public record OrphanAssignmentResult(int examined, int assigned, long nextCursor, boolean stopped) {
}

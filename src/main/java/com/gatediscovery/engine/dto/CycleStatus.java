package com.gatediscovery.engine.dto;

public enum CycleStatus {
    COMPLETED,
    /** Another cycle held the session lock. */
    SKIPPED_BUSY,
    SKIPPED_INACTIVE,
    /** The session was deactivated while the cycle ran. */
    STOPPED
}

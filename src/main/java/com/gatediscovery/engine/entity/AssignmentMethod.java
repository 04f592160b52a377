package com.gatediscovery.engine.entity;

/**
 * Records which step last set a check-in's gate reference.
 */
public enum AssignmentMethod {
    /** Named by the scanner or resolved from its location when stored. */
    INGESTION,
    ORPHAN_BACKFILL,
    /** Re-pointed from a gate that was merged away. */
    MERGE
}

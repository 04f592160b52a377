package com.gatediscovery.engine.exception;

/**
 * The gates or the suggestion changed since the merge was proposed: a gate is no
 * longer active, or the suggestion was already decided.
 */
public class StaleMergeStateException extends BusinessException {

    public StaleMergeStateException(String detail) {
        super(ErrorCode.STALE_MERGE_STATE, detail);
    }
}

package com.gatediscovery.engine.entity;

public enum MergeStatus {
    PENDING,
    APPROVED,
    REJECTED,
    AUTO_APPLIED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

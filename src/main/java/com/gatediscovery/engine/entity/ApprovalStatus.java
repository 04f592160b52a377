package com.gatediscovery.engine.entity;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}

package com.gatediscovery.engine.entity;

public enum GateStatus {
    ACTIVE,
    INACTIVE,
    MAINTENANCE
}

package com.gatediscovery.engine.dto;

public enum CycleType {
    DISCOVERY,
    ENFORCEMENT,
    DUPLICATES
}

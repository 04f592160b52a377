package com.gatediscovery.engine.entity;

public enum CheckinOutcome {
    SUCCESS,
    DENIED,
    ERROR
}

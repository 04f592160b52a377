package com.gatediscovery.engine.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidThresholdConfigException extends BusinessException {

    private final List<String> violations;

    public InvalidThresholdConfigException(List<String> violations) {
        super(ErrorCode.INVALID_THRESHOLD_CONFIG, String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}

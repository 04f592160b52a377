package com.gatediscovery.engine.exception;

public class GateNotFoundException extends BusinessException {

    public GateNotFoundException(Long sessionId, Long gateId) {
        super(ErrorCode.GATE_NOT_FOUND, "Gate " + gateId + " not found in session " + sessionId);
    }
}

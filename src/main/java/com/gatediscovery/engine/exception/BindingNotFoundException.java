package com.gatediscovery.engine.exception;

public class BindingNotFoundException extends BusinessException {

    public BindingNotFoundException(Long gateId, String category) {
        super(ErrorCode.BINDING_NOT_FOUND, "No binding for category " + category + " at gate " + gateId);
    }
}

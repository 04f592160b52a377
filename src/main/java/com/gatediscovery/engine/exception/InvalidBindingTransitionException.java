package com.gatediscovery.engine.exception;

public class InvalidBindingTransitionException extends BusinessException {

    public InvalidBindingTransitionException(String detail) {
        super(ErrorCode.INVALID_BINDING_TRANSITION, detail);
    }
}

package com.gatediscovery.engine.exception;

public class SessionInactiveException extends BusinessException {

    public SessionInactiveException(Long sessionId) {
        super(ErrorCode.SESSION_INACTIVE, "Venue session is inactive: " + sessionId);
    }
}
